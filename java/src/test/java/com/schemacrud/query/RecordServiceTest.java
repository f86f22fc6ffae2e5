package com.schemacrud.query;

import com.schemacrud.TestFixtures;
import com.schemacrud.error.MissingRelationshipConfigException;
import com.schemacrud.error.RecordNotFoundException;
import com.schemacrud.error.SchemaNotFoundException;
import com.schemacrud.relation.RelationshipResolver;
import com.schemacrud.schema.SchemaService;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordServiceTest {

    private static EmbeddedDatabase db;
    private static RecordService records;

    @BeforeAll
    static void setUp() {
        db = TestFixtures.rbacDatabase();
        SchemaService schemas = TestFixtures.schemaService("rbac");
        var store = new JdbcRecordStore(new JdbcTemplate(db));
        records = new RecordService(
            schemas,
            new RelationshipResolver(schemas, 2),
            new ListingEngine(store, 25, 100),
            store);
    }

    @AfterAll
    static void tearDown() {
        db.shutdown();
    }

    private static List<Object> column(ListingResult result, String field) {
        return result.rows().stream().map(row -> row.get(field)).toList();
    }

    // -----------------------------------------------------------------------
    // Model listings
    // -----------------------------------------------------------------------

    @Test
    void listRecords_usesSchemaBinding() {
        var result = records.listRecords("roles", ListingRequest.firstPage());

        assertEquals(3, result.count());
        assertEquals(List.of(1, 2, 3), column(result, "id"));
    }

    @Test
    void listRecords_unknownModel() {
        assertThrows(SchemaNotFoundException.class,
            () -> records.listRecords("nope", ListingRequest.firstPage()));
    }

    // -----------------------------------------------------------------------
    // Related listings
    // -----------------------------------------------------------------------

    @Test
    void related_throughTwoPivots() {
        var result = records.listRelatedRecords("users", 1, "permissions", ListingRequest.firstPage());

        assertEquals(5, result.count());
        assertEquals(List.of("uri_users", "create_user", "update_user_field", "delete_user", "uri_roles"),
            column(result, "slug"));
    }

    @Test
    void related_throughTwoPivotsAreScopedToParent() {
        var alice = records.listRelatedRecords("users", "2", "permissions", ListingRequest.firstPage());
        var dave = records.listRelatedRecords("users", "5", "permissions", ListingRequest.firstPage());

        assertEquals(List.of("uri_users", "update_user_field"), column(alice, "slug"));
        assertEquals(0, dave.count());
        assertTrue(dave.rows().isEmpty());
    }

    @Test
    void related_manyToManyWithListFields() {
        var result = records.listRelatedRecords("users", 1, "roles", ListingRequest.firstPage());

        assertEquals(2, result.count());
        assertEquals(List.of("slug", "name"), List.copyOf(result.rows().get(0).keySet()));
        assertEquals(List.of("site-admin", "user"), column(result, "slug"));
    }

    @Test
    void related_hasManyDirect() {
        var result = records.listRelatedRecords("users", 1, "activities", ListingRequest.firstPage());

        assertEquals(3, result.count());
        assertEquals(List.of("type", "description", "occurred_at"), List.copyOf(result.rows().get(0).keySet()));
    }

    @Test
    void related_detailForeignKeySkipsSoftDeleted() {
        var zerg = records.listRelatedRecords("groups", 2, "users", ListingRequest.firstPage());

        assertEquals(List.of("bob", "dave"), column(zerg, "user_name"));
        assertEquals(List.of("user_name", "email"), List.copyOf(zerg.rows().get(0).keySet()));
    }

    @Test
    void related_filtersApplyWithinScope() {
        var result = records.listRelatedRecords("groups", 1, "users",
            ListingRequest.firstPage().withFilter("user_name", "a"));

        assertEquals(3, result.count());
        assertEquals(2, result.countFiltered());
        assertEquals(List.of("admin", "alice"), column(result, "user_name"));
    }

    @Test
    void related_missingParent() {
        var missing = assertThrows(RecordNotFoundException.class,
            () -> records.listRelatedRecords("users", 99, "roles", ListingRequest.firstPage()));
        assertEquals(99, missing.recordId());

        assertThrows(RecordNotFoundException.class,
            () -> records.listRelatedRecords("users", 4, "roles", ListingRequest.firstPage()),
            "soft-deleted parents are gone");
        assertThrows(RecordNotFoundException.class,
            () -> records.listRelatedRecords("users", "abc", "roles", ListingRequest.firstPage()));
        assertThrows(RecordNotFoundException.class,
            () -> records.listRelatedRecords("users", null, "roles", ListingRequest.firstPage()));
    }

    @Test
    void related_unknownRelation() {
        var missing = assertThrows(MissingRelationshipConfigException.class,
            () -> records.listRelatedRecords("groups", 1, "roles", ListingRequest.firstPage()));
        assertEquals("roles", missing.relation());
    }
}
