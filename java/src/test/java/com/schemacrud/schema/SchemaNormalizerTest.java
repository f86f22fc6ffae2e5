package com.schemacrud.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemacrud.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.schemacrud.TestFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

class SchemaNormalizerTest {

    private final SchemaNormalizer normalizer = new SchemaNormalizer();

    private JsonNode field(String fieldJson) {
        var schema = json("""
            {"model": "users", "table": "users", "fields": {"f": %s}}
            """.formatted(fieldJson));
        return normalizer.normalize(schema).at("/fields/f");
    }

    private static List<String> texts(JsonNode array) {
        var out = new ArrayList<String>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }

    // -----------------------------------------------------------------------
    // Idempotence
    // -----------------------------------------------------------------------

    @Test
    void normalize_isIdempotent() {
        var raw = TestFixtures.loader("rbac").load("users", null);

        var once = normalizer.normalize(raw);
        var twice = normalizer.normalize(once);

        assertEquals(once, twice);
    }

    @Test
    void normalize_doesNotMutateInput() {
        var raw = json("""
            {"model": "users", "table": "users", "fields": {"f": {"type": "boolean-tgl"}}}
            """);
        var copy = raw.deepCopy();

        normalizer.normalize(raw);

        assertEquals(copy, raw);
    }

    // -----------------------------------------------------------------------
    // Top-level defaults
    // -----------------------------------------------------------------------

    @Test
    void defaults_filledWhenAbsent() {
        var schema = normalizer.normalize(json("""
            {"model": "users", "table": "users", "fields": {"f": {}}}
            """));

        assertEquals("id", schema.get("primary_key").asText());
        assertTrue(schema.get("timestamps").asBoolean());
        assertFalse(schema.get("soft_delete").asBoolean());
    }

    @Test
    void defaults_neverOverwriteExplicitValues() {
        var schema = normalizer.normalize(json("""
            {"model": "users", "table": "users", "primary_key": "uuid", "timestamps": false,
             "soft_delete": true, "fields": {"f": {}}}
            """));

        assertEquals("uuid", schema.get("primary_key").asText());
        assertFalse(schema.get("timestamps").asBoolean());
        assertTrue(schema.get("soft_delete").asBoolean());
    }

    @Test
    void legacyDetail_foldedIntoDetails() {
        var schema = normalizer.normalize(json("""
            {"model": "users", "table": "users", "fields": {"f": {}},
             "detail": {"model": "activities", "foreign_key": "user_id"}}
            """));

        assertFalse(schema.has("detail"));
        assertEquals("activities", schema.at("/details/0/model").asText());
    }

    // -----------------------------------------------------------------------
    // Legacy booleans
    // -----------------------------------------------------------------------

    @Test
    void booleanTgl_becomesToggle() {
        var f = field("{\"type\": \"boolean-tgl\"}");
        assertEquals("boolean", f.get("type").asText());
        assertEquals("toggle", f.get("ui").asText());
    }

    @Test
    void booleanChk_becomesCheckbox() {
        var f = field("{\"type\": \"boolean-chk\"}");
        assertEquals("boolean", f.get("type").asText());
        assertEquals("checkbox", f.get("ui").asText());
    }

    @Test
    void plainBoolean_defaultsToCheckbox() {
        assertEquals("checkbox", field("{\"type\": \"boolean\"}").get("ui").asText());
    }

    @Test
    void booleanYnAndSel_becomeSelect() {
        assertEquals("select", field("{\"type\": \"boolean-yn\"}").get("ui").asText());
        assertEquals("select", field("{\"type\": \"boolean-sel\"}").get("ui").asText());
    }

    @Test
    void legacyBoolean_keepsExplicitUi() {
        var f = field("{\"type\": \"boolean-tgl\", \"ui\": \"switch\"}");
        assertEquals("boolean", f.get("type").asText());
        assertEquals("switch", f.get("ui").asText());
    }

    // -----------------------------------------------------------------------
    // ORM attributes
    // -----------------------------------------------------------------------

    @Test
    void nullable_derivesRequired() {
        var f = field("{\"nullable\": false}");
        assertTrue(f.get("required").asBoolean());
    }

    @Test
    void required_derivesNullable() {
        var f = field("{\"required\": true}");
        assertFalse(f.get("nullable").asBoolean());
    }

    @Test
    void camelCaseAliases_renamed() {
        var f = field("{\"autoIncrement\": true, \"defaultValue\": 3, \"validate\": {\"email\": true}}");

        assertTrue(f.get("auto_increment").asBoolean());
        assertEquals(3, f.get("default").asInt());
        assertTrue(f.at("/validation/email").asBoolean());
        assertFalse(f.has("autoIncrement"));
        assertFalse(f.has("validate"));
    }

    @Test
    void uniqueAndLength_movedIntoValidation() {
        var f = field("{\"unique\": true, \"length\": 50}");

        assertTrue(f.at("/validation/unique").asBoolean());
        assertEquals(50, f.at("/validation/length/max").asInt());
    }

    @Test
    void references_becomeSmartlookup() {
        var f = field("{\"type\": \"integer\", \"references\": {\"table\": \"groups\", \"key\": \"id\", \"display\": \"name\"}}");

        assertEquals("smartlookup", f.get("type").asText());
        assertEquals("groups", f.get("lookup_model").asText());
        assertEquals("id", f.get("lookup_id").asText());
        assertEquals("name", f.get("lookup_desc").asText());
    }

    @Test
    void uiObject_flattened() {
        var f = field("{\"type\": \"string\", \"ui\": {\"label\": \"Name\", \"show_in\": [\"list\"], \"sortable\": true, \"widget\": \"text\"}}");

        assertEquals("Name", f.get("label").asText());
        assertEquals("text", f.get("ui").asText());
        assertTrue(f.get("sortable").asBoolean());
        assertTrue(f.get("listable").asBoolean());
    }

    @Test
    void missingType_becomesString() {
        assertEquals("string", field("{}").get("type").asText());
    }

    // -----------------------------------------------------------------------
    // Smartlookup
    // -----------------------------------------------------------------------

    @Test
    void lookupObject_flattened() {
        var f = field("{\"type\": \"smartlookup\", \"lookup\": {\"model\": \"groups\", \"id\": \"id\", \"desc\": \"name\"}}");

        assertEquals("groups", f.get("lookup_model").asText());
        assertEquals("name", f.get("lookup_desc").asText());
    }

    @Test
    void lookupShorthand_used() {
        var f = field("{\"type\": \"smartlookup\", \"model\": \"groups\", \"id\": \"id\", \"desc\": \"slug\"}");

        assertEquals("groups", f.get("lookup_model").asText());
        assertEquals("slug", f.get("lookup_desc").asText());
    }

    @Test
    void explicitLookupAttributes_kept() {
        var f = field("{\"type\": \"smartlookup\", \"lookup_desc\": \"slug\", \"lookup\": {\"model\": \"groups\", \"desc\": \"name\"}}");

        assertEquals("slug", f.get("lookup_desc").asText());
    }

    // -----------------------------------------------------------------------
    // Visibility
    // -----------------------------------------------------------------------

    @Test
    void listable_isOptIn() {
        var f = field("{\"type\": \"string\"}");

        assertFalse(f.get("listable").asBoolean());
        assertEquals(List.of("create", "edit", "detail"), texts(f.get("show_in")));
    }

    @Test
    void listableTrue_addsListContext() {
        var f = field("{\"listable\": true}");

        assertTrue(f.get("listable").asBoolean());
        assertEquals(List.of("list", "create", "edit", "detail"), texts(f.get("show_in")));
    }

    @Test
    void showInList_makesListable() {
        var f = field("{\"show_in\": [\"list\", \"detail\"]}");

        assertTrue(f.get("listable").asBoolean());
        assertFalse(f.get("editable").asBoolean());
        assertTrue(f.get("viewable").asBoolean());
    }

    @Test
    void formContext_expands() {
        var f = field("{\"show_in\": [\"form\", \"edit\"]}");

        assertEquals(List.of("create", "edit"), texts(f.get("show_in")));
        assertTrue(f.get("editable").asBoolean());
    }

    @Test
    void explicitFlags_notOverwrittenByShowIn() {
        var f = field("{\"show_in\": [\"list\"], \"editable\": true, \"viewable\": true}");

        assertTrue(f.get("editable").asBoolean());
        assertTrue(f.get("viewable").asBoolean());
    }

    @Test
    void notEditable_leavesForms() {
        var f = field("{\"editable\": false, \"listable\": true}");

        assertEquals(List.of("list", "detail"), texts(f.get("show_in")));
    }

    @Test
    void password_neverInListOrDetail() {
        var f = field("{\"type\": \"password\", \"show_in\": [\"list\", \"form\", \"detail\"], \"listable\": true}");

        assertEquals(List.of("create", "edit"), texts(f.get("show_in")));
        assertFalse(f.get("listable").asBoolean());
    }

    @Test
    void password_withoutShowIn() {
        var f = field("{\"type\": \"password\"}");

        assertEquals(List.of("create", "edit"), texts(f.get("show_in")));
        assertFalse(f.get("listable").asBoolean());
    }

    @Test
    void sortableAndFilterable_explicitBooleans() {
        var f = field("{\"sortable\": \"true\"}");

        assertTrue(f.get("sortable").isBoolean());
        assertTrue(f.get("sortable").asBoolean());
        assertTrue(f.get("filterable").isBoolean());
        assertFalse(f.get("filterable").asBoolean());
    }

    // -----------------------------------------------------------------------
    // Actions
    // -----------------------------------------------------------------------

    @Test
    void actionScopeString_becomesList() {
        var schema = normalizer.normalize(json("""
            {"model": "users", "table": "users", "fields": {"f": {}},
             "actions": [{"key": "export", "scope": "list"}, {"key": "toggle", "scope": ["detail"]}]}
            """));

        assertEquals(List.of("list"), texts(schema.at("/actions/0/scope")));
        assertEquals(List.of("detail"), texts(schema.at("/actions/1/scope")));
    }
}
