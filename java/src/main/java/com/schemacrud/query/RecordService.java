package com.schemacrud.query;

import com.schemacrud.error.RecordNotFoundException;
import com.schemacrud.metadata.ModelBinding;
import com.schemacrud.relation.RelationshipResolver;
import com.schemacrud.schema.SchemaService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.schemacrud.query.SqlIdentifiers.column;
import static com.schemacrud.query.SqlIdentifiers.quote;

/**
 * Read side of the engine: listings of a model and of the records related
 * to one of its rows.
 */
@Service
public class RecordService {

    private final SchemaService schemas;
    private final RelationshipResolver resolver;
    private final ListingEngine engine;
    private final RecordStore store;

    public RecordService(
        SchemaService schemas,
        RelationshipResolver resolver,
        ListingEngine engine,
        RecordStore store
    ) {
        this.schemas = schemas;
        this.resolver = resolver;
        this.engine = engine;
        this.store = store;
    }

    public ListingResult listRecords(String model, ListingRequest request) {
        return engine.list(schemas.getBinding(model), request);
    }

    /**
     * Related records of one parent row, e.g. the permissions of user 1.
     *
     * @throws com.schemacrud.error.MissingRelationshipConfigException when the relation cannot be resolved
     * @throws RecordNotFoundException when the parent row does not exist
     */
    public ListingResult listRelatedRecords(String model, Object recordId, String relationName, ListingRequest request) {
        var parent = schemas.getSchema(model);
        var plan = resolver.resolve(parent, relationName);

        var parentBinding = ModelBinding.of(parent);
        var parentId = parentKey(parentBinding, recordId);
        if (!exists(parentBinding, parentId)) {
            throw new RecordNotFoundException(model, recordId);
        }

        var related = ModelBinding.of(plan.related()).restrictListable(plan.listFields());
        return engine.list(related, request, ListingQuery.relationScope(plan, parentId));
    }

    /** The record id converted to the primary key's type; ids that cannot be converted match no row. */
    private static Object parentKey(ModelBinding binding, Object recordId) {
        if (recordId == null) throw new RecordNotFoundException(binding.model(), null);
        if (!(recordId instanceof String text)) return recordId;
        return binding.fieldType(binding.primaryKey()).coerce(text)
            .orElseThrow(() -> new RecordNotFoundException(binding.model(), recordId));
    }

    private boolean exists(ModelBinding binding, Object id) {
        var conditions = new ArrayList<String>();
        conditions.add(column(ListingQuery.ALIAS, binding.primaryKey()) + " = ?");
        binding.softDelete().ifPresent(col -> conditions.add(column(ListingQuery.ALIAS, col) + " IS NULL"));
        var sql = "SELECT COUNT(*) FROM " + quote(binding.table()) + " " + quote(ListingQuery.ALIAS)
            + " WHERE " + String.join(" AND ", conditions);
        return store.count(new SqlStatement(sql, List.of(id))) > 0;
    }
}
