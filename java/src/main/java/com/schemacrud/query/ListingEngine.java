package com.schemacrud.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.schemacrud.metadata.FieldType;
import com.schemacrud.metadata.ModelBinding;
import com.schemacrud.metadata.SchemaJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs paginated listings: builds the {@link ListingQuery}, executes its
 * three statements and shapes the rows to the listable fields.
 */
@Component
public class ListingEngine {

    private static final Logger log = LoggerFactory.getLogger(ListingEngine.class);

    private final RecordStore store;
    private final int defaultSize;
    private final int maxSize;

    public ListingEngine(
        RecordStore store,
        @Value("${schemacrud.listing.default-size:25}") int defaultSize,
        @Value("${schemacrud.listing.max-size:100}") int maxSize
    ) {
        this.store = store;
        this.defaultSize = defaultSize;
        this.maxSize = maxSize;
    }

    public ListingResult list(ModelBinding binding, ListingRequest request) {
        return list(binding, request, null);
    }

    public ListingResult list(ModelBinding binding, ListingRequest request, SqlStatement scope) {
        var query = ListingQuery.build(binding, request, pageSize(request.size()), scope);
        if (!query.rejected().isEmpty()) {
            log.debug("Dropped unsupported listing parameters for '{}': {}", binding.model(), query.rejected());
        }

        var count = store.count(query.count());
        var countFiltered = store.count(query.countFiltered());
        var rows = store.query(query.rows()).stream()
            .map(row -> shape(binding, row))
            .toList();
        return new ListingResult(count, countFiltered, rows);
    }

    /** Requested size bounded to {@code [1, max]}; missing or non-positive sizes get the default. */
    int pageSize(Integer requested) {
        if (requested == null || requested < 1) return Math.min(defaultSize, maxSize);
        return Math.min(requested, maxSize);
    }

    /** Listable fields only, in schema order; JSON columns parsed and booleans normalized. */
    static Map<String, Object> shape(ModelBinding binding, Map<String, Object> row) {
        var out = new LinkedHashMap<String, Object>();
        List<String> listable = binding.listableFields();
        for (var field : listable) {
            out.put(field, convert(binding.fieldType(field), row.get(field)));
        }
        return out;
    }

    static Object convert(FieldType type, Object value) {
        if (value == null) return null;
        return switch (type.kind()) {
            case BOOLEAN -> toBoolean(value);
            case JSON -> value instanceof String text ? parseJson(text) : value;
            default -> value;
        };
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.intValue() != 0;
        return FieldType.BOOLEAN.coerce(value.toString()).orElse(value);
    }

    private static Object parseJson(String text) {
        try {
            return SchemaJson.mapper().readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Column value is not valid JSON, returning it as text: {}", e.getOriginalMessage());
            return text;
        }
    }
}
