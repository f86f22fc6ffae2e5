package com.schemacrud.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only copies of the free-form JSON values a schema carries
 * ({@code validation}, {@code modal_config}). Nested maps and lists are
 * copied too; JSON nulls are kept, so {@code Map.copyOf} does not fit.
 */
final class Frozen {

    private Frozen() {}

    static Map<String, Object> map(Map<String, Object> source) {
        if (source == null) return null;
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((key, value) -> copy.put(key, value(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object value(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return map((Map<String, Object>) nested);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(value(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
