package com.schemacrud.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Caller input for one listing page. Field names and values are untrusted:
 * they are checked against the model's opt-in field sets when the query is
 * built, and unknown ones are dropped.
 *
 * @param page    0-based page index
 * @param size    requested page size, {@code null} for the configured default
 * @param sorts   field → {@code asc|desc}, applied in insertion order
 * @param filters field → value
 * @param search  free text matched against every filterable field
 */
public record ListingRequest(
    int page,
    Integer size,
    Map<String, String> sorts,
    Map<String, String> filters,
    String search
) {
    private static final Pattern SORT_PARAM = Pattern.compile("^sorts\\[(.*)]$");
    private static final Pattern FILTER_PARAM = Pattern.compile("^filters\\[(.*)]$");

    public ListingRequest {
        page = Math.max(page, 0);
        sorts = sorts != null ? Collections.unmodifiableMap(new LinkedHashMap<>(sorts)) : Map.of();
        filters = filters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(filters)) : Map.of();
    }

    public static ListingRequest firstPage() {
        return new ListingRequest(0, null, null, null, null);
    }

    public static ListingRequest page(int page, int size) {
        return new ListingRequest(page, size, null, null, null);
    }

    public ListingRequest withSort(String field, String direction) {
        var next = new LinkedHashMap<>(sorts);
        next.put(field, direction);
        return new ListingRequest(page, size, next, filters, search);
    }

    public ListingRequest withFilter(String field, String value) {
        var next = new LinkedHashMap<>(filters);
        next.put(field, value);
        return new ListingRequest(page, size, sorts, next, search);
    }

    public ListingRequest withSearch(String text) {
        return new ListingRequest(page, size, sorts, filters, text);
    }

    /**
     * Parse flat query parameters: {@code page}, {@code size},
     * {@code sorts[field]}, {@code filters[field]}, {@code search}.
     * Unparseable numbers fall back to the defaults.
     */
    public static ListingRequest fromQueryParams(Map<String, String> params) {
        var sorts = new LinkedHashMap<String, String>();
        var filters = new LinkedHashMap<String, String>();
        params.forEach((name, value) -> {
            var sort = SORT_PARAM.matcher(name);
            if (sort.matches()) {
                sorts.put(sort.group(1), value);
                return;
            }
            var filter = FILTER_PARAM.matcher(name);
            if (filter.matches()) {
                filters.put(filter.group(1), value);
            }
        });
        var page = parseInt(params.get("page"));
        return new ListingRequest(
            page != null ? page : 0,
            parseInt(params.get("size")),
            sorts,
            filters,
            params.get("search"));
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
