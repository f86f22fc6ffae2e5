package com.schemacrud.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One listing page: {@code count} rows in the (scoped) table,
 * {@code count_filtered} after filters and search, and the page's rows
 * holding listable fields only.
 */
public record ListingResult(
    long count,
    @JsonProperty("count_filtered") long countFiltered,
    List<Map<String, Object>> rows
) {
    public ListingResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
    }
}
