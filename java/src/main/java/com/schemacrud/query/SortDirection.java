package com.schemacrud.query;

import java.util.Optional;

public enum SortDirection {
    ASC,
    DESC;

    /** "asc" / "DESC" → direction; anything else is empty. */
    public static Optional<SortDirection> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value.trim().toLowerCase()) {
            case "asc" -> Optional.of(ASC);
            case "desc" -> Optional.of(DESC);
            default -> Optional.empty();
        };
    }
}
