package com.schemacrud.query;

import java.util.regex.Pattern;

/**
 * Quoting for table and column names taken from a schema document. Names
 * are checked again here so nothing but a plain identifier (optionally
 * {@code schema.table}) ever reaches SQL text.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {}

    /** "users" → "\"users\"", "crm.users" → "\"crm\".\"users\"" */
    public static String quote(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Missing SQL identifier");
        }
        var parts = name.split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Not a plain SQL identifier: " + name);
        }
        var quoted = new StringBuilder();
        for (var part : parts) {
            if (!IDENTIFIER.matcher(part).matches()) {
                throw new IllegalArgumentException("Not a plain SQL identifier: " + name);
            }
            if (!quoted.isEmpty()) quoted.append('.');
            quoted.append("\"%s\"".formatted(part));
        }
        return quoted.toString();
    }

    /** Column qualified by a table alias: {@code "t"."email"}. */
    public static String column(String alias, String column) {
        return quote(alias) + "." + quote(column);
    }

    /** Escape LIKE wildcards so a caller value matches literally; the escape character is a backslash. */
    public static String escapeLike(String value) {
        return value
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }
}
