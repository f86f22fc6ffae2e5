package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical field types of a schema document.
 *
 * The wire name is the lower-case spelling used in the JSON documents.
 * Legacy boolean spellings ({@code boolean-tgl}, {@code boolean-chk},
 * {@code boolean-yn}, {@code boolean-sel}) are accepted by
 * {@link #isKnown(String)} but are rewritten by the normalizer before a
 * document is bound, so {@link #fromWire(String)} only sees canonical names.
 */
public enum FieldType {
    STRING("string", Kind.TEXT),
    TEXT("text", Kind.TEXT),
    TEXTAREA("textarea", Kind.TEXT),
    EMAIL("email", Kind.TEXT),
    URL("url", Kind.TEXT),
    PHONE("phone", Kind.TEXT),
    ZIP("zip", Kind.TEXT),
    ADDRESS("address", Kind.TEXT),
    SELECT("select", Kind.TEXT),
    ENUM("enum", Kind.TEXT),
    PASSWORD("password", Kind.TEXT),
    INTEGER("integer", Kind.INTEGER),
    SMARTLOOKUP("smartlookup", Kind.INTEGER),
    NUMBER("number", Kind.DECIMAL),
    DECIMAL("decimal", Kind.DECIMAL),
    FLOAT("float", Kind.DECIMAL),
    CURRENCY("currency", Kind.DECIMAL),
    BOOLEAN("boolean", Kind.BOOLEAN),
    DATE("date", Kind.DATE),
    DATETIME("datetime", Kind.DATETIME),
    TIME("time", Kind.TIME),
    JSON("json", Kind.JSON),
    MULTISELECT("multiselect", Kind.JSON);

    /** Storage family of a type; drives filter coercion and row casting. */
    public enum Kind { TEXT, INTEGER, DECIMAL, BOOLEAN, DATE, DATETIME, TIME, JSON }

    /** Legacy boolean type suffix → ui hint. */
    public static final Map<String, String> LEGACY_BOOLEAN_UI = Map.of(
        "boolean-tgl", "toggle",
        "boolean-chk", "checkbox",
        "boolean-yn", "select",
        "boolean-sel", "select"
    );

    private final String wire;
    private final Kind kind;

    FieldType(String wire, Kind kind) {
        this.wire = wire;
        this.kind = kind;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTextLike() {
        return kind == Kind.TEXT;
    }

    @JsonCreator
    public static FieldType fromWire(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + name));
    }

    public static Optional<FieldType> find(String name) {
        if (name == null) return Optional.empty();
        for (FieldType t : values()) {
            if (t.wire.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** True for canonical names and for the legacy boolean spellings. */
    public static boolean isKnown(String name) {
        return find(name).isPresent() || LEGACY_BOOLEAN_UI.containsKey(name);
    }

    /**
     * Convert a caller-supplied filter value into the Java type bound for this
     * field. Empty when the value cannot represent this type; such filters are
     * dropped rather than sent to the store.
     */
    public Optional<Object> coerce(String raw) {
        if (raw == null) return Optional.empty();
        var value = raw.trim();
        try {
            return switch (kind) {
                case TEXT, JSON -> Optional.of(raw);
                case INTEGER -> Optional.of(Long.parseLong(value));
                case DECIMAL -> Optional.of(new BigDecimal(value));
                case BOOLEAN -> parseBoolean(value);
                case DATE -> Optional.of(LocalDate.parse(value));
                case DATETIME -> Optional.of(LocalDateTime.parse(value));
                case TIME -> Optional.of(LocalTime.parse(value));
            };
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Object> parseBoolean(String value) {
        return switch (value.toLowerCase()) {
            case "1", "true", "yes", "on" -> Optional.of(Boolean.TRUE);
            case "0", "false", "no", "off" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }
}
