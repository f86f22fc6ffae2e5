package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum RelationshipType {
    /** Child rows carry a column pointing at the parent's primary key. */
    HAS_MANY("has_many"),
    /** Rows linked through one pivot table. */
    MANY_TO_MANY("many_to_many"),
    /** Rows linked through a chain of pivots, starting from another relationship. */
    BELONGS_TO_MANY_THROUGH("belongs_to_many_through");

    private final String wire;

    RelationshipType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isPivot() {
        return this != HAS_MANY;
    }

    @JsonCreator
    public static RelationshipType fromWire(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown relationship type: " + name));
    }

    public static Optional<RelationshipType> find(String name) {
        for (RelationshipType t : values()) {
            if (t.wire.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
