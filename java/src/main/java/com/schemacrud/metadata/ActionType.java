package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum ActionType {
    FORM("form"),
    DELETE("delete"),
    FIELD_UPDATE("field_update"),
    API_CALL("api_call"),
    MODAL("modal"),
    ROUTE("route"),
    PASSWORD_UPDATE("password_update");

    private final String wire;

    ActionType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ActionType fromWire(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + name));
    }

    public static Optional<ActionType> find(String name) {
        for (ActionType t : values()) {
            if (t.wire.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
