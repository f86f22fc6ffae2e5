package com.schemacrud.error;

/**
 * A schema document violates a structural rule. Raised while loading,
 * validating or resolving and never patched over: the message names the
 * model and the offending key so the document can be fixed directly.
 */
public class InvalidSchemaException extends SchemaCrudException {

    private final String key;

    public InvalidSchemaException(String model, String key, String message) {
        super(model, "Invalid schema for model '" + model + "' at '" + key + "': " + message);
        this.key = key;
    }

    public InvalidSchemaException(String model, String key, String message, Throwable cause) {
        super(model, "Invalid schema for model '" + model + "' at '" + key + "': " + message, cause);
        this.key = key;
    }

    /** Path of the offending key, e.g. {@code fields.email.type} or {@code actions[2].scope}. */
    public String key() {
        return key;
    }
}
