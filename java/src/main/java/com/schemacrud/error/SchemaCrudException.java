package com.schemacrud.error;

/**
 * Root of the engine's exception hierarchy. Every failure raised by the
 * schema pipeline, the resolvers or the services extends this type, so a
 * collaborator layer can map the whole family with one handler.
 */
public class SchemaCrudException extends RuntimeException {

    private final String model;

    public SchemaCrudException(String model, String message) {
        super(message);
        this.model = model;
    }

    public SchemaCrudException(String model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    /** Model the failure relates to, or {@code null} when not model-specific. */
    public String model() {
        return model;
    }
}
