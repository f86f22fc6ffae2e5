package com.schemacrud.error;

/**
 * Something the caller asked for does not exist: a schema document or a record.
 */
public abstract class NotFoundException extends SchemaCrudException {

    protected NotFoundException(String model, String message) {
        super(model, message);
    }
}
