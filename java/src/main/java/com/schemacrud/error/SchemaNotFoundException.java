package com.schemacrud.error;

public class SchemaNotFoundException extends NotFoundException {

    public SchemaNotFoundException(String model) {
        super(model, "Schema not found for model: " + model);
    }

    public SchemaNotFoundException(String model, String namespace) {
        super(model, namespace == null
            ? "Schema not found for model: " + model
            : "Schema not found for model: " + model + " (namespace '" + namespace + "')");
    }
}
