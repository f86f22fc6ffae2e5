package com.schemacrud.error;

/**
 * A related listing was requested for a relation that has no usable
 * relationship definition. Only the offending relation request fails;
 * the rest of the schema stays usable.
 */
public class MissingRelationshipConfigException extends SchemaCrudException {

    private final String relation;

    public MissingRelationshipConfigException(String model, String relation, String message) {
        super(model, "Relation '" + relation + "' of model '" + model + "': " + message);
        this.relation = relation;
    }

    public String relation() {
        return relation;
    }
}
