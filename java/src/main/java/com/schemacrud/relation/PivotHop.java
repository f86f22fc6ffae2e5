package com.schemacrud.relation;

import com.schemacrud.metadata.RelationshipDefinition;

/**
 * One pivot table on the way from a parent row to related rows:
 * {@code foreignKey} holds the key of the previous step, {@code relatedKey}
 * the key of the next one.
 */
public record PivotHop(String pivotTable, String foreignKey, String relatedKey) {

    public static PivotHop of(RelationshipDefinition relationship) {
        return new PivotHop(relationship.pivotTable(), relationship.foreignKey(), relationship.relatedKey());
    }
}
