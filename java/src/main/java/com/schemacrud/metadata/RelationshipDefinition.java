package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of a schema's {@code relationships} list.
 *
 * For pivot relationships {@code foreign_key} is the pivot column holding the
 * owning row's key and {@code related_key} the pivot column holding the
 * related row's key. For {@code has_many}, {@code foreign_key} is the child
 * column. {@code through} names the relationship a chained pivot starts from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelationshipDefinition(
    String name,
    RelationshipType type,
    @JsonProperty("pivot_table") String pivotTable,
    @JsonProperty("foreign_key") String foreignKey,
    @JsonProperty("related_key") String relatedKey,
    String through
) {
    public RelationshipDefinition {
        type = type != null ? type : RelationshipType.MANY_TO_MANY;
    }

    public boolean hasPivotKeys() {
        return pivotTable != null && foreignKey != null && relatedKey != null;
    }
}
