package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A related listing shown for a single record. A present {@code foreign_key}
 * marks a direct relation; its absence sends resolution to the same-named
 * relationship definition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetailDefinition(
    String model,
    @JsonProperty("foreign_key") String foreignKey,
    @JsonProperty("list_fields") List<String> listFields,
    String title
) {
    public DetailDefinition {
        listFields = listFields != null ? List.copyOf(listFields) : List.of();
    }

    @JsonIgnore
    public boolean isDirect() {
        return foreignKey != null;
    }
}
