package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root model for one {@code <model>.json} schema document, bound after
 * validation and normalization. Immutable once built; the schema cache hands
 * out the same instance to every request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaDocument(
    String model,
    String table,
    String connection,
    @JsonProperty("primary_key") String primaryKey,
    Boolean timestamps,
    @JsonProperty("soft_delete") Boolean softDelete,
    @JsonProperty("deleted_at") String deletedAt,

    // Display
    String title,
    @JsonProperty("singular_title") String singularTitle,
    @JsonProperty("title_field") String titleField,
    String description,
    @JsonProperty("default_sort") Map<String, String> defaultSort,

    // Permissions / actions
    Map<String, String> permissions,
    @JsonProperty("default_actions") Boolean defaultActions,
    List<ActionDefinition> actions,

    Map<String, FieldDefinition> fields,
    List<RelationshipDefinition> relationships,
    List<DetailDefinition> details
) {
    public static final String DEFAULT_PRIMARY_KEY = "id";
    public static final String DEFAULT_DELETED_AT = "deleted_at";

    public SchemaDocument {
        primaryKey = primaryKey != null ? primaryKey : DEFAULT_PRIMARY_KEY;
        timestamps = timestamps != null ? timestamps : Boolean.TRUE;
        softDelete = softDelete != null ? softDelete : Boolean.FALSE;
        defaultSort = defaultSort != null ? Collections.unmodifiableMap(new LinkedHashMap<>(defaultSort)) : Map.of();
        permissions = permissions != null ? Collections.unmodifiableMap(new LinkedHashMap<>(permissions)) : Map.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        details = details != null ? List.copyOf(details) : List.of();
    }

    public Optional<FieldDefinition> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<String> permission(String operation) {
        return Optional.ofNullable(permissions.get(operation));
    }

    public Optional<RelationshipDefinition> relationship(String name) {
        return relationships.stream()
            .filter(r -> name.equals(r.name()))
            .findFirst();
    }

    /** The detail entry whose related model is {@code relatedModel}. */
    public Optional<DetailDefinition> detail(String relatedModel) {
        return details.stream()
            .filter(d -> relatedModel.equals(d.model()))
            .findFirst();
    }

    /** Soft-delete column when soft deletes are enabled. */
    public Optional<String> softDeleteColumn() {
        if (!softDelete) return Optional.empty();
        return Optional.of(deletedAt != null && !deletedAt.isBlank() ? deletedAt : DEFAULT_DELETED_AT);
    }

    public boolean defaultActionsEnabled() {
        return !Boolean.FALSE.equals(defaultActions);
    }

    public String titleOrDefault() {
        return title != null ? title : ModelNames.capitalize(model);
    }

    public String singularTitleOrDefault() {
        if (singularTitle != null) return singularTitle;
        return title != null ? ModelNames.singularize(title) : ModelNames.pascalSingular(model);
    }

    public SchemaDocument withActions(List<ActionDefinition> newActions) {
        return new SchemaDocument(model, table, connection, primaryKey, timestamps, softDelete, deletedAt,
            title, singularTitle, titleField, description, defaultSort,
            permissions, defaultActions, newActions,
            fields, relationships, details);
    }
}
