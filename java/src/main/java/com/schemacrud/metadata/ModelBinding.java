package com.schemacrud.metadata;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A schema document bound to its table: the generic description every query
 * is built from. Field policies are read once from the normalized document
 * and carried here; column lists only ever name persisted fields.
 */
public record ModelBinding(
    String model,
    String table,
    String primaryKey,
    String softDeleteColumn,
    Map<String, FieldDefinition> fields,
    Map<String, FieldPolicy> policies,
    Map<String, String> defaultSort
) {
    public ModelBinding {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
        defaultSort = defaultSort != null ? Collections.unmodifiableMap(new LinkedHashMap<>(defaultSort)) : Map.of();
    }

    public static ModelBinding of(SchemaDocument schema) {
        var policies = new LinkedHashMap<String, FieldPolicy>();
        schema.fields().forEach((name, field) -> policies.put(name, field.policy()));
        return new ModelBinding(
            schema.model(),
            schema.table(),
            schema.primaryKey(),
            schema.softDeleteColumn().orElse(null),
            schema.fields(),
            policies,
            schema.defaultSort());
    }

    /**
     * Same binding with listing output narrowed to {@code names}; fields
     * outside it keep their sort and filter flags. An empty list keeps
     * the binding as is.
     */
    public ModelBinding restrictListable(Collection<String> names) {
        if (names == null || names.isEmpty()) return this;
        var restricted = new LinkedHashMap<String, FieldPolicy>();
        policies.forEach((name, policy) -> restricted.put(name, names.contains(name)
            ? policy
            : new FieldPolicy(policy.sortable(), policy.filterable(), false)));
        return new ModelBinding(model, table, primaryKey, softDeleteColumn, fields, restricted, defaultSort);
    }

    public Optional<String> softDelete() {
        return Optional.ofNullable(softDeleteColumn);
    }

    public FieldPolicy policy(String field) {
        return policies.getOrDefault(field, FieldPolicy.HIDDEN);
    }

    /** Type of a field; the primary key is an integer unless declared otherwise. */
    public FieldType fieldType(String field) {
        var def = fields.get(field);
        if (def != null) return def.type();
        return primaryKey.equals(field) ? FieldType.INTEGER : FieldType.STRING;
    }

    public List<String> sortableFields() {
        return queryable(name -> policy(name).sortable());
    }

    public List<String> filterableFields() {
        return queryable(name -> policy(name).filterable());
    }

    public List<String> listableFields() {
        return queryable(name -> policy(name).listable());
    }

    /** Columns written on insert: persisted, not generated, not locked against editing. */
    public List<String> insertColumns() {
        return fields.entrySet().stream()
            .filter(e -> !e.getValue().isComputedField())
            .filter(e -> !e.getValue().isAutoIncrementing())
            .filter(e -> e.getValue().isEditableField())
            .map(Map.Entry::getKey)
            .toList();
    }

    /** Columns written on update: the insert columns minus the primary key. */
    public List<String> updateColumns() {
        return insertColumns().stream()
            .filter(name -> !name.equals(primaryKey))
            .toList();
    }

    /**
     * True when {@code name} is a real column of this table: either the
     * primary key or a declared, non-computed field.
     */
    public boolean isColumn(String name) {
        if (name == null || name.isBlank()) return false;
        if (name.equals(primaryKey)) return true;
        var def = fields.get(name);
        return def != null && !def.isComputedField();
    }

    private List<String> queryable(Predicate<String> allowed) {
        return fields.entrySet().stream()
            .filter(e -> !e.getValue().isComputedField())
            .filter(e -> !e.getValue().isPasswordField())
            .map(Map.Entry::getKey)
            .filter(allowed)
            .toList();
    }
}
