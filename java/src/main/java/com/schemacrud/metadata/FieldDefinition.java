package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One entry of a schema document's {@code fields} map, as bound after
 * normalization. Flags stay nullable so a bound document serialises back to
 * the same JSON it was read from; use the helpers for effective values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldDefinition(
    FieldType type,
    String ui,
    String label,
    Boolean required,
    Boolean nullable,
    Boolean readonly,
    Boolean editable,
    Boolean viewable,

    // Opt-in listing exposure
    Boolean sortable,
    Boolean filterable,
    Boolean listable,

    Boolean computed,
    @JsonProperty("auto_increment") Boolean autoIncrement,
    @JsonProperty("default") Object defaultValue,
    Map<String, Object> validation,
    @JsonProperty("show_in") List<String> showIn,

    // Display
    String description,
    String placeholder,
    String icon,
    Integer rows,
    Object width,
    @JsonProperty("field_template") String fieldTemplate,
    @JsonProperty("filter_type") String filterType,

    // Smartlookup
    @JsonProperty("lookup_model") String lookupModel,
    @JsonProperty("lookup_id") String lookupId,
    @JsonProperty("lookup_desc") String lookupDesc
) {
    public FieldDefinition {
        type = type != null ? type : FieldType.STRING;
        showIn = showIn != null ? List.copyOf(showIn) : List.of();
        validation = Frozen.map(validation);
    }

    /** Minimal definition, mostly for tests and synthetic fields. */
    public static FieldDefinition of(FieldType type) {
        return new FieldDefinition(type, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null,
            null, null, null);
    }

    public FieldPolicy policy() {
        if (isPasswordField()) {
            return FieldPolicy.HIDDEN;
        }
        return new FieldPolicy(
            Boolean.TRUE.equals(sortable),
            Boolean.TRUE.equals(filterable),
            Boolean.TRUE.equals(listable) || showIn.contains("list"));
    }

    public boolean shownIn(String context) {
        return showIn.contains(context);
    }

    @JsonIgnore
    public boolean isComputedField() {
        return Boolean.TRUE.equals(computed);
    }

    @JsonIgnore
    public boolean isAutoIncrementing() {
        return Boolean.TRUE.equals(autoIncrement);
    }

    @JsonIgnore
    public boolean isPasswordField() {
        return type == FieldType.PASSWORD;
    }

    @JsonIgnore
    public boolean isRequiredField() {
        return Boolean.TRUE.equals(required);
    }

    @JsonIgnore
    public boolean isReadonlyField() {
        return readonly != null ? readonly : isPasswordField();
    }

    /** Editable unless explicitly disabled. */
    @JsonIgnore
    public boolean isEditableField() {
        return editable == null || editable;
    }

    public String labelOr(String fieldName) {
        return label != null ? label : fieldName;
    }
}
