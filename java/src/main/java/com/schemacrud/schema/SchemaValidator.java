package com.schemacrud.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacrud.error.InvalidSchemaException;
import com.schemacrud.metadata.ActionType;
import com.schemacrud.metadata.FieldType;
import com.schemacrud.metadata.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks on a raw schema document, run before normalization.
 * Every violation is an {@link InvalidSchemaException} naming the model and
 * the offending key; nothing is repaired here.
 */
@Component
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    public void validate(ObjectNode schema, String model) {
        for (var required : new String[] {"model", "table", "fields"}) {
            if (!schema.hasNonNull(required)) {
                throw new InvalidSchemaException(model, required, "required field is missing");
            }
        }

        var declared = schema.get("model").asText();
        if (!declared.equals(model)) {
            throw new InvalidSchemaException(model, "model",
                "schema model name '" + declared + "' does not match requested model '" + model + "'");
        }

        requireMatch(model, "table", text(schema, "table"), TABLE);
        if (schema.hasNonNull("primary_key")) {
            requireIdentifier(model, "primary_key", text(schema, "primary_key"));
        }
        if (schema.hasNonNull("deleted_at")) {
            requireIdentifier(model, "deleted_at", text(schema, "deleted_at"));
        }

        validatePermissions(schema, model);
        validateFields(schema, model);
        validateActions(schema, model);
        validateRelationships(schema, model);
        validateDetails(schema, model);
    }

    // -----------------------------------------------------------------------
    // Sections
    // -----------------------------------------------------------------------

    private void validatePermissions(ObjectNode schema, String model) {
        var permissions = schema.get("permissions");
        if (permissions == null || permissions.isNull()) return;
        if (!permissions.isObject()) {
            throw new InvalidSchemaException(model, "permissions", "must be an object of operation to permission key");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = permissions.fields(); it.hasNext(); ) {
            var entry = it.next();
            if (!entry.getValue().isTextual() || entry.getValue().asText().isBlank()) {
                throw new InvalidSchemaException(model, "permissions." + entry.getKey(), "permission key must be a non-empty string");
            }
        }
    }

    private void validateFields(ObjectNode schema, String model) {
        var fields = schema.get("fields");
        if (!fields.isObject() || fields.isEmpty()) {
            throw new InvalidSchemaException(model, "fields", "must be a non-empty object");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = fields.fields(); it.hasNext(); ) {
            var entry = it.next();
            var path = "fields." + entry.getKey();
            requireIdentifier(model, path, entry.getKey());
            var field = entry.getValue();
            if (!field.isObject()) {
                throw new InvalidSchemaException(model, path, "field definition must be an object");
            }
            if (field.hasNonNull("type")) {
                var type = field.get("type").asText();
                if (!FieldType.isKnown(type)) {
                    throw new InvalidSchemaException(model, path + ".type", "unsupported type " + type);
                }
            }
            var showIn = field.get("show_in");
            if (showIn != null && !showIn.isNull() && !showIn.isArray()) {
                throw new InvalidSchemaException(model, path + ".show_in", "must be a list of contexts");
            }
        }
    }

    private void validateActions(ObjectNode schema, String model) {
        var actions = schema.get("actions");
        if (actions == null || actions.isNull()) return;
        if (!actions.isArray()) {
            throw new InvalidSchemaException(model, "actions", "must be a list");
        }

        Set<String> keys = new HashSet<>();
        for (int i = 0; i < actions.size(); i++) {
            var action = actions.get(i);
            var path = "actions[" + i + "]";
            if (!action.isObject()) {
                throw new InvalidSchemaException(model, path, "action must be an object");
            }
            var key = text(action, "key");
            if (isBlank(key)) {
                throw new InvalidSchemaException(model, path + ".key", "action key required");
            }
            if (!keys.add(key)) {
                throw new InvalidSchemaException(model, path + ".key", "duplicate action key " + key);
            }
            if (!hasScope(action.get("scope"))) {
                throw new InvalidSchemaException(model, path + ".scope",
                    "action '" + key + "' must declare a scope (list and/or detail)");
            }
            var type = text(action, "type");
            if (type != null && ActionType.find(type).isEmpty()) {
                throw new InvalidSchemaException(model, path + ".type", "unsupported action type " + type);
            }
            if (ActionType.FIELD_UPDATE.wire().equals(type) && isBlank(text(action, "field"))) {
                throw new InvalidSchemaException(model, path + ".field", "field_update action '" + key + "' must name a field");
            }
        }
    }

    private void validateRelationships(ObjectNode schema, String model) {
        var relationships = schema.get("relationships");
        if (relationships == null || relationships.isNull()) return;
        if (!relationships.isArray()) {
            throw new InvalidSchemaException(model, "relationships", "must be a list");
        }

        for (int i = 0; i < relationships.size(); i++) {
            var rel = relationships.get(i);
            var path = "relationships[" + i + "]";
            var name = text(rel, "name");
            if (isBlank(name)) {
                throw new InvalidSchemaException(model, path + ".name", "relationship name required");
            }
            var typeName = rel.hasNonNull("type") ? text(rel, "type") : RelationshipType.MANY_TO_MANY.wire();
            var type = RelationshipType.find(typeName).orElseThrow(() ->
                new InvalidSchemaException(model, path + ".type", "unsupported relationship type " + typeName));

            switch (type) {
                case MANY_TO_MANY -> {
                    for (var key : new String[] {"pivot_table", "foreign_key", "related_key"}) {
                        requireIdentifier(model, path + "." + key, text(rel, key));
                    }
                }
                case HAS_MANY -> requireIdentifier(model, path + ".foreign_key", text(rel, "foreign_key"));
                case BELONGS_TO_MANY_THROUGH -> {
                    if (isBlank(text(rel, "through"))) {
                        throw new InvalidSchemaException(model, path + ".through",
                            "relationship '" + name + "' must name the relationship it goes through");
                    }
                    // Pivot keys are optional here (taken from the intermediate model), but all or nothing.
                    var given = 0;
                    for (var key : new String[] {"pivot_table", "foreign_key", "related_key"}) {
                        if (rel.hasNonNull(key)) {
                            requireIdentifier(model, path + "." + key, text(rel, key));
                            given++;
                        }
                    }
                    if (given != 0 && given != 3) {
                        throw new InvalidSchemaException(model, path,
                            "relationship '" + name + "' must give all of pivot_table, foreign_key, related_key or none");
                    }
                }
            }
        }
    }

    private void validateDetails(ObjectNode schema, String model) {
        var details = schema.get("details");
        if (details == null || details.isNull()) return;
        if (!details.isArray()) {
            throw new InvalidSchemaException(model, "details", "must be a list");
        }

        for (int i = 0; i < details.size(); i++) {
            var detail = details.get(i);
            var path = "details[" + i + "]";
            var related = text(detail, "model");
            if (isBlank(related)) {
                throw new InvalidSchemaException(model, path + ".model", "detail must name its related model");
            }
            if (detail.has("foreign_key")) {
                // Present-but-empty would read as a direct relation on a blank column.
                requireIdentifier(model, path + ".foreign_key", text(detail, "foreign_key"));
                var pivot = relationshipType(schema, related).filter(RelationshipType::isPivot);
                if (pivot.isPresent()) {
                    throw new InvalidSchemaException(model, path + ".foreign_key",
                        "detail '" + related + "' is a " + pivot.get().wire()
                            + " relationship and must not declare a foreign_key");
                }
            } else if (relationshipType(schema, related).isEmpty()) {
                log.warn("Schema '{}': detail '{}' has no foreign_key and no matching relationship; "
                    + "requests for it will fail", model, related);
            }
            var listFields = detail.get("list_fields");
            if (listFields != null && !listFields.isNull()) {
                if (!listFields.isArray()) {
                    throw new InvalidSchemaException(model, path + ".list_fields", "must be a list of field names");
                }
                for (int j = 0; j < listFields.size(); j++) {
                    var fieldName = listFields.get(j).asText();
                    if (!fieldName.isBlank()) {
                        requireIdentifier(model, path + ".list_fields[" + j + "]", fieldName);
                    }
                }
            }
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static boolean hasScope(JsonNode scope) {
        if (scope == null || scope.isNull()) return false;
        if (scope.isTextual()) return !scope.asText().isBlank();
        return scope.isArray() && !scope.isEmpty();
    }

    /** Type of the relationship named {@code name}; an absent type means many_to_many. */
    private static Optional<RelationshipType> relationshipType(ObjectNode schema, String name) {
        var relationships = schema.get("relationships");
        if (relationships == null || !relationships.isArray()) return Optional.empty();
        for (var rel : relationships) {
            if (name.equals(text(rel, "name"))) {
                return rel.hasNonNull("type")
                    ? RelationshipType.find(text(rel, "type"))
                    : Optional.of(RelationshipType.MANY_TO_MANY);
            }
        }
        return Optional.empty();
    }

    private static void requireIdentifier(String model, String key, String value) {
        requireMatch(model, key, value, IDENTIFIER);
    }

    private static void requireMatch(String model, String key, String value, Pattern pattern) {
        if (isBlank(value)) {
            throw new InvalidSchemaException(model, key, "required identifier is missing or empty");
        }
        if (!pattern.matcher(value).matches()) {
            throw new InvalidSchemaException(model, key, "'" + value + "' is not a valid SQL identifier");
        }
    }

    private static String text(JsonNode node, String key) {
        var value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
