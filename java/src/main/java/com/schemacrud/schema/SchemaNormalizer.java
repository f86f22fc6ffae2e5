package com.schemacrud.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacrud.metadata.FieldType;
import com.schemacrud.metadata.SchemaDocument;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites a validated raw document into canonical form.
 *
 * Every step only fills in what is absent, so normalizing an already
 * normalized document returns an equal document. Steps run in this order:
 * <ol>
 *   <li>top-level defaults ({@code primary_key}, {@code timestamps}, {@code soft_delete})</li>
 *   <li>ORM-style field attributes ({@code nullable}, {@code autoIncrement}, {@code references}, ...)</li>
 *   <li>smartlookup attributes</li>
 *   <li>visibility: {@code show_in} and the opt-in {@code listable} flag</li>
 *   <li>opt-in {@code sortable} / {@code filterable} flags</li>
 *   <li>legacy boolean types ({@code boolean-tgl} → boolean + toggle)</li>
 *   <li>action scopes given as a single string</li>
 * </ol>
 */
@Component
public class SchemaNormalizer {

    private static final Pattern LEGACY_BOOLEAN = Pattern.compile("^boolean-(tgl|chk|sel|yn)$");

    /** Returns a normalized copy; the input is left untouched. */
    public ObjectNode normalize(ObjectNode input) {
        var schema = input.deepCopy();
        applyDefaults(schema);

        var fields = schema.get("fields");
        if (fields instanceof ObjectNode fieldMap) {
            for (Iterator<Map.Entry<String, JsonNode>> it = fieldMap.fields(); it.hasNext(); ) {
                if (it.next().getValue() instanceof ObjectNode field) {
                    normalizeOrmAttributes(field);
                    normalizeLookupAttributes(field);
                    normalizeVisibility(field);
                    normalizeQueryFlags(field);
                    normalizeBooleanType(field);
                }
            }
        }

        normalizeActionScopes(schema);
        return schema;
    }

    // -----------------------------------------------------------------------
    // Top level
    // -----------------------------------------------------------------------

    void applyDefaults(ObjectNode schema) {
        if (!schema.hasNonNull("primary_key")) schema.put("primary_key", SchemaDocument.DEFAULT_PRIMARY_KEY);
        if (!schema.hasNonNull("timestamps")) schema.put("timestamps", true);
        if (!schema.hasNonNull("soft_delete")) schema.put("soft_delete", false);

        // Legacy single "detail" object
        var legacy = schema.get("detail");
        if (legacy != null && legacy.isObject()) {
            if (!schema.hasNonNull("details")) {
                schema.putArray("details").add(legacy);
            }
            schema.remove("detail");
        }
    }

    // -----------------------------------------------------------------------
    // Fields
    // -----------------------------------------------------------------------

    void normalizeOrmAttributes(ObjectNode field) {
        // nullable <-> required
        if (field.hasNonNull("nullable") && !field.hasNonNull("required")) {
            field.put("required", !field.get("nullable").asBoolean());
        }
        if (field.hasNonNull("required") && !field.hasNonNull("nullable")) {
            field.put("nullable", !field.get("required").asBoolean());
        }

        moveAlias(field, "autoIncrement", "auto_increment");
        moveAlias(field, "primaryKey", "primary");
        moveAlias(field, "validate", "validation");
        moveAlias(field, "defaultValue", "default");

        if (field.has("unique")) {
            var validation = validationOf(field);
            if (!validation.has("unique")) validation.set("unique", field.get("unique"));
        }
        if (field.hasNonNull("length")) {
            var validation = validationOf(field);
            if (!validation.has("length")) validation.putObject("length").set("max", field.get("length"));
        }

        var references = field.get("references");
        if (references != null && references.isObject()) {
            if (!field.has("lookup")) {
                var lookup = field.putObject("lookup");
                lookup.put("model", firstText(references, "model", "table", null));
                lookup.put("id", firstText(references, "key", "id", "id"));
                lookup.put("desc", firstText(references, "display", "desc", "name"));
            }
            if ((!field.hasNonNull("type") || "integer".equals(field.get("type").asText()))
                && (references.has("display") || references.has("desc"))) {
                field.put("type", FieldType.SMARTLOOKUP.wire());
            }
        }

        var ui = field.get("ui");
        if (ui != null && ui.isObject()) {
            copyIfAbsent(ui, field, "label");
            copyIfAbsent(ui, field, "show_in");
            copyIfAbsent(ui, field, "sortable");
            copyIfAbsent(ui, field, "filterable");
            if ("lookup".equals(ui.path("type").asText())
                && (!field.hasNonNull("type") || "integer".equals(field.get("type").asText()))) {
                field.put("type", FieldType.SMARTLOOKUP.wire());
            }
            if (ui.hasNonNull("widget")) {
                field.put("ui", ui.get("widget").asText());
            } else {
                field.remove("ui");
            }
        }

        if (!field.hasNonNull("type")) {
            field.put("type", FieldType.STRING.wire());
        }
    }

    void normalizeLookupAttributes(ObjectNode field) {
        if (!FieldType.SMARTLOOKUP.wire().equals(field.path("type").asText())) {
            return;
        }
        var lookup = field.get("lookup");
        if (lookup != null && lookup.isObject()) {
            copyIfAbsent(lookup, "model", field, "lookup_model");
            copyIfAbsent(lookup, "id", field, "lookup_id");
            copyIfAbsent(lookup, "desc", field, "lookup_desc");
        }
        // Shorthand attributes as fallbacks
        copyIfAbsent(field, "model", field, "lookup_model");
        copyIfAbsent(field, "id", field, "lookup_id");
        copyIfAbsent(field, "desc", field, "lookup_desc");
    }

    /**
     * Canonical {@code show_in}: {@code form} expands to {@code create} and
     * {@code edit}; listing is opt-in; password fields never show in
     * {@code list} or {@code detail}.
     */
    void normalizeVisibility(ObjectNode field) {
        var password = FieldType.PASSWORD.wire().equals(field.path("type").asText());
        var showIn = field.get("show_in");

        if (showIn != null && showIn.isArray()) {
            Set<String> contexts = new LinkedHashSet<>();
            for (var context : showIn) {
                if ("form".equals(context.asText())) {
                    contexts.add("create");
                    contexts.add("edit");
                } else {
                    contexts.add(context.asText());
                }
            }
            var listable = !password && (field.path("listable").asBoolean(false) || contexts.contains("list"));
            if (listable) {
                contexts.add("list");
            }
            if (password) {
                contexts.remove("list");
                contexts.remove("detail");
            }
            writeContexts(field, contexts);
            field.put("listable", listable);
            if (!field.hasNonNull("editable")) field.put("editable", contexts.contains("create") || contexts.contains("edit"));
            if (!field.hasNonNull("viewable")) field.put("viewable", contexts.contains("detail"));
            return;
        }

        var listable = !password && field.path("listable").asBoolean(false);
        var editable = !field.hasNonNull("editable") || field.get("editable").asBoolean();
        var viewable = !field.hasNonNull("viewable") || field.get("viewable").asBoolean();

        Set<String> contexts = new LinkedHashSet<>();
        if (listable) contexts.add("list");
        if (editable) {
            contexts.add("create");
            contexts.add("edit");
        }
        if (viewable && !password) contexts.add("detail");

        writeContexts(field, contexts);
        field.put("listable", listable);
        field.put("editable", editable);
        field.put("viewable", viewable);
    }

    void normalizeQueryFlags(ObjectNode field) {
        field.put("sortable", field.path("sortable").asBoolean(false));
        field.put("filterable", field.path("filterable").asBoolean(false));
    }

    void normalizeBooleanType(ObjectNode field) {
        var type = field.path("type").asText();
        var legacy = LEGACY_BOOLEAN.matcher(type);
        if (legacy.matches()) {
            field.put("type", FieldType.BOOLEAN.wire());
            if (!field.hasNonNull("ui")) {
                field.put("ui", FieldType.LEGACY_BOOLEAN_UI.get(type));
            }
        } else if (FieldType.BOOLEAN.wire().equals(type) && !field.hasNonNull("ui")) {
            field.put("ui", "checkbox");
        }
    }

    // -----------------------------------------------------------------------
    // Actions
    // -----------------------------------------------------------------------

    void normalizeActionScopes(ObjectNode schema) {
        var actions = schema.get("actions");
        if (actions == null || !actions.isArray()) return;
        for (var action : actions) {
            if (action instanceof ObjectNode node && node.path("scope").isTextual()) {
                var scope = node.get("scope").asText();
                node.putArray("scope").add(scope);
            }
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static void writeContexts(ObjectNode field, Set<String> contexts) {
        ArrayNode array = field.putArray("show_in");
        contexts.forEach(array::add);
    }

    private static ObjectNode validationOf(ObjectNode field) {
        var validation = field.get("validation");
        if (validation instanceof ObjectNode node) return node;
        return field.putObject("validation");
    }

    private static void moveAlias(ObjectNode field, String alias, String canonical) {
        if (!field.has(alias)) return;
        if (!field.has(canonical)) field.set(canonical, field.get(alias));
        field.remove(alias);
    }

    private static void copyIfAbsent(JsonNode source, ObjectNode target, String key) {
        copyIfAbsent(source, key, target, key);
    }

    private static void copyIfAbsent(JsonNode source, String sourceKey, ObjectNode target, String targetKey) {
        if (source.hasNonNull(sourceKey) && !target.hasNonNull(targetKey)) {
            target.set(targetKey, source.get(sourceKey));
        }
    }

    private static String firstText(JsonNode node, String first, String second, String fallback) {
        if (node.hasNonNull(first)) return node.get(first).asText();
        if (node.hasNonNull(second)) return node.get(second).asText();
        return fallback;
    }
}
