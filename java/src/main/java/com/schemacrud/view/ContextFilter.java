package com.schemacrud.view;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacrud.metadata.FieldDefinition;
import com.schemacrud.metadata.SchemaDocument;
import com.schemacrud.metadata.SchemaJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces the part of a schema a given usage context needs.
 *
 * <ul>
 *   <li>{@code list}: listable fields with display and query flags, default sort, list actions</li>
 *   <li>{@code create} / {@code edit}: fields shown in that form with input attributes</li>
 *   <li>{@code form}: create and edit combined</li>
 *   <li>{@code detail}: viewable fields, details, relationships, detail actions</li>
 *   <li>{@code meta} / {@code metadata}: base metadata only</li>
 *   <li>{@code full}: the whole document</li>
 * </ul>
 *
 * Several contexts merge into one view: field maps merge per field (earlier
 * contexts win per attribute), actions are unioned by key, anything else is
 * replaced by the later context. Unknown contexts add nothing.
 */
@Component
public class ContextFilter {

    private static final Logger log = LoggerFactory.getLogger(ContextFilter.class);

    public static final String FULL = "full";

    private final ActionManager actionManager;

    public ContextFilter(ActionManager actionManager) {
        this.actionManager = actionManager;
    }

    /** Empty or {@code null} contexts, or any list containing {@code full}, return the whole document. */
    public ObjectNode filter(SchemaDocument schema, List<String> contexts) {
        if (contexts == null || contexts.isEmpty() || contexts.contains(FULL)) {
            return mapper().valueToTree(schema);
        }

        var view = baseMetadata(schema);
        for (var context : contexts) {
            var data = contextData(schema, context);
            if (data == null) {
                log.debug("Ignoring unknown context '{}' for model '{}'", context, schema.model());
                continue;
            }
            merge(view, data);
        }
        return view;
    }

    ObjectNode baseMetadata(SchemaDocument schema) {
        var node = mapper().createObjectNode();
        node.put("model", schema.model());
        node.put("title", schema.titleOrDefault());
        node.put("singular_title", schema.singularTitleOrDefault());
        node.put("primary_key", schema.primaryKey());
        putIfPresent(node, "title_field", schema.titleField());
        putIfPresent(node, "description", schema.description());
        if (!schema.permissions().isEmpty()) {
            node.set("permissions", mapper().valueToTree(schema.permissions()));
        }
        return node;
    }

    private ObjectNode contextData(SchemaDocument schema, String context) {
        return switch (context) {
            case "meta", "metadata" -> mapper().createObjectNode();
            case "list" -> listData(schema);
            case "create", "edit" -> formData(schema, context);
            case "form" -> {
                var combined = formData(schema, "create");
                merge(combined, formData(schema, "edit"));
                yield combined;
            }
            case "detail" -> detailData(schema);
            default -> null;
        };
    }

    // -----------------------------------------------------------------------
    // Per-context payloads
    // -----------------------------------------------------------------------

    private ObjectNode listData(SchemaDocument schema) {
        var data = mapper().createObjectNode();
        var fields = data.putObject("fields");
        schema.fields().forEach((name, field) -> {
            if (!field.policy().listable() || field.isComputedField()) return;
            var out = fields.putObject(name);
            out.put("type", field.type().wire());
            putIfPresent(out, "ui", field.ui());
            out.put("label", field.labelOr(name));
            out.put("sortable", field.policy().sortable());
            out.put("filterable", field.policy().filterable());
            putIfPresent(out, "width", field.width());
            putIfPresent(out, "field_template", field.fieldTemplate());
            if (field.policy().filterable()) {
                putIfPresent(out, "filter_type", field.filterType());
            }
        });
        if (!schema.defaultSort().isEmpty()) {
            data.set("default_sort", mapper().valueToTree(schema.defaultSort()));
        }
        data.set("actions", mapper().valueToTree(actionManager.filterByScope(schema.actions(), "list")));
        return data;
    }

    private ObjectNode formData(SchemaDocument schema, String context) {
        var data = mapper().createObjectNode();
        var fields = data.putObject("fields");
        schema.fields().forEach((name, field) -> {
            if (!field.shownIn(context)) return;
            var out = fields.putObject(name);
            out.put("type", field.type().wire());
            putIfPresent(out, "ui", field.ui());
            out.put("label", field.labelOr(name));
            out.put("required", field.isRequiredField());
            out.put("editable", field.isEditableField());
            putIfPresent(out, "validation", field.validation());
            putIfPresent(out, "placeholder", field.placeholder());
            putIfPresent(out, "description", field.description());
            putIfPresent(out, "default", field.defaultValue());
            putIfPresent(out, "icon", field.icon());
            putIfPresent(out, "rows", field.rows());
            out.set("show_in", mapper().valueToTree(field.showIn()));
            putIfPresent(out, "lookup_model", field.lookupModel());
            putIfPresent(out, "lookup_id", field.lookupId());
            putIfPresent(out, "lookup_desc", field.lookupDesc());
        });
        return data;
    }

    private ObjectNode detailData(SchemaDocument schema) {
        var data = mapper().createObjectNode();
        var fields = data.putObject("fields");
        schema.fields().forEach((name, field) -> {
            if (!field.shownIn("detail") || field.isPasswordField()) return;
            detailField(fields.putObject(name), name, field);
        });
        if (!schema.details().isEmpty()) {
            data.set("details", mapper().valueToTree(schema.details()));
        }
        if (!schema.relationships().isEmpty()) {
            data.set("relationships", mapper().valueToTree(schema.relationships()));
        }
        data.set("actions", mapper().valueToTree(actionManager.filterByScope(schema.actions(), "detail")));
        putIfPresent(data, "title_field", schema.titleField());
        return data;
    }

    private void detailField(ObjectNode out, String name, FieldDefinition field) {
        var readonly = field.isReadonlyField();
        out.put("type", field.type().wire());
        putIfPresent(out, "ui", field.ui());
        out.put("label", field.labelOr(name));
        out.put("editable", field.editable() != null ? field.editable() : !readonly);
        out.put("readonly", readonly);
        putIfPresent(out, "description", field.description());
        putIfPresent(out, "field_template", field.fieldTemplate());
        putIfPresent(out, "default", field.defaultValue());
    }

    // -----------------------------------------------------------------------
    // Merging
    // -----------------------------------------------------------------------

    static void merge(ObjectNode view, ObjectNode data) {
        for (var it = data.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            var key = entry.getKey();
            var value = entry.getValue();
            switch (key) {
                case "fields" -> mergeFields(view, (ObjectNode) value);
                case "actions" -> mergeActions(view, (ArrayNode) value);
                default -> view.set(key, value);
            }
        }
    }

    private static void mergeFields(ObjectNode view, ObjectNode fields) {
        var target = view.has("fields") ? (ObjectNode) view.get("fields") : view.putObject("fields");
        for (var it = fields.fields(); it.hasNext(); ) {
            var entry = it.next();
            var existing = target.get(entry.getKey());
            if (existing == null) {
                target.set(entry.getKey(), entry.getValue().deepCopy());
                continue;
            }
            var merged = (ObjectNode) existing;
            for (var attrs = entry.getValue().fields(); attrs.hasNext(); ) {
                var attr = attrs.next();
                if (!merged.has(attr.getKey())) {
                    merged.set(attr.getKey(), attr.getValue());
                }
            }
        }
    }

    private static void mergeActions(ObjectNode view, ArrayNode actions) {
        var target = view.has("actions") ? (ArrayNode) view.get("actions") : view.putArray("actions");
        Set<String> keys = new HashSet<>();
        target.forEach(action -> keys.add(action.path("key").asText()));
        for (var action : actions) {
            if (keys.add(action.path("key").asText())) {
                target.add(action);
            }
        }
    }

    private static void putIfPresent(ObjectNode node, String key, Object value) {
        if (value != null) {
            node.set(key, mapper().valueToTree(value));
        }
    }

    private static ObjectMapper mapper() {
        return SchemaJson.mapper();
    }
}
