package com.schemacrud.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A row or page action declared by a schema (or synthesized from its
 * permissions). {@code scope} lists where it may render; an action with no
 * scope renders nowhere.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionDefinition(
    String key,
    String label,
    String icon,
    ActionType type,
    String style,
    List<String> scope,
    String permission,

    // field_update
    String field,
    Boolean toggle,
    Object value,

    String confirm,
    @JsonProperty("field_label") String fieldLabel,
    @JsonProperty("modal_config") Map<String, Object> modalConfig
) {
    public ActionDefinition {
        scope = scope != null ? List.copyOf(scope) : null;
        modalConfig = Frozen.map(modalConfig);
    }

    public boolean hasScope(String requested) {
        return scope != null && scope.contains(requested);
    }

    @JsonIgnore
    public boolean isToggleAction() {
        return type == ActionType.FIELD_UPDATE && Boolean.TRUE.equals(toggle);
    }

    public ActionDefinition withConfirmation(String confirm, String fieldLabel, Map<String, Object> modalConfig) {
        return new ActionDefinition(key, label, icon, type, style, scope, permission,
            field, toggle, value, confirm, fieldLabel, modalConfig);
    }
}
