package com.schemacrud.view;

import com.schemacrud.metadata.ActionDefinition;
import com.schemacrud.metadata.ActionType;
import com.schemacrud.metadata.FieldDefinition;
import com.schemacrud.metadata.ModelNames;
import com.schemacrud.metadata.SchemaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Synthesizes the default create/edit/delete actions, fills in toggle
 * confirmations and filters actions by scope and permission.
 */
@Component
public class ActionManager {

    private static final Logger log = LoggerFactory.getLogger(ActionManager.class);

    public static final String CREATE_ACTION = "create_action";
    public static final String EDIT_ACTION = "edit_action";
    public static final String DELETE_ACTION = "delete_action";

    static final String TOGGLE_CONFIRM = "CRUD6.TOGGLE_CONFIRM";
    static final String DELETE_CONFIRM = "CRUD6.DELETE_CONFIRM";

    private final PermissionChecker permissionChecker;

    /** Uses the application's {@link PermissionChecker} bean, or allows everything when none is declared. */
    @Autowired
    public ActionManager(ObjectProvider<PermissionChecker> permissionCheckers) {
        this(permissionCheckers.getIfAvailable(PermissionChecker::allowAll));
    }

    public ActionManager(PermissionChecker permissionChecker) {
        this.permissionChecker = permissionChecker;
    }

    /** Defaults and toggle confirmations applied once, before the schema is cached. */
    public SchemaDocument prepare(SchemaDocument schema) {
        var actions = normalizeToggles(synthesizeDefaults(schema), schema);
        return schema.withActions(actions);
    }

    /**
     * The schema's actions with the default actions prepended. A default is
     * added only when its permission is declared and no action already uses
     * its key; {@code default_actions: false} turns them off entirely.
     */
    public List<ActionDefinition> synthesizeDefaults(SchemaDocument schema) {
        if (!schema.defaultActionsEnabled()) {
            return schema.actions();
        }
        Set<String> existing = schema.actions().stream()
            .map(ActionDefinition::key)
            .collect(Collectors.toSet());

        var defaults = new ArrayList<ActionDefinition>();
        schema.permission("create")
            .filter(p -> !existing.contains(CREATE_ACTION))
            .ifPresent(p -> defaults.add(new ActionDefinition(
                CREATE_ACTION, "CRUD6.CREATE", "plus", ActionType.FORM, "primary", List.of("list"), p,
                null, null, null, null, null, Map.of("type", "form", "title", "CRUD6.CREATE"))));
        schema.permission("update")
            .filter(p -> !existing.contains(EDIT_ACTION))
            .ifPresent(p -> defaults.add(new ActionDefinition(
                EDIT_ACTION, "CRUD6.EDIT", "pen-to-square", ActionType.FORM, "primary", List.of("detail"), p,
                null, null, null, null, null, Map.of("type", "form", "title", "CRUD6.EDIT"))));
        schema.permission("delete")
            .filter(p -> !existing.contains(DELETE_ACTION))
            .ifPresent(p -> defaults.add(new ActionDefinition(
                DELETE_ACTION, "CRUD6.DELETE", "trash", ActionType.DELETE, "danger", List.of("detail"), p,
                null, null, null, DELETE_CONFIRM, null,
                Map.of("type", "confirm", "buttons", "yes_no", "warning", "WARNING_CANNOT_UNDONE"))));

        if (defaults.isEmpty()) {
            return schema.actions();
        }
        log.debug("Adding default actions {} to '{}'",
            defaults.stream().map(ActionDefinition::key).toList(), schema.model());

        var combined = new ArrayList<ActionDefinition>(defaults);
        combined.addAll(schema.actions());
        return List.copyOf(combined);
    }

    /**
     * Toggle actions ({@code field_update} with {@code toggle: true}) always
     * confirm before changing a value. Explicit confirm text, label and modal
     * settings are kept.
     */
    public List<ActionDefinition> normalizeToggles(List<ActionDefinition> actions, SchemaDocument schema) {
        return actions.stream()
            .map(action -> action.isToggleAction() && action.field() != null
                ? normalizeToggle(action, schema)
                : action)
            .toList();
    }

    private ActionDefinition normalizeToggle(ActionDefinition action, SchemaDocument schema) {
        var fieldName = action.field();
        var fieldLabel = action.fieldLabel() != null
            ? action.fieldLabel()
            : schema.field(fieldName)
                .map(FieldDefinition::label)
                .orElse(ModelNames.humanize(fieldName));
        var confirm = action.confirm() != null ? action.confirm() : TOGGLE_CONFIRM;

        Map<String, Object> modal;
        if (action.modalConfig() == null) {
            modal = Map.of("type", "confirm", "buttons", "yes_no");
        } else {
            modal = new LinkedHashMap<>(action.modalConfig());
            modal.putIfAbsent("type", "confirm");
        }
        return action.withConfirmation(confirm, fieldLabel, modal);
    }

    /** Actions whose scope contains {@code scope}; an action without a scope is never returned. */
    public List<ActionDefinition> filterByScope(List<ActionDefinition> actions, String scope) {
        return actions.stream()
            .filter(action -> {
                if (action.scope() == null || action.scope().isEmpty()) {
                    log.debug("Excluding action '{}' without scope", action.key());
                    return false;
                }
                return action.hasScope(scope);
            })
            .toList();
    }

    /** Actions to render in {@code scope} for the current caller. */
    public List<ActionDefinition> actionsFor(SchemaDocument schema, String scope) {
        return filterByScope(schema.actions(), scope).stream()
            .filter(action -> action.permission() == null || permissionChecker.hasPermission(action.permission()))
            .toList();
    }
}
