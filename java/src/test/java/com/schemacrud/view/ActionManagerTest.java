package com.schemacrud.view;

import com.schemacrud.metadata.ActionDefinition;
import com.schemacrud.metadata.ActionType;
import com.schemacrud.metadata.SchemaDocument;
import com.schemacrud.metadata.SchemaJson;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionManagerTest {

    private final ActionManager manager = new ActionManager(PermissionChecker.allowAll());

    private static SchemaDocument schema(String json) throws Exception {
        return SchemaJson.mapper().readValue(json, SchemaDocument.class);
    }

    private static ActionDefinition action(String key, List<String> scope, String permission) {
        return new ActionDefinition(key, null, null, ActionType.API_CALL, null, scope, permission,
            null, null, null, null, null, null);
    }

    private static List<String> keys(List<ActionDefinition> actions) {
        return actions.stream().map(ActionDefinition::key).toList();
    }

    // -----------------------------------------------------------------------
    // synthesizeDefaults
    // -----------------------------------------------------------------------

    @Test
    void synthesizeDefaults_allThreeBeforeCustom() throws Exception {
        var schema = schema("""
            {"model": "roles", "table": "roles", "fields": {"name": {}},
             "permissions": {"create": "create_role", "update": "update_role", "delete": "delete_role"},
             "actions": [{"key": "clone", "type": "api_call", "scope": ["detail"]}]}
            """);

        var actions = manager.synthesizeDefaults(schema);

        assertEquals(List.of("create_action", "edit_action", "delete_action", "clone"), keys(actions));
    }

    @Test
    void synthesizeDefaults_shapes() throws Exception {
        var schema = schema("""
            {"model": "roles", "table": "roles", "fields": {"name": {}},
             "permissions": {"create": "create_role", "update": "update_role", "delete": "delete_role"}}
            """);

        var actions = manager.synthesizeDefaults(schema);
        var create = actions.get(0);
        var edit = actions.get(1);
        var delete = actions.get(2);

        assertEquals("plus", create.icon());
        assertEquals(List.of("list"), create.scope());
        assertEquals("create_role", create.permission());
        assertEquals(ActionType.FORM, create.type());

        assertEquals("pen-to-square", edit.icon());
        assertEquals(List.of("detail"), edit.scope());
        assertEquals("update_role", edit.permission());

        assertEquals("trash", delete.icon());
        assertEquals(ActionType.DELETE, delete.type());
        assertEquals("CRUD6.DELETE_CONFIRM", delete.confirm());
        assertEquals(Map.of("type", "confirm", "buttons", "yes_no", "warning", "WARNING_CANNOT_UNDONE"),
            delete.modalConfig());
    }

    @Test
    void synthesizeDefaults_customKeyWins() throws Exception {
        var schema = schema("""
            {"model": "roles", "table": "roles", "fields": {"name": {}},
             "permissions": {"create": "create_role", "delete": "delete_role"},
             "actions": [{"key": "delete_action", "label": "Remove", "type": "delete", "scope": ["list"]}]}
            """);

        var actions = manager.synthesizeDefaults(schema);

        assertEquals(List.of("create_action", "delete_action"), keys(actions));
        assertEquals("Remove", actions.get(1).label());
    }

    @Test
    void synthesizeDefaults_noPermissionsNoDefaults() throws Exception {
        var schema = schema("""
            {"model": "logs", "table": "logs", "fields": {"name": {}}}
            """);

        assertTrue(manager.synthesizeDefaults(schema).isEmpty());
    }

    @Test
    void synthesizeDefaults_disabled() throws Exception {
        var schema = schema("""
            {"model": "roles", "table": "roles", "fields": {"name": {}}, "default_actions": false,
             "permissions": {"create": "create_role"}}
            """);

        assertTrue(manager.synthesizeDefaults(schema).isEmpty());
    }

    // -----------------------------------------------------------------------
    // normalizeToggles
    // -----------------------------------------------------------------------

    @Test
    void normalizeToggles_fillsConfirmation() throws Exception {
        var schema = schema("""
            {"model": "users", "table": "users",
             "fields": {"flag_verified": {"type": "boolean"}},
             "actions": [{"key": "verify", "type": "field_update", "field": "flag_verified",
                          "toggle": true, "scope": ["detail"]}]}
            """);

        var toggle = manager.normalizeToggles(schema.actions(), schema).get(0);

        assertEquals("CRUD6.TOGGLE_CONFIRM", toggle.confirm());
        assertEquals("Flag verified", toggle.fieldLabel(), "humanized field name without a label");
        assertEquals(Map.of("type", "confirm", "buttons", "yes_no"), toggle.modalConfig());
    }

    @Test
    void normalizeToggles_keepsExplicitValues() throws Exception {
        var schema = schema("""
            {"model": "users", "table": "users",
             "fields": {"flag_enabled": {"type": "boolean", "label": "Enabled"}},
             "actions": [{"key": "toggle", "type": "field_update", "field": "flag_enabled", "toggle": true,
                          "scope": ["detail"], "confirm": "Really?", "modal_config": {"buttons": "ok_cancel"}}]}
            """);

        var toggle = manager.normalizeToggles(schema.actions(), schema).get(0);

        assertEquals("Really?", toggle.confirm());
        assertEquals("Enabled", toggle.fieldLabel());
        assertEquals(Map.of("type", "confirm", "buttons", "ok_cancel"), toggle.modalConfig());
    }

    @Test
    void normalizeToggles_leavesOtherActions() throws Exception {
        var schema = schema("""
            {"model": "users", "table": "users", "fields": {"flag_enabled": {"type": "boolean"}},
             "actions": [{"key": "set", "type": "field_update", "field": "flag_enabled", "value": true,
                          "scope": ["detail"]}]}
            """);

        var action = manager.normalizeToggles(schema.actions(), schema).get(0);

        assertNull(action.confirm());
        assertNull(action.modalConfig());
    }

    // -----------------------------------------------------------------------
    // filterByScope / actionsFor
    // -----------------------------------------------------------------------

    @Test
    void filterByScope_scopelessExcluded() {
        var actions = List.of(
            action("a", List.of("list"), null),
            action("b", null, null),
            action("c", List.of(), null),
            action("d", List.of("list", "detail"), null));

        assertEquals(List.of("a", "d"), keys(manager.filterByScope(actions, "list")));
        assertEquals(List.of("d"), keys(manager.filterByScope(actions, "detail")));
    }

    @Test
    void actionsFor_permissionChecked() throws Exception {
        var schema = schema("""
            {"model": "roles", "table": "roles", "fields": {"name": {}},
             "actions": [
               {"key": "open", "scope": ["list"]},
               {"key": "export", "scope": ["list"], "permission": "export_roles"},
               {"key": "purge", "scope": ["list"], "permission": "purge_roles"}]}
            """);
        var restricted = new ActionManager(permission -> permission.equals("export_roles"));

        assertEquals(List.of("open", "export"), keys(restricted.actionsFor(schema, "list")));
    }

    @Test
    void permissionCheckerBean_used() throws Exception {
        var schema = schema("""
            {"model": "roles", "table": "roles", "fields": {"name": {}},
             "actions": [{"key": "purge", "scope": ["list"], "permission": "purge_roles"}]}
            """);
        var beans = new DefaultListableBeanFactory();
        beans.registerSingleton("denyAll", (PermissionChecker) permission -> false);

        var fromBean = new ActionManager(beans.getBeanProvider(PermissionChecker.class));

        assertTrue(fromBean.actionsFor(schema, "list").isEmpty());
    }

    @Test
    void noPermissionCheckerBean_allowsAll() throws Exception {
        var schema = schema("""
            {"model": "roles", "table": "roles", "fields": {"name": {}},
             "actions": [{"key": "purge", "scope": ["list"], "permission": "purge_roles"}]}
            """);

        var fallback = new ActionManager(new DefaultListableBeanFactory().getBeanProvider(PermissionChecker.class));

        assertEquals(List.of("purge"), keys(fallback.actionsFor(schema, "list")));
    }

    @Test
    void prepare_appliesDefaultsAndToggles() throws Exception {
        var schema = schema("""
            {"model": "users", "table": "users", "fields": {"flag_enabled": {"type": "boolean"}},
             "permissions": {"update": "update_user"},
             "actions": [{"key": "toggle", "type": "field_update", "field": "flag_enabled", "toggle": true,
                          "scope": ["detail"]}]}
            """);

        var prepared = manager.prepare(schema);

        assertEquals(List.of("edit_action", "toggle"), keys(prepared.actions()));
        assertEquals("CRUD6.TOGGLE_CONFIRM", prepared.actions().get(1).confirm());
    }
}
