package com.schemacrud.view;

/**
 * Decides whether the current caller holds a permission key declared by a
 * schema ({@code permissions.*} or an action's {@code permission}).
 * Authentication lives outside the engine; the host application supplies
 * the real implementation.
 */
@FunctionalInterface
public interface PermissionChecker {

    boolean hasPermission(String permission);

    static PermissionChecker allowAll() {
        return permission -> true;
    }
}
