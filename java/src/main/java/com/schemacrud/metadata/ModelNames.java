package com.schemacrud.metadata;

/**
 * Naming conventions for deriving display names from model and field names
 * when a schema does not spell them out.
 */
public final class ModelNames {

    private ModelNames() {}

    /** "roles" → "Roles" */
    public static String capitalize(String name) {
        if (name == null || name.isEmpty()) return name;
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /** "roles" → "Role", "order_details" → "Order_detail" */
    public static String pascalSingular(String name) {
        return capitalize(singularize(name));
    }

    /** Field name as a label: "first_name" → "First name" */
    public static String humanize(String fieldName) {
        return capitalize(fieldName.replace('_', ' '));
    }

    /**
     * Naive singularize covering the usual table names:
     * "users" → "user", "categories" → "category", "addresses" → "address",
     * "Permissions" → "Permission"
     */
    public static String singularize(String name) {
        if (name.endsWith("ies")) {
            // categories → category
            return name.substring(0, name.length() - 3) + "y";
        }
        if (name.endsWith("ses") || name.endsWith("zes") || name.endsWith("xes")) {
            // addresses → address (but not "prices" which ends in "ces")
            return name.substring(0, name.length() - 2);
        }
        if (name.endsWith("s") && !name.endsWith("ss")) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }
}
