package com.schemascope.core.dialect;

/**
 * Validation for schema and table names that end up inside query text as string literals.
 */
public final class CatalogNames {
    private CatalogNames() {}

    /**
     * Returns {@code name} unchanged if it can be embedded between single quotes without escaping.
     *
     * @throws IllegalArgumentException if the name is empty or contains a quote, a backslash or a
     *                                  control character
     */
    public static String requireLiteralSafe(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Catalog name must not be empty");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '\'' || c == '"' || c == '\\' || Character.isISOControl(c)) {
                throw new IllegalArgumentException("Catalog name contains a character that cannot be embedded in a query: " + name);
            }
        }
        return name;
    }
}
