package com.schemascope.core.dialect;

/**
 * A base table found by the table-listing query.
 */
public record TableRef(String schema, String name) {

    public String qualifiedName() {
        return schema + "." + name;
    }
}
