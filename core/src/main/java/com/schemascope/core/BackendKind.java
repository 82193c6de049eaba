package com.schemascope.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of database backends a snapshot can be taken from.
 * The tag is what appears as {@code dbType} in the JSON output.
 */
public enum BackendKind {
    SQLSERVER("sqlserver", 1433, "dbo"),
    SYBASE("sybase", 5000, "dbo"),
    MYSQL("mysql", 3306, null),
    POSTGRES("postgres", 5432, "public"),
    MONGODB("mongodb", 27017, null);

    private final String tag;
    private final int defaultPort;
    private final String defaultSchema;

    BackendKind(String tag, int defaultPort, String defaultSchema) {
        this.tag = tag;
        this.defaultPort = defaultPort;
        this.defaultSchema = defaultSchema;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /**
     * Schema used when the operator does not name one. MySQL has no schema separate from the
     * database, so its default is the database name itself.
     */
    public String defaultSchema(String databaseName) {
        return this == MYSQL ? databaseName : defaultSchema;
    }

    public boolean isRelational() {
        return this != MONGODB;
    }

    @JsonCreator
    public static BackendKind fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (BackendKind kind : values()) {
                if (kind.tag.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown database type: " + tag
                + " (valid types: sqlserver, sybase, mysql, postgres, mongodb)");
    }

    @Override
    public String toString() {
        return tag;
    }
}
