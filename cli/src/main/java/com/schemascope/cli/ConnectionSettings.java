package com.schemascope.cli;

import com.schemascope.core.BackendKind;

/**
 * Where and as whom to connect. A port of 0 and a null schema mean "use the backend's default".
 */
public class ConnectionSettings {
    public BackendKind kind;
    public String server = "localhost";
    public int port;
    public String user;
    public String password;
    public String database;
    public String schema;
    public String sslMode = "disable";

    /**
     * @throws IllegalArgumentException naming the first missing or invalid setting
     */
    public void validate() {
        if (kind == null) {
            throw new IllegalArgumentException("database type is required");
        }
        requireNonBlank(server, "server");
        requireNonBlank(user, "user");
        requireNonBlank(password, "password");
        requireNonBlank(database, "database");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        if (schema != null && schema.isBlank()) {
            throw new IllegalArgumentException("schema must not be blank");
        }
    }

    public int effectivePort() {
        return port == 0 ? kind.defaultPort() : port;
    }

    public String effectiveSchema() {
        return schema != null ? schema : kind.defaultSchema(database);
    }

    /**
     * Target description for messages; never includes credentials.
     */
    public String describe() {
        return kind + " at " + server + ":" + effectivePort() + "/" + database;
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
