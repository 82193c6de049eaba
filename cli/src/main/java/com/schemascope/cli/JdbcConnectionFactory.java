package com.schemascope.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class JdbcConnectionFactory implements ConnectionFactory<Connection> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcConnectionFactory.class);

    static String jdbcUrl(ConnectionSettings settings) {
        String host = settings.server;
        int port = settings.effectivePort();
        String db = settings.database;
        return switch (settings.kind) {
            case SQLSERVER -> "jdbc:sqlserver://%s:%d;databaseName=%s;trustServerCertificate=true".formatted(host, port, db);
            case SYBASE -> "jdbc:jtds:sybase://%s:%d/%s;charset=utf8".formatted(host, port, db);
            case MYSQL -> "jdbc:mysql://%s:%d/%s".formatted(host, port, db);
            case POSTGRES -> "jdbc:postgresql://%s:%d/%s?sslmode=%s".formatted(host, port, db, settings.sslMode);
            case MONGODB -> throw new IllegalArgumentException("mongodb is not reachable through JDBC");
        };
    }

    @Override
    public Connection open(ConnectionSettings settings) throws ConnectionException {
        String url = jdbcUrl(settings);
        logger.info("Connecting to {} at {}:{}", settings.kind, settings.server, settings.effectivePort());

        Connection conn;
        try {
            conn = DriverManager.getConnection(url, settings.user, settings.password);
        } catch (SQLException e) {
            throw new ConnectionException("Could not connect to " + settings.describe() + ": " + e.getMessage(), e);
        }

        try {
            ping(conn);
        } catch (SQLException e) {
            ConnectionException failure = new ConnectionException(
                    "Connection to " + settings.describe() + " did not answer a ping: " + e.getMessage(), e);
            try {
                conn.close();
            } catch (SQLException closeError) {
                failure.addSuppressed(closeError);
            }
            throw failure;
        }
        return conn;
    }

    // Not every driver implements Connection.isValid, so ping with a trivial query.
    private static void ping(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("SELECT 1");
        }
    }
}
