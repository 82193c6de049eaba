package com.schemascope.cli;

import com.mongodb.client.MongoClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

@Command(
        name = "ping",
        description = "Check that the database is reachable with the given credentials",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_CONFIGURATION,
        exitCodeOnExecutionException = ExitCodes.CONNECTION_FAILED
)
public class PingCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(PingCommand.class);

    @Mixin
    ConnectionOptions connection;

    private final ConnectionFactory<Connection> jdbcConnections;
    private final ConnectionFactory<MongoClient> mongoConnections;

    public PingCommand() {
        this(new JdbcConnectionFactory(), new MongoConnectionFactory());
    }

    PingCommand(ConnectionFactory<Connection> jdbcConnections, ConnectionFactory<MongoClient> mongoConnections) {
        this.jdbcConnections = jdbcConnections;
        this.mongoConnections = mongoConnections;
    }

    @Override
    public Integer call() {
        ConnectionSettings settings = connection.toSettings();
        try {
            settings.validate();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return ExitCodes.INVALID_CONFIGURATION;
        }

        try {
            if (settings.kind.isRelational()) {
                Connection conn = jdbcConnections.open(settings);
                try {
                    conn.close();
                } catch (SQLException e) {
                    logger.warn("Error closing connection to {}", settings.describe(), e);
                }
            } else {
                mongoConnections.open(settings).close();
            }
        } catch (ConnectionException e) {
            logger.error("Ping failed", e);
            System.err.println("Error connecting to the database: " + e.getMessage());
            return ExitCodes.CONNECTION_FAILED;
        }

        System.out.println("Connection to " + settings.describe() + " succeeded");
        return ExitCodes.OK;
    }
}
