package com.schemascope.cli;

import com.mongodb.client.MongoClient;
import com.schemascope.core.SchemaExtractionException;
import com.schemascope.core.dialect.Dialects;
import com.schemascope.core.extract.RelationalSchemaExtractor;
import com.schemascope.core.model.CollectionSchema;
import com.schemascope.core.model.DatabaseSchema;
import com.schemascope.core.model.SchemaSnapshot;
import com.schemascope.mongo.MongoCollectionExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

@Command(
        name = "extract",
        description = "Extract the schema of a database and write it as JSON",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_CONFIGURATION,
        exitCodeOnExecutionException = ExitCodes.EXTRACTION_FAILED
)
public class ExtractCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ExtractCommand.class);

    @Mixin
    ConnectionOptions connection;

    @Option(names = {"--output", "-o"}, defaultValue = "database_schema.json",
            description = "Output JSON file (default: database_schema.json)")
    File output;

    private final ConnectionFactory<Connection> jdbcConnections;
    private final ConnectionFactory<MongoClient> mongoConnections;
    private final SchemaWriter writer = new SchemaWriter();

    public ExtractCommand() {
        this(new JdbcConnectionFactory(), new MongoConnectionFactory());
    }

    ExtractCommand(ConnectionFactory<Connection> jdbcConnections, ConnectionFactory<MongoClient> mongoConnections) {
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

        printConfiguration(settings);

        SchemaSnapshot snapshot;
        try {
            snapshot = settings.kind.isRelational() ? extractTables(settings) : extractCollections(settings);
        } catch (ConnectionException e) {
            logger.error("Connection failed", e);
            System.err.println("Error connecting to the database: " + e.getMessage());
            return ExitCodes.CONNECTION_FAILED;
        } catch (SchemaExtractionException e) {
            logger.error("Extraction failed at stage {}", e.getStage(), e);
            System.err.println("Error extracting the schema: " + e.getMessage());
            return ExitCodes.EXTRACTION_FAILED;
        }

        try {
            writer.write(snapshot, output.toPath());
        } catch (IOException e) {
            logger.error("Writing {} failed", output, e);
            System.err.println("Error writing the JSON file: " + e.getMessage());
            return ExitCodes.OUTPUT_FAILED;
        }

        System.out.println("Schema written to " + output.getAbsolutePath());
        if (snapshot instanceof DatabaseSchema schema) {
            System.out.println("Tables processed: " + schema.tables().size());
        } else if (snapshot instanceof CollectionSchema schema) {
            System.out.println("Collections processed: " + schema.collections().size());
        }
        return ExitCodes.OK;
    }

    private DatabaseSchema extractTables(ConnectionSettings settings)
            throws ConnectionException, SchemaExtractionException {
        Connection conn = jdbcConnections.open(settings);
        System.out.println("Connected to " + settings.describe());
        try {
            return new RelationalSchemaExtractor(Dialects.forKind(settings.kind))
                    .extract(conn, settings.database, settings.effectiveSchema());
        } finally {
            try {
                conn.close();
            } catch (SQLException e) {
                logger.warn("Error closing connection to {}", settings.describe(), e);
            }
        }
    }

    private CollectionSchema extractCollections(ConnectionSettings settings)
            throws ConnectionException, SchemaExtractionException {
        try (MongoClient client = mongoConnections.open(settings)) {
            System.out.println("Connected to " + settings.describe());
            return new MongoCollectionExtractor(client.getDatabase(settings.database)).extract();
        }
    }

    private void printConfiguration(ConnectionSettings settings) {
        System.out.println("Configuration:");
        System.out.println("  Database type: " + settings.kind);
        System.out.println("  Server: " + settings.server + ":" + settings.effectivePort());
        System.out.println("  Database: " + settings.database);
        if (settings.kind.isRelational()) {
            System.out.println("  Schema: " + settings.effectiveSchema());
        }
        System.out.println("  Output file: " + output);
    }
}
