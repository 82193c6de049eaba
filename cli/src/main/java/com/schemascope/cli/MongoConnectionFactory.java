package com.schemascope.cli;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public class MongoConnectionFactory implements ConnectionFactory<MongoClient> {
    private static final Logger logger = LoggerFactory.getLogger(MongoConnectionFactory.class);

    static String connectionString(ConnectionSettings settings) {
        return "mongodb://%s:%s@%s:%d/%s".formatted(
                encode(settings.user),
                encode(settings.password),
                settings.server,
                settings.effectivePort(),
                settings.database);
    }

    @Override
    public MongoClient open(ConnectionSettings settings) throws ConnectionException {
        logger.info("Connecting to mongodb at {}:{}", settings.server, settings.effectivePort());

        MongoClient client;
        try {
            client = MongoClients.create(connectionString(settings));
        } catch (MongoException | IllegalArgumentException e) {
            throw new ConnectionException("Could not connect to " + settings.describe()
                    + ": " + e.getMessage(), e);
        }

        try {
            client.getDatabase(settings.database).runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            client.close();
            throw new ConnectionException("Connection to " + settings.describe()
                    + " did not answer a ping: " + e.getMessage(), e);
        }
        return client;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
