package com.schemascope.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoDatabase;
import com.schemascope.core.ExtractionStage;
import com.schemascope.core.SchemaAssembler;
import com.schemascope.core.SchemaExtractionException;
import com.schemascope.core.model.CollectionSchema;
import com.schemascope.core.model.DocumentCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class MongoCollectionExtractor {
    private static final Logger logger = LoggerFactory.getLogger(MongoCollectionExtractor.class);

    private final MongoDatabase database;

    /**
     * @param database database whose collections are listed
     */
    public MongoCollectionExtractor(MongoDatabase database) {
        this.database = database;
    }

    /**
     * Lists the collections of the database in the order the server returns them.
     */
    public CollectionSchema extract() throws SchemaExtractionException {
        String databaseName = database.getName();
        logger.info("Extracting collections of MongoDB database {}", databaseName);

        List<String> names;
        try {
            names = database.listCollectionNames().into(new ArrayList<>());
        } catch (MongoException e) {
            throw new SchemaExtractionException(ExtractionStage.LIST_COLLECTIONS, "database " + databaseName, e);
        }

        List<DocumentCollection> collections = new ArrayList<>(names.size());
        for (String name : names) {
            collections.add(DocumentCollection.named(name, databaseName));
            logger.info("Processed collection {}", name);
        }

        return SchemaAssembler.document(databaseName, collections);
    }
}
