package com.schemascope.core;

import com.schemascope.core.model.CollectionSchema;
import com.schemascope.core.model.DatabaseSchema;
import com.schemascope.core.model.DocumentCollection;
import com.schemascope.core.model.Table;

import java.util.List;

/**
 * Wraps extracted tables or collections into the top-level snapshot records.
 */
public final class SchemaAssembler {
    private SchemaAssembler() {}

    public static DatabaseSchema relational(String databaseName, BackendKind kind,
                                            String defaultSchema, List<Table> tables) {
        if (!kind.isRelational()) {
            throw new IllegalArgumentException(kind + " is not a relational backend");
        }
        return new DatabaseSchema(databaseName, kind, defaultSchema, tables);
    }

    public static CollectionSchema document(String databaseName, List<DocumentCollection> collections) {
        return new CollectionSchema(databaseName, BackendKind.MONGODB, collections);
    }
}
