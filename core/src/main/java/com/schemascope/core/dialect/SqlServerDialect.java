package com.schemascope.core.dialect;

import com.schemascope.core.BackendKind;

public class SqlServerDialect extends InformationSchemaDialect {

    static final String TABLES = """
            SELECT TABLE_SCHEMA,
                   TABLE_NAME
            FROM INFORMATION_SCHEMA.TABLES
            WHERE TABLE_TYPE = 'BASE TABLE'
              AND TABLE_SCHEMA = ?
            ORDER BY TABLE_SCHEMA, TABLE_NAME
            """;

    static final String COLUMNS = """
            SELECT c.COLUMN_NAME,
                   c.DATA_TYPE,
                   c.IS_NULLABLE,
                   c.CHARACTER_MAXIMUM_LENGTH,
                   c.NUMERIC_PRECISION,
                   c.NUMERIC_SCALE,
                   CASE WHEN pk.COLUMN_NAME IS NOT NULL THEN 1 ELSE 0 END AS IS_PRIMARY_KEY,
                   COLUMNPROPERTY(OBJECT_ID(QUOTENAME(c.TABLE_SCHEMA) + '.' + QUOTENAME(c.TABLE_NAME)),
                                  c.COLUMN_NAME, 'IsIdentity') AS IS_IDENTITY,
                   COALESCE(c.COLUMN_DEFAULT, '') AS COLUMN_DEFAULT
            FROM INFORMATION_SCHEMA.COLUMNS c
            LEFT JOIN (
                SELECT ku.TABLE_SCHEMA,
                       ku.TABLE_NAME,
                       ku.COLUMN_NAME
                FROM INFORMATION_SCHEMA.TABLE_CONSTRAINTS tc
                JOIN INFORMATION_SCHEMA.KEY_COLUMN_USAGE ku
                  ON tc.CONSTRAINT_TYPE = 'PRIMARY KEY'
                 AND tc.CONSTRAINT_SCHEMA = ku.CONSTRAINT_SCHEMA
                 AND tc.CONSTRAINT_NAME = ku.CONSTRAINT_NAME
            ) pk
              ON c.TABLE_SCHEMA = pk.TABLE_SCHEMA
             AND c.TABLE_NAME = pk.TABLE_NAME
             AND c.COLUMN_NAME = pk.COLUMN_NAME
            WHERE c.TABLE_SCHEMA = ?
              AND c.TABLE_NAME = ?
            ORDER BY c.ORDINAL_POSITION
            """;

    @Override
    public BackendKind kind() {
        return BackendKind.SQLSERVER;
    }

    @Override
    public CatalogQuery tableQuery(String defaultSchema) {
        return CatalogQuery.of(TABLES, defaultSchema);
    }

    @Override
    public CatalogQuery columnQuery(String schema, String table) {
        return CatalogQuery.of(COLUMNS, schema, table);
    }
}
