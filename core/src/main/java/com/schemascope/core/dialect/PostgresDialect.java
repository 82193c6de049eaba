package com.schemascope.core.dialect;

import com.schemascope.core.BackendKind;

/**
 * PostgreSQL catalog queries. A column counts as identity when it is declared
 * {@code GENERATED ... AS IDENTITY} or its default draws from a sequence ({@code serial}).
 */
public class PostgresDialect extends InformationSchemaDialect {

    static final String TABLES = """
            SELECT table_schema,
                   table_name
            FROM information_schema.tables
            WHERE table_type = 'BASE TABLE'
              AND table_schema = ?
            ORDER BY table_schema, table_name
            """;

    static final String COLUMNS = """
            SELECT c.column_name,
                   c.data_type,
                   c.is_nullable,
                   c.character_maximum_length,
                   c.numeric_precision,
                   c.numeric_scale,
                   CASE WHEN EXISTS (
                            SELECT 1
                            FROM information_schema.table_constraints tc
                            JOIN information_schema.key_column_usage kcu
                              ON tc.constraint_name = kcu.constraint_name
                             AND tc.table_schema = kcu.table_schema
                             AND tc.table_name = kcu.table_name
                            WHERE tc.constraint_type = 'PRIMARY KEY'
                              AND kcu.table_schema = c.table_schema
                              AND kcu.table_name = c.table_name
                              AND kcu.column_name = c.column_name)
                        THEN 1 ELSE 0 END AS is_primary_key,
                   CASE WHEN c.is_identity = 'YES' OR c.column_default LIKE 'nextval%'
                        THEN 1 ELSE 0 END AS is_identity,
                   COALESCE(c.column_default, '') AS column_default
            FROM information_schema.columns c
            WHERE c.table_schema = ?
              AND c.table_name = ?
            ORDER BY c.ordinal_position
            """;

    @Override
    public BackendKind kind() {
        return BackendKind.POSTGRES;
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
