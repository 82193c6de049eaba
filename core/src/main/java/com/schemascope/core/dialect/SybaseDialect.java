package com.schemascope.core.dialect;

import com.schemascope.core.BackendKind;
import com.schemascope.core.keys.PrimaryKeyResolver;
import com.schemascope.core.keys.SybaseIndexKeyStrategy;
import com.schemascope.core.keys.SybaseSysKeysStrategy;
import com.schemascope.core.model.Column;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static com.schemascope.core.dialect.ColumnRows.*;

/**
 * Sybase ASE, read from the legacy system tables. Owner and table names are embedded in the query
 * text as literals, so they pass through {@link CatalogNames#requireLiteralSafe(String)} first.
 *
 * <p>The column query reports a constant {@code 0} for primary-key membership; the real answer
 * comes from {@link #primaryKeyResolver()}.
 */
public class SybaseDialect implements Dialect {
    static final int COLUMN_ROW_WIDTH = 8;

    /** {@code syscolumns.status} bit for columns that allow nulls. */
    static final long STATUS_NULLABLE = 0x08;
    /** {@code syscolumns.status} bit for identity columns. */
    static final long STATUS_IDENTITY = 0x80;

    private static final String TABLES = """
            SELECT user_name(uid) AS schema_name,
                   name AS table_name
            FROM sysobjects
            WHERE type = 'U'
              AND user_name(uid) = '%s'
            ORDER BY schema_name, table_name
            """;

    static final String COLUMNS = """
            SELECT c.name AS column_name,
                   t.name AS data_type,
                   CASE WHEN t.name IN ('char', 'varchar', 'binary', 'varbinary') THEN c.length
                        WHEN t.name IN ('nchar', 'nvarchar') THEN c.length / @@ncharsize
                        WHEN t.name IN ('unichar', 'univarchar') THEN c.length / @@unicharsize
                        ELSE NULL END AS max_length,
                   c.prec AS numeric_precision,
                   c.scale AS numeric_scale,
                   c.status AS status,
                   ISNULL(OBJECT_NAME(c.cdefault), '') AS default_value,
                   0 AS is_primary_key
            FROM syscolumns c
            JOIN systypes t ON c.usertype = t.usertype
            WHERE c.id = object_id('%s.%s')
            ORDER BY c.colid
            """;

    private final PrimaryKeyResolver primaryKeyResolver = new PrimaryKeyResolver(List.of(
            new SybaseIndexKeyStrategy(),
            new SybaseSysKeysStrategy()));

    @Override
    public BackendKind kind() {
        return BackendKind.SYBASE;
    }

    @Override
    public CatalogQuery tableQuery(String defaultSchema) {
        return CatalogQuery.of(TABLES.formatted(CatalogNames.requireLiteralSafe(defaultSchema)));
    }

    @Override
    public CatalogQuery columnQuery(String schema, String table) {
        return CatalogQuery.of(COLUMNS.formatted(
                CatalogNames.requireLiteralSafe(schema),
                CatalogNames.requireLiteralSafe(table)));
    }

    @Override
    public Column decodeColumn(ResultSet rs) throws SQLException {
        requireColumnCount(rs, COLUMN_ROW_WIDTH);
        return new Column(
                requiredText(rs, 1),
                requiredText(rs, 2),
                bitSet(rs, 6, STATUS_NULLABLE) ? Column.NULLABLE : Column.NOT_NULLABLE,
                nullableLong(rs, 3),
                nullableInt(rs, 4),
                nullableInt(rs, 5),
                flag(rs, 8),
                bitSet(rs, 6, STATUS_IDENTITY),
                text(rs, 7)
        );
    }

    @Override
    public Optional<PrimaryKeyResolver> primaryKeyResolver() {
        return Optional.of(primaryKeyResolver);
    }
}
