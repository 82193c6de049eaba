package com.schemascope.core.dialect;

import com.schemascope.core.BackendKind;
import com.schemascope.core.model.Column;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

import static com.schemascope.core.dialect.ColumnRows.*;

/**
 * MySQL keeps one schema per database, so tables are listed for the connected database and the
 * schema argument is ignored. Key and auto-increment information comes back as the raw
 * {@code COLUMN_KEY} and {@code EXTRA} text and is interpreted here.
 */
public class MySqlDialect implements Dialect {
    static final int COLUMN_ROW_WIDTH = 9;

    static final String TABLES = """
            SELECT TABLE_SCHEMA,
                   TABLE_NAME
            FROM INFORMATION_SCHEMA.TABLES
            WHERE TABLE_TYPE = 'BASE TABLE'
              AND TABLE_SCHEMA = DATABASE()
            ORDER BY TABLE_SCHEMA, TABLE_NAME
            """;

    static final String COLUMNS = """
            SELECT COLUMN_NAME,
                   DATA_TYPE,
                   IS_NULLABLE,
                   CHARACTER_MAXIMUM_LENGTH,
                   NUMERIC_PRECISION,
                   NUMERIC_SCALE,
                   COLUMN_KEY,
                   EXTRA,
                   COALESCE(COLUMN_DEFAULT, '') AS COLUMN_DEFAULT
            FROM INFORMATION_SCHEMA.COLUMNS
            WHERE TABLE_SCHEMA = ?
              AND TABLE_NAME = ?
            ORDER BY ORDINAL_POSITION
            """;

    @Override
    public BackendKind kind() {
        return BackendKind.MYSQL;
    }

    @Override
    public CatalogQuery tableQuery(String defaultSchema) {
        return CatalogQuery.of(TABLES);
    }

    @Override
    public CatalogQuery columnQuery(String schema, String table) {
        return CatalogQuery.of(COLUMNS, schema, table);
    }

    @Override
    public Column decodeColumn(ResultSet rs) throws SQLException {
        requireColumnCount(rs, COLUMN_ROW_WIDTH);
        return new Column(
                requiredText(rs, 1),
                requiredText(rs, 2),
                nullability(rs, 3),
                nullableLong(rs, 4),
                nullableInt(rs, 5),
                nullableInt(rs, 6),
                "PRI".equalsIgnoreCase(text(rs, 7).trim()),
                text(rs, 8).toLowerCase(Locale.ROOT).contains("auto_increment"),
                text(rs, 9)
        );
    }
}
