package com.schemascope.core.keys;

import com.schemascope.core.dialect.CatalogQuery;
import com.schemascope.core.dialect.ColumnRows;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Strategy backed by a single catalog query returning one column name per row.
 */
abstract class CatalogKeyStrategy implements PrimaryKeyStrategy {

    protected abstract CatalogQuery query(String schema, String table);

    @Override
    public Set<String> primaryKeyColumns(Connection conn, String schema, String table) throws SQLException {
        CatalogQuery query;
        try {
            query = query(schema, table);
        } catch (IllegalArgumentException e) {
            throw new SQLException(e.getMessage(), e);
        }

        Set<String> columns = new LinkedHashSet<>();
        try (PreparedStatement stmt = query.prepare(conn);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                columns.add(ColumnRows.requiredText(rs, 1));
            }
        }
        return Collections.unmodifiableSet(columns);
    }
}
