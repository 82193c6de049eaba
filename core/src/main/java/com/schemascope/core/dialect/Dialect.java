package com.schemascope.core.dialect;

import com.schemascope.core.BackendKind;
import com.schemascope.core.keys.PrimaryKeyResolver;
import com.schemascope.core.model.Column;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Everything the relational extractor needs to know about one backend's catalog: how to list base
 * tables, how to list the columns of one table, and how to turn a catalog row into a
 * {@link Column}.
 *
 * <p>Implementations are stateless. Decoders read the current row of the result set positionally
 * and never advance it.
 */
public interface Dialect {

    BackendKind kind();

    /**
     * Query listing base tables as {@code (schema, name)} rows ordered by schema and name.
     *
     * @param defaultSchema schema selected for the run; dialects scoped to the connected database
     *                      ignore it
     */
    CatalogQuery tableQuery(String defaultSchema);

    /**
     * Query listing the columns of one table in ordinal order.
     */
    CatalogQuery columnQuery(String schema, String table);

    default TableRef decodeTableRow(ResultSet rs) throws SQLException {
        ColumnRows.requireColumnCount(rs, 2);
        return new TableRef(ColumnRows.requiredText(rs, 1), ColumnRows.requiredText(rs, 2));
    }

    Column decodeColumn(ResultSet rs) throws SQLException;

    /**
     * Separate primary-key discovery for dialects whose column query cannot report it.
     */
    default Optional<PrimaryKeyResolver> primaryKeyResolver() {
        return Optional.empty();
    }
}
