package com.schemascope.core.dialect;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * Catalog query text together with the values bound to its {@code ?} placeholders, in order.
 */
public record CatalogQuery(String sql, List<Object> parameters) {

    public CatalogQuery {
        parameters = List.copyOf(parameters);
    }

    public static CatalogQuery of(String sql, Object... parameters) {
        return new CatalogQuery(sql, List.of(parameters));
    }

    public PreparedStatement prepare(Connection conn) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        try {
            for (int i = 0; i < parameters.size(); i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }
}
