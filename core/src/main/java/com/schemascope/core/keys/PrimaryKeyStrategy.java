package com.schemascope.core.keys;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Set;

/**
 * One way of finding the primary-key columns of a table.
 */
public interface PrimaryKeyStrategy {

    String name();

    /**
     * @return the names of the columns in the table's primary key; empty if it has none
     * @throws SQLException if the strategy cannot be run against this server
     */
    Set<String> primaryKeyColumns(Connection conn, String schema, String table) throws SQLException;
}
