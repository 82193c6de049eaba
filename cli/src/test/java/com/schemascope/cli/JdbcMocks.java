package com.schemascope.cli;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked JDBC connections answering catalog queries by SQL fragment.
 */
final class JdbcMocks {
    private JdbcMocks() {}

    static Connection catalog(Map<String, Object[][]> rowsByFragment) throws SQLException {
        Connection conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenAnswer(inv -> {
            String sql = inv.getArgument(0);
            for (Map.Entry<String, Object[][]> entry : rowsByFragment.entrySet()) {
                if (sql.contains(entry.getKey())) {
                    PreparedStatement stmt = mock(PreparedStatement.class);
                    ResultSet rs = resultSet(entry.getValue());
                    when(stmt.executeQuery()).thenReturn(rs);
                    return stmt;
                }
            }
            throw new SQLException("unexpected query: " + sql);
        });
        return conn;
    }

    static ResultSet resultSet(Object[][] rows) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(metaData.getColumnCount()).thenReturn(rows.length == 0 ? 0 : rows[0].length);
        when(rs.getMetaData()).thenReturn(metaData);

        int[] cursor = {-1};
        when(rs.next()).thenAnswer(inv -> ++cursor[0] < rows.length);
        when(rs.getObject(anyInt())).thenAnswer(inv -> rows[cursor[0]][(int) inv.getArgument(0) - 1]);
        when(rs.getString(anyInt())).thenAnswer(inv -> {
            Object value = rows[cursor[0]][(int) inv.getArgument(0) - 1];
            return value == null ? null : value.toString();
        });
        return rs;
    }
}
