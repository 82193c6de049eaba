package com.schemascope.core;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mockito-backed result sets over in-memory rows, read positionally.
 */
public final class ResultSets {
    private ResultSets() {}

    public static ResultSet of(int width, Object[]... rows) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(metaData.getColumnCount()).thenReturn(width);
        when(rs.getMetaData()).thenReturn(metaData);

        int[] cursor = {-1};
        Object[] lastRead = {null};

        when(rs.next()).thenAnswer(inv -> ++cursor[0] < rows.length);
        when(rs.getObject(anyInt())).thenAnswer(inv -> {
            int index = inv.getArgument(0);
            lastRead[0] = rows[cursor[0]][index - 1];
            return lastRead[0];
        });
        when(rs.getString(anyInt())).thenAnswer(inv -> {
            int index = inv.getArgument(0);
            lastRead[0] = rows[cursor[0]][index - 1];
            return lastRead[0] == null ? null : lastRead[0].toString();
        });
        when(rs.wasNull()).thenAnswer(inv -> lastRead[0] == null);
        return rs;
    }

    /**
     * A result set positioned on its single row.
     */
    public static ResultSet row(Object... values) throws SQLException {
        ResultSet rs = of(values.length, new Object[][]{values});
        rs.next();
        return rs;
    }

    public static Object[] values(Object... values) {
        return values;
    }
}
