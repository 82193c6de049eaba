package com.schemascope.core.dialect;

import com.schemascope.core.model.Column;

import java.sql.ResultSet;
import java.sql.SQLException;

import static com.schemascope.core.dialect.ColumnRows.*;

/**
 * Row shape shared by dialects whose column query computes key and identity flags itself:
 * name, data type, nullable, max length, precision, scale, pk flag, identity flag, default.
 */
public abstract class InformationSchemaDialect implements Dialect {
    static final int COLUMN_ROW_WIDTH = 9;

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
                flag(rs, 7),
                flag(rs, 8),
                text(rs, 9)
        );
    }
}
