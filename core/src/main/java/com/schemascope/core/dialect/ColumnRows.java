package com.schemascope.core.dialect;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Positional readers shared by the row decoders. Every reader fails with
 * {@link SQLDataException} when the value does not have the expected shape.
 */
public final class ColumnRows {
    private ColumnRows() {}

    public static void requireColumnCount(ResultSet rs, int expected) throws SQLException {
        int actual = rs.getMetaData().getColumnCount();
        if (actual != expected) {
            throw new SQLDataException("Expected " + expected + " columns in catalog row but got " + actual);
        }
    }

    /**
     * Reads a non-null text value exactly as the catalog spells it. Identifiers may legally carry
     * leading or trailing blanks, so nothing is trimmed.
     */
    public static String requiredText(ResultSet rs, int index) throws SQLException {
        String value = rs.getString(index);
        if (value == null) {
            throw new SQLDataException("Column " + index + " of catalog row is null");
        }
        return value;
    }

    public static String text(ResultSet rs, int index) throws SQLException {
        String value = rs.getString(index);
        return value == null ? "" : value;
    }

    public static Long nullableLong(ResultSet rs, int index) throws SQLException {
        Object value = rs.getObject(index);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return exactLong(decimal, index);
        }
        if (value instanceof BigInteger integer) {
            return exactLong(new BigDecimal(integer), index);
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new SQLDataException("Column " + index + " is not numeric: " + s, e);
            }
        }
        throw new SQLDataException("Column " + index + " is not numeric: " + value.getClass().getName());
    }

    public static Integer nullableInt(ResultSet rs, int index) throws SQLException {
        Long value = nullableLong(rs, index);
        if (value == null) {
            return null;
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new SQLDataException("Column " + index + " is out of integer range: " + value);
        }
        return value.intValue();
    }

    /**
     * Reads a boolean-like value: 0/1 numbers, BIT/boolean columns and YES/NO or Y/N text.
     * A null reads as false.
     */
    public static boolean flag(ResultSet rs, int index) throws SQLException {
        Object value = rs.getObject(index);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number number) {
            return number.longValue() != 0;
        }
        if (value instanceof String s) {
            switch (s.trim().toUpperCase(Locale.ROOT)) {
                case "1", "YES", "Y", "TRUE", "T":
                    return true;
                case "0", "NO", "N", "FALSE", "F", "":
                    return false;
                default:
                    throw new SQLDataException("Column " + index + " is not a flag: " + s);
            }
        }
        throw new SQLDataException("Column " + index + " is not a flag: " + value.getClass().getName());
    }

    /**
     * Reads a nullability column and normalizes it to {@code "YES"} or {@code "NO"}.
     */
    public static String nullability(ResultSet rs, int index) throws SQLException {
        return flag(rs, index) ? "YES" : "NO";
    }

    /**
     * Tests whether all bits of {@code mask} are set in an integer status column.
     */
    public static boolean bitSet(ResultSet rs, int index, long mask) throws SQLException {
        Long status = nullableLong(rs, index);
        return status != null && (status & mask) == mask;
    }

    private static Long exactLong(BigDecimal value, int index) throws SQLDataException {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new SQLDataException("Column " + index + " is not an integer: " + value, e);
        }
    }
}
