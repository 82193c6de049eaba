package com.schemascope.core.keys;

import com.schemascope.core.dialect.CatalogNames;
import com.schemascope.core.dialect.CatalogQuery;

/**
 * Joins {@code sysindexes}, {@code syscolumns} and {@code sysobjects}: the key columns of a unique
 * index that is backed by a primary-key constraint.
 */
public class SybaseIndexKeyStrategy extends CatalogKeyStrategy {

    private static final String QUERY = """
            SELECT sc.name AS column_name
            FROM sysindexes i
            JOIN syscolumns sc
              ON i.id = sc.id
             AND sc.colid IN (i.key1, i.key2, i.key3, i.key4, i.key5, i.key6, i.key7, i.key8)
            JOIN sysobjects o ON i.id = o.id
            WHERE o.name = '%s'
              AND user_name(o.uid) = '%s'
              AND i.status & 2 = 2
              AND EXISTS (
                  SELECT 1
                  FROM sysconstraints ct
                  WHERE ct.tableid = i.id
                    AND ct.constrid = i.indid
                    AND ct.status & 1 = 1)
            """;

    @Override
    public String name() {
        return "sysindexes-syscolumns";
    }

    @Override
    protected CatalogQuery query(String schema, String table) {
        return CatalogQuery.of(QUERY.formatted(
                CatalogNames.requireLiteralSafe(table),
                CatalogNames.requireLiteralSafe(schema)));
    }
}
