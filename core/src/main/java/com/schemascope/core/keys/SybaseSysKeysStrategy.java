package com.schemascope.core.keys;

import com.schemascope.core.dialect.CatalogNames;
import com.schemascope.core.dialect.CatalogQuery;

/**
 * Maps key positions through {@code syskeys} and {@code col_name()} instead of joining
 * {@code syscolumns}. Some server configurations only support this path.
 */
public class SybaseSysKeysStrategy extends CatalogKeyStrategy {

    private static final String QUERY = """
            SELECT col_name(i.id, k.keyno) AS column_name
            FROM sysindexes i, syskeys k
            WHERE i.id = object_id('%s.%s')
              AND i.id = k.id
              AND i.indid = k.indid
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
        return "sysindexes-syskeys";
    }

    @Override
    protected CatalogQuery query(String schema, String table) {
        return CatalogQuery.of(QUERY.formatted(
                CatalogNames.requireLiteralSafe(schema),
                CatalogNames.requireLiteralSafe(table)));
    }
}
