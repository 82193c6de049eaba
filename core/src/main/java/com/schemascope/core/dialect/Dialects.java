package com.schemascope.core.dialect;

import com.schemascope.core.BackendKind;

public final class Dialects {
    private Dialects() {}

    public static Dialect forKind(BackendKind kind) {
        return switch (kind) {
            case SQLSERVER -> new SqlServerDialect();
            case SYBASE -> new SybaseDialect();
            case MYSQL -> new MySqlDialect();
            case POSTGRES -> new PostgresDialect();
            case MONGODB -> throw new IllegalArgumentException("mongodb has no relational catalog dialect");
        };
    }
}
