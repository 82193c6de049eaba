package com.schemascope.core.extract;

import com.schemascope.core.dialect.PostgresDialect;
import com.schemascope.core.model.Column;
import com.schemascope.core.model.DatabaseSchema;
import com.schemascope.core.model.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "TESTCONTAINERS", matches = "1")
class PostgresDialectContainerTest {

    @Container
    private static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("shop")
            .withUsername("test")
            .withPassword("test");

    @Test
    void extractsLiveCatalog() throws Exception {
        try (Connection conn = DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword())) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("""
                        CREATE TABLE accounts (
                            id SERIAL PRIMARY KEY,
                            email VARCHAR(255),
                            balance NUMERIC(12, 0) NOT NULL DEFAULT 0
                        )
                        """);
                stmt.execute("CREATE VIEW account_emails AS SELECT email FROM accounts");
            }

            DatabaseSchema schema = new RelationalSchemaExtractor(new PostgresDialect())
                    .extract(conn, "shop", "public");

            assertEquals(1, schema.tables().size());
            Table accounts = schema.tables().get(0);
            assertEquals("accounts", accounts.tableName());

            Column id = accounts.columns().get(0);
            assertEquals("id", id.columnName());
            assertTrue(id.isPrimaryKey());
            assertTrue(id.isIdentity());
            assertEquals("NO", id.isNullable());

            Column email = accounts.columns().get(1);
            assertEquals("character varying", email.dataType());
            assertEquals(255L, email.maxLength());
            assertEquals("YES", email.isNullable());
            assertFalse(email.isPrimaryKey());

            Column balance = accounts.columns().get(2);
            assertEquals(12, balance.precision());
            assertEquals(0, balance.scale());
            assertEquals("0", balance.defaultValue());
        }
    }
}
