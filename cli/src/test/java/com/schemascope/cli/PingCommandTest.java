package com.schemascope.cli;

import com.mongodb.client.MongoClient;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PingCommandTest {

    @Test
    void relationalPingOpensAndClosesOneConnection() throws Exception {
        Connection conn = mock(Connection.class);
        ConnectionSettings[] seen = new ConnectionSettings[1];

        int exitCode = new CommandLine(new PingCommand(settings -> {
            seen[0] = settings;
            return conn;
        }, settings -> fail("no mongo connection expected")))
                .execute("--dbtype", "SYBASE", "--server", "ase.internal", "-u", "sa", "-p", "secret", "-d", "legacy");

        assertEquals(ExitCodes.OK, exitCode);
        assertEquals(5000, seen[0].effectivePort());
        assertEquals("ase.internal", seen[0].server);
        verify(conn).close();
    }

    @Test
    void mongoPingClosesClient() {
        MongoClient client = mock(MongoClient.class);

        int exitCode = new CommandLine(new PingCommand(settings -> fail("no JDBC connection expected"),
                settings -> client))
                .execute("--dbtype", "mongodb", "-u", "reader", "-p", "secret", "-d", "catalog");

        assertEquals(ExitCodes.OK, exitCode);
        verify(client).close();
    }

    @Test
    void unreachableServerIsAConnectionFailure() {
        int exitCode = new CommandLine(new PingCommand(settings -> {
            throw new ConnectionException("Could not connect to " + settings.describe(), null);
        }, settings -> fail("no mongo connection expected")))
                .execute("--dbtype", "postgres", "-u", "reader", "-p", "secret", "-d", "shop");

        assertEquals(ExitCodes.CONNECTION_FAILED, exitCode);
    }

    @Test
    void unexpectedRuntimeFailureIsAConnectionFailure() {
        int exitCode = new CommandLine(new PingCommand(settings -> {
            throw new IllegalStateException("driver bug");
        }, settings -> fail("no mongo connection expected")))
                .execute("--dbtype", "postgres", "-u", "reader", "-p", "secret", "-d", "shop");

        assertEquals(ExitCodes.CONNECTION_FAILED, exitCode);
    }

    @Test
    void portOutOfRangeIsInvalidConfiguration() {
        int exitCode = new CommandLine(new PingCommand(settings -> fail("no connection expected"),
                settings -> fail("no connection expected")))
                .execute("--dbtype", "mysql", "--port", "99999", "-u", "root", "-p", "secret", "-d", "inventory");

        assertEquals(ExitCodes.INVALID_CONFIGURATION, exitCode);
    }
}
