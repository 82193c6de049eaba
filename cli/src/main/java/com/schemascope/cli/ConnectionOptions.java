package com.schemascope.cli;

import com.schemascope.core.BackendKind;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

/**
 * Connection options shared by every subcommand.
 */
public class ConnectionOptions {

    @Option(names = {"--dbtype"}, required = true, converter = BackendKindConverter.class,
            description = "Database type: sqlserver, sybase, mysql, postgres, mongodb")
    BackendKind kind;

    @Option(names = {"--server"}, defaultValue = "localhost", description = "Database server (default: localhost)")
    String server;

    @Option(names = {"--port"}, defaultValue = "0",
            description = "Database port (default: 1433 sqlserver, 5000 sybase, 3306 mysql, 5432 postgres, 27017 mongodb)")
    int port;

    @Option(names = {"--user", "-u"}, required = true, description = "Database user")
    String user;

    @Option(names = {"--password", "-p"}, defaultValue = "${env:SCHEMASCOPE_PASSWORD}",
            description = "Database password (default: $SCHEMASCOPE_PASSWORD)")
    String password;

    @Option(names = {"--database", "-d"}, required = true, description = "Database name")
    String database;

    @Option(names = {"--schema", "-s"},
            description = "Schema to extract (default: dbo for sqlserver and sybase, public for postgres, the database for mysql)")
    String schema;

    @Option(names = {"--sslmode"}, defaultValue = "disable", description = "SSL mode for postgres (default: disable)")
    String sslMode;

    ConnectionSettings toSettings() {
        ConnectionSettings settings = new ConnectionSettings();
        settings.kind = kind;
        settings.server = server;
        settings.port = port;
        settings.user = user;
        settings.password = password;
        settings.database = database;
        settings.schema = schema;
        settings.sslMode = sslMode;
        return settings;
    }

    static class BackendKindConverter implements ITypeConverter<BackendKind> {
        @Override
        public BackendKind convert(String value) {
            return BackendKind.fromTag(value);
        }
    }
}
