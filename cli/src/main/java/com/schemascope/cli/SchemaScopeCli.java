package com.schemascope.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "schemascope",
        description = "Extract a normalized JSON description of a database schema",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_CONFIGURATION,
        version = "0.1.0",
        subcommands = {
                ExtractCommand.class,
                PingCommand.class
        }
)
public class SchemaScopeCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemaScopeCli()).execute(args);
        System.exit(exitCode);
    }
}
