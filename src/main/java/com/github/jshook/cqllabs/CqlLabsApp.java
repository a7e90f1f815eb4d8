package com.github.jshook.cqllabs;

import com.github.jshook.cqllabs.cli.LabCommand;
import picocli.CommandLine;

/**
 * Main entry point for cqllabs - guided exercises on basic Cassandra operations.
 */
public class CqlLabsApp {
    public static void main(String[] args) {
        int exitCode = createCommandLine(new LabCommand()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine createCommandLine(LabCommand command) {
        return new CommandLine(command)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO));
    }
}
