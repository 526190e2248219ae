package org.schemaforge.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for the SchemaForge migration generator.
 */
@CommandLine.Command(
        name = "schemaforge",
        mixinStandardHelpOptions = true,
        version = "schemaforge 1.0",
        description = "Generates schema migrations from entity definitions",
        subcommands = {
                MakeMigrationsCommand.class,
                StatusCommand.class
        }
)
public class SchemaForgeCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemaForgeCli()).execute(args);
        System.exit(exitCode);
    }
}
