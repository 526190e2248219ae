package org.schemaforge.cli;

import org.schemaforge.config.ConfigurationLoader;
import org.schemaforge.migration.MigrationHistory;
import org.schemaforge.options.SchemaForgeOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Lists the rollback artifacts available under {@code applied/}.
 */
@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "Lists alter migrations and batches available for rollback."
)
public class StatusCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-m", "--migrations"}, description = "Migrations directory")
    private Path migrationsDir;
    @CommandLine.Option(names = "--profile", description = "Configuration profile to use")
    private String profile;

    private final ConfigurationLoader configurationLoader;

    public StatusCommand() {
        this(new ConfigurationLoader());
    }

    StatusCommand(ConfigurationLoader configurationLoader) {
        this.configurationLoader = configurationLoader;
    }

    @Override
    public Integer call() {
        try {
            if (migrationsDir == null) {
                migrationsDir = Paths.get(configurationLoader.loadConfiguration(profile)
                        .get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));
            }

            MigrationHistory.Listing listing = new MigrationHistory().list(migrationsDir);
            if (listing.isEmpty()) {
                System.out.println("No applied migrations found in " + migrationsDir);
                return 0;
            }

            if (!listing.getAlterFiles().isEmpty()) {
                System.out.println("Per table:");
                listing.getAlterFiles().forEach((table, files) -> {
                    System.out.println("  " + table + ":");
                    files.forEach(file -> System.out.println("    " + file));
                });
            }
            if (!listing.getBatches().isEmpty()) {
                System.out.println("by_time (full batches):");
                listing.getBatches().forEach((table, versions) -> {
                    System.out.println("  " + table + ":");
                    versions.forEach(version -> System.out.println("    " + version));
                });
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status failed: " + e.getMessage());
            return 1;
        }
    }
}
