package org.schemaforge.cli;

import org.schemaforge.config.ConfigurationLoader;
import org.schemaforge.exception.DestructiveChangeBlockedException;
import org.schemaforge.migration.MakeMigrations;
import org.schemaforge.migration.MigrationReport;
import org.schemaforge.migration.MigrationRequest;
import org.schemaforge.options.SchemaForgeOptions;
import picocli.CommandLine;

import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Detects entity changes and writes the matching migration sources.
 */
@CommandLine.Command(
        name = "makemigrations",
        mixinStandardHelpOptions = true,
        description = "Detects entity changes and generates migration sources."
)
public class MakeMigrationsCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-e", "--entities"}, description = "Directory holding the entity definitions")
    private Path entitiesDir;
    @CommandLine.Option(names = {"-m", "--migrations"}, description = "Directory the migrations are written to")
    private Path migrationsDir;
    @CommandLine.Option(names = "--force", description = "Apply destructive changes (type changes, nullable to required) without asking.")
    private boolean force;
    @CommandLine.Option(names = "--profile", description = "Configuration profile to use (dev, prod, test ...)")
    private String profile;

    private final ConfigurationLoader configurationLoader;
    private final InputStream stdin;
    private final Clock clock;

    public MakeMigrationsCommand() {
        this(new ConfigurationLoader(), System.in, Clock.systemUTC());
    }

    MakeMigrationsCommand(ConfigurationLoader configurationLoader, InputStream stdin, Clock clock) {
        this.configurationLoader = configurationLoader;
        this.stdin = stdin;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        try {
            applyConfiguration();

            MigrationRequest request = MigrationRequest.builder()
                    .entitiesDir(entitiesDir)
                    .migrationsDir(migrationsDir)
                    .force(force)
                    .confirmationProvider(new ConsoleConfirmationProvider(stdin, System.out))
                    .clock(clock)
                    .build();

            MigrationReport report = new MakeMigrations().run(request);
            if (!report.hasChanges()) {
                System.out.println("No changes detected.");
                return 0;
            }

            report.getTables().stream()
                    .filter(t -> t.getStatus() != MigrationReport.TableStatus.UNCHANGED)
                    .forEach(t -> System.out.println(describe(t)));
            System.out.println("Migration files generated successfully in " + migrationsDir);
            return 0;

        } catch (DestructiveChangeBlockedException e) {
            System.err.println("⚠️ Migration aborted due to potentially destructive changes.");
            e.getChanges().forEach(change -> System.err.println("   - " + change));
            System.err.println("\n   To proceed anyway, use the --force option.");
            return 1;
        } catch (Exception e) {
            System.err.println("Migration failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describe(MigrationReport.TableOutcome outcome) {
        return switch (outcome.getStatus()) {
            case CREATED -> "  + created " + outcome.getTableName();
            case ALTERED -> "  ~ altered " + outcome.getTableName();
            case UNCHANGED -> "    unchanged " + outcome.getTableName();
        };
    }

    /**
     * Configuration values are only used when the matching CLI option is not given.
     */
    private void applyConfiguration() {
        Map<String, String> config = configurationLoader.loadConfiguration(profile);

        if (entitiesDir == null) {
            entitiesDir = Paths.get(config.get(SchemaForgeOptions.Paths.ENTITIES_KEY));
        }
        if (migrationsDir == null) {
            migrationsDir = Paths.get(config.get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));
        }
        if (!force) {
            force = Boolean.parseBoolean(config.get(SchemaForgeOptions.Safety.FORCE_KEY));
        }
    }
}
