package org.schemaforge.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemaforge.config.ConfigurationLoader;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaForgeCliTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T08:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path entities;
    private Path migrations;
    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        entities = Files.createDirectories(tempDir.resolve("entities"));
        migrations = tempDir.resolve("migrations");

        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private void defineUsers(String ageDefinition) throws IOException {
        Files.writeString(entities.resolve("users.java"), """
                class Users {
                    Object schema = model("Users")
                            .primaryKey(PrimaryKeyDef.of("id").i32())
                            .column(ColumnDef.of("age").%s)
                            .build();
                }
                """.formatted(ageDefinition));
    }

    private int makemigrations(String stdin, String... extraArgs) {
        MakeMigrationsCommand command = new MakeMigrationsCommand(
                new ConfigurationLoader(tempDir, name -> null),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                CLOCK);
        String[] args = new String[extraArgs.length + 4];
        args[0] = "--entities";
        args[1] = entities.toString();
        args[2] = "--migrations";
        args[3] = migrations.toString();
        System.arraycopy(extraArgs, 0, args, 4, extraArgs.length);
        return new CommandLine(command).execute(args);
    }

    @Test
    @DisplayName("Generates the create migration of a new table, exit 0")
    void createsMigration() throws IOException {
        defineUsers("i32()");

        int code = makemigrations("");

        assertThat(code).isZero();
        assertThat(outContent.toString()).contains("created users").contains("Migration files generated successfully");
        assertThat(migrations.resolve("m20250301_080000_create_users_table.java")).exists();
    }

    @Test
    @DisplayName("A second run reports no changes")
    void noChanges() throws IOException {
        defineUsers("i32()");
        makemigrations("");
        outContent.reset();

        assertThat(makemigrations("")).isZero();
        assertThat(outContent.toString()).contains("No changes detected.");
    }

    @Test
    @DisplayName("Declined destructive change -> exit 1 with the list and the --force hint")
    void destructiveDeclined() throws IOException {
        defineUsers("i32()");
        makemigrations("");
        defineUsers("string()");

        int code = makemigrations("\n");

        assertThat(code).isEqualTo(1);
        assertThat(errContent.toString())
                .contains("users.age: type INTEGER -> STRING")
                .contains("--force");
        assertThat(outContent.toString()).contains("Potentially destructive changes detected");
        assertThat(migrations.resolve("applied")).doesNotExist();
    }

    @Test
    @DisplayName("A typed answer or --force lets the destructive change through")
    void destructiveAccepted() throws IOException {
        defineUsers("i32()");
        makemigrations("");
        defineUsers("string()");

        assertThat(makemigrations("yes\n")).isZero();
        assertThat(outContent.toString()).contains("altered users");

        defineUsers("text()");
        assertThat(makemigrations("", "--force")).isZero();
    }

    @Test
    @DisplayName("Missing entities directory -> exit 1 with Migration failed")
    void missingEntities() {
        MakeMigrationsCommand command = new MakeMigrationsCommand(
                new ConfigurationLoader(tempDir, name -> null), new ByteArrayInputStream(new byte[0]), CLOCK);

        int code = new CommandLine(command).execute("--entities", tempDir.resolve("nope").toString(),
                "--migrations", migrations.toString());

        assertThat(code).isEqualTo(1);
        assertThat(errContent.toString()).contains("Migration failed: Entities directory not found");
    }

    @Test
    @DisplayName("Paths come from the configuration when not given on the command line")
    void pathsFromConfiguration() throws IOException {
        Files.writeString(tempDir.resolve("schemaforge.yaml"), """
                profiles:
                  ci:
                    paths:
                      entities: %s
                      migrations: %s
                """.formatted(entities, migrations));
        defineUsers("i32()");
        MakeMigrationsCommand command = new MakeMigrationsCommand(
                new ConfigurationLoader(tempDir, name -> null), new ByteArrayInputStream(new byte[0]), CLOCK);

        int code = new CommandLine(command).execute("--profile", "ci");

        assertThat(code).isZero();
        assertThat(migrations.resolve("snapshots/users.java")).exists();
    }

    @Test
    @DisplayName("status lists alter files and batches")
    void status() throws IOException {
        defineUsers("i32()");
        makemigrations("");
        defineUsers("i32().nullable()");
        makemigrations("");
        outContent.reset();

        int code = new CommandLine(new StatusCommand(new ConfigurationLoader(tempDir, name -> null)))
                .execute("--migrations", migrations.toString());

        assertThat(code).isZero();
        assertThat(outContent.toString())
                .contains("20250301_080000_alter_users_table.java")
                .contains("by_time (full batches):");
    }

    @Test
    @DisplayName("Top-level help lists the subcommands")
    void help() {
        ByteArrayOutputStream helpOut = new ByteArrayOutputStream();
        CommandLine cli = new CommandLine(new SchemaForgeCli());
        cli.setOut(new PrintWriter(helpOut, true));

        int code = cli.execute("--help");

        assertThat(code).isZero();
        assertThat(helpOut.toString()).contains("makemigrations").contains("status");
    }
}
