package org.schemaforge.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemaforge.exception.MigrationWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationLedgerTest {

    @TempDir
    Path dir;

    private Path registrar;
    private MigrationLedger ledger;

    @BeforeEach
    void setUp() {
        registrar = dir.resolve("lib.java");
        ledger = new MigrationLedger(registrar);
    }

    @Test
    @DisplayName("A missing registrar is created with the module as sole member")
    void createsSkeleton() throws IOException {
        assertThat(ledger.insert("m20250101_000000_create_users_table")).isTrue();

        String content = Files.readString(registrar);
        assertThat(content)
                .contains("// @module m20250101_000000_create_users_table")
                .contains("migrations.add(new m20250101_000000_create_users_table());")
                .contains("\nclass Migrator implements MigratorTrait")
                .doesNotContain("public class Migrator");
        assertThat(ledger.modules()).containsExactly("m20250101_000000_create_users_table");
    }

    @Test
    @DisplayName("Inserting the same module twice leaves the file byte-identical")
    void idempotent() throws IOException {
        ledger.insert("m1_create_users_table");
        byte[] before = Files.readAllBytes(registrar);

        assertThat(ledger.insert("m1_create_users_table")).isFalse();

        assertThat(Files.readAllBytes(registrar)).isEqualTo(before);
    }

    @Test
    @DisplayName("New modules go after the last reference and before the return marker")
    void appendsInOrder() throws IOException {
        ledger.insert("m1_create_users_table");
        ledger.insert("m2_create_posts_table");

        String content = Files.readString(registrar);
        assertThat(ledger.modules()).containsExactly("m1_create_users_table", "m2_create_posts_table");
        assertThat(content.indexOf("// @module m2_create_posts_table"))
                .isGreaterThan(content.indexOf("// @module m1_create_users_table"));
        assertThat(content.indexOf("migrations.add(new m2_create_posts_table());"))
                .isGreaterThan(content.indexOf("migrations.add(new m1_create_users_table());"))
                .isLessThan(content.indexOf("return migrations;"));
    }

    @Test
    @DisplayName("Hand-written parts of the registrar are kept")
    void keepsOtherBytes() throws IOException {
        String handWritten = """
                import org.schemaforge.migration.api.*;

                import java.util.ArrayList;
                import java.util.List;

                // maintained by hand
                class Migrator implements MigratorTrait {

                    @Override
                    public List<Migration> migrations() {
                        List<Migration> migrations = new ArrayList<>();
                        migrations.add(new LegacySeed());
                        return migrations;
                    }
                }
                """;
        Files.writeString(registrar, handWritten);

        ledger.insert("m3_create_tags_table");

        String expected = handWritten
                .replace("import org.schemaforge.migration.api.*;\n",
                        "import org.schemaforge.migration.api.*;\n// @module m3_create_tags_table\n")
                .replace("        return migrations;",
                        "        migrations.add(new m3_create_tags_table());\n        return migrations;");
        assertThat(Files.readString(registrar)).isEqualTo(expected);
    }

    @Test
    void missingMarkers() throws IOException {
        Files.writeString(registrar, "class Migrator {}\n");

        assertThatThrownBy(() -> ledger.insert("m4_create_x_table"))
                .isInstanceOf(MigrationWriteException.class);
    }

    @Test
    void noRegistrarMeansNoModules() {
        assertThat(ledger.modules()).isEmpty();
    }
}
