package org.schemaforge.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemaforge.exception.MigrationException;
import org.schemaforge.model.ParsedSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityScannerTest {

    @TempDir
    Path entities;

    private final EntityScanner scanner = new EntityScanner();

    private void write(String fileName, String content) throws IOException {
        Files.writeString(entities.resolve(fileName), content);
    }

    private static String builderEntity(String model) {
        return "class " + model + " { Object s = model(\"" + model + "\").primaryKey(PrimaryKeyDef.of(\"id\")).build(); }";
    }

    @Test
    @DisplayName("Schemas come back in file-name order")
    void fileNameOrder() throws IOException {
        write("b_post.java", builderEntity("Post"));
        write("a_user.java", builderEntity("User"));
        write("c_tag.java", """
                class Tag {
                    void up(SchemaManager manager) {
                        manager.createTable(Table.create().table(Alias.of("tags"))
                                .col(ColumnDef.of(Alias.of("id")).integer().primaryKey()));
                    }
                }
                """);

        List<ParsedSchema> schemas = scanner.scan(entities);

        assertThat(schemas).extracting(ParsedSchema::getTableName).containsExactly("user", "post", "tags");
    }

    @Test
    @DisplayName("Non-java, info files, unrecognized and broken sources are skipped")
    void skipped() throws IOException {
        write("a_user.java", builderEntity("User"));
        write("package-info.java", "package entities;");
        write("notes.txt", builderEntity("Note"));
        write("helper.java", "class Helper { int x = 1; }");
        write("broken.java", "class Broken { void up() { manager.createTable(Table.create()); } }");

        assertThat(scanner.scan(entities)).extracting(ParsedSchema::getTableName).containsExactly("user");
    }

    @Test
    @DisplayName("A later file declaring the same table is skipped")
    void duplicateTable() throws IOException {
        write("a.java", builderEntity("User"));
        write("b.java", "class B { Object s = model(\"Other\").tableName(\"user\").primaryKey(PrimaryKeyDef.of(\"uid\")).build(); }");

        List<ParsedSchema> schemas = scanner.scan(entities);

        assertThat(schemas).singleElement()
                .satisfies(s -> assertThat(s.getPrimaryKey().getName()).isEqualTo("id"));
    }

    @Test
    void missingDirectory() {
        assertThatThrownBy(() -> scanner.scan(entities.resolve("nope")))
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("Entities directory not found");
    }
}
