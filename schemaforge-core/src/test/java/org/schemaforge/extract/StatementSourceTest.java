package org.schemaforge.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.exception.SchemaExtractionException;
import org.schemaforge.model.ColumnType;
import org.schemaforge.model.ParsedColumn;
import org.schemaforge.model.ParsedForeignKey;
import org.schemaforge.model.ParsedIndex;
import org.schemaforge.model.ParsedSchema;
import org.schemaforge.model.ReferentialAction;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementSourceTest {

    private final StatementSource source = new StatementSource();

    private static final String POSTS = """
            import org.schemaforge.migration.api.*;

            public class m20250101_000000_create_posts_table implements Migration {

                @Override
                public void up(SchemaManager manager) {
                    manager.createTable(Table.create()
                            .table(Alias.of("posts"))
                            .ifNotExists()
                            .col(ColumnDef.of(Alias.of("id")).bigInteger().notNull().autoIncrement().primaryKey())
                            .col(ColumnDef.of(Alias.of("title")).string().notNull().unique())
                            .col(ColumnDef.of(Alias.of("body")).text().nullable())
                            .col(ColumnDef.of(Alias.of("published_at")).timestampTz().nullable())
                            .foreignKey(ForeignKeyDef.of(Alias.of("category_id")).references("categories").onDelete(ForeignKeyAction.RESTRICT)));
                    manager.createForeignKey(ForeignKey.create()
                            .name("fk_posts_author_id")
                            .from(Alias.of("posts"), Alias.of("author_id"))
                            .to(Alias.of("users"), Alias.of("uid"))
                            .onDelete(ForeignKeyAction.CASCADE)
                            .onUpdate(ForeignKeyAction.SET_NULL));
                    manager.createIndex(Index.create().name("idx_posts_title_body").table(Alias.of("posts"))
                            .col(Alias.of("title")).col(Alias.of("body")));
                    manager.createIndex(IndexDef.of("idx_posts_published", "published_at").unique());
                }

                @Override
                public void down(SchemaManager manager) {
                    manager.dropTable(Table.drop().table(Alias.of("ignored_in_down")));
                }
            }
            """;

    @Test
    @DisplayName("Reads table, primary key and columns in source order")
    void tableAndColumns() {
        ParsedSchema schema = source.extract(POSTS).orElseThrow();

        assertThat(schema.getTableName()).isEqualTo("posts");
        assertThat(schema.getPrimaryKey()).isEqualTo(ParsedColumn.of("id", ColumnType.BIG_INTEGER));
        assertThat(schema.getColumns()).containsExactly(
                ParsedColumn.builder().name("title").type(ColumnType.STRING).unique(true).build(),
                ParsedColumn.builder().name("body").type(ColumnType.TEXT).nullable(true).build(),
                ParsedColumn.builder().name("published_at").type(ColumnType.TIMESTAMP_WITH_TIME_ZONE).nullable(true).build());
    }

    @Test
    @DisplayName("Accepts both foreign key call shapes")
    void foreignKeys() {
        ParsedSchema schema = source.extract(POSTS).orElseThrow();

        assertThat(schema.getForeignKeys()).containsExactly(
                ParsedForeignKey.builder().fromColumn("category_id").toTable("categories").toColumn("id")
                        .onDelete(ReferentialAction.RESTRICT).build(),
                ParsedForeignKey.builder().fromColumn("author_id").toTable("users").toColumn("uid")
                        .onDelete(ReferentialAction.CASCADE).onUpdate(ReferentialAction.SET_NULL).build());
    }

    @Test
    @DisplayName("Accepts both index call shapes; index columns are not table columns")
    void indexes() {
        ParsedSchema schema = source.extract(POSTS).orElseThrow();

        assertThat(schema.getIndexes()).containsExactly(
                ParsedIndex.builder().name("idx_posts_title_body").columns(List.of("title", "body")).build(),
                ParsedIndex.builder().name("idx_posts_published").columns(List.of("published_at")).unique(true).build());
        assertThat(schema.getColumns()).hasSize(3);
    }

    @Test
    @DisplayName("Only the up method is read")
    void onlyUp() {
        String src = """
                class Snapshot {
                    public void down(SchemaManager manager) {
                        manager.dropTable(Table.drop().table(Alias.of("other")));
                    }
                    public void up(SchemaManager manager) {
                        manager.createTable(Table.create().table(new Alias("users"))
                                .col(ColumnDef.of(Alias.of("id")).uuid().notNull().primaryKey()));
                    }
                }
                """;

        ParsedSchema schema = source.extract(src).orElseThrow();

        assertThat(schema.getTableName()).isEqualTo("users");
        assertThat(schema.getPrimaryKey().getType()).isEqualTo(ColumnType.UUID);
    }

    @Test
    @DisplayName("No up method or a syntax error means not recognized")
    void notRecognized() {
        assertThat(source.extract("class A { void down() { } }")).isEmpty();
        assertThat(source.extract("class A { void up( { }")).isEmpty();
    }

    @Test
    @DisplayName("An up method without a table name is an extraction error")
    void missingTableName() {
        String src = """
                class A {
                    public void up(SchemaManager manager) {
                        manager.createTable(Table.create().col(ColumnDef.of(Alias.of("id")).integer().primaryKey()));
                    }
                }
                """;

        assertThatThrownBy(() -> source.extract(src))
                .isInstanceOf(SchemaExtractionException.class)
                .hasMessageContaining("table name");
    }
}
