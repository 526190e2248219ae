package org.schemaforge.generate;

import org.schemaforge.diff.Changes;
import org.schemaforge.model.ParsedColumn;
import org.schemaforge.model.ParsedForeignKey;
import org.schemaforge.model.ParsedIndex;
import org.schemaforge.model.ParsedSchema;
import org.schemaforge.naming.CaseConverter;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the Java migration sources written into the migrations directory.
 * <p>
 * Create files and snapshots use the same {@code up} body so a snapshot can be read
 * back by {@link org.schemaforge.extract.StatementSource}. Ignored columns are never
 * rendered.
 */
public class MigrationSourceRenderer {
    public static final String API_IMPORT = "import org.schemaforge.migration.api.*;";

    private static final String INDENT = "    ";
    private static final String BODY = INDENT + INDENT;
    private static final String CONT = BODY + INDENT + INDENT;

    public String renderCreate(ParsedSchema schema, String moduleName) {
        return renderTableClass("public class " + moduleName, schema);
    }

    public String renderSnapshot(ParsedSchema schema) {
        return renderTableClass("class " + CaseConverter.toPascalCase(schema.getTableName()) + "Snapshot", schema);
    }

    /**
     * {@code up} applies the changes; {@code down} undoes them in reverse order using the
     * previous column definitions.
     */
    public String renderAlter(Changes changes, MigrationTimestamp ts) {
        String className = "Alter" + CaseConverter.toPascalCase(changes.getTableName()) + "Table" + ts.compact();
        StringBuilder sb = header();
        sb.append("class ").append(className).append(" implements Migration {\n\n");
        method(sb, "up", upStatements(changes));
        sb.append('\n');
        method(sb, "down", downStatements(changes));
        sb.append("}\n");
        return sb.toString();
    }

    public String renderBatchUp(Changes changes, MigrationTimestamp ts) {
        return renderBatch(changes, ts, "Up", upStatements(changes));
    }

    public String renderBatchDown(Changes changes, MigrationTimestamp ts) {
        return renderBatch(changes, ts, "Down", downStatements(changes));
    }

    private String renderBatch(Changes changes, MigrationTimestamp ts, String direction, List<String> statements) {
        String className = CaseConverter.toPascalCase(changes.getTableName()) + direction + ts.compact();
        StringBuilder sb = header();
        sb.append("class ").append(className).append(" implements BatchStep {\n\n");
        sb.append(INDENT).append("@Override\n");
        sb.append(INDENT).append("public String table() {\n");
        sb.append(BODY).append("return ").append(quote(changes.getTableName())).append(";\n");
        sb.append(INDENT).append("}\n\n");
        sb.append(INDENT).append("@Override\n");
        sb.append(INDENT).append("public String version() {\n");
        sb.append(BODY).append("return ").append(quote(ts.value())).append(";\n");
        sb.append(INDENT).append("}\n\n");
        method(sb, "run", statements);
        sb.append("}\n");
        return sb.toString();
    }

    private String renderTableClass(String declaration, ParsedSchema schema) {
        StringBuilder sb = header();
        sb.append(declaration).append(" implements Migration {\n\n");
        List<String> up = new ArrayList<>();
        up.add(createTable(schema));
        schema.getIndexes().forEach(index -> up.add(createIndex(schema.getTableName(), index)));
        method(sb, "up", up);
        sb.append('\n');
        method(sb, "down", List.of("manager.dropTable(Table.drop().table(" + alias(schema.getTableName()) + "));"));
        sb.append("}\n");
        return sb.toString();
    }

    private static StringBuilder header() {
        return new StringBuilder(API_IMPORT).append("\n\n");
    }

    private static void method(StringBuilder sb, String name, List<String> statements) {
        sb.append(INDENT).append("@Override\n");
        sb.append(INDENT).append("public void ").append(name).append("(SchemaManager manager) {\n");
        for (String statement : statements) {
            sb.append(BODY).append(statement).append('\n');
        }
        sb.append(INDENT).append("}\n");
    }

    private String createTable(ParsedSchema schema) {
        StringBuilder sb = new StringBuilder("manager.createTable(Table.create()\n");
        sb.append(CONT).append(".table(").append(alias(schema.getTableName())).append(")\n");
        sb.append(CONT).append(".ifNotExists()");
        schema.primaryKeyColumn().ifPresent(pk ->
                sb.append('\n').append(CONT).append(".col(").append(primaryKeyDef(pk)).append(')'));
        for (ParsedColumn column : schema.dbColumns()) {
            sb.append('\n').append(CONT).append(".col(").append(columnDef(column)).append(')');
        }
        for (ParsedForeignKey fk : schema.getForeignKeys()) {
            sb.append('\n').append(CONT).append(".foreignKey(").append(foreignKeyDef(schema.getTableName(), fk)).append(')');
        }
        return sb.append(");").toString();
    }

    private List<String> upStatements(Changes changes) {
        String table = changes.getTableName();
        List<String> statements = new ArrayList<>();
        changes.getDroppedForeignKeys().forEach(fk -> statements.add(dropForeignKey(table, fk)));
        changes.getDroppedIndexes().forEach(index -> statements.add(dropIndex(table, index)));
        changes.getAddedColumns().forEach(c -> statements.add(alter(table, ".addColumn(" + columnDef(c) + ")")));
        changes.getModifiedColumns().forEach(m -> statements.add(alter(table, ".modifyColumn(" + columnDef(m.getNewColumn()) + ")")));
        changes.getDroppedColumnDefinitions().forEach(c -> statements.add(alter(table, ".dropColumn(" + alias(c.getName()) + ")")));
        changes.getAddedForeignKeys().forEach(fk -> statements.add(createForeignKey(table, fk)));
        changes.getAddedIndexes().forEach(index -> statements.add(createIndex(table, index)));
        return statements;
    }

    private List<String> downStatements(Changes changes) {
        String table = changes.getTableName();
        List<String> statements = new ArrayList<>();
        changes.getAddedIndexes().forEach(index -> statements.add(dropIndex(table, index)));
        changes.getAddedForeignKeys().forEach(fk -> statements.add(dropForeignKey(table, fk)));
        changes.getDroppedColumnDefinitions().forEach(c -> statements.add(alter(table, ".addColumn(" + columnDef(c) + ")")));
        changes.getModifiedColumns().forEach(m -> statements.add(alter(table, ".modifyColumn(" + columnDef(m.getOldColumn()) + ")")));
        changes.getAddedColumns().forEach(c -> statements.add(alter(table, ".dropColumn(" + alias(c.getName()) + ")")));
        changes.getDroppedForeignKeys().forEach(fk -> statements.add(createForeignKey(table, fk)));
        changes.getDroppedIndexes().forEach(index -> statements.add(createIndex(table, index)));
        return statements;
    }

    private static String alter(String table, String operation) {
        return "manager.alterTable(Table.alter().table(" + alias(table) + ")" + operation + ");";
    }

    private static String primaryKeyDef(ParsedColumn pk) {
        StringBuilder sb = new StringBuilder("ColumnDef.of(").append(alias(pk.getName())).append(')')
                .append('.').append(pk.getType().getToken()).append("()")
                .append(".notNull()");
        if (pk.getType().isIntegral()) {
            sb.append(".autoIncrement()");
        }
        return sb.append(".primaryKey()").toString();
    }

    private static String columnDef(ParsedColumn column) {
        StringBuilder sb = new StringBuilder("ColumnDef.of(").append(alias(column.getName())).append(')')
                .append('.').append(column.getType().getToken()).append("()")
                .append(column.isNullable() ? ".nullable()" : ".notNull()");
        if (column.isUnique()) {
            sb.append(".unique()");
        }
        return sb.toString();
    }

    private static String foreignKeyDef(String table, ParsedForeignKey fk) {
        return "ForeignKey.create()"
                + ".name(" + quote(fk.constraintName(table)) + ")"
                + ".from(" + alias(table) + ", " + alias(fk.getFromColumn()) + ")"
                + ".to(" + alias(fk.getToTable()) + ", " + alias(fk.getToColumn()) + ")"
                + ".onDelete(ForeignKeyAction." + fk.getOnDelete().name() + ")"
                + ".onUpdate(ForeignKeyAction." + fk.getOnUpdate().name() + ")";
    }

    private static String createForeignKey(String table, ParsedForeignKey fk) {
        return "manager.createForeignKey(" + foreignKeyDef(table, fk) + ");";
    }

    private static String dropForeignKey(String table, ParsedForeignKey fk) {
        return "manager.dropForeignKey(ForeignKey.drop().name(" + quote(fk.constraintName(table))
                + ").table(" + alias(table) + "));";
    }

    private static String createIndex(String table, ParsedIndex index) {
        StringBuilder sb = new StringBuilder("manager.createIndex(Index.create().name(")
                .append(quote(index.getName())).append(").table(").append(alias(table)).append(')');
        for (String column : index.getColumns()) {
            sb.append(".col(").append(alias(column)).append(')');
        }
        if (index.isUnique()) {
            sb.append(".unique()");
        }
        return sb.append(");").toString();
    }

    private static String dropIndex(String table, ParsedIndex index) {
        return "manager.dropIndex(Index.drop().name(" + quote(index.getName()) + ").table(" + alias(table) + "));";
    }

    private static String alias(String name) {
        return "Alias.of(" + quote(name) + ")";
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
