package org.schemaforge.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.schemaforge.exception.InvalidSchemaException;
import org.schemaforge.exception.MissingPrimaryKeyException;
import org.schemaforge.naming.CaseConverter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural representation of one table as read from a definition source or a snapshot.
 * Rebuilt from source on every run.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class ParsedSchema {
    private final String tableName;
    private final ParsedColumn primaryKey;
    @Singular("column") private final List<ParsedColumn> columns;
    @Singular("foreignKey") private final List<ParsedForeignKey> foreignKeys;
    @Singular("index") private final List<ParsedIndex> indexes;

    public static ParsedSchemaBuilder builder() {
        return new ParsedSchemaBuilder();
    }

    public static ParsedSchemaBuilder builder(String tableName) {
        return new ParsedSchemaBuilder().tableName(tableName);
    }

    public Optional<ParsedColumn> primaryKeyColumn() {
        return Optional.ofNullable(primaryKey);
    }

    /**
     * Fails when the schema cannot be turned into a table. Runs before any diff or write.
     *
     * @throws MissingPrimaryKeyException when no primary key was declared
     * @throws InvalidSchemaException     on a blank table name or a duplicated column name
     */
    public ParsedSchema validate() {
        if (tableName == null || tableName.isBlank()) {
            throw new InvalidSchemaException(tableName, "Schema has no table name");
        }
        if (primaryKey == null) {
            throw new MissingPrimaryKeyException(tableName);
        }
        Set<String> seen = new HashSet<>();
        seen.add(primaryKey.getName());
        for (ParsedColumn column : columns) {
            if (!seen.add(column.getName())) {
                throw new InvalidSchemaException(tableName,
                        "Schema '" + tableName + "': duplicate column '" + column.getName() + "'");
            }
        }
        return this;
    }

    /**
     * Columns that exist as plain database columns: neither ignored nor the primary key.
     */
    public List<ParsedColumn> dbColumns() {
        String pkName = primaryKey != null ? primaryKey.getName() : null;
        return columns.stream()
                .filter(c -> !c.isIgnored())
                .filter(c -> !c.getName().equals(pkName))
                .collect(Collectors.toList());
    }

    public Optional<ParsedColumn> findColumn(String name) {
        if (primaryKey != null && primaryKey.getName().equals(name)) {
            return Optional.of(primaryKey);
        }
        return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    /**
     * Generic {@code CREATE TABLE} statement for this schema, followed by one
     * {@code CREATE INDEX} statement per declared index.
     */
    public String toCreateTableSql() {
        List<String> body = new ArrayList<>();
        if (primaryKey != null) {
            body.add(columnSql(primaryKey) + " PRIMARY KEY");
        }
        for (ParsedColumn column : dbColumns()) {
            body.add(columnSql(column));
        }
        for (ParsedForeignKey fk : foreignKeys) {
            body.add(String.format("CONSTRAINT %s FOREIGN KEY (%s) REFERENCES %s (%s) ON DELETE %s ON UPDATE %s",
                    fk.constraintName(tableName), fk.getFromColumn(), fk.getToTable(), fk.getToColumn(),
                    fk.getOnDelete().sql(), fk.getOnUpdate().sql()));
        }

        StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
                .append(tableName).append(" (\n");
        sb.append(body.stream().map(line -> "    " + line).collect(Collectors.joining(",\n")));
        sb.append("\n);\n");

        for (ParsedIndex index : indexes) {
            sb.append(index.isUnique() ? "CREATE UNIQUE INDEX " : "CREATE INDEX ")
                    .append(index.getName()).append(" ON ").append(tableName)
                    .append(" (").append(String.join(", ", index.getColumns())).append(");\n");
        }
        return sb.toString();
    }

    private static String columnSql(ParsedColumn column) {
        StringBuilder sb = new StringBuilder(column.getName())
                .append(' ').append(column.getType().getSqlType());
        if (!column.isNullable()) {
            sb.append(" NOT NULL");
        }
        if (column.isUnique()) {
            sb.append(" UNIQUE");
        }
        return sb.toString();
    }

    /**
     * Shape the runtime model layer binds to this table.
     */
    public ModelBinding toModelBinding() {
        List<ModelBinding.Attribute> attributes = new ArrayList<>();
        if (primaryKey != null) {
            attributes.add(ModelBinding.Attribute.of(primaryKey, true));
        }
        String pkName = primaryKey != null ? primaryKey.getName() : null;
        columns.stream()
                .filter(c -> !c.getName().equals(pkName))
                .map(c -> ModelBinding.Attribute.of(c, false))
                .forEach(attributes::add);
        return ModelBinding.builder()
                .entityName(CaseConverter.toPascalCase(tableName))
                .tableName(tableName)
                .attributes(attributes)
                .build();
    }
}
