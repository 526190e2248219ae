package org.schemaforge.diff;

import org.schemaforge.model.ParsedColumn;
import org.schemaforge.model.ParsedSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name-indexed comparison of the database columns of two revisions.
 * A name present on both sides is never reported as added or dropped.
 */
public class ColumnDiffer implements TableComponentDiffer {

    @Override
    public void diff(ParsedSchema previous, ParsedSchema current, Changes result) {
        Map<String, ParsedColumn> oldColumns = byName(previous);
        Map<String, ParsedColumn> newColumns = byName(current);

        for (ParsedColumn newColumn : newColumns.values()) {
            ParsedColumn oldColumn = oldColumns.get(newColumn.getName());
            if (oldColumn == null) {
                result.getAddedColumns().add(newColumn);
            } else if (!isColumnEqual(oldColumn, newColumn)) {
                result.getModifiedColumns().add(Changes.ColumnChange.of(oldColumn, newColumn));
            }
        }

        oldColumns.values().stream()
                .filter(oldColumn -> !newColumns.containsKey(oldColumn.getName()))
                .forEach(result.getDroppedColumnDefinitions()::add);
    }

    private static Map<String, ParsedColumn> byName(ParsedSchema schema) {
        Map<String, ParsedColumn> columns = new LinkedHashMap<>();
        schema.dbColumns().forEach(c -> columns.putIfAbsent(c.getName(), c));
        return columns;
    }

    // ignored is filtered out by dbColumns(), so only these three attributes count
    private static boolean isColumnEqual(ParsedColumn oldCol, ParsedColumn newCol) {
        return oldCol.getType() == newCol.getType()
                && oldCol.isNullable() == newCol.isNullable()
                && oldCol.isUnique() == newCol.isUnique();
    }
}
