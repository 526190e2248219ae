package org.schemaforge.diff;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.schemaforge.model.ParsedColumn;
import org.schemaforge.model.ParsedForeignKey;
import org.schemaforge.model.ParsedIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural changes of one table between its snapshot and the current definition.
 */
@Builder
@Getter
@ToString
public class Changes {
    private final String tableName;
    private final boolean newTable;
    @Builder.Default private final List<ParsedColumn> addedColumns = new ArrayList<>();
    /** Previous definitions of dropped columns, kept so the reverse fragment can re-create them. */
    @Builder.Default private final List<ParsedColumn> droppedColumnDefinitions = new ArrayList<>();
    @Builder.Default private final List<ColumnChange> modifiedColumns = new ArrayList<>();
    @Builder.Default private final List<ParsedForeignKey> addedForeignKeys = new ArrayList<>();
    @Builder.Default private final List<ParsedForeignKey> droppedForeignKeys = new ArrayList<>();
    @Builder.Default private final List<ParsedIndex> addedIndexes = new ArrayList<>();
    @Builder.Default private final List<ParsedIndex> droppedIndexes = new ArrayList<>();

    public List<String> getDroppedColumns() {
        return droppedColumnDefinitions.stream().map(ParsedColumn::getName).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return !newTable
                && addedColumns.isEmpty()
                && droppedColumnDefinitions.isEmpty()
                && modifiedColumns.isEmpty()
                && addedForeignKeys.isEmpty()
                && droppedForeignKeys.isEmpty()
                && addedIndexes.isEmpty()
                && droppedIndexes.isEmpty();
    }

    /**
     * An existing column whose type, nullability or uniqueness changed.
     */
    @Builder
    @Getter
    @ToString
    public static class ColumnChange {
        private final ParsedColumn oldColumn;
        private final ParsedColumn newColumn;

        public static ColumnChange of(ParsedColumn oldColumn, ParsedColumn newColumn) {
            return new ColumnChange(oldColumn, newColumn);
        }

        public String getName() {
            return newColumn.getName();
        }
    }
}
