package org.schemaforge.diff;

import org.schemaforge.model.ParsedSchema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the {@link Changes} of one table between its previous snapshot and its
 * current definition.
 */
public class SchemaDiffer {
    private final List<TableComponentDiffer> differs;

    public SchemaDiffer() {
        this(createDefaultDiffers());
    }

    public SchemaDiffer(List<TableComponentDiffer> differs) {
        this.differs = List.copyOf(Objects.requireNonNull(differs, "differs must not be null"));
    }

    /**
     * Pipeline order is fixed: columns, foreign keys, indexes.
     */
    private static List<TableComponentDiffer> createDefaultDiffers() {
        return List.of(
                new ColumnDiffer(),
                new ForeignKeyDiffer(),
                new IndexDiffer()
        );
    }

    /**
     * @param previous the snapshot, or empty when the table has never been generated
     * @param current  the freshly extracted definition
     */
    public Changes diff(Optional<ParsedSchema> previous, ParsedSchema current) {
        Objects.requireNonNull(current, "current must not be null");
        if (previous.isEmpty()) {
            return newTable(current);
        }
        return diff(previous.get(), current);
    }

    public Changes diff(ParsedSchema previous, ParsedSchema current) {
        Objects.requireNonNull(previous, "previous must not be null");
        Objects.requireNonNull(current, "current must not be null");

        Changes result = Changes.builder()
                .tableName(current.getTableName())
                .newTable(false)
                .build();
        for (TableComponentDiffer differ : differs) {
            differ.diff(previous, current, result);
        }
        return result;
    }

    /**
     * Nothing to compare against: every database column, foreign key and index is new.
     */
    public Changes newTable(ParsedSchema current) {
        Changes result = Changes.builder()
                .tableName(current.getTableName())
                .newTable(true)
                .build();
        result.getAddedColumns().addAll(current.dbColumns());
        result.getAddedForeignKeys().addAll(current.getForeignKeys());
        result.getAddedIndexes().addAll(current.getIndexes());
        return result;
    }
}
