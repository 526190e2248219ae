package org.schemaforge.classify;

import org.schemaforge.diff.Changes;
import org.schemaforge.model.ParsedColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags modified columns whose change may lose data or reject existing rows:
 * any type change, and a nullable column becoming required under the same type.
 */
public class DestructiveChangeClassifier {

    public boolean isDestructive(ParsedColumn oldColumn, ParsedColumn newColumn) {
        return classify(oldColumn, newColumn).isPresent();
    }

    public Optional<DestructiveChange.Kind> classify(ParsedColumn oldColumn, ParsedColumn newColumn) {
        if (oldColumn.getType() != newColumn.getType()) {
            return Optional.of(DestructiveChange.Kind.TYPE_CHANGE);
        }
        if (oldColumn.isNullable() && !newColumn.isNullable()) {
            return Optional.of(DestructiveChange.Kind.NULLABLE_TO_REQUIRED);
        }
        return Optional.empty();
    }

    /**
     * Aggregates destructive changes across every pending table, type changes first.
     */
    public List<DestructiveChange> classify(List<Changes> pending) {
        List<DestructiveChange> typeChanges = new ArrayList<>();
        List<DestructiveChange> narrowings = new ArrayList<>();

        for (Changes changes : pending) {
            for (Changes.ColumnChange change : changes.getModifiedColumns()) {
                ParsedColumn oldColumn = change.getOldColumn();
                ParsedColumn newColumn = change.getNewColumn();
                classify(oldColumn, newColumn).ifPresent(kind -> {
                    if (kind == DestructiveChange.Kind.TYPE_CHANGE) {
                        typeChanges.add(DestructiveChange.builder()
                                .tableName(changes.getTableName())
                                .columnName(oldColumn.getName())
                                .kind(kind)
                                .description("type " + oldColumn.getType() + " -> " + newColumn.getType())
                                .build());
                    } else {
                        narrowings.add(DestructiveChange.builder()
                                .tableName(changes.getTableName())
                                .columnName(newColumn.getName())
                                .kind(kind)
                                .description("nullable -> not_null (requires a default or backfill)")
                                .build());
                    }
                });
            }
        }

        List<DestructiveChange> all = new ArrayList<>(typeChanges);
        all.addAll(narrowings);
        return all;
    }
}
