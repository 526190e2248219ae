package org.schemaforge.migration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.schemaforge.classify.DestructiveChange;
import org.schemaforge.generate.MigrationTimestamp;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What a {@link MakeMigrations} run did.
 */
@Value
@Builder
public class MigrationReport {
    /** Absent when nothing was written. */
    MigrationTimestamp timestamp;
    @Singular List<TableOutcome> tables;
    @Singular("writtenFile") List<Path> writtenFiles;
    @Singular("acknowledgedChange") List<DestructiveChange> acknowledgedChanges;

    public Optional<MigrationTimestamp> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    public boolean hasChanges() {
        return tables.stream().anyMatch(t -> t.getStatus() != TableStatus.UNCHANGED);
    }

    public Optional<TableOutcome> table(String tableName) {
        return tables.stream().filter(t -> t.getTableName().equals(tableName)).findFirst();
    }

    public enum TableStatus { CREATED, ALTERED, UNCHANGED }

    @Value
    public static class TableOutcome {
        String tableName;
        TableStatus status;
    }
}
