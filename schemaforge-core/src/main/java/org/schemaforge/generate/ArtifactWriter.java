package org.schemaforge.generate;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.diff.Changes;
import org.schemaforge.exception.MigrationWriteException;
import org.schemaforge.ledger.MigrationLedger;
import org.schemaforge.model.ParsedSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists the artifacts of one table for one run.
 * <ul>
 *     <li>new table: create migration, registrar entry, snapshot</li>
 *     <li>changed table: alter migration, batch up and batch down fragments, snapshot</li>
 * </ul>
 * The snapshot is always written last, so a failed write leaves the previous snapshot in
 * place and the next run regenerates the missing artifacts.
 */
@Slf4j
public class ArtifactWriter {
    private final MigrationPaths paths;
    private final MigrationSourceRenderer renderer;
    private final MigrationLedger ledger;

    public ArtifactWriter(MigrationPaths paths) {
        this(paths, new MigrationSourceRenderer(), new MigrationLedger(paths.registrar()));
    }

    public ArtifactWriter(MigrationPaths paths, MigrationSourceRenderer renderer, MigrationLedger ledger) {
        this.paths = paths;
        this.renderer = renderer;
        this.ledger = ledger;
    }

    /**
     * @return files created or rewritten, in write order
     * @throws MigrationWriteException on any IO failure, or when the create file already exists
     */
    public List<Path> write(ParsedSchema schema, Changes changes, MigrationTimestamp ts) {
        return changes.isNewTable() ? writeNewTable(schema, ts) : writeChangedTable(schema, changes, ts);
    }

    private List<Path> writeNewTable(ParsedSchema schema, MigrationTimestamp ts) {
        String table = schema.getTableName();
        String moduleName = MigrationPaths.createModuleName(ts, table);
        List<Path> written = new ArrayList<>();

        Path createFile = paths.createFile(ts, table);
        if (Files.exists(createFile)) {
            throw new MigrationWriteException(createFile, "Migration file already exists: " + createFile);
        }
        writeFile(createFile, renderer.renderCreate(schema, moduleName));
        written.add(createFile);
        log.info("Generated: {}", createFile);

        if (ledger.insert(moduleName)) {
            written.add(paths.registrar());
        }

        written.add(writeSnapshot(schema));
        return written;
    }

    private List<Path> writeChangedTable(ParsedSchema schema, Changes changes, MigrationTimestamp ts) {
        String table = schema.getTableName();
        List<Path> written = new ArrayList<>();

        Path alterFile = paths.alterFile(table, ts);
        writeFile(alterFile, renderer.renderAlter(changes, ts));
        written.add(alterFile);
        log.info("Generated: {}", alterFile);

        Path up = paths.batchUp(table, ts);
        writeFile(up, renderer.renderBatchUp(changes, ts));
        written.add(up);

        Path down = paths.batchDown(table, ts);
        writeFile(down, renderer.renderBatchDown(changes, ts));
        written.add(down);
        log.info("Generated batch: {} / {}", up, down);

        written.add(writeSnapshot(schema));
        return written;
    }

    private Path writeSnapshot(ParsedSchema schema) {
        Path snapshot = paths.snapshot(schema.getTableName());
        writeFile(snapshot, renderer.renderSnapshot(schema));
        log.info("Updated snapshot: {}", snapshot);
        return snapshot;
    }

    private static void writeFile(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationWriteException(file, e);
        }
    }
}
