package org.schemaforge.migration;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.classify.DestructiveChange;
import org.schemaforge.classify.DestructiveChangeClassifier;
import org.schemaforge.classify.SafetyGate;
import org.schemaforge.diff.Changes;
import org.schemaforge.diff.SchemaDiffer;
import org.schemaforge.exception.SchemaExtractionException;
import org.schemaforge.extract.EntityScanner;
import org.schemaforge.extract.StatementSource;
import org.schemaforge.generate.ArtifactWriter;
import org.schemaforge.generate.MigrationPaths;
import org.schemaforge.generate.MigrationTimestamp;
import org.schemaforge.model.ParsedSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One generation run: scan the entity definitions, compare each table with its snapshot,
 * gate destructive changes, then write the artifacts of every changed table under a
 * single timestamp.
 * <p>
 * Nothing is written unless every schema validates, every snapshot parses and the
 * safety gate lets the run through.
 */
@Slf4j
public class MakeMigrations {
    private final EntityScanner scanner;
    private final StatementSource snapshotSource;
    private final SchemaDiffer differ;
    private final DestructiveChangeClassifier classifier;

    public MakeMigrations() {
        this(new EntityScanner(), new StatementSource(), new SchemaDiffer(), new DestructiveChangeClassifier());
    }

    public MakeMigrations(EntityScanner scanner, StatementSource snapshotSource,
                          SchemaDiffer differ, DestructiveChangeClassifier classifier) {
        this.scanner = scanner;
        this.snapshotSource = snapshotSource;
        this.differ = differ;
        this.classifier = classifier;
    }

    public MigrationReport run(MigrationRequest request) {
        MigrationPaths paths = new MigrationPaths(request.getMigrationsDir());

        List<ParsedSchema> schemas = scanner.scan(request.getEntitiesDir());
        schemas.forEach(ParsedSchema::validate);

        Map<ParsedSchema, Changes> pending = new LinkedHashMap<>();
        MigrationReport.MigrationReportBuilder report = MigrationReport.builder();
        for (ParsedSchema schema : schemas) {
            Changes changes = differ.diff(loadSnapshot(paths, schema.getTableName()), schema);
            if (changes.isEmpty()) {
                report.table(new MigrationReport.TableOutcome(schema.getTableName(), MigrationReport.TableStatus.UNCHANGED));
                continue;
            }
            pending.put(schema, changes);
        }

        if (pending.isEmpty()) {
            log.info("No changes detected.");
            return report.build();
        }

        List<DestructiveChange> acknowledged = new SafetyGate(classifier, request.getConfirmationProvider())
                .check(new ArrayList<>(pending.values()), request.isForce());
        report.acknowledgedChanges(acknowledged);

        MigrationTimestamp ts = MigrationTimestamp.now(request.getClock());
        report.timestamp(ts);
        ArtifactWriter writer = new ArtifactWriter(paths);
        for (Map.Entry<ParsedSchema, Changes> entry : pending.entrySet()) {
            ParsedSchema schema = entry.getKey();
            Changes changes = entry.getValue();
            report.writtenFiles(writer.write(schema, changes, ts));
            report.table(new MigrationReport.TableOutcome(schema.getTableName(),
                    changes.isNewTable() ? MigrationReport.TableStatus.CREATED : MigrationReport.TableStatus.ALTERED));
        }
        return report.build();
    }

    /**
     * @throws SchemaExtractionException when a snapshot exists but cannot be read back
     */
    Optional<ParsedSchema> loadSnapshot(MigrationPaths paths, String tableName) {
        Path snapshot = paths.snapshot(tableName);
        if (!Files.exists(snapshot)) {
            return Optional.empty();
        }

        String source;
        try {
            source = Files.readString(snapshot, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemaExtractionException("Cannot read snapshot: " + snapshot, e);
        }

        Optional<ParsedSchema> previous = snapshotSource.extract(source);
        if (previous.isEmpty()) {
            throw new SchemaExtractionException("Cannot parse snapshot: " + snapshot);
        }
        return previous;
    }
}
