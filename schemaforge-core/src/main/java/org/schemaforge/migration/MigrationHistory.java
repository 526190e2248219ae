package org.schemaforge.migration;

import lombok.Value;
import org.schemaforge.exception.MigrationException;
import org.schemaforge.generate.MigrationPaths;
import org.schemaforge.generate.MigrationTimestamp;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only view of the rollback artifacts kept under {@code applied/}.
 */
public class MigrationHistory {

    @Value
    public static class Listing {
        /** table -> alter file names, sorted */
        Map<String, List<String>> alterFiles;
        /** table -> batch timestamps, sorted */
        Map<String, List<String>> batches;

        public boolean isEmpty() {
            return alterFiles.isEmpty() && batches.isEmpty();
        }
    }

    public Listing list(Path migrationsDir) {
        MigrationPaths paths = new MigrationPaths(migrationsDir);

        Map<String, List<String>> alterFiles = new TreeMap<>();
        for (Path tableDir : directories(paths.appliedDir())) {
            String table = tableDir.getFileName().toString();
            if (tableDir.equals(paths.batchDir())) {
                continue;
            }
            List<String> files = fileNames(tableDir);
            if (!files.isEmpty()) {
                alterFiles.put(table, files);
            }
        }

        Map<String, List<String>> batches = new TreeMap<>();
        for (Path tableDir : directories(paths.batchDir())) {
            String table = tableDir.getFileName().toString();
            List<String> versions = fileNames(paths.batchUpDir(table)).stream()
                    .map(name -> name.substring(0, name.length() - MigrationPaths.EXTENSION.length()))
                    .filter(MigrationTimestamp::isTimestamp)
                    .collect(Collectors.toList());
            if (!versions.isEmpty()) {
                batches.put(table, versions);
            }
        }
        return new Listing(alterFiles, batches);
    }

    private static List<Path> directories(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new MigrationException("Cannot list " + dir, e);
        }
    }

    private static List<String> fileNames(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(MigrationPaths.EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MigrationException("Cannot list " + dir, e);
        }
    }
}
