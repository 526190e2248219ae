package org.schemaforge.generate;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk layout of the migrations directory.
 */
public class MigrationPaths {
    public static final String EXTENSION = ".java";
    public static final String REGISTRAR_FILE = "lib" + EXTENSION;

    private final Path root;

    public MigrationPaths(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public Path root() {
        return root;
    }

    public Path snapshotsDir() {
        return root.resolve("snapshots");
    }

    public Path snapshot(String table) {
        return snapshotsDir().resolve(table + EXTENSION);
    }

    public static String createModuleName(MigrationTimestamp ts, String table) {
        return "m" + ts.value() + "_create_" + table + "_table";
    }

    public Path createFile(MigrationTimestamp ts, String table) {
        return root.resolve(createModuleName(ts, table) + EXTENSION);
    }

    public Path appliedDir() {
        return root.resolve("applied");
    }

    public Path alterDir(String table) {
        return appliedDir().resolve(table);
    }

    public Path alterFile(String table, MigrationTimestamp ts) {
        return alterDir(table).resolve(ts.value() + "_alter_" + table + "_table" + EXTENSION);
    }

    public Path batchDir() {
        return appliedDir().resolve("by_time");
    }

    public Path batchUpDir(String table) {
        return batchDir().resolve(table).resolve("up");
    }

    public Path batchDownDir(String table) {
        return batchDir().resolve(table).resolve("down");
    }

    public Path batchUp(String table, MigrationTimestamp ts) {
        return batchUpDir(table).resolve(ts.value() + EXTENSION);
    }

    public Path batchDown(String table, MigrationTimestamp ts) {
        return batchDownDir(table).resolve(ts.value() + EXTENSION);
    }

    public Path registrar() {
        return root.resolve(REGISTRAR_FILE);
    }
}
