package org.schemaforge.exception;

import java.nio.file.Path;

/**
 * Writing an artifact failed. Artifacts written earlier in the same run are kept.
 */
public class MigrationWriteException extends MigrationException {
    private final Path file;

    public MigrationWriteException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public MigrationWriteException(Path file, Throwable cause) {
        super("Failed to write: " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
