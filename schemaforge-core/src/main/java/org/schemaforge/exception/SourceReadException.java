package org.schemaforge.exception;

import java.nio.file.Path;

public class SourceReadException extends MigrationException {
    private final Path file;

    public SourceReadException(Path file, Throwable cause) {
        super("Cannot read file: " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
