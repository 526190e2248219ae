package org.schemaforge.exception;

/**
 * A source matched a front-end but the schema could not be completed,
 * typically because no table name could be discovered.
 */
public class SchemaExtractionException extends MigrationException {
    public SchemaExtractionException(String message) {
        super(message);
    }

    public SchemaExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
