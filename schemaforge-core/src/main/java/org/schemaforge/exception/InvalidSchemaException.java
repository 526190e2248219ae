package org.schemaforge.exception;

/**
 * A parsed schema failed structural validation.
 */
public class InvalidSchemaException extends MigrationException {
    private final String tableName;

    public InvalidSchemaException(String tableName, String message) {
        super(message);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
