package org.schemaforge.exception;

public class MissingPrimaryKeyException extends InvalidSchemaException {
    public MissingPrimaryKeyException(String tableName) {
        super(tableName, "Schema '" + tableName + "': missing primary key");
    }
}
