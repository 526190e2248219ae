package org.schemaforge.classify;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DestructiveChange {
    public enum Kind { TYPE_CHANGE, NULLABLE_TO_REQUIRED }

    String tableName;
    String columnName;
    Kind kind;
    String description;

    @Override
    public String toString() {
        return tableName + "." + columnName + ": " + description;
    }
}
