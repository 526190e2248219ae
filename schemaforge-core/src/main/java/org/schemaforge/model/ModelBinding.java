package org.schemaforge.model;

import lombok.Builder;
import lombok.Value;
import org.schemaforge.naming.CaseConverter;

import java.util.List;
import java.util.Optional;

/**
 * Table shape as seen by the runtime model layer: one attribute per column,
 * primary key first. Ignored columns are kept as transient attributes.
 */
@Value
@Builder
public class ModelBinding {
    String entityName;
    String tableName;
    List<Attribute> attributes;

    public Optional<Attribute> attribute(String columnName) {
        return attributes.stream().filter(a -> a.getColumnName().equals(columnName)).findFirst();
    }

    @Value
    @Builder
    public static class Attribute {
        String columnName;
        String attributeName;
        String javaType;
        boolean nullable;
        boolean primaryKey;
        boolean transientAttribute;

        static Attribute of(ParsedColumn column, boolean primaryKey) {
            return Attribute.builder()
                    .columnName(column.getName())
                    .attributeName(CaseConverter.toCamelCase(column.getName()))
                    .javaType(column.getType().getJavaType())
                    .nullable(column.isNullable())
                    .primaryKey(primaryKey)
                    .transientAttribute(column.isIgnored())
                    .build();
        }
    }
}
