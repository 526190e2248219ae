package org.schemaforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ParsedColumn {
    private String name;
    @Builder.Default private ColumnType type = ColumnType.STRING;
    @Builder.Default private boolean nullable = false;
    @Builder.Default private boolean unique = false;
    /** Tracked in the schema but never emitted as DDL. */
    @Builder.Default private boolean ignored = false;

    public static ParsedColumn of(String name, ColumnType type) {
        return ParsedColumn.builder().name(name).type(type).build();
    }
}
