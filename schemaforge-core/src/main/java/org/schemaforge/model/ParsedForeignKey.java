package org.schemaforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ParsedForeignKey {
    private String fromColumn;
    @Builder.Default private String toTable = "";
    @Builder.Default private String toColumn = "id";
    @Builder.Default private ReferentialAction onDelete = ReferentialAction.NO_ACTION;
    @Builder.Default private ReferentialAction onUpdate = ReferentialAction.NO_ACTION;

    /**
     * Name under which the diff engine matches foreign keys between two revisions.
     */
    public String key() {
        return fromColumn + "->" + toTable + ":" + toColumn;
    }

    /**
     * Constraint name used in generated sources, e.g. {@code fk_posts_author_id}.
     */
    public String constraintName(String tableName) {
        return "fk_" + tableName + "_" + fromColumn;
    }
}
