package org.schemaforge.model;

/**
 * Action applied by a foreign key when the referenced row is deleted or updated.
 */
public enum ReferentialAction {
    NO_ACTION("NO ACTION"),
    CASCADE("CASCADE"),
    SET_NULL("SET NULL"),
    RESTRICT("RESTRICT");

    private final String sql;

    ReferentialAction(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /**
     * Resolves the last segment of an action reference such as {@code Action.SET_NULL}
     * or {@code ForeignKeyAction.Cascade}. Anything unknown maps to {@link #NO_ACTION}.
     */
    public static ReferentialAction fromIdentifier(String identifier) {
        if (identifier == null) {
            return NO_ACTION;
        }
        String normalized = identifier.replace("_", "").toLowerCase(java.util.Locale.ROOT);
        return switch (normalized) {
            case "cascade" -> CASCADE;
            case "setnull" -> SET_NULL;
            case "restrict" -> RESTRICT;
            default -> NO_ACTION;
        };
    }
}
