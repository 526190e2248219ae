package org.schemaforge.naming;

import java.util.Locale;

/**
 * Identifier case conversions used for table, class and attribute names.
 */
public final class CaseConverter {

    private CaseConverter() {
    }

    /**
     * {@code UsersBooster} -> {@code users_booster}.
     */
    public static String toSnakeCase(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isUpperCase(ch) && i > 0) {
                sb.append('_');
            }
            sb.append(Character.toLowerCase(ch));
        }
        return sb.toString();
    }

    /**
     * {@code users_booster} -> {@code UsersBooster}.
     */
    public static String toPascalCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean upper = true;
        for (char ch : value.toCharArray()) {
            if (ch == '_' || ch == '-' || ch == ' ') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(ch) : ch);
            upper = false;
        }
        return sb.toString();
    }

    /**
     * {@code created_at} -> {@code createdAt}.
     */
    public static String toCamelCase(String value) {
        String pascal = toPascalCase(value);
        if (pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }
}
