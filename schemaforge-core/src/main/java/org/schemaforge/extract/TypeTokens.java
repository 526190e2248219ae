package org.schemaforge.extract;

import org.schemaforge.model.ColumnType;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.schemaforge.model.ColumnType.*;

/**
 * Controlled mapping from call-name tokens found in a column expression to a
 * {@link ColumnType}. Rules are checked in order; the first rule with a matching
 * token wins, so narrower families come before the general ones.
 */
final class TypeTokens {

    private record Rule(Set<String> tokens, ColumnType type) {
        boolean matches(Collection<String> methods) {
            return methods.stream().anyMatch(tokens::contains);
        }
    }

    private static Rule rule(ColumnType type, String... tokens) {
        return new Rule(Set.of(tokens), type);
    }

    private static final List<Rule> STATEMENT_RULES = List.of(
            rule(BLOB, "blob"),
            rule(BINARY, "binary", "binaryLen"),
            rule(VAR_BINARY, "varBinary"),
            rule(TEXT, "text"),
            rule(CHAR, "character", "charLen"),
            rule(TINY_INTEGER, "tinyInteger"),
            rule(SMALL_INTEGER, "smallInteger"),
            rule(BIG_UNSIGNED, "bigUnsigned"),
            rule(UNSIGNED, "unsigned"),
            rule(BIG_INTEGER, "bigInteger"),
            rule(INTEGER, "integer"),
            rule(FLOAT, "float32"),
            rule(DOUBLE, "float64"),
            rule(DECIMAL, "decimal", "decimalLen"),
            rule(BOOLEAN, "bool"),
            rule(TIMESTAMP_WITH_TIME_ZONE, "timestampTz", "timestampWithTimeZone"),
            rule(TIMESTAMP, "timestamp"),
            rule(DATE_TIME, "dateTime", "autoNow", "autoNowUpdate"),
            rule(DATE, "date"),
            rule(TIME, "time"),
            rule(UUID, "uuid"),
            rule(JSON_BINARY, "jsonBinary"),
            rule(JSON, "json"),
            rule(INET, "inet"),
            rule(CIDR, "cidr"),
            rule(MAC_ADDRESS, "macAddress"),
            rule(INTERVAL, "interval"),
            rule(ENUM, "enumeration", "enumType")
    );

    private static final List<Rule> BUILDER_RULES = List.of(
            rule(BLOB, "blob"),
            rule(BINARY, "binary", "binaryLen"),
            rule(VAR_BINARY, "varBinary"),
            rule(TEXT, "text"),
            rule(CHAR, "character", "charLen"),
            rule(STRING, "varchar", "stringLen"),
            rule(TINY_INTEGER, "tinyInteger", "i8"),
            rule(SMALL_INTEGER, "smallInteger", "i16"),
            rule(BIG_UNSIGNED, "bigUnsigned", "u64"),
            rule(UNSIGNED, "unsigned", "u32"),
            rule(BIG_INTEGER, "bigInteger", "i64"),
            rule(INTEGER, "integer", "i32"),
            rule(FLOAT, "float32", "f32"),
            rule(DOUBLE, "float64", "f64"),
            rule(DECIMAL, "decimal", "decimalLen"),
            rule(BOOLEAN, "bool"),
            rule(TIMESTAMP_WITH_TIME_ZONE, "timestampTz"),
            rule(TIMESTAMP, "timestamp"),
            rule(DATE_TIME, "datetime", "dateTime", "autoNow", "autoNowUpdate"),
            rule(DATE, "date"),
            rule(TIME, "time"),
            rule(UUID, "uuid"),
            rule(JSON_BINARY, "jsonBinary"),
            rule(JSON, "json"),
            rule(INET, "inet"),
            rule(CIDR, "cidr"),
            rule(MAC_ADDRESS, "macAddress"),
            rule(INTERVAL, "interval"),
            rule(ENUM, "enumeration", "enumType")
    );

    // primary keys only come in key-friendly shapes; anything else is an integer key
    private static final List<Rule> PRIMARY_KEY_RULES = List.of(
            rule(UUID, "uuid"),
            rule(BIG_INTEGER, "i64", "bigInteger"),
            rule(INTEGER, "i32", "integer"),
            rule(SMALL_INTEGER, "i16", "smallInteger"),
            rule(TINY_INTEGER, "i8", "tinyInteger"),
            rule(BIG_UNSIGNED, "u64", "bigUnsigned"),
            rule(UNSIGNED, "u32", "unsigned"),
            rule(STRING, "string", "varchar")
    );

    private TypeTokens() {
    }

    static ColumnType fromStatement(Collection<String> methods) {
        return resolve(STATEMENT_RULES, methods, STRING);
    }

    static ColumnType fromBuilder(Collection<String> methods) {
        return resolve(BUILDER_RULES, methods, STRING);
    }

    static ColumnType fromPrimaryKey(Collection<String> methods) {
        return resolve(PRIMARY_KEY_RULES, methods, INTEGER);
    }

    private static ColumnType resolve(List<Rule> rules, Collection<String> methods, ColumnType fallback) {
        return rules.stream()
                .filter(r -> r.matches(methods))
                .map(Rule::type)
                .findFirst()
                .orElse(fallback);
    }
}
