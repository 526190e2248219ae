package org.schemaforge.model;

import lombok.Getter;

/**
 * Logical column type tags shared by both definition front-ends.
 * <p>
 * Each tag carries the builder-call token used when it is rendered into a generated
 * migration source, the generic SQL type used by {@link ParsedSchema#toCreateTableSql()}
 * and the Java type the runtime model layer binds to it.
 */
@Getter
public enum ColumnType {
    STRING("string", "VARCHAR(255)", "java.lang.String"),
    TEXT("text", "TEXT", "java.lang.String"),
    CHAR("character", "CHAR(1)", "java.lang.String"),
    TINY_INTEGER("tinyInteger", "TINYINT", "java.lang.Byte"),
    SMALL_INTEGER("smallInteger", "SMALLINT", "java.lang.Short"),
    INTEGER("integer", "INTEGER", "java.lang.Integer"),
    BIG_INTEGER("bigInteger", "BIGINT", "java.lang.Long"),
    UNSIGNED("unsigned", "INTEGER UNSIGNED", "java.lang.Long"),
    BIG_UNSIGNED("bigUnsigned", "BIGINT UNSIGNED", "java.math.BigInteger"),
    FLOAT("float32", "REAL", "java.lang.Float"),
    DOUBLE("float64", "DOUBLE PRECISION", "java.lang.Double"),
    DECIMAL("decimal", "DECIMAL(10,2)", "java.math.BigDecimal"),
    BOOLEAN("bool", "BOOLEAN", "java.lang.Boolean"),
    DATE_TIME("dateTime", "TIMESTAMP", "java.time.LocalDateTime"),
    TIMESTAMP("timestamp", "TIMESTAMP", "java.time.LocalDateTime"),
    TIMESTAMP_WITH_TIME_ZONE("timestampTz", "TIMESTAMP WITH TIME ZONE", "java.time.OffsetDateTime"),
    DATE("date", "DATE", "java.time.LocalDate"),
    TIME("time", "TIME", "java.time.LocalTime"),
    UUID("uuid", "UUID", "java.util.UUID"),
    JSON("json", "JSON", "java.lang.String"),
    JSON_BINARY("jsonBinary", "JSONB", "java.lang.String"),
    BINARY("binary", "BINARY(255)", "byte[]"),
    VAR_BINARY("varBinary", "VARBINARY(255)", "byte[]"),
    BLOB("blob", "BLOB", "byte[]"),
    INET("inet", "INET", "java.lang.String"),
    CIDR("cidr", "CIDR", "java.lang.String"),
    MAC_ADDRESS("macAddress", "MACADDR", "java.lang.String"),
    INTERVAL("interval", "INTERVAL", "java.time.Duration"),
    ENUM("enumeration", "VARCHAR(64)", "java.lang.String");

    private final String token;
    private final String sqlType;
    private final String javaType;

    ColumnType(String token, String sqlType, String javaType) {
        this.token = token;
        this.sqlType = sqlType;
        this.javaType = javaType;
    }

    public boolean isIntegral() {
        return switch (this) {
            case TINY_INTEGER, SMALL_INTEGER, INTEGER, BIG_INTEGER, UNSIGNED, BIG_UNSIGNED -> true;
            default -> false;
        };
    }
}
