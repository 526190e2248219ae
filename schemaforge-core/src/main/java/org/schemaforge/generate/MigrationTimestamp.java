package org.schemaforge.generate;

import lombok.EqualsAndHashCode;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Run-scoped version key in the form {@code yyyyMMdd_HHmmss}, UTC. Taken once per run
 * and handed to every writer so all artifacts of a run share it.
 */
@EqualsAndHashCode
public final class MigrationTimestamp {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);
    private static final Pattern SHAPE = Pattern.compile("\\d{8}_\\d{6}");

    private final String value;

    private MigrationTimestamp(String value) {
        this.value = value;
    }

    public static MigrationTimestamp now(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return new MigrationTimestamp(FORMAT.format(clock.instant()));
    }

    public static MigrationTimestamp parse(String value) {
        if (value == null || !SHAPE.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a migration timestamp: " + value);
        }
        return new MigrationTimestamp(value);
    }

    public static boolean isTimestamp(String value) {
        return value != null && SHAPE.matcher(value).matches();
    }

    public String value() {
        return value;
    }

    /**
     * Digits only, for use inside Java identifiers.
     */
    public String compact() {
        return value.replace("_", "");
    }

    @Override
    public String toString() {
        return value;
    }
}
