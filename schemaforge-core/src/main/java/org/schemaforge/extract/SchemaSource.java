package org.schemaforge.extract;

import org.schemaforge.model.ParsedSchema;

import java.util.Optional;

/**
 * One definition syntax the engine knows how to read.
 * <p>
 * Implementations are deterministic and side-effect free. A source that does not
 * have the shape an implementation recognizes yields {@link Optional#empty()}.
 */
public interface SchemaSource {

    Optional<ParsedSchema> extract(String source);

    /**
     * Short label used in log messages.
     */
    String name();
}
