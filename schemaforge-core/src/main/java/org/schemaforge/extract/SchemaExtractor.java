package org.schemaforge.extract;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.model.ParsedSchema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tries each known definition syntax in turn; the first one that recognizes the
 * source wins.
 */
@Slf4j
public class SchemaExtractor {
    private final List<SchemaSource> sources;

    public SchemaExtractor() {
        this(List.of(new BuilderChainSource(), new StatementSource()));
    }

    public SchemaExtractor(List<SchemaSource> sources) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
    }

    /**
     * @throws org.schemaforge.exception.SchemaExtractionException when a source matched
     *         a syntax but no table name could be found
     */
    public Optional<ParsedSchema> extract(String source) {
        for (SchemaSource schemaSource : sources) {
            Optional<ParsedSchema> schema = schemaSource.extract(source);
            if (schema.isPresent()) {
                log.debug("Read table '{}' using the {} syntax", schema.get().getTableName(), schemaSource.name());
                return schema;
            }
        }
        return Optional.empty();
    }
}
