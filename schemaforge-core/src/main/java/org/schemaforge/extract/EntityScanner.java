package org.schemaforge.extract;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.exception.MigrationException;
import org.schemaforge.exception.SchemaExtractionException;
import org.schemaforge.exception.SourceReadException;
import org.schemaforge.model.ParsedSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects the schemas declared in an entities directory, one file at a time,
 * in file-name order.
 */
@Slf4j
public class EntityScanner {
    private static final Set<String> SKIPPED_FILES = Set.of("package-info.java", "module-info.java");

    private final SchemaExtractor extractor;

    public EntityScanner() {
        this(new SchemaExtractor());
    }

    public EntityScanner(SchemaExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Files that cannot be read or that match no known syntax are skipped; a later
     * file declaring a table already seen is skipped too.
     *
     * @throws MigrationException when the directory itself is missing or cannot be listed
     */
    public List<ParsedSchema> scan(Path entitiesDir) {
        if (!Files.isDirectory(entitiesDir)) {
            throw new MigrationException("Entities directory not found: " + entitiesDir);
        }

        List<ParsedSchema> schemas = new ArrayList<>();
        Set<String> seenTables = new HashSet<>();
        for (Path file : listSources(entitiesDir)) {
            Optional<ParsedSchema> schema = scanFile(file);
            if (schema.isEmpty()) {
                continue;
            }
            String table = schema.get().getTableName();
            if (!seenTables.add(table)) {
                log.warn("Table '{}' is already declared by another file, skipping {}", table, file.getFileName());
                continue;
            }
            log.info("Found schema: {} in {}", table, file.getFileName());
            schemas.add(schema.get());
        }
        return schemas;
    }

    Optional<ParsedSchema> scanFile(Path file) {
        String source;
        try {
            source = read(file);
        } catch (SourceReadException e) {
            log.warn("{}", e.getMessage(), e.getCause());
            return Optional.empty();
        }

        try {
            Optional<ParsedSchema> schema = extractor.extract(source);
            if (schema.isEmpty()) {
                log.debug("No schema definition recognized in {}", file.getFileName());
            }
            return schema;
        } catch (SchemaExtractionException e) {
            log.warn("Skipping {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceReadException(file, e);
        }
    }

    private List<Path> listSources(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".java"))
                    .filter(p -> !SKIPPED_FILES.contains(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MigrationException("Cannot list entities directory: " + dir, e);
        }
    }
}
