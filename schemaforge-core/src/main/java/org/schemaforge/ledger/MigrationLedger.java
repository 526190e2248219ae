package org.schemaforge.ledger;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.exception.MigrationWriteException;
import org.schemaforge.generate.MigrationSourceRenderer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps the registrar source ({@code lib.java}) listing every create migration.
 * <p>
 * Each module appears twice: a {@code // @module <name>} reference line and a
 * {@code migrations.add(new <name>());} registration line. Edits are textual and
 * leave every other byte of the file untouched.
 */
@Slf4j
public class MigrationLedger {
    static final String MODULE_PREFIX = "// @module ";
    static final String RETURN_MARKER = "        return migrations;";

    private static final Pattern MODULE_LINE = Pattern.compile("^// @module (\\S+)[ \\t]*$", Pattern.MULTILINE);

    private final Path registrar;

    public MigrationLedger(Path registrar) {
        this.registrar = registrar;
    }

    /**
     * Registers a module. Calling it again with the same name is a no-op.
     *
     * @return {@code true} when the registrar was created or changed
     * @throws MigrationWriteException when the registrar cannot be read, lacks its
     *                                 markers, or cannot be written
     */
    public boolean insert(String moduleName) {
        if (!Files.exists(registrar)) {
            write(skeleton(moduleName));
            log.info("Created registrar {} with {}", registrar.getFileName(), moduleName);
            return true;
        }

        String content = read();
        if (modules(content).contains(moduleName)) {
            return false;
        }

        String withReference = insertReference(content, moduleName);
        int marker = withReference.indexOf(RETURN_MARKER);
        if (marker < 0) {
            throw new MigrationWriteException(registrar, "Registrar has no '" + RETURN_MARKER.trim() + "' marker: " + registrar);
        }
        String updated = withReference.substring(0, marker)
                + registrationLine(moduleName) + "\n"
                + withReference.substring(marker);

        write(updated);
        log.info("Registered {} in {}", moduleName, registrar.getFileName());
        return true;
    }

    /**
     * Registered module names in file order; empty when the registrar does not exist.
     */
    public List<String> modules() {
        if (!Files.exists(registrar)) {
            return List.of();
        }
        return modules(read());
    }

    private static List<String> modules(String content) {
        List<String> names = new ArrayList<>();
        Matcher matcher = MODULE_LINE.matcher(content);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private String insertReference(String content, String moduleName) {
        int anchorEnd = -1;
        Matcher matcher = MODULE_LINE.matcher(content);
        while (matcher.find()) {
            anchorEnd = matcher.end();
        }
        if (anchorEnd < 0) {
            int importAt = content.indexOf(MigrationSourceRenderer.API_IMPORT);
            if (importAt < 0) {
                throw new MigrationWriteException(registrar, "Registrar has no import anchor: " + registrar);
            }
            anchorEnd = importAt + MigrationSourceRenderer.API_IMPORT.length();
        }

        // anchorEnd sits before the line break of the anchor line
        return content.substring(0, anchorEnd)
                + "\n" + MODULE_PREFIX + moduleName
                + content.substring(anchorEnd);
    }

    private static String registrationLine(String moduleName) {
        return "        migrations.add(new " + moduleName + "());";
    }

    static String skeleton(String moduleName) {
        return MigrationSourceRenderer.API_IMPORT + "\n"
                + MODULE_PREFIX + moduleName + "\n"
                + "\n"
                + "import java.util.ArrayList;\n"
                + "import java.util.List;\n"
                + "\n"
                + "class Migrator implements MigratorTrait {\n"
                + "\n"
                + "    @Override\n"
                + "    public List<Migration> migrations() {\n"
                + "        List<Migration> migrations = new ArrayList<>();\n"
                + registrationLine(moduleName) + "\n"
                + RETURN_MARKER + "\n"
                + "    }\n"
                + "}\n";
    }

    private String read() {
        try {
            return Files.readString(registrar, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationWriteException(registrar, e);
        }
    }

    private void write(String content) {
        try {
            Path parent = registrar.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(registrar, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationWriteException(registrar, e);
        }
    }
}
