package org.schemaforge.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemaforge.options.SchemaForgeOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigurationLoaderTest {

    private static final String YAML = """
            profiles:
              dev:
                paths:
                  entities: src/entities
                  migrations: db/migrations
              prod:
                paths:
                  migrations: release/migrations
                safety:
                  force: true
            """;

    @Test
    @DisplayName("Without a config file the built-in defaults apply")
    void loadConfiguration_noFile_returnsDefaults(@TempDir Path tempDir) {
        // given
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration(null);

        // then
        assertEquals(SchemaForgeOptions.Paths.ENTITIES_DEFAULT, config.get(SchemaForgeOptions.Paths.ENTITIES_KEY));
        assertEquals(SchemaForgeOptions.Paths.MIGRATIONS_DEFAULT, config.get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));
        assertEquals("false", config.get(SchemaForgeOptions.Safety.FORCE_KEY));
    }

    @Test
    @DisplayName("Values of the requested profile are loaded, missing ones keep their defaults")
    void loadConfiguration_withProfile_loadsCorrectValues(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("schemaforge.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> dev = loader.loadConfiguration("dev");
        Map<String, String> prod = loader.loadConfiguration("prod");

        // then
        assertEquals("src/entities", dev.get(SchemaForgeOptions.Paths.ENTITIES_KEY));
        assertEquals("db/migrations", dev.get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));
        assertEquals("false", dev.get(SchemaForgeOptions.Safety.FORCE_KEY));
        assertEquals(SchemaForgeOptions.Paths.ENTITIES_DEFAULT, prod.get(SchemaForgeOptions.Paths.ENTITIES_KEY));
        assertEquals("release/migrations", prod.get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));
        assertEquals("true", prod.get(SchemaForgeOptions.Safety.FORCE_KEY));
    }

    @Test
    @DisplayName("The config file is found in a parent directory")
    void loadConfiguration_parentDirectory(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("schemaforge.yaml"), YAML);
        Path nested = Files.createDirectories(tempDir.resolve("a/b"));
        ConfigurationLoader loader = new ConfigurationLoader(nested, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals("db/migrations", config.get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));
    }

    @Test
    @DisplayName("Profile precedence: CLI, then environment, then dev")
    void resolveActiveProfile_precedence(@TempDir Path tempDir) {
        ConfigurationLoader withEnv = new ConfigurationLoader(tempDir,
                name -> SchemaForgeOptions.Profile.ENV_VAR.equals(name) ? "prod" : null);
        ConfigurationLoader withoutEnv = new ConfigurationLoader(tempDir, name -> null);

        assertEquals("test", withEnv.resolveActiveProfile("test"));
        assertEquals("prod", withEnv.resolveActiveProfile(null));
        assertEquals("prod", withEnv.resolveActiveProfile("  "));
        assertEquals("dev", withoutEnv.resolveActiveProfile(null));
    }

    @Test
    @DisplayName("An unknown profile or a broken file falls back to defaults")
    void loadConfiguration_fallbacks(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("schemaforge.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);
        assertEquals(SchemaForgeOptions.Paths.MIGRATIONS_DEFAULT,
                loader.loadConfiguration("staging").get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));

        Files.writeString(tempDir.resolve("schemaforge.yaml"), "profiles: [unclosed");
        assertEquals(SchemaForgeOptions.Paths.MIGRATIONS_DEFAULT,
                loader.loadConfiguration("dev").get(SchemaForgeOptions.Paths.MIGRATIONS_KEY));
    }
}
