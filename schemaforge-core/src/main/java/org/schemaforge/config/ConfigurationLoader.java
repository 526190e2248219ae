package org.schemaforge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.schemaforge.options.SchemaForgeOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = SchemaForgeOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = SchemaForgeOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = SchemaForgeOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    public ConfigurationLoader(Path startDirectory, UnaryOperator<String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads the configuration and applies the active profile.
     * <p>
     * Precedence: CLI profile, then environment variable, then {@code dev}.
     *
     * @param cliProfile profile given on the command line, may be null
     * @return resolved key-value settings, defaults filled in
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<SchemaForgeConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the filesystem root looking for the config file.
     */
    private Optional<SchemaForgeConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), SchemaForgeConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(SchemaForgeConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var paths = profileConfig.getPaths();
        if (paths != null) {
            if (paths.getEntities() != null) {
                configMap.put(SchemaForgeOptions.Paths.ENTITIES_KEY, paths.getEntities());
            }
            if (paths.getMigrations() != null) {
                configMap.put(SchemaForgeOptions.Paths.MIGRATIONS_KEY, paths.getMigrations());
            }
        }

        if (profileConfig.getSafety() != null && profileConfig.getSafety().getForce() != null) {
            configMap.put(SchemaForgeOptions.Safety.FORCE_KEY, String.valueOf(profileConfig.getSafety().getForce()));
        }

        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                SchemaForgeOptions.Paths.ENTITIES_KEY, SchemaForgeOptions.Paths.ENTITIES_DEFAULT,
                SchemaForgeOptions.Paths.MIGRATIONS_KEY, SchemaForgeOptions.Paths.MIGRATIONS_DEFAULT,
                SchemaForgeOptions.Safety.FORCE_KEY, String.valueOf(SchemaForgeOptions.Safety.FORCE_DEFAULT)
        );
    }
}
