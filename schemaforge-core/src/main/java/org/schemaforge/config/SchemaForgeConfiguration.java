package org.schemaforge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Shape of {@code schemaforge.yaml}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaForgeConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("paths")
        private PathsConfiguration paths;

        @JsonProperty("safety")
        private SafetyConfiguration safety;
    }

    /**
     * Entities and migrations directories, relative to the working directory.
     */
    @Data
    public static class PathsConfiguration {

        @JsonProperty("entities")
        private String entities;

        @JsonProperty("migrations")
        private String migrations;
    }

    @Data
    public static class SafetyConfiguration {

        @JsonProperty("force")
        private Boolean force;
    }
}
