package org.schemaforge.options;

/**
 * Configuration keys and defaults shared by the configuration loader and the CLI.
 */
public final class SchemaForgeOptions {

    private SchemaForgeOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "SCHEMAFORGE_PROFILE";

        /**
         * Configuration file name, looked up from the working directory upward.
         */
        public static final String CONFIG_FILE = "schemaforge.yaml";
    }

    public static final class Paths {
        private Paths() {}

        public static final String ENTITIES_KEY = "schemaforge.paths.entities";
        public static final String ENTITIES_DEFAULT = "src/main/java/entities";

        public static final String MIGRATIONS_KEY = "schemaforge.paths.migrations";
        public static final String MIGRATIONS_DEFAULT = "migrations";
    }

    public static final class Safety {
        private Safety() {}

        /**
         * Skip the destructive-change confirmation.
         */
        public static final String FORCE_KEY = "schemaforge.safety.force";
        public static final boolean FORCE_DEFAULT = false;
    }
}
