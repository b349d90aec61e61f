package dev.mars.pgshift.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import dev.mars.pgshift.db.util.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.*;

/**
 * Tool-level configuration for PgShift: where revisions and backups live, which bookkeeping
 * table holds the applied-revision pointer, and which client binaries to run.
 *
 * <p>Sources, later ones winning:
 * <ol>
 *   <li>{@code /pgshift-default.properties} on the classpath</li>
 *   <li>{@code /pgshift-<profile>.properties} on the classpath</li>
 *   <li>{@code PGSHIFT_*} entries of the supplied environment ({@code PGSHIFT_BACKUP_DIR} becomes
 *       {@code pgshift.backup.dir})</li>
 *   <li>{@code pgshift.*} system properties</li>
 * </ol>
 *
 * <p>Database connection parameters are not part of this class; they are resolved per
 * environment by {@link EnvironmentResolver}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class PgShiftConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PgShiftConfiguration.class);

    public static final String BACKUP_DIR = "pgshift.backup.dir";
    public static final String BACKUP_KEEP = "pgshift.backup.keep";
    public static final String VERSIONS_DIR = "pgshift.versions.dir";
    public static final String POINTER_TABLE = "pgshift.pointer.table";
    public static final String PG_DUMP = "pgshift.tools.pgdump";
    public static final String PSQL = "pgshift.tools.psql";
    public static final String STATEMENT_TIMEOUT = "pgshift.statement.timeout";

    private final Properties properties;
    private final String profile;

    public PgShiftConfiguration(String profile, Map<String, String> environment) {
        this(profile, environment, Map.of());
    }

    /**
     * Constructor for programmatic configuration with explicit overrides, applied after every
     * other source. Used by tests to avoid System property pollution.
     *
     * @param profile the configuration profile to use
     * @param environment process environment to read {@code PGSHIFT_*} entries from
     * @param overrides property overrides, keyed by full property name
     */
    public PgShiftConfiguration(String profile, Map<String, String> environment, Map<String, String> overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        overrides.forEach(properties::setProperty);
        validateConfiguration();
        logger.debug("Loaded PgShift configuration for profile: {}", profile);
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgshift-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgshift-" + profile + ".properties");
        }

        // PGSHIFT_BACKUP_DIR -> pgshift.backup.dir; environment first so -D still wins
        environment.forEach((key, value) -> {
            if (key.startsWith("PGSHIFT_") && !"PGSHIFT_PROFILE".equals(key)) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgshift.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        if (getString(BACKUP_DIR, "").isBlank()) {
            errors.add("Backup directory is required");
        }
        if (getString(VERSIONS_DIR, "").isBlank()) {
            errors.add("Versions directory is required");
        }
        if (getInt(BACKUP_KEEP, 10) < 0) {
            errors.add("Backup keep count must be non-negative");
        }
        if (!SqlIdentifiers.isValid(getString(POINTER_TABLE, ""))) {
            errors.add("Pointer table must be a valid PostgreSQL identifier: '" + getString(POINTER_TABLE, "") + "'");
        }
        if (getString(PG_DUMP, "").isBlank() || getString(PSQL, "").isBlank()) {
            errors.add("pg_dump and psql commands are required");
        }
        if (getDuration(STATEMENT_TIMEOUT, Duration.ZERO).isNegative()) {
            errors.add("Statement timeout must not be negative");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }
    }

    public String getProfile() {
        return profile;
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public Path getBackupDir() {
        return Paths.get(getString(BACKUP_DIR, "db_backups"));
    }

    public int getDefaultKeep() {
        return getInt(BACKUP_KEEP, 10);
    }

    public Path getVersionsDir() {
        return Paths.get(getString(VERSIONS_DIR, "migrations/versions"));
    }

    public String getPointerTable() {
        return getString(POINTER_TABLE, "pgshift_revision");
    }

    public String getPgDumpCommand() {
        return getString(PG_DUMP, "pg_dump");
    }

    public String getPsqlCommand() {
        return getString(PSQL, "psql");
    }

    /** Zero disables the per-statement timeout */
    public Duration getStatementTimeout() {
        return getDuration(STATEMENT_TIMEOUT, Duration.ZERO);
    }
}
