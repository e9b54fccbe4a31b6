/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.textarchive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for the text archive, recovery and migration components.
 * <p>
 * Built once at process start and passed by reference into every component.
 * Values are resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dtextarchive.archiveDir=/path})</li>
 *   <li>Environment variables (e.g., {@code TEXTARCHIVE_ARCHIVE_DIR})</li>
 *   <li>Properties file ({@code textarchive.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>archiveDir</td><td>textarchive.archiveDir</td><td>TEXTARCHIVE_ARCHIVE_DIR</td><td>~/.textarchive/archive</td></tr>
 *   <tr><td>enabled</td><td>textarchive.enabled</td><td>TEXTARCHIVE_ENABLED</td><td>true</td></tr>
 *   <tr><td>syncEnabled</td><td>textarchive.syncEnabled</td><td>TEXTARCHIVE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>migrationLockFile</td><td>textarchive.migrationLockFile</td><td>TEXTARCHIVE_MIGRATION_LOCK_FILE</td><td>&lt;archiveDir&gt;/.migration.lock</td></tr>
 *   <tr><td>lockTimeoutMs</td><td>textarchive.lockTimeoutMs</td><td>TEXTARCHIVE_LOCK_TIMEOUT_MS</td><td>5000</td></tr>
 *   <tr><td>checkpointFile</td><td>textarchive.checkpointFile</td><td>TEXTARCHIVE_CHECKPOINT_FILE</td><td>&lt;archiveDir&gt;/.recovery-checkpoint</td></tr>
 *   <tr><td>maintenanceThresholdSeconds</td><td>textarchive.maintenanceThresholdSeconds</td><td>TEXTARCHIVE_MAINTENANCE_THRESHOLD_SECONDS</td><td>30</td></tr>
 *   <tr><td>recoveryParallelism</td><td>textarchive.recoveryParallelism</td><td>TEXTARCHIVE_RECOVERY_PARALLELISM</td><td>1</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # textarchive.properties
 * textarchive.archiveDir=/var/lib/prayers/text_archives
 * textarchive.syncEnabled=true
 * textarchive.lockTimeoutMs=5000
 * textarchive.recoveryParallelism=4
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * ArchiveConfig config = ArchiveConfig.builder()
 *     .archiveDir(Path.of("/var/lib/prayers/text_archives"))
 *     .lockTimeout(Duration.ofSeconds(2))
 *     .build();
 *
 * ArchiveWriter writer = new ArchiveWriter(config);
 * </pre>
 */
public final class ArchiveConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveConfig.class);

    static final String PROPERTIES_FILE = "textarchive.properties";

    // Property keys
    static final String PROP_ARCHIVE_DIR = "textarchive.archiveDir";
    static final String PROP_ENABLED = "textarchive.enabled";
    static final String PROP_SYNC_ENABLED = "textarchive.syncEnabled";
    static final String PROP_MIGRATION_LOCK_FILE = "textarchive.migrationLockFile";
    static final String PROP_LOCK_TIMEOUT_MS = "textarchive.lockTimeoutMs";
    static final String PROP_CHECKPOINT_FILE = "textarchive.checkpointFile";
    static final String PROP_MAINTENANCE_THRESHOLD = "textarchive.maintenanceThresholdSeconds";
    static final String PROP_RECOVERY_PARALLELISM = "textarchive.recoveryParallelism";

    // Defaults
    private static final Path DEFAULT_ARCHIVE_DIR = Path.of(System.getProperty("user.home"), ".textarchive", "archive");
    private static final boolean DEFAULT_ENABLED = true;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_LOCK_TIMEOUT_MS = 5000;
    private static final int DEFAULT_MAINTENANCE_THRESHOLD_SECONDS = 30;
    private static final int DEFAULT_RECOVERY_PARALLELISM = 1;

    private final Path archiveDir;
    private final boolean enabled;
    private final boolean syncEnabled;
    private final Path migrationLockFile;
    private final Duration lockTimeout;
    private final Path checkpointFile;
    private final int maintenanceThresholdSeconds;
    private final int recoveryParallelism;

    private ArchiveConfig(Builder builder) {
        this.archiveDir = builder.archiveDir;
        this.enabled = builder.enabled;
        this.syncEnabled = builder.syncEnabled;
        this.migrationLockFile = builder.migrationLockFile;
        this.lockTimeout = builder.lockTimeout;
        this.checkpointFile = builder.checkpointFile;
        this.maintenanceThresholdSeconds = builder.maintenanceThresholdSeconds;
        this.recoveryParallelism = builder.recoveryParallelism;
    }

    /** Root directory of the text archive. */
    public Path archiveDir() {
        return archiveDir;
    }

    /** Whether archive-first writes are enabled. When false, rows are stored without an archive path. */
    public boolean enabled() {
        return enabled;
    }

    /** Whether archive files are forced to disk after every write. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Lock file guarding schema migrations. */
    public Path migrationLockFile() {
        return migrationLockFile;
    }

    /** Maximum wait for any exclusive lock. */
    public Duration lockTimeout() {
        return lockTimeout;
    }

    /** Where an in-flight recovery persists its progress. */
    public Path checkpointFile() {
        return checkpointFile;
    }

    /** Estimated migration duration above which maintenance mode is required. */
    public int maintenanceThresholdSeconds() {
        return maintenanceThresholdSeconds;
    }

    /** Number of entity types within one recovery stage that may run concurrently. */
    public int recoveryParallelism() {
        return recoveryParallelism;
    }

    @Override
    public String toString() {
        return "ArchiveConfig{" +
                "archiveDir=" + archiveDir +
                ", enabled=" + enabled +
                ", syncEnabled=" + syncEnabled +
                ", migrationLockFile=" + migrationLockFile +
                ", lockTimeout=" + lockTimeout +
                ", checkpointFile=" + checkpointFile +
                ", maintenanceThresholdSeconds=" + maintenanceThresholdSeconds +
                ", recoveryParallelism=" + recoveryParallelism +
                '}';
    }

    /**
     * Creates a new builder. Unset values are resolved from system properties,
     * environment variables, the properties file, or defaults.
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for {@code ArchiveConfig.builder().build()}. */
    public static ArchiveConfig load() {
        return builder().build();
    }

    /**
     * Maps a property key to its environment variable name:
     * {@code textarchive.lockTimeoutMs} becomes {@code TEXTARCHIVE_LOCK_TIMEOUT_MS}.
     */
    static String envName(String propertyKey) {
        StringBuilder sb = new StringBuilder();
        for (char c : propertyKey.toCharArray()) {
            if (c == '.') {
                sb.append('_');
            } else if (Character.isUpperCase(c)) {
                sb.append('_').append(c);
            } else {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }

    /**
     * Builder for {@link ArchiveConfig}.
     */
    public static final class Builder {
        private Path archiveDir;
        private Boolean enabled;
        private Boolean syncEnabled;
        private Path migrationLockFile;
        private Duration lockTimeout;
        private Path checkpointFile;
        private Integer maintenanceThresholdSeconds;
        private Integer recoveryParallelism;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder archiveDir(Path archiveDir) {
            this.archiveDir = archiveDir;
            return this;
        }

        public Builder archiveDir(String archiveDir) {
            this.archiveDir = Path.of(archiveDir);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        public Builder migrationLockFile(Path migrationLockFile) {
            this.migrationLockFile = migrationLockFile;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder checkpointFile(Path checkpointFile) {
            this.checkpointFile = checkpointFile;
            return this;
        }

        public Builder maintenanceThresholdSeconds(int seconds) {
            this.maintenanceThresholdSeconds = seconds;
            return this;
        }

        public Builder recoveryParallelism(int parallelism) {
            this.recoveryParallelism = parallelism;
            return this;
        }

        /**
         * Builds the configuration. Paths that default relative to the archive
         * directory are resolved after the archive directory itself.
         */
        public ArchiveConfig build() {
            if (archiveDir == null) {
                String value = resolve(PROP_ARCHIVE_DIR);
                archiveDir = value != null ? Path.of(value) : DEFAULT_ARCHIVE_DIR;
            }
            if (enabled == null) {
                enabled = resolveBoolean(PROP_ENABLED, DEFAULT_ENABLED);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (migrationLockFile == null) {
                String value = resolve(PROP_MIGRATION_LOCK_FILE);
                migrationLockFile = value != null ? Path.of(value) : archiveDir.resolve(".migration.lock");
            }
            if (lockTimeout == null) {
                lockTimeout = Duration.ofMillis(resolveInt(PROP_LOCK_TIMEOUT_MS, DEFAULT_LOCK_TIMEOUT_MS));
            }
            if (checkpointFile == null) {
                String value = resolve(PROP_CHECKPOINT_FILE);
                checkpointFile = value != null ? Path.of(value) : archiveDir.resolve(".recovery-checkpoint");
            }
            if (maintenanceThresholdSeconds == null) {
                maintenanceThresholdSeconds = resolveInt(PROP_MAINTENANCE_THRESHOLD, DEFAULT_MAINTENANCE_THRESHOLD_SECONDS);
            }
            if (recoveryParallelism == null) {
                recoveryParallelism = resolveInt(PROP_RECOVERY_PARALLELISM, DEFAULT_RECOVERY_PARALLELISM);
            }

            if (lockTimeout.isNegative()) {
                throw new IllegalArgumentException("lockTimeout must not be negative: " + lockTimeout);
            }
            if (recoveryParallelism < 1) {
                throw new IllegalArgumentException("recoveryParallelism must be at least 1: " + recoveryParallelism);
            }
            return new ArchiveConfig(this);
        }

        /**
         * Returns the first non-blank value from system property, environment
         * variable or properties file, or null.
         */
        private String resolve(String key) {
            String value = System.getProperty(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = System.getenv(envName(key));
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = fileProperties.getProperty(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        }

        private boolean resolveBoolean(String key, boolean defaultValue) {
            String value = resolve(key);
            return value != null ? Boolean.parseBoolean(value) : defaultValue;
        }

        private int resolveInt(String key, int defaultValue) {
            String value = resolve(key);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value '{}' for {}, using default {}", value, key, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            try (InputStream is = ArchiveConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }
            return props;
        }
    }
}
