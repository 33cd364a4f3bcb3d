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
package dev.mars.todostore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Configuration for the todo store.
 * <p>
 * Each value is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dtodostore.dbPath=/path/todo.json})</li>
 *   <li>Environment variables (e.g., {@code TODOSTORE_DB_PATH})</li>
 *   <li>Properties file ({@code todostore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dbPath</td><td>todostore.dbPath</td><td>TODOSTORE_DB_PATH</td><td>$XDG_DATA_HOME/todostore/todo.json, else ./.todo.json</td></tr>
 *   <tr><td>backupEnabled</td><td>todostore.backupEnabled</td><td>TODOSTORE_BACKUP_ENABLED</td><td>true</td></tr>
 *   <tr><td>backupCount</td><td>todostore.backupCount</td><td>TODOSTORE_BACKUP_COUNT</td><td>3</td></tr>
 *   <tr><td>maxDocumentSizeBytes</td><td>todostore.maxDocumentSizeBytes</td><td>TODOSTORE_MAX_DOCUMENT_SIZE_BYTES</td><td>10485760</td></tr>
 *   <tr><td>lockTimeoutMs</td><td>todostore.lockTimeoutMs</td><td>TODOSTORE_LOCK_TIMEOUT_MS</td><td>30000</td></tr>
 *   <tr><td>syncEnabled</td><td>todostore.syncEnabled</td><td>TODOSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>cacheEnabled</td><td>todostore.cacheEnabled</td><td>TODOSTORE_CACHE_ENABLED</td><td>true</td></tr>
 *   <tr><td>strictLocking</td><td>todostore.strictLocking</td><td>TODOSTORE_STRICT_LOCKING</td><td>false</td></tr>
 *   <tr><td>allowInsecureLocking</td><td>todostore.allowInsecureLocking</td><td>TODOSTORE_ALLOW_INSECURE_LOCKING</td><td>false</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # todostore.properties
 * todostore.dbPath=/home/me/.local/share/todostore/todo.json
 * todostore.backupCount=5
 * todostore.lockTimeoutMs=10000
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * TodoStoreConfig config = TodoStoreConfig.builder()
 *     .dbPath(Path.of("/tmp/todo.json"))
 *     .backupCount(5)
 *     .build();
 *
 * try (TodoStore store = new FileTodoStore(config)) {
 *     store.add("write the report");
 * }
 * </pre>
 * Numeric values that do not parse are logged and replaced by the default.
 */
public final class TodoStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(TodoStoreConfig.class);

    static final String PROPERTIES_FILE = "todostore.properties";

    static final String PROP_DB_PATH = "todostore.dbPath";
    static final String PROP_BACKUP_ENABLED = "todostore.backupEnabled";
    static final String PROP_BACKUP_COUNT = "todostore.backupCount";
    static final String PROP_MAX_DOCUMENT_SIZE = "todostore.maxDocumentSizeBytes";
    static final String PROP_LOCK_TIMEOUT_MS = "todostore.lockTimeoutMs";
    static final String PROP_SYNC_ENABLED = "todostore.syncEnabled";
    static final String PROP_CACHE_ENABLED = "todostore.cacheEnabled";
    static final String PROP_STRICT_LOCKING = "todostore.strictLocking";
    static final String PROP_ALLOW_INSECURE_LOCKING = "todostore.allowInsecureLocking";

    static final String ENV_DB_PATH = "TODOSTORE_DB_PATH";
    static final String ENV_BACKUP_ENABLED = "TODOSTORE_BACKUP_ENABLED";
    static final String ENV_BACKUP_COUNT = "TODOSTORE_BACKUP_COUNT";
    static final String ENV_MAX_DOCUMENT_SIZE = "TODOSTORE_MAX_DOCUMENT_SIZE_BYTES";
    static final String ENV_LOCK_TIMEOUT_MS = "TODOSTORE_LOCK_TIMEOUT_MS";
    static final String ENV_SYNC_ENABLED = "TODOSTORE_SYNC_ENABLED";
    static final String ENV_CACHE_ENABLED = "TODOSTORE_CACHE_ENABLED";
    static final String ENV_STRICT_LOCKING = "TODOSTORE_STRICT_LOCKING";
    static final String ENV_ALLOW_INSECURE_LOCKING = "TODOSTORE_ALLOW_INSECURE_LOCKING";
    static final String ENV_XDG_DATA_HOME = "XDG_DATA_HOME";

    static final String DEFAULT_FILE_NAME = "todo.json";
    static final String FALLBACK_FILE_NAME = ".todo.json";
    static final boolean DEFAULT_BACKUP_ENABLED = true;
    static final int DEFAULT_BACKUP_COUNT = 3;
    static final long DEFAULT_MAX_DOCUMENT_SIZE = 10L * 1024 * 1024;
    static final long DEFAULT_LOCK_TIMEOUT_MS = 30_000;
    /** Largest budget still representable in nanoseconds. */
    static final long MAX_LOCK_TIMEOUT_MS = Long.MAX_VALUE / 1_000_000;
    static final boolean DEFAULT_SYNC_ENABLED = true;
    static final boolean DEFAULT_CACHE_ENABLED = true;
    static final boolean DEFAULT_STRICT_LOCKING = false;
    static final boolean DEFAULT_ALLOW_INSECURE_LOCKING = false;

    private final Path dbPath;
    private final boolean backupEnabled;
    private final int backupCount;
    private final long maxDocumentSizeBytes;
    private final long lockTimeoutMs;
    private final boolean syncEnabled;
    private final boolean cacheEnabled;
    private final boolean strictLocking;
    private final boolean allowInsecureLocking;

    private TodoStoreConfig(Builder builder) {
        this.dbPath = builder.dbPath;
        this.backupEnabled = builder.backupEnabled;
        this.backupCount = builder.backupCount;
        this.maxDocumentSizeBytes = builder.maxDocumentSizeBytes;
        this.lockTimeoutMs = builder.lockTimeoutMs;
        this.syncEnabled = builder.syncEnabled;
        this.cacheEnabled = builder.cacheEnabled;
        this.strictLocking = builder.strictLocking;
        this.allowInsecureLocking = builder.allowInsecureLocking;
    }

    /** The JSON document. */
    public Path dbPath() {
        return dbPath;
    }

    /** Sidecar file the cross-process lock is taken on. */
    public Path lockPath() {
        return dbPath.resolveSibling(dbPath.getFileName() + ".lock");
    }

    public boolean backupEnabled() {
        return backupEnabled;
    }

    /** Number of backups retained. */
    public int backupCount() {
        return backupCount;
    }

    /** Hard cap on document size, applied to both reads and writes. */
    public long maxDocumentSizeBytes() {
        return maxDocumentSizeBytes;
    }

    public long lockTimeoutMs() {
        return lockTimeoutMs;
    }

    /** Budget for each mutex and file lock acquisition. */
    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether {@code load()} may serve an unchanged document from memory. */
    public boolean cacheEnabled() {
        return cacheEnabled;
    }

    /** Missing native locking is a startup error, even with {@link #allowInsecureLocking()}. */
    public boolean strictLocking() {
        return strictLocking;
    }

    /** Missing native locking falls back to marker-file locking instead of failing. */
    public boolean allowInsecureLocking() {
        return allowInsecureLocking;
    }

    @Override
    public String toString() {
        return "TodoStoreConfig{" +
                "dbPath=" + dbPath +
                ", backupEnabled=" + backupEnabled +
                ", backupCount=" + backupCount +
                ", maxDocumentSizeBytes=" + maxDocumentSizeBytes +
                ", lockTimeoutMs=" + lockTimeoutMs +
                ", syncEnabled=" + syncEnabled +
                ", cacheEnabled=" + cacheEnabled +
                ", strictLocking=" + strictLocking +
                ", allowInsecureLocking=" + allowInsecureLocking +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder(System::getenv, loadPropertiesFile());
    }

    /**
     * Builder reading the environment and properties file from the given sources.
     */
    static Builder builder(UnaryOperator<String> environment, Properties fileProperties) {
        return new Builder(environment, fileProperties);
    }

    /**
     * Loads configuration from all sources with default priority.
     */
    public static TodoStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link TodoStoreConfig}.
     * <p>
     * Values not explicitly set are resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dbPath;
        private Boolean backupEnabled;
        private Integer backupCount;
        private Long maxDocumentSizeBytes;
        private Long lockTimeoutMs;
        private Boolean syncEnabled;
        private Boolean cacheEnabled;
        private Boolean strictLocking;
        private Boolean allowInsecureLocking;

        private final UnaryOperator<String> environment;
        private final Properties fileProperties;

        private Builder(UnaryOperator<String> environment, Properties fileProperties) {
            this.environment = environment;
            this.fileProperties = fileProperties;
        }

        public Builder dbPath(Path dbPath) {
            this.dbPath = dbPath;
            return this;
        }

        public Builder dbPath(String dbPath) {
            this.dbPath = Path.of(dbPath);
            return this;
        }

        /** Enables or disables backups before each save (default: true). */
        public Builder backupEnabled(boolean backupEnabled) {
            this.backupEnabled = backupEnabled;
            return this;
        }

        /** Sets the number of backups kept (default: 3). */
        public Builder backupCount(int backupCount) {
            this.backupCount = backupCount;
            return this;
        }

        /** Sets the document size cap in bytes (default: 10 MiB). */
        public Builder maxDocumentSizeBytes(long maxDocumentSizeBytes) {
            this.maxDocumentSizeBytes = maxDocumentSizeBytes;
            return this;
        }

        public Builder lockTimeout(Duration timeout) {
            this.lockTimeoutMs = timeout.toMillis();
            return this;
        }

        /** Sets the lock acquisition budget (default: 30 s). */
        public Builder lockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder strictLocking(boolean strictLocking) {
            this.strictLocking = strictLocking;
            return this;
        }

        public Builder allowInsecureLocking(boolean allowInsecureLocking) {
            this.allowInsecureLocking = allowInsecureLocking;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public TodoStoreConfig build() {
            if (dbPath == null) {
                dbPath = resolve(PROP_DB_PATH, ENV_DB_PATH, Path::of, null);
                if (dbPath == null) {
                    dbPath = defaultDbPath();
                }
            }
            if (backupEnabled == null) {
                backupEnabled = resolve(PROP_BACKUP_ENABLED, ENV_BACKUP_ENABLED, Boolean::parseBoolean, DEFAULT_BACKUP_ENABLED);
            }
            if (backupCount == null) {
                backupCount = resolve(PROP_BACKUP_COUNT, ENV_BACKUP_COUNT, Integer::parseInt, DEFAULT_BACKUP_COUNT);
            }
            if (maxDocumentSizeBytes == null) {
                maxDocumentSizeBytes = resolve(PROP_MAX_DOCUMENT_SIZE, ENV_MAX_DOCUMENT_SIZE, Long::parseLong, DEFAULT_MAX_DOCUMENT_SIZE);
            }
            if (lockTimeoutMs == null) {
                lockTimeoutMs = resolve(PROP_LOCK_TIMEOUT_MS, ENV_LOCK_TIMEOUT_MS, Long::parseLong, DEFAULT_LOCK_TIMEOUT_MS);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (cacheEnabled == null) {
                cacheEnabled = resolve(PROP_CACHE_ENABLED, ENV_CACHE_ENABLED, Boolean::parseBoolean, DEFAULT_CACHE_ENABLED);
            }
            if (strictLocking == null) {
                strictLocking = resolve(PROP_STRICT_LOCKING, ENV_STRICT_LOCKING, Boolean::parseBoolean, DEFAULT_STRICT_LOCKING);
            }
            if (allowInsecureLocking == null) {
                allowInsecureLocking = resolve(PROP_ALLOW_INSECURE_LOCKING, ENV_ALLOW_INSECURE_LOCKING,
                        Boolean::parseBoolean, DEFAULT_ALLOW_INSECURE_LOCKING);
            }

            if (backupCount < 1) {
                throw new IllegalArgumentException("backupCount must be >= 1: " + backupCount);
            }
            if (maxDocumentSizeBytes < 1 || maxDocumentSizeBytes > SafeReader.MAX_SUPPORTED_BYTES) {
                throw new IllegalArgumentException("maxDocumentSizeBytes must be between 1 and "
                        + SafeReader.MAX_SUPPORTED_BYTES + ": " + maxDocumentSizeBytes);
            }
            if (lockTimeoutMs < 0 || lockTimeoutMs > MAX_LOCK_TIMEOUT_MS) {
                throw new IllegalArgumentException("lockTimeoutMs must be between 0 and "
                        + MAX_LOCK_TIMEOUT_MS + ": " + lockTimeoutMs);
            }
            return new TodoStoreConfig(this);
        }

        private Path defaultDbPath() {
            String xdg = environment.apply(ENV_XDG_DATA_HOME);
            if (xdg != null && !xdg.isBlank()) {
                return Path.of(xdg, "todostore", DEFAULT_FILE_NAME);
            }
            return Path.of(FALLBACK_FILE_NAME);
        }

        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            T value = parse(sysProp, System.getProperty(sysProp), parser);
            if (value != null) {
                return value;
            }
            value = parse(envVar, environment.apply(envVar), parser);
            if (value != null) {
                return value;
            }
            value = parse(sysProp, fileProperties.getProperty(sysProp), parser);
            return value != null ? value : defaultValue;
        }

        private static <T> T parse(String source, String raw, Function<String, T> parser) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                return parser.apply(raw.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring invalid value for {}: '{}'", source, raw);
                return null;
            }
        }
    }

    private static Properties loadPropertiesFile() {
        Properties props = new Properties();

        try (InputStream is = TodoStoreConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
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
