package org.cleanseam.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the CleanSeam engine process.
 * Values come from environment variables, then a .env file, then defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String PORT_KEY = "CLEANSEAM_PORT";
    public static final String HTTP_THREADS_KEY = "CLEANSEAM_HTTP_THREADS";
    public static final String CATALOG_PATH_KEY = "CLEANSEAM_CATALOG_PATH";
    public static final String LOG_FILE_KEY = "CLEANSEAM_LOG_FILE";
    public static final String FILE_LOGGING_ENABLED_KEY = "CLEANSEAM_FILE_LOGGING_ENABLED";

    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_HTTP_THREADS = 4;
    public static final String DEFAULT_LOG_FILE = "/app/logs/cleanseam/engine.log";

    private final int port;
    private final int httpThreads;
    private final String catalogPath;
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.port = builder.port;
        this.httpThreads = builder.httpThreads;
        this.catalogPath = builder.catalogPath;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables, falling back to a .env file.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return fromLookup(key -> {
            String fromEnv = System.getenv(key);
            if (fromEnv != null && !fromEnv.trim().isEmpty()) {
                return fromEnv;
            }
            return dotenv.get(key);
        });
    }

    /**
     * Creates configuration from an arbitrary key lookup. Missing keys use defaults.
     */
    public static EngineConfig fromLookup(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .port(getInt(lookup, PORT_KEY, DEFAULT_PORT))
                .httpThreads(getInt(lookup, HTTP_THREADS_KEY, DEFAULT_HTTP_THREADS))
                .catalogPath(getString(lookup, CATALOG_PATH_KEY, ""))
                .logFilePath(getString(lookup, LOG_FILE_KEY, DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, FILE_LOGGING_ENABLED_KEY, true))
                .build();
    }

    // Getters
    public int getPort() {
        return port;
    }

    public int getHttpThreads() {
        return httpThreads;
    }

    /**
     * Catalog file path; empty means the bundled classpath catalog.
     */
    public String getCatalogPath() {
        return catalogPath;
    }

    public boolean hasCatalogPath() {
        return !catalogPath.isEmpty();
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Lookup helpers
    private static String getString(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "port=" + port +
                ", httpThreads=" + httpThreads +
                ", catalogPath='" + (hasCatalogPath() ? catalogPath : "classpath") + '\'' +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private int port = DEFAULT_PORT;
        private int httpThreads = DEFAULT_HTTP_THREADS;
        private String catalogPath = "";
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = true;

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535");
            }
            this.port = port;
            return this;
        }

        public Builder httpThreads(int httpThreads) {
            if (httpThreads < 1) {
                throw new IllegalArgumentException("httpThreads must be at least 1");
            }
            this.httpThreads = httpThreads;
            return this;
        }

        public Builder catalogPath(String catalogPath) {
            this.catalogPath = Objects.requireNonNull(catalogPath, "catalogPath must not be null");
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
