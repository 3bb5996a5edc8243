package org.safeshipper.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the compliance engine.
 * Values come from environment variables, then from a .env file, then from defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_REFERENCE_RESOURCE = "reference-data.json";
    public static final int DEFAULT_RANKING_THREADS = 4;
    public static final int DEFAULT_EXPIRY_WARNING_DAYS = 30;
    public static final String DEFAULT_LOG_FILE = "logs/compliance-engine.log";

    // Reference data
    private final String referenceDataUrl;
    private final String referenceDataResource;

    // Validation
    private final int rankingThreads;
    private final int expiryWarningDays;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.referenceDataUrl = builder.referenceDataUrl;
        this.referenceDataResource = builder.referenceDataResource;
        this.rankingThreads = builder.rankingThreads;
        this.expiryWarningDays = builder.expiryWarningDays;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables, falling back to a .env file in the working directory.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return fromLookup(key -> {
            String value = System.getenv(key);
            return value != null && !value.trim().isEmpty() ? value : dotenv.get(key);
        });
    }

    /**
     * Creates configuration from an explicit set of variables.
     */
    public static EngineConfig fromMap(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables must not be null");
        return fromLookup(variables::get);
    }

    private static EngineConfig fromLookup(Function<String, String> lookup) {
        return new Builder()
                .referenceDataUrl(getString(lookup, "REFERENCE_DATA_URL", null))
                .referenceDataResource(getString(lookup, "REFERENCE_DATA_RESOURCE", DEFAULT_REFERENCE_RESOURCE))
                .rankingThreads(getInt(lookup, "RANKING_THREADS", DEFAULT_RANKING_THREADS))
                .expiryWarningDays(getInt(lookup, "EXPIRY_WARNING_DAYS", DEFAULT_EXPIRY_WARNING_DAYS))
                .logFilePath(getString(lookup, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "ENGINE_FILE_LOGGING_ENABLED", false))
                .build();
    }

    // Getters

    /**
     * Base URL of the reference data service, null to use the bundled resource.
     */
    public String getReferenceDataUrl() {
        return referenceDataUrl;
    }

    public String getReferenceDataResource() {
        return referenceDataResource;
    }

    public boolean isRemoteReferenceData() {
        return referenceDataUrl != null;
    }

    public int getRankingThreads() {
        return rankingThreads;
    }

    public int getExpiryWarningDays() {
        return expiryWarningDays;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Variable helpers
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
                "referenceDataUrl='" + referenceDataUrl + '\'' +
                ", referenceDataResource='" + referenceDataResource + '\'' +
                ", rankingThreads=" + rankingThreads +
                ", expiryWarningDays=" + expiryWarningDays +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String referenceDataUrl;
        private String referenceDataResource = DEFAULT_REFERENCE_RESOURCE;
        private int rankingThreads = DEFAULT_RANKING_THREADS;
        private int expiryWarningDays = DEFAULT_EXPIRY_WARNING_DAYS;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled;

        public Builder referenceDataUrl(String referenceDataUrl) {
            this.referenceDataUrl = referenceDataUrl;
            return this;
        }

        public Builder referenceDataResource(String referenceDataResource) {
            this.referenceDataResource = Objects.requireNonNull(referenceDataResource,
                    "referenceDataResource must not be null");
            return this;
        }

        public Builder rankingThreads(int rankingThreads) {
            if (rankingThreads < 1) {
                throw new IllegalArgumentException("rankingThreads must be at least 1");
            }
            this.rankingThreads = rankingThreads;
            return this;
        }

        public Builder expiryWarningDays(int expiryWarningDays) {
            if (expiryWarningDays < 0) {
                throw new IllegalArgumentException("expiryWarningDays must not be negative");
            }
            this.expiryWarningDays = expiryWarningDays;
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
