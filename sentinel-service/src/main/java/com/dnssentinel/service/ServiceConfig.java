package com.dnssentinel.service;

import java.util.Objects;

/**
 * Typed, immutable process settings for the DNS Sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configured through container env vars or the shell. Analytics
 * and alerting settings live in the YAML file located by
 * {@link #getConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production and the {@link Builder} in
 * tests. {@link Builder#build()} validates every value.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    public static final String MODE_SCHEDULED = "scheduled";
    public static final String MODE_ONCE = "once";

    private final String configPath;
    private final String recordsPath;
    private final String trainingPath;
    private final int healthPort;
    private final String dataSource;
    private final String analysisMode;

    private ServiceConfig(Builder b) {
        this.configPath = b.configPath;
        this.recordsPath = b.recordsPath;
        this.trainingPath = b.trainingPath;
        this.healthPort = b.healthPort;
        this.dataSource = b.dataSource;
        this.analysisMode = b.analysisMode;
    }

    /**
     * @throws IllegalStateException    if a numeric env var cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .configPath(env("SENTINEL_CONFIG_PATH", ""))
                    .recordsPath(env("RECORDS_PATH", "data/queries.jsonl"))
                    .trainingPath(env("TRAINING_PATH", ""))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .dataSource(env("DATA_SOURCE", "file"))
                    .analysisMode(env("ANALYSIS_MODE", MODE_SCHEDULED))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public String getConfigPath() {
        return configPath;
    }

    public String getRecordsPath() {
        return recordsPath;
    }

    /**
     * @return the training batch path, falling back to the records path
     */
    public String getTrainingPath() {
        return trainingPath.isBlank() ? recordsPath : trainingPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public String getDataSource() {
        return dataSource;
    }

    public String getAnalysisMode() {
        return analysisMode;
    }

    public boolean isScheduled() {
        return MODE_SCHEDULED.equals(analysisMode);
    }

    /**
     * Fluent builder for {@link ServiceConfig}. Health port 0 binds an
     * ephemeral port.
     */
    public static class Builder {
        private String configPath = "";
        private String recordsPath = "data/queries.jsonl";
        private String trainingPath = "";
        private int healthPort = 8080;
        private String dataSource = "file";
        private String analysisMode = MODE_SCHEDULED;

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder recordsPath(String v) {
            this.recordsPath = v;
            return this;
        }

        public Builder trainingPath(String v) {
            this.trainingPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder dataSource(String v) {
            this.dataSource = v;
            return this;
        }

        public Builder analysisMode(String v) {
            this.analysisMode = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(configPath, "configPath must not be null");
            Objects.requireNonNull(trainingPath, "trainingPath must not be null");
            requireNonBlank(recordsPath, "recordsPath");
            requireNonBlank(dataSource, "dataSource");
            if (!MODE_SCHEDULED.equals(analysisMode) && !MODE_ONCE.equals(analysisMode)) {
                throw new IllegalArgumentException(
                        "analysisMode must be 'scheduled' or 'once', got: " + analysisMode);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException("healthPort must be in [0, 65535], got: " + healthPort);
            }
            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{configPath='" + configPath + "', recordsPath='" + recordsPath
                + "', trainingPath='" + getTrainingPath() + "', healthPort=" + healthPort
                + ", dataSource='" + dataSource + "', analysisMode='" + analysisMode + "'}";
    }
}
