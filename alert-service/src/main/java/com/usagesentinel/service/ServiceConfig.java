package com.usagesentinel.service;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable configuration for the usage sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configured entirely through its deployment environment.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code HTTP_PORT}: listening port, default 8080</li>
 * <li>{@code DATABASE_URL}: JDBC URL of the usage store, default
 * {@code jdbc:sqlite:usage.db}</li>
 * <li>{@code SCAN_MAX_CONCURRENCY}: fleet scan worker threads, default 8</li>
 * <li>{@code SCAN_TIMEOUT_MS}: fleet scan deadline, default 30000</li>
 * <li>{@code CONDITION_HINTS_PATH}: condition hints YAML file; blank uses the
 * bundled catalog</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    private final int httpPort;
    private final String databaseUrl;
    private final int scanMaxConcurrency;
    private final long scanTimeoutMs;
    private final String conditionHintsPath;

    private ServiceConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.databaseUrl = b.databaseUrl;
        this.scanMaxConcurrency = b.scanMaxConcurrency;
        this.scanTimeoutMs = b.scanTimeoutMs;
        this.conditionHintsPath = b.conditionHintsPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build a {@link ServiceConfig} from an arbitrary variable source.
     *
     * @param env variable lookup; returns {@code null} for unset names
     * @return fully populated configuration
     */
    static ServiceConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "environment lookup must not be null");
        try {
            return new Builder()
                    .httpPort(Integer.parseInt(value(env, "HTTP_PORT", "8080")))
                    .databaseUrl(value(env, "DATABASE_URL", "jdbc:sqlite:usage.db"))
                    .scanMaxConcurrency(Integer.parseInt(value(env, "SCAN_MAX_CONCURRENCY", "8")))
                    .scanTimeoutMs(Long.parseLong(value(env, "SCAN_TIMEOUT_MS", "30000")))
                    .conditionHintsPath(value(env, "CONDITION_HINTS_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    static ServiceConfig fromMap(Map<String, String> values) {
        return fromEnvironment(values::get);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHttpPort() {
        return httpPort;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public int getScanMaxConcurrency() {
        return scanMaxConcurrency;
    }

    public long getScanTimeoutMs() {
        return scanTimeoutMs;
    }

    public String getConditionHintsPath() {
        return conditionHintsPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that the port is in [0, 65535] (0 binds an
     * ephemeral port), the pool size and timeout are positive and the
     * database URL is a non-blank JDBC URL.
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private String databaseUrl = "jdbc:sqlite:usage.db";
        private int scanMaxConcurrency = 8;
        private long scanTimeoutMs = 30_000;
        private String conditionHintsPath = "";

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder databaseUrl(String v) {
            this.databaseUrl = v;
            return this;
        }

        public Builder scanMaxConcurrency(int v) {
            this.scanMaxConcurrency = v;
            return this;
        }

        public Builder scanTimeoutMs(long v) {
            this.scanTimeoutMs = v;
            return this;
        }

        public Builder conditionHintsPath(String v) {
            this.conditionHintsPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            if (databaseUrl == null || !databaseUrl.startsWith("jdbc:")) {
                throw new IllegalArgumentException("databaseUrl must be a JDBC URL, got: " + databaseUrl);
            }
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (scanMaxConcurrency < 1) {
                throw new IllegalArgumentException(
                        "scanMaxConcurrency must be >= 1, got: " + scanMaxConcurrency);
            }
            if (scanTimeoutMs < 1) {
                throw new IllegalArgumentException("scanTimeoutMs must be >= 1, got: " + scanTimeoutMs);
            }
            if (conditionHintsPath == null) {
                conditionHintsPath = "";
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "httpPort=" + httpPort +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", scanMaxConcurrency=" + scanMaxConcurrency +
                ", scanTimeoutMs=" + scanTimeoutMs +
                ", conditionHintsPath='" + conditionHintsPath + '\'' +
                '}';
    }
}
