package com.ipcsentinel.host;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration for the sentinel host process.
 *
 * <p>
 * Values are resolved from environment variables with defaults:
 * </p>
 * <ul>
 * <li>{@code GUARD_CONFIG_PATH} – guard YAML file; blank means the bundled
 * defaults</li>
 * <li>{@code STATS_PORT} – port of the health/stats endpoint (8080)</li>
 * <li>{@code STATS_ENABLED} – whether that endpoint starts (true)</li>
 * <li>{@code CLEANUP_INTERVAL_MS} – cadence of scheduled cleanup (60000)</li>
 * </ul>
 *
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} for
 * tests. The builder validates at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class HostConfig {

    public static final String ENV_GUARD_CONFIG_PATH = "GUARD_CONFIG_PATH";
    public static final String ENV_STATS_PORT = "STATS_PORT";
    public static final String ENV_STATS_ENABLED = "STATS_ENABLED";
    public static final String ENV_CLEANUP_INTERVAL_MS = "CLEANUP_INTERVAL_MS";

    private final String guardConfigPath;
    private final int statsPort;
    private final boolean statsEnabled;
    private final long cleanupIntervalMs;

    private HostConfig(Builder b) {
        this.guardConfigPath = b.guardConfigPath;
        this.statsPort = b.statsPort;
        this.statsEnabled = b.statsEnabled;
        this.cleanupIntervalMs = b.cleanupIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory – resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link HostConfig} from the process environment.
     *
     * @throws IllegalStateException    if a numeric value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static HostConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build a {@link HostConfig} from an arbitrary variable lookup.
     */
    static HostConfig fromEnvironment(UnaryOperator<String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        try {
            return new Builder()
                    .guardConfigPath(env(lookup, ENV_GUARD_CONFIG_PATH, ""))
                    .statsPort(Integer.parseInt(env(lookup, ENV_STATS_PORT, "8080")))
                    .statsEnabled(Boolean.parseBoolean(env(lookup, ENV_STATS_ENABLED, "true")))
                    .cleanupIntervalMs(Long.parseLong(env(lookup, ENV_CLEANUP_INTERVAL_MS, "60000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getGuardConfigPath() {
        return guardConfigPath;
    }

    public boolean hasGuardConfigPath() {
        return !guardConfigPath.isBlank();
    }

    public int getStatsPort() {
        return statsPort;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link HostConfig}.
     *
     * <p>
     * {@link #build()} checks the port is in [0, 65535] (0 picks a free
     * port) and the cleanup interval is positive.
     * </p>
     */
    public static class Builder {
        private String guardConfigPath = "";
        private int statsPort = 8080;
        private boolean statsEnabled = true;
        private long cleanupIntervalMs = 60_000;

        public Builder guardConfigPath(String v) {
            this.guardConfigPath = v;
            return this;
        }

        public Builder statsPort(int v) {
            this.statsPort = v;
            return this;
        }

        public Builder statsEnabled(boolean v) {
            this.statsEnabled = v;
            return this;
        }

        public Builder cleanupIntervalMs(long v) {
            this.cleanupIntervalMs = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public HostConfig build() {
            Objects.requireNonNull(guardConfigPath, "guardConfigPath required");
            if (statsPort < 0 || statsPort > 65_535) {
                throw new IllegalArgumentException(
                        "statsPort must be in [0, 65535], got: " + statsPort);
            }
            if (cleanupIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "cleanupIntervalMs must be >= 1, got: " + cleanupIntervalMs);
            }
            return new HostConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "HostConfig{" +
                "guardConfigPath='" + guardConfigPath + '\'' +
                ", statsPort=" + statsPort +
                ", statsEnabled=" + statsEnabled +
                ", cleanupIntervalMs=" + cleanupIntervalMs +
                '}';
    }
}
