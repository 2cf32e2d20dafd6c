package io.trading.executor.config;

import io.trading.executor.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the Strategy Executor.
 *
 * @param executorId       Executor instance identifier
 * @param httpPort         Port of the HTTP server (exec, health, metrics)
 * @param healthCheckMs    Health check interval in milliseconds
 * @param dedupRetentionMs How long completed executions are remembered for idempotency
 * @param dedupMaxEntries  Upper bound on remembered executions
 * @param timeoutGraceMs   How long a timed-out strategy call may keep running before its
 *                         instance is retired
 * @param venues           Venue identifiers accepted in requests
 * @param strategies       Strategy bindings; the first one is the default strategy
 * @param configDir        Descriptor directory searched before the standard ones, null for none
 */
public record ExecutorConfig(
    String executorId,
    int httpPort,
    int healthCheckMs,
    long dedupRetentionMs,
    int dedupMaxEntries,
    long timeoutGraceMs,
    Set<String> venues,
    List<StrategyBinding> strategies,
    String configDir
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorConfig.class);

    private static final int DEFAULT_HTTP_PORT = 8080;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final long DEFAULT_DEDUP_RETENTION_MS = 600_000;
    private static final int DEFAULT_DEDUP_MAX_ENTRIES = 10_000;
    private static final long DEFAULT_TIMEOUT_GRACE_MS = 2000;
    private static final String DEFAULT_STRATEGIES =
        "dual_ma:io.trading.executor.example.DualMovingAverageStrategy";

    public ExecutorConfig {
        if (executorId == null || executorId.isEmpty()) {
            throw new IllegalArgumentException("executorId cannot be null or empty");
        }
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("httpPort must be between 0 and 65535");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (dedupRetentionMs <= 0) {
            throw new IllegalArgumentException("dedupRetentionMs must be positive");
        }
        if (dedupMaxEntries <= 0) {
            throw new IllegalArgumentException("dedupMaxEntries must be positive");
        }
        if (timeoutGraceMs < 0) {
            throw new IllegalArgumentException("timeoutGraceMs cannot be negative");
        }
        if (venues == null || venues.isEmpty()) {
            throw new IllegalArgumentException("venues cannot be null or empty");
        }
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("strategies cannot be null or empty");
        }
        venues = venues.stream().map(v -> v.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        strategies = List.copyOf(strategies);
        if (configDir != null && configDir.isBlank()) {
            configDir = null;
        }
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - EXECUTOR_ID: Executor instance ID (default: "executor-0")
     * - HTTP_PORT: HTTP port (default: 8080)
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - DEDUP_RETENTION_MS: Idempotency retention (default: 600000)
     * - DEDUP_MAX_ENTRIES: Idempotency capacity (default: 10000)
     * - TIMEOUT_GRACE_MS: Grace period for timed-out strategy calls (default: 2000)
     * - VENUES: Accepted venues (e.g., "binance,okx,bybit")
     * - STRATEGIES: Strategy bindings (e.g., "dual_ma:io.trading.executor.example.DualMovingAverageStrategy")
     * - EXECUTOR_CONFIG_DIR: Descriptor override directory
     */
    public static ExecutorConfig fromEnv() {
        String executorId = System.getenv("EXECUTOR_ID");
        if (executorId == null || executorId.isEmpty()) {
            executorId = "executor-0";
        }

        String venuesStr = System.getenv("VENUES");
        if (venuesStr == null || venuesStr.isEmpty()) {
            venuesStr = Arrays.stream(Venue.values()).map(Venue::id).collect(Collectors.joining(","));
        }

        String strategiesStr = System.getenv("STRATEGIES");
        if (strategiesStr == null || strategiesStr.isEmpty()) {
            strategiesStr = DEFAULT_STRATEGIES;
        }

        return new ExecutorConfig(
            executorId,
            parseIntEnv("HTTP_PORT", DEFAULT_HTTP_PORT),
            parseIntEnv("HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            parseLongEnv("DEDUP_RETENTION_MS", DEFAULT_DEDUP_RETENTION_MS),
            parseIntEnv("DEDUP_MAX_ENTRIES", DEFAULT_DEDUP_MAX_ENTRIES),
            parseLongEnv("TIMEOUT_GRACE_MS", DEFAULT_TIMEOUT_GRACE_MS),
            parseVenues(venuesStr),
            parseStrategies(strategiesStr),
            System.getenv("EXECUTOR_CONFIG_DIR")
        );
    }

    static Set<String> parseVenues(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    static List<StrategyBinding> parseStrategies(String value) {
        return Arrays.stream(value.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(StrategyBinding::fromString)
            .collect(Collectors.toList());
    }

    private static int parseIntEnv(String key, int defaultValue) {
        return (int) parseLongEnv(key, defaultValue);
    }

    private static long parseLongEnv(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * The default strategy id, used for requests that name none.
     */
    public String defaultStrategyId() {
        return strategies.get(0).strategyId();
    }

    public boolean isKnownVenue(String venue) {
        return venue != null && venues.contains(venue.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Creates a new builder for ExecutorConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ExecutorConfig.
     */
    public static class Builder {
        private String executorId = "executor-0";
        private int httpPort = DEFAULT_HTTP_PORT;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private long dedupRetentionMs = DEFAULT_DEDUP_RETENTION_MS;
        private int dedupMaxEntries = DEFAULT_DEDUP_MAX_ENTRIES;
        private long timeoutGraceMs = DEFAULT_TIMEOUT_GRACE_MS;
        private final Set<String> venues = new LinkedHashSet<>();
        private final List<StrategyBinding> strategies = new ArrayList<>();
        private String configDir;

        public Builder executorId(String executorId) {
            this.executorId = executorId;
            return this;
        }

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder dedupRetentionMs(long dedupRetentionMs) {
            this.dedupRetentionMs = dedupRetentionMs;
            return this;
        }

        public Builder dedupMaxEntries(int dedupMaxEntries) {
            this.dedupMaxEntries = dedupMaxEntries;
            return this;
        }

        public Builder timeoutGraceMs(long timeoutGraceMs) {
            this.timeoutGraceMs = timeoutGraceMs;
            return this;
        }

        public Builder addVenue(String venue) {
            this.venues.add(venue);
            return this;
        }

        public Builder addStrategy(String strategyId, String className) {
            this.strategies.add(new StrategyBinding(strategyId, className));
            return this;
        }

        public Builder configDir(String configDir) {
            this.configDir = configDir;
            return this;
        }

        public ExecutorConfig build() {
            if (venues.isEmpty()) {
                for (Venue venue : Venue.values()) {
                    venues.add(venue.id());
                }
            }
            if (strategies.isEmpty()) {
                strategies.addAll(parseStrategies(DEFAULT_STRATEGIES));
            }
            return new ExecutorConfig(
                executorId,
                httpPort,
                healthCheckMs,
                dedupRetentionMs,
                dedupMaxEntries,
                timeoutGraceMs,
                Set.copyOf(venues),
                List.copyOf(strategies),
                configDir
            );
        }
    }
}
