package io.trading.executor.core;

import io.trading.executor.metrics.ExecutorMetrics;
import io.trading.executor.model.HealthReport;
import io.trading.executor.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Polls executor health on a fixed interval, logs status changes and keeps statistics.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final Supplier<HealthReport> source;
    private final ExecutorMetrics metrics;
    private final ScheduledExecutorService scheduler;

    private volatile boolean running = false;
    private volatile HealthReport lastReport;
    private volatile long checkCount = 0;
    private volatile long degradedCount = 0;
    private volatile long lastTransitionTime = 0;

    public HealthMonitor(long checkIntervalMs, Supplier<HealthReport> source, ExecutorMetrics metrics) {
        this.checkIntervalMs = checkIntervalMs;
        this.source = source;
        this.metrics = metrics;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the health monitor.
     */
    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms)", checkIntervalMs);
    }

    /**
     * Stops the health monitor.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Runs one check now. Called by the schedule; exposed for tests.
     */
    public HealthReport performHealthCheck() {
        HealthReport report;
        try {
            report = source.get();
        } catch (RuntimeException e) {
            LOGGER.error("[HealthMonitor] Health check failed", e);
            report = new HealthReport(HealthStatus.UNHEALTHY, "Health check failed: " + e.getMessage(), List.of());
        }

        HealthReport previous = lastReport;
        checkCount++;
        if (report.status() != HealthStatus.HEALTHY) {
            degradedCount++;
            LOGGER.warn("[HealthMonitor] {}: {} {}", report.status(), report.message(), report.details());
        }
        if (previous == null || previous.status() != report.status()) {
            lastTransitionTime = System.currentTimeMillis();
            LOGGER.info("[HealthMonitor] Status {} -> {}",
                previous == null ? "UNKNOWN" : previous.status(), report.status());
        }
        lastReport = report;
        metrics.setHealthStatus(report.status());
        return report;
    }

    /**
     * Logs a summary of health statistics.
     */
    public void logSummary() {
        HealthReport report = lastReport;
        LOGGER.info("=== Health Monitor Summary ===");
        LOGGER.info("status={}, checks={}, nonHealthyChecks={}, lastTransition={}",
            report == null ? "UNKNOWN" : report.status(),
            checkCount,
            degradedCount,
            lastTransitionTime
        );
        LOGGER.info("=============================");
    }

    /**
     * Most recent report, null before the first check.
     */
    public HealthReport getLastReport() {
        return lastReport;
    }

    public long getCheckCount() {
        return checkCount;
    }

    public long getDegradedCount() {
        return degradedCount;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }
}
