package io.trading.executor.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.executor.model.ExecutionStatus;
import io.trading.executor.model.HealthStatus;

/**
 * Prometheus metrics collector for the Strategy Executor.
 *
 * Tracks:
 * - Executions by final status
 * - Rejected requests, dedup hits and timeouts
 * - Periodic callback failures
 * - Descriptor file parses
 * - In-flight executions and execution latency
 * - Health status
 *
 * Each instance owns its registry so that several executors (tests) can coexist in one JVM.
 */
public class ExecutorMetrics {

    // Counters
    private final Counter executions;
    private final Counter rejectedRequests;
    private final Counter dedupHits;
    private final Counter timeouts;
    private final Counter callbackFailures;
    private final Counter descriptorParses;

    // Gauges
    private final Gauge inFlight;
    private final Gauge healthStatus;

    // Summary (latency tracking)
    private final Summary executionLatency;

    private final CollectorRegistry registry;

    public ExecutorMetrics() {
        this(new CollectorRegistry(true), true);
    }

    /**
     * @param registry   Registry to register with
     * @param jvmMetrics Whether to add the JVM collectors (GC, memory, threads, etc.)
     */
    public ExecutorMetrics(CollectorRegistry registry, boolean jvmMetrics) {
        this.registry = registry;
        if (jvmMetrics) {
            DefaultExports.register(registry);
        }

        this.executions = Counter.build()
            .name("executor_executions_total")
            .help("Total number of executions by final status")
            .labelNames("status")
            .register(registry);

        this.rejectedRequests = Counter.build()
            .name("executor_rejected_requests_total")
            .help("Total number of requests rejected as invalid")
            .register(registry);

        this.dedupHits = Counter.build()
            .name("executor_dedup_hits_total")
            .help("Total number of requests answered from the dedup cache")
            .register(registry);

        this.timeouts = Counter.build()
            .name("executor_timeouts_total")
            .help("Total number of strategy calls abandoned after max_timeout")
            .register(registry);

        this.callbackFailures = Counter.build()
            .name("executor_callback_failures_total")
            .help("Total number of failed periodic callbacks")
            .register(registry);

        this.descriptorParses = Counter.build()
            .name("executor_descriptor_parses_total")
            .help("Total number of descriptor files parsed")
            .register(registry);

        this.inFlight = Gauge.build()
            .name("executor_in_flight_executions")
            .help("Number of executions currently in progress")
            .register(registry);

        // 0 = healthy, 1 = degraded, 2 = unhealthy
        this.healthStatus = Gauge.build()
            .name("executor_health_status")
            .help("Health status (0 = healthy, 1 = degraded, 2 = unhealthy)")
            .register(registry);

        this.executionLatency = Summary.build()
            .name("executor_execution_latency_milliseconds")
            .help("Execution latency in milliseconds")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);
    }

    public void recordExecution(ExecutionStatus status, double latencyMs) {
        executions.labels(status.name()).inc();
        executionLatency.observe(latencyMs);
    }

    public void recordRejected() {
        rejectedRequests.inc();
    }

    public void recordDedupHit() {
        dedupHits.inc();
    }

    public void recordTimeout() {
        timeouts.inc();
    }

    public void recordCallbackFailures(int count) {
        if (count > 0) {
            callbackFailures.inc(count);
        }
    }

    public void recordDescriptorParse() {
        descriptorParses.inc();
    }

    public void executionStarted() {
        inFlight.inc();
    }

    public void executionFinished() {
        inFlight.dec();
    }

    public void setHealthStatus(HealthStatus status) {
        healthStatus.set(status.ordinal());
    }

    /**
     * Returns the CollectorRegistry for HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getExecutions(ExecutionStatus status) {
        return executions.labels(status.name()).get();
    }

    public double getDedupHits() {
        return dedupHits.get();
    }

    public double getTimeouts() {
        return timeouts.get();
    }

    public double getCallbackFailures() {
        return callbackFailures.get();
    }

    public double getDescriptorParses() {
        return descriptorParses.get();
    }

    public double getInFlight() {
        return inFlight.get();
    }
}
