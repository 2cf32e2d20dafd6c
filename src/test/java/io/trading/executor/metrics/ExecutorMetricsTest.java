package io.trading.executor.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.executor.model.ExecutionStatus;
import io.trading.executor.model.HealthStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExecutorMetrics.
 */
class ExecutorMetricsTest {

    private final CollectorRegistry registry = new CollectorRegistry();
    private final ExecutorMetrics metrics = new ExecutorMetrics(registry, false);

    @Test
    void testExecutionCounters() {
        metrics.recordExecution(ExecutionStatus.SUCCESS, 12.5);
        metrics.recordExecution(ExecutionStatus.SUCCESS, 7.5);
        metrics.recordExecution(ExecutionStatus.FAILED, 1000);

        assertEquals(2.0, metrics.getExecutions(ExecutionStatus.SUCCESS));
        assertEquals(1.0, metrics.getExecutions(ExecutionStatus.FAILED));
        assertEquals(0.0, metrics.getExecutions(ExecutionStatus.PARTIAL_SUCCESS));
        assertEquals(3.0, registry.getSampleValue("executor_execution_latency_milliseconds_count"));
    }

    @Test
    void testEventCounters() {
        metrics.recordDedupHit();
        metrics.recordTimeout();
        metrics.recordCallbackFailures(0);
        metrics.recordCallbackFailures(2);
        metrics.recordDescriptorParse();
        metrics.recordRejected();

        assertEquals(1.0, metrics.getDedupHits());
        assertEquals(1.0, metrics.getTimeouts());
        assertEquals(2.0, metrics.getCallbackFailures());
        assertEquals(1.0, metrics.getDescriptorParses());
        assertEquals(1.0, registry.getSampleValue("executor_rejected_requests_total"));
    }

    @Test
    void testGauges() {
        metrics.executionStarted();
        metrics.executionStarted();
        metrics.executionFinished();
        metrics.setHealthStatus(HealthStatus.UNHEALTHY);

        assertEquals(1.0, metrics.getInFlight());
        assertEquals(2.0, registry.getSampleValue("executor_health_status"));
    }

    @Test
    void testSeparateRegistriesDoNotCollide() {
        ExecutorMetrics other = new ExecutorMetrics(new CollectorRegistry(), false);
        other.recordTimeout();

        assertEquals(0.0, metrics.getTimeouts());
        assertSame(registry, metrics.getRegistry());
    }
}
