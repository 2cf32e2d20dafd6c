package io.trading.executor.core;

import io.trading.executor.config.ExecutorConfig;
import io.trading.executor.error.InvalidRequestException;
import io.trading.executor.lookup.ConfigLookupService;
import io.trading.executor.metrics.ExecutorMetrics;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.ExecutionResponse;
import io.trading.executor.model.HealthReport;
import io.trading.executor.model.HealthStatus;
import io.trading.executor.model.OrderOperation;
import io.trading.executor.scheduler.PhaseResolver;
import io.trading.executor.scope.ExecutionScope;
import io.trading.executor.scope.ScopeKey;
import io.trading.executor.scope.ScopeManager;
import io.trading.executor.strategy.StrategyInstance;
import io.trading.executor.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public entry point: {@link #exec} and {@link #health}.
 *
 * Per request: validate, take the pair's serialization permit, claim the execution id, open
 * the scope, run the strategy on a worker thread bounded by the request's timeout, assemble
 * the response, close the scope, store the response, release the permit.
 *
 * Timed-out calls are abandoned: the worker is interrupted, the scope is closed (which makes
 * every further context call fail), the working state is discarded and the Failed response
 * goes back at once. The pair stays unavailable until the abandoned call returns or the grace
 * period elapses: the pair's next execution waits out the rest of the grace period first. A
 * call still running after that gets its strategy instance retired, so nothing it still
 * touches is reused, and is reported by {@link #health()}.
 */
public class ExecutionGateway implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionGateway.class);

    private final ExecutorConfig config;
    private final StrategyRegistry registry;
    private final ExecutorMetrics metrics;
    private final ScopeManager scopeManager;
    private final DedupCache dedupCache;
    private final PairSerializer serializer;
    private final TriggerDispatcher dispatcher;
    private final ExecutorService workers;
    private final Map<String, AbandonedCall> abandoned = new ConcurrentHashMap<>();

    private volatile boolean running = true;

    public ExecutionGateway(ExecutorConfig config, StrategyRegistry registry,
                            ConfigLookupService lookupService, ExecutorMetrics metrics) {
        this.config = config;
        this.registry = registry;
        this.metrics = metrics;
        this.scopeManager = new ScopeManager(lookupService);
        this.dedupCache = new DedupCache(config.dedupRetentionMs(), config.dedupMaxEntries());
        this.serializer = new PairSerializer();
        this.dispatcher = new TriggerDispatcher();
        AtomicInteger workerCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "strategy-worker-" + workerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs one execution.
     *
     * @throws InvalidRequestException if the request is malformed; nothing is executed or stored
     */
    public ExecutionResponse exec(ExecutionRequest request) {
        ExecutionRequest resolved;
        try {
            resolved = validate(request);
        } catch (InvalidRequestException e) {
            metrics.recordRejected();
            LOGGER.warn("Rejected request: {}", e.getMessage());
            throw e;
        }

        ScopeKey key = new ScopeKey(resolved.account().accountId(), resolved.strategyId());
        long startNanos = System.nanoTime();
        metrics.executionStarted();
        try (PairSerializer.Permit permit = serializer.acquire(key)) {
            settleAbandoned(key);
            DedupCache.Claim claim = dedupCache.claim(resolved.execId());
            if (!claim.isOwner()) {
                metrics.recordDedupHit();
                LOGGER.debug("[{}] Duplicate exec {}, returning stored response", key, resolved.execId());
                return claim.await();
            }

            ExecutionResponse response = null;
            try {
                LOGGER.debug("[{}] Accepted exec {} ({})", key, resolved.execId(), resolved.trigger().type());
                response = execute(key, resolved);
            } catch (RuntimeException e) {
                LOGGER.error("[{}] Exec {} failed outside the strategy", key, resolved.execId(), e);
                response = ExecutionResponse.failed("Execution error: " + StrategyInvocation.describe(e), List.of());
            } finally {
                if (response == null) {
                    response = ExecutionResponse.failed("Execution aborted", List.of());
                }
                claim.complete(response);
                metrics.recordExecution(response.status(), (System.nanoTime() - startNanos) / 1_000_000.0);
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("[{}] Interrupted waiting for pair, exec {} not run", key, resolved.execId());
            return ExecutionResponse.failed("Interrupted before execution", List.of());
        } finally {
            metrics.executionFinished();
        }
    }

    private ExecutionResponse execute(ScopeKey key, ExecutionRequest request) {
        StrategyInstance instance = registry.instanceFor(key);
        PhaseResolver phaseResolver = PhaseResolver.fromParams(request.strategyParams());

        ExecutionResponse response;
        try (ExecutionScope scope = scopeManager.open(key, request, instance)) {
            StrategyInvocation invocation = new StrategyInvocation(scope, scopeManager, phaseResolver, dispatcher);
            Future<StrategyInvocation.Outcome> future = workers.submit(invocation);
            try {
                StrategyInvocation.Outcome outcome = future.get(request.maxTimeoutMillis(), TimeUnit.MILLISECONDS);
                List<OrderOperation> operations = scope.orderOperations();
                scope.commitState();
                metrics.recordCallbackFailures(outcome.callbackFailures());
                response = ExecutionResponse.completed(operations, outcome.warnings());
            } catch (TimeoutException e) {
                future.cancel(true);
                abandon(key, request.execId(), instance, invocation);
                metrics.recordTimeout();
                LOGGER.warn("[{}] Exec {} timed out after {}s, abandoning strategy call",
                    key, request.execId(), request.maxTimeoutSeconds());
                response = ExecutionResponse.failed(String.format(
                    "Timeout: strategy did not return within %ss", request.maxTimeoutSeconds()), List.of());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.warn("[{}] Strategy failed for exec {}: {}", key, request.execId(),
                    StrategyInvocation.describe(cause), cause);
                response = ExecutionResponse.failed(StrategyInvocation.describe(cause), List.of());
            } catch (InterruptedException e) {
                future.cancel(true);
                abandon(key, request.execId(), instance, invocation);
                Thread.currentThread().interrupt();
                response = ExecutionResponse.failed("Interrupted while waiting for strategy", List.of());
            }
        }
        return response;
    }

    private void abandon(ScopeKey key, String execId, StrategyInstance instance, StrategyInvocation invocation) {
        if (invocation.isFinished()) {
            return;
        }
        abandoned.put(execId, new AbandonedCall(key, execId, instance, invocation,
            System.currentTimeMillis() + config.timeoutGraceMs()));
    }

    /**
     * Waits out what is left of the grace period of an abandoned call on this pair. Called
     * with the pair's permit held.
     */
    private void settleAbandoned(ScopeKey key) throws InterruptedException {
        for (AbandonedCall call : abandoned.values()) {
            if (!call.key().equals(key) || call.isRetired()) {
                continue;
            }
            long remaining = call.graceDeadline() - System.currentTimeMillis();
            if (call.invocation().awaitFinished(Math.max(0, remaining))) {
                abandoned.remove(call.execId(), call);
                LOGGER.debug("[{}] Abandoned call for exec {} returned within grace period", key, call.execId());
            } else {
                retire(call);
            }
        }
    }

    private void retire(AbandonedCall call) {
        if (call.markRetired()) {
            registry.retire(call.instance());
            LOGGER.error("[{}] Abandoned call for exec {} still running after {} ms grace, instance retired",
                call.key(), call.execId(), config.timeoutGraceMs());
        }
    }

    /**
     * Checks the request and resolves the default strategy.
     *
     * @throws InvalidRequestException if anything required is missing or out of range
     */
    ExecutionRequest validate(ExecutionRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request cannot be null");
        }
        String execId = request.execId();
        if (execId == null || execId.isBlank()) {
            throw new InvalidRequestException("exec_id is required");
        }
        if (request.trigger() == null) {
            throw new InvalidRequestException(execId, "trigger is required");
        }
        if (request.trigger().timestamp() <= 0) {
            throw new InvalidRequestException(execId, "trigger timestamp must be positive");
        }
        if (!(request.maxTimeoutSeconds() > 0) || Double.isInfinite(request.maxTimeoutSeconds())) {
            throw new InvalidRequestException(execId, "max_timeout must be a positive number of seconds");
        }
        if (request.account() == null) {
            throw new InvalidRequestException(execId, "account is required");
        }
        if (!config.isKnownVenue(request.exchange())) {
            throw new InvalidRequestException(execId, "unknown exchange: " + request.exchange());
        }

        String strategyId = request.strategyId();
        if (strategyId == null || strategyId.isBlank()) {
            strategyId = registry.getDefaultStrategyId();
            if (strategyId == null) {
                throw new InvalidRequestException(execId, "no strategy registered");
            }
            return request.withStrategyId(strategyId);
        }
        if (!registry.contains(strategyId)) {
            throw new InvalidRequestException(execId, "unknown strategy: " + strategyId);
        }
        return request;
    }

    /**
     * Current service health.
     */
    public HealthReport health() {
        if (!running) {
            return new HealthReport(HealthStatus.UNHEALTHY, "Executor is shut down", List.of());
        }
        if (registry.size() == 0) {
            return new HealthReport(HealthStatus.UNHEALTHY, "No strategy registered", List.of());
        }

        List<String> details = new ArrayList<>();
        long now = System.currentTimeMillis();
        for (AbandonedCall call : abandoned.values()) {
            if (call.invocation().isFinished()) {
                abandoned.remove(call.execId(), call);
            } else if (now >= call.graceDeadline()) {
                retire(call);
                details.add(String.format("exec %s for %s still running %d ms after grace period",
                    call.execId(), call.key(), now - call.graceDeadline()));
            }
        }
        if (!details.isEmpty()) {
            return new HealthReport(HealthStatus.DEGRADED, "Abandoned strategy calls still running", details);
        }
        return new HealthReport(HealthStatus.HEALTHY, "All systems operational", List.of());
    }

    public DedupCache getDedupCache() {
        return dedupCache;
    }

    public ScopeManager getScopeManager() {
        return scopeManager;
    }

    public PairSerializer getSerializer() {
        return serializer;
    }

    public StrategyRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Execution gateway stopped");
    }

    private static final class AbandonedCall {
        private final ScopeKey key;
        private final String execId;
        private final StrategyInstance instance;
        private final StrategyInvocation invocation;
        private final long graceDeadline;
        private final AtomicBoolean retired = new AtomicBoolean(false);

        private AbandonedCall(ScopeKey key, String execId, StrategyInstance instance,
                              StrategyInvocation invocation, long graceDeadline) {
            this.key = key;
            this.execId = execId;
            this.instance = instance;
            this.invocation = invocation;
            this.graceDeadline = graceDeadline;
        }

        ScopeKey key() {
            return key;
        }

        String execId() {
            return execId;
        }

        StrategyInstance instance() {
            return instance;
        }

        StrategyInvocation invocation() {
            return invocation;
        }

        long graceDeadline() {
            return graceDeadline;
        }

        boolean isRetired() {
            return retired.get();
        }

        boolean markRetired() {
            return retired.compareAndSet(false, true);
        }
    }
}
