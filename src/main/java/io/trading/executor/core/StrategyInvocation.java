package io.trading.executor.core;

import io.trading.executor.error.ExecutorException;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.scheduler.DispatchResult;
import io.trading.executor.scheduler.PhaseResolver;
import io.trading.executor.scope.ExecutionScope;
import io.trading.executor.scope.ScopeManager;
import io.trading.executor.strategy.StrategyContext;
import io.trading.executor.strategy.StrategyInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * The part of an execution that runs strategy code, on a worker thread: initialization,
 * the before-trading hook on a new trading day, due periodic callbacks, then the trigger's
 * entry point.
 *
 * Callback and before-trading failures become warnings. Initialization and entry point
 * failures propagate and fail the execution.
 */
class StrategyInvocation implements Callable<StrategyInvocation.Outcome> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StrategyInvocation.class);

    private final ExecutionScope scope;
    private final ScopeManager scopeManager;
    private final PhaseResolver phaseResolver;
    private final TriggerDispatcher dispatcher;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean started = false;

    StrategyInvocation(ExecutionScope scope, ScopeManager scopeManager,
                       PhaseResolver phaseResolver, TriggerDispatcher dispatcher) {
        this.scope = scope;
        this.scopeManager = scopeManager;
        this.phaseResolver = phaseResolver;
        this.dispatcher = dispatcher;
    }

    @Override
    public Outcome call() throws Exception {
        started = true;
        try (ScopeManager.ScopeBinding binding = scopeManager.bind(scope)) {
            ExecutionRequest request = scope.request();
            StrategyInstance instance = scope.instance();
            StrategyContext context = scope.context();
            List<String> warnings = new ArrayList<>();

            try {
                instance.initializeIfNeeded(context);
            } catch (Exception e) {
                throw new ExecutorException("Strategy initialize failed: " + describe(e), e);
            }

            long timestamp = request.trigger().timestamp();
            String reference = TriggerDispatcher.referenceInstrument(request);
            LocalDate tradingDay = phaseResolver.tradingDay(timestamp, reference);
            if (instance.startTradingDay(tradingDay)) {
                try {
                    instance.getStrategy().beforeTrading(context);
                } catch (Exception e) {
                    String warning = "beforeTrading failed: " + describe(e);
                    LOGGER.warn("[{}] {}", scope.getKey(), warning, e);
                    warnings.add(warning);
                }
            }

            DispatchResult callbacks = instance.getScheduler().dispatch(context, timestamp, phaseResolver, reference);
            warnings.addAll(callbacks.warnings());

            dispatcher.dispatch(instance.getStrategy(), context, request);
            List<String> allWarnings = new ArrayList<>(phaseResolver.getWarnings());
            allWarnings.addAll(warnings);
            return new Outcome(allWarnings, callbacks.warnings().size());
        } finally {
            finished.countDown();
        }
    }

    /**
     * Waits for the strategy code to return, whether or not its result is still wanted.
     *
     * A call cancelled before it started counts as finished: once its scope is closed it
     * can no longer reach any state.
     *
     * @return true if it returned within the wait
     */
    boolean awaitFinished(long timeoutMs) throws InterruptedException {
        if (!started) {
            return true;
        }
        return finished.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    boolean isFinished() {
        return !started || finished.getCount() == 0;
    }

    static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    /**
     * @param warnings         Non-fatal problems, in the order they happened
     * @param callbackFailures Periodic callbacks that failed
     */
    record Outcome(List<String> warnings, int callbackFailures) {
        Outcome {
            warnings = List.copyOf(warnings);
        }
    }
}
