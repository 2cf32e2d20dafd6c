package io.trading.executor.scope;

import io.trading.executor.data.DataAdapter;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.OrderOperation;
import io.trading.executor.strategy.StrategyContext;
import io.trading.executor.strategy.StrategyInstance;
import io.trading.executor.strategy.StrategyState;

import java.util.ArrayList;
import java.util.List;

/**
 * Live binding of one execution to its (account, strategy) pair: the request, a data adapter
 * over the request's snapshots, the strategy instance and a working copy of its state.
 *
 * Closing clears every binding and frees the pair. Once closed, every accessor throws
 * {@link IllegalStateException}, which is what stops an abandoned strategy call from
 * emitting orders or touching state after its execution has been answered.
 */
public class ExecutionScope implements AutoCloseable {

    private final ScopeKey key;
    private final String execId;
    private final ScopeManager manager;

    private ExecutionRequest request;
    private DataAdapter dataAdapter;
    private StrategyInstance instance;
    private StrategyState workingState;
    private StrategyContext context;
    private final List<OrderOperation> orderOperations = new ArrayList<>();
    private int orderSequence = 0;
    private boolean open = true;

    ExecutionScope(ScopeKey key, ExecutionRequest request, DataAdapter dataAdapter,
                   StrategyInstance instance, ScopeManager manager) {
        this.key = key;
        this.execId = request.execId();
        this.manager = manager;
        this.request = request;
        this.dataAdapter = dataAdapter;
        this.instance = instance;
        this.workingState = instance.beginState();
    }

    public ScopeKey getKey() {
        return key;
    }

    public String getExecId() {
        return execId;
    }

    public synchronized boolean isOpen() {
        return open;
    }

    public synchronized ExecutionRequest request() {
        requireOpen();
        return request;
    }

    public synchronized DataAdapter dataAdapter() {
        requireOpen();
        return dataAdapter;
    }

    public synchronized StrategyInstance instance() {
        requireOpen();
        return instance;
    }

    public synchronized StrategyState state() {
        requireOpen();
        return workingState;
    }

    public synchronized StrategyContext context() {
        requireOpen();
        return context;
    }

    synchronized void attachContext(StrategyContext context) {
        this.context = context;
    }

    public synchronized void addOrderOperation(OrderOperation operation) {
        requireOpen();
        orderOperations.add(operation);
    }

    /**
     * Next per-execution order sequence number, starting at 1.
     */
    public synchronized int nextOrderSequence() {
        requireOpen();
        return ++orderSequence;
    }

    public synchronized List<OrderOperation> orderOperations() {
        requireOpen();
        return List.copyOf(orderOperations);
    }

    /**
     * Makes the working state the instance's persistent state. Called only for executions
     * that completed; abandoned and failed ones simply never commit.
     */
    public synchronized void commitState() {
        requireOpen();
        instance.commitState(workingState);
    }

    /**
     * Clears every binding and frees the pair. Idempotent.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (!open) {
                return;
            }
            open = false;
            request = null;
            dataAdapter = null;
            instance = null;
            workingState = null;
            context = null;
            orderOperations.clear();
        }
        manager.release(this);
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("Execution scope " + execId + " for " + key + " is closed");
        }
    }

    @Override
    public String toString() {
        return "ExecutionScope[" + key + ", exec=" + execId + "]";
    }
}
