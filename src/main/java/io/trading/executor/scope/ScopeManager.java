package io.trading.executor.scope;

import io.trading.executor.data.SnapshotDataAdapter;
import io.trading.executor.error.ScopeConflictException;
import io.trading.executor.lookup.ConfigLookupService;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.strategy.StrategyContext;
import io.trading.executor.strategy.StrategyInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens and tracks execution scopes, at most one per (account, strategy) pair.
 *
 * A scope is also bound to the worker thread running the strategy through
 * {@link #bind(ExecutionScope)}, so helper code deep inside a strategy call can reach it with
 * {@link #current()} without any process-wide state.
 */
public class ScopeManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScopeManager.class);

    private final ConfigLookupService lookupService;
    private final ConcurrentHashMap<ScopeKey, ExecutionScope> openScopes = new ConcurrentHashMap<>();
    private final ThreadLocal<ExecutionScope> current = new ThreadLocal<>();

    public ScopeManager(ConfigLookupService lookupService) {
        this.lookupService = lookupService;
    }

    /**
     * Opens a scope for the pair. Use with try-with-resources so the scope is closed on
     * every exit path.
     *
     * @throws ScopeConflictException if the pair already has an open scope
     */
    public ExecutionScope open(ScopeKey key, ExecutionRequest request, StrategyInstance instance) {
        ExecutionScope scope = new ExecutionScope(key, request, new SnapshotDataAdapter(request), instance, this);
        ExecutionScope existing = openScopes.putIfAbsent(key, scope);
        if (existing != null) {
            LOGGER.error("[{}] Scope conflict: exec {} while {} is open", key, request.execId(), existing.getExecId());
            throw new ScopeConflictException(key.accountId(), key.strategyId(), existing.getExecId());
        }
        scope.attachContext(new StrategyContext(scope, lookupService));
        LOGGER.debug("[{}] Opened scope for exec {}", key, request.execId());
        return scope;
    }

    /**
     * Binds the scope to the calling thread until the returned binding is closed.
     */
    public ScopeBinding bind(ExecutionScope scope) {
        ExecutionScope previous = current.get();
        current.set(scope);
        return new ScopeBinding(previous);
    }

    /**
     * Scope bound to the calling thread, if it is still open.
     */
    public Optional<ExecutionScope> current() {
        ExecutionScope scope = current.get();
        return scope != null && scope.isOpen() ? Optional.of(scope) : Optional.empty();
    }

    public boolean isOpen(ScopeKey key) {
        return openScopes.containsKey(key);
    }

    public int getOpenCount() {
        return openScopes.size();
    }

    void release(ExecutionScope scope) {
        if (openScopes.remove(scope.getKey(), scope)) {
            LOGGER.debug("[{}] Closed scope for exec {}", scope.getKey(), scope.getExecId());
        }
    }

    /**
     * Restores the previous thread binding when closed.
     */
    public final class ScopeBinding implements AutoCloseable {
        private final ExecutionScope previous;

        private ScopeBinding(ExecutionScope previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }
}
