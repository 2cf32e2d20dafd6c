package io.trading.executor.error;

/**
 * A second scope was opened for an (account, strategy) pair that already has one open.
 * Pair serialization makes this unreachable in normal operation.
 */
public class ScopeConflictException extends ExecutorException {

    private final String accountId;
    private final String strategyId;

    public ScopeConflictException(String accountId, String strategyId, String openExecId) {
        super(String.format("[%s:%s] Scope already open for exec %s", accountId, strategyId, openExecId));
        this.accountId = accountId;
        this.strategyId = strategyId;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getStrategyId() {
        return strategyId;
    }
}
