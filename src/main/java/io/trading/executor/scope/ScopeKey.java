package io.trading.executor.scope;

/**
 * Serialization and scope identity: one account running one strategy.
 *
 * @param accountId  Account identifier
 * @param strategyId Strategy identifier
 */
public record ScopeKey(
    String accountId,
    String strategyId
) {
    public ScopeKey {
        if (accountId == null || accountId.isEmpty()) {
            throw new IllegalArgumentException("accountId cannot be null or empty");
        }
        if (strategyId == null || strategyId.isEmpty()) {
            throw new IllegalArgumentException("strategyId cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return accountId + "/" + strategyId;
    }
}
