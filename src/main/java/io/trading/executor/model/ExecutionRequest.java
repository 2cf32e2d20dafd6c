package io.trading.executor.model;

import java.util.List;
import java.util.Map;

/**
 * One execution request: a trigger plus everything the strategy may look at.
 * Immutable; owned by a single gateway invocation.
 *
 * @param execId            Caller-supplied idempotency key
 * @param maxTimeoutSeconds Upper bound on strategy run time, in seconds
 * @param trigger           Event that caused this execution
 * @param marketData        One entry per instrument/resolution pair
 * @param account           Account snapshot
 * @param incompleteOrders  Orders still working
 * @param completedOrders   Orders in a terminal state
 * @param exchange          Venue identifier, used as a descriptor lookup key
 * @param strategyId        Strategy to run, null to use the default strategy
 * @param strategyParams    Opaque parameters passed through to the strategy
 */
public record ExecutionRequest(
    String execId,
    double maxTimeoutSeconds,
    Trigger trigger,
    List<MarketDataContext> marketData,
    Account account,
    List<Order> incompleteOrders,
    List<Order> completedOrders,
    String exchange,
    String strategyId,
    Map<String, String> strategyParams
) {
    public ExecutionRequest {
        marketData = marketData == null ? List.of() : List.copyOf(marketData);
        incompleteOrders = incompleteOrders == null ? List.of() : List.copyOf(incompleteOrders);
        completedOrders = completedOrders == null ? List.of() : List.copyOf(completedOrders);
        strategyParams = strategyParams == null ? Map.of() : Map.copyOf(strategyParams);
    }

    /**
     * Copy of this request bound to another strategy id.
     */
    public ExecutionRequest withStrategyId(String strategyId) {
        return new ExecutionRequest(execId, maxTimeoutSeconds, trigger, marketData, account,
            incompleteOrders, completedOrders, exchange, strategyId, strategyParams);
    }

    public long maxTimeoutMillis() {
        return (long) Math.ceil(maxTimeoutSeconds * 1000.0);
    }
}
