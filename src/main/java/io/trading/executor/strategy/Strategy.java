package io.trading.executor.strategy;

import io.trading.executor.model.Bar;
import io.trading.executor.model.Order;
import io.trading.executor.model.RiskManageTrigger;

/**
 * User strategy. One instance is created per (account, strategy) pair and reused for every
 * trigger of that pair; calls on one instance never overlap.
 *
 * Strategies emit orders through the {@link StrategyContext} they are handed and must not
 * keep it, or start threads that use it, past the call that received it.
 */
public interface Strategy {

    /**
     * Called once, before the first trigger. The only place periodic callbacks may be
     * registered with {@link StrategyContext#runDaily}.
     */
    void initialize(StrategyContext context) throws Exception;

    /**
     * Called on the first trigger of each trading day, before periodic callbacks.
     */
    default void beforeTrading(StrategyContext context) throws Exception {
    }

    /**
     * Called for market-data triggers with the latest bar of the series that fired.
     */
    default void onBar(StrategyContext context, Bar bar) throws Exception {
    }

    /**
     * Called for order-status triggers with the order that changed.
     */
    default void onOrderStatus(StrategyContext context, Order order) throws Exception {
    }

    /**
     * Called for risk-management triggers.
     */
    default void onRiskEvent(StrategyContext context, RiskManageTrigger event) throws Exception {
    }
}
