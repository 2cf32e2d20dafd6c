package io.trading.executor.model;

/**
 * The event that caused an execution. One of {@link MarketDataTrigger},
 * {@link RiskManageTrigger} or {@link OrderStatusTrigger}.
 */
public interface Trigger {

    TriggerType type();

    /**
     * Event time in epoch milliseconds.
     */
    long timestamp();
}
