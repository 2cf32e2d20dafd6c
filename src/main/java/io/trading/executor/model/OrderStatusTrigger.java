package io.trading.executor.model;

/**
 * An order changed status.
 *
 * @param timestamp Event time in milliseconds
 * @param orderId   Order id or unique id of the order that changed, may be null
 */
public record OrderStatusTrigger(
    long timestamp,
    String orderId
) implements Trigger {

    @Override
    public TriggerType type() {
        return TriggerType.ORDER_STATUS;
    }
}
