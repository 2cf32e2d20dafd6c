package io.trading.executor.model;

/**
 * Operations a strategy can request on an order.
 */
public enum OrderOpType {
    CREATE,
    CANCEL,
    MODIFY
}
