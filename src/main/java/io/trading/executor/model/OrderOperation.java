package io.trading.executor.model;

/**
 * One order operation emitted by a strategy.
 *
 * @param opType Operation kind
 * @param order  Target order; for CANCEL only the ids are meaningful
 */
public record OrderOperation(
    OrderOpType opType,
    Order order
) {
    public OrderOperation {
        if (opType == null) {
            throw new IllegalArgumentException("opType cannot be null");
        }
        if (order == null) {
            throw new IllegalArgumentException("order cannot be null");
        }
    }

    public static OrderOperation create(Order order) {
        return new OrderOperation(OrderOpType.CREATE, order);
    }

    public static OrderOperation cancel(Order order) {
        return new OrderOperation(OrderOpType.CANCEL, order);
    }

    public static OrderOperation modify(Order order) {
        return new OrderOperation(OrderOpType.MODIFY, order);
    }
}
