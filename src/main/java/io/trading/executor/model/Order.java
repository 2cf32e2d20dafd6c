package io.trading.executor.model;

import java.math.BigDecimal;

/**
 * Order snapshot, either supplied by the caller or created by a strategy.
 *
 * @param orderId          Venue order id, empty for orders not yet routed
 * @param uniqueId         Client order id
 * @param symbol           Instrument symbol
 * @param side             Buy or sell
 * @param orderType        Market or limit
 * @param quantity         Ordered quantity
 * @param limitPrice       Limit price, null for market orders
 * @param status           Current status
 * @param executedQuantity Filled quantity
 * @param avgFillPrice     Average fill price, null if nothing filled
 * @param commission       Commission paid, null if unknown
 * @param cancelReason     Reason for cancellation, null if not cancelled
 */
public record Order(
    String orderId,
    String uniqueId,
    String symbol,
    Side side,
    OrderType orderType,
    BigDecimal quantity,
    BigDecimal limitPrice,
    OrderStatus status,
    BigDecimal executedQuantity,
    BigDecimal avgFillPrice,
    BigDecimal commission,
    String cancelReason
) {
    public Order {
        orderId = orderId == null ? "" : orderId;
        uniqueId = uniqueId == null ? "" : uniqueId;
        symbol = symbol == null ? "" : symbol;
        side = side == null ? Side.UNKNOWN : side;
        orderType = orderType == null ? OrderType.MARKET : orderType;
        quantity = quantity == null ? BigDecimal.ZERO : quantity;
        status = status == null ? OrderStatus.UNKNOWN : status;
        executedQuantity = executedQuantity == null ? BigDecimal.ZERO : executedQuantity;
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity cannot be negative");
        }
        if (limitPrice != null && limitPrice.signum() < 0) {
            throw new IllegalArgumentException("limitPrice cannot be negative");
        }
    }

    /**
     * Placeholder used when an order-status trigger names no resolvable order.
     */
    public static Order empty() {
        return new Order("", "", "", Side.UNKNOWN, OrderType.MARKET, BigDecimal.ZERO,
            null, OrderStatus.UNKNOWN, BigDecimal.ZERO, null, null, null);
    }

    /**
     * Matches either the venue order id or the client order id.
     */
    public boolean matches(String id) {
        return id != null && !id.isEmpty() && (id.equals(orderId) || id.equals(uniqueId));
    }
}
