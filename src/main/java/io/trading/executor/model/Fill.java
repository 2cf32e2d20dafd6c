package io.trading.executor.model;

import java.math.BigDecimal;

/**
 * Executed portion of one order.
 *
 * @param orderId          Order id (venue id, or client id when not routed yet)
 * @param symbol           Instrument symbol
 * @param side             Buy or sell
 * @param executedQuantity Filled quantity
 * @param avgFillPrice     Average fill price, may be null
 * @param commission       Commission paid, may be null
 */
public record Fill(
    String orderId,
    String symbol,
    Side side,
    BigDecimal executedQuantity,
    BigDecimal avgFillPrice,
    BigDecimal commission
) {
    /**
     * Builds a fill record from an order that has executed quantity.
     */
    public static Fill fromOrder(Order order) {
        String id = order.orderId().isEmpty() ? order.uniqueId() : order.orderId();
        return new Fill(id, order.symbol(), order.side(), order.executedQuantity(),
            order.avgFillPrice(), order.commission());
    }
}
