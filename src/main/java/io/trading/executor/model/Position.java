package io.trading.executor.model;

import java.math.BigDecimal;

/**
 * Open position on one instrument.
 *
 * @param symbol           Instrument symbol
 * @param quantity         Signed quantity, negative for short
 * @param averageCostPrice Average entry price, may be null
 * @param unrealizedPnl    Unrealized profit and loss, may be null
 */
public record Position(
    String symbol,
    BigDecimal quantity,
    BigDecimal averageCostPrice,
    BigDecimal unrealizedPnl
) {
    public Position {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (quantity == null) {
            quantity = BigDecimal.ZERO;
        }
    }
}
