package io.trading.executor.model;

import java.math.BigDecimal;

/**
 * Order-size and price constraints for one instrument on one venue.
 *
 * @param symbol            Instrument symbol
 * @param minQuantity       Smallest order quantity
 * @param quantityStep      Quantity increment
 * @param minPrice          Smallest price
 * @param priceTick         Price increment
 * @param pricePrecision    Decimal places for prices
 * @param quantityPrecision Decimal places for quantities
 * @param maxLeverage       Highest leverage allowed
 */
public record TradingRule(
    String symbol,
    BigDecimal minQuantity,
    BigDecimal quantityStep,
    BigDecimal minPrice,
    BigDecimal priceTick,
    int pricePrecision,
    int quantityPrecision,
    BigDecimal maxLeverage
) {
    public TradingRule {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (minQuantity == null || minQuantity.signum() < 0) {
            throw new IllegalArgumentException("min_quantity must be >= 0");
        }
        if (quantityStep == null || quantityStep.signum() <= 0) {
            throw new IllegalArgumentException("quantity_step must be > 0");
        }
        if (minPrice == null || minPrice.signum() < 0) {
            throw new IllegalArgumentException("min_price must be >= 0");
        }
        if (priceTick == null || priceTick.signum() <= 0) {
            throw new IllegalArgumentException("price_tick must be > 0");
        }
        if (pricePrecision < 0) {
            throw new IllegalArgumentException("price_precision must be >= 0");
        }
        if (quantityPrecision < 0) {
            throw new IllegalArgumentException("quantity_precision must be >= 0");
        }
        if (maxLeverage == null || maxLeverage.signum() <= 0) {
            throw new IllegalArgumentException("max_leverage must be > 0");
        }
    }
}
