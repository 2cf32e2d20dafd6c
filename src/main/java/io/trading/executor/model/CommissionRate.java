package io.trading.executor.model;

import java.math.BigDecimal;

/**
 * Maker and taker fee rates as fractions (0.001 = 0.1%).
 *
 * @param symbol       Instrument symbol
 * @param makerFeeRate Maker rate; negative for a rebate
 * @param takerFeeRate Taker rate
 */
public record CommissionRate(
    String symbol,
    BigDecimal makerFeeRate,
    BigDecimal takerFeeRate
) {
    private static final BigDecimal MIN_MAKER_RATE = BigDecimal.ONE.negate();

    public CommissionRate {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (makerFeeRate == null || makerFeeRate.compareTo(MIN_MAKER_RATE) < 0) {
            throw new IllegalArgumentException("maker_fee_rate must be >= -1");
        }
        if (takerFeeRate == null || takerFeeRate.signum() < 0) {
            throw new IllegalArgumentException("taker_fee_rate must be >= 0");
        }
    }
}
