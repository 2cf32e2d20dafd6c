package io.trading.executor.model;

import java.math.BigDecimal;

/**
 * OHLCV bar.
 *
 * @param openTime  Bar open time in milliseconds
 * @param closeTime Bar close time in milliseconds
 * @param open      Open price
 * @param high      High price
 * @param low       Low price
 * @param close     Close price
 * @param volume    Traded volume
 */
public record Bar(
    long openTime,
    long closeTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume
) {
    public Bar {
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("bar prices cannot be null");
        }
        if (volume == null) {
            volume = BigDecimal.ZERO;
        }
        if (closeTime < openTime) {
            throw new IllegalArgumentException("closeTime cannot be before openTime");
        }
    }
}
