package io.trading.executor.model;

/**
 * A new bar (or tick folded into a bar) arrived.
 *
 * @param timestamp Event time in milliseconds
 * @param symbol    Symbol of the series that fired, may be null
 * @param timeframe Resolution of the series that fired (e.g. "1h"), may be null
 */
public record MarketDataTrigger(
    long timestamp,
    String symbol,
    String timeframe
) implements Trigger {

    @Override
    public TriggerType type() {
        return TriggerType.MARKET_DATA;
    }
}
