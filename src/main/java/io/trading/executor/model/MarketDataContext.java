package io.trading.executor.model;

import java.util.List;

/**
 * Bars of one instrument at one resolution, oldest first.
 *
 * @param symbol    Instrument symbol (e.g. "BTCUSDT")
 * @param timeframe Resolution (e.g. "1h", "1d")
 * @param bars      Bars ordered by open time ascending
 */
public record MarketDataContext(
    String symbol,
    String timeframe,
    List<Bar> bars
) {
    public MarketDataContext {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (timeframe == null || timeframe.isEmpty()) {
            throw new IllegalArgumentException("timeframe cannot be null or empty");
        }
        bars = bars == null ? List.of() : List.copyOf(bars);
        for (int i = 1; i < bars.size(); i++) {
            if (bars.get(i).openTime() < bars.get(i - 1).openTime()) {
                throw new IllegalArgumentException("bars must be ordered oldest first: " + symbol + "/" + timeframe);
            }
        }
    }
}
