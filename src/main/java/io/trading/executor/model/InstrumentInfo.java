package io.trading.executor.model;

import java.util.List;

/**
 * What the request snapshot says about one instrument.
 *
 * @param symbol     Instrument symbol
 * @param marketType Detected market family
 * @param timeframes Resolutions present in the snapshot
 * @param firstBarTime Open time of the oldest bar across resolutions, 0 if no bars
 * @param lastBarTime  Close time of the newest bar across resolutions, 0 if no bars
 */
public record InstrumentInfo(
    String symbol,
    MarketType marketType,
    List<String> timeframes,
    long firstBarTime,
    long lastBarTime
) {
    public InstrumentInfo {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        timeframes = timeframes == null ? List.of() : List.copyOf(timeframes);
    }
}
