package io.trading.executor.scheduler;

import io.trading.executor.model.MarketType;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Regular trading session of a market, in the market's local time.
 *
 * @param marketType Market family
 * @param zone       Market timezone
 * @param open       Session open
 * @param close      Session close
 */
public record MarketSession(
    MarketType marketType,
    ZoneId zone,
    LocalTime open,
    LocalTime close
) {
    public MarketSession {
        if (marketType == null) {
            throw new IllegalArgumentException("marketType cannot be null");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        if (open == null || close == null) {
            throw new IllegalArgumentException("open and close cannot be null");
        }
        if (!open.isBefore(close)) {
            throw new IllegalArgumentException("open must be before close: " + open + " >= " + close);
        }
    }

    public static MarketSession forMarket(MarketType marketType) {
        return switch (marketType) {
            case A_STOCK -> new MarketSession(marketType, ZoneId.of("Asia/Shanghai"),
                LocalTime.of(9, 30), LocalTime.of(15, 0));
            case US_STOCK -> new MarketSession(marketType, ZoneId.of("America/New_York"),
                LocalTime.of(9, 30), LocalTime.of(16, 0));
            case HK_STOCK -> new MarketSession(marketType, ZoneId.of("Asia/Hong_Kong"),
                LocalTime.of(9, 30), LocalTime.of(16, 0));
            case CRYPTO -> new MarketSession(marketType, ZoneId.of("UTC"),
                LocalTime.of(0, 0), LocalTime.of(23, 59));
        };
    }
}
