package io.trading.executor.model;

import java.util.Locale;

/**
 * Order direction.
 */
public enum Side {
    BUY,
    SELL,
    UNKNOWN;

    public static Side fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "buy", "b", "1" -> BUY;
            case "sell", "s", "2" -> SELL;
            default -> UNKNOWN;
        };
    }
}
