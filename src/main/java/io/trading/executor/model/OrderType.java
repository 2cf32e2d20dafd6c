package io.trading.executor.model;

import java.util.Locale;

/**
 * Order pricing type.
 */
public enum OrderType {
    MARKET,
    LIMIT;

    public static OrderType fromString(String value) {
        if (value == null) {
            return MARKET;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "limit", "2" -> LIMIT;
            default -> MARKET;
        };
    }
}
