package io.trading.executor.model;

import java.util.Locale;

/**
 * Order lifecycle states as reported by the caller.
 */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    UNKNOWN;

    public static OrderStatus fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "new", "1" -> NEW;
            case "partially_filled", "partial", "2" -> PARTIALLY_FILLED;
            case "filled", "3" -> FILLED;
            case "cancelled", "canceled", "4" -> CANCELLED;
            case "rejected", "5" -> REJECTED;
            default -> UNKNOWN;
        };
    }

    /**
     * Whether no further fills can happen.
     */
    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }
}
