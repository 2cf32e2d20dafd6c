package io.trading.executor.model;

import java.util.Locale;

/**
 * Market families with distinct trading sessions.
 */
public enum MarketType {
    A_STOCK,
    US_STOCK,
    HK_STOCK,
    CRYPTO;

    /**
     * Detects the market from a symbol suffix: {@code 000001.XSHE}, {@code AAPL.US},
     * {@code 00700.HK}. Anything else (including {@code BTCUSDT}) is crypto.
     */
    public static MarketType detect(String symbol) {
        if (symbol == null) {
            return CRYPTO;
        }
        int dot = symbol.lastIndexOf('.');
        if (dot < 0) {
            return CRYPTO;
        }
        return switch (symbol.substring(dot + 1).toUpperCase(Locale.ROOT)) {
            case "XSHE", "XSHG" -> A_STOCK;
            case "US" -> US_STOCK;
            case "HK" -> HK_STOCK;
            default -> CRYPTO;
        };
    }

    /**
     * Parses an explicit override such as {@code "us_stock"}; null when blank or unknown.
     */
    public static MarketType parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Stock markets trade whole shares only.
     */
    public boolean isStock() {
        return this != CRYPTO;
    }
}
