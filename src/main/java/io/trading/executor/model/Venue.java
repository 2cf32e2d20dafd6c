package io.trading.executor.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Trading venues the executor knows descriptors for.
 */
public enum Venue {
    BINANCE("binance"),
    OKX("okx"),
    BYBIT("bybit");

    private final String id;

    Venue(String id) {
        this.id = id;
    }

    /**
     * Identifier used in requests and as the descriptor file name.
     */
    public String id() {
        return id;
    }

    public static Optional<Venue> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Venue venue : values()) {
            if (venue.id.equals(normalized)) {
                return Optional.of(venue);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
