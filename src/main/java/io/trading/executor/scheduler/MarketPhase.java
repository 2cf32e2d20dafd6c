package io.trading.executor.scheduler;

import java.util.Locale;

/**
 * Market-session buckets used to time periodic callbacks.
 */
public enum MarketPhase {
    BEFORE_OPEN("before_open"),
    OPEN("open"),
    AFTER_CLOSE("after_close");

    private final String tag;

    MarketPhase(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * @throws IllegalArgumentException for an unknown tag
     */
    public static MarketPhase fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (MarketPhase phase : values()) {
                if (phase.tag.equals(normalized)) {
                    return phase;
                }
            }
        }
        throw new IllegalArgumentException("Unknown market phase: " + tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
