package io.trading.executor.model;

import java.util.Locale;

/**
 * Event classes that cause one execution.
 */
public enum TriggerType {
    MARKET_DATA(1, "market_data"),
    RISK_MANAGE(2, "risk_manage"),
    ORDER_STATUS(3, "order_status");

    private final int code;
    private final String displayName;

    TriggerType(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int code() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a wire value, either the numeric code or the display name.
     *
     * @throws IllegalArgumentException if the value names no trigger type
     */
    public static TriggerType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TriggerType type : values()) {
                if (type.displayName.equals(normalized)
                    || type.name().equalsIgnoreCase(normalized)
                    || Integer.toString(type.code).equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + value);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
