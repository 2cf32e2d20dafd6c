package io.trading.executor.config;

/**
 * A strategy id bound to its implementation class.
 *
 * @param strategyId Id requests use to select the strategy
 * @param className  Fully qualified class implementing {@code Strategy}
 */
public record StrategyBinding(
    String strategyId,
    String className
) {
    public StrategyBinding {
        if (strategyId == null || strategyId.isEmpty()) {
            throw new IllegalArgumentException("strategyId cannot be null or empty");
        }
        if (className == null || className.isEmpty()) {
            throw new IllegalArgumentException("className cannot be null or empty");
        }
    }

    /**
     * Parses a binding string.
     * Format: "id:fully.qualified.ClassName"
     * Example: "dual_ma:io.trading.executor.example.DualMovingAverageStrategy"
     */
    public static StrategyBinding fromString(String value) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid strategy binding format: " + value);
        }
        return new StrategyBinding(parts[0].trim(), parts[1].trim());
    }

    @Override
    public String toString() {
        return strategyId + ":" + className;
    }
}
