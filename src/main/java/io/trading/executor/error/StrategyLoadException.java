package io.trading.executor.error;

/**
 * A strategy implementation could not be located or instantiated.
 */
public class StrategyLoadException extends ExecutorException {

    private final String strategyId;

    public StrategyLoadException(String strategyId, String message, Throwable cause) {
        super(String.format("[%s] %s", strategyId, message), cause);
        this.strategyId = strategyId;
    }

    public StrategyLoadException(String strategyId, String message) {
        super(String.format("[%s] %s", strategyId, message));
        this.strategyId = strategyId;
    }

    public String getStrategyId() {
        return strategyId;
    }
}
