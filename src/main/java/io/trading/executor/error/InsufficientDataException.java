package io.trading.executor.error;

/**
 * A data query reaches outside what the request snapshot carries.
 */
public class InsufficientDataException extends ExecutorException {

    private final String symbol;

    public InsufficientDataException(String symbol, String message) {
        super(String.format("Insufficient data for %s: %s", symbol, message));
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
