package io.trading.executor.error;

/**
 * Request is malformed or incomplete. Raised before any scope is opened; no side effects.
 */
public class InvalidRequestException extends ExecutorException {

    private final String execId;

    public InvalidRequestException(String execId, String message) {
        super(execId == null || execId.isEmpty()
            ? "Invalid request: " + message
            : String.format("Invalid request %s: %s", execId, message));
        this.execId = execId;
    }

    public InvalidRequestException(String message) {
        this(null, message);
    }

    public String getExecId() {
        return execId;
    }
}
