package io.trading.executor.error;

import java.nio.file.Path;

/**
 * A descriptor exists but fails structural validation.
 */
public class MalformedDescriptorException extends ExecutorException {

    private final Path file;
    private final String reason;

    public MalformedDescriptorException(Path file, String reason) {
        super(String.format("Malformed descriptor %s: %s", file, reason));
        this.file = file;
        this.reason = reason;
    }

    public MalformedDescriptorException(Path file, String reason, Throwable cause) {
        super(String.format("Malformed descriptor %s: %s", file, reason), cause);
        this.file = file;
        this.reason = reason;
    }

    public Path getFile() {
        return file;
    }

    public String getReason() {
        return reason;
    }
}
