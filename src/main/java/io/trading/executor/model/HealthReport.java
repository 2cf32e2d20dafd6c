package io.trading.executor.model;

import java.util.List;

/**
 * @param status  Overall health
 * @param message Human-readable summary
 * @param details Individual findings behind a non-healthy status
 */
public record HealthReport(
    HealthStatus status,
    String message,
    List<String> details
) {
    public HealthReport {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        message = message == null ? "" : message;
        details = details == null ? List.of() : List.copyOf(details);
    }
}
