package io.trading.executor.model;

import java.util.List;

/**
 * Result of one execution. Produced exactly once per accepted request.
 *
 * @param status          Outcome
 * @param orderOperations Order operations in the order the strategy emitted them
 * @param warnings        Non-fatal problems (failed periodic callbacks and the like)
 * @param errorMessage    Set iff status is FAILED
 */
public record ExecutionResponse(
    ExecutionStatus status,
    List<OrderOperation> orderOperations,
    List<String> warnings,
    String errorMessage
) {
    public ExecutionResponse {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        orderOperations = orderOperations == null ? List.of() : List.copyOf(orderOperations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (status == ExecutionStatus.FAILED) {
            if (errorMessage == null || errorMessage.isEmpty()) {
                throw new IllegalArgumentException("errorMessage is required for FAILED responses");
            }
        } else {
            errorMessage = "";
        }
    }

    /**
     * SUCCESS when there are no warnings, PARTIAL_SUCCESS otherwise.
     */
    public static ExecutionResponse completed(List<OrderOperation> orderOperations, List<String> warnings) {
        ExecutionStatus status = warnings == null || warnings.isEmpty()
            ? ExecutionStatus.SUCCESS
            : ExecutionStatus.PARTIAL_SUCCESS;
        return new ExecutionResponse(status, orderOperations, warnings, "");
    }

    public static ExecutionResponse failed(String errorMessage, List<String> warnings) {
        return new ExecutionResponse(ExecutionStatus.FAILED, List.of(), warnings, errorMessage);
    }

    public boolean isFailed() {
        return status == ExecutionStatus.FAILED;
    }
}
