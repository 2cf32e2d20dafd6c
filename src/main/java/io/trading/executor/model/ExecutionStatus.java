package io.trading.executor.model;

/**
 * Outcome of one execution.
 */
public enum ExecutionStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED
}
