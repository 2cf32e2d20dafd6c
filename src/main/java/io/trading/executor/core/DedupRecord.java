package io.trading.executor.core;

import io.trading.executor.model.ExecutionResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Response stored under an execution id. The future completes once the owning execution has
 * produced its response; duplicates arriving earlier wait on it.
 *
 * @param execId    Execution id
 * @param response  Response, completed exactly once
 * @param createdAt Time the id was first claimed, in milliseconds
 */
public record DedupRecord(
    String execId,
    CompletableFuture<ExecutionResponse> response,
    long createdAt
) {
    public boolean isComplete() {
        return response.isDone();
    }
}
