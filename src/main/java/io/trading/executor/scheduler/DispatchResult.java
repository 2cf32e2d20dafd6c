package io.trading.executor.scheduler;

import java.util.List;

/**
 * Outcome of dispatching periodic callbacks for one trigger.
 *
 * @param fired    Names of callbacks that ran to completion, in order
 * @param warnings One entry for a callback that failed and cut dispatch short
 */
public record DispatchResult(
    List<String> fired,
    List<String> warnings
) {
    public DispatchResult {
        fired = fired == null ? List.of() : List.copyOf(fired);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static DispatchResult empty() {
        return new DispatchResult(List.of(), List.of());
    }
}
