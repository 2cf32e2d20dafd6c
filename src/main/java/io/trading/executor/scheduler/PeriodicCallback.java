package io.trading.executor.scheduler;

import io.trading.executor.strategy.ScheduledTask;

/**
 * A registered periodic callback.
 *
 * @param name                Display name used in logs and warnings
 * @param task                Callback body
 * @param phase               Phase the callback fires in
 * @param referenceInstrument Instrument whose market defines the phase, null for the trigger's own
 * @param sequence            Registration order, starting at 0
 */
public record PeriodicCallback(
    String name,
    ScheduledTask task,
    MarketPhase phase,
    String referenceInstrument,
    int sequence
) {
    public PeriodicCallback {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (name == null || name.isEmpty()) {
            name = "callback-" + sequence;
        }
    }
}
