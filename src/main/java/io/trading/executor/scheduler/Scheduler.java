package io.trading.executor.scheduler;

import io.trading.executor.strategy.ScheduledTask;
import io.trading.executor.strategy.StrategyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Periodic callbacks of one strategy instance.
 *
 * Registration is only open while the strategy initializes. On each trigger, callbacks
 * whose phase equals the trigger's computed phase run in registration order; the first
 * failure stops the remaining callbacks for that trigger and becomes a warning.
 *
 * Not thread-safe: the owning instance is only ever driven by one execution at a time.
 */
public class Scheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Scheduler.class);

    private final String ownerId;
    private final List<PeriodicCallback> callbacks = new ArrayList<>();
    private boolean registrationOpen = false;

    public Scheduler(String ownerId) {
        this.ownerId = ownerId;
    }

    /**
     * Opens registration; discards anything left from a failed earlier initialization.
     */
    public void beginRegistration() {
        callbacks.clear();
        registrationOpen = true;
    }

    public void endRegistration() {
        registrationOpen = false;
    }

    /**
     * Drops every registration and closes registration.
     */
    public void reset() {
        callbacks.clear();
        registrationOpen = false;
    }

    /**
     * Registers a callback.
     *
     * @throws IllegalStateException outside strategy initialization
     */
    public PeriodicCallback register(String name, ScheduledTask task, MarketPhase phase, String referenceInstrument) {
        if (!registrationOpen) {
            throw new IllegalStateException("Periodic callbacks can only be registered during initialize()");
        }
        PeriodicCallback callback = new PeriodicCallback(name, task, phase, referenceInstrument, callbacks.size());
        callbacks.add(callback);
        LOGGER.debug("[{}] Registered {} for {} (reference {})",
            ownerId, callback.name(), phase, referenceInstrument);
        return callback;
    }

    /**
     * Runs the callbacks due for this trigger.
     *
     * @param context          Context of the current scope, handed to every callback
     * @param timestampMillis  Trigger time
     * @param resolver         Phase computation for this execution's params
     * @param defaultReference Reference instrument for callbacks registered without one
     */
    public DispatchResult dispatch(StrategyContext context, long timestampMillis,
                                   PhaseResolver resolver, String defaultReference) {
        if (callbacks.isEmpty()) {
            return DispatchResult.empty();
        }
        List<String> fired = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (PeriodicCallback callback : callbacks) {
            String reference = callback.referenceInstrument() != null
                ? callback.referenceInstrument()
                : defaultReference;
            try {
                Optional<MarketPhase> phase = resolver.phaseFor(timestampMillis, reference);
                if (phase.isEmpty() || phase.get() != callback.phase()) {
                    continue;
                }
                callback.task().run(context);
                fired.add(callback.name());
            } catch (Exception e) {
                String warning = String.format("Periodic callback '%s' (%s) failed: %s",
                    callback.name(), callback.phase(), describe(e));
                LOGGER.warn("[{}] {}", ownerId, warning, e);
                warnings.add(warning);
                break;
            }
        }
        return new DispatchResult(fired, warnings);
    }

    public List<PeriodicCallback> getCallbacks() {
        return List.copyOf(callbacks);
    }

    public boolean isRegistrationOpen() {
        return registrationOpen;
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
