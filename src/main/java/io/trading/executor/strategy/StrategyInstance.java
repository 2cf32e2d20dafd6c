package io.trading.executor.strategy;

import io.trading.executor.scheduler.Scheduler;
import io.trading.executor.scope.ScopeKey;

import java.time.LocalDate;

/**
 * A strategy object together with what it keeps between triggers: its persistent state,
 * its periodic callbacks and its lifecycle flags. One per (account, strategy) pair.
 */
public class StrategyInstance {

    private final ScopeKey key;
    private final Strategy strategy;
    private final StrategyState state = new StrategyState();
    private final Scheduler scheduler;
    private final long createdAt;

    private volatile boolean initialized = false;
    private volatile boolean retired = false;
    private LocalDate lastTradingDay;

    public StrategyInstance(ScopeKey key, Strategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        this.key = key;
        this.strategy = strategy;
        this.scheduler = new Scheduler(key.toString());
        this.createdAt = System.currentTimeMillis();
    }

    /**
     * Runs {@link Strategy#initialize} if it has not yet succeeded. Registration is open only
     * for the duration of the call; a failed attempt leaves no registrations behind.
     */
    public void initializeIfNeeded(StrategyContext context) throws Exception {
        if (initialized) {
            return;
        }
        scheduler.beginRegistration();
        try {
            strategy.initialize(context);
            initialized = true;
        } catch (Exception | Error e) {
            scheduler.reset();
            throw e;
        } finally {
            scheduler.endRegistration();
        }
    }

    /**
     * Records the trading day of the current trigger.
     *
     * @return true if {@code day} is a new trading day for this instance
     */
    public boolean startTradingDay(LocalDate day) {
        if (day.equals(lastTradingDay)) {
            return false;
        }
        lastTradingDay = day;
        return true;
    }

    public StrategyState beginState() {
        return state.copy();
    }

    public void commitState(StrategyState working) {
        state.replaceWith(working);
    }

    /**
     * Marks this instance unusable, after an abandoned call outlived its grace period.
     */
    public void retire() {
        retired = true;
    }

    public boolean isRetired() {
        return retired;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public ScopeKey getKey() {
        return key;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public StrategyState getState() {
        return state;
    }

    public long getCreatedAt() {
        return createdAt;
    }
}
