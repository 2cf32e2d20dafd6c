package io.trading.executor.scheduler;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Splits the day at the session boundaries: before open, during the session, after close.
 * Every time maps to exactly one phase.
 */
public class SessionPhasePolicy implements PhasePolicy {

    public static final String NAME = "session";

    @Override
    public Optional<MarketPhase> phaseAt(LocalTime localTime, MarketSession session) {
        if (localTime.isBefore(session.open())) {
            return Optional.of(MarketPhase.BEFORE_OPEN);
        }
        if (localTime.isBefore(session.close())) {
            return Optional.of(MarketPhase.OPEN);
        }
        return Optional.of(MarketPhase.AFTER_CLOSE);
    }

    @Override
    public String name() {
        return NAME;
    }
}
