package io.trading.executor.scheduler;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Decides which market phase a local time falls into.
 */
public interface PhasePolicy {

    /**
     * @param localTime Trigger time in the session's timezone
     * @param session   Session boundaries of the reference market
     * @return the phase, or empty when the time matches none
     */
    Optional<MarketPhase> phaseAt(LocalTime localTime, MarketSession session);

    /**
     * Name used to select the policy through the {@code phase_policy} strategy param.
     */
    String name();
}
