package io.trading.executor.scheduler;

import io.trading.executor.model.MarketType;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Matches a phase only near its time point: before_open at open minus five minutes, open at
 * the open, after_close at close plus five minutes. Crypto has no pre or post session, so its
 * before_open and after_close fall on the open and the close.
 *
 * Distances are measured around the clock, so a point near midnight also matches times just
 * across it. A time within the tolerance of several points takes the nearest one, the earlier
 * phase on a tie; a time near none has no phase.
 */
public class WindowPhasePolicy implements PhasePolicy {

    public static final String NAME = "window";
    public static final int DEFAULT_TOLERANCE_MINUTES = 30;

    private static final Duration PRE_POST_OFFSET = Duration.ofMinutes(5);
    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final long toleranceSeconds;

    public WindowPhasePolicy(int toleranceMinutes) {
        if (toleranceMinutes < 0) {
            throw new IllegalArgumentException("toleranceMinutes cannot be negative");
        }
        this.toleranceSeconds = toleranceMinutes * 60L;
    }

    @Override
    public Optional<MarketPhase> phaseAt(LocalTime localTime, MarketSession session) {
        MarketPhase best = null;
        long bestDistance = Long.MAX_VALUE;
        for (MarketPhase phase : MarketPhase.values()) {
            long distance = distance(timePoint(phase, session), localTime);
            if (distance <= toleranceSeconds && distance < bestDistance) {
                best = phase;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public String name() {
        return NAME;
    }

    static LocalTime timePoint(MarketPhase phase, MarketSession session) {
        Duration offset = session.marketType() == MarketType.CRYPTO ? Duration.ZERO : PRE_POST_OFFSET;
        return switch (phase) {
            case BEFORE_OPEN -> session.open().minus(offset);
            case OPEN -> session.open();
            case AFTER_CLOSE -> session.close().plus(offset);
        };
    }

    static long distance(LocalTime a, LocalTime b) {
        long seconds = Math.abs(a.toSecondOfDay() - b.toSecondOfDay());
        return Math.min(seconds, SECONDS_PER_DAY - seconds);
    }
}
