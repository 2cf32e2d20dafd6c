package io.trading.executor.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Scheduler.
 */
class SchedulerTest {

    private static final String A_SHARE = "000001.XSHE";
    private static final long BEFORE_OPEN = Instant.parse("2024-01-02T01:00:00Z").toEpochMilli();
    private static final long DURING_SESSION = Instant.parse("2024-01-02T02:00:00Z").toEpochMilli();
    private static final long AFTER_CLOSE = Instant.parse("2024-01-02T08:00:00Z").toEpochMilli();

    private final PhaseResolver resolver = PhaseResolver.fromParams(Map.of());
    private final List<String> fired = new ArrayList<>();
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new Scheduler("acc-1/test");
    }

    @Test
    void testRegistrationOnlyWhileOpen() {
        assertThrows(IllegalStateException.class,
            () -> scheduler.register("early", context -> { }, MarketPhase.OPEN, null));

        scheduler.beginRegistration();
        assertTrue(scheduler.isRegistrationOpen());
        PeriodicCallback callback = scheduler.register("ok", context -> { }, MarketPhase.OPEN, null);
        scheduler.endRegistration();

        assertEquals(0, callback.sequence());
        assertThrows(IllegalStateException.class,
            () -> scheduler.register("late", context -> { }, MarketPhase.OPEN, null));
        assertEquals(1, scheduler.getCallbacks().size());
    }

    @Test
    void testCallbacksFireInTheirPhase() {
        scheduler.beginRegistration();
        scheduler.register("pre", context -> fired.add("pre"), MarketPhase.BEFORE_OPEN, null);
        scheduler.register("open", context -> fired.add("open"), MarketPhase.OPEN, null);
        scheduler.register("post", context -> fired.add("post"), MarketPhase.AFTER_CLOSE, null);
        scheduler.endRegistration();

        assertEquals(List.of("pre"), scheduler.dispatch(null, BEFORE_OPEN, resolver, A_SHARE).fired());
        assertEquals(List.of("open"), scheduler.dispatch(null, DURING_SESSION, resolver, A_SHARE).fired());
        assertEquals(List.of("post"), scheduler.dispatch(null, AFTER_CLOSE, resolver, A_SHARE).fired());
        assertEquals(List.of("pre", "open", "post"), fired);
    }

    @Test
    void testSamePhaseKeepsRegistrationOrder() {
        scheduler.beginRegistration();
        scheduler.register("first", context -> fired.add("first"), MarketPhase.OPEN, null);
        scheduler.register("second", context -> fired.add("second"), MarketPhase.OPEN, null);
        scheduler.register("third", context -> fired.add("third"), MarketPhase.OPEN, null);
        scheduler.endRegistration();

        DispatchResult result = scheduler.dispatch(null, DURING_SESSION, resolver, A_SHARE);

        assertEquals(List.of("first", "second", "third"), fired);
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testFailureStopsRemainingCallbacks() {
        scheduler.beginRegistration();
        scheduler.register("first", context -> fired.add("first"), MarketPhase.OPEN, null);
        scheduler.register("broken", context -> {
            throw new IllegalStateException("bad data");
        }, MarketPhase.OPEN, null);
        scheduler.register("third", context -> fired.add("third"), MarketPhase.OPEN, null);
        scheduler.endRegistration();

        DispatchResult result = scheduler.dispatch(null, DURING_SESSION, resolver, A_SHARE);

        assertEquals(List.of("first"), fired);
        assertEquals(List.of("first"), result.fired());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("broken"));
        assertTrue(result.warnings().get(0).contains("bad data"));
    }

    @Test
    void testReferenceInstrumentSelectsMarket() {
        scheduler.beginRegistration();
        scheduler.register("a-share", context -> fired.add("a-share"), MarketPhase.OPEN, A_SHARE);
        scheduler.endRegistration();

        // 02:00 UTC is mid-session in Shanghai even when the trigger is a crypto pair
        scheduler.dispatch(null, DURING_SESSION, resolver, "BTCUSDT");
        assertEquals(List.of("a-share"), fired);
    }

    @Test
    void testResetDropsRegistrations() {
        scheduler.beginRegistration();
        scheduler.register("one", context -> { }, MarketPhase.OPEN, null);
        scheduler.reset();

        assertFalse(scheduler.isRegistrationOpen());
        assertTrue(scheduler.getCallbacks().isEmpty());
        assertEquals(DispatchResult.empty(), scheduler.dispatch(null, DURING_SESSION, resolver, A_SHARE));
    }
}
