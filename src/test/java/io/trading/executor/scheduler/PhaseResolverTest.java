package io.trading.executor.scheduler;

import io.trading.executor.model.MarketType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PhaseResolver and the phase policies.
 */
class PhaseResolverTest {

    private static long utc(String time) {
        return Instant.parse("2024-01-02T" + time + ":00Z").toEpochMilli();
    }

    @Test
    void testSessionPolicyCoversWholeDay() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of());

        assertEquals(Optional.of(MarketPhase.BEFORE_OPEN), resolver.phaseFor(utc("01:00"), "000001.XSHE"));
        assertEquals(Optional.of(MarketPhase.OPEN), resolver.phaseFor(utc("01:30"), "000001.XSHE"));
        assertEquals(Optional.of(MarketPhase.AFTER_CLOSE), resolver.phaseFor(utc("07:00"), "000001.XSHE"));
        assertEquals(Optional.of(MarketPhase.OPEN), resolver.phaseFor(utc("15:00"), "AAPL.US"));
        assertEquals(Optional.of(MarketPhase.OPEN), resolver.phaseFor(utc("12:00"), "BTCUSDT"));
        assertTrue(resolver.getWarnings().isEmpty());
    }

    @Test
    void testWindowPolicyMatchesNearestPoint() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of(
            PhaseResolver.PARAM_POLICY, "window",
            PhaseResolver.PARAM_TOLERANCE, "10"));

        // Shanghai open 09:30 local = 01:30 UTC; before_open point 09:25
        assertEquals(Optional.of(MarketPhase.BEFORE_OPEN), resolver.phaseFor(utc("01:26"), "000001.XSHE"));
        assertEquals(Optional.of(MarketPhase.OPEN), resolver.phaseFor(utc("01:29"), "000001.XSHE"));
        assertEquals(Optional.of(MarketPhase.AFTER_CLOSE), resolver.phaseFor(utc("07:10"), "000001.XSHE"));
        assertEquals(Optional.empty(), resolver.phaseFor(utc("04:00"), "000001.XSHE"));
        assertInstanceOf(WindowPhasePolicy.class, resolver.getPolicy());
    }

    @Test
    void testOverrides() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of(
            PhaseResolver.PARAM_MARKET_TYPE, "a_stock",
            PhaseResolver.PARAM_SESSION_OPEN, "10:00",
            PhaseResolver.PARAM_SESSION_CLOSE, "11:00"));

        MarketSession session = resolver.sessionFor("BTCUSDT");
        assertEquals(MarketType.A_STOCK, session.marketType());
        assertEquals(LocalTime.of(10, 0), session.open());
        assertEquals(LocalTime.of(11, 0), session.close());
        // 01:45 UTC = 09:45 Shanghai, before the overridden open
        assertEquals(Optional.of(MarketPhase.BEFORE_OPEN), resolver.phaseFor(utc("01:45"), "BTCUSDT"));
    }

    @Test
    void testBadParamsFallBackWithWarnings() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of(
            PhaseResolver.PARAM_POLICY, "hourly",
            PhaseResolver.PARAM_MARKET_TYPE, "moon",
            PhaseResolver.PARAM_SESSION_OPEN, "25:99"));

        assertInstanceOf(SessionPhasePolicy.class, resolver.getPolicy());
        assertEquals(3, resolver.getWarnings().size());
        assertEquals(MarketType.CRYPTO, resolver.sessionFor("BTCUSDT").marketType());
    }

    @Test
    void testInvertedSessionIgnored() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of(
            PhaseResolver.PARAM_SESSION_OPEN, "15:00",
            PhaseResolver.PARAM_SESSION_CLOSE, "09:00"));

        assertEquals(1, resolver.getWarnings().size());
        assertEquals(LocalTime.of(9, 30), resolver.sessionFor("000001.XSHE").open());
    }

    @Test
    void testSingleOverrideCrossingTableBoundaryFallsBack() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of(
            PhaseResolver.PARAM_SESSION_CLOSE, "09:00"));
        assertTrue(resolver.getWarnings().isEmpty());

        MarketSession session = resolver.sessionFor("000001.XSHE");
        assertEquals(LocalTime.of(9, 30), session.open());
        assertEquals(LocalTime.of(15, 0), session.close());
        assertEquals(1, resolver.getWarnings().size());
        assertEquals(LocalDate.of(2024, 1, 2), resolver.tradingDay(utc("03:00"), "000001.XSHE"));
        assertEquals(Optional.of(MarketPhase.OPEN), resolver.phaseFor(utc("03:00"), "000001.XSHE"));
        assertEquals(1, resolver.getWarnings().size());

        // the same close is valid for a market that opens earlier
        assertEquals(LocalTime.of(9, 0), resolver.sessionFor("BTCUSDT").close());
    }

    @Test
    void testCryptoWindowAroundMidnight() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of(
            PhaseResolver.PARAM_POLICY, "window",
            PhaseResolver.PARAM_TOLERANCE, "10"));

        assertEquals(Optional.of(MarketPhase.BEFORE_OPEN), resolver.phaseFor(utc("00:03"), "BTCUSDT"));
        assertEquals(Optional.of(MarketPhase.AFTER_CLOSE), resolver.phaseFor(utc("23:57"), "BTCUSDT"));
        assertEquals(Optional.of(MarketPhase.BEFORE_OPEN), resolver.phaseFor(utc("00:00"), "BTCUSDT"));
        assertEquals(Optional.empty(), resolver.phaseFor(utc("12:00"), "BTCUSDT"));
    }

    @Test
    void testWindowDistanceWrapsMidnight() {
        assertEquals(120, WindowPhasePolicy.distance(LocalTime.of(23, 59), LocalTime.of(0, 1)));
        assertEquals(120, WindowPhasePolicy.distance(LocalTime.of(0, 1), LocalTime.of(23, 59)));
        assertEquals(43_200, WindowPhasePolicy.distance(LocalTime.of(0, 0), LocalTime.of(12, 0)));
    }

    @Test
    void testTradingDayUsesMarketZone() {
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of());
        long lateUtc = Instant.parse("2024-01-02T20:00:00Z").toEpochMilli();

        assertEquals(LocalDate.of(2024, 1, 3), resolver.tradingDay(lateUtc, "000001.XSHE"));
        assertEquals(LocalDate.of(2024, 1, 2), resolver.tradingDay(lateUtc, "BTCUSDT"));
    }

    @Test
    void testNegativeToleranceRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WindowPhasePolicy(-1));
        PhaseResolver resolver = PhaseResolver.fromParams(Map.of(
            PhaseResolver.PARAM_POLICY, "window",
            PhaseResolver.PARAM_TOLERANCE, "-5"));
        assertEquals(1, resolver.getWarnings().size());
    }
}
