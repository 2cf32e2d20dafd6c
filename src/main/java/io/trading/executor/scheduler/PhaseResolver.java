package io.trading.executor.scheduler;

import io.trading.executor.model.MarketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Computes the market phase of a trigger timestamp for a reference instrument, using the
 * policy and session overrides named in the strategy params:
 *
 * - {@code phase_policy}: {@code session} (default) or {@code window}
 * - {@code phase_tolerance_minutes}: tolerance for the window policy (default 30)
 * - {@code market_type}: forces the market instead of detecting it from the symbol
 * - {@code session_open}, {@code session_close}: {@code HH:mm} boundary overrides
 */
public class PhaseResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(PhaseResolver.class);

    public static final String PARAM_POLICY = "phase_policy";
    public static final String PARAM_TOLERANCE = "phase_tolerance_minutes";
    public static final String PARAM_MARKET_TYPE = "market_type";
    public static final String PARAM_SESSION_OPEN = "session_open";
    public static final String PARAM_SESSION_CLOSE = "session_close";

    private final PhasePolicy policy;
    private final MarketType marketTypeOverride;
    private final LocalTime openOverride;
    private final LocalTime closeOverride;
    private final CopyOnWriteArrayList<String> warnings = new CopyOnWriteArrayList<>();

    public PhaseResolver(PhasePolicy policy, MarketType marketTypeOverride,
                         LocalTime openOverride, LocalTime closeOverride) {
        this(policy, marketTypeOverride, openOverride, closeOverride, List.of());
    }

    private PhaseResolver(PhasePolicy policy, MarketType marketTypeOverride,
                          LocalTime openOverride, LocalTime closeOverride, List<String> warnings) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
        this.marketTypeOverride = marketTypeOverride;
        this.openOverride = openOverride;
        this.closeOverride = closeOverride;
        this.warnings.addAll(warnings);
    }

    /**
     * Builds a resolver from strategy params. Bad values fall back to defaults and are
     * reported through {@link #getWarnings()}.
     */
    public static PhaseResolver fromParams(Map<String, String> params) {
        List<String> warnings = new ArrayList<>();

        String policyName = params.getOrDefault(PARAM_POLICY, SessionPhasePolicy.NAME).trim().toLowerCase(Locale.ROOT);
        PhasePolicy policy;
        if (WindowPhasePolicy.NAME.equals(policyName)) {
            policy = new WindowPhasePolicy(parseTolerance(params.get(PARAM_TOLERANCE), warnings));
        } else {
            if (!SessionPhasePolicy.NAME.equals(policyName)) {
                warnings.add("Unknown phase_policy '" + policyName + "', using session");
            }
            policy = new SessionPhasePolicy();
        }

        MarketType marketType = MarketType.parse(params.get(PARAM_MARKET_TYPE));
        if (marketType == null && params.containsKey(PARAM_MARKET_TYPE)
            && !params.get(PARAM_MARKET_TYPE).isBlank()) {
            warnings.add("Unknown market_type '" + params.get(PARAM_MARKET_TYPE) + "', detecting from symbol");
        }

        LocalTime open = parseTime(PARAM_SESSION_OPEN, params.get(PARAM_SESSION_OPEN), warnings);
        LocalTime close = parseTime(PARAM_SESSION_CLOSE, params.get(PARAM_SESSION_CLOSE), warnings);
        if (open != null && close != null && !open.isBefore(close)) {
            warnings.add("session_open " + open + " is not before session_close " + close + ", ignoring both");
            open = null;
            close = null;
        }

        for (String warning : warnings) {
            LOGGER.warn("[PhaseResolver] {}", warning);
        }
        return new PhaseResolver(policy, marketType, open, close, warnings);
    }

    /**
     * Phase of {@code timestampMillis} for the market of {@code referenceInstrument}.
     */
    public Optional<MarketPhase> phaseFor(long timestampMillis, String referenceInstrument) {
        MarketSession session = sessionFor(referenceInstrument);
        LocalTime local = localTime(timestampMillis, session);
        return policy.phaseAt(local, session);
    }

    /**
     * Local calendar date of {@code timestampMillis} in the reference market.
     */
    public LocalDate tradingDay(long timestampMillis, String referenceInstrument) {
        ZoneId zone = MarketSession.forMarket(marketTypeFor(referenceInstrument)).zone();
        return ZonedDateTime.ofInstant(Instant.ofEpochMilli(timestampMillis), zone).toLocalDate();
    }

    /**
     * Session of the reference market with the boundary overrides applied. Overrides that
     * would put the open at or after the close are ignored with a warning.
     */
    public MarketSession sessionFor(String referenceInstrument) {
        MarketSession table = MarketSession.forMarket(marketTypeFor(referenceInstrument));
        LocalTime open = openOverride != null ? openOverride : table.open();
        LocalTime close = closeOverride != null ? closeOverride : table.close();
        if (open.equals(table.open()) && close.equals(table.close())) {
            return table;
        }
        if (!open.isBefore(close)) {
            addWarning("Session overrides give open " + open + " not before close " + close
                + " for " + table.marketType() + ", using " + table.open() + "-" + table.close());
            return table;
        }
        return new MarketSession(table.marketType(), table.zone(), open, close);
    }

    private MarketType marketTypeFor(String referenceInstrument) {
        return marketTypeOverride != null ? marketTypeOverride : MarketType.detect(referenceInstrument);
    }

    private void addWarning(String warning) {
        if (warnings.addIfAbsent(warning)) {
            LOGGER.warn("[PhaseResolver] {}", warning);
        }
    }

    public PhasePolicy getPolicy() {
        return policy;
    }

    /**
     * Problems found in the params, including session overrides rejected for a market.
     */
    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    private static LocalTime localTime(long timestampMillis, MarketSession session) {
        return ZonedDateTime.ofInstant(Instant.ofEpochMilli(timestampMillis), session.zone()).toLocalTime();
    }

    private static int parseTolerance(String value, List<String> warnings) {
        if (value == null || value.isBlank()) {
            return WindowPhasePolicy.DEFAULT_TOLERANCE_MINUTES;
        }
        int tolerance;
        try {
            tolerance = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            tolerance = -1;
        }
        if (tolerance >= 0) {
            return tolerance;
        }
        warnings.add("Invalid phase_tolerance_minutes '" + value + "', using "
            + WindowPhasePolicy.DEFAULT_TOLERANCE_MINUTES);
        return WindowPhasePolicy.DEFAULT_TOLERANCE_MINUTES;
    }

    private static LocalTime parseTime(String name, String value, List<String> warnings) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            warnings.add("Invalid " + name + " '" + value + "', expected HH:mm");
            return null;
        }
    }
}
