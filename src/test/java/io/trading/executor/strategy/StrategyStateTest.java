package io.trading.executor.strategy;

import io.trading.executor.scope.ScopeKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StrategyState.
 */
class StrategyStateTest {

    private final StrategyState state = new StrategyState();

    @Test
    void testTypedGet() {
        state.put("count", 3);
        state.put("signal", "buy");

        assertEquals(Integer.valueOf(3), state.get("count", Integer.class).orElseThrow());
        assertEquals("buy", state.getOrDefault("signal", String.class, "none"));
        assertEquals("none", state.getOrDefault("missing", String.class, "none"));
        assertTrue(state.get("missing", Integer.class).isEmpty());
    }

    @Test
    void testWrongTypeFailsAtLookup() {
        state.put("count", 3);

        assertThrows(ClassCastException.class, () -> state.get("count", String.class));
        assertThrows(ClassCastException.class, () -> state.getOrDefault("count", String.class, "none"));
    }

    @Test
    void testCopyIsIndependentUntilCommitted() {
        StrategyInstance instance = new StrategyInstance(
            new ScopeKey("acc-1", "alpha"), context -> { });
        instance.getState().put("count", 1);

        StrategyState working = instance.beginState();
        working.put("count", 2);
        assertEquals(Integer.valueOf(1), instance.getState().getOrDefault("count", Integer.class, 0));

        instance.commitState(working);
        assertEquals(Integer.valueOf(2), instance.getState().getOrDefault("count", Integer.class, 0));
    }
}
