package io.trading.executor.core;

import io.trading.executor.model.ExecutionResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DedupCache.
 */
class DedupCacheTest {

    private final AtomicLong now = new AtomicLong(1_000);

    @Test
    void testFirstClaimOwnsId() {
        DedupCache cache = new DedupCache(60_000, 10, now::get);

        DedupCache.Claim first = cache.claim("e-1");
        DedupCache.Claim second = cache.claim("e-1");

        assertTrue(first.isOwner());
        assertFalse(second.isOwner());
        assertFalse(second.isComplete());
        assertTrue(cache.get("e-1").isEmpty());

        ExecutionResponse response = ExecutionResponse.completed(List.of(), List.of());
        first.complete(response);

        assertTrue(second.isComplete());
        assertSame(response, second.await());
        assertEquals(response, cache.get("e-1").orElseThrow());
    }

    @Test
    void testOnlyOwnerCompletes() {
        DedupCache cache = new DedupCache(60_000, 10, now::get);
        cache.claim("e-1");
        DedupCache.Claim duplicate = cache.claim("e-1");

        assertThrows(IllegalStateException.class,
            () -> duplicate.complete(ExecutionResponse.failed("x", List.of())));
    }

    @Test
    void testExpiredRecordsAreEvicted() {
        DedupCache cache = new DedupCache(1_000, 10, now::get);
        cache.claim("old").complete(ExecutionResponse.failed("boom", List.of()));

        now.addAndGet(999);
        assertEquals(0, cache.evict());
        assertEquals(1, cache.size());

        now.addAndGet(1);
        assertEquals(1, cache.evict());
        assertTrue(cache.get("old").isEmpty());
        assertTrue(cache.claim("old").isOwner());
    }

    @Test
    void testCapacityEvictsOldestFirst() {
        DedupCache cache = new DedupCache(60_000, 2, now::get);
        cache.claim("a").complete(ExecutionResponse.completed(List.of(), List.of()));
        cache.claim("b").complete(ExecutionResponse.completed(List.of(), List.of()));

        cache.claim("c");

        assertEquals(2, cache.size());
        assertTrue(cache.get("a").isEmpty());
        assertTrue(cache.get("b").isPresent());
    }

    @Test
    void testInFlightRecordIsNeverEvicted() {
        DedupCache cache = new DedupCache(1_000, 1, now::get);
        DedupCache.Claim running = cache.claim("running");

        now.addAndGet(5_000);
        assertEquals(0, cache.evict());
        assertFalse(cache.claim("running").isOwner());

        running.complete(ExecutionResponse.completed(List.of(), List.of()));
        assertEquals(1, cache.evict());
    }

    @Test
    void testInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new DedupCache(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new DedupCache(1_000, 0));
    }
}
