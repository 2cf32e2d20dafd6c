package io.trading.executor.core;

import io.trading.executor.model.ExecutionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongSupplier;

/**
 * Execution id to response, bounded by age and count.
 *
 * An id is claimed atomically before its execution starts, so two concurrent deliveries of
 * the same id never both run the strategy: the loser waits for the winner's response.
 * Failed responses are stored like any other. Only completed records are evicted.
 */
public class DedupCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(DedupCache.class);

    private final long retentionMs;
    private final int maxEntries;
    private final LongSupplier clock;
    private final ConcurrentHashMap<String, DedupRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<DedupRecord> insertionOrder = new ConcurrentLinkedQueue<>();

    public DedupCache(long retentionMs, int maxEntries) {
        this(retentionMs, maxEntries, System::currentTimeMillis);
    }

    public DedupCache(long retentionMs, int maxEntries, LongSupplier clock) {
        if (retentionMs <= 0) {
            throw new IllegalArgumentException("retentionMs must be positive");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.retentionMs = retentionMs;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Claims an execution id.
     *
     * @return a claim that either owns the id (the caller must {@link Claim#complete} it) or
     *         refers to the record of an earlier delivery
     */
    public Claim claim(String execId) {
        evict();
        DedupRecord created = new DedupRecord(execId, new CompletableFuture<>(), clock.getAsLong());
        DedupRecord existing = records.putIfAbsent(execId, created);
        if (existing != null) {
            return new Claim(existing, false);
        }
        insertionOrder.add(created);
        return new Claim(created, true);
    }

    /**
     * Stored response for a completed execution id.
     */
    public Optional<ExecutionResponse> get(String execId) {
        DedupRecord record = records.get(execId);
        if (record == null || !record.isComplete()) {
            return Optional.empty();
        }
        return Optional.of(record.response().join());
    }

    public int size() {
        return records.size();
    }

    /**
     * Drops completed records that are expired or beyond capacity, oldest first. Stops at the
     * first record still in flight.
     *
     * @return number of records dropped
     */
    public int evict() {
        long now = clock.getAsLong();
        int evicted = 0;
        DedupRecord head;
        while ((head = insertionOrder.peek()) != null) {
            boolean expired = now - head.createdAt() >= retentionMs;
            boolean overCapacity = records.size() >= maxEntries;
            if (!(expired || overCapacity) || !head.isComplete()) {
                break;
            }
            if (insertionOrder.remove(head)) {
                records.remove(head.execId(), head);
                evicted++;
            }
        }
        if (evicted > 0) {
            LOGGER.debug("Evicted {} dedup records, {} remaining", evicted, records.size());
        }
        return evicted;
    }

    /**
     * Result of {@link #claim}.
     */
    public static final class Claim {
        private final DedupRecord record;
        private final boolean owner;

        private Claim(DedupRecord record, boolean owner) {
            this.record = record;
            this.owner = owner;
        }

        public boolean isOwner() {
            return owner;
        }

        /**
         * Stores the response for this id. Only the owner completes; later calls are ignored.
         */
        public void complete(ExecutionResponse response) {
            if (!owner) {
                throw new IllegalStateException("Only the owning claim may complete " + record.execId());
            }
            record.response().complete(response);
        }

        public boolean isComplete() {
            return record.isComplete();
        }

        /**
         * The stored response, waiting for the owner if it is still executing.
         */
        public ExecutionResponse await() {
            return record.response().join();
        }

        public DedupRecord getRecord() {
            return record;
        }
    }
}
