package io.trading.executor.core;

import io.trading.executor.scope.ScopeKey;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per (account, strategy) pair. Waiters on a pair are admitted in arrival
 * order; different pairs never contend. Locks exist only while some thread holds or waits
 * for them.
 */
public class PairSerializer {

    private final ConcurrentHashMap<ScopeKey, Slot> slots = new ConcurrentHashMap<>();

    /**
     * Blocks until the pair is free.
     *
     * @return a permit that frees the pair when closed
     */
    public Permit acquire(ScopeKey key) throws InterruptedException {
        Slot slot = slots.compute(key, (k, existing) -> {
            Slot s = existing != null ? existing : new Slot();
            s.users++;
            return s;
        });
        try {
            slot.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            release(key);
            throw e;
        }
        return new Permit(key, slot);
    }

    public boolean isHeld(ScopeKey key) {
        Slot slot = slots.get(key);
        return slot != null && slot.lock.isLocked();
    }

    /**
     * Pairs currently held or waited on.
     */
    public int getActivePairs() {
        return slots.size();
    }

    private void release(ScopeKey key) {
        slots.computeIfPresent(key, (k, s) -> --s.users == 0 ? null : s);
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's compute
        private int users;
    }

    /**
     * Held pair. Must be closed by the thread that acquired it.
     */
    public final class Permit implements AutoCloseable {
        private final ScopeKey key;
        private final Slot slot;
        private boolean released = false;

        private Permit(ScopeKey key, Slot slot) {
            this.key = key;
            this.slot = slot;
        }

        public ScopeKey getKey() {
            return key;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            slot.lock.unlock();
            release(key);
        }
    }
}
