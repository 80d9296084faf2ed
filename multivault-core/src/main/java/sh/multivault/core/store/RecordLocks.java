// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.store;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-record mutual exclusion for read-modify-write sequences.
 *
 * <p>
 * Each id maps to a reference-counted lock that is dropped once no thread holds or waits for
 * it, so the table only grows with the number of records in flight.
 */
public final class RecordLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    /**
     * Runs {@code action} while holding the lock for {@code id}.
     */
    public <T> T withLock(final String id, final Supplier<T> action) {
        final Entry entry = locks.compute(id, (key, existing) -> {
            final Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(id, (key, e) -> --e.users == 0 ? null : e);
        }
    }

    int activeLocks() {
        return locks.size();
    }
}
