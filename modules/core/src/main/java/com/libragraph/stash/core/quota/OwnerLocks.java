package com.libragraph.stash.core.quota;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-owner critical sections. Work for one owner is serialized; different
 * owners never wait on each other. Locks are reentrant, so a note operation
 * can hold its owner's lock while it stores several objects.
 *
 * <p>An owner's entry lives only while some thread holds or waits for it.
 */
@ApplicationScoped
public class OwnerLocks {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        int users;
    }

    private final ConcurrentHashMap<Long, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long ownerId, Supplier<T> action) {
        Entry entry = locks.compute(ownerId, (id, current) -> {
            Entry e = current != null ? current : new Entry();
            e.users++;
            return e;
        });
        try {
            entry.lock.lock();
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(ownerId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    public boolean isHeldByCurrentThread(long ownerId) {
        Entry entry = locks.get(ownerId);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    int trackedOwners() {
        return locks.size();
    }
}
