package io.polygraph.store.core;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of lock stripes addressed by key hash. Two keys may share a stripe; the same key
 * always maps to the same one.
 */
final class KeyedLocks {
    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    KeyedLocks(int stripes) {
        if (stripes <= 0) throw new IllegalArgumentException("stripes must be positive");
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String key) {
        Objects.requireNonNull(key, "key");
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }

    int size() {
        return stripes.length;
    }
}
