package io.polygraph.store.core.kv;

import io.polygraph.store.spi.KeyValueStore;
import io.polygraph.store.spi.KvEntry;
import io.polygraph.store.spi.Mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Sorted in-memory {@link KeyValueStore}.
 *
 * <p>Nothing is persisted. Suitable for tests and as the index of a log-backed store whose log
 * is replayed on every open.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final TreeMap<String, byte[]> entries = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            byte[] value = entries.get(key);
            return value == null ? Optional.empty() : Optional.of(value.clone());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(String key, byte[] value) {
        apply(List.of(Mutation.put(key, value)));
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<KvEntry> scan(String startInclusive, String endExclusive) {
        Objects.requireNonNull(startInclusive, "startInclusive");
        Objects.requireNonNull(endExclusive, "endExclusive");
        if (startInclusive.compareTo(endExclusive) >= 0) return List.of();
        lock.readLock().lock();
        try {
            List<KvEntry> out = new ArrayList<>();
            for (Map.Entry<String, byte[]> e : entries.subMap(startInclusive, endExclusive).entrySet()) {
                out.add(new KvEntry(e.getKey(), e.getValue().clone()));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void apply(List<Mutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        lock.writeLock().lock();
        try {
            for (Mutation m : mutations) {
                if (m.op() == Mutation.Op.PUT) {
                    entries.put(m.key(), m.value().clone());
                } else {
                    entries.remove(m.key());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
