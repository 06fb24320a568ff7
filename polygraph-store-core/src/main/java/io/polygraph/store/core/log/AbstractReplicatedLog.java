package io.polygraph.store.core.log;

import io.polygraph.core.GraphException;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.LogKey;
import io.polygraph.store.spi.LogListener;
import io.polygraph.store.spi.Mutation;
import io.polygraph.store.spi.ReplicatedLog;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fully materialized {@link ReplicatedLog}: every entry is held in memory, subclasses decide
 * whether it is also persisted.
 *
 * <p>Listeners are invoked while the log's lock is held, so they observe entries in sequence
 * order and must not call back into {@link #append(List)}.
 */
public abstract class AbstractReplicatedLog implements ReplicatedLog {

    private final LogKey key;
    private final boolean writable;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition entryArrived = lock.newCondition();
    private final List<LogEntry> entries = new ArrayList<>();
    private final List<LogListener> listeners = new CopyOnWriteArrayList<>();
    private boolean closed;

    protected AbstractReplicatedLog(LogKey key, boolean writable, Clock clock) {
        this.key = Objects.requireNonNull(key, "key");
        this.writable = writable;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Makes the entry durable before it becomes visible. Called under the log's lock.
     */
    protected abstract void persist(LogEntry entry) throws IOException;

    /**
     * Adds an entry recovered from storage without persisting it again.
     */
    protected void restore(LogEntry entry) {
        if (entry.seq() != entries.size()) {
            throw new IllegalStateException("Log " + key.shortForm() + " expected seq " + entries.size() + " but found " + entry.seq());
        }
        entries.add(entry);
    }

    @Override
    public LogKey key() {
        return key;
    }

    @Override
    public boolean writable() {
        return writable;
    }

    @Override
    public long length() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public LogEntry append(List<Mutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        if (!writable) {
            throw new GraphException.ReadOnlyReplica(key.hex());
        }
        lock.lock();
        try {
            ensureOpen();
            LogEntry entry = new LogEntry(entries.size(), clock.millis(), mutations);
            persistOrFail(entry);
            entries.add(entry);
            entryArrived.signalAll();
            return entry;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean ingest(LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (writable) {
            throw new IllegalStateException("Log " + key.shortForm() + " is writable and only grows by append");
        }
        lock.lock();
        try {
            ensureOpen();
            if (entry.seq() < entries.size()) {
                return false;
            }
            if (entry.seq() > entries.size()) {
                throw new IllegalArgumentException("Entry " + entry.seq() + " leaves a gap after " + entries.size());
            }
            persistOrFail(entry);
            entries.add(entry);
            entryArrived.signalAll();
            for (LogListener listener : listeners) {
                listener.onIngested(this, entry);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<LogEntry> read(long fromSeq, int max) {
        if (fromSeq < 0) throw new IllegalArgumentException("fromSeq must be >= 0");
        if (max <= 0) throw new IllegalArgumentException("max must be positive");
        lock.lock();
        try {
            if (fromSeq >= entries.size()) return List.of();
            int from = (int) fromSeq;
            int to = (int) Math.min(entries.size(), fromSeq + max);
            return List.copyOf(entries.subList(from, to));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean await(long seq, Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            if (seq < entries.size()) return true;
            long nanos = timeout.toNanos();
            while (nanos > 0 && !closed) {
                nanos = entryArrived.awaitNanos(nanos);
                if (seq < entries.size()) return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addListener(LogListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(LogListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            closed = true;
            entryArrived.signalAll();
        } finally {
            lock.unlock();
        }
        listeners.clear();
    }

    private void persistOrFail(LogEntry entry) {
        try {
            persist(entry);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist entry " + entry.seq() + " of log " + key.shortForm(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Log " + key.shortForm() + " is closed");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + key.shortForm() + (writable ? ", writable" : ", replica") + "]";
    }
}
