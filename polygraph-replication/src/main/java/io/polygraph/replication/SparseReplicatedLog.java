package io.polygraph.replication;

import io.polygraph.core.GraphException;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.LogKey;
import io.polygraph.store.spi.LogListener;
import io.polygraph.store.spi.Mutation;
import io.polygraph.store.spi.ReplicatedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Read-only view of a remote log whose entries are fetched from peers on demand.
 *
 * <p>Fetched entries are cached in memory until {@link #evictBefore(long)} drops them; nothing is
 * persisted. {@link #length()} is the largest length any peer has reported so far.
 */
public final class SparseReplicatedLog implements ReplicatedLog {
    private static final Logger log = LoggerFactory.getLogger(SparseReplicatedLog.class);

    private final LogKey key;
    private final PeerClient client;
    private final int batchSize;
    private final NavigableMap<Long, LogEntry> cache = new ConcurrentSkipListMap<>();
    private final List<URI> peers = new CopyOnWriteArrayList<>();
    private final List<LogListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong knownLength = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition entryArrived = lock.newCondition();
    private volatile boolean closed;

    public SparseReplicatedLog(LogKey key, PeerClient client, int batchSize) {
        this.key = Objects.requireNonNull(key, "key");
        this.client = Objects.requireNonNull(client, "client");
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        this.batchSize = batchSize;
    }

    public void addPeer(URI peer) {
        Objects.requireNonNull(peer, "peer");
        if (!peers.contains(peer)) {
            peers.add(peer);
            log.debug("Log {} can now be fetched from {}", key.shortForm(), peer);
        }
    }

    public List<URI> peers() {
        return List.copyOf(peers);
    }

    /**
     * Drops cached entries below {@code seq}.
     */
    public void evictBefore(long seq) {
        cache.headMap(seq, false).clear();
    }

    public int cachedEntries() {
        return cache.size();
    }

    @Override
    public LogKey key() {
        return key;
    }

    @Override
    public boolean writable() {
        return false;
    }

    @Override
    public boolean sparse() {
        return true;
    }

    @Override
    public long length() {
        return knownLength.get();
    }

    @Override
    public LogEntry append(List<Mutation> mutations) {
        throw new GraphException.ReadOnlyReplica(key.hex());
    }

    /**
     * Caches an entry delivered by a peer. Entries may arrive out of order.
     */
    @Override
    public boolean ingest(LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        ensureOpen();
        if (cache.putIfAbsent(entry.seq(), entry) != null) {
            return false;
        }
        knownLength.accumulateAndGet(entry.seq() + 1, Math::max);
        lock.lock();
        try {
            entryArrived.signalAll();
        } finally {
            lock.unlock();
        }
        for (LogListener listener : listeners) {
            listener.onIngested(this, entry);
        }
        return true;
    }

    /**
     * Returns cached entries from {@code fromSeq} and fetches the rest of the range from peers.
     */
    @Override
    public List<LogEntry> read(long fromSeq, int max) {
        if (fromSeq < 0) throw new IllegalArgumentException("fromSeq must be >= 0");
        if (max <= 0) throw new IllegalArgumentException("max must be positive");
        ensureOpen();
        List<LogEntry> out = collect(fromSeq, max);
        if (out.size() < max && !peers.isEmpty()) {
            fetch(fromSeq + out.size(), Math.min(batchSize, max - out.size()), null);
            out = collect(fromSeq, max);
        }
        return out;
    }

    /**
     * Long-polls the peers for entry {@code seq}; with no peers, waits for an ingested entry.
     */
    @Override
    public boolean await(long seq, Duration timeout) throws InterruptedException {
        if (cache.containsKey(seq)) return true;
        ensureOpen();
        if (!peers.isEmpty()) {
            fetch(seq, batchSize, timeout);
            return cache.containsKey(seq);
        }
        lock.lock();
        try {
            long nanos = timeout.toNanos();
            while (nanos > 0 && !closed && !cache.containsKey(seq)) {
                nanos = entryArrived.awaitNanos(nanos);
            }
            return cache.containsKey(seq);
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
    public void close() {
        closed = true;
        lock.lock();
        try {
            entryArrived.signalAll();
        } finally {
            lock.unlock();
        }
        cache.clear();
        listeners.clear();
    }

    private List<LogEntry> collect(long fromSeq, int max) {
        List<LogEntry> out = new ArrayList<>();
        long seq = fromSeq;
        while (out.size() < max) {
            LogEntry e = cache.get(seq);
            if (e == null) break;
            out.add(e);
            seq++;
        }
        return out;
    }

    // first peer that answers wins; the last failure is rethrown when none does
    private void fetch(long fromSeq, int max, Duration longPoll) {
        GraphException.Transport failure = null;
        for (URI peer : peers) {
            try {
                LogBatch batch = client.fetch(peer, key, fromSeq, max, longPoll);
                knownLength.accumulateAndGet(batch.length(), Math::max);
                for (LogEntry entry : batch.entries()) {
                    ingest(entry);
                }
                return;
            } catch (GraphException.Transport e) {
                log.debug("Fetching log {} from {} failed: {}", key.shortForm(), peer, e.getMessage());
                failure = e;
            }
        }
        if (failure != null) throw failure;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Log " + key.shortForm() + " is closed");
        }
    }

    @Override
    public String toString() {
        return "SparseReplicatedLog[" + key.shortForm() + ", peers=" + peers.size() + "]";
    }
}
