package io.polygraph.store.core.kv;

import io.polygraph.core.GraphException;
import io.polygraph.store.spi.KeyValueStore;
import io.polygraph.store.spi.KvEntry;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.LogKey;
import io.polygraph.store.spi.LogListener;
import io.polygraph.store.spi.Mutation;
import io.polygraph.store.spi.ReplicatedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link KeyValueStore} whose writes are recorded in a {@link ReplicatedLog} and materialized in
 * an index store.
 *
 * <p>Every write batch becomes one log entry and is applied to the index together with the
 * updated applied-length marker, so after a crash the index is caught up by replaying the log
 * from that marker. When the primary log is a replica, the store is read-only and entries are
 * applied as peers deliver them.
 *
 * <p>Entries of other peers' logs are merged with {@link #applyRemote(LogKey, LogEntry)}. Each
 * followed log keeps its own cursor, written atomically with the entry's mutations. Remote
 * entries overwrite local values and are not re-recorded in the primary log.
 *
 * <p>Bookkeeping lives under {@value #META_PREFIX}, outside every entity prefix.
 */
public final class ReplicatedKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(ReplicatedKeyValueStore.class);

    public static final String META_PREFIX = "_meta/";
    static final String APPLIED_KEY = META_PREFIX + "applied";
    static final String REMOTE_PREFIX = META_PREFIX + "remote/";
    private static final int REPLAY_BATCH = 256;

    private final ReplicatedLog primary;
    private final KeyValueStore index;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final LogListener ingestListener = this::onIngested;

    public ReplicatedKeyValueStore(ReplicatedLog primary, KeyValueStore index) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.index = Objects.requireNonNull(index, "index");
        catchUp();
        if (!primary.writable()) {
            primary.addListener(ingestListener);
        }
    }

    public ReplicatedLog log() {
        return primary;
    }

    public LogKey key() {
        return primary.key();
    }

    public boolean writable() {
        return primary.writable();
    }

    public KeyValueStore index() {
        return index;
    }

    /**
     * Number of primary log entries reflected in the index.
     */
    public long appliedLength() {
        return readCounter(APPLIED_KEY);
    }

    /**
     * Next seq expected from the followed log {@code remote}.
     */
    public long remoteCursor(LogKey remote) {
        return readCounter(remoteKey(remote));
    }

    @Override
    public Optional<byte[]> get(String key) {
        return index.get(key);
    }

    @Override
    public List<KvEntry> scan(String startInclusive, String endExclusive) {
        return index.scan(startInclusive, endExclusive);
    }

    @Override
    public void put(String key, byte[] value) {
        apply(List.of(Mutation.put(key, value)));
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        requireWritable();
        writeLock.lock();
        try {
            if (index.get(key).isEmpty()) {
                return false;
            }
            commit(List.of(Mutation.delete(key)));
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void apply(List<Mutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        if (mutations.isEmpty()) return;
        requireWritable();
        for (Mutation m : mutations) {
            if (m.key().startsWith(META_PREFIX)) {
                throw new IllegalArgumentException("Key " + m.key() + " is reserved");
            }
        }
        writeLock.lock();
        try {
            commit(mutations);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Applies an entry of a followed log.
     *
     * @return true if applied; false if the entry was already applied
     * @throws IllegalArgumentException if entries before it are missing
     */
    public boolean applyRemote(LogKey remote, LogEntry entry) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(entry, "entry");
        if (remote.equals(primary.key())) {
            throw new IllegalArgumentException("Entries of the primary log are not applied remotely");
        }
        writeLock.lock();
        try {
            String cursorKey = remoteKey(remote);
            long cursor = readCounter(cursorKey);
            if (entry.seq() < cursor) {
                return false;
            }
            if (entry.seq() > cursor) {
                throw new IllegalArgumentException("Remote log " + remote.shortForm() + " entry " + entry.seq()
                        + " skips past cursor " + cursor);
            }
            index.apply(withCounter(entry.mutations(), cursorKey, entry.seq() + 1));
            log.debug("Applied remote entry {} of log {}", entry.seq(), remote.shortForm());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        primary.removeListener(ingestListener);
        try {
            primary.close();
        } finally {
            index.close();
        }
    }

    private void commit(List<Mutation> mutations) {
        LogEntry entry = primary.append(mutations);
        index.apply(withCounter(mutations, APPLIED_KEY, entry.seq() + 1));
        log.debug("Committed entry {} ({} mutations) to log {}", entry.seq(), mutations.size(), primary.key().shortForm());
    }

    private void onIngested(ReplicatedLog source, LogEntry entry) {
        writeLock.lock();
        try {
            long applied = readCounter(APPLIED_KEY);
            if (entry.seq() < applied) return;
            if (entry.seq() > applied) {
                // a replay is still pending; catch up from the log, which already holds this entry
                replayFrom(applied);
                return;
            }
            index.apply(withCounter(entry.mutations(), APPLIED_KEY, entry.seq() + 1));
            log.debug("Applied replicated entry {} of log {}", entry.seq(), primary.key().shortForm());
        } finally {
            writeLock.unlock();
        }
    }

    private void catchUp() {
        writeLock.lock();
        try {
            long applied = readCounter(APPLIED_KEY);
            long length = primary.length();
            if (applied > length) {
                throw new IllegalStateException("Index has applied " + applied + " entries but log "
                        + primary.key().shortForm() + " holds only " + length);
            }
            if (applied < length) {
                log.info("Replaying {} entries of log {} into the index", length - applied, primary.key().shortForm());
                replayFrom(applied);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private void replayFrom(long from) {
        long next = from;
        while (true) {
            List<LogEntry> batch = primary.read(next, REPLAY_BATCH);
            if (batch.isEmpty()) return;
            for (LogEntry entry : batch) {
                index.apply(withCounter(entry.mutations(), APPLIED_KEY, entry.seq() + 1));
                next = entry.seq() + 1;
            }
        }
    }

    private void requireWritable() {
        if (!primary.writable()) {
            throw new GraphException.ReadOnlyReplica(primary.key().hex());
        }
    }

    private long readCounter(String key) {
        return index.get(key)
                .map(bytes -> Long.parseLong(new String(bytes, StandardCharsets.US_ASCII)))
                .orElse(0L);
    }

    private static List<Mutation> withCounter(List<Mutation> mutations, String counterKey, long value) {
        List<Mutation> out = new ArrayList<>(mutations.size() + 1);
        out.addAll(mutations);
        out.add(Mutation.put(counterKey, Long.toString(value).getBytes(StandardCharsets.US_ASCII)));
        return out;
    }

    private static String remoteKey(LogKey remote) {
        return REMOTE_PREFIX + remote.hex();
    }
}
