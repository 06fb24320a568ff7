package io.polygraph.store.spi;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;

/**
 * Append-only, peer-synchronizable log of mutation batches.
 *
 * <p>A log is either writable (this process created it and is its only writer) or a replica of a
 * log written elsewhere, which only grows through {@link #ingest(LogEntry)}.
 */
public interface ReplicatedLog extends Closeable {

    LogKey key();

    default String discoveryKey() {
        return key().discoveryKey();
    }

    boolean writable();

    /**
     * True if entries are fetched from peers on demand instead of held in full.
     */
    default boolean sparse() {
        return false;
    }

    /**
     * Number of entries known; the next entry's {@code seq}.
     */
    long length();

    /**
     * Appends a new block. Writable logs only.
     */
    LogEntry append(List<Mutation> mutations);

    /**
     * Accepts an entry received from a peer. Replicas only.
     *
     * @return true if the entry was new; false if it was already held
     * @throws IllegalArgumentException if the entry would leave a gap
     */
    boolean ingest(LogEntry entry);

    /**
     * Up to {@code max} entries starting at {@code fromSeq}; empty when {@code fromSeq >= length()}.
     */
    List<LogEntry> read(long fromSeq, int max);

    /**
     * Waits until an entry at {@code seq} exists.
     *
     * @return true if available, false on timeout
     */
    boolean await(long seq, Duration timeout) throws InterruptedException;

    void addListener(LogListener listener);

    void removeListener(LogListener listener);
}
