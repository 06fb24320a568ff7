package io.polygraph.store.spi;

/**
 * Notified after a replica accepted an entry received from a peer.
 */
@FunctionalInterface
public interface LogListener {
    void onIngested(ReplicatedLog log, LogEntry entry);
}
