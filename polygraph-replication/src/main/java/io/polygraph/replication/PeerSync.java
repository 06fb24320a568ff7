package io.polygraph.replication;

import io.polygraph.store.core.kv.ReplicatedKeyValueStore;
import io.polygraph.store.spi.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Applies the entries of a followed remote log to the local substrate.
 *
 * <p>Progress is the substrate's per-remote cursor, so a restarted sync resumes where the last
 * one stopped. Applied entries are evicted from the sparse cache. A sync that fails stops and
 * reports itself to its owner, which may start a new one.
 */
final class PeerSync {
    private static final Logger log = LoggerFactory.getLogger(PeerSync.class);

    private final SparseReplicatedLog remote;
    private final ReplicatedKeyValueStore substrate;
    private final int batchSize;
    private final Duration longPollTimeout;
    private final Consumer<String> failureSink;
    private final Consumer<PeerSync> onFailed;
    private volatile boolean running = true;
    private volatile boolean failed;
    private Future<?> task;

    PeerSync(SparseReplicatedLog remote, ReplicatedKeyValueStore substrate, int batchSize, Duration longPollTimeout,
             Consumer<String> failureSink, Consumer<PeerSync> onFailed) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.substrate = Objects.requireNonNull(substrate, "substrate");
        this.batchSize = batchSize;
        this.longPollTimeout = Objects.requireNonNull(longPollTimeout, "longPollTimeout");
        this.failureSink = Objects.requireNonNull(failureSink, "failureSink");
        this.onFailed = Objects.requireNonNull(onFailed, "onFailed");
    }

    synchronized void start(ExecutorService executor) {
        if (task == null && running) {
            task = executor.submit(this::run);
        }
    }

    SparseReplicatedLog remote() {
        return remote;
    }

    boolean failed() {
        return failed;
    }

    /**
     * Applies whatever the peers currently have.
     *
     * @return number of entries applied
     */
    int pumpAvailable() {
        int applied = 0;
        while (true) {
            long cursor = substrate.remoteCursor(remote.key());
            List<LogEntry> entries = remote.read(cursor, batchSize);
            if (entries.isEmpty()) return applied;
            for (LogEntry entry : entries) {
                if (substrate.applyRemote(remote.key(), entry)) applied++;
            }
            remote.evictBefore(substrate.remoteCursor(remote.key()));
        }
    }

    synchronized void stop() {
        running = false;
        if (task != null) task.cancel(true);
    }

    private void run() {
        log.info("Following log {}", remote.key().shortForm());
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                int applied = pumpAvailable();
                if (applied > 0) {
                    log.debug("Applied {} entries of log {}", applied, remote.key().shortForm());
                    continue;
                }
                remote.await(substrate.remoteCursor(remote.key()), longPollTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (!running || Thread.currentThread().isInterrupted()) return;
            failed = true;
            String failure = "sync with log " + remote.key().shortForm() + " failed: " + e.getMessage();
            log.warn("Peer {}", failure, e);
            failureSink.accept(failure);
            onFailed.accept(this);
        }
    }
}
