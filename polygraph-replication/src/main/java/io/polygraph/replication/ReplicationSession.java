package io.polygraph.replication;

import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.ReplicatedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Replication over one peer connection of the primary topic.
 *
 * <p>When the local log is a full replica and the connection is outbound, the session pulls the
 * missing entries from the peer and keeps long-polling for more. Otherwise the peer pulls from
 * us through the server and the session only tracks the connection.
 */
final class ReplicationSession {
    private static final Logger log = LoggerFactory.getLogger(ReplicationSession.class);

    enum Mode {
        PULL,
        SERVE
    }

    enum Status {
        ACTIVE,
        FAILED,
        STOPPED
    }

    private final PeerConnection connection;
    private final ReplicatedLog replicatedLog;
    private final PeerClient client;
    private final int batchSize;
    private final Duration longPollTimeout;
    private final Consumer<String> failureSink;
    private final Consumer<ReplicationSession> onFailed;
    private final Mode mode;
    private volatile Status status = Status.ACTIVE;
    private volatile boolean running = true;
    private Future<?> task;

    ReplicationSession(PeerConnection connection, ReplicatedLog replicatedLog, PeerClient client, int batchSize,
                       Duration longPollTimeout, Consumer<String> failureSink,
                       Consumer<ReplicationSession> onFailed) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.replicatedLog = Objects.requireNonNull(replicatedLog, "replicatedLog");
        this.client = Objects.requireNonNull(client, "client");
        this.batchSize = batchSize;
        this.longPollTimeout = Objects.requireNonNull(longPollTimeout, "longPollTimeout");
        this.failureSink = Objects.requireNonNull(failureSink, "failureSink");
        this.onFailed = Objects.requireNonNull(onFailed, "onFailed");
        boolean pulls = !replicatedLog.writable() && !replicatedLog.sparse()
                && connection.direction() == PeerConnection.Direction.OUTBOUND;
        this.mode = pulls ? Mode.PULL : Mode.SERVE;
    }

    synchronized void start(ExecutorService executor) {
        if (mode == Mode.PULL && task == null && running) {
            task = executor.submit(this::pull);
        }
    }

    PeerConnection connection() {
        return connection;
    }

    Mode mode() {
        return mode;
    }

    Status status() {
        return status;
    }

    synchronized void stop() {
        running = false;
        if (status == Status.ACTIVE) status = Status.STOPPED;
        if (task != null) task.cancel(true);
    }

    private void pull() {
        log.info("Pulling log {} from {}", replicatedLog.key().shortForm(), connection.remoteAddress());
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                long from = replicatedLog.length();
                LogBatch batch = client.fetch(connection.remoteAddress(), replicatedLog.key(), from, batchSize,
                        longPollTimeout);
                for (LogEntry entry : batch.entries()) {
                    replicatedLog.ingest(entry);
                }
                if (!batch.entries().isEmpty()) {
                    log.debug("Ingested {} entries of log {} from {}", batch.entries().size(),
                            replicatedLog.key().shortForm(), connection.remoteAddress());
                }
            }
        } catch (RuntimeException e) {
            if (!running || Thread.currentThread().isInterrupted()) return;
            status = Status.FAILED;
            String failure = "session with " + connection.remoteAddress() + " failed: " + e.getMessage();
            log.warn("Replication {}", failure, e);
            failureSink.accept(failure);
            onFailed.accept(this);
        }
    }
}
