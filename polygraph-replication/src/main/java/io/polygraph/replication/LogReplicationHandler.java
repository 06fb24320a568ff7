package io.polygraph.replication;

import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.ReplicatedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Framework-neutral HTTP handler serving replicated logs to peers.
 *
 * <p>Logs are registered with {@link #serve(ReplicatedLog)} under their discovery topic.
 * {@code HEAD /logs/{topic}} reports the length; {@code GET /logs/{topic}} returns a batch of
 * entries and requires the log key in the {@value LogProtocol#H_LOG_KEY} header.
 *
 * <pre>{@code
 * LogReplicationHandler handler = LogReplicationHandler.builder(codec)
 *     .longPollTimeout(Duration.ofSeconds(20))
 *     .maxBatchSize(256)
 *     .build();
 * }</pre>
 */
public final class LogReplicationHandler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LogReplicationHandler.class);

    public static final int DEFAULT_MAX_BATCH_SIZE = 256;
    private static final Duration AWAIT_SLICE = Duration.ofMillis(250);

    private final GraphCodec codec;
    private final Duration longPollTimeout;
    private final int maxBatchSize;
    private final Map<String, ReplicatedLog> logs = new ConcurrentHashMap<>();
    private final List<InboundListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public static Builder builder(GraphCodec codec) {
        return new Builder(codec);
    }

    private LogReplicationHandler(Builder builder) {
        this.codec = Objects.requireNonNull(builder.codec, "codec");
        this.longPollTimeout = builder.longPollTimeout != null ? builder.longPollTimeout : Duration.ofSeconds(20);
        this.maxBatchSize = builder.maxBatchSize > 0 ? builder.maxBatchSize : DEFAULT_MAX_BATCH_SIZE;
    }

    /**
     * Builder for {@link LogReplicationHandler}.
     */
    public static final class Builder {
        private final GraphCodec codec;
        private Duration longPollTimeout;
        private int maxBatchSize;

        private Builder(GraphCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        /** How long a live read waits for new entries before answering 204. Default: 20 seconds. */
        public Builder longPollTimeout(Duration longPollTimeout) {
            this.longPollTimeout = longPollTimeout;
            return this;
        }

        /** Upper bound on entries per response, whatever the client asks for. Default: 256. */
        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public LogReplicationHandler build() {
            return new LogReplicationHandler(this);
        }
    }

    /**
     * Starts serving {@code replicatedLog} under its discovery topic.
     *
     * @return the topic
     */
    public String serve(ReplicatedLog replicatedLog) {
        Objects.requireNonNull(replicatedLog, "replicatedLog");
        if (replicatedLog.sparse()) {
            throw new IllegalArgumentException("Sparse logs are not served");
        }
        String topic = replicatedLog.discoveryKey();
        logs.put(topic, replicatedLog);
        return topic;
    }

    public void unserve(String topic) {
        logs.remove(topic);
    }

    public Set<String> topics() {
        return Set.copyOf(logs.keySet());
    }

    public void addInboundListener(InboundListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public PeerResponse handle(PeerRequest req) {
        try {
            String topic = topicOf(req.uri());
            if (topic == null) {
                return PeerResponse.empty(404);
            }
            ReplicatedLog served = logs.get(topic);
            if (served == null) {
                return PeerResponse.empty(404);
            }
            notifyInbound(topic, req);
            return switch (req.method()) {
                case "HEAD" -> handleHead(served);
                case "GET" -> handleGet(req, served);
                default -> PeerResponse.empty(405).header("Allow", "GET, HEAD");
            };
        } catch (IllegalArgumentException e) {
            return PeerResponse.empty(400).header(LogProtocol.H_ERROR, String.valueOf(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PeerResponse.empty(503).header(LogProtocol.H_ERROR, "interrupted");
        } catch (Exception e) {
            log.warn("Failed to serve {}", req.uri().getPath(), e);
            return PeerResponse.empty(500).header(LogProtocol.H_ERROR, "internal_error");
        }
    }

    private PeerResponse handleHead(ReplicatedLog served) {
        return PeerResponse.empty(200)
                .header(LogProtocol.H_LOG_LENGTH, Long.toString(served.length()));
    }

    private PeerResponse handleGet(PeerRequest req, ReplicatedLog served) throws Exception {
        Optional<String> presented = Headers.firstValue(req.headers(), LogProtocol.H_LOG_KEY);
        if (presented.isEmpty() || !served.key().hex().equalsIgnoreCase(presented.get().trim())) {
            return PeerResponse.empty(403).header(LogProtocol.H_ERROR, "log_key_mismatch");
        }

        Map<String, String> q = QueryString.parse(req.uri());
        long offset = q.containsKey(LogProtocol.Q_OFFSET) ? LexiLong.decode(q.get(LogProtocol.Q_OFFSET)) : 0L;
        int max = q.containsKey(LogProtocol.Q_MAX) ? parseMax(q.get(LogProtocol.Q_MAX)) : maxBatchSize;
        String live = q.get(LogProtocol.Q_LIVE);
        if (live != null && !live.isEmpty() && !LogProtocol.LIVE_LONG_POLL.equals(live)) {
            throw new IllegalArgumentException("invalid live mode");
        }

        if (LogProtocol.LIVE_LONG_POLL.equals(live) && offset >= served.length()) {
            if (!awaitEntry(served, offset)) {
                long length = served.length();
                return PeerResponse.empty(204)
                        .header(LogProtocol.H_LOG_NEXT_OFFSET, LexiLong.encode(Math.min(offset, length)))
                        .header(LogProtocol.H_LOG_UP_TO_DATE, LogProtocol.BOOL_TRUE)
                        .header(LogProtocol.H_LOG_LENGTH, Long.toString(length));
            }
        }

        List<LogEntry> entries = served.read(offset, max);
        long length = served.length();
        long next = offset + entries.size();
        return new PeerResponse(200, codec.encodeEntries(entries))
                .header(LogProtocol.H_CONTENT_TYPE, codec.contentType())
                .header(LogProtocol.H_CACHE_CONTROL, "no-store")
                .header(LogProtocol.H_LOG_NEXT_OFFSET, LexiLong.encode(next))
                .header(LogProtocol.H_LOG_UP_TO_DATE, Boolean.toString(next >= length))
                .header(LogProtocol.H_LOG_LENGTH, Long.toString(length));
    }

    // awaits in slices so close() releases parked readers
    private boolean awaitEntry(ReplicatedLog served, long seq) throws InterruptedException {
        long deadline = System.nanoTime() + longPollTimeout.toNanos();
        while (!closed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return false;
            Duration slice = Duration.ofNanos(Math.min(remaining, AWAIT_SLICE.toNanos()));
            if (served.await(seq, slice)) return true;
        }
        return false;
    }

    private int parseMax(String raw) {
        int max;
        try {
            max = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid max: " + raw, e);
        }
        if (max <= 0) throw new IllegalArgumentException("max must be positive");
        return Math.min(max, maxBatchSize);
    }

    private void notifyInbound(String topic, PeerRequest req) {
        Optional<String> peerId = Headers.firstValue(req.headers(), LogProtocol.H_PEER_ID);
        Optional<String> address = Headers.firstValue(req.headers(), LogProtocol.H_PEER_ADDRESS);
        if (peerId.isEmpty() || address.isEmpty()) return;
        URI peerAddress;
        try {
            peerAddress = URI.create(address.get());
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed peer address {}", address.get());
            return;
        }
        for (InboundListener listener : listeners) {
            listener.onInbound(topic, peerId.get(), peerAddress);
        }
    }

    private static String topicOf(URI uri) {
        String path = uri.getPath();
        if (path == null || !path.startsWith(LogProtocol.LOGS_PATH)) return null;
        String topic = path.substring(LogProtocol.LOGS_PATH.length());
        if (topic.isEmpty() || topic.contains("/")) return null;
        return topic;
    }

    /**
     * Stops serving all logs and releases parked long-poll readers.
     */
    @Override
    public void close() {
        closed = true;
        logs.clear();
        listeners.clear();
    }
}
