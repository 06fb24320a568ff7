package io.polygraph.replication;

import io.polygraph.core.GraphException;
import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.GraphCodecException;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.LogKey;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads logs served by other peers, using {@link java.net.http.HttpClient}.
 *
 * <p>Every request carries this peer's id and, when known, its advertised address, so the
 * serving side can account for the connection. Failures surface as
 * {@link GraphException.Transport}; nothing is retried here.
 */
public final class PeerClient {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration LONG_POLL_GRACE = Duration.ofSeconds(5);

    private final HttpClient http;
    private final GraphCodec codec;
    private final String peerId;
    private final URI selfAddress;

    /**
     * @param selfAddress advertised address of this peer, or null for anonymous reads
     */
    public PeerClient(HttpClient http, GraphCodec codec, String peerId, URI selfAddress) {
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.selfAddress = selfAddress;
    }

    public String peerId() {
        return peerId;
    }

    /**
     * Length of the log served under {@code topic}, or empty if the peer does not serve it.
     */
    public OptionalLong length(URI peer, String topic) {
        HttpRequest request = baseRequest(logUri(peer, topic, Map.of()), DEFAULT_TIMEOUT)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> resp = send(request, HttpResponse.BodyHandlers.discarding(), peer);
        if (resp.statusCode() == 404) {
            return OptionalLong.empty();
        }
        if (resp.statusCode() != 200) {
            throw new GraphException.Transport("HEAD " + peer + " returned status " + resp.statusCode());
        }
        return OptionalLong.of(parseLong(resp.headers().map(), LogProtocol.H_LOG_LENGTH, peer));
    }

    /**
     * Reads up to {@code max} entries of {@code key} starting at {@code offset}.
     *
     * @param longPoll when non-null, the peer may hold the request this long waiting for new entries
     */
    public LogBatch fetch(URI peer, LogKey key, long offset, int max, Duration longPoll) {
        Objects.requireNonNull(key, "key");
        Map<String, String> q = new LinkedHashMap<>();
        q.put(LogProtocol.Q_OFFSET, LexiLong.encode(offset));
        q.put(LogProtocol.Q_MAX, Integer.toString(max));
        if (longPoll != null) q.put(LogProtocol.Q_LIVE, LogProtocol.LIVE_LONG_POLL);

        Duration timeout = longPoll == null ? DEFAULT_TIMEOUT : longPoll.plus(LONG_POLL_GRACE);
        HttpRequest request = baseRequest(logUri(peer, key.discoveryKey(), q), timeout)
                .header(LogProtocol.H_LOG_KEY, key.hex())
                .GET()
                .build();
        HttpResponse<byte[]> resp = send(request, HttpResponse.BodyHandlers.ofByteArray(), peer);
        Map<String, List<String>> headers = resp.headers().map();

        switch (resp.statusCode()) {
            case 200 -> {
                List<LogEntry> entries;
                try {
                    entries = codec.decodeEntries(resp.body() == null ? new byte[0] : resp.body());
                } catch (GraphCodecException e) {
                    throw new GraphException.Transport("Malformed log batch from " + peer, e);
                }
                long next = parseOffset(headers, peer).orElse(offset + entries.size());
                boolean upToDate = Headers.isTrue(Headers.firstValue(headers, LogProtocol.H_LOG_UP_TO_DATE));
                return new LogBatch(entries, next, upToDate, parseLong(headers, LogProtocol.H_LOG_LENGTH, peer));
            }
            case 204 -> {
                long next = parseOffset(headers, peer).orElse(offset);
                return new LogBatch(List.of(), next, true, parseLong(headers, LogProtocol.H_LOG_LENGTH, peer));
            }
            case 403 -> throw new GraphException.Transport("Peer " + peer + " refused key " + key.shortForm());
            case 404 -> throw new GraphException.Transport("Peer " + peer + " does not serve log " + key.shortForm());
            default -> throw new GraphException.Transport("GET " + peer + " returned status " + resp.statusCode());
        }
    }

    private HttpRequest.Builder baseRequest(URI uri, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header(LogProtocol.H_PEER_ID, peerId);
        if (selfAddress != null) {
            builder.header(LogProtocol.H_PEER_ADDRESS, selfAddress.toString());
        }
        return builder;
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, URI peer) {
        try {
            return http.send(request, handler);
        } catch (IOException e) {
            throw new GraphException.Transport("Request to " + peer + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphException.Transport("Interrupted while talking to " + peer, e);
        }
    }

    private static URI logUri(URI peer, String topic, Map<String, String> query) {
        String base = peer.toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        String uri = base + LogProtocol.logPath(topic);
        return URI.create(query.isEmpty() ? uri : uri + "?" + QueryString.format(query));
    }

    private static OptionalLong parseOffset(Map<String, List<String>> headers, URI peer) {
        Optional<String> raw = Headers.firstValue(headers, LogProtocol.H_LOG_NEXT_OFFSET);
        if (raw.isEmpty()) return OptionalLong.empty();
        try {
            return OptionalLong.of(LexiLong.decode(raw.get()));
        } catch (IllegalArgumentException e) {
            throw new GraphException.Transport("Malformed " + LogProtocol.H_LOG_NEXT_OFFSET + " from " + peer, e);
        }
    }

    private static long parseLong(Map<String, List<String>> headers, String name, URI peer) {
        String raw = Headers.firstValue(headers, name)
                .orElseThrow(() -> new GraphException.Transport("Missing " + name + " from " + peer));
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new GraphException.Transport("Malformed " + name + " from " + peer, e);
        }
    }
}
