package io.polygraph.replication;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Network settings of a {@link ReplicationOrchestrator}.
 *
 * <pre>{@code
 * ReplicationConfig config = ReplicationConfig.builder()
 *     .bindHost("0.0.0.0")
 *     .port(7070)
 *     .advertisedAddress(URI.create("http://graph-a.internal:7070"))
 *     .discovery(new BootstrapDiscoveryService(peers, codec))
 *     .build();
 * }</pre>
 */
public final class ReplicationConfig {
    public static final String DEFAULT_BIND_HOST = "127.0.0.1";
    public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SYNC_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_LONG_POLL_TIMEOUT = Duration.ofSeconds(20);
    public static final int DEFAULT_BATCH_SIZE = 256;

    private final String bindHost;
    private final int port;
    private final URI advertisedAddress;
    private final Duration joinTimeout;
    private final Duration syncTimeout;
    private final Duration longPollTimeout;
    private final int batchSize;
    private final DiscoveryService discovery;
    private final String peerId;
    private final HttpClient httpClient;

    public static Builder builder() {
        return new Builder();
    }

    public static ReplicationConfig defaults() {
        return builder().build();
    }

    private ReplicationConfig(Builder builder) {
        this.bindHost = builder.bindHost != null ? builder.bindHost : DEFAULT_BIND_HOST;
        if (builder.port < 0 || builder.port > 65535) {
            throw new IllegalArgumentException("port out of range: " + builder.port);
        }
        this.port = builder.port;
        this.advertisedAddress = builder.advertisedAddress;
        this.joinTimeout = positive(builder.joinTimeout, DEFAULT_JOIN_TIMEOUT, "joinTimeout");
        this.syncTimeout = positive(builder.syncTimeout, DEFAULT_SYNC_TIMEOUT, "syncTimeout");
        this.longPollTimeout = positive(builder.longPollTimeout, DEFAULT_LONG_POLL_TIMEOUT, "longPollTimeout");
        this.batchSize = builder.batchSize > 0 ? builder.batchSize : DEFAULT_BATCH_SIZE;
        this.discovery = builder.discovery != null ? builder.discovery : InMemoryDiscoveryService.shared();
        this.peerId = builder.peerId != null ? builder.peerId : UUID.randomUUID().toString();
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(5))
                        .build();
    }

    private static Duration positive(Duration value, Duration fallback, String name) {
        if (value == null) return fallback;
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public String bindHost() {
        return bindHost;
    }

    public int port() {
        return port;
    }

    public URI advertisedAddress() {
        return advertisedAddress;
    }

    public Duration joinTimeout() {
        return joinTimeout;
    }

    public Duration syncTimeout() {
        return syncTimeout;
    }

    public Duration longPollTimeout() {
        return longPollTimeout;
    }

    public int batchSize() {
        return batchSize;
    }

    public DiscoveryService discovery() {
        return discovery;
    }

    public String peerId() {
        return peerId;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    /**
     * Builder for {@link ReplicationConfig}.
     */
    public static final class Builder {
        private String bindHost;
        private int port;
        private URI advertisedAddress;
        private Duration joinTimeout;
        private Duration syncTimeout;
        private Duration longPollTimeout;
        private int batchSize;
        private DiscoveryService discovery;
        private String peerId;
        private HttpClient httpClient;

        private Builder() {}

        /** Interface the peer server binds to. Default: 127.0.0.1. */
        public Builder bindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        /** Peer server port; 0 picks an ephemeral port. Default: 0. */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /** Address announced to other peers. Default: derived from bind host and bound port. */
        public Builder advertisedAddress(URI advertisedAddress) {
            this.advertisedAddress = advertisedAddress;
            return this;
        }

        /** Deadline for the initial announce and lookup. Default: 10 seconds. */
        public Builder joinTimeout(Duration joinTimeout) {
            this.joinTimeout = joinTimeout;
            return this;
        }

        /** Deadline for finding peers of a followed log. Default: 10 seconds. */
        public Builder syncTimeout(Duration syncTimeout) {
            this.syncTimeout = syncTimeout;
            return this;
        }

        /** How long live reads wait for new entries, on both sides. Default: 20 seconds. */
        public Builder longPollTimeout(Duration longPollTimeout) {
            this.longPollTimeout = longPollTimeout;
            return this;
        }

        /** Entries per request. Default: 256. */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Default: {@link InMemoryDiscoveryService#shared()}. */
        public Builder discovery(DiscoveryService discovery) {
            this.discovery = discovery;
            return this;
        }

        /** Default: a random UUID. */
        public Builder peerId(String peerId) {
            this.peerId = peerId;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            return this;
        }

        public ReplicationConfig build() {
            return new ReplicationConfig(this);
        }
    }
}
