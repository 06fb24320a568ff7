package io.polygraph.replication;

import io.polygraph.core.GraphException;
import io.polygraph.json.jackson.JacksonGraphCodec;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.LogKey;
import io.polygraph.store.spi.Mutation;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeerClientTest {

    private final JacksonGraphCodec codec = new JacksonGraphCodec();
    private final LogKey key = LogKey.random();
    private MockWebServer server;
    private PeerClient client;
    private URI peer;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        peer = server.url("/").uri();
        client = new PeerClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), codec,
                "peer-a", URI.create("http://127.0.0.1:7001"));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void fetchDecodesEntriesAndHeaders() throws Exception {
        List<LogEntry> entries = List.of(
                new LogEntry(3, 1_000L, List.of(Mutation.put("node/water", "{}".getBytes(StandardCharsets.UTF_8)))),
                new LogEntry(4, 2_000L, List.of(Mutation.delete("node/water"))));
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .addHeader("Log-Next-Offset", LexiLong.encode(5))
                .addHeader("Log-Up-To-Date", "true")
                .addHeader("Log-Length", "5")
                .setBody(new String(codec.encodeEntries(entries), StandardCharsets.UTF_8)));

        LogBatch batch = client.fetch(peer, key, 3, 10, null);

        assertThat(batch.entries()).extracting(LogEntry::seq).containsExactly(3L, 4L);
        assertThat(batch.nextOffset()).isEqualTo(5);
        assertThat(batch.upToDate()).isTrue();
        assertThat(batch.length()).isEqualTo(5);

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).startsWith("/logs/" + key.discoveryKey())
                .contains("offset=" + LexiLong.encode(3))
                .contains("max=10")
                .doesNotContain("live=");
        assertThat(recorded.getHeader("Log-Key")).isEqualTo(key.hex());
        assertThat(recorded.getHeader("Peer-Id")).isEqualTo("peer-a");
        assertThat(recorded.getHeader("Peer-Address")).isEqualTo("http://127.0.0.1:7001");
    }

    @Test
    void longPollTimeoutIsAnEmptyUpToDateBatch() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(204)
                .addHeader("Log-Next-Offset", LexiLong.encode(7))
                .addHeader("Log-Up-To-Date", "true")
                .addHeader("Log-Length", "7"));

        LogBatch batch = client.fetch(peer, key, 7, 10, Duration.ofMillis(100));

        assertThat(batch.entries()).isEmpty();
        assertThat(batch.upToDate()).isTrue();
        assertThat(batch.nextOffset()).isEqualTo(7);
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).contains("live=long-poll");
    }

    @Test
    void refusalsSurfaceAsTransportErrors() {
        server.enqueue(new MockResponse().setResponseCode(403));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> client.fetch(peer, key, 0, 10, null))
                .isInstanceOf(GraphException.Transport.class).hasMessageContaining("refused");
        assertThatThrownBy(() -> client.fetch(peer, key, 0, 10, null))
                .isInstanceOf(GraphException.Transport.class).hasMessageContaining("does not serve");
        assertThatThrownBy(() -> client.fetch(peer, key, 0, 10, null))
                .isInstanceOf(GraphException.Transport.class).hasMessageContaining("500");
    }

    @Test
    void malformedBodyIsATransportError() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Log-Length", "1")
                .setBody("{not json"));

        assertThatThrownBy(() -> client.fetch(peer, key, 0, 10, null))
                .isInstanceOf(GraphException.Transport.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void headReportsLength() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).addHeader("Log-Length", "12"));
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThat(client.length(peer, key.discoveryKey())).hasValue(12);
        assertThat(client.length(peer, key.discoveryKey())).isEmpty();
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getMethod()).isEqualTo("HEAD");
    }

    @Test
    void unreachablePeerIsATransportError() throws Exception {
        MockWebServer gone = new MockWebServer();
        gone.start();
        URI closed = gone.url("/").uri();
        gone.shutdown();

        assertThatThrownBy(() -> client.length(closed, key.discoveryKey()))
                .isInstanceOf(GraphException.Transport.class);
    }
}
