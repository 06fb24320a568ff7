package io.polygraph.replication;

import io.polygraph.core.GraphException;
import io.polygraph.json.jackson.JacksonGraphCodec;
import io.polygraph.store.core.log.InMemoryReplicatedLog;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.Mutation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SparseReplicatedLogTest {

    private final JacksonGraphCodec codec = new JacksonGraphCodec();
    private InMemoryReplicatedLog origin;
    private PeerServer server;
    private SparseReplicatedLog sparse;

    @BeforeEach
    void setUp() {
        origin = InMemoryReplicatedLog.create();
        for (int i = 0; i < 10; i++) {
            origin.append(List.of(Mutation.put("attr/a" + i, Integer.toString(i).getBytes(StandardCharsets.UTF_8))));
        }
        LogReplicationHandler handler = LogReplicationHandler.builder(codec)
                .longPollTimeout(Duration.ofSeconds(2))
                .build();
        handler.serve(origin);
        server = new PeerServer(handler);
        int port = server.start("127.0.0.1", 0);

        PeerClient client = new PeerClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                codec, "reader", null);
        sparse = new SparseReplicatedLog(origin.key(), client, 4);
        sparse.addPeer(URI.create("http://127.0.0.1:" + port));
    }

    @AfterEach
    void tearDown() throws Exception {
        sparse.close();
        server.close();
        origin.close();
    }

    @Test
    void readsFetchOnlyTheRequestedRange() {
        List<LogEntry> entries = sparse.read(6, 2);

        assertThat(entries).extracting(LogEntry::seq).containsExactly(6L, 7L);
        assertThat(sparse.length()).isEqualTo(10);
        assertThat(sparse.cachedEntries()).isEqualTo(2);
    }

    @Test
    void cachedEntriesAreServedLocallyAndEvictable() {
        sparse.read(0, 4);
        assertThat(sparse.cachedEntries()).isEqualTo(4);

        sparse.evictBefore(3);

        assertThat(sparse.cachedEntries()).isEqualTo(1);
        assertThat(sparse.read(3, 1)).extracting(LogEntry::seq).containsExactly(3L);
    }

    @Test
    void awaitLongPollsForNewEntries() throws Exception {
        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            origin.append(List.of(Mutation.delete("attr/a0")));
        });
        writer.start();

        boolean arrived = sparse.await(10, Duration.ofSeconds(2));
        writer.join();

        assertThat(arrived).isTrue();
        assertThat(sparse.read(10, 1)).extracting(LogEntry::seq).containsExactly(10L);
    }

    @Test
    void isReadOnly() {
        assertThat(sparse.writable()).isFalse();
        assertThat(sparse.sparse()).isTrue();
        assertThatThrownBy(() -> sparse.append(List.of(Mutation.delete("x"))))
                .isInstanceOf(GraphException.ReadOnlyReplica.class);
    }

    @Test
    void withoutPeersReadsOnlyWhatWasIngested() throws Exception {
        SparseReplicatedLog detached = new SparseReplicatedLog(origin.key(), new PeerClient(
                HttpClient.newHttpClient(), codec, "offline", null), 4);
        detached.ingest(origin.read(2, 1).get(0));

        assertThat(detached.read(0, 4)).isEmpty();
        assertThat(detached.read(2, 4)).extracting(LogEntry::seq).containsExactly(2L);
        assertThat(detached.await(5, Duration.ofMillis(50))).isFalse();
        detached.close();
    }
}
