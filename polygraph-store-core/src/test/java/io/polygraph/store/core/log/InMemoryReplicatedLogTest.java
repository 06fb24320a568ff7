package io.polygraph.store.core.log;

import io.polygraph.core.GraphException;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.Mutation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryReplicatedLogTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void appendAssignsConsecutiveSequenceNumbers() {
        InMemoryReplicatedLog log = InMemoryReplicatedLog.create();

        LogEntry a = log.append(List.of(put("a")));
        LogEntry b = log.append(List.of(put("b")));

        assertThat(a.seq()).isZero();
        assertThat(b.seq()).isEqualTo(1);
        assertThat(log.length()).isEqualTo(2);
        assertThat(log.read(0, 10)).containsExactly(a, b);
        assertThat(log.read(1, 10)).containsExactly(b);
        assertThat(log.read(2, 10)).isEmpty();
    }

    @Test
    void replicaOnlyGrowsByIngest() {
        InMemoryReplicatedLog origin = InMemoryReplicatedLog.create();
        LogEntry a = origin.append(List.of(put("a")));
        LogEntry b = origin.append(List.of(put("b")));
        InMemoryReplicatedLog replica = InMemoryReplicatedLog.replicaOf(origin.key());
        List<Long> seen = new ArrayList<>();
        replica.addListener((log, entry) -> seen.add(entry.seq()));

        assertThatThrownBy(() -> replica.append(List.of(put("x"))))
                .isInstanceOf(GraphException.ReadOnlyReplica.class);
        assertThatThrownBy(() -> replica.ingest(b))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> origin.ingest(a))
                .isInstanceOf(IllegalStateException.class);

        assertThat(replica.ingest(a)).isTrue();
        assertThat(replica.ingest(a)).isFalse();
        assertThat(replica.ingest(b)).isTrue();

        assertThat(seen).containsExactly(0L, 1L);
        assertThat(replica.discoveryKey()).isEqualTo(origin.discoveryKey());
    }

    @Test
    void awaitWakesOnAppend() throws Exception {
        InMemoryReplicatedLog log = InMemoryReplicatedLog.create();

        Future<Boolean> waiting = executor.submit(() -> log.await(0, Duration.ofSeconds(5)));
        Thread.sleep(50);
        log.append(List.of(put("a")));

        assertThat(waiting.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(log.await(5, Duration.ofMillis(20))).isFalse();
    }

    private static Mutation put(String key) {
        return Mutation.put("nodes/" + key, key.getBytes(StandardCharsets.UTF_8));
    }
}
