package io.polygraph.replication;

import io.polygraph.core.AttributeOptions;
import io.polygraph.core.GraphException;
import io.polygraph.core.Ids;
import io.polygraph.core.NodeOptions;
import io.polygraph.core.PolyNode;
import io.polygraph.core.RelationOptions;
import io.polygraph.json.jackson.JacksonGraphCodec;
import io.polygraph.store.core.GraphStores;
import io.polygraph.store.core.KeyValueGraphStore;
import io.polygraph.store.spi.LogKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplicationOrchestratorTest {

    private static final Duration PROPAGATION = Duration.ofSeconds(10);

    private final JacksonGraphCodec codec = new JacksonGraphCodec();
    private final InMemoryDiscoveryService discovery = new InMemoryDiscoveryService();
    private final List<AutoCloseable> cleanup = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (int i = cleanup.size() - 1; i >= 0; i--) {
            cleanup.get(i).close();
        }
    }

    @Test
    void joinIsIdempotentAndLeaveReturnsToDisconnected() {
        KeyValueGraphStore store = store(GraphStores.inMemory(codec));
        ReplicationOrchestrator network = orchestrator(store, "a");

        network.joinNetwork();
        URI address = network.address().orElseThrow();
        network.joinNetwork();

        assertThat(network.state()).isEqualTo(NetworkState.JOINED);
        assertThat(network.address()).contains(address);
        assertThat(discovery.lookup(network.key().discoveryKey())).containsExactly(address);
        assertThat(network.status().topics()).containsExactly(network.key().discoveryKey());

        network.leaveNetwork();

        assertThat(network.state()).isEqualTo(NetworkState.DISCONNECTED);
        assertThat(discovery.lookup(network.key().discoveryKey())).isEmpty();
        assertThat(network.status().connections()).isEmpty();
        assertThat(network.address()).isEmpty();
    }

    @Test
    void leaveWithoutJoinIsSafe() {
        ReplicationOrchestrator network = orchestrator(store(GraphStores.inMemory(codec)), "a");

        network.leaveNetwork();
        network.close();

        assertThat(network.state()).isEqualTo(NetworkState.DISCONNECTED);
    }

    @Test
    void canRejoinAfterLeaving() {
        ReplicationOrchestrator network = orchestrator(store(GraphStores.inMemory(codec)), "a");

        network.joinNetwork();
        network.leaveNetwork();
        network.joinNetwork();

        assertThat(network.state()).isEqualTo(NetworkState.JOINED);
    }

    @Test
    void syncRequiresJoinedNetwork() {
        ReplicationOrchestrator network = orchestrator(store(GraphStores.inMemory(codec)), "a");

        assertThatThrownBy(() -> network.syncWithPeer(LogKey.random()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void replicaFollowsWriterAfterJoin() throws Exception {
        KeyValueGraphStore writer = store(GraphStores.inMemory(codec));
        writer.addNode("Water", NodeOptions.none());
        ReplicationOrchestrator writerNetwork = orchestrator(writer, "writer");
        writerNetwork.joinNetwork();

        KeyValueGraphStore replica = store(GraphStores.inMemoryReplica(GraphStores.substrateOf(writer).key()));
        ReplicationOrchestrator replicaNetwork = orchestrator(replica, "replica");
        replicaNetwork.joinNetwork();

        Eventually.await("initial catch-up", PROPAGATION, () -> replica.getNode("water").isPresent());

        writer.addNode("Hydrogen", NodeOptions.none());
        writer.addRelation("hydrogen", "water", "part of", RelationOptions.none());

        Eventually.await("live entries", PROPAGATION,
                () -> replica.getRelation(Ids.relationId("hydrogen", "part of", "water")).isPresent());
        assertThat(replica.getNode("hydrogen").orElseThrow().activeMorph().relationIds())
                .containsExactly(Ids.relationId("hydrogen", "part of", "water"));
        assertThatThrownBy(() -> replica.addNode("Ice", NodeOptions.none()))
                .isInstanceOf(GraphException.ReadOnlyReplica.class);

        Eventually.await("inbound connection on writer", PROPAGATION, () -> writerNetwork.status().connections()
                .stream().anyMatch(c -> c.direction() == PeerConnection.Direction.INBOUND));
        assertThat(replicaNetwork.status().connections())
                .anyMatch(c -> c.direction() == PeerConnection.Direction.OUTBOUND);
    }

    @Test
    void syncWithPeerMergesRemoteWrites() throws Exception {
        KeyValueGraphStore alice = store(GraphStores.inMemory(codec));
        alice.addNode("Water", NodeOptions.none());
        alice.addAttribute("water", "chemical formula", "H2O", AttributeOptions.none());
        ReplicationOrchestrator aliceNetwork = orchestrator(alice, "alice");
        aliceNetwork.joinNetwork();

        KeyValueGraphStore bob = store(GraphStores.inMemory(codec));
        bob.addNode("Salt", NodeOptions.none());
        ReplicationOrchestrator bobNetwork = orchestrator(bob, "bob");
        bobNetwork.joinNetwork();

        LogKey aliceKey = aliceNetwork.key();
        bobNetwork.syncWithPeer(aliceKey);
        bobNetwork.syncWithPeer(aliceKey);

        Eventually.await("alice's node at bob", PROPAGATION, () -> bob.getNode("water").isPresent());
        PolyNode water = bob.getNode("water").orElseThrow();
        assertThat(water.activeMorph().attributeIds()).hasSize(1);
        assertThat(bob.getNode("salt")).isPresent();

        alice.addNode("Ice", NodeOptions.none());
        Eventually.await("later write at bob", PROPAGATION, () -> bob.getNode("ice").isPresent());

        assertThat(alice.getNode("salt")).isEmpty();
        assertThat(bobNetwork.state()).isEqualTo(NetworkState.JOINED);
        assertThat(bobNetwork.status().syncedPeers()).containsExactly(aliceKey);
        assertThat(GraphStores.substrateOf(bob).remoteCursor(aliceKey))
                .isEqualTo(GraphStores.substrateOf(alice).log().length());
    }

    @Test
    void failedSyncCanBeStartedAgain() throws Exception {
        KeyValueGraphStore alice = store(GraphStores.inMemory(codec));
        alice.addNode("Water", NodeOptions.none());
        ReplicationOrchestrator aliceNetwork = orchestrator(alice, "alice");
        aliceNetwork.joinNetwork();

        KeyValueGraphStore bob = store(GraphStores.inMemory(codec));
        ReplicationOrchestrator bobNetwork = orchestrator(bob, "bob");
        bobNetwork.joinNetwork();
        LogKey aliceKey = aliceNetwork.key();
        bobNetwork.syncWithPeer(aliceKey);
        Eventually.await("first copy", PROPAGATION, () -> bob.getNode("water").isPresent());

        aliceNetwork.leaveNetwork();
        Eventually.await("failed sync dropped", PROPAGATION, () -> bobNetwork.status().syncedPeers().isEmpty());
        assertThat(bobNetwork.status().failures()).isNotEmpty();
        assertThat(bobNetwork.status().topics()).doesNotContain(aliceKey.discoveryKey());

        alice.addNode("Ice", NodeOptions.none());
        aliceNetwork.joinNetwork();
        bobNetwork.syncWithPeer(aliceKey);

        Eventually.await("resumed copy", PROPAGATION, () -> bob.getNode("ice").isPresent());
        assertThat(bobNetwork.status().syncedPeers()).containsExactly(aliceKey);
        assertThat(GraphStores.substrateOf(bob).remoteCursor(aliceKey))
                .isEqualTo(GraphStores.substrateOf(alice).log().length());
    }

    @Test
    void failedPullSessionIsDropped() throws Exception {
        KeyValueGraphStore writer = store(GraphStores.inMemory(codec));
        writer.addNode("Water", NodeOptions.none());
        ReplicationOrchestrator writerNetwork = orchestrator(writer, "writer");
        writerNetwork.joinNetwork();

        KeyValueGraphStore replica = store(GraphStores.inMemoryReplica(writerNetwork.key()));
        ReplicationOrchestrator replicaNetwork = orchestrator(replica, "replica");
        replicaNetwork.joinNetwork();
        Eventually.await("initial catch-up", PROPAGATION, () -> replica.getNode("water").isPresent());
        assertThat(replicaNetwork.sessions()).anyMatch(s -> s.mode() == ReplicationSession.Mode.PULL);

        writerNetwork.leaveNetwork();

        Eventually.await("pull session dropped", PROPAGATION, () -> replicaNetwork.sessions().stream()
                .noneMatch(s -> s.mode() == ReplicationSession.Mode.PULL));
        assertThat(replicaNetwork.status().failures()).isNotEmpty();
        assertThat(replicaNetwork.state()).isEqualTo(NetworkState.JOINED);
    }

    @Test
    void syncWithUnknownLogFails() {
        ReplicationOrchestrator network = orchestrator(store(GraphStores.inMemory(codec)), "a");
        network.joinNetwork();
        LogKey nobody = LogKey.random();

        assertThatThrownBy(() -> network.syncWithPeer(nobody))
                .isInstanceOf(GraphException.Transport.class);
        assertThat(network.state()).isEqualTo(NetworkState.JOINED);
        assertThat(network.status().syncedPeers()).isEmpty();
        assertThat(network.status().topics()).doesNotContain(nobody.discoveryKey());
    }

    @Test
    void slowDiscoveryTimesOutJoin() {
        DiscoveryService stuck = new DiscoveryService() {
            @Override
            public void announce(String topic, URI address) {
            }

            @Override
            public void unannounce(String topic, URI address) {
            }

            @Override
            public List<URI> lookup(String topic) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }
        };
        ReplicationOrchestrator network = track(new ReplicationOrchestrator(
                GraphStores.substrateOf(store(GraphStores.inMemory(codec))), codec,
                ReplicationConfig.builder().discovery(stuck).joinTimeout(Duration.ofMillis(200)).build()));

        assertThatThrownBy(network::joinNetwork).isInstanceOf(GraphException.Transport.class);
        assertThat(network.state()).isEqualTo(NetworkState.DISCONNECTED);
        assertThat(network.address()).isEmpty();
    }

    @Test
    void fileBackedReplicaResumesAfterRestart(@TempDir Path dir) throws Exception {
        KeyValueGraphStore writer = store(GraphStores.inMemory(codec));
        writer.addNode("Water", NodeOptions.none());
        ReplicationOrchestrator writerNetwork = orchestrator(writer, "writer");
        writerNetwork.joinNetwork();
        LogKey key = writerNetwork.key();

        KeyValueGraphStore first = GraphStores.openReplica(dir, key, GraphStores.IndexBackend.ROCKSDB, codec);
        ReplicationOrchestrator firstNetwork = new ReplicationOrchestrator(GraphStores.substrateOf(first), codec, config("r1"));
        firstNetwork.joinNetwork();
        Eventually.await("first copy", PROPAGATION, () -> first.getNode("water").isPresent());
        firstNetwork.close();
        first.close();

        writer.addNode("Steam", NodeOptions.none());

        KeyValueGraphStore second = store(GraphStores.openReplica(dir, key, GraphStores.IndexBackend.ROCKSDB, codec));
        assertThat(second.getNode("water")).isPresent();
        orchestrator(second, "r2").joinNetwork();

        Eventually.await("resumed copy", PROPAGATION, () -> second.getNode("steam").isPresent());
    }

    private KeyValueGraphStore store(KeyValueGraphStore store) {
        cleanup.add(store::close);
        return store;
    }

    private ReplicationOrchestrator orchestrator(KeyValueGraphStore store, String peerId) {
        return track(new ReplicationOrchestrator(GraphStores.substrateOf(store), codec, config(peerId)));
    }

    private ReplicationOrchestrator track(ReplicationOrchestrator network) {
        cleanup.add(network);
        return network;
    }

    private ReplicationConfig config(String peerId) {
        return ReplicationConfig.builder()
                .peerId(peerId)
                .discovery(discovery)
                .longPollTimeout(Duration.ofMillis(500))
                .joinTimeout(Duration.ofSeconds(5))
                .syncTimeout(Duration.ofSeconds(5))
                .build();
    }
}
