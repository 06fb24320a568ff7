package io.polygraph.replication;

import io.polygraph.core.GraphException;
import io.polygraph.store.core.kv.ReplicatedKeyValueStore;
import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.GraphCodecs;
import io.polygraph.store.spi.LogKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Makes a store's log reachable from other peers and follows other peers' logs.
 *
 * <p>{@link #joinNetwork()} serves and announces the primary log and connects to everyone else
 * serving it; a replica pulls the entries it is missing over those connections.
 * {@link #syncWithPeer(LogKey)} follows another writer's log and merges its entries into the
 * local substrate.
 *
 * <pre>{@code
 * KeyValueGraphStore store = GraphStores.open(dir);
 * try (ReplicationOrchestrator network = new ReplicationOrchestrator(GraphStores.substrateOf(store), config)) {
 *     network.joinNetwork();
 *     network.syncWithPeer(colleagueKey);
 * }
 * }</pre>
 *
 * <p>Failed sessions are logged, listed in {@link #status()} and dropped; they are not retried.
 * A failed peer sync can be started again with another {@link #syncWithPeer(LogKey)}.
 */
public final class ReplicationOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReplicationOrchestrator.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final ReplicatedKeyValueStore substrate;
    private final GraphCodec codec;
    private final ReplicationConfig config;
    private final List<String> failures = new CopyOnWriteArrayList<>();
    private final List<ReplicationSession> sessions = new CopyOnWriteArrayList<>();
    private final Map<LogKey, PeerSync> syncs = new ConcurrentHashMap<>();
    private final Map<String, SparseReplicatedLog> followedByTopic = new ConcurrentHashMap<>();

    private volatile NetworkState state = NetworkState.DISCONNECTED;
    private volatile HttpSwarm swarm;
    private volatile ExecutorService executor;
    private volatile PeerClient client;
    private volatile String primaryTopic;

    public ReplicationOrchestrator(ReplicatedKeyValueStore substrate, GraphCodec codec, ReplicationConfig config) {
        this.substrate = Objects.requireNonNull(substrate, "substrate");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
    }

    public ReplicationOrchestrator(ReplicatedKeyValueStore substrate, ReplicationConfig config) {
        this(substrate, GraphCodecs.load(), config);
    }

    public NetworkState state() {
        return state;
    }

    public LogKey key() {
        return substrate.key();
    }

    /**
     * Address other peers reach this one at, while joined.
     */
    public Optional<URI> address() {
        HttpSwarm current = swarm;
        return current == null ? Optional.empty() : Optional.ofNullable(current.selfAddress());
    }

    /**
     * Serves and announces the primary log and connects to the peers already serving it.
     *
     * <p>A no-op when already joined.
     *
     * @throws GraphException.Transport if the server cannot start or the lookup misses the join
     *         timeout; the orchestrator is then left disconnected
     */
    public synchronized void joinNetwork() {
        if (state != NetworkState.DISCONNECTED) {
            return;
        }
        state = NetworkState.JOINING;
        log.info("Joining network for log {}", substrate.key().shortForm());
        try {
            executor = Executors.newCachedThreadPool(new NamedThreadFactory("polygraph-replication"));
            LogReplicationHandler handler = LogReplicationHandler.builder(codec)
                    .longPollTimeout(config.longPollTimeout())
                    .maxBatchSize(config.batchSize())
                    .build();
            HttpSwarm created = new HttpSwarm(config.discovery(), handler, executor);
            swarm = created;
            URI self = created.listen(config.bindHost(), config.port(), config.advertisedAddress());
            client = new PeerClient(config.httpClient(), codec, config.peerId(), self);
            created.onConnection(this::onConnection);

            primaryTopic = handler.serve(substrate.log());
            created.join(primaryTopic, JoinMode.BOTH);
            if (!created.flush(config.joinTimeout())) {
                throw new GraphException.Transport("Peer lookup for log " + substrate.key().shortForm()
                        + " did not finish within " + config.joinTimeout());
            }
            state = NetworkState.JOINED;
            log.info("Joined network at {} for log {} ({} peers)", self, substrate.key().shortForm(),
                    created.connections().size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            teardown();
            throw new GraphException.Transport("Interrupted while joining", e);
        } catch (GraphException.Transport e) {
            teardown();
            throw e;
        } catch (RuntimeException e) {
            teardown();
            throw new GraphException.Transport("Failed to join network", e);
        }
    }

    /**
     * Stops every session and peer sync, unannounces, and stops the server. Safe when never joined.
     */
    public synchronized void leaveNetwork() {
        if (state == NetworkState.DISCONNECTED && swarm == null) {
            return;
        }
        teardown();
        log.info("Left network for log {}", substrate.key().shortForm());
    }

    /**
     * Follows the log {@code remote}: finds peers serving it and applies its entries to the local
     * substrate as they become available. Repeated calls for the same key are no-ops while the
     * sync is running; after it failed, a call starts a new one from the persisted cursor.
     *
     * @throws IllegalStateException if not joined
     * @throws GraphException.Transport if no peer serving the log is found within the sync timeout
     */
    public synchronized void syncWithPeer(LogKey remote) {
        Objects.requireNonNull(remote, "remote");
        if (state != NetworkState.JOINED) {
            throw new IllegalStateException("syncWithPeer requires a joined network, state is " + state);
        }
        if (remote.equals(substrate.key())) {
            throw new IllegalArgumentException("Cannot sync with the primary log");
        }
        PeerSync existing = syncs.get(remote);
        if (existing != null) {
            if (!existing.failed()) {
                return;
            }
            dropFailed(existing);
        }

        SparseReplicatedLog sparse = new SparseReplicatedLog(remote, client, config.batchSize());
        String topic = remote.discoveryKey();
        followedByTopic.put(topic, sparse);
        swarm.join(topic, JoinMode.CLIENT_ONLY);
        boolean flushed;
        try {
            flushed = swarm.flush(config.syncTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(topic, sparse);
            throw new GraphException.Transport("Interrupted while looking up peers of " + remote.shortForm(), e);
        }
        if (!flushed || sparse.peers().isEmpty()) {
            abandon(topic, sparse);
            throw new GraphException.Transport("No peer serving log " + remote.shortForm() + " found within "
                    + config.syncTimeout());
        }

        PeerSync sync = new PeerSync(sparse, substrate, config.batchSize(), config.longPollTimeout(), failures::add,
                this::dropFailed);
        syncs.put(remote, sync);
        sync.start(executor);
        log.info("Syncing with log {} via {} peers", remote.shortForm(), sparse.peers().size());
    }

    public SwarmStatus status() {
        HttpSwarm current = swarm;
        if (current == null) {
            return SwarmStatus.disconnected(failures);
        }
        return new SwarmStatus(state, current.connections(), current.topics(), syncs.keySet(), failures);
    }

    @Override
    public void close() {
        leaveNetwork();
    }

    List<ReplicationSession> sessions() {
        return List.copyOf(sessions);
    }

    private void onConnection(PeerConnection connection) {
        ExecutorService running = executor;
        if (running == null) return;
        if (connection.topic().equals(primaryTopic)) {
            ReplicationSession session = new ReplicationSession(connection, substrate.log(), client,
                    config.batchSize(), config.longPollTimeout(), failures::add, sessions::remove);
            sessions.add(session);
            session.start(running);
            return;
        }
        SparseReplicatedLog followed = followedByTopic.get(connection.topic());
        if (followed != null && connection.direction() == PeerConnection.Direction.OUTBOUND) {
            followed.addPeer(connection.remoteAddress());
        }
    }

    /**
     * Forgets a failed sync so that {@link #syncWithPeer(LogKey)} can start over.
     */
    private synchronized void dropFailed(PeerSync sync) {
        LogKey remote = sync.remote().key();
        if (!syncs.remove(remote, sync)) {
            return;
        }
        String topic = remote.discoveryKey();
        followedByTopic.remove(topic, sync.remote());
        HttpSwarm current = swarm;
        if (current != null) {
            current.leave(topic);
        }
        sync.remote().close();
        log.info("Stopped following log {} after a failure", remote.shortForm());
    }

    private void abandon(String topic, SparseReplicatedLog sparse) {
        swarm.leave(topic);
        followedByTopic.remove(topic);
        sparse.close();
    }

    private void teardown() {
        for (PeerSync sync : syncs.values()) {
            sync.stop();
            sync.remote().close();
        }
        syncs.clear();
        followedByTopic.clear();
        for (ReplicationSession session : sessions) {
            session.stop();
        }
        sessions.clear();

        HttpSwarm current = swarm;
        swarm = null;
        if (current != null) {
            current.destroy();
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Replication threads did not stop within {}s", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        client = null;
        primaryTopic = null;
        state = NetworkState.DISCONNECTED;
    }
}
