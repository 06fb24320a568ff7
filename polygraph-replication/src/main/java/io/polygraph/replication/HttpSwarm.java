package io.polygraph.replication;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link Swarm} over the HTTP log protocol.
 *
 * <p>Server-mode topics are announced with this peer's advertised address. Client-mode topics are
 * looked up on the executor and each address found becomes an outbound connection. Peers that
 * read a server-mode topic become inbound connections. Connections are reported once per
 * (topic, address, direction).
 */
public final class HttpSwarm implements Swarm {
    private static final Logger log = LoggerFactory.getLogger(HttpSwarm.class);

    private final DiscoveryService discovery;
    private final PeerServer server;
    private final ExecutorService executor;
    private final Map<String, JoinMode> topics = new ConcurrentHashMap<>();
    private final Map<String, PeerConnection> connections = new ConcurrentHashMap<>();
    private final List<Consumer<PeerConnection>> listeners = new CopyOnWriteArrayList<>();
    private final List<Future<?>> pending = new CopyOnWriteArrayList<>();
    private volatile URI selfAddress;
    private volatile boolean destroyed;

    public HttpSwarm(DiscoveryService discovery, LogReplicationHandler handler, ExecutorService executor) {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.server = new PeerServer(Objects.requireNonNull(handler, "handler"));
        this.executor = Objects.requireNonNull(executor, "executor");
        handler.addInboundListener(this::onInbound);
    }

    /**
     * Starts the peer server.
     *
     * @param advertised address announced to others; derived from host and bound port when null
     * @return the address this peer is reachable at
     */
    public URI listen(String host, int port, URI advertised) {
        ensureActive();
        int bound = server.start(host, port);
        selfAddress = advertised != null ? advertised : URI.create("http://" + host + ":" + bound);
        return selfAddress;
    }

    public URI selfAddress() {
        return selfAddress;
    }

    @Override
    public void join(String topic, JoinMode mode) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(mode, "mode");
        ensureActive();
        if (mode.server() && selfAddress == null) {
            throw new IllegalStateException("Swarm must listen before joining " + abbreviate(topic) + " as a server");
        }
        topics.merge(topic, mode, (a, b) -> new JoinMode(a.server() || b.server(), a.client() || b.client()));
        if (mode.server()) {
            discovery.announce(topic, selfAddress);
        }
        if (mode.client()) {
            pending.add(executor.submit(() -> lookup(topic)));
        }
        log.debug("Joined topic {} (server={}, client={})", abbreviate(topic), mode.server(), mode.client());
    }

    @Override
    public void leave(String topic) {
        JoinMode mode = topics.remove(topic);
        if (mode == null) return;
        if (mode.server() && selfAddress != null) {
            discovery.unannounce(topic, selfAddress);
        }
        connections.values().removeIf(c -> c.topic().equals(topic));
        log.debug("Left topic {}", abbreviate(topic));
    }

    @Override
    public boolean flush(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Future<?> f : new ArrayList<>(pending)) {
            long remaining = deadline - System.nanoTime();
            try {
                f.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                log.warn("Peer lookup failed", e.getCause());
            }
            pending.remove(f);
        }
        return true;
    }

    @Override
    public void onConnection(Consumer<PeerConnection> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public List<PeerConnection> connections() {
        return List.copyOf(connections.values());
    }

    @Override
    public Set<String> topics() {
        return Set.copyOf(topics.keySet());
    }

    @Override
    public void destroy() {
        if (destroyed) return;
        destroyed = true;
        for (String topic : List.copyOf(topics.keySet())) {
            leave(topic);
        }
        for (Future<?> f : pending) {
            f.cancel(true);
        }
        pending.clear();
        listeners.clear();
        server.close();
    }

    private void lookup(String topic) {
        for (URI address : discovery.lookup(topic)) {
            if (address.equals(selfAddress)) continue;
            connect(new PeerConnection(topic, address, null, PeerConnection.Direction.OUTBOUND));
        }
    }

    private void onInbound(String topic, String peerId, URI address) {
        JoinMode mode = topics.get(topic);
        if (mode == null || !mode.server()) return;
        connect(new PeerConnection(topic, address, peerId, PeerConnection.Direction.INBOUND));
    }

    private void connect(PeerConnection connection) {
        if (destroyed || !topics.containsKey(connection.topic())) return;
        String id = connection.topic() + "|" + connection.remoteAddress() + "|" + connection.direction();
        if (connections.putIfAbsent(id, connection) != null) return;
        log.info("{} connection on topic {} with {}", connection.direction() == PeerConnection.Direction.INBOUND
                ? "Inbound" : "Outbound", abbreviate(connection.topic()), connection.remoteAddress());
        for (Consumer<PeerConnection> listener : listeners) {
            try {
                listener.accept(connection);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed for {}", connection.remoteAddress(), e);
            }
        }
    }

    private void ensureActive() {
        if (destroyed) throw new IllegalStateException("Swarm has been destroyed");
    }

    static String abbreviate(String topic) {
        return topic.length() <= 8 ? topic : topic.substring(0, 8);
    }
}
