package io.polygraph.replication;

import io.polygraph.core.GraphException;
import io.polygraph.store.spi.GraphCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Discovery over a fixed list of peer addresses.
 *
 * <p>Announcing is implicit: a running peer server answers for every topic it serves.
 * {@link #lookup(String)} probes each configured address with a {@code HEAD} request and keeps
 * those that serve the topic. Unreachable addresses are skipped.
 */
public final class BootstrapDiscoveryService implements DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(BootstrapDiscoveryService.class);

    private final List<URI> peers;
    private final PeerClient probe;

    public BootstrapDiscoveryService(List<URI> peers, PeerClient probe) {
        this.peers = List.copyOf(Objects.requireNonNull(peers, "peers"));
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    public BootstrapDiscoveryService(List<URI> peers, GraphCodec codec) {
        this(peers, new PeerClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                codec, "probe-" + UUID.randomUUID(), null));
    }

    public List<URI> peers() {
        return peers;
    }

    @Override
    public void announce(String topic, URI address) {
        // served topics answer HEAD probes directly
    }

    @Override
    public void unannounce(String topic, URI address) {
        // nothing registered
    }

    @Override
    public List<URI> lookup(String topic) {
        List<URI> found = new ArrayList<>();
        for (URI peer : peers) {
            try {
                if (probe.length(peer, topic).isPresent()) {
                    found.add(peer);
                }
            } catch (GraphException.Transport e) {
                log.debug("Bootstrap peer {} unreachable: {}", peer, e.getMessage());
            }
        }
        return found;
    }
}
