package io.polygraph.replication;

import java.net.URI;
import java.util.List;

/**
 * Maps discovery topics to the addresses of peers that serve them.
 */
public interface DiscoveryService {

    /**
     * Advertises that {@code address} serves {@code topic}.
     */
    void announce(String topic, URI address);

    void unannounce(String topic, URI address);

    /**
     * Addresses currently known to serve {@code topic}. May block on network probes.
     */
    List<URI> lookup(String topic);
}
