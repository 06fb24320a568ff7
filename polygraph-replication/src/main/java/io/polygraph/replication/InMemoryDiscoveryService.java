package io.polygraph.replication;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of announcements held in memory, for peers running in one process.
 *
 * <p>{@link #shared()} is the process-wide instance; separate instances give isolated networks.
 */
public final class InMemoryDiscoveryService implements DiscoveryService {
    private static final InMemoryDiscoveryService SHARED = new InMemoryDiscoveryService();

    private final Map<String, Set<URI>> announcements = new ConcurrentHashMap<>();

    public static InMemoryDiscoveryService shared() {
        return SHARED;
    }

    @Override
    public void announce(String topic, URI address) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(address, "address");
        announcements.compute(topic, (t, current) -> {
            Set<URI> next = current == null ? new LinkedHashSet<>() : new LinkedHashSet<>(current);
            next.add(address);
            return next;
        });
    }

    @Override
    public void unannounce(String topic, URI address) {
        announcements.computeIfPresent(topic, (t, current) -> {
            Set<URI> next = new LinkedHashSet<>(current);
            next.remove(address);
            return next.isEmpty() ? null : next;
        });
    }

    @Override
    public List<URI> lookup(String topic) {
        Set<URI> addresses = announcements.get(topic);
        return addresses == null ? List.of() : new ArrayList<>(addresses);
    }
}
