package io.polygraph.replication;

import io.polygraph.store.spi.LogKey;

import java.util.List;
import java.util.Set;

/**
 * Snapshot of an orchestrator's network participation.
 *
 * @param syncedPeers remote logs followed through {@link ReplicationOrchestrator#syncWithPeer(LogKey)}
 * @param failures sessions and peer syncs that stopped on an error, most recent last
 */
public record SwarmStatus(
        NetworkState state,
        List<PeerConnection> connections,
        Set<String> topics,
        Set<LogKey> syncedPeers,
        List<String> failures
) {
    public SwarmStatus {
        connections = List.copyOf(connections);
        topics = Set.copyOf(topics);
        syncedPeers = Set.copyOf(syncedPeers);
        failures = List.copyOf(failures);
    }

    public static SwarmStatus disconnected(List<String> failures) {
        return new SwarmStatus(NetworkState.DISCONNECTED, List.of(), Set.of(), Set.of(), failures);
    }
}
