package io.polygraph.replication;

/**
 * Lifecycle of a {@link ReplicationOrchestrator}.
 */
public enum NetworkState {
    DISCONNECTED,
    JOINING,
    JOINED
}
