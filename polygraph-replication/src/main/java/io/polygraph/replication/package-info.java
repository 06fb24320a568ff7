/**
 * Peer-to-peer replication of store logs over HTTP.
 *
 * <p>{@link io.polygraph.replication.ReplicationOrchestrator} is the entry point. The wire format is
 * described by {@link io.polygraph.replication.LogProtocol}; peers find each other through a
 * {@link io.polygraph.replication.DiscoveryService}.
 */
package io.polygraph.replication;
