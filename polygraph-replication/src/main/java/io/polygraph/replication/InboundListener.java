package io.polygraph.replication;

import java.net.URI;

/**
 * Notified when a peer that identified itself reads one of the served logs.
 */
@FunctionalInterface
public interface InboundListener {
    void onInbound(String topic, String peerId, URI peerAddress);
}
