package io.polygraph.replication;

import java.net.URI;
import java.util.Objects;

/**
 * A peer reached on a topic, either because we looked it up or because it read from us.
 *
 * @param remotePeerId the peer's id; null for outbound connections, which only know the address
 */
public record PeerConnection(String topic, URI remoteAddress, String remotePeerId, Direction direction) {

    public enum Direction {
        INBOUND,
        OUTBOUND
    }

    public PeerConnection {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(direction, "direction");
    }
}
