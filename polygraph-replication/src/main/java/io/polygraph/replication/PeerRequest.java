package io.polygraph.replication;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral request as seen by {@link LogReplicationHandler}.
 */
public record PeerRequest(String method, URI uri, Map<String, List<String>> headers) {
    public PeerRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : headers;
    }
}
