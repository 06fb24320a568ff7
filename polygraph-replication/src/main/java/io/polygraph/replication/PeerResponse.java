package io.polygraph.replication;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Framework-neutral response produced by {@link LogReplicationHandler}.
 */
public final class PeerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final byte[] body; // may be null

    public PeerResponse(int status, byte[] body) {
        this.status = status;
        this.body = body;
    }

    public static PeerResponse empty(int status) {
        return new PeerResponse(status, null).header(LogProtocol.H_CACHE_CONTROL, "no-store");
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public byte[] body() {
        return body;
    }

    public PeerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }
}
