package io.polygraph.replication;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.polygraph.core.GraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exposes a {@link LogReplicationHandler} over HTTP with Javalin.
 */
public final class PeerServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PeerServer.class);

    private final LogReplicationHandler handler;
    private Javalin app;

    public PeerServer(LogReplicationHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Binds and starts serving. A port of 0 picks an ephemeral port.
     *
     * @return the bound port
     * @throws GraphException.Transport if the server cannot bind
     */
    public synchronized int start(String host, int port) {
        if (app != null) {
            return app.port();
        }
        Javalin created = Javalin.create();
        created.head(LogProtocol.LOGS_PATH + "{topic}", this::handle);
        created.get(LogProtocol.LOGS_PATH + "{topic}", this::handle);
        try {
            created.start(host, port);
        } catch (RuntimeException e) {
            created.stop();
            throw new GraphException.Transport("Failed to bind peer server on " + host + ":" + port, e);
        }
        app = created;
        log.info("Peer server listening on {}:{}", host, app.port());
        return app.port();
    }

    public synchronized int port() {
        if (app == null) throw new IllegalStateException("Peer server is not running");
        return app.port();
    }

    public synchronized boolean running() {
        return app != null;
    }

    private void handle(Context ctx) {
        PeerRequest request = new PeerRequest(ctx.method().name(), URI.create(ctx.fullUrl()), toHeaders(ctx));
        PeerResponse response = handler.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }
        if (response.body() != null) {
            ctx.result(response.body());
        }
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    @Override
    public synchronized void close() {
        if (app == null) return;
        handler.close();
        app.stop();
        log.info("Peer server stopped");
        app = null;
    }
}
