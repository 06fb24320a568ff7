package io.polygraph.replication;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Topic-based peer discovery and connection tracking.
 */
public interface Swarm extends AutoCloseable {

    /**
     * Joins {@code topic}. Client-mode lookups run in the background until {@link #flush(Duration)}.
     */
    void join(String topic, JoinMode mode);

    void leave(String topic);

    /**
     * Waits for pending lookups to finish.
     *
     * @return false if the timeout elapsed first
     */
    boolean flush(Duration timeout) throws InterruptedException;

    void onConnection(Consumer<PeerConnection> listener);

    List<PeerConnection> connections();

    Set<String> topics();

    /**
     * Leaves every topic and releases network resources. Idempotent.
     */
    void destroy();

    @Override
    default void close() {
        destroy();
    }
}
