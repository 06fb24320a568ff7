package io.polygraph.store.core.log;

import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.LogKey;

import java.time.Clock;

/**
 * Volatile log, for tests and throw-away stores.
 */
public final class InMemoryReplicatedLog extends AbstractReplicatedLog {

    private InMemoryReplicatedLog(LogKey key, boolean writable, Clock clock) {
        super(key, writable, clock);
    }

    /**
     * A new writable log under a fresh random key.
     */
    public static InMemoryReplicatedLog create() {
        return new InMemoryReplicatedLog(LogKey.random(), true, Clock.systemUTC());
    }

    public static InMemoryReplicatedLog create(Clock clock) {
        return new InMemoryReplicatedLog(LogKey.random(), true, clock);
    }

    /**
     * An empty replica of a log written elsewhere.
     */
    public static InMemoryReplicatedLog replicaOf(LogKey key) {
        return new InMemoryReplicatedLog(key, false, Clock.systemUTC());
    }

    @Override
    protected void persist(LogEntry entry) {
    }
}
