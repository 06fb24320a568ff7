package io.polygraph.store.core;

import io.polygraph.store.core.kv.InMemoryKeyValueStore;
import io.polygraph.store.core.kv.LmdbKeyValueStore;
import io.polygraph.store.core.kv.ReplicatedKeyValueStore;
import io.polygraph.store.core.kv.RocksDbKeyValueStore;
import io.polygraph.store.core.log.FileReplicatedLog;
import io.polygraph.store.core.log.InMemoryReplicatedLog;
import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.GraphCodecs;
import io.polygraph.store.spi.KeyValueStore;
import io.polygraph.store.spi.LogKey;
import io.polygraph.store.spi.ReplicatedLog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Factories for log-backed graph stores.
 *
 * <p>A directory-backed store keeps its log under {@code <dir>/log} and its index under
 * {@code <dir>/index}. The substrate of every store returned here is a
 * {@link ReplicatedKeyValueStore}, ready to be handed to the replication layer.
 */
public final class GraphStores {

    public enum IndexBackend {
        ROCKSDB,
        LMDB
    }

    private GraphStores() {}

    /**
     * A writable store that lives only in memory.
     */
    public static KeyValueGraphStore inMemory() {
        return inMemory(GraphCodecs.load());
    }

    public static KeyValueGraphStore inMemory(GraphCodec codec) {
        return over(new ReplicatedKeyValueStore(InMemoryReplicatedLog.create(), new InMemoryKeyValueStore()), codec);
    }

    /**
     * An in-memory read-only replica of the log {@code key}, filled by replication.
     */
    public static KeyValueGraphStore inMemoryReplica(LogKey key) {
        return over(new ReplicatedKeyValueStore(InMemoryReplicatedLog.replicaOf(key), new InMemoryKeyValueStore()),
                GraphCodecs.load());
    }

    /**
     * Opens or creates the store in {@code dir} with a RocksDB index.
     */
    public static KeyValueGraphStore open(Path dir) {
        return open(dir, IndexBackend.ROCKSDB, GraphCodecs.load());
    }

    public static KeyValueGraphStore open(Path dir, IndexBackend backend, GraphCodec codec) {
        Objects.requireNonNull(dir, "dir");
        return assemble(FileReplicatedLog.open(dir.resolve("log"), codec), dir, backend, codec);
    }

    /**
     * Opens or creates a read-only replica of {@code key} in {@code dir}.
     */
    public static KeyValueGraphStore openReplica(Path dir, LogKey key) {
        return openReplica(dir, key, IndexBackend.ROCKSDB, GraphCodecs.load());
    }

    public static KeyValueGraphStore openReplica(Path dir, LogKey key, IndexBackend backend, GraphCodec codec) {
        Objects.requireNonNull(dir, "dir");
        return assemble(FileReplicatedLog.openReplica(dir.resolve("log"), key, codec), dir, backend, codec);
    }

    /**
     * The log-backed substrate of a store built by this class.
     *
     * @throws IllegalArgumentException if the store was assembled over another substrate
     */
    public static ReplicatedKeyValueStore substrateOf(KeyValueGraphStore store) {
        if (store.substrate() instanceof ReplicatedKeyValueStore replicated) {
            return replicated;
        }
        throw new IllegalArgumentException("Store is not backed by a replicated log");
    }

    private static KeyValueGraphStore assemble(ReplicatedLog log, Path dir, IndexBackend backend, GraphCodec codec) {
        KeyValueStore index;
        try {
            index = backend == IndexBackend.LMDB
                    ? new LmdbKeyValueStore(dir.resolve("index"))
                    : new RocksDbKeyValueStore(dir.resolve("index"));
        } catch (RuntimeException e) {
            closeAfterFailure(log, e);
            throw e;
        }
        return over(new ReplicatedKeyValueStore(log, index), codec);
    }

    private static KeyValueGraphStore over(ReplicatedKeyValueStore substrate, GraphCodec codec) {
        return KeyValueGraphStore.builder(substrate).codec(codec).build();
    }

    private static void closeAfterFailure(ReplicatedLog log, RuntimeException failure) {
        try {
            log.close();
        } catch (IOException e) {
            failure.addSuppressed(new UncheckedIOException(e));
        }
    }
}
