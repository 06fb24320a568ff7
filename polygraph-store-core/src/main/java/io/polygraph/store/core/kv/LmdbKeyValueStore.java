package io.polygraph.store.core.kv;

import io.polygraph.store.spi.KeyValueStore;
import io.polygraph.store.spi.KvEntry;
import io.polygraph.store.spi.Mutation;
import org.lmdbjava.CursorIterable;
import org.lmdbjava.Dbi;
import org.lmdbjava.DbiFlags;
import org.lmdbjava.Env;
import org.lmdbjava.KeyRange;
import org.lmdbjava.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LMDB-backed {@link KeyValueStore}. A batch is one write transaction.
 *
 * <p>lmdbjava reaches into {@code java.nio} internals; on JDK 17 the JVM needs
 * {@code --add-opens java.base/java.nio=ALL-UNNAMED --add-opens java.base/sun.nio.ch=ALL-UNNAMED}.
 */
public final class LmdbKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(LmdbKeyValueStore.class);

    private static final int MAX_KEY_SIZE = 511;
    private static final int MAX_DBS = 1;
    private static final long DEFAULT_MAP_SIZE = 256L * 1024 * 1024;

    private static final ThreadLocal<ByteBuffer> KEY_BUFFER =
            ThreadLocal.withInitial(() -> ByteBuffer.allocateDirect(MAX_KEY_SIZE));

    private final Env<ByteBuffer> env;
    private final Dbi<ByteBuffer> entries;

    public LmdbKeyValueStore(Path baseDir) {
        this(baseDir, DEFAULT_MAP_SIZE);
    }

    public LmdbKeyValueStore(Path baseDir, long mapSize) {
        Objects.requireNonNull(baseDir, "baseDir");
        if (mapSize <= 0) {
            throw new IllegalArgumentException("mapSize must be positive");
        }
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create LMDB directory", e);
        }
        this.env = Env.create()
                .setMapSize(mapSize)
                .setMaxDbs(MAX_DBS)
                .open(baseDir.toFile());
        this.entries = env.openDbi("graph", DbiFlags.MDB_CREATE);
        log.info("Opened LMDB index at {}", baseDir);
    }

    @Override
    public Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key");
        try (Txn<ByteBuffer> txn = env.txnRead()) {
            ByteBuffer value = entries.get(txn, encodeKey(key));
            return value == null ? Optional.empty() : Optional.of(toBytes(value));
        }
    }

    @Override
    public void put(String key, byte[] value) {
        apply(List.of(Mutation.put(key, value)));
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        boolean removed;
        try (Txn<ByteBuffer> txn = env.txnWrite()) {
            removed = entries.delete(txn, encodeKey(key));
            txn.commit();
        }
        if (removed) {
            env.sync(true);
        }
        return removed;
    }

    @Override
    public List<KvEntry> scan(String startInclusive, String endExclusive) {
        Objects.requireNonNull(startInclusive, "startInclusive");
        Objects.requireNonNull(endExclusive, "endExclusive");
        if (startInclusive.compareTo(endExclusive) >= 0) return List.of();
        List<KvEntry> out = new ArrayList<>();
        // LMDB rejects zero-length keys, including as a seek target
        KeyRange<ByteBuffer> range = startInclusive.isEmpty()
                ? KeyRange.lessThan(directKey(endExclusive))
                : KeyRange.closedOpen(directKey(startInclusive), directKey(endExclusive));
        try (Txn<ByteBuffer> txn = env.txnRead();
             CursorIterable<ByteBuffer> cursor = entries.iterate(txn, range)) {
            for (CursorIterable.KeyVal<ByteBuffer> kv : cursor) {
                out.add(new KvEntry(StandardCharsets.UTF_8.decode(kv.key()).toString(), toBytes(kv.val())));
            }
        }
        return out;
    }

    @Override
    public void apply(List<Mutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        try (Txn<ByteBuffer> txn = env.txnWrite()) {
            for (Mutation m : mutations) {
                if (m.op() == Mutation.Op.PUT) {
                    ByteBuffer value = ByteBuffer.allocateDirect(Math.max(1, m.value().length));
                    value.put(m.value()).flip();
                    entries.put(txn, encodeKey(m.key()), value);
                } else {
                    entries.delete(txn, encodeKey(m.key()));
                }
            }
            txn.commit();
        }
        env.sync(true);
    }

    @Override
    public void close() {
        entries.close();
        env.close();
        log.info("Closed LMDB index");
    }

    private static ByteBuffer encodeKey(String key) {
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_KEY_SIZE) {
            throw new IllegalArgumentException("Key is too long for LMDB: " + key);
        }
        ByteBuffer buffer = KEY_BUFFER.get();
        buffer.clear();
        buffer.put(bytes);
        buffer.flip();
        return buffer;
    }

    private static ByteBuffer directKey(String key) {
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buffer = ByteBuffer.allocateDirect(bytes.length);
        buffer.put(bytes).flip();
        return buffer;
    }

    private static byte[] toBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }
}
