package io.polygraph.store.core.kv;

import io.polygraph.store.spi.KeyValueStore;
import io.polygraph.store.spi.KvEntry;
import io.polygraph.store.spi.Mutation;
import org.rocksdb.CompressionType;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RocksDB-backed {@link KeyValueStore}. Batches are applied as one {@link WriteBatch}.
 */
public final class RocksDbKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDbKeyValueStore.class);

    private static final long DEFAULT_WRITE_BUFFER_SIZE = 64L * 1024 * 1024;
    private static final int DEFAULT_MAX_WRITE_BUFFERS = 3;

    private final RocksDB db;
    private final Options options;
    private final WriteOptions writeOptions;
    private final Path baseDir;

    public RocksDbKeyValueStore(Path baseDir) {
        this(baseDir, DEFAULT_WRITE_BUFFER_SIZE, DEFAULT_MAX_WRITE_BUFFERS);
    }

    public RocksDbKeyValueStore(Path baseDir, long writeBufferSize, int maxWriteBuffers) {
        Objects.requireNonNull(baseDir, "baseDir");
        if (writeBufferSize <= 0) {
            throw new IllegalArgumentException("writeBufferSize must be positive");
        }
        if (maxWriteBuffers <= 0) {
            throw new IllegalArgumentException("maxWriteBuffers must be positive");
        }
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create RocksDB directory", e);
        }
        try {
            RocksDB.loadLibrary();
        } catch (UnsatisfiedLinkError e) {
            throw new IllegalStateException("RocksDB native library failed to load", e);
        }
        this.baseDir = baseDir;
        this.options = new Options()
                .setCreateIfMissing(true)
                .setWriteBufferSize(writeBufferSize)
                .setMaxWriteBufferNumber(maxWriteBuffers)
                .setCompressionType(CompressionType.LZ4_COMPRESSION);
        this.writeOptions = new WriteOptions();
        try {
            this.db = RocksDB.open(options, baseDir.toString());
        } catch (RocksDBException e) {
            writeOptions.close();
            options.close();
            throw new IllegalStateException("Failed to open RocksDB at " + baseDir, e);
        }
        log.info("Opened RocksDB index at {}", baseDir);
    }

    @Override
    public Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key");
        try {
            return Optional.ofNullable(db.get(encodeKey(key)));
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to read " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        try {
            db.put(writeOptions, encodeKey(key), value);
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to write " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        byte[] k = encodeKey(key);
        try {
            byte[] existing = db.get(k);
            if (existing == null) {
                return false;
            }
            db.delete(writeOptions, k);
            return true;
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to delete " + key, e);
        }
    }

    @Override
    public List<KvEntry> scan(String startInclusive, String endExclusive) {
        Objects.requireNonNull(startInclusive, "startInclusive");
        Objects.requireNonNull(endExclusive, "endExclusive");
        List<KvEntry> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seek(encodeKey(startInclusive)); it.isValid(); it.next()) {
                String key = new String(it.key(), StandardCharsets.UTF_8);
                if (key.compareTo(endExclusive) >= 0) break;
                out.add(new KvEntry(key, it.value()));
            }
            it.status();
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to scan [" + startInclusive + ", " + endExclusive + ")", e);
        }
        return out;
    }

    @Override
    public void apply(List<Mutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        try (WriteBatch batch = new WriteBatch()) {
            for (Mutation m : mutations) {
                if (m.op() == Mutation.Op.PUT) {
                    batch.put(encodeKey(m.key()), m.value());
                } else {
                    batch.delete(encodeKey(m.key()));
                }
            }
            db.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to apply batch of " + mutations.size(), e);
        }
    }

    @Override
    public void close() {
        db.close();
        writeOptions.close();
        options.close();
        log.info("Closed RocksDB index at {}", baseDir);
    }

    private static byte[] encodeKey(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }
}
