package io.polygraph.store.core.log;

import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.GraphCodecException;
import io.polygraph.store.spi.LogEntry;
import io.polygraph.store.spi.LogKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Log persisted as newline-delimited encoded entries under a directory.
 *
 * <p>Layout:
 * <pre>
 *   log.key        line 1: key hex, line 2: "writable" or "replica"
 *   entries.jsonl  one encoded entry per line, in seq order
 * </pre>
 *
 * <p>Each append is forced to disk before it becomes visible. On open, a trailing line without
 * its newline (an interrupted append) is truncated away.
 */
public final class FileReplicatedLog extends AbstractReplicatedLog {
    private static final Logger log = LoggerFactory.getLogger(FileReplicatedLog.class);

    static final String KEY_FILE = "log.key";
    static final String ENTRIES_FILE = "entries.jsonl";
    private static final String WRITABLE = "writable";
    private static final String REPLICA = "replica";
    private static final byte NEWLINE = '\n';

    private final Path dir;
    private final GraphCodec codec;
    private final FileChannel channel;

    private FileReplicatedLog(Path dir, LogKey key, boolean writable, GraphCodec codec, Clock clock) throws IOException {
        super(key, writable, clock);
        this.dir = dir;
        this.codec = codec;
        this.channel = FileChannel.open(dir.resolve(ENTRIES_FILE), StandardOpenOption.CREATE, StandardOpenOption.READ,
                StandardOpenOption.WRITE);
        try {
            load();
        } catch (RuntimeException | IOException e) {
            channel.close();
            throw e;
        }
    }

    /**
     * Opens the log in {@code dir}, creating a new writable log with a random key if none exists.
     */
    public static FileReplicatedLog open(Path dir, GraphCodec codec) {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(codec, "codec");
        try {
            Files.createDirectories(dir);
            Path keyFile = dir.resolve(KEY_FILE);
            if (Files.exists(keyFile)) {
                List<String> header = Files.readAllLines(keyFile, StandardCharsets.UTF_8);
                return new FileReplicatedLog(dir, parseKey(header, keyFile), parseWritable(header, keyFile), codec, Clock.systemUTC());
            }
            LogKey key = LogKey.random();
            writeHeader(keyFile, key, true);
            log.info("Created writable log {} at {}", key.shortForm(), dir);
            return new FileReplicatedLog(dir, key, true, codec, Clock.systemUTC());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open log at " + dir, e);
        }
    }

    /**
     * Opens or creates a replica of {@code key} in {@code dir}.
     *
     * @throws IllegalStateException if {@code dir} already holds a different log
     */
    public static FileReplicatedLog openReplica(Path dir, LogKey key, GraphCodec codec) {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(codec, "codec");
        try {
            Files.createDirectories(dir);
            Path keyFile = dir.resolve(KEY_FILE);
            if (Files.exists(keyFile)) {
                List<String> header = Files.readAllLines(keyFile, StandardCharsets.UTF_8);
                LogKey existing = parseKey(header, keyFile);
                if (!existing.equals(key)) {
                    throw new IllegalStateException(dir + " holds log " + existing.shortForm() + ", not " + key.shortForm());
                }
                return new FileReplicatedLog(dir, key, parseWritable(header, keyFile), codec, Clock.systemUTC());
            }
            writeHeader(keyFile, key, false);
            log.info("Created replica of log {} at {}", key.shortForm(), dir);
            return new FileReplicatedLog(dir, key, false, codec, Clock.systemUTC());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open replica at " + dir, e);
        }
    }

    public Path directory() {
        return dir;
    }

    @Override
    protected void persist(LogEntry entry) throws IOException {
        byte[] encoded = codec.encodeEntry(entry);
        byte[] line = Arrays.copyOf(encoded, encoded.length + 1);
        line[encoded.length] = NEWLINE;
        ByteBuffer buffer = ByteBuffer.wrap(line);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        channel.force(false);
    }

    @Override
    public void close() throws IOException {
        super.close();
        channel.close();
    }

    private void load() throws IOException {
        long size = channel.size();
        if (size > Integer.MAX_VALUE) {
            throw new IllegalStateException("Log file too large: " + dir.resolve(ENTRIES_FILE));
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) size);
        channel.position(0);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) break;
        }
        byte[] data = buffer.array();

        int lineStart = 0;
        int restored = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] != NEWLINE) continue;
            if (i > lineStart) {
                byte[] line = Arrays.copyOfRange(data, lineStart, i);
                try {
                    restore(codec.decodeEntry(line));
                } catch (GraphCodecException e) {
                    throw new IllegalStateException("Corrupt entry at byte " + lineStart + " of " + dir.resolve(ENTRIES_FILE), e);
                }
                restored++;
            }
            lineStart = i + 1;
        }
        if (lineStart < data.length) {
            log.warn("Truncating {} bytes of an interrupted append in {}", data.length - lineStart, dir);
            channel.truncate(lineStart);
            channel.force(true);
        }
        channel.position(lineStart);
        log.debug("Loaded {} entries of log {} from {}", restored, key().shortForm(), dir);
    }

    private static void writeHeader(Path keyFile, LogKey key, boolean writable) throws IOException {
        Files.write(keyFile, List.of(key.hex(), writable ? WRITABLE : REPLICA), StandardCharsets.UTF_8);
    }

    private static LogKey parseKey(List<String> header, Path keyFile) {
        if (header.isEmpty()) {
            throw new IllegalStateException("Empty log header " + keyFile);
        }
        return LogKey.parse(header.get(0));
    }

    private static boolean parseWritable(List<String> header, Path keyFile) {
        if (header.size() < 2) {
            throw new IllegalStateException("Log header " + keyFile + " lacks a mode line");
        }
        String mode = header.get(1).trim();
        if (WRITABLE.equals(mode)) return true;
        if (REPLICA.equals(mode)) return false;
        throw new IllegalStateException("Unknown log mode '" + mode + "' in " + keyFile);
    }
}
