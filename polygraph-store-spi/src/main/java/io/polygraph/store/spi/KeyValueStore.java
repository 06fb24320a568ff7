package io.polygraph.store.spi;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, string-keyed byte store the graph is persisted in.
 *
 * <p>Keys sort by their UTF-8 bytes, which for the ASCII keys used by the graph store equals
 * {@link String#compareTo} order.
 */
public interface KeyValueStore extends Closeable {

    Optional<byte[]> get(String key);

    void put(String key, byte[] value);

    /**
     * @return true if the key existed
     */
    boolean delete(String key);

    /**
     * Ascending scan of {@code [startInclusive, endExclusive)}.
     */
    List<KvEntry> scan(String startInclusive, String endExclusive);

    /**
     * Applies all mutations or none of them.
     */
    void apply(List<Mutation> mutations);
}
