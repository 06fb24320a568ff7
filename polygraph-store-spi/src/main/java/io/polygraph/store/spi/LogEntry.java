package io.polygraph.store.spi;

import java.util.List;
import java.util.Objects;

/**
 * One block of a replicated log: an atomic batch of mutations at position {@code seq}.
 *
 * @param timestamp epoch millis at which the writer appended the block
 */
public record LogEntry(long seq, long timestamp, List<Mutation> mutations) {
    public LogEntry {
        if (seq < 0) throw new IllegalArgumentException("seq must be >= 0");
        Objects.requireNonNull(mutations, "mutations");
        if (mutations.isEmpty()) throw new IllegalArgumentException("log entry must carry at least one mutation");
        mutations = List.copyOf(mutations);
    }
}
