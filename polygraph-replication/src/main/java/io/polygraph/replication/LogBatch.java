package io.polygraph.replication;

import io.polygraph.store.spi.LogEntry;

import java.util.List;

/**
 * One response of a log read.
 *
 * @param nextOffset seq to read from next
 * @param length the serving peer's log length at response time
 */
public record LogBatch(List<LogEntry> entries, long nextOffset, boolean upToDate, long length) {
    public LogBatch {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
