package io.polygraph.store.spi;

import io.polygraph.core.GraphEntity;

import java.util.List;

/**
 * Serializes entities for the key-value substrate and log entries for disk and the wire.
 *
 * <p>Implementations are discovered through {@link GraphCodecProvider} or passed explicitly.
 */
public interface GraphCodec {

    /**
     * Media type of the encoded form, e.g. {@code application/json}.
     */
    String contentType();

    byte[] encode(GraphEntity entity) throws GraphCodecException;

    <T extends GraphEntity> T decode(byte[] data, Class<T> type) throws GraphCodecException;

    byte[] encodeEntry(LogEntry entry) throws GraphCodecException;

    LogEntry decodeEntry(byte[] data) throws GraphCodecException;

    byte[] encodeEntries(List<LogEntry> entries) throws GraphCodecException;

    List<LogEntry> decodeEntries(byte[] data) throws GraphCodecException;
}
