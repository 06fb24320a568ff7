package io.polygraph.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.polygraph.core.GraphEntity;
import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.GraphCodecException;
import io.polygraph.store.spi.LogEntry;

import java.util.List;
import java.util.Objects;

/**
 * Jackson implementation of {@link GraphCodec}.
 *
 * <p>Entities are written as snake_case JSON objects ({@code base_name}, {@code morph_ids},
 * {@code nbh}); mutation values inside log entries are base64 strings. Output is always a
 * single line, so encoded entries can be stored newline-delimited.
 */
public final class JacksonGraphCodec implements GraphCodec {
    public static final String CONTENT_TYPE = "application/json";

    private static final TypeReference<List<LogEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    /**
     * Creates a codec with the default mapper configuration.
     */
    public JacksonGraphCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a codec over a caller-configured mapper. The mapper must not indent output.
     */
    public JacksonGraphCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper(new JsonFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }

    @Override
    public byte[] encode(GraphEntity entity) throws GraphCodecException {
        Objects.requireNonNull(entity, "entity");
        try {
            return mapper.writeValueAsBytes(entity);
        } catch (Exception e) {
            throw new GraphCodecException("Failed to serialize " + entity.id(), e);
        }
    }

    @Override
    public <T extends GraphEntity> T decode(byte[] data, Class<T> type) throws GraphCodecException {
        Objects.requireNonNull(type, "type");
        if (data == null || data.length == 0) {
            throw new GraphCodecException("Cannot decode " + type.getSimpleName() + " from empty data");
        }
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new GraphCodecException("Failed to deserialize bytes to " + type.getSimpleName(), e);
        }
    }

    @Override
    public byte[] encodeEntry(LogEntry entry) throws GraphCodecException {
        try {
            return mapper.writeValueAsBytes(entry);
        } catch (Exception e) {
            throw new GraphCodecException("Failed to serialize log entry " + entry.seq(), e);
        }
    }

    @Override
    public LogEntry decodeEntry(byte[] data) throws GraphCodecException {
        try {
            return mapper.readValue(data, LogEntry.class);
        } catch (Exception e) {
            throw new GraphCodecException("Failed to deserialize log entry", e);
        }
    }

    @Override
    public byte[] encodeEntries(List<LogEntry> entries) throws GraphCodecException {
        try {
            return mapper.writeValueAsBytes(entries);
        } catch (Exception e) {
            throw new GraphCodecException("Failed to serialize " + entries.size() + " log entries", e);
        }
    }

    @Override
    public List<LogEntry> decodeEntries(byte[] data) throws GraphCodecException {
        if (data == null || data.length == 0) {
            return List.of();
        }
        try {
            return List.copyOf(mapper.readValue(data, ENTRY_LIST));
        } catch (Exception e) {
            throw new GraphCodecException("Failed to deserialize log entries", e);
        }
    }
}
