package io.polygraph.json.jackson;

import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.GraphCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonGraphCodec}.
 */
public final class JacksonGraphCodecProvider implements GraphCodecProvider {
    @Override
    public GraphCodec codec() {
        return new JacksonGraphCodec();
    }
}
