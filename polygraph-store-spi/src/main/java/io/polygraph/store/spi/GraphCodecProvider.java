package io.polygraph.store.spi;

/**
 * ServiceLoader entry point for codec modules.
 */
public interface GraphCodecProvider {
    GraphCodec codec();
}
