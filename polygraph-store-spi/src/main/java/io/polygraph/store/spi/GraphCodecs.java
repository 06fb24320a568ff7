package io.polygraph.store.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the installed {@link GraphCodec} through {@link ServiceLoader}.
 *
 * <p>For GraalVM native-image, pass a codec instance explicitly instead.
 */
public final class GraphCodecs {
    private GraphCodecs() {}

    public static GraphCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static GraphCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<GraphCodecProvider> it = ServiceLoader.load(GraphCodecProvider.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No GraphCodecProvider installed; add polygraph-json-jackson to the classpath");
        }
        return it.next().codec();
    }
}
