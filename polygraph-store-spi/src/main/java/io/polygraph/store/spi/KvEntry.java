package io.polygraph.store.spi;

import java.util.Objects;

public record KvEntry(String key, byte[] value) {
    public KvEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
