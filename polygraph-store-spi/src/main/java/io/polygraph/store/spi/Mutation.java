package io.polygraph.store.spi;

import java.util.Objects;

/**
 * A single write inside an atomic batch.
 *
 * @param value the new value for {@link Op#PUT}; null for {@link Op#DELETE}
 */
public record Mutation(Op op, String key, byte[] value) {

    public enum Op {
        PUT,
        DELETE
    }

    public Mutation {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(key, "key");
        if (op == Op.PUT && value == null) {
            throw new IllegalArgumentException("put of " + key + " requires a value");
        }
        if (op == Op.DELETE) {
            value = null;
        }
    }

    public static Mutation put(String key, byte[] value) {
        return new Mutation(Op.PUT, key, value);
    }

    public static Mutation delete(String key) {
        return new Mutation(Op.DELETE, key, null);
    }
}
