package io.polygraph.core;

import java.util.Objects;

/**
 * Key namespaces of the graph store.
 *
 * <p>Keys are {@code <prefix>/<id>}; a lexicographic scan over {@code [prefix/, prefix0)} lists
 * every entity of a kind, since {@code '0'} sorts directly after {@code '/'}.
 */
public enum EntityKind {
    NODES("nodes", PolyNode.class),
    RELATIONS("relations", Relation.class),
    ATTRIBUTES("attributes", Attribute.class);

    private final String prefix;
    private final Class<? extends GraphEntity> type;

    EntityKind(String prefix, Class<? extends GraphEntity> type) {
        this.prefix = prefix;
        this.type = type;
    }

    public String prefix() {
        return prefix;
    }

    public Class<? extends GraphEntity> type() {
        return type;
    }

    public String key(String id) {
        Objects.requireNonNull(id, "id");
        return prefix + "/" + id;
    }

    public String scanStart() {
        return prefix + "/";
    }

    public String scanEnd() {
        return prefix + "0";
    }

    public static EntityKind of(GraphEntity entity) {
        if (entity instanceof PolyNode) return NODES;
        if (entity instanceof Relation) return RELATIONS;
        return ATTRIBUTES;
    }

    public static EntityKind fromPrefix(String prefix) {
        for (EntityKind kind : values()) {
            if (kind.prefix.equals(prefix)) return kind;
        }
        throw new IllegalArgumentException("unknown entity kind: " + prefix);
    }
}
