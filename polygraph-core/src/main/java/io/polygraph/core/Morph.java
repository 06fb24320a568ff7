package io.polygraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A contextual version of a node, holding its own relation and attribute references.
 *
 * <p>Reference lists are duplicate-free and keep insertion order.
 */
public record Morph(
        String morphId,
        String nodeId,
        String name,
        List<String> relationIds,
        List<String> attributeIds
) {
    public Morph {
        Objects.requireNonNull(morphId, "morphId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(name, "name");
        relationIds = relationIds == null ? List.of() : List.copyOf(relationIds);
        attributeIds = attributeIds == null ? List.of() : List.copyOf(attributeIds);
    }

    public static Morph empty(String nodeId, String name, long seq) {
        return new Morph(Ids.morphId(nodeId, seq), nodeId, name, List.of(), List.of());
    }

    public boolean hasRelation(String relationId) {
        return relationIds.contains(relationId);
    }

    public boolean hasAttribute(String attributeId) {
        return attributeIds.contains(attributeId);
    }

    public Morph withRelation(String relationId) {
        if (hasRelation(relationId)) return this;
        return new Morph(morphId, nodeId, name, appended(relationIds, relationId), attributeIds);
    }

    public Morph withAttribute(String attributeId) {
        if (hasAttribute(attributeId)) return this;
        return new Morph(morphId, nodeId, name, relationIds, appended(attributeIds, attributeId));
    }

    public Morph withoutReferences(List<String> ids) {
        List<String> rels = new ArrayList<>(relationIds);
        List<String> attrs = new ArrayList<>(attributeIds);
        rels.removeAll(ids);
        attrs.removeAll(ids);
        return new Morph(morphId, nodeId, name, rels, attrs);
    }

    private static List<String> appended(List<String> ids, String id) {
        List<String> out = new ArrayList<>(ids.size() + 1);
        out.addAll(ids);
        out.add(id);
        return out;
    }
}
