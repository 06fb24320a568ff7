package io.polygraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named, directed edge between two nodes, addressable on its own.
 *
 * <p>The id is derived from {@code (sourceId, name, targetId)}, so re-creating the same triple
 * resolves to the same entity.
 */
public record Relation(
        String id,
        String sourceId,
        String targetId,
        String name,
        String adverb,
        String modality,
        List<String> morphIds,
        boolean deleted
) implements GraphEntity {

    public Relation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(name, "name");
        morphIds = morphIds == null ? List.of() : List.copyOf(morphIds);
    }

    public Relation withMorph(String morphId) {
        if (morphIds.contains(morphId)) return this;
        List<String> out = new ArrayList<>(morphIds);
        out.add(morphId);
        return new Relation(id, sourceId, targetId, name, adverb, modality, out, deleted);
    }
}
