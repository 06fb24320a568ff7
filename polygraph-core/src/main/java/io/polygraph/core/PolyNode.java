package io.polygraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node that exists in one or more morphs, exactly one of which is active.
 *
 * <p>{@code nbh} names the active morph and always resolves to an element of {@code morphs}.
 * {@code nextMorphSeq} is the counter the next morph id is derived from; it only grows.
 */
public record PolyNode(
        String id,
        String baseName,
        String name,
        String adjective,
        String quantifier,
        String role,
        String description,
        List<String> parentTypes,
        List<Morph> morphs,
        String nbh,
        long nextMorphSeq,
        boolean deleted
) implements GraphEntity {

    public static final String DEFAULT_ROLE = "individual";
    public static final String BASIC_MORPH = "basic";

    public PolyNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(baseName, "baseName");
        parentTypes = parentTypes == null ? List.of() : List.copyOf(parentTypes);
        morphs = morphs == null ? List.of() : List.copyOf(morphs);
        if (morphs.isEmpty()) {
            throw new IllegalArgumentException("node " + id + " must have at least one morph");
        }
        if (nbh == null) {
            nbh = morphs.get(0).morphId();
        }
        String active = nbh;
        if (morphs.stream().noneMatch(m -> m.morphId().equals(active))) {
            throw new GraphException.MorphNotFound(id, nbh);
        }
        if (nextMorphSeq < morphs.size()) {
            nextMorphSeq = morphs.size();
        }
    }

    public Morph activeMorph() {
        for (Morph m : morphs) {
            if (m.morphId().equals(nbh)) return m;
        }
        throw new GraphException.MorphNotFound(id, nbh);
    }

    /**
     * Resolves a morph by id first, then by display name.
     */
    public Optional<Morph> morph(String idOrName) {
        for (Morph m : morphs) {
            if (m.morphId().equals(idOrName)) return Optional.of(m);
        }
        for (Morph m : morphs) {
            if (m.name().equals(idOrName)) return Optional.of(m);
        }
        return Optional.empty();
    }

    public PolyNode withMorphAdded(String morphName) {
        if (morph(morphName).isPresent()) return this;
        List<Morph> out = new ArrayList<>(morphs);
        out.add(Morph.empty(id, morphName, nextMorphSeq));
        return new PolyNode(id, baseName, name, adjective, quantifier, role, description,
                parentTypes, out, nbh, nextMorphSeq + 1, deleted);
    }

    public PolyNode withActiveMorph(String morphId) {
        return new PolyNode(id, baseName, name, adjective, quantifier, role, description,
                parentTypes, morphs, morphId, nextMorphSeq, deleted);
    }

    public PolyNode withMorphs(List<Morph> newMorphs) {
        return new PolyNode(id, baseName, name, adjective, quantifier, role, description,
                parentTypes, newMorphs, nbh, nextMorphSeq, deleted);
    }

    /**
     * Renumbers the morphs to ids starting at {@code firstSeq}, keeping order, names, references
     * and the active pointer. A no-op unless {@code firstSeq} is past the current counter's start.
     */
    public PolyNode withMorphSeqFrom(long firstSeq) {
        if (firstSeq <= 0) return this;
        List<Morph> out = new ArrayList<>(morphs.size());
        String active = nbh;
        long seq = firstSeq;
        for (Morph m : morphs) {
            String renumbered = Ids.morphId(id, seq++);
            out.add(new Morph(renumbered, id, m.name(), m.relationIds(), m.attributeIds()));
            if (m.morphId().equals(nbh)) active = renumbered;
        }
        return new PolyNode(id, baseName, name, adjective, quantifier, role, description,
                parentTypes, out, active, seq, deleted);
    }

    public PolyNode withRelationOnActiveMorph(String relationId) {
        return replaceActive(activeMorph().withRelation(relationId));
    }

    public PolyNode withAttributeOnActiveMorph(String attributeId) {
        return replaceActive(activeMorph().withAttribute(attributeId));
    }

    /**
     * Returns true if any morph of this node references the given relation or attribute id.
     */
    public boolean references(String childId) {
        for (Morph m : morphs) {
            if (m.hasRelation(childId) || m.hasAttribute(childId)) return true;
        }
        return false;
    }

    private PolyNode replaceActive(Morph updated) {
        if (updated.equals(activeMorph())) return this;
        List<Morph> out = new ArrayList<>(morphs.size());
        for (Morph m : morphs) {
            out.add(m.morphId().equals(nbh) ? updated : m);
        }
        return withMorphs(out);
    }
}
