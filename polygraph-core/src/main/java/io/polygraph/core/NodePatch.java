package io.polygraph.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shallow field overwrite for a stored node.
 *
 * <p>Only fields that were explicitly set are applied; setting a field to {@code null} clears it.
 * The node id is not patchable.
 */
public final class NodePatch {

    public enum Field {
        BASE_NAME, NAME, ADJECTIVE, QUANTIFIER, ROLE, DESCRIPTION, PARENT_TYPES, MORPHS, NBH, DELETED
    }

    private final Map<Field, Object> values;

    private NodePatch(Map<Field, Object> values) {
        this.values = values;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<Field> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public PolyNode applyTo(PolyNode node) {
        String baseName = pick(Field.BASE_NAME, node.baseName());
        if (baseName == null || baseName.isBlank()) {
            throw new GraphException.InvalidName("base name must not be empty");
        }
        return new PolyNode(
                node.id(),
                baseName,
                pick(Field.NAME, node.name()),
                pick(Field.ADJECTIVE, node.adjective()),
                pick(Field.QUANTIFIER, node.quantifier()),
                pick(Field.ROLE, node.role()),
                pick(Field.DESCRIPTION, node.description()),
                (List<String>) pick(Field.PARENT_TYPES, node.parentTypes()),
                (List<Morph>) pick(Field.MORPHS, node.morphs()),
                pick(Field.NBH, node.nbh()),
                node.nextMorphSeq(),
                Boolean.TRUE.equals(pick(Field.DELETED, node.deleted())));
    }

    @SuppressWarnings("unchecked")
    private <T> T pick(Field field, T current) {
        return values.containsKey(field) ? (T) values.get(field) : current;
    }

    public static final class Builder {
        private final Map<Field, Object> values = new EnumMap<>(Field.class);

        private Builder() {}

        public Builder baseName(String baseName) {
            values.put(Field.BASE_NAME, baseName);
            return this;
        }

        public Builder name(String name) {
            values.put(Field.NAME, name);
            return this;
        }

        public Builder adjective(String adjective) {
            values.put(Field.ADJECTIVE, adjective);
            return this;
        }

        public Builder quantifier(String quantifier) {
            values.put(Field.QUANTIFIER, quantifier);
            return this;
        }

        public Builder role(String role) {
            values.put(Field.ROLE, role);
            return this;
        }

        public Builder description(String description) {
            values.put(Field.DESCRIPTION, description);
            return this;
        }

        public Builder parentTypes(List<String> parentTypes) {
            values.put(Field.PARENT_TYPES, parentTypes == null ? List.of() : List.copyOf(parentTypes));
            return this;
        }

        public Builder morphs(List<Morph> morphs) {
            values.put(Field.MORPHS, morphs == null ? List.of() : List.copyOf(morphs));
            return this;
        }

        public Builder nbh(String nbh) {
            values.put(Field.NBH, nbh);
            return this;
        }

        public Builder deleted(boolean deleted) {
            values.put(Field.DELETED, deleted);
            return this;
        }

        public NodePatch build() {
            return new NodePatch(new EnumMap<>(values));
        }
    }
}
