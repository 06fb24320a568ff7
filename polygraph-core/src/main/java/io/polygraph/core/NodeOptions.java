package io.polygraph.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional fields for node creation. Use {@link #builder()} or {@link #none()}.
 *
 * @param id explicit id; derived from the base name when null
 * @param morphNames initial morph names; a single {@code "basic"} morph when empty
 * @param activeMorph name of the initially active morph; the first morph when null
 */
public record NodeOptions(
        String id,
        String adjective,
        String quantifier,
        String role,
        String description,
        List<String> parentTypes,
        List<String> morphNames,
        String activeMorph
) {
    private static final NodeOptions NONE = builder().build();

    public NodeOptions {
        parentTypes = parentTypes == null ? List.of() : List.copyOf(parentTypes);
        morphNames = morphNames == null ? List.of() : List.copyOf(morphNames);
    }

    public static NodeOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String adjective;
        private String quantifier;
        private String role;
        private String description;
        private final List<String> parentTypes = new ArrayList<>();
        private final List<String> morphNames = new ArrayList<>();
        private String activeMorph;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder adjective(String adjective) {
            this.adjective = adjective;
            return this;
        }

        public Builder quantifier(String quantifier) {
            this.quantifier = quantifier;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parentType(String parentType) {
            this.parentTypes.add(parentType);
            return this;
        }

        public Builder morph(String morphName) {
            this.morphNames.add(morphName);
            return this;
        }

        public Builder activeMorph(String morphName) {
            this.activeMorph = morphName;
            return this;
        }

        public NodeOptions build() {
            return new NodeOptions(id, adjective, quantifier, role, description, parentTypes, morphNames, activeMorph);
        }
    }
}
