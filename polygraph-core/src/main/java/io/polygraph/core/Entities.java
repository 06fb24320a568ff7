package io.polygraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pure constructors for graph entities. No I/O and no existence checks.
 */
public final class Entities {
    private Entities() {}

    public static PolyNode createNode(String baseName, NodeOptions options) {
        Objects.requireNonNull(options, "options");
        String derived = Ids.nodeId(baseName);
        String id = options.id() == null || options.id().isBlank() ? derived : options.id();
        String name = options.adjective() == null ? baseName : options.adjective() + " " + baseName;
        String role = options.role() == null ? PolyNode.DEFAULT_ROLE : options.role();

        List<String> names = options.morphNames().isEmpty() ? List.of(PolyNode.BASIC_MORPH) : options.morphNames();
        List<Morph> morphs = new ArrayList<>(names.size());
        String nbh = null;
        for (String morphName : names) {
            if (morphName == null || morphName.isBlank()) {
                throw new GraphException.InvalidName("morph name must not be empty");
            }
            Morph morph = Morph.empty(id, morphName, morphs.size());
            morphs.add(morph);
            if (morphName.equals(options.activeMorph())) {
                nbh = morph.morphId();
            }
        }
        if (options.activeMorph() != null && nbh == null) {
            throw new GraphException.MorphNotFound(id, options.activeMorph());
        }
        return new PolyNode(id, baseName, name, options.adjective(), options.quantifier(), role,
                options.description(), options.parentTypes(), morphs, nbh, morphs.size(), false);
    }

    public static PolyNode createNode(String baseName) {
        return createNode(baseName, NodeOptions.none());
    }

    public static Relation createRelation(String sourceId, String targetId, String name, RelationOptions options) {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(options, "options");
        requireLabel(name, "relation name");
        String id = options.id() != null ? options.id() : Ids.relationId(sourceId, name, targetId);
        return new Relation(id, sourceId, targetId, name, options.adverb(), options.modality(), List.of(), false);
    }

    public static Attribute createAttribute(String sourceId, String name, String value, AttributeOptions options) {
        return attribute(sourceId, name, value, options, null);
    }

    public static Attribute createFunctionAttribute(String sourceId, String name, String value, String expression,
                                                    AttributeOptions options) {
        if (expression == null || expression.isBlank()) {
            throw new GraphException.InvalidExpression("expression must not be empty");
        }
        return attribute(sourceId, name, value, options, FunctionPayload.derivedFrom(expression));
    }

    private static Attribute attribute(String sourceId, String name, String value, AttributeOptions options,
                                       FunctionPayload function) {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(options, "options");
        requireLabel(name, "attribute name");
        String id = options.id() != null ? options.id() : Ids.attributeId(sourceId, name, value);
        AttributeKind kind = function == null ? AttributeKind.AUTHORED : AttributeKind.FUNCTION;
        return new Attribute(id, sourceId, name, value, options.adverb(), options.unit(), options.modality(),
                List.of(), false, kind, function);
    }

    private static void requireLabel(String label, String what) {
        if (label == null || label.isBlank()) {
            throw new GraphException.InvalidName(what + " must not be empty");
        }
    }
}
