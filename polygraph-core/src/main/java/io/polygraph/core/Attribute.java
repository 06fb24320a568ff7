package io.polygraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named value attached to a node.
 *
 * <p>Authored attributes and computed functions share this one shape: {@code kind} selects the
 * variant and {@code function} is present exactly when {@code kind == FUNCTION}.
 */
public record Attribute(
        String id,
        String sourceId,
        String name,
        String value,
        String adverb,
        String unit,
        String modality,
        List<String> morphIds,
        boolean deleted,
        AttributeKind kind,
        FunctionPayload function
) implements GraphEntity {

    public Attribute {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        morphIds = morphIds == null ? List.of() : List.copyOf(morphIds);
        if (kind == null) {
            kind = function == null ? AttributeKind.AUTHORED : AttributeKind.FUNCTION;
        }
        if (kind == AttributeKind.FUNCTION && function == null) {
            throw new IllegalArgumentException("function attribute " + id + " requires an expression");
        }
        if (kind == AttributeKind.AUTHORED && function != null) {
            throw new IllegalArgumentException("authored attribute " + id + " must not carry an expression");
        }
    }

    public Optional<FunctionPayload> functionPayload() {
        return Optional.ofNullable(function);
    }

    public Attribute withMorph(String morphId) {
        if (morphIds.contains(morphId)) return this;
        List<String> out = new ArrayList<>(morphIds);
        out.add(morphId);
        return new Attribute(id, sourceId, name, value, adverb, unit, modality, out, deleted, kind, function);
    }
}
