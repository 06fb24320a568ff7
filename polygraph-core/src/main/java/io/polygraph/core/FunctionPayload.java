package io.polygraph.core;

import java.util.Objects;

/**
 * Extra fields carried by a {@link AttributeKind#FUNCTION} attribute.
 */
public record FunctionPayload(String expression, boolean derived) {

    public FunctionPayload {
        Objects.requireNonNull(expression, "expression");
    }

    public static FunctionPayload derivedFrom(String expression) {
        return new FunctionPayload(expression, true);
    }
}
