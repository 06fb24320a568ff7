package io.polygraph.core;

/**
 * Discriminator of the {@link Attribute} variant.
 */
public enum AttributeKind {
    /** Value supplied by an author. */
    AUTHORED,
    /** Value computed from an expression over other attributes. */
    FUNCTION
}
