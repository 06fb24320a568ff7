package io.polygraph.core;

/**
 * An independently addressable graph entity stored under {@code <kind>/<id>}.
 */
public sealed interface GraphEntity permits PolyNode, Relation, Attribute {

    String id();

    boolean deleted();
}
