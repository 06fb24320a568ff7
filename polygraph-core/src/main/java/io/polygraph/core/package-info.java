/**
 * Identity and versioning model of the graph.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.polygraph.core.PolyNode}, {@link io.polygraph.core.Morph},
 *   {@link io.polygraph.core.Relation} and {@link io.polygraph.core.Attribute} (immutable records)</li>
 *   <li>{@link io.polygraph.core.Entities} (pure constructors) and {@link io.polygraph.core.Ids}
 *   (deterministic id derivation)</li>
 *   <li>{@link io.polygraph.core.GraphException} (error taxonomy)</li>
 * </ul>
 *
 * <p>This module has no I/O and no third-party dependencies.
 */
package io.polygraph.core;
