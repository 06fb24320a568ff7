package io.polygraph.store.spi;

import io.polygraph.core.Attribute;
import io.polygraph.core.AttributeOptions;
import io.polygraph.core.EntityKind;
import io.polygraph.core.GraphEntity;
import io.polygraph.core.Morph;
import io.polygraph.core.NodeOptions;
import io.polygraph.core.NodePatch;
import io.polygraph.core.PolyNode;
import io.polygraph.core.Relation;
import io.polygraph.core.RelationOptions;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * CRUD over graph entities with morph-consistency enforcement.
 *
 * <p>This SPI is blocking. {@link AsyncGraphStore} is the asynchronous counterpart; use
 * {@link BlockingToAsyncGraphStore} to run an implementation of this interface on an executor.
 *
 * <p>New relations and attributes always attach to the source node's active morph. Switch it
 * with {@link #setActiveMorph(String, String)} before authoring into another morph.
 */
public interface GraphStore extends Closeable {

    /**
     * Creates and persists a node. Re-adding the same base name overwrites the stored node.
     *
     * @throws io.polygraph.core.GraphException.InvalidName if the base name is empty
     */
    PolyNode addNode(String baseName, NodeOptions options);

    /**
     * @return the node, or empty if absent or soft-deleted
     */
    Optional<PolyNode> getNode(String id);

    /**
     * Shallow-merges the patch into the stored node.
     *
     * @throws io.polygraph.core.GraphException.NotFound if the node is absent
     * @throws io.polygraph.core.GraphException.MorphNotFound if the result has no active morph
     */
    PolyNode updateNode(String id, NodePatch patch);

    /**
     * Removes the node. Relations and attributes referencing it are left in place.
     *
     * @return true if the node existed
     */
    boolean deleteNode(String id);

    /**
     * Persists a relation and references it from the source node's active morph, atomically.
     *
     * @throws io.polygraph.core.GraphException.MissingEndpoint if either node is absent
     */
    Relation addRelation(String sourceId, String targetId, String name, RelationOptions options);

    Optional<Relation> getRelation(String id);

    /**
     * Persists an attribute and references it from the source node's active morph, atomically.
     *
     * @throws io.polygraph.core.GraphException.MissingSource if the source node is absent
     */
    Attribute addAttribute(String sourceId, String name, String value, AttributeOptions options);

    Optional<Attribute> getAttribute(String id);

    /**
     * Evaluates {@code expression} over the source node's numeric attributes and stores the
     * result as a derived attribute.
     *
     * @throws io.polygraph.core.GraphException.MissingSource if the source node is absent
     * @throws io.polygraph.core.GraphException.InvalidExpression if evaluation fails
     */
    Attribute applyFunction(String sourceId, String name, String expression, AttributeOptions options);

    /**
     * Adds a morph unless the node already has one with that name.
     *
     * @return the new or existing morph
     */
    Morph addMorph(String nodeId, String morphName);

    /**
     * Switches the node's active morph.
     *
     * @param morph morph id or name
     */
    PolyNode setActiveMorph(String nodeId, String morph);

    /**
     * All live entities of a kind, in key order.
     */
    List<? extends GraphEntity> listAll(EntityKind kind);

    List<PolyNode> listNodes();

    List<Relation> listRelations();

    List<Attribute> listAttributes();

    /**
     * Repairs orphaned references and reports dangling ones.
     */
    ReconcileReport reconcile(ReconcileOptions options);
}
