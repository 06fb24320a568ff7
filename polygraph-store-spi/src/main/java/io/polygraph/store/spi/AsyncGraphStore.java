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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous counterpart to {@link GraphStore}.
 *
 * <p>Every operation mirrors its blocking twin; failures complete the future exceptionally with
 * the same {@link io.polygraph.core.GraphException} the blocking call would throw.
 *
 * @see BlockingToAsyncGraphStore
 */
public interface AsyncGraphStore {

    CompletableFuture<PolyNode> addNode(String baseName, NodeOptions options);

    CompletableFuture<Optional<PolyNode>> getNode(String id);

    CompletableFuture<PolyNode> updateNode(String id, NodePatch patch);

    CompletableFuture<Boolean> deleteNode(String id);

    CompletableFuture<Relation> addRelation(String sourceId, String targetId, String name, RelationOptions options);

    CompletableFuture<Optional<Relation>> getRelation(String id);

    CompletableFuture<Attribute> addAttribute(String sourceId, String name, String value, AttributeOptions options);

    CompletableFuture<Optional<Attribute>> getAttribute(String id);

    CompletableFuture<Attribute> applyFunction(String sourceId, String name, String expression, AttributeOptions options);

    CompletableFuture<Morph> addMorph(String nodeId, String morphName);

    CompletableFuture<PolyNode> setActiveMorph(String nodeId, String morph);

    CompletableFuture<List<? extends GraphEntity>> listAll(EntityKind kind);

    CompletableFuture<ReconcileReport> reconcile(ReconcileOptions options);
}
