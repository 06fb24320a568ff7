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
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a blocking {@link GraphStore} on an {@link Executor} behind the {@link AsyncGraphStore}
 * interface.
 *
 * <p>Example usage:
 * <pre>{@code
 * GraphStore blocking = GraphStores.inMemory();
 * AsyncGraphStore async = new BlockingToAsyncGraphStore(blocking, Executors.newFixedThreadPool(4));
 *
 * async.addNode("Water", NodeOptions.none())
 *      .thenCompose(water -> async.addAttribute(water.id(), "chemical formula", "H2O", AttributeOptions.none()));
 * }</pre>
 *
 * <p>Operations still occupy an executor thread while the delegate blocks. The adapter does not
 * own the delegate; closing it is the caller's job.
 */
public final class BlockingToAsyncGraphStore implements AsyncGraphStore {

    private final GraphStore delegate;
    private final Executor executor;

    public BlockingToAsyncGraphStore(GraphStore delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<PolyNode> addNode(String baseName, NodeOptions options) {
        return submit(() -> delegate.addNode(baseName, options));
    }

    @Override
    public CompletableFuture<Optional<PolyNode>> getNode(String id) {
        return submit(() -> delegate.getNode(id));
    }

    @Override
    public CompletableFuture<PolyNode> updateNode(String id, NodePatch patch) {
        return submit(() -> delegate.updateNode(id, patch));
    }

    @Override
    public CompletableFuture<Boolean> deleteNode(String id) {
        return submit(() -> delegate.deleteNode(id));
    }

    @Override
    public CompletableFuture<Relation> addRelation(String sourceId, String targetId, String name, RelationOptions options) {
        return submit(() -> delegate.addRelation(sourceId, targetId, name, options));
    }

    @Override
    public CompletableFuture<Optional<Relation>> getRelation(String id) {
        return submit(() -> delegate.getRelation(id));
    }

    @Override
    public CompletableFuture<Attribute> addAttribute(String sourceId, String name, String value, AttributeOptions options) {
        return submit(() -> delegate.addAttribute(sourceId, name, value, options));
    }

    @Override
    public CompletableFuture<Optional<Attribute>> getAttribute(String id) {
        return submit(() -> delegate.getAttribute(id));
    }

    @Override
    public CompletableFuture<Attribute> applyFunction(String sourceId, String name, String expression, AttributeOptions options) {
        return submit(() -> delegate.applyFunction(sourceId, name, expression, options));
    }

    @Override
    public CompletableFuture<Morph> addMorph(String nodeId, String morphName) {
        return submit(() -> delegate.addMorph(nodeId, morphName));
    }

    @Override
    public CompletableFuture<PolyNode> setActiveMorph(String nodeId, String morph) {
        return submit(() -> delegate.setActiveMorph(nodeId, morph));
    }

    @Override
    public CompletableFuture<List<? extends GraphEntity>> listAll(EntityKind kind) {
        return submit(() -> delegate.listAll(kind));
    }

    @Override
    public CompletableFuture<ReconcileReport> reconcile(ReconcileOptions options) {
        return submit(() -> delegate.reconcile(options));
    }

    public GraphStore delegate() {
        return delegate;
    }

    public Executor executor() {
        return executor;
    }

    private <T> CompletableFuture<T> submit(Callable<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    private static RuntimeException wrapException(Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new AsyncStorageException(e);
    }

    /**
     * Wraps checked exceptions thrown by the blocking store.
     */
    public static final class AsyncStorageException extends RuntimeException {
        public AsyncStorageException(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
