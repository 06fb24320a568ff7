package io.polygraph.store.core;

import io.polygraph.core.Attribute;
import io.polygraph.core.AttributeOptions;
import io.polygraph.core.Entities;
import io.polygraph.core.EntityKind;
import io.polygraph.core.GraphEntity;
import io.polygraph.core.GraphException;
import io.polygraph.core.Morph;
import io.polygraph.core.NodeOptions;
import io.polygraph.core.NodePatch;
import io.polygraph.core.PolyNode;
import io.polygraph.core.Relation;
import io.polygraph.core.RelationOptions;
import io.polygraph.store.core.function.FunctionEvaluator;
import io.polygraph.store.spi.GraphCodec;
import io.polygraph.store.spi.GraphCodecs;
import io.polygraph.store.spi.GraphStore;
import io.polygraph.store.spi.KeyValueStore;
import io.polygraph.store.spi.KvEntry;
import io.polygraph.store.spi.Mutation;
import io.polygraph.store.spi.ReconcileOptions;
import io.polygraph.store.spi.ReconcileReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link GraphStore} over an ordered {@link KeyValueStore}.
 *
 * <p>Entities live at {@code nodes/<id>}, {@code relations/<id>} and {@code attributes/<id>}.
 * Read-modify-writes of a node run under that node's lock, and a child entity is written in the
 * same batch as the morph that references it.
 *
 * <pre>{@code
 * GraphStore store = KeyValueGraphStore.builder(new InMemoryKeyValueStore())
 *     .codec(new JacksonGraphCodec())
 *     .build();
 * }</pre>
 */
public final class KeyValueGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(KeyValueGraphStore.class);
    static final String MORPH_COUNTER_PREFIX = "counters/morph/";

    private final KeyValueStore substrate;
    private final GraphCodec codec;
    private final KeyedLocks locks;
    private final FunctionEvaluator functions;

    public static Builder builder(KeyValueStore substrate) {
        return new Builder(substrate);
    }

    public KeyValueGraphStore(KeyValueStore substrate) {
        this(builder(substrate));
    }

    private KeyValueGraphStore(Builder builder) {
        this.substrate = Objects.requireNonNull(builder.substrate, "substrate");
        this.codec = builder.codec != null ? builder.codec : GraphCodecs.load();
        this.locks = new KeyedLocks(builder.lockStripes > 0 ? builder.lockStripes : KeyedLocks.DEFAULT_STRIPES);
        this.functions = new FunctionEvaluator();
    }

    public KeyValueStore substrate() {
        return substrate;
    }

    public GraphCodec codec() {
        return codec;
    }

    /**
     * Stores a new node, replacing any node with the same id. A replacing node's morphs are
     * numbered after every morph id the id has used before, so stale references never resolve
     * to one of its morphs.
     */
    @Override
    public PolyNode addNode(String baseName, NodeOptions options) {
        PolyNode created = Entities.createNode(baseName, options == null ? NodeOptions.none() : options);
        PolyNode node = locks.withLock(created.id(), () -> {
            PolyNode stored = created.withMorphSeqFrom(usedMorphSeq(created.id()));
            List<Mutation> batch = new ArrayList<>(2);
            batch.add(Mutation.put(EntityKind.NODES.key(stored.id()), codec.encode(stored)));
            if (substrate.get(MORPH_COUNTER_PREFIX + stored.id()).isPresent()) {
                batch.add(Mutation.delete(MORPH_COUNTER_PREFIX + stored.id()));
            }
            substrate.apply(batch);
            return stored;
        });
        log.debug("Stored node {}", node.id());
        return node;
    }

    @Override
    public Optional<PolyNode> getNode(String id) {
        return read(EntityKind.NODES, id, PolyNode.class);
    }

    @Override
    public PolyNode updateNode(String id, NodePatch patch) {
        Objects.requireNonNull(patch, "patch");
        return locks.withLock(id, () -> {
            PolyNode current = getNode(id).orElseThrow(() -> new GraphException.NotFound(id));
            PolyNode updated = patch.applyTo(current);
            substrate.put(EntityKind.NODES.key(id), codec.encode(updated));
            log.debug("Updated node {} fields {}", id, patch.fields());
            return updated;
        });
    }

    @Override
    public boolean deleteNode(String id) {
        Objects.requireNonNull(id, "id");
        boolean removed = locks.withLock(id, () -> {
            Optional<byte[]> current = substrate.get(EntityKind.NODES.key(id));
            if (current.isEmpty()) {
                return false;
            }
            long counter = codec.decode(current.get(), PolyNode.class).nextMorphSeq();
            substrate.apply(List.of(
                    Mutation.delete(EntityKind.NODES.key(id)),
                    Mutation.put(MORPH_COUNTER_PREFIX + id, Long.toString(counter).getBytes(StandardCharsets.UTF_8))));
            return true;
        });
        if (removed) {
            log.debug("Deleted node {}", id);
        }
        return removed;
    }

    @Override
    public Relation addRelation(String sourceId, String targetId, String name, RelationOptions options) {
        Relation created = Entities.createRelation(sourceId, targetId, name, options == null ? RelationOptions.none() : options);
        return locks.withLock(sourceId, () -> {
            Optional<PolyNode> source = getNode(sourceId);
            Optional<PolyNode> target = sourceId.equals(targetId) ? source : getNode(targetId);
            if (source.isEmpty() || target.isEmpty()) {
                throw new GraphException.MissingEndpoint(sourceId, targetId);
            }
            PolyNode node = source.get();
            String morphId = node.nbh();
            Relation relation = carryMorphs(created, getRelation(created.id()).map(Relation::morphIds)).withMorph(morphId);
            PolyNode updated = node.withRelationOnActiveMorph(relation.id());
            substrate.apply(List.of(
                    Mutation.put(EntityKind.RELATIONS.key(relation.id()), codec.encode(relation)),
                    Mutation.put(EntityKind.NODES.key(node.id()), codec.encode(updated))));
            log.debug("Stored relation {} on morph {}", relation.id(), morphId);
            return relation;
        });
    }

    @Override
    public Optional<Relation> getRelation(String id) {
        return read(EntityKind.RELATIONS, id, Relation.class);
    }

    @Override
    public Attribute addAttribute(String sourceId, String name, String value, AttributeOptions options) {
        Attribute created = Entities.createAttribute(sourceId, name, value, options == null ? AttributeOptions.none() : options);
        return locks.withLock(sourceId, () -> attach(created));
    }

    @Override
    public Optional<Attribute> getAttribute(String id) {
        return read(EntityKind.ATTRIBUTES, id, Attribute.class);
    }

    @Override
    public Attribute applyFunction(String sourceId, String name, String expression, AttributeOptions options) {
        Objects.requireNonNull(sourceId, "sourceId");
        AttributeOptions opts = options == null ? AttributeOptions.none() : options;
        return locks.withLock(sourceId, () -> {
            PolyNode node = getNode(sourceId).orElseThrow(() -> new GraphException.MissingSource(sourceId));
            double result = functions.evaluate(expression, scopeOf(node));
            Attribute function = Entities.createFunctionAttribute(sourceId, name, FunctionEvaluator.format(result), expression, opts);
            return attach(function);
        });
    }

    @Override
    public Morph addMorph(String nodeId, String morphName) {
        if (morphName == null || morphName.isBlank()) {
            throw new GraphException.InvalidName("morph name must not be empty");
        }
        return locks.withLock(nodeId, () -> {
            PolyNode node = getNode(nodeId).orElseThrow(() -> new GraphException.NotFound(nodeId));
            Optional<Morph> existing = node.morphs().stream().filter(m -> m.name().equals(morphName)).findFirst();
            if (existing.isPresent()) {
                return existing.get();
            }
            PolyNode updated = node.withMorphAdded(morphName);
            substrate.put(EntityKind.NODES.key(nodeId), codec.encode(updated));
            Morph added = updated.morphs().get(updated.morphs().size() - 1);
            log.debug("Added morph {} to node {}", added.morphId(), nodeId);
            return added;
        });
    }

    @Override
    public PolyNode setActiveMorph(String nodeId, String morph) {
        Objects.requireNonNull(morph, "morph");
        return locks.withLock(nodeId, () -> {
            PolyNode node = getNode(nodeId).orElseThrow(() -> new GraphException.NotFound(nodeId));
            Morph target = node.morph(morph).orElseThrow(() -> new GraphException.MorphNotFound(nodeId, morph));
            if (target.morphId().equals(node.nbh())) {
                return node;
            }
            PolyNode updated = node.withActiveMorph(target.morphId());
            substrate.put(EntityKind.NODES.key(nodeId), codec.encode(updated));
            log.debug("Node {} now active in morph {}", nodeId, target.morphId());
            return updated;
        });
    }

    @Override
    public List<? extends GraphEntity> listAll(EntityKind kind) {
        Objects.requireNonNull(kind, "kind");
        return list(kind, kind.type());
    }

    @Override
    public List<PolyNode> listNodes() {
        return list(EntityKind.NODES, PolyNode.class);
    }

    @Override
    public List<Relation> listRelations() {
        return list(EntityKind.RELATIONS, Relation.class);
    }

    @Override
    public List<Attribute> listAttributes() {
        return list(EntityKind.ATTRIBUTES, Attribute.class);
    }

    @Override
    public ReconcileReport reconcile(ReconcileOptions options) {
        return new Reconciler(this).run(options == null ? ReconcileOptions.repair() : options);
    }

    @Override
    public void close() throws IOException {
        substrate.close();
    }

    KeyedLocks locks() {
        return locks;
    }

    byte[] encode(GraphEntity entity) {
        return codec.encode(entity);
    }

    private Attribute attach(Attribute created) {
        String sourceId = created.sourceId();
        PolyNode node = getNode(sourceId).orElseThrow(() -> new GraphException.MissingSource(sourceId));
        String morphId = node.nbh();
        Attribute attribute = carryMorphs(created, getAttribute(created.id()).map(Attribute::morphIds)).withMorph(morphId);
        PolyNode updated = node.withAttributeOnActiveMorph(attribute.id());
        substrate.apply(List.of(
                Mutation.put(EntityKind.ATTRIBUTES.key(attribute.id()), codec.encode(attribute)),
                Mutation.put(EntityKind.NODES.key(node.id()), codec.encode(updated))));
        log.debug("Stored attribute {} on morph {}", attribute.id(), morphId);
        return attribute;
    }

    /**
     * Name to value for every attribute of the node; those on the active morph win name clashes.
     */
    private Map<String, String> scopeOf(PolyNode node) {
        Map<String, String> scope = new LinkedHashMap<>();
        List<Attribute> own = new ArrayList<>();
        for (Attribute a : listAttributes()) {
            if (a.sourceId().equals(node.id())) own.add(a);
        }
        Morph active = node.activeMorph();
        for (Attribute a : own) {
            if (!active.hasAttribute(a.id())) scope.put(a.name(), a.value());
        }
        for (Attribute a : own) {
            if (active.hasAttribute(a.id())) scope.put(a.name(), a.value());
        }
        return scope;
    }

    private static Relation carryMorphs(Relation relation, Optional<List<String>> previous) {
        Relation out = relation;
        for (String morphId : previous.orElse(List.of())) {
            out = out.withMorph(morphId);
        }
        return out;
    }

    private static Attribute carryMorphs(Attribute attribute, Optional<List<String>> previous) {
        Attribute out = attribute;
        for (String morphId : previous.orElse(List.of())) {
            out = out.withMorph(morphId);
        }
        return out;
    }

    /**
     * First morph seq not yet used by {@code nodeId}: the stored node's counter, soft-deleted or
     * not, or the counter left behind by a delete.
     */
    private long usedMorphSeq(String nodeId) {
        Optional<byte[]> stored = substrate.get(EntityKind.NODES.key(nodeId));
        if (stored.isPresent()) {
            return codec.decode(stored.get(), PolyNode.class).nextMorphSeq();
        }
        return substrate.get(MORPH_COUNTER_PREFIX + nodeId)
                .map(bytes -> Long.parseLong(new String(bytes, StandardCharsets.UTF_8)))
                .orElse(0L);
    }

    private <T extends GraphEntity> Optional<T> read(EntityKind kind, String id, Class<T> type) {
        Objects.requireNonNull(id, "id");
        return substrate.get(kind.key(id))
                .map(bytes -> codec.decode(bytes, type))
                .filter(entity -> !entity.deleted());
    }

    private <T extends GraphEntity> List<T> list(EntityKind kind, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (KvEntry entry : substrate.scan(kind.scanStart(), kind.scanEnd())) {
            T entity = codec.decode(entry.value(), type);
            if (!entity.deleted()) out.add(entity);
        }
        return out;
    }

    public static final class Builder {
        private final KeyValueStore substrate;
        private GraphCodec codec;
        private int lockStripes;

        private Builder(KeyValueStore substrate) {
            this.substrate = Objects.requireNonNull(substrate, "substrate");
        }

        /** Sets the entity codec. Default: the codec found by {@link GraphCodecs#load()}. */
        public Builder codec(GraphCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Sets the number of per-node lock stripes. Default: 64. */
        public Builder lockStripes(int lockStripes) {
            this.lockStripes = lockStripes;
            return this;
        }

        public KeyValueGraphStore build() {
            return new KeyValueGraphStore(this);
        }
    }
}
