package io.polygraph.store.core;

import io.polygraph.core.Attribute;
import io.polygraph.core.EntityKind;
import io.polygraph.core.GraphEntity;
import io.polygraph.core.Morph;
import io.polygraph.core.PolyNode;
import io.polygraph.core.Relation;
import io.polygraph.store.spi.Mutation;
import io.polygraph.store.spi.ReconcileOptions;
import io.polygraph.store.spi.ReconcileReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds and repairs broken links between nodes, their morphs, and the children they reference.
 *
 * <p>Each repair re-reads the node under its lock, so a pass may run while writers are active.
 * Children whose node is absent are only reported unless pruning is requested.
 */
final class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final KeyValueGraphStore store;

    private final List<String> orphans = new ArrayList<>();
    private final List<String> danglingChildren = new ArrayList<>();
    private final List<String> danglingReferences = new ArrayList<>();
    private final List<String> relinked = new ArrayList<>();
    private final List<String> pruned = new ArrayList<>();

    Reconciler(KeyValueGraphStore store) {
        this.store = store;
    }

    ReconcileReport run(ReconcileOptions options) {
        Set<String> nodeIds = new HashSet<>();
        for (PolyNode node : store.listNodes()) {
            nodeIds.add(node.id());
        }
        Set<String> childIds = new HashSet<>();

        for (Relation relation : store.listRelations()) {
            childIds.add(relation.id());
            boolean dangling = !nodeIds.contains(relation.sourceId()) || !nodeIds.contains(relation.targetId());
            inspect(relation, EntityKind.RELATIONS, relation.sourceId(), dangling, options);
        }
        for (Attribute attribute : store.listAttributes()) {
            childIds.add(attribute.id());
            inspect(attribute, EntityKind.ATTRIBUTES, attribute.sourceId(), !nodeIds.contains(attribute.sourceId()), options);
        }
        for (String nodeId : nodeIds) {
            checkReferences(nodeId, childIds, options);
        }

        ReconcileReport report = new ReconcileReport(orphans, danglingChildren, danglingReferences, relinked, pruned);
        if (report.clean()) {
            log.info("Reconciliation found no problems in {} nodes and {} children", nodeIds.size(), childIds.size());
        } else {
            log.warn("Reconciliation found {} orphans, {} dangling children, {} dangling references; relinked {}, pruned {}",
                    orphans.size(), danglingChildren.size(), danglingReferences.size(), relinked.size(), pruned.size());
        }
        return report;
    }

    private void inspect(GraphEntity child, EntityKind kind, String sourceId, boolean dangling, ReconcileOptions options) {
        if (dangling) {
            danglingChildren.add(child.id());
            if (options.pruneDangling()) {
                prune(child, kind, sourceId);
            }
            return;
        }
        store.locks().withLock(sourceId, () -> {
            Optional<PolyNode> source = store.getNode(sourceId);
            if (source.isEmpty() || source.get().references(child.id())) {
                return null;
            }
            orphans.add(child.id());
            if (options.relinkOrphans()) {
                relink(source.get(), child, kind);
            }
            return null;
        });
    }

    private void relink(PolyNode node, GraphEntity child, EntityKind kind) {
        String morphId = node.nbh();
        PolyNode updated;
        GraphEntity linked;
        if (child instanceof Relation relation) {
            updated = node.withRelationOnActiveMorph(relation.id());
            linked = relation.withMorph(morphId);
        } else {
            Attribute attribute = (Attribute) child;
            updated = node.withAttributeOnActiveMorph(attribute.id());
            linked = attribute.withMorph(morphId);
        }
        store.substrate().apply(List.of(
                Mutation.put(kind.key(child.id()), store.encode(linked)),
                Mutation.put(EntityKind.NODES.key(node.id()), store.encode(updated))));
        relinked.add(child.id());
        log.debug("Relinked {} to morph {}", child.id(), morphId);
    }

    private void prune(GraphEntity child, EntityKind kind, String sourceId) {
        store.locks().withLock(sourceId, () -> {
            List<Mutation> batch = new ArrayList<>();
            batch.add(Mutation.delete(kind.key(child.id())));
            store.getNode(sourceId).ifPresent(node -> {
                if (node.references(child.id())) {
                    batch.add(Mutation.put(EntityKind.NODES.key(node.id()), store.encode(stripReferences(node, List.of(child.id())))));
                }
            });
            store.substrate().apply(batch);
            return null;
        });
        pruned.add(child.id());
        log.debug("Pruned dangling {}", child.id());
    }

    private void checkReferences(String nodeId, Set<String> childIds, ReconcileOptions options) {
        store.locks().withLock(nodeId, () -> {
            Optional<PolyNode> current = store.getNode(nodeId);
            if (current.isEmpty()) return null;
            PolyNode node = current.get();
            List<String> missing = new ArrayList<>();
            for (Morph morph : node.morphs()) {
                for (String id : morph.relationIds()) {
                    if (!childIds.contains(id) && store.getRelation(id).isEmpty()) missing.add(id);
                }
                for (String id : morph.attributeIds()) {
                    if (!childIds.contains(id) && store.getAttribute(id).isEmpty()) missing.add(id);
                }
            }
            if (missing.isEmpty()) return null;
            for (String id : missing) {
                danglingReferences.add(nodeId + "/" + id);
            }
            if (options.pruneDangling()) {
                store.substrate().put(EntityKind.NODES.key(nodeId), store.encode(stripReferences(node, missing)));
                for (String id : missing) {
                    pruned.add(nodeId + "/" + id);
                }
            }
            return null;
        });
    }

    private static PolyNode stripReferences(PolyNode node, List<String> ids) {
        List<Morph> morphs = new ArrayList<>(node.morphs().size());
        for (Morph morph : node.morphs()) {
            morphs.add(morph.withoutReferences(ids));
        }
        return node.withMorphs(morphs);
    }
}
