package io.polygraph.store.core;

import io.polygraph.core.Attribute;
import io.polygraph.core.AttributeOptions;
import io.polygraph.core.Entities;
import io.polygraph.core.EntityKind;
import io.polygraph.core.NodeOptions;
import io.polygraph.core.NodePatch;
import io.polygraph.core.PolyNode;
import io.polygraph.core.Relation;
import io.polygraph.core.RelationOptions;
import io.polygraph.json.jackson.JacksonGraphCodec;
import io.polygraph.store.core.kv.InMemoryKeyValueStore;
import io.polygraph.store.spi.ReconcileOptions;
import io.polygraph.store.spi.ReconcileReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcilerTest {

    private final JacksonGraphCodec codec = new JacksonGraphCodec();
    private InMemoryKeyValueStore kv;
    private KeyValueGraphStore store;

    @BeforeEach
    void setUp() {
        kv = new InMemoryKeyValueStore();
        store = KeyValueGraphStore.builder(kv).codec(codec).build();
        store.addNode("Water", NodeOptions.none());
        store.addNode("Hydrogen", NodeOptions.none());
    }

    @Test
    void consistentGraphIsClean() {
        store.addRelation("hydrogen", "water", "part of", RelationOptions.none());
        store.addAttribute("water", "formula", "H2O", AttributeOptions.none());

        ReconcileReport report = store.reconcile(ReconcileOptions.repair());

        assertThat(report.clean()).isTrue();
        assertThat(report.relinked()).isEmpty();
    }

    @Test
    void orphanLeftByInterruptedWriteIsRelinked() {
        // child persisted, parent morph never updated
        Attribute orphan = Entities.createAttribute("water", "formula", "H2O", AttributeOptions.none());
        kv.put(EntityKind.ATTRIBUTES.key(orphan.id()), codec.encode(orphan));

        ReconcileReport report = store.reconcile(ReconcileOptions.repair());

        assertThat(report.orphans()).containsExactly(orphan.id());
        assertThat(report.relinked()).containsExactly(orphan.id());
        PolyNode water = store.getNode("water").orElseThrow();
        assertThat(water.activeMorph().attributeIds()).containsExactly(orphan.id());
        assertThat(store.getAttribute(orphan.id()).orElseThrow().morphIds()).containsExactly(water.nbh());

        assertThat(store.reconcile(ReconcileOptions.repair()).clean()).isTrue();
    }

    @Test
    void reportOnlyLeavesDataAlone() {
        Relation orphan = Entities.createRelation("hydrogen", "water", "part of", RelationOptions.none());
        kv.put(EntityKind.RELATIONS.key(orphan.id()), codec.encode(orphan));

        ReconcileReport report = store.reconcile(ReconcileOptions.reportOnly());

        assertThat(report.orphans()).containsExactly(orphan.id());
        assertThat(report.relinked()).isEmpty();
        assertThat(store.getNode("hydrogen").orElseThrow().activeMorph().relationIds()).isEmpty();
    }

    @Test
    void deletedNodeLeavesDanglingChildrenUntilPruned() {
        Relation relation = store.addRelation("hydrogen", "water", "part of", RelationOptions.none());
        Attribute attribute = store.addAttribute("water", "formula", "H2O", AttributeOptions.none());
        store.deleteNode("water");

        ReconcileReport found = store.reconcile(ReconcileOptions.repair());
        assertThat(found.danglingChildren()).containsExactlyInAnyOrder(relation.id(), attribute.id());
        assertThat(found.pruned()).isEmpty();
        assertThat(store.getRelation(relation.id())).isPresent();

        ReconcileReport pruned = store.reconcile(ReconcileOptions.repairAndPrune());
        assertThat(pruned.pruned()).containsExactlyInAnyOrder(relation.id(), attribute.id());
        assertThat(store.getRelation(relation.id())).isEmpty();
        assertThat(store.getAttribute(attribute.id())).isEmpty();
        assertThat(store.getNode("hydrogen").orElseThrow().activeMorph().relationIds()).isEmpty();

        assertThat(store.reconcile(ReconcileOptions.repair()).clean()).isTrue();
    }

    @Test
    void referenceToMissingChildIsReportedAndPruned() {
        PolyNode water = store.getNode("water").orElseThrow();
        store.updateNode("water", NodePatch.builder()
                .morphs(water.withAttributeOnActiveMorph("attr_water_gone_00000000").morphs())
                .build());

        ReconcileReport report = store.reconcile(ReconcileOptions.reportOnly());
        assertThat(report.danglingReferences()).containsExactly("water/attr_water_gone_00000000");

        store.reconcile(ReconcileOptions.repairAndPrune());
        assertThat(store.getNode("water").orElseThrow().activeMorph().attributeIds()).isEmpty();
    }
}
