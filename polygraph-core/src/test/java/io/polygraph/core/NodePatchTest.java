package io.polygraph.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodePatchTest {

    private final PolyNode water = Entities.createNode("Water",
            NodeOptions.builder().description("clear").parentType("substance").build());

    @Test
    void unsetFieldsAreKept() {
        PolyNode patched = NodePatch.builder().quantifier("some").build().applyTo(water);

        assertThat(patched.quantifier()).isEqualTo("some");
        assertThat(patched.description()).isEqualTo("clear");
        assertThat(patched.parentTypes()).containsExactly("substance");
        assertThat(patched.id()).isEqualTo(water.id());
    }

    @Test
    void explicitNullClearsField() {
        PolyNode patched = NodePatch.builder().description(null).build().applyTo(water);

        assertThat(patched.description()).isNull();
    }

    @Test
    void emptyPatchIsIdentity() {
        NodePatch patch = NodePatch.builder().build();

        assertThat(patch.isEmpty()).isTrue();
        assertThat(patch.applyTo(water)).isEqualTo(water);
    }

    @Test
    void baseNameCannotBeBlanked() {
        assertThatThrownBy(() -> NodePatch.builder().baseName(" ").build().applyTo(water))
                .isInstanceOf(GraphException.InvalidName.class);
    }

    @Test
    void replacingMorphsRequiresActivePointerToSurvive() {
        PolyNode withIce = water.withMorphAdded("ice");
        Morph ice = withIce.morph("ice").orElseThrow();

        assertThatThrownBy(() -> NodePatch.builder().morphs(List.of(ice)).build().applyTo(withIce))
                .isInstanceOf(GraphException.MorphNotFound.class);

        PolyNode onlyIce = NodePatch.builder().morphs(List.of(ice)).nbh(ice.morphId()).build().applyTo(withIce);
        assertThat(onlyIce.activeMorph()).isEqualTo(ice);
        assertThat(onlyIce.nextMorphSeq()).isEqualTo(withIce.nextMorphSeq());
    }
}
