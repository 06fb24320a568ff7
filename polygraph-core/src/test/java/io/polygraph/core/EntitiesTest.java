package io.polygraph.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntitiesTest {

    @ParameterizedTest
    @ValueSource(strings = {"Water", "Carbon Dioxide", "  sodium   chloride ", "Ünïcode Name", "H2O"})
    void freshNodeHasOneActiveBasicMorph(String baseName) {
        PolyNode node = Entities.createNode(baseName);

        assertThat(node.morphs()).hasSize(1);
        Morph only = node.morphs().get(0);
        assertThat(only.name()).isEqualTo(PolyNode.BASIC_MORPH);
        assertThat(only.relationIds()).isEmpty();
        assertThat(only.attributeIds()).isEmpty();
        assertThat(node.nbh()).isEqualTo(only.morphId());
        assertThat(only.nodeId()).isEqualTo(node.id());
    }

    @Test
    void idIsDerivedFromBaseName() {
        assertThat(Entities.createNode("Carbon Dioxide").id()).isEqualTo("carbon_dioxide");
        assertThat(Entities.createNode("  sodium \t chloride ").id()).isEqualTo("sodium_chloride");
        assertThat(Entities.createNode("Water", NodeOptions.builder().id("h2o").build()).id()).isEqualTo("h2o");
    }

    @Test
    void adjectivePrefixesDisplayName() {
        PolyNode node = Entities.createNode("Water", NodeOptions.builder().adjective("liquid").build());

        assertThat(node.name()).isEqualTo("liquid Water");
        assertThat(node.baseName()).isEqualTo("Water");
        assertThat(node.role()).isEqualTo("individual");
    }

    @Test
    void blankBaseNameIsInvalid() {
        assertThatThrownBy(() -> Entities.createNode("")).isInstanceOf(GraphException.InvalidName.class);
        assertThatThrownBy(() -> Entities.createNode("   ")).isInstanceOf(GraphException.InvalidName.class);
        assertThatThrownBy(() -> Entities.createNode(null)).isInstanceOf(GraphException.InvalidName.class);
    }

    @Test
    void initialMorphsAndActiveMorphCanBeChosen() {
        PolyNode node = Entities.createNode("Water", NodeOptions.builder().morph("liquid").morph("solid").activeMorph("solid").build());

        assertThat(node.morphs()).extracting(Morph::morphId).containsExactly("water_morph_0", "water_morph_1");
        assertThat(node.activeMorph().name()).isEqualTo("solid");
        assertThat(node.nextMorphSeq()).isEqualTo(2);

        assertThatThrownBy(() -> Entities.createNode("Water", NodeOptions.builder().morph("liquid").activeMorph("gas").build()))
                .isInstanceOf(GraphException.MorphNotFound.class);
    }

    @Test
    void relationIdIsDeterministic() {
        Relation a = Entities.createRelation("hydrogen", "water", "part of", RelationOptions.none());
        Relation b = Entities.createRelation("hydrogen", "water", "part of", RelationOptions.adverb("partly"));

        assertThat(a.id()).startsWith("rel_hydrogen_part_of_water_").hasSize("rel_hydrogen_part_of_water_".length() + 8)
                .isEqualTo(b.id());
        assertThat(a.morphIds()).isEmpty();
        assertThat(Entities.createRelation("water", "hydrogen", "part of", RelationOptions.none()).id()).isNotEqualTo(a.id());
        assertThatThrownBy(() -> Entities.createRelation("a", "b", " ", RelationOptions.none()))
                .isInstanceOf(GraphException.InvalidName.class);
    }

    @Test
    void attributeIdIsContentAddressed() {
        Attribute h2o = Entities.createAttribute("water", "chemical formula", "H2O", AttributeOptions.none());
        Attribute again = Entities.createAttribute("water", "chemical formula", "H2O", AttributeOptions.unit("none"));
        Attribute other = Entities.createAttribute("water", "chemical formula", "D2O", AttributeOptions.none());

        assertThat(h2o.id()).startsWith("attr_water_chemical_formula_").hasSize("attr_water_chemical_formula_".length() + 8);
        assertThat(again.id()).isEqualTo(h2o.id());
        assertThat(other.id()).isNotEqualTo(h2o.id());
        assertThat(h2o.kind()).isEqualTo(AttributeKind.AUTHORED);
        assertThat(h2o.functionPayload()).isEmpty();
    }

    @Test
    void functionIsATaggedAttribute() {
        Attribute fn = Entities.createFunctionAttribute("water", "moles", "2", "mass / molar_mass", AttributeOptions.none());

        assertThat(fn.kind()).isEqualTo(AttributeKind.FUNCTION);
        assertThat(fn.function()).isEqualTo(new FunctionPayload("mass / molar_mass", true));
        assertThat(fn.id()).isEqualTo(Entities.createAttribute("water", "moles", "2", AttributeOptions.none()).id());
        assertThatThrownBy(() -> Entities.createFunctionAttribute("water", "moles", "2", " ", AttributeOptions.none()))
                .isInstanceOf(GraphException.InvalidExpression.class);
    }
}
