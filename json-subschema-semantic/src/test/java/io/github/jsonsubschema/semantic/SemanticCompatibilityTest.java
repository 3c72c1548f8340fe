package io.github.jsonsubschema.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SemanticCompatibilityTest extends SemanticTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SemanticCompatibility checker;

    @BeforeEach
    void hierarchy() {
        SemanticTypeResolver resolver = SemanticTypeResolver.uninitialized();
        resolver.addRelationship("ex:Manager", "ex:Employee");
        resolver.addRelationship("ex:Employee", ConceptRelation.SUBCLASS_OF, "foaf:Person");
        resolver.addRelationship("quantitykind:ThermodynamicTemperature", "quantitykind:Temperature");
        checker = new SemanticCompatibility(resolver);
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    @Test
    void nodeRuleCoversAllFourCases() {
        JsonNode plain = json("{\"type\":\"object\"}");
        JsonNode employee = json("{\"type\":\"object\",\"stype\":\"ex:Employee\"}");
        JsonNode person = json("{\"type\":\"object\",\"stype\":\"foaf:Person\"}");

        assertThat(checker.isCompatible(plain, plain)).isTrue();
        assertThat(checker.isCompatible(employee, plain)).isTrue();
        assertThat(checker.isCompatible(plain, employee)).isFalse();
        assertThat(checker.isCompatible(employee, person)).isTrue();
        assertThat(checker.isCompatible(person, employee)).isFalse();
    }

    @Test
    void unrelatedQuantitiesAreIncompatibleBothWays() {
        JsonNode temperature = json("{\"type\":\"number\",\"stype\":\"quantitykind:Temperature\"}");
        JsonNode pressure = json("{\"type\":\"number\",\"stype\":\"quantitykind:Pressure\"}");

        assertThat(checker.isCompatible(temperature, pressure)).isFalse();
        assertThat(checker.isCompatible(pressure, temperature)).isFalse();
        assertThat(checker.areComparable(temperature, pressure)).isFalse();
    }

    @Test
    void sharedPropertiesAreComparedRecursively() {
        JsonNode narrow = json("""
            {"type":"object","properties":{
              "reading":{"type":"number","stype":"quantitykind:ThermodynamicTemperature"},
              "note":{"type":"string","stype":"ex:Only"}}}
            """);
        JsonNode broad = json("""
            {"type":"object","properties":{
              "reading":{"type":"number","stype":"quantitykind:Temperature"},
              "other":{"type":"string","stype":"ex:Unrelated"}}}
            """);

        assertThat(checker.isCompatible(narrow, broad)).isTrue();
        assertThat(checker.isCompatible(broad, narrow)).isFalse();
    }

    @Test
    void propertyIsPairedWithTheOtherSideAdditionalProperties() {
        JsonNode declared = json("""
            {"type":"object","properties":{"p":{"type":"number","stype":"quantitykind:Temperature"}}}
            """);
        JsonNode open = json("""
            {"type":"object","additionalProperties":{"type":"number","stype":"quantitykind:Pressure"}}
            """);
        JsonNode openTemperature = json("""
            {"type":"object","additionalProperties":{"type":"number","stype":"quantitykind:ThermodynamicTemperature"}}
            """);

        assertThat(checker.areComparable(declared, open)).isFalse();
        assertThat(checker.areComparable(open, declared)).isFalse();
        assertThat(checker.isCompatible(declared, open)).isFalse();
        assertThat(checker.areComparable(declared, openTemperature)).isTrue();
        assertThat(checker.isCompatible(openTemperature, declared)).isTrue();
        assertThat(checker.isCompatible(declared, openTemperature)).isFalse();
    }

    @Test
    void propertyIsPairedWithMatchingPatterns() {
        JsonNode declared = json("""
            {"type":"object","properties":{"t_room":{"stype":"quantitykind:ThermodynamicTemperature"}}}
            """);
        JsonNode patterned = json("""
            {"type":"object","patternProperties":{
              "^t_":{"stype":"quantitykind:Temperature"},
              "^p_":{"stype":"quantitykind:Pressure"}},
             "additionalProperties":{"stype":"quantitykind:Pressure"}}
            """);
        JsonNode pressureNamed = json("""
            {"type":"object","properties":{"t_room":{"stype":"quantitykind:Pressure"}}}
            """);

        assertThat(checker.isCompatible(declared, patterned)).isTrue();
        assertThat(checker.areComparable(declared, patterned)).isTrue();
        assertThat(checker.areComparable(pressureNamed, patterned)).isFalse();
    }

    @Test
    void invalidPatternIsReportedWithItsLocation() {
        JsonNode declared = json("{\"properties\":{\"a\":{}}}");
        JsonNode broken = json("{\"patternProperties\":{\"(\":{}}}");

        assertThatThrownBy(() -> checker.isCompatible(declared, broken))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("#/patternProperties/(");
    }

    @Test
    void uninhabitedSchemasAreCompatibleWithAnything() {
        JsonNode pressure = json("{\"type\":\"number\",\"stype\":\"quantitykind:Pressure\"}");
        JsonNode nothing = json("{\"not\":{}}");

        assertThat(SemanticCompatibility.isUninhabited(nothing)).isTrue();
        assertThat(SemanticCompatibility.isUninhabited(json("false"))).isTrue();
        assertThat(SemanticCompatibility.isUninhabited(json("{\"not\":{\"type\":\"string\"}}"))).isFalse();
        assertThat(checker.isCompatible(nothing, pressure)).isTrue();
        assertThat(checker.areComparable(pressure, nothing)).isTrue();
    }

    @Test
    void itemsInSingleAndTupleForm() {
        JsonNode managers = json("{\"type\":\"array\",\"items\":{\"stype\":\"ex:Manager\"}}");
        JsonNode people = json("{\"type\":\"array\",\"items\":{\"stype\":\"foaf:Person\"}}");
        JsonNode tuple = json("{\"type\":\"array\",\"items\":[{\"stype\":\"ex:Manager\"},{\"type\":\"string\"}]}");
        JsonNode broadTuple = json("{\"type\":\"array\",\"items\":[{\"stype\":\"ex:Employee\"}]}");
        JsonNode plainTuple = json("{\"type\":\"array\",\"items\":[{\"type\":\"string\"}]}");
        JsonNode plainItems = json("{\"type\":\"array\",\"items\":{\"type\":\"string\"}}");

        assertThat(checker.isCompatible(managers, people)).isTrue();
        assertThat(checker.isCompatible(people, managers)).isFalse();
        assertThat(checker.isCompatible(tuple, broadTuple)).isTrue();
        assertThat(checker.isCompatible(broadTuple, tuple)).isFalse();
        assertThat(checker.isCompatible(managers, tuple)).isFalse();
        assertThat(checker.isCompatible(plainItems, plainTuple)).isTrue();
    }

    @Test
    void additionalAndPatternPropertiesByIdenticalKey() {
        JsonNode narrow = json("""
            {"type":"object",
             "additionalProperties":{"stype":"ex:Manager"},
             "patternProperties":{"^t_":{"stype":"quantitykind:ThermodynamicTemperature"}}}
            """);
        JsonNode broad = json("""
            {"type":"object",
             "additionalProperties":{"stype":"ex:Employee"},
             "patternProperties":{"^t_":{"stype":"quantitykind:Temperature"},
                                  "^p_":{"stype":"quantitykind:Pressure"}}}
            """);
        JsonNode closed = json("{\"type\":\"object\",\"additionalProperties\":false}");

        assertThat(checker.isCompatible(narrow, broad)).isTrue();
        assertThat(checker.isCompatible(broad, narrow)).isFalse();
        assertThat(checker.isCompatible(closed, broad)).isTrue();
    }

    @Test
    void connectivesUseBranchMatching() {
        JsonNode allNarrow = json("{\"allOf\":[{\"stype\":\"ex:Manager\"},{\"type\":\"object\"}]}");
        JsonNode allBroad = json("{\"allOf\":[{\"stype\":\"foaf:Person\"},{\"type\":\"object\"}]}");
        JsonNode anyMixed = json("{\"anyOf\":[{\"stype\":\"quantitykind:Pressure\"},{\"stype\":\"ex:Manager\"}]}");
        JsonNode anyPerson = json("{\"anyOf\":[{\"stype\":\"foaf:Person\"}]}");
        JsonNode oneOfPressure = json("{\"oneOf\":[{\"stype\":\"quantitykind:Pressure\"}]}");
        JsonNode oneOfTemperature = json("{\"oneOf\":[{\"stype\":\"quantitykind:Temperature\"}]}");

        assertThat(checker.isCompatible(allNarrow, allBroad)).isTrue();
        assertThat(checker.isCompatible(allBroad, allNarrow)).isTrue();
        assertThat(checker.isCompatible(anyMixed, anyPerson)).isTrue();
        assertThat(checker.isCompatible(oneOfPressure, oneOfTemperature)).isFalse();
    }

    @Test
    void comparabilityIsSymmetric() {
        JsonNode plain = json("{\"type\":\"object\"}");
        JsonNode manager = json("{\"type\":\"object\",\"stype\":\"ex:Manager\"}");
        JsonNode person = json("{\"type\":\"object\",\"stype\":\"foaf:Person\"}");

        assertThat(checker.areComparable(plain, manager)).isTrue();
        assertThat(checker.areComparable(manager, plain)).isTrue();
        assertThat(checker.areComparable(person, manager)).isTrue();
        assertThat(checker.areComparable(manager, person)).isTrue();
    }

    @Test
    void booleanSchemasCarryNoAnnotation() {
        JsonNode employee = json("{\"stype\":\"ex:Employee\"}");

        assertThat(SemanticCompatibility.annotationOf(json("true"))).isNull();
        assertThat(SemanticCompatibility.annotationOf(json("{\"stype\":42}"))).isNull();
        assertThat(checker.isCompatible(json("false"), json("true"))).isTrue();
        assertThat(checker.isCompatible(json("true"), employee)).isFalse();
    }
}
