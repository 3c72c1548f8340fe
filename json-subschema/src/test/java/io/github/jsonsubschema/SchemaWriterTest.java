package io.github.jsonsubschema;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaWriterTest extends SubschemaTestBase {

    private static String written(String schema) {
        return SchemaWriter.write(canonical(schema)).toString();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', textBlock = """
        true                                                  | {}
        false                                                 | {"not":{}}
        {"type":"integer","minimum":2,"maximum":1}            | {"not":{}}
        {"type":"integer","minimum":1,"maximum":3}            | {"type":"integer","minimum":1,"maximum":3}
        {"type":"number","exclusiveMinimum":0.5}              | {"type":"number","minimum":0.5,"exclusiveMinimum":true}
        {"type":"number","multipleOf":0.25,"maximum":1}       | {"type":"number","maximum":1,"multipleOf":0.25}
        {"type":"number","minimum":3,"maximum":3}             | {"type":"integer","enum":[3]}
        {"enum":[true]}                                       | {"type":"boolean","enum":[true]}
        {"enum":["b","a"]}                                    | {"type":"string","enum":["a","b"]}
        {"type":"string","minLength":2,"maxLength":5}         | {"type":"string","minLength":2,"maxLength":5}
        {"type":["string","null"]}                            | {"type":["null","string"]}
        {"type":"array","items":{"type":"null"},"minItems":1} | {"type":"array","items":{"type":"null"},"minItems":1}
        {"type":"array","uniqueItems":true}                   | {"type":"array","uniqueItems":true}
        """)
    void writesDraftFourVocabulary(String schema, String expected) {
        assertThat(written(schema)).isEqualTo(expected);
    }

    @Test
    void closedObjectKeepsItsCount() {
        assertThat(written("""
            {"type":"object","properties":{"a":{"type":"string"}},"required":["a"],"additionalProperties":false}"""))
            .isEqualTo("""
                {"type":"object","properties":{"a":{"type":"string"}},"required":["a"],\
                "additionalProperties":false,"maxProperties":1}""");
    }

    @Test
    void tupleWithClosedTail() {
        assertThat(written("""
            {"type":"array","items":[{"type":"string"},{"type":"boolean"}],"additionalItems":false}"""))
            .isEqualTo("""
                {"type":"array","items":[{"type":"string"},{"type":"boolean"}],"additionalItems":false,\
                "maxItems":2}""");
    }

    @Test
    void mixedConstrainedKindsBecomeAnyOf() {
        JsonNode written = SchemaWriter.write(canonical("{\"type\":[\"null\",\"integer\"]}"));

        assertThat(written.get("anyOf")).hasSize(2);
        assertThat(written.get("anyOf").get(1).get("type").asText()).isEqualTo("integer");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"type\":\"string\",\"pattern\":\"^[a-c]+$\"}",
        "{\"type\":\"string\",\"pattern\":\"ab|cd\"}",
        "{\"type\":\"string\",\"pattern\":\"^(x|yz)*q?$\",\"maxLength\":6}",
        "{\"type\":\"string\",\"format\":\"ipv4\"}",
        "{\"type\":\"object\",\"patternProperties\":{\"^a\":{\"type\":\"integer\"}},\"additionalProperties\":false}",
        "{\"anyOf\":[{\"type\":\"string\",\"pattern\":\"^a\"},{\"type\":\"string\",\"pattern\":\"b$\"}]}",
        "{\"type\":\"array\",\"items\":[{\"enum\":[1,2]}],\"additionalItems\":{\"type\":\"string\"}}"
    })
    void writtenFormCanonicalizesToTheSameSchema(String schema) {
        JsonSubschema subschema = structural();
        JsonNode original = json(schema);

        JsonNode written = subschema.canonicalize(original);

        assertThat(subschema.isEquivalent(original, written)).as(written.toString()).isTrue();
    }

    @Test
    void semanticTypeIsWrittenOnItsNode() {
        JsonNode written = semantic().canonicalize(json("""
            {"type":"object","properties":{"t":{"type":"number","stype":"quantitykind:Temperature"}}}"""));

        assertThat(written.get("properties").get("t").get("stype").asText())
            .isEqualTo("http://qudt.org/vocab/quantitykind/Temperature");
        assertThat(written.has("stype")).isFalse();
    }
}
