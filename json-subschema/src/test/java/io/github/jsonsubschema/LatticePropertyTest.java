package io.github.jsonsubschema;

import net.jqwik.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Lattice laws over generated schemas: subtyping is a preorder, meet is the greatest
/// lower bound and join an upper bound.
class LatticePropertyTest extends SubschemaTestBase {

    private static final List<String> PROPERTY_NAMES = List.of("alpha", "beta", "gamma");
    private static final List<String> PATTERNS = List.of("^a", "b$", "^[a-c]+$");
    private static final List<String> WORDS = List.of("a", "ab", "bb", "cab");

    private final SchemaAlgebra algebra = new SchemaAlgebra(AnnotationLattice.ignoring());

    private static Arbitrary<String> schemaArbitrary(int depth) {
        final Arbitrary<String> leaves = Arbitraries.oneOf(
            Arbitraries.of("{}", "false", "{\"type\":\"null\"}", "{\"type\":\"boolean\"}", "{\"const\":true}",
                "{\"type\":\"integer\"}", "{\"type\":\"number\"}", "{\"type\":\"string\"}", "{\"type\":\"object\"}"),
            numberArbitrary(),
            stringArbitrary());
        if (depth == 0) {
            return leaves;
        }
        return Arbitraries.oneOf(leaves, arrayArbitrary(depth), objectArbitrary(depth), combinedArbitrary(depth));
    }

    private static Arbitrary<String> numberArbitrary() {
        final Arbitrary<Integer> bounds = Arbitraries.integers().between(-5, 5);
        return Combinators.combine(Arbitraries.of("integer", "number"), bounds, bounds, Arbitraries.of(0, 1, 2, 3))
            .as((type, low, high, shape) -> switch (shape) {
                case 0 -> "{\"type\":\"" + type + "\",\"minimum\":" + low + "}";
                case 1 -> "{\"type\":\"" + type + "\",\"maximum\":" + high + "}";
                case 2 -> "{\"type\":\"" + type + "\",\"exclusiveMinimum\":" + low + ",\"maximum\":" + high + "}";
                default -> "{\"type\":\"" + type + "\",\"minimum\":" + Math.min(low, high)
                    + ",\"maximum\":" + Math.max(low, high) + "}";
            });
    }

    private static Arbitrary<String> stringArbitrary() {
        final Arbitrary<String> patterned = Combinators.combine(Arbitraries.of(PATTERNS), Arbitraries.integers().between(1, 4))
            .as((pattern, max) -> "{\"type\":\"string\",\"pattern\":\"" + pattern + "\",\"maxLength\":" + max + "}");
        final Arbitrary<String> lengths = Arbitraries.integers().between(0, 3)
            .map(min -> "{\"type\":\"string\",\"minLength\":" + min + "}");
        final Arbitrary<String> enums = Arbitraries.of(WORDS).set().ofMinSize(1).ofMaxSize(3)
            .map(words -> "{\"enum\":[\"" + String.join("\",\"", words) + "\"]}");
        return Arbitraries.oneOf(patterned, lengths, enums);
    }

    private static Arbitrary<String> arrayArbitrary(int depth) {
        final Arbitrary<String> child = schemaArbitrary(depth - 1);
        final Arbitrary<String> homogeneous = Combinators.combine(child, Arbitraries.integers().between(0, 2))
            .as((items, min) -> "{\"type\":\"array\",\"items\":" + items + ",\"minItems\":" + min + "}");
        final Arbitrary<String> tuple = Combinators.combine(child, child, Arbitraries.of("{}", "false", "{\"type\":\"null\"}"))
            .as((first, second, rest) -> "{\"type\":\"array\",\"items\":[" + first + "," + second
                + "],\"additionalItems\":" + rest + "}");
        return Arbitraries.oneOf(homogeneous, tuple);
    }

    private static Arbitrary<String> objectArbitrary(int depth) {
        final Arbitrary<String> child = schemaArbitrary(depth - 1);
        return Combinators.combine(Arbitraries.of(PROPERTY_NAMES), child, Arbitraries.of(true, false),
                Arbitraries.of("{}", "false", "{\"type\":\"string\"}"))
            .as((name, value, required, additional) -> "{\"type\":\"object\",\"properties\":{\"" + name + "\":" + value + "}"
                + (required ? ",\"required\":[\"" + name + "\"]" : "")
                + ",\"additionalProperties\":" + additional + "}");
    }

    private static Arbitrary<String> combinedArbitrary(int depth) {
        final Arbitrary<String> child = schemaArbitrary(depth - 1);
        return Combinators.combine(Arbitraries.of("anyOf", "allOf"), child, child)
            .as((keyword, left, right) -> "{\"" + keyword + "\":[" + left + "," + right + "]}");
    }

    @Provide
    Arbitrary<String> schemas() {
        return schemaArbitrary(2);
    }

    @Property(tries = 200)
    void subtypingIsReflexive(@ForAll("schemas") String schema) {
        CanonicalSchema s = canonical(schema);

        assertThat(algebra.isSubtype(s, s)).as(schema).isTrue();
    }

    @Property(tries = 200)
    void meetIsALowerBound(@ForAll("schemas") String left, @ForAll("schemas") String right) {
        CanonicalSchema a = canonical(left);
        CanonicalSchema b = canonical(right);

        CanonicalSchema meet = algebra.meet(a, b);

        assertThat(algebra.isSubtype(meet, a)).as("%s /\\ %s <= left", left, right).isTrue();
        assertThat(algebra.isSubtype(meet, b)).as("%s /\\ %s <= right", left, right).isTrue();
    }

    @Property(tries = 200)
    void meetWithALargerSchemaKeepsTheSmallerOne(@ForAll("schemas") String left, @ForAll("schemas") String right) {
        CanonicalSchema a = canonical(left);
        CanonicalSchema b = algebra.join(a, canonical(right));

        assertThat(algebra.isSubtype(a, algebra.meet(a, b))).as("%s <= %s", left, right).isTrue();
    }

    @Property(tries = 200)
    void joinIsAnUpperBound(@ForAll("schemas") String left, @ForAll("schemas") String right) {
        CanonicalSchema a = canonical(left);
        CanonicalSchema b = canonical(right);

        CanonicalSchema join = algebra.join(a, b);

        assertThat(algebra.isSubtype(a, join)).as("left <= %s \\/ %s", left, right).isTrue();
        assertThat(algebra.isSubtype(b, join)).as("right <= %s \\/ %s", left, right).isTrue();
    }

    @Property(tries = 200)
    void meetAndJoinAreCommutative(@ForAll("schemas") String left, @ForAll("schemas") String right) {
        CanonicalSchema a = canonical(left);
        CanonicalSchema b = canonical(right);

        assertThat(equivalent(algebra.meet(a, b), algebra.meet(b, a))).as("meet %s %s", left, right).isTrue();
        assertThat(equivalent(algebra.join(a, b), algebra.join(b, a))).as("join %s %s", left, right).isTrue();
    }

    @Property(tries = 100)
    void subtypingIsTransitive(@ForAll("schemas") String first, @ForAll("schemas") String second,
                               @ForAll("schemas") String third) {
        CanonicalSchema a = canonical(first);
        CanonicalSchema b = algebra.join(a, canonical(second));
        CanonicalSchema c = algebra.join(b, canonical(third));

        assertThat(algebra.isSubtype(a, c)).as("%s <= %s <= %s", first, second, third).isTrue();
    }

    @Property(tries = 100)
    void canonicalFormIsEquivalentToItsSource(@ForAll("schemas") String schema) {
        JsonSubschema subschema = structural();

        assertThat(subschema.isEquivalent(subschema.canonicalize(schema), json(schema))).as(schema).isTrue();
    }

    private boolean equivalent(CanonicalSchema a, CanonicalSchema b) {
        return algebra.isSubtype(a, b) && algebra.isSubtype(b, a);
    }
}
