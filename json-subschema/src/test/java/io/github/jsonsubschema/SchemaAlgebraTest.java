package io.github.jsonsubschema;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaAlgebraTest extends SubschemaTestBase {

    /// Meets concatenate, joins keep only equal annotations; every call is recorded.
    static final class RecordingLattice implements AnnotationLattice {
        final List<String> calls = new ArrayList<>();

        @Override
        public String meet(String left, String right) {
            calls.add("meet(" + left + "," + right + ")");
            if (left == null || right == null) {
                return left == null ? right : left;
            }
            return left + "&" + right;
        }

        @Override
        public String join(String left, String right) {
            calls.add("join(" + left + "," + right + ")");
            return Objects.equals(left, right) ? left : null;
        }
    }

    /// Different annotations never share a value.
    static final class DisjointLattice implements AnnotationLattice {
        @Override
        public String meet(String left, String right) {
            return left == null ? right : left;
        }

        @Override
        public String join(String left, String right) {
            return Objects.equals(left, right) ? left : null;
        }

        @Override
        public boolean conflicts(String left, String right) {
            return left != null && right != null && !left.equals(right);
        }
    }

    private final SchemaAlgebra algebra = new SchemaAlgebra(AnnotationLattice.ignoring());

    private static CanonicalSchema itemsTagged(String semanticType, SizeRange length) {
        return CanonicalSchema.of(ArrayDescriptor.of(
            List.of(), CanonicalSchema.top().withSemanticType(semanticType), length, false).orElseThrow());
    }

    @Test
    void topAndBottomBoundEverything() {
        CanonicalSchema strings = canonical("{\"type\":\"string\"}");

        assertThat(algebra.isSubtype(CanonicalSchema.bottom(), strings)).isTrue();
        assertThat(algebra.isSubtype(strings, CanonicalSchema.top())).isTrue();
        assertThat(algebra.isSubtype(CanonicalSchema.top(), strings)).isFalse();
        assertThat(algebra.meet(CanonicalSchema.top(), strings)).isSameAs(strings);
        assertThat(algebra.join(CanonicalSchema.bottom(), strings)).isSameAs(strings);
    }

    @Test
    void meetOfDisjointKindsIsBottom() {
        CanonicalSchema meet = algebra.meet(canonical("{\"type\":\"string\"}"), canonical("{\"type\":\"integer\"}"));

        assertThat(meet.isBottom()).isTrue();
    }

    @Test
    void complementOfAKindKeepsEveryOtherKind() {
        CanonicalSchema strings = canonical("{\"type\":\"string\"}");

        CanonicalSchema complement = algebra.complement(strings);

        assertThat(complement.kinds()).containsExactlyInAnyOrder(
            JsonKind.NULL, JsonKind.BOOLEAN, JsonKind.NUMBER, JsonKind.ARRAY, JsonKind.OBJECT);
        CanonicalSchema twice = algebra.complement(complement);
        assertThat(algebra.isSubtype(twice, strings)).isTrue();
        assertThat(algebra.isSubtype(strings, twice)).isTrue();
    }

    @Test
    void complementOfTopAndBottom() {
        assertThat(algebra.complement(CanonicalSchema.top()).isBottom()).isTrue();
        assertThat(algebra.complement(CanonicalSchema.bottom()).isTop()).isTrue();
    }

    @Test
    void complementOfABooleanConstant() {
        CanonicalSchema complement = algebra.complement(canonical("{\"const\":true}"));

        BooleanDescriptor booleans = (BooleanDescriptor) complement.descriptor(JsonKind.BOOLEAN).orElseThrow();
        assertThat(booleans.values()).containsExactly(false);
        assertThat(complement.accepts(JsonKind.STRING)).isTrue();
    }

    @Test
    void complementOfALowerBoundIsDisjointFromIt() {
        CanonicalSchema atLeastFive = canonical("{\"type\":\"number\",\"minimum\":5}");

        CanonicalSchema complement = algebra.complement(atLeastFive);

        assertThat(algebra.isSubtype(canonical("{\"type\":\"number\",\"maximum\":4.5}"), complement)).isTrue();
        assertThat(algebra.meet(atLeastFive, complement).isBottom()).isTrue();
    }

    @Test
    void complementOfAnUnsupportedConstraintIsRejected() {
        assertThatThrownBy(() -> algebra.complement(canonical("{\"type\":\"number\",\"multipleOf\":3}")))
            .isInstanceOf(UnsupportedSchemaException.class);
    }

    @Test
    void meetAndJoinConsultTheAnnotationLattice() {
        RecordingLattice lattice = new RecordingLattice();
        SchemaAlgebra annotated = new SchemaAlgebra(lattice);
        CanonicalSchema a = canonical("{\"type\":\"number\"}").withSemanticType("ex:A");
        CanonicalSchema b = canonical("{\"type\":\"integer\"}").withSemanticType("ex:B");

        assertThat(annotated.meet(a, b).semanticType()).isEqualTo("ex:A&ex:B");
        assertThat(annotated.join(a, b).semanticType()).isNull();
        assertThat(annotated.join(a, a).semanticType()).isEqualTo("ex:A");
        assertThat(lattice.calls).containsExactly(
            "meet(ex:A,ex:B)", "join(ex:A,ex:B)", "join(ex:A,ex:A)");
    }

    @Test
    void emptyMeetCarriesNoAnnotation() {
        SchemaAlgebra annotated = new SchemaAlgebra(new RecordingLattice());
        CanonicalSchema a = canonical("{\"type\":\"string\"}").withSemanticType("ex:A");
        CanonicalSchema b = canonical("{\"type\":\"null\"}").withSemanticType("ex:B");

        CanonicalSchema meet = annotated.meet(a, b);

        assertThat(meet.isBottom()).isTrue();
        assertThat(meet.semanticType()).isNull();
    }

    @Test
    void joinWithBottomKeepsTheOtherAnnotation() {
        SchemaAlgebra annotated = new SchemaAlgebra(new RecordingLattice());
        CanonicalSchema a = canonical("{\"type\":\"string\"}").withSemanticType("ex:A");

        assertThat(annotated.join(a, CanonicalSchema.bottom()).semanticType()).isEqualTo("ex:A");
    }

    @Test
    void conflictingAnnotationsMeetInBottom() {
        SchemaAlgebra disjoint = new SchemaAlgebra(new DisjointLattice());
        CanonicalSchema a = canonical("{\"type\":\"number\"}").withSemanticType("ex:A");
        CanonicalSchema b = canonical("{\"type\":\"number\"}").withSemanticType("ex:B");

        assertThat(disjoint.meet(a, b).isBottom()).isTrue();
        assertThat(disjoint.meet(a, a).semanticType()).isEqualTo("ex:A");
        assertThat(disjoint.meet(a, canonical("{\"type\":\"integer\"}")).semanticType()).isEqualTo("ex:A");
    }

    @Test
    void conflictingItemAnnotationsLeaveOnlyTheEmptyArray() {
        SchemaAlgebra disjoint = new SchemaAlgebra(new DisjointLattice());

        CanonicalSchema meet = disjoint.meet(itemsTagged("ex:A", SizeRange.ANY), itemsTagged("ex:B", SizeRange.ANY));

        ArrayDescriptor array = (ArrayDescriptor) meet.descriptor(JsonKind.ARRAY).orElseThrow();
        assertThat(array.additionalItems().isBottom()).isTrue();
        assertThat(array.length()).isEqualTo(SizeRange.exactly(0));
    }

    @Test
    void annotatedTopItemsAreNotUnconstrained() {
        CanonicalSchema tagged = itemsTagged("ex:A", SizeRange.ANY);
        CanonicalSchema bounded = canonical("{\"type\":\"array\",\"maxItems\":2}");

        CanonicalSchema meet = new SchemaAlgebra(new RecordingLattice()).meet(tagged, bounded);

        assertThat(tagged.descriptor(JsonKind.ARRAY).orElseThrow().isUnconstrained()).isFalse();
        assertThat(tagged.isAnnotated()).isTrue();
        assertThat(tagged.semanticType()).isNull();
        assertThat(SchemaWriter.write(meet).toString())
            .isEqualTo("{\"type\":\"array\",\"items\":{\"stype\":\"ex:A\"},\"maxItems\":2}");
    }

    @Test
    void joinComparesAnnotatedMembersInsteadOfKeepingTheLargerOperand() {
        SchemaAlgebra annotated = new SchemaAlgebra(new RecordingLattice());
        CanonicalSchema narrow = itemsTagged("ex:A", new SizeRange(0, 2));
        CanonicalSchema wide = itemsTagged("ex:B", SizeRange.ANY);

        CanonicalSchema join = annotated.join(narrow, wide);

        assertThat(join.descriptor(JsonKind.ARRAY).orElseThrow().isUnconstrained()).isTrue();
        assertThat(join.isAnnotated()).isFalse();
    }

    @Test
    void subtypingIgnoresAnnotations() {
        CanonicalSchema a = canonical("{\"type\":\"integer\"}").withSemanticType("ex:A");
        CanonicalSchema b = canonical("{\"type\":\"number\"}").withSemanticType("ex:B");

        assertThat(new SchemaAlgebra(new RecordingLattice()).isSubtype(a, b)).isTrue();
    }

    @Test
    void descriptorsOfDifferentKindsAreNotCompared() {
        KindDescriptor booleans = canonical("{\"const\":true}").descriptor(JsonKind.BOOLEAN).orElseThrow();
        KindDescriptor integers = canonical("{\"type\":\"integer\"}").descriptor(JsonKind.NUMBER).orElseThrow();

        assertThatThrownBy(() -> algebra.isSubtype(booleans, integers))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
