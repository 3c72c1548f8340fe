package io.github.jsonsubschema;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumberAlgebraTest extends SubschemaTestBase {

    private static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    private static NumberDescriptor range(String low, String high, boolean integer) {
        NumericInterval interval = new NumericInterval(
            low == null ? Bound.UNBOUNDED : Bound.inclusive(d(low)),
            high == null ? Bound.UNBOUNDED : Bound.inclusive(d(high)));
        return NumberDescriptor.of(interval, null, integer).orElseThrow();
    }

    private static void assertSameInterval(NumericInterval actual, NumericInterval expected) {
        assertThat(actual.contains(expected) && expected.contains(actual))
            .as("%s equals %s", actual, expected).isTrue();
    }

    @Test
    void integerFlagFoldsIntoTheStep() {
        NumberDescriptor stepped = NumberDescriptor.of(NumericInterval.ALL, d("1.5"), true).orElseThrow();

        assertThat(stepped.multipleOf()).isEqualByComparingTo("3");
        assertThat(stepped.integer()).isTrue();
        assertThat(NumberDescriptor.of(NumericInterval.ALL, d("1.0"), false).orElseThrow().multipleOf()).isNull();
    }

    @Test
    void boundsSnapToTheGrid() {
        NumericInterval open = new NumericInterval(Bound.exclusive(d("0")), Bound.exclusive(d("10")));

        NumberDescriptor stepped = NumberDescriptor.of(open, d("3"), false).orElseThrow();

        assertSameInterval(stepped.interval(),
            new NumericInterval(Bound.inclusive(d("3")), Bound.inclusive(d("9"))));
        assertThat(NumberDescriptor.of(open, d("20"), false)).isEmpty();
    }

    @Test
    void openAndClosedEndpointsAreCompared() {
        NumberDescriptor closed = range("0", "1", false);
        NumberDescriptor halfOpen = NumberDescriptor.of(
            new NumericInterval(Bound.exclusive(d("0")), Bound.inclusive(d("1"))), null, false).orElseThrow();

        assertThat(NumberAlgebra.isSubtype(halfOpen, closed)).isTrue();
        assertThat(NumberAlgebra.isSubtype(closed, halfOpen)).isFalse();
    }

    @Test
    void pointIsCheckedByMembership() {
        NumberDescriptor six = NumberDescriptor.point(d("6"));
        NumberDescriptor evens = NumberDescriptor.of(NumericInterval.ALL, d("2"), false).orElseThrow();

        assertThat(NumberAlgebra.isSubtype(six, evens)).isTrue();
        assertThat(NumberAlgebra.isSubtype(NumberDescriptor.point(d("7")), evens)).isFalse();
        assertThat(NumberAlgebra.isSubtype(NumberDescriptor.point(d("6.0")), range(null, null, true))).isTrue();
    }

    @Test
    void meetTakesTheLeastCommonStep() {
        NumberDescriptor fours = NumberDescriptor.of(NumericInterval.ALL, d("4"), false).orElseThrow();
        NumberDescriptor sixes = NumberDescriptor.of(NumericInterval.ALL, d("6"), false).orElseThrow();

        NumberDescriptor meet = NumberAlgebra.meet(fours, sixes).orElseThrow();

        assertThat(meet.multipleOf()).isEqualByComparingTo("12");
    }

    @Test
    void meetOfDecimalStepWithIntegers() {
        NumberDescriptor halves = NumberDescriptor.of(NumericInterval.ALL, d("0.5"), false).orElseThrow();

        NumberDescriptor meet = NumberAlgebra.meet(halves, range(null, null, true)).orElseThrow();

        assertThat(meet.multipleOf()).isNull();
        assertThat(meet.integer()).isTrue();
    }

    @Test
    void joinIsTheHullAndKeepsADividingStep() {
        NumberDescriptor fours = NumberDescriptor.of(
            new NumericInterval(Bound.inclusive(d("0")), Bound.inclusive(d("8"))), d("4"), false).orElseThrow();
        NumberDescriptor evens = NumberDescriptor.of(
            new NumericInterval(Bound.inclusive(d("10")), Bound.inclusive(d("20"))), d("2"), false).orElseThrow();

        NumberDescriptor join = NumberAlgebra.join(fours, evens);

        assertSameInterval(join.interval(),
            new NumericInterval(Bound.inclusive(d("0")), Bound.inclusive(d("20"))));
        assertThat(join.multipleOf()).isEqualByComparingTo("2");
        assertThat(NumberAlgebra.isSubtype(fours, join)).isTrue();
        assertThat(NumberAlgebra.isSubtype(evens, join)).isTrue();
    }

    @Test
    void joinDropsUnrelatedSteps() {
        NumberDescriptor threes = NumberDescriptor.of(NumericInterval.ALL, d("3"), false).orElseThrow();
        NumberDescriptor fives = NumberDescriptor.of(NumericInterval.ALL, d("5"), false).orElseThrow();

        NumberDescriptor join = NumberAlgebra.join(threes, fives);

        assertThat(join.multipleOf()).isNull();
        assertThat(join.integer()).isTrue();
    }

    @Test
    void complementOfAHalfLine() {
        NumberDescriptor atLeastFive = range("5", null, false);

        NumberDescriptor below = NumberAlgebra.complement(atLeastFive).orElseThrow();

        assertSameInterval(below.interval(), new NumericInterval(Bound.UNBOUNDED, Bound.exclusive(d("5"))));
        assertThat(NumberAlgebra.complement(NumberDescriptor.ANY)).isEmpty();
        assertThatThrownBy(() -> NumberAlgebra.complement(range("0", "1", false)))
            .isInstanceOf(UnsupportedSchemaException.class);
        assertThatThrownBy(() -> NumberAlgebra.complement(range(null, null, true)))
            .isInstanceOf(UnsupportedSchemaException.class);
    }
}
