package io.github.jsonsubschema;

import java.math.BigDecimal;
import java.util.Optional;

/// Interval and step arithmetic for [NumberDescriptor].
final class NumberAlgebra {

  private NumberAlgebra() {}

  static boolean isSubtype(NumberDescriptor a, NumberDescriptor b) {
    BigDecimal point = a.pointValue();
    if (point != null) {
      return b.accepts(point);
    }
    if (!b.interval().contains(a.interval())) {
      return false;
    }
    BigDecimal required = b.effectiveStep();
    if (required == null) {
      return true;
    }
    BigDecimal step = a.effectiveStep();
    return step != null && NumberDescriptor.isMultiple(step, required);
  }

  static Optional<NumberDescriptor> meet(NumberDescriptor a, NumberDescriptor b) {
    BigDecimal sa = a.multipleOf();
    BigDecimal sb = b.multipleOf();
    BigDecimal step = sa == null ? sb : sb == null ? sa : NumberDescriptor.lcm(sa, sb);
    return NumberDescriptor.of(a.interval().intersect(b.interval()), step, a.integer() || b.integer());
  }

  /// Convex hull of incomparable operands. A step survives only when one step divides
  /// the other, so the result may admit values neither operand admits.
  static NumberDescriptor join(NumberDescriptor a, NumberDescriptor b) {
    NumericInterval hull = a.interval().hull(b.interval());
    BigDecimal sa = a.effectiveStep();
    BigDecimal sb = b.effectiveStep();
    BigDecimal step = null;
    if (sa != null && sb != null) {
      if (NumberDescriptor.isMultiple(sa, sb)) {
        step = sb;
      } else if (NumberDescriptor.isMultiple(sb, sa)) {
        step = sa;
      }
    }
    boolean integer = a.integer() && b.integer();
    return NumberDescriptor.of(hull, step, integer).orElseGet(() -> new NumberDescriptor(hull, null, false));
  }

  /// The numbers `d` rejects, when they form one half-line.
  static Optional<NumberDescriptor> complement(NumberDescriptor d) {
    if (d.isUnconstrained()) {
      return Optional.empty();
    }
    if (d.multipleOf() == null && !d.integer()) {
      Bound lower = d.interval().lower();
      Bound upper = d.interval().upper();
      if (lower instanceof Bound.Finite lo && !upper.isFinite()) {
        return Optional.of(new NumberDescriptor(
            new NumericInterval(Bound.UNBOUNDED, new Bound.Finite(lo.value(), !lo.inclusive())), null, false));
      }
      if (upper instanceof Bound.Finite up && !lower.isFinite()) {
        return Optional.of(new NumberDescriptor(
            new NumericInterval(new Bound.Finite(up.value(), !up.inclusive()), Bound.UNBOUNDED), null, false));
      }
    }
    throw new UnsupportedSchemaException(
        "not: the numbers outside a bounded, stepped or integer range are not a single interval");
  }
}
