package io.github.jsonsubschema;

import java.math.BigDecimal;
import java.util.Objects;

/// Interval of numbers between two [Bound]s.
public record NumericInterval(Bound lower, Bound upper) {

  public static final NumericInterval ALL = new NumericInterval(Bound.UNBOUNDED, Bound.UNBOUNDED);

  public NumericInterval {
    Objects.requireNonNull(lower, "lower");
    Objects.requireNonNull(upper, "upper");
  }

  public static NumericInterval point(BigDecimal value) {
    Bound bound = Bound.inclusive(value);
    return new NumericInterval(bound, bound);
  }

  public boolean isEmpty() {
    if (lower instanceof Bound.Finite lo && upper instanceof Bound.Finite up) {
      int cmp = lo.value().compareTo(up.value());
      return cmp > 0 || (cmp == 0 && !(lo.inclusive() && up.inclusive()));
    }
    return false;
  }

  public boolean isUnbounded() {
    return !lower.isFinite() && !upper.isFinite();
  }

  /// The single value of a closed degenerate interval, or null.
  public BigDecimal pointValue() {
    if (lower instanceof Bound.Finite lo && upper instanceof Bound.Finite up
        && lo.inclusive() && up.inclusive() && lo.value().compareTo(up.value()) == 0) {
      return lo.value();
    }
    return null;
  }

  public boolean containsValue(BigDecimal value) {
    if (lower instanceof Bound.Finite lo) {
      int cmp = value.compareTo(lo.value());
      if (cmp < 0 || (cmp == 0 && !lo.inclusive())) {
        return false;
      }
    }
    if (upper instanceof Bound.Finite up) {
      int cmp = value.compareTo(up.value());
      return cmp < 0 || (cmp == 0 && up.inclusive());
    }
    return true;
  }

  public boolean contains(NumericInterval other) {
    if (other.isEmpty()) {
      return true;
    }
    return Bound.compareLower(other.lower, lower) >= 0 && Bound.compareUpper(other.upper, upper) <= 0;
  }

  public NumericInterval intersect(NumericInterval other) {
    return new NumericInterval(Bound.tighterLower(lower, other.lower), Bound.tighterUpper(upper, other.upper));
  }

  /// Convex hull: may admit values neither operand admits.
  public NumericInterval hull(NumericInterval other) {
    if (isEmpty()) {
      return other;
    }
    if (other.isEmpty()) {
      return this;
    }
    return new NumericInterval(Bound.looserLower(lower, other.lower), Bound.looserUpper(upper, other.upper));
  }
}
