package io.github.jsonsubschema;

import java.math.BigDecimal;
import java.util.Objects;

/// One end of a [NumericInterval]: either unbounded or a finite value, open or closed.
///
/// Comparisons are total. As a lower bound [Unbounded] is minus infinity and an
/// exclusive value sits just above the same inclusive value; as an upper bound
/// [Unbounded] is plus infinity and an exclusive value sits just below.
public sealed interface Bound permits Bound.Unbounded, Bound.Finite {

  Bound UNBOUNDED = new Unbounded();

  record Unbounded() implements Bound {}

  record Finite(BigDecimal value, boolean inclusive) implements Bound {
    public Finite {
      Objects.requireNonNull(value, "value");
    }
  }

  static Bound inclusive(BigDecimal value) {
    return new Finite(value, true);
  }

  static Bound exclusive(BigDecimal value) {
    return new Finite(value, false);
  }

  default boolean isFinite() {
    return this instanceof Finite;
  }

  /// Orders `a` and `b` as lower bounds: positive when `a` admits fewer values.
  static int compareLower(Bound a, Bound b) {
    if (a instanceof Finite fa && b instanceof Finite fb) {
      int byValue = fa.value().compareTo(fb.value());
      if (byValue != 0) {
        return byValue;
      }
      return Boolean.compare(fb.inclusive(), fa.inclusive());
    }
    return Boolean.compare(a.isFinite(), b.isFinite());
  }

  /// Orders `a` and `b` as upper bounds: positive when `a` admits more values.
  static int compareUpper(Bound a, Bound b) {
    if (a instanceof Finite fa && b instanceof Finite fb) {
      int byValue = fa.value().compareTo(fb.value());
      if (byValue != 0) {
        return byValue;
      }
      return Boolean.compare(fa.inclusive(), fb.inclusive());
    }
    return Boolean.compare(b.isFinite(), a.isFinite());
  }

  static Bound tighterLower(Bound a, Bound b) {
    return compareLower(a, b) >= 0 ? a : b;
  }

  static Bound looserLower(Bound a, Bound b) {
    return compareLower(a, b) <= 0 ? a : b;
  }

  static Bound tighterUpper(Bound a, Bound b) {
    return compareUpper(a, b) <= 0 ? a : b;
  }

  static Bound looserUpper(Bound a, Bound b) {
    return compareUpper(a, b) >= 0 ? a : b;
  }
}
