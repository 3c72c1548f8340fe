package io.github.jsonsubschema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

/// Numbers in an interval, optionally restricted to multiples of a step or to integers.
///
/// Instances built through [#of] are normalized:
/// - an integral step implies the integer flag, and the integer flag folds into the step
///   as `lcm(step, 1)`, with a step of exactly 1 dropped
/// - finite bounds of a stepped or integer interval are closed and lie on the grid
/// - a single-value interval drops the step and records whether the value is integral
public record NumberDescriptor(NumericInterval interval, BigDecimal multipleOf, boolean integer)
    implements KindDescriptor {

  public static final NumberDescriptor ANY = new NumberDescriptor(NumericInterval.ALL, null, false);

  public NumberDescriptor {
    Objects.requireNonNull(interval, "interval");
  }

  public static Optional<NumberDescriptor> of(NumericInterval interval, BigDecimal multipleOf, boolean integer) {
    BigDecimal step = multipleOf == null ? null : multipleOf.stripTrailingZeros();
    if (step != null && step.signum() <= 0) {
      throw new IllegalArgumentException("multipleOf must be > 0: " + multipleOf);
    }
    boolean isInteger = integer || (step != null && isIntegral(step));
    if (isInteger && step != null) {
      step = lcm(step, BigDecimal.ONE);
      if (step.compareTo(BigDecimal.ONE) == 0) {
        step = null;
      }
    }
    BigDecimal grid = step != null ? step : (isInteger ? BigDecimal.ONE : null);
    NumericInterval snapped = grid == null ? interval : snap(interval, grid);
    if (snapped.isEmpty()) {
      return Optional.empty();
    }
    BigDecimal point = snapped.pointValue();
    if (point != null) {
      return Optional.of(new NumberDescriptor(NumericInterval.point(point), null, isIntegral(point)));
    }
    return Optional.of(new NumberDescriptor(snapped, step, isInteger));
  }

  public static NumberDescriptor point(BigDecimal value) {
    return new NumberDescriptor(NumericInterval.point(value.stripTrailingZeros()), null, isIntegral(value));
  }

  @Override
  public JsonKind kind() {
    return JsonKind.NUMBER;
  }

  @Override
  public boolean isUnconstrained() {
    return interval.isUnbounded() && multipleOf == null && !integer;
  }

  /// The step every accepted value is a multiple of, or null.
  public BigDecimal effectiveStep() {
    if (multipleOf != null) {
      return multipleOf;
    }
    return integer ? BigDecimal.ONE : null;
  }

  /// The single accepted value, or null.
  public BigDecimal pointValue() {
    return interval.pointValue();
  }

  public boolean accepts(BigDecimal value) {
    if (!interval.containsValue(value)) {
      return false;
    }
    BigDecimal step = effectiveStep();
    return step == null || isMultiple(value, step);
  }

  static boolean isIntegral(BigDecimal value) {
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }

  static boolean isMultiple(BigDecimal value, BigDecimal step) {
    return value.remainder(step).signum() == 0;
  }

  static BigDecimal lcm(BigDecimal a, BigDecimal b) {
    int scale = Math.max(0, Math.max(a.scale(), b.scale()));
    BigInteger x = a.movePointRight(scale).toBigIntegerExact();
    BigInteger y = b.movePointRight(scale).toBigIntegerExact();
    BigInteger lcm = x.divide(x.gcd(y)).multiply(y);
    return new BigDecimal(lcm, scale).stripTrailingZeros();
  }

  private static NumericInterval snap(NumericInterval interval, BigDecimal grid) {
    Bound lower = interval.lower();
    Bound upper = interval.upper();
    if (lower instanceof Bound.Finite lo) {
      BigDecimal k = lo.value().divide(grid, 0, RoundingMode.CEILING);
      BigDecimal snapped = k.multiply(grid);
      if (!lo.inclusive() && snapped.compareTo(lo.value()) == 0) {
        snapped = snapped.add(grid);
      }
      lower = Bound.inclusive(snapped.stripTrailingZeros());
    }
    if (upper instanceof Bound.Finite up) {
      BigDecimal k = up.value().divide(grid, 0, RoundingMode.FLOOR);
      BigDecimal snapped = k.multiply(grid);
      if (!up.inclusive() && snapped.compareTo(up.value()) == 0) {
        snapped = snapped.subtract(grid);
      }
      upper = Bound.inclusive(snapped.stripTrailingZeros());
    }
    return new NumericInterval(lower, upper);
  }
}
