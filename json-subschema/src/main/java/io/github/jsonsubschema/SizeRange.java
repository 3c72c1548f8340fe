package io.github.jsonsubschema;

/// Closed range of non-negative sizes; `max == null` is unbounded.
/// A range with `max < min` is empty.
public record SizeRange(int min, Integer max) {

  public static final SizeRange ANY = new SizeRange(0, null);

  public SizeRange {
    if (min < 0) {
      throw new IllegalArgumentException("min must be >= 0: " + min);
    }
    if (max != null && max < 0) {
      throw new IllegalArgumentException("max must be >= 0: " + max);
    }
  }

  public static SizeRange exactly(int size) {
    return new SizeRange(size, size);
  }

  public boolean isEmpty() {
    return max != null && max < min;
  }

  public boolean isUnconstrained() {
    return min == 0 && max == null;
  }

  public boolean allows(int size) {
    return size >= min && (max == null || size <= max);
  }

  /// True when every size of `other` is in this range.
  public boolean contains(SizeRange other) {
    if (other.isEmpty()) {
      return true;
    }
    return min <= other.min && (max == null || (other.max != null && other.max <= max));
  }

  public SizeRange intersect(SizeRange other) {
    return new SizeRange(Math.max(min, other.min), minMax(max, other.max));
  }

  /// Smallest range covering both.
  public SizeRange hull(SizeRange other) {
    if (isEmpty()) {
      return other;
    }
    if (other.isEmpty()) {
      return this;
    }
    Integer upper = max == null || other.max == null ? null : Math.max(max, other.max);
    return new SizeRange(Math.min(min, other.min), upper);
  }

  public SizeRange atLeast(int lower) {
    return new SizeRange(Math.max(min, lower), max);
  }

  public SizeRange atMost(int upper) {
    return new SizeRange(min, minMax(max, upper));
  }

  private static Integer minMax(Integer a, Integer b) {
    if (a == null) {
      return b;
    }
    return b == null ? a : Integer.valueOf(Math.min(a, b));
  }
}
