package io.github.jsonsubschema;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Position-wise comparison of [ArrayDescriptor]s, treating a homogeneous array as an
/// infinite tuple of its item schema.
final class ArrayAlgebra {

  private final SchemaAlgebra algebra;

  ArrayAlgebra(SchemaAlgebra algebra) {
    this.algebra = algebra;
  }

  boolean isSubtype(ArrayDescriptor a, ArrayDescriptor b) {
    if (!b.length().contains(a.length())) {
      return false;
    }
    if (b.unique() && !a.unique() && a.reaches(1)) {
      return false;
    }
    int positions = Math.max(a.prefixItems().size(), b.prefixItems().size());
    for (int i = 0; i < positions; i++) {
      if (!a.reaches(i)) {
        return true;
      }
      if (!algebra.isSubtype(a.itemAt(i), b.itemAt(i))) {
        return false;
      }
    }
    return !a.reaches(positions) || algebra.isSubtype(a.additionalItems(), b.additionalItems());
  }

  Optional<ArrayDescriptor> meet(ArrayDescriptor a, ArrayDescriptor b) {
    int positions = Math.max(a.prefixItems().size(), b.prefixItems().size());
    List<CanonicalSchema> prefix = new ArrayList<>(positions);
    for (int i = 0; i < positions; i++) {
      prefix.add(algebra.meet(a.itemAt(i), b.itemAt(i)));
    }
    return ArrayDescriptor.of(prefix, algebra.meet(a.additionalItems(), b.additionalItems()),
        a.length().intersect(b.length()), a.unique() || b.unique());
  }

  ArrayDescriptor join(ArrayDescriptor a, ArrayDescriptor b) {
    int positions = Math.max(a.prefixItems().size(), b.prefixItems().size());
    List<CanonicalSchema> prefix = new ArrayList<>(positions);
    for (int i = 0; i < positions; i++) {
      prefix.add(joinAt(a, b, i));
    }
    SizeRange length = a.length().hull(b.length());
    boolean unique = a.unique() && b.unique();
    return ArrayDescriptor.of(prefix, joinAt(a, b, Integer.MAX_VALUE), length, unique)
        .orElseThrow(() -> new IllegalStateException("join of inhabited arrays is empty"));
  }

  /// Join of position `index` (`Integer.MAX_VALUE` for the tail), ignoring an operand that
  /// never populates it.
  private CanonicalSchema joinAt(ArrayDescriptor a, ArrayDescriptor b, int index) {
    int at = index == Integer.MAX_VALUE ? Math.max(a.prefixItems().size(), b.prefixItems().size()) : index;
    boolean left = a.reaches(at);
    boolean right = b.reaches(at);
    CanonicalSchema la = index == Integer.MAX_VALUE ? a.additionalItems() : a.itemAt(index);
    CanonicalSchema rb = index == Integer.MAX_VALUE ? b.additionalItems() : b.itemAt(index);
    if (left && !right) {
      return la;
    }
    if (right && !left) {
      return rb;
    }
    return algebra.join(la, rb);
  }

  static Optional<ArrayDescriptor> complement(ArrayDescriptor d) {
    if (d.isUnconstrained()) {
      return Optional.empty();
    }
    if (d.prefixItems().isEmpty() && d.additionalItems().isTop() && !d.unique()) {
      SizeRange length = d.length();
      if (length.max() == null) {
        return ArrayDescriptor.of(List.of(), CanonicalSchema.top(), new SizeRange(0, length.min() - 1), false);
      }
      if (length.min() == 0) {
        return ArrayDescriptor.of(List.of(), CanonicalSchema.top(), new SizeRange(length.max() + 1, null), false);
      }
    }
    throw new UnsupportedSchemaException(
        "not: the arrays rejected by an item, tuple, uniqueness or two-sided length constraint are not a single atom");
  }
}
