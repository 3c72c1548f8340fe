package io.github.jsonsubschema;

import io.github.jsonsubschema.semantic.SemanticTypeResolver;

import java.util.Objects;
import java.util.logging.Level;

import static io.github.jsonsubschema.SubschemaLogging.LOG;

/// [AnnotationLattice] over a concept hierarchy.
///
/// Meet keeps the narrower annotation and adopts the other side's when one is missing.
/// Join keeps the broader annotation and drops it whenever either side lacks one, so a
/// join never claims a guarantee the weaker operand does not give. Incomparable
/// annotations conflict: [SchemaAlgebra] turns their meet into Bottom and their join
/// drops the annotation with a diagnostic.
final class SemanticAnnotationLattice implements AnnotationLattice {

  private final SemanticTypeResolver resolver;
  private final Level diagnostics;

  SemanticAnnotationLattice(SemanticTypeResolver resolver, Level diagnostics) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  @Override
  public String meet(String left, String right) {
    if (left == null) {
      return right;
    }
    if (right == null || left.equals(right)) {
      return left;
    }
    if (resolver.isSubtypeOf(left, right)) {
      return left;
    }
    if (resolver.isSubtypeOf(right, left)) {
      return right;
    }
    LOG.log(diagnostics, () -> "meet: incomparable semantic types " + left + " and " + right + ", annotation dropped");
    return null;
  }

  @Override
  public boolean conflicts(String left, String right) {
    if (left == null || right == null || left.equals(right)) {
      return false;
    }
    boolean conflict = !resolver.isSubtypeOf(left, right) && !resolver.isSubtypeOf(right, left);
    if (conflict) {
      LOG.log(diagnostics, () -> "meet: semantic types " + left + " and " + right + " share no value");
    }
    return conflict;
  }

  @Override
  public String join(String left, String right) {
    if (left == null || right == null) {
      return null;
    }
    if (left.equals(right)) {
      return left;
    }
    if (resolver.isSubtypeOf(left, right)) {
      return right;
    }
    if (resolver.isSubtypeOf(right, left)) {
      return left;
    }
    LOG.log(diagnostics, () -> "join: incomparable semantic types " + left + " and " + right + ", annotation dropped");
    return null;
  }
}
