package io.github.jsonsubschema;

/// Chooses the semantic annotation of a meet or join result from the operands' annotations.
/// Either argument may be null (no annotation); a null result drops the annotation.
public interface AnnotationLattice {

  String meet(String left, String right);

  String join(String left, String right);

  /// True when both annotations are present and no value can carry both meanings. A meet
  /// of two schemas with conflicting annotations is Bottom.
  default boolean conflicts(String left, String right) {
    return false;
  }

  /// Drops every annotation; used when semantic reasoning is disabled.
  static AnnotationLattice ignoring() {
    return Ignoring.INSTANCE;
  }

  enum Ignoring implements AnnotationLattice {
    INSTANCE;

    @Override
    public String meet(String left, String right) {
      return null;
    }

    @Override
    public String join(String left, String right) {
      return null;
    }
  }
}
