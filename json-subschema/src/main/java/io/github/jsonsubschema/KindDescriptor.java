package io.github.jsonsubschema;

/// Per-kind normal form of the values a schema accepts. A kind that accepts nothing has
/// no descriptor at all: factories return an empty `Optional` instead of an empty descriptor.
public sealed interface KindDescriptor
    permits NullDescriptor,
    BooleanDescriptor,
    NumberDescriptor,
    StringDescriptor,
    ArrayDescriptor,
    ObjectDescriptor {

  JsonKind kind();

  /// True when every value of [#kind()] is accepted.
  boolean isUnconstrained();
}
