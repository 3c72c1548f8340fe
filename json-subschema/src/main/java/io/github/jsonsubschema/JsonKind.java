package io.github.jsonsubschema;

import java.util.Optional;

/// The disjoint JSON value categories. `integer` is [#NUMBER] with the integer flag set.
public enum JsonKind {
  NULL("null"),
  BOOLEAN("boolean"),
  NUMBER("number"),
  STRING("string"),
  ARRAY("array"),
  OBJECT("object");

  private final String typeName;

  JsonKind(String typeName) {
    this.typeName = typeName;
  }

  /// The `type` keyword value for this kind.
  public String typeName() {
    return typeName;
  }

  /// Kind for a `type` keyword value; `integer` maps to [#NUMBER].
  public static Optional<JsonKind> ofTypeName(String name) {
    if ("integer".equals(name)) {
      return Optional.of(NUMBER);
    }
    for (JsonKind kind : values()) {
      if (kind.typeName.equals(name)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  /// The descriptor accepting every value of this kind.
  KindDescriptor unconstrained() {
    switch (this) {
      case NULL:
        return NullDescriptor.INSTANCE;
      case BOOLEAN:
        return BooleanDescriptor.ANY;
      case NUMBER:
        return NumberDescriptor.ANY;
      case STRING:
        return StringDescriptor.any();
      case ARRAY:
        return ArrayDescriptor.any();
      case OBJECT:
        return ObjectDescriptor.any();
      default:
        throw new AssertionError(this);
    }
  }
}
