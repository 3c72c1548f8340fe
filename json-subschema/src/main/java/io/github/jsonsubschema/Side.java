package io.github.jsonsubschema;

/// Which operand of a binary operation a schema came from.
public enum Side {
  LEFT,
  RIGHT
}
