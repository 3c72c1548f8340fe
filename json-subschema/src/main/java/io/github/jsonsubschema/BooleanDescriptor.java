package io.github.jsonsubschema;

import java.util.Optional;
import java.util.Set;

/// A non-empty subset of `{true, false}`.
public record BooleanDescriptor(Set<Boolean> values) implements KindDescriptor {

  public static final BooleanDescriptor ANY = new BooleanDescriptor(Set.of(Boolean.TRUE, Boolean.FALSE));

  public BooleanDescriptor {
    values = Set.copyOf(values);
    if (values.isEmpty()) {
      throw new IllegalArgumentException("empty boolean descriptor");
    }
  }

  public static Optional<BooleanDescriptor> of(Set<Boolean> values) {
    return values.isEmpty() ? Optional.empty() : Optional.of(new BooleanDescriptor(values));
  }

  @Override
  public JsonKind kind() {
    return JsonKind.BOOLEAN;
  }

  @Override
  public boolean isUnconstrained() {
    return values.size() == 2;
  }
}
