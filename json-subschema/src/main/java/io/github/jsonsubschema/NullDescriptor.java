package io.github.jsonsubschema;

/// The `null` value.
public record NullDescriptor() implements KindDescriptor {

  public static final NullDescriptor INSTANCE = new NullDescriptor();

  @Override
  public JsonKind kind() {
    return JsonKind.NULL;
  }

  @Override
  public boolean isUnconstrained() {
    return true;
  }
}
