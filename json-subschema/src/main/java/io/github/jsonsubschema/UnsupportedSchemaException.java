package io.github.jsonsubschema;

/// Exception signalling a schema that cannot be canonicalized: malformed keyword values,
/// unsupported keywords or regular expressions, or a negation with no single-atom form.
public class UnsupportedSchemaException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final Side side;
  private final String pointer;
  private final String reason;

  public UnsupportedSchemaException(Side side, String pointer, String reason) {
    this(side, pointer, reason, null);
  }

  public UnsupportedSchemaException(Side side, String pointer, String reason, Throwable cause) {
    super(render(side, pointer, reason), cause);
    this.side = side;
    this.pointer = pointer;
    this.reason = reason;
  }

  /// Location-free failure raised below the canonicalizer; see [#locate].
  UnsupportedSchemaException(String reason) {
    this(null, null, reason, null);
  }

  /// The operand that failed, or null when the failure is not tied to one.
  public Side side() {
    return side;
  }

  /// JSON pointer of the offending subschema, or null when unknown.
  public String pointer() {
    return pointer;
  }

  /// The message without the location prefix.
  public String reason() {
    return reason;
  }

  /// Same failure attributed to `side` at `pointer`, unless already attributed.
  UnsupportedSchemaException locate(Side side, String pointer) {
    if (this.pointer != null) {
      return this;
    }
    return new UnsupportedSchemaException(side, pointer, reason, this);
  }

  private static String render(Side side, String pointer, String reason) {
    if (side == null && pointer == null) {
      return reason;
    }
    StringBuilder sb = new StringBuilder();
    if (side != null) {
      sb.append(side);
    }
    if (pointer != null) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(pointer.isEmpty() ? "#" : pointer);
    }
    return sb.append(": ").append(reason).toString();
  }
}
