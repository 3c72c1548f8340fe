package io.github.jsonsubschema;

import com.fasterxml.jackson.databind.JsonNode;

/// Raised when a schema tree revisits one of its own ancestors, or nests deeper than
/// [Canonicalizer#MAX_DEPTH].
///
/// The offending subtree is kept by reference and never rendered: printing a cyclic
/// Jackson tree does not terminate.
public final class UnsupportedRecursiveRefException extends UnsupportedSchemaException {

  private static final long serialVersionUID = 1L;

  private final transient JsonNode subtree;

  UnsupportedRecursiveRefException(Side side, String pointer, JsonNode subtree, String reason) {
    super(side, pointer, reason);
    this.subtree = subtree;
  }

  /// The subschema at which recursion was detected.
  public JsonNode subtree() {
    return subtree;
  }
}
