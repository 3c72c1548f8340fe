package io.github.jsonsubschema.semantic;

/// Raised by a [ConceptGraph] that cannot evaluate a query.
public final class ConceptGraphException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConceptGraphException(String message) {
    super(message);
  }

  public ConceptGraphException(String message, Throwable cause) {
    super(message, cause);
  }
}
