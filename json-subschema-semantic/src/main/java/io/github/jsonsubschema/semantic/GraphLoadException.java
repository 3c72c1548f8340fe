package io.github.jsonsubschema.semantic;

import java.util.Objects;

/// Exception signalling that an ontology document could not be merged into a graph
public final class GraphLoadException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String location;
  private final Reason reason;

  GraphLoadException(String location, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.location = Objects.requireNonNull(location, "location");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public String location() {
    return location;
  }

  public Reason reason() {
    return reason;
  }

  public enum Reason {
    NOT_FOUND,
    NETWORK_ERROR,
    PARSE_ERROR,
    CACHE_ERROR
  }
}
