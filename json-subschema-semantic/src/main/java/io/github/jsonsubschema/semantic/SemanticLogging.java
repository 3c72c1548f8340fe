package io.github.jsonsubschema.semantic;

import java.util.logging.Logger;

/// Centralized logger for the semantic type subsystem.
/// All classes must use this logger via:
///   import static io.github.jsonsubschema.semantic.SemanticLogging.LOG;
final class SemanticLogging {
  static final Logger LOG = Logger.getLogger("io.github.jsonsubschema.semantic");
  private SemanticLogging() {}
}
