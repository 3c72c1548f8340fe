package io.github.jsonsubschema;

import java.util.logging.Logger;

/// Centralized logger for canonicalization and the schema algebra.
/// All classes must use this logger via:
///   import static io.github.jsonsubschema.SubschemaLogging.LOG;
final class SubschemaLogging {
  public static final Logger LOG = Logger.getLogger("io.github.jsonsubschema");
  private SubschemaLogging() {}
}
