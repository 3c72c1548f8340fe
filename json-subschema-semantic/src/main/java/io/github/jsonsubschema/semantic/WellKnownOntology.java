package io.github.jsonsubschema.semantic;

import java.util.Locale;
import java.util.Optional;

/// Ontologies that can be requested by name instead of by location.
public enum WellKnownOntology {
  QUDT("https://qudt.org/vocab/quantitykind/"),
  FOAF("http://xmlns.com/foaf/0.1/"),
  SKOS("http://www.w3.org/2004/02/skos/core#");

  private final String location;

  WellKnownOntology(String location) {
    this.location = location;
  }

  public String location() {
    return location;
  }

  /// Case-insensitive lookup, e.g. `"foaf"`.
  public static Optional<WellKnownOntology> named(String name) {
    if (name == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
