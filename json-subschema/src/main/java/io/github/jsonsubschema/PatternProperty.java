package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;

import java.util.Objects;

/// A `patternProperties` entry: the ECMA source, the member names it matches and
/// the schema those members must satisfy.
public record PatternProperty(String source, Automaton names, CanonicalSchema schema) {

  public PatternProperty {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(names, "names");
    Objects.requireNonNull(schema, "schema");
  }

  public boolean matches(String name) {
    return names.run(name);
  }
}
