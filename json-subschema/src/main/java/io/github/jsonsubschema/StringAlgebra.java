package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;

import java.util.Optional;

/// Regular-language operations for [StringDescriptor]. Containment is decided on automata,
/// never by sampling.
final class StringAlgebra {

  private StringAlgebra() {}

  static boolean isSubtype(StringDescriptor a, StringDescriptor b) {
    return a.effectiveLanguage().subsetOf(b.effectiveLanguage());
  }

  static Optional<StringDescriptor> meet(StringDescriptor a, StringDescriptor b) {
    return StringDescriptor.of(a.length().intersect(b.length()), a.language().intersection(b.language()));
  }

  /// Union of the accepted languages; exact.
  static StringDescriptor join(StringDescriptor a, StringDescriptor b) {
    Automaton union = a.effectiveLanguage().union(b.effectiveLanguage());
    return new StringDescriptor(a.length().hull(b.length()), union);
  }

  static Optional<StringDescriptor> complement(StringDescriptor d) {
    if (d.isUnconstrained()) {
      return Optional.empty();
    }
    return StringDescriptor.of(SizeRange.ANY, d.effectiveLanguage().complement());
  }
}
