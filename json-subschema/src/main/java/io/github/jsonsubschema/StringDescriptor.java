package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;

import java.util.Objects;
import java.util.Optional;

/// Strings in a regular language and a length range.
///
/// `language` comes from `pattern` and `format` (always intersected within one atom).
/// The accepted set is [#effectiveLanguage()], the language cut to the length range.
/// Automata are treated as values: nothing here mutates one after construction.
public record StringDescriptor(SizeRange length, Automaton language) implements KindDescriptor {

  public StringDescriptor {
    Objects.requireNonNull(length, "length");
    Objects.requireNonNull(language, "language");
  }

  public static StringDescriptor any() {
    return new StringDescriptor(SizeRange.ANY, Automaton.makeAnyString());
  }

  public static StringDescriptor literal(String value) {
    return new StringDescriptor(SizeRange.ANY, Automaton.makeString(value));
  }

  /// Empty when no string satisfies both constraints.
  public static Optional<StringDescriptor> of(SizeRange length, Automaton language) {
    if (length.isEmpty()) {
      return Optional.empty();
    }
    StringDescriptor candidate = new StringDescriptor(length, language);
    return isEmptyLanguage(candidate.effectiveLanguage()) ? Optional.empty() : Optional.of(candidate);
  }

  @Override
  public JsonKind kind() {
    return JsonKind.STRING;
  }

  @Override
  public boolean isUnconstrained() {
    return length.isUnconstrained() && isTotalLanguage(language);
  }

  public Automaton effectiveLanguage() {
    if (length.isUnconstrained()) {
      return language;
    }
    return language.intersection(lengthLanguage(length));
  }

  static boolean isEmptyLanguage(Automaton language) {
    return language.getShortestExample(true) == null;
  }

  /// Independent of how minimal `language` is, unlike [Automaton#isTotal()].
  static boolean isTotalLanguage(Automaton language) {
    return Automaton.makeAnyString().subsetOf(language);
  }

  static Automaton lengthLanguage(SizeRange length) {
    Automaton anyChar = Automaton.makeAnyChar();
    return length.max() == null ? anyChar.repeat(length.min()) : anyChar.repeat(length.min(), length.max());
  }
}
