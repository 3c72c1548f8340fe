package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;

import java.util.Locale;
import java.util.Optional;

/// `format` values with a regular-language reading. Other formats cannot be compared and
/// are rejected by the canonicalizer.
enum Format {
  DATE(Format.DATE_PART),
  TIME(Format.TIME_PART),
  DATE_TIME(Format.DATE_PART + "[Tt]" + Format.TIME_PART),
  EMAIL("[A-Za-z0-9.!#$%&'*+/=?^_`{|}~-]+@" + Format.LABEL + "(?:\\." + Format.LABEL + ")*"),
  IPV4("(?:" + Format.OCTET + "\\.){3}" + Format.OCTET),
  UUID("[0-9A-Fa-f]{8}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{12}"),
  HOSTNAME(Format.LABEL + "(?:\\." + Format.LABEL + ")*");

  private static final String DATE_PART = "\\d{4}-(?:0[1-9]|1[0-2])-(?:0[1-9]|[12]\\d|3[01])";
  private static final String TIME_PART =
      "(?:[01]\\d|2[0-3]):[0-5]\\d:(?:[0-5]\\d|60)(?:\\.\\d+)?(?:[Zz]|[+-](?:[01]\\d|2[0-3]):[0-5]\\d)";
  private static final String LABEL = "[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?";
  private static final String OCTET = "(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";

  private final String body;

  Format(String body) {
    this.body = body;
  }

  /// Anchored ECMA pattern for this format.
  String pattern() {
    return "^" + body + "$";
  }

  /// A fresh automaton for this format's language.
  Automaton language() {
    return PatternCompiler.compile(pattern());
  }

  /// Format for a `format` keyword value such as `date-time`.
  static Optional<Format> byName(String name) {
    for (Format format : values()) {
      if (format.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(name)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
