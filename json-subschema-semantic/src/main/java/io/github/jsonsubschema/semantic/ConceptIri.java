package io.github.jsonsubschema.semantic;

import java.util.Map;

/// Normalization of semantic type identifiers.
///
/// An `stype` value is either a full IRI or a compact `prefix:local` name.
/// Compact names whose prefix appears in the fixed table are expanded;
/// everything else passes through unchanged so that unknown identifiers
/// still compare equal to themselves.
public final class ConceptIri {

  /// Compact prefix to namespace IRI.
  public static final Map<String, String> PREFIXES = Map.of(
      "quantitykind", "http://qudt.org/vocab/quantitykind/",
      "qudt", "http://qudt.org/schema/qudt/",
      "skos", "http://www.w3.org/2004/02/skos/core#",
      "foaf", "http://xmlns.com/foaf/0.1/",
      "ex", "http://example.org/",
      "rdfs", "http://www.w3.org/2000/01/rdf-schema#"
  );

  private ConceptIri() {}

  /// Expands a compact identifier against [#PREFIXES].
  /// @param stype the raw annotation value, may be null
  /// @return the full IRI, or the input when it cannot be expanded
  public static String normalize(String stype) {
    if (stype == null || stype.isEmpty()) {
      return stype;
    }
    if (stype.startsWith("http://") || stype.startsWith("https://")) {
      return stype;
    }
    int colon = stype.indexOf(':');
    if (colon <= 0) {
      return stype;
    }
    String namespace = PREFIXES.get(stype.substring(0, colon));
    return namespace == null ? stype : namespace + stype.substring(colon + 1);
  }

  /// Namespace of a full IRI: everything up to and including the last `#` or `/`.
  /// Returns the IRI itself when it has neither.
  public static String namespaceOf(String iri) {
    int cut = Math.max(iri.lastIndexOf('#'), iri.lastIndexOf('/'));
    return cut < 0 ? iri : iri.substring(0, cut + 1);
  }

  /// Key under which a fetched namespace is remembered. Compact names are expanded and
  /// `https` folds to `http`, so a document loaded from either scheme covers both.
  static String namespaceKey(String location) {
    String namespace = namespaceOf(normalize(location));
    return namespace.startsWith("https://") ? "http://" + namespace.substring("https://".length()) : namespace;
  }

  /// True for identifiers that can be dereferenced over the network.
  static boolean isDereferenceable(String iri) {
    return iri.startsWith("http://") || iri.startsWith("https://");
  }
}
