package io.github.jsonsubschema.semantic;

import java.util.Set;

/// Reachability oracle over a concept hierarchy.
///
/// Implementations are not required to be thread-safe; [SemanticTypeResolver]
/// serializes every access.
public interface ConceptGraph {

  /// Direct broader concepts of `iri` over every [ConceptRelation].
  Set<String> broaderConcepts(String iri);

  /// Whether `broader` is reachable from `narrower` through one or more edges.
  /// @throws ConceptGraphException when the backend cannot answer path queries
  boolean hasPath(String narrower, String broader);

  /// Adds one edge `narrower --relation--> broader`.
  void addRelation(String narrower, ConceptRelation relation, String broader);

  /// Merges the RDF document at `location` into this graph.
  /// @return the number of triples the graph gained
  /// @throws GraphLoadException when the document cannot be fetched or parsed
  long read(String location);

  /// Number of triples currently held.
  long size();
}
