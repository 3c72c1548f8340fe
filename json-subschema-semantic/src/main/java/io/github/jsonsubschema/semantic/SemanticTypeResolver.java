package io.github.jsonsubschema.semantic;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static io.github.jsonsubschema.semantic.SemanticLogging.LOG;

/// Answers "is concept A the same as or narrower than concept B" over a [ConceptGraph].
///
/// ## States
/// - [State#UNINITIALIZED]: no graph, every query degrades to identity after normalization
/// - [State#READY]: a graph is present, whether it answers transitive path queries is unknown
/// - [State#TESTED]: the first query has recorded whether path queries work
///
/// Every resolved pair is memoized. Anything that adds triples to the graph clears the
/// memo and the path-query flag, returning the resolver to [State#READY].
///
/// Instances are safe to share between threads; queries and mutations run under one lock.
public final class SemanticTypeResolver {

  public enum State {
    UNINITIALIZED,
    READY,
    TESTED
  }

  /// Memo key, both members normalized.
  record ConceptPair(String narrower, String broader) {}

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<ConceptPair, Boolean> cache = new HashMap<>();
  private final Set<String> fetchedNamespaces = new HashSet<>();
  private final OntologyLoader loader;
  private final boolean lazyLoad;

  private ConceptGraph graph;
  private Boolean pathQueriesSupported;

  private SemanticTypeResolver(ConceptGraph graph, OntologyLoader loader, boolean lazyLoad) {
    this.graph = graph;
    this.loader = Objects.requireNonNull(loader, "loader");
    this.lazyLoad = lazyLoad;
  }

  /// A resolver without a graph: only identical concepts are related.
  public static SemanticTypeResolver uninitialized() {
    return new SemanticTypeResolver(null, OntologyLoader.direct(), false);
  }

  /// A resolver over an already populated graph.
  public static SemanticTypeResolver over(ConceptGraph graph) {
    return builder().graph(graph).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /// True when `narrower` equals `broader` after normalization, or `broader` is reachable
  /// from `narrower` through `skos:broader`/`rdfs:subClassOf` edges.
  public boolean isSubtypeOf(String narrower, String broader) {
    Objects.requireNonNull(narrower, "narrower");
    Objects.requireNonNull(broader, "broader");
    final String n = ConceptIri.normalize(narrower);
    final String b = ConceptIri.normalize(broader);
    if (n.equals(b)) {
      return true;
    }
    lock.lock();
    try {
      if (graph == null) {
        LOG.finer(() -> "resolver.identity narrower=" + n + " broader=" + b);
        return false;
      }
      if (lazyLoad) {
        fetchNamespaceOf(n);
        fetchNamespaceOf(b);
      }
      final ConceptPair key = new ConceptPair(n, b);
      Boolean cached = cache.get(key);
      if (cached != null) {
        LOG.finer(() -> "resolver.cacheHit " + key + " -> " + cached);
        return cached;
      }
      boolean result = reachable(n, b);
      cache.put(key, result);
      StructuredLog.fine(LOG, "resolver.query", "narrower", n, "broader", b, "result", result);
      return result;
    } finally {
      lock.unlock();
    }
  }

  /// Both directions of [#isSubtypeOf(String, String)].
  public boolean isEquivalent(String first, String second) {
    return isSubtypeOf(first, second) && isSubtypeOf(second, first);
  }

  /// Adds `narrower skos:broader broader`.
  public void addRelationship(String narrower, String broader) {
    addRelationship(narrower, ConceptRelation.BROADER, broader);
  }

  public void addRelationship(String narrower, ConceptRelation relation, String broader) {
    Objects.requireNonNull(relation, "relation");
    final String n = ConceptIri.normalize(Objects.requireNonNull(narrower, "narrower"));
    final String b = ConceptIri.normalize(Objects.requireNonNull(broader, "broader"));
    lock.lock();
    try {
      ensureGraph().addRelation(n, relation, b);
      invalidate("relationship");
      StructuredLog.fine(LOG, "resolver.relation", "narrower", n, "relation", relation, "broader", b);
    } finally {
      lock.unlock();
    }
  }

  /// Merges the ontology at `location` into the graph. Failures are logged, never thrown.
  /// @return the number of triples added
  public long load(String location) {
    Objects.requireNonNull(location, "location");
    lock.lock();
    try {
      return loadLocked(location);
    } finally {
      lock.unlock();
    }
  }

  public State state() {
    lock.lock();
    try {
      if (graph == null) {
        return State.UNINITIALIZED;
      }
      return pathQueriesSupported == null ? State.READY : State.TESTED;
    } finally {
      lock.unlock();
    }
  }

  /// Number of memoized pairs.
  public int cachedPairs() {
    lock.lock();
    try {
      return cache.size();
    } finally {
      lock.unlock();
    }
  }

  /// Namespaces already handed to the loader, successfully or not, keyed by
  /// `ConceptIri.namespaceKey`.
  public Set<String> fetchedNamespaces() {
    lock.lock();
    try {
      return Set.copyOf(fetchedNamespaces);
    } finally {
      lock.unlock();
    }
  }

  public boolean lazyLoad() {
    return lazyLoad;
  }

  private long loadLocked(String location) {
    ConceptGraph target = ensureGraph();
    fetchedNamespaces.add(ConceptIri.namespaceKey(location));
    long added = loader.load(target, location);
    if (added > 0) {
      invalidate("load");
    }
    return added;
  }

  private void fetchNamespaceOf(String iri) {
    if (!ConceptIri.isDereferenceable(iri)) {
      return;
    }
    String namespace = ConceptIri.namespaceOf(iri);
    if (fetchedNamespaces.contains(ConceptIri.namespaceKey(namespace))) {
      return;
    }
    StructuredLog.info(LOG, "resolver.lazyFetch", "namespace", namespace);
    loadLocked(namespace);
  }

  private ConceptGraph ensureGraph() {
    if (graph == null) {
      graph = JenaConceptGraph.empty();
      LOG.fine(() -> "resolver.graph created empty graph");
    }
    return graph;
  }

  private void invalidate(String cause) {
    int dropped = cache.size();
    cache.clear();
    pathQueriesSupported = null;
    StructuredLog.finer(LOG, "resolver.invalidate", "cause", cause, "dropped", dropped);
  }

  private boolean reachable(String narrower, String broader) {
    if (!Boolean.FALSE.equals(pathQueriesSupported)) {
      try {
        boolean result = graph.hasPath(narrower, broader);
        if (pathQueriesSupported == null) {
          pathQueriesSupported = Boolean.TRUE;
          LOG.fine(() -> "resolver.pathQueries supported");
        }
        return result;
      } catch (ConceptGraphException | UnsupportedOperationException e) {
        if (pathQueriesSupported == null) {
          pathQueriesSupported = Boolean.FALSE;
          StructuredLog.fine(LOG, "resolver.pathQueries", "supported", false, "error", e.getMessage());
        } else {
          StructuredLog.warning(LOG, "resolver.pathQueryFailed", "narrower", narrower,
              "broader", broader, "error", e.getMessage());
        }
      }
    }
    return traverse(narrower, broader);
  }

  /// Breadth-first search over direct broader edges; the seen-set bounds cyclic data.
  private boolean traverse(String narrower, String broader) {
    Set<String> seen = new HashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(narrower);
    while (!queue.isEmpty()) {
      String current = queue.removeFirst();
      if (!seen.add(current)) {
        continue;
      }
      for (String next : graph.broaderConcepts(current)) {
        if (next.equals(broader)) {
          LOG.finer(() -> "resolver.traverse found " + narrower + " -> " + broader + " visited=" + seen.size());
          return true;
        }
        if (!seen.contains(next)) {
          queue.addLast(next);
        }
      }
    }
    LOG.finer(() -> "resolver.traverse none " + narrower + " -> " + broader + " visited=" + seen.size());
    return false;
  }

  /// Assembles a resolver from a graph, ontologies and loading policy.
  public static final class Builder {
    private ConceptGraph graph;
    private final Set<String> locations = new LinkedHashSet<>();
    private boolean lazyLoad;
    private Path cacheDir;
    private OntologyLoader loader;

    private Builder() {}

    /// Pre-populated graph; further ontologies are merged into it.
    public Builder graph(ConceptGraph graph) {
      this.graph = Objects.requireNonNull(graph, "graph");
      return this;
    }

    public Builder ontologies(WellKnownOntology... ontologies) {
      Arrays.stream(ontologies).map(WellKnownOntology::location).forEach(locations::add);
      return this;
    }

    /// RDF document locations: URLs, `file:` URIs or local paths.
    public Builder locations(Iterable<String> locations) {
      for (String location : locations) {
        this.locations.add(Objects.requireNonNull(location, "location"));
      }
      return this;
    }

    public Builder location(String location) {
      locations.add(Objects.requireNonNull(location, "location"));
      return this;
    }

    /// Fetch the namespace of a concept the first time a query mentions it.
    public Builder lazyLoad(boolean lazyLoad) {
      this.lazyLoad = lazyLoad;
      return this;
    }

    /// Directory holding Turtle copies of fetched documents. Ignored when a loader is set.
    public Builder cacheDir(Path cacheDir) {
      this.cacheDir = cacheDir;
      return this;
    }

    public Builder loader(OntologyLoader loader) {
      this.loader = Objects.requireNonNull(loader, "loader");
      return this;
    }

    public SemanticTypeResolver build() {
      OntologyLoader effectiveLoader = loader != null ? loader : OntologyLoader.standard(cacheDir);
      ConceptGraph effectiveGraph = graph;
      if (effectiveGraph == null && (lazyLoad || !locations.isEmpty())) {
        effectiveGraph = JenaConceptGraph.empty();
      }
      SemanticTypeResolver resolver = new SemanticTypeResolver(effectiveGraph, effectiveLoader, lazyLoad);
      for (String location : locations) {
        resolver.load(location);
      }
      StructuredLog.info(LOG, "resolver.built", "state", resolver.state(), "sources", locations.size(),
          "lazy", lazyLoad);
      return resolver;
    }
  }
}
