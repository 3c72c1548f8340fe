package io.github.jsonsubschema.semantic;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.shared.JenaException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import static io.github.jsonsubschema.semantic.SemanticLogging.LOG;

/// Strategy for merging an ontology document into a [ConceptGraph].
///
/// Loading never fails the caller: a document that cannot be fetched or parsed
/// is logged and counted as zero triples.
@FunctionalInterface
public interface OntologyLoader {

  /// @return the number of triples the graph gained
  long load(ConceptGraph graph, String location);

  /// Reads every location straight from its source.
  static OntologyLoader direct() {
    return new RdfOntologyLoader(null);
  }

  /// Keeps a Turtle copy of each remote document in `cacheDir` and reads from it
  /// on later loads.
  static OntologyLoader cached(Path cacheDir) {
    return new RdfOntologyLoader(Objects.requireNonNull(cacheDir, "cacheDir"));
  }

  /// Default loader: reads through `cacheDir` when one is given, directly otherwise.
  static OntologyLoader standard(Path cacheDir) {
    return cacheDir == null ? direct() : cached(cacheDir);
  }

  /// Loader over RDF documents; `cacheDir` may be null.
  record RdfOntologyLoader(Path cacheDir) implements OntologyLoader {

    @Override
    public long load(ConceptGraph graph, String location) {
      Objects.requireNonNull(graph, "graph");
      Objects.requireNonNull(location, "location");
      StructuredLog.info(LOG, "ontology.load", "location", location, "cached", cacheDir != null);
      try {
        long added = graph.read(resolve(location));
        StructuredLog.info(LOG, "ontology.loaded", "location", location, "triples", added);
        return added;
      } catch (GraphLoadException e) {
        StructuredLog.warning(LOG, "ontology.failed", "location", e.location(),
            "reason", e.reason(), "message", e.getMessage());
        return 0L;
      }
    }

    /// Returns the location to read from, populating the cache on a miss.
    private String resolve(String location) {
      if (cacheDir == null || !ConceptIri.isDereferenceable(location)) {
        return location;
      }
      Path cached = cacheDir.resolve(Sha256.hex(location) + ".ttl");
      if (Files.isRegularFile(cached)) {
        LOG.fine(() -> "ontology cache hit location=" + location + " file=" + cached);
        return cached.toUri().toString();
      }
      Model remote = ModelFactory.createDefaultModel();
      try {
        RDFDataMgr.read(remote, location);
      } catch (JenaException e) {
        // let the graph classify the failure on its own read
        LOG.fine(() -> "ontology cache fill skipped location=" + location + " error=" + e.getMessage());
        return location;
      }
      try {
        Files.createDirectories(cacheDir);
        Path partial = Files.createTempFile(cacheDir, "ontology", ".ttl.part");
        try (OutputStream out = Files.newOutputStream(partial)) {
          RDFDataMgr.write(out, remote, Lang.TURTLE);
        }
        Files.move(partial, cached, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.fine(() -> "ontology cached location=" + location + " file=" + cached);
        return cached.toUri().toString();
      } catch (IOException e) {
        throw new GraphLoadException(location, GraphLoadException.Reason.CACHE_ERROR,
            "cannot write ontology cache " + cached + ": " + e.getMessage(), e);
      }
    }
  }
}
