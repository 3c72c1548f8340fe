package io.github.jsonsubschema.semantic;

import org.apache.jena.atlas.RuntimeIOException;
import org.apache.jena.atlas.web.HttpException;
import org.apache.jena.query.ParameterizedSparqlString;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.NodeIterator;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RiotException;
import org.apache.jena.riot.RiotNotFoundException;
import org.apache.jena.shared.JenaException;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static io.github.jsonsubschema.semantic.SemanticLogging.LOG;

/// [ConceptGraph] backed by an Apache Jena [Model].
///
/// Path queries are answered with a SPARQL 1.1 property path over
/// `skos:broader` and `rdfs:subClassOf`.
public final class JenaConceptGraph implements ConceptGraph {

  private static final String PATH_QUERY =
      "ASK { ?narrower (<" + ConceptRelation.BROADER.iri() + ">|<"
          + ConceptRelation.SUBCLASS_OF.iri() + ">)+ ?broader }";

  private final Model model;

  private JenaConceptGraph(Model model) {
    this.model = Objects.requireNonNull(model, "model");
  }

  /// An empty in-memory graph.
  public static JenaConceptGraph empty() {
    return new JenaConceptGraph(ModelFactory.createDefaultModel());
  }

  /// Wraps a pre-populated model. The model is used directly, not copied.
  public static JenaConceptGraph wrap(Model model) {
    return new JenaConceptGraph(model);
  }

  public Model model() {
    return model;
  }

  @Override
  public Set<String> broaderConcepts(String iri) {
    Resource subject = model.createResource(iri);
    Set<String> result = new LinkedHashSet<>();
    for (ConceptRelation relation : ConceptRelation.values()) {
      NodeIterator objects = model.listObjectsOfProperty(subject, relation.property());
      try {
        while (objects.hasNext()) {
          RDFNode node = objects.next();
          if (node.isURIResource()) {
            result.add(node.asResource().getURI());
          }
        }
      } finally {
        objects.close();
      }
    }
    return result;
  }

  @Override
  public boolean hasPath(String narrower, String broader) {
    try {
      ParameterizedSparqlString query = new ParameterizedSparqlString(PATH_QUERY);
      query.setIri("narrower", narrower);
      query.setIri("broader", broader);
      try (QueryExecution execution = QueryExecutionFactory.create(query.asQuery(), model)) {
        return execution.execAsk();
      }
    } catch (JenaException e) {
      throw new ConceptGraphException("path query failed for <" + narrower + "> <" + broader + ">", e);
    }
  }

  @Override
  public void addRelation(String narrower, ConceptRelation relation, String broader) {
    model.add(model.createResource(narrower), relation.property(), model.createResource(broader));
  }

  @Override
  public long read(String location) {
    Objects.requireNonNull(location, "location");
    // parse into a scratch model so a failing document leaves no partial triples behind
    Model scratch = ModelFactory.createDefaultModel();
    try {
      RDFDataMgr.read(scratch, location);
    } catch (RiotNotFoundException e) {
      throw new GraphLoadException(location, GraphLoadException.Reason.NOT_FOUND, e.getMessage(), e);
    } catch (HttpException | RuntimeIOException e) {
      throw new GraphLoadException(location, GraphLoadException.Reason.NETWORK_ERROR, e.getMessage(), e);
    } catch (RiotException e) {
      throw new GraphLoadException(location, GraphLoadException.Reason.PARSE_ERROR, e.getMessage(), e);
    }
    long before = model.size();
    model.add(scratch);
    long added = model.size() - before;
    LOG.finer(() -> "JenaConceptGraph.read location=" + location + " added=" + added);
    return added;
  }

  @Override
  public long size() {
    return model.size();
  }
}
