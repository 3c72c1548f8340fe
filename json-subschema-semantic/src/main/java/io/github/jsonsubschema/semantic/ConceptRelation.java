package io.github.jsonsubschema.semantic;

import org.apache.jena.rdf.model.Property;
import org.apache.jena.vocabulary.RDFS;
import org.apache.jena.vocabulary.SKOS;

/// The two relations a concept hierarchy is built from. Both are treated as
/// transitive and they compose: a path may mix broader and subclass edges.
public enum ConceptRelation {
  BROADER(SKOS.broader),
  SUBCLASS_OF(RDFS.subClassOf);

  private final Property property;

  ConceptRelation(Property property) {
    this.property = property;
  }

  Property property() {
    return property;
  }

  public String iri() {
    return property.getURI();
  }
}
