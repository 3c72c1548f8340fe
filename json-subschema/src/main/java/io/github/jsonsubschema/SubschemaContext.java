package io.github.jsonsubschema;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.jsonsubschema.semantic.SemanticCompatibility;
import io.github.jsonsubschema.semantic.SemanticTypeResolver;

import java.util.Objects;
import java.util.function.Predicate;

import static io.github.jsonsubschema.SubschemaLogging.LOG;

/// Options plus the concept resolver they were built with. Contexts share no state, so
/// two contexts with different graphs can be used side by side.
public record SubschemaContext(SubschemaOptions options, SemanticTypeResolver resolver) {

  public SubschemaContext {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(resolver, "resolver");
  }

  /// Builds a resolver from the options. Without graph sources and lazy loading, or with
  /// semantic reasoning disabled, the resolver compares concepts by identity only.
  public static SubschemaContext create(SubschemaOptions options) {
    Objects.requireNonNull(options, "options");
    LOG.fine(() -> "SubschemaContext.create " + options.summary());
    if (!options.semanticReasoning()
        || (options.semanticGraphSources().isEmpty() && !options.lazyLoad())) {
      return new SubschemaContext(options, SemanticTypeResolver.uninitialized());
    }
    SemanticTypeResolver resolver = SemanticTypeResolver.builder()
        .locations(options.semanticGraphSources())
        .lazyLoad(options.lazyLoad())
        .cacheDir(options.semanticCacheDir())
        .build();
    return new SubschemaContext(options, resolver);
  }

  public static SubschemaContext of(SubschemaOptions options, SemanticTypeResolver resolver) {
    return new SubschemaContext(options, resolver);
  }

  public static SubschemaContext defaults() {
    return create(SubschemaOptions.DEFAULT);
  }

  SemanticCompatibility compatibility(Predicate<JsonNode> empty) {
    return new SemanticCompatibility(resolver, empty);
  }

  SchemaAlgebra algebra() {
    AnnotationLattice lattice = options.semanticReasoning()
        ? new SemanticAnnotationLattice(resolver, options.diagnosticLevel())
        : AnnotationLattice.ignoring();
    return new SchemaAlgebra(lattice);
  }
}
