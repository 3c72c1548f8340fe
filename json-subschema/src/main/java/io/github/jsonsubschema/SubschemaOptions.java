package io.github.jsonsubschema;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;

/// Settings for one [SubschemaContext]. Nothing is read from the environment.
///
/// @param semanticReasoning compare `stype` annotations against the concept hierarchy
/// @param debug log diagnostics at INFO instead of FINE
/// @param warnUninhabited log a WARNING for every subschema that accepts no value
/// @param semanticCacheDir directory for Turtle copies of fetched ontologies, or null
/// @param semanticGraphSources extra RDF documents loaded into the concept graph
/// @param lazyLoad fetch a concept's namespace the first time it is queried
public record SubschemaOptions(
    boolean semanticReasoning,
    boolean debug,
    boolean warnUninhabited,
    Path semanticCacheDir,
    List<String> semanticGraphSources,
    boolean lazyLoad
) {
  public static final SubschemaOptions DEFAULT = new SubschemaOptions(true, false, false, null, List.of(), false);

  public SubschemaOptions {
    Objects.requireNonNull(semanticGraphSources, "semanticGraphSources");
    semanticGraphSources = List.copyOf(new LinkedHashSet<>(semanticGraphSources));
  }

  public SubschemaOptions withSemanticReasoning(boolean enabled) {
    return new SubschemaOptions(enabled, debug, warnUninhabited, semanticCacheDir, semanticGraphSources, lazyLoad);
  }

  public SubschemaOptions withDebug(boolean enabled) {
    return new SubschemaOptions(semanticReasoning, enabled, warnUninhabited, semanticCacheDir, semanticGraphSources, lazyLoad);
  }

  public SubschemaOptions withWarnUninhabited(boolean enabled) {
    return new SubschemaOptions(semanticReasoning, debug, enabled, semanticCacheDir, semanticGraphSources, lazyLoad);
  }

  public SubschemaOptions withSemanticCacheDir(Path directory) {
    return new SubschemaOptions(semanticReasoning, debug, warnUninhabited, directory, semanticGraphSources, lazyLoad);
  }

  public SubschemaOptions withSemanticGraphSources(List<String> sources) {
    return new SubschemaOptions(semanticReasoning, debug, warnUninhabited, semanticCacheDir, sources, lazyLoad);
  }

  /// Appends one source; a source already present keeps its position.
  public SubschemaOptions withSemanticGraphSource(String source) {
    Objects.requireNonNull(source, "source");
    List<String> sources = new ArrayList<>(semanticGraphSources);
    sources.add(source);
    return withSemanticGraphSources(sources);
  }

  public SubschemaOptions withLazyLoad(boolean enabled) {
    return new SubschemaOptions(semanticReasoning, debug, warnUninhabited, semanticCacheDir, semanticGraphSources, enabled);
  }

  /// Level for decision diagnostics.
  Level diagnosticLevel() {
    return debug ? Level.INFO : Level.FINE;
  }

  String summary() {
    return "semanticReasoning=" + semanticReasoning + " debug=" + debug + " warnUninhabited=" + warnUninhabited
        + " cacheDir=" + semanticCacheDir + " sources=" + semanticGraphSources.size() + " lazyLoad=" + lazyLoad;
  }
}
