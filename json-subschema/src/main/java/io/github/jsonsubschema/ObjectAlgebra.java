package io.github.jsonsubschema;

import dk.brics.automaton.Automaton;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BinaryOperator;

import static io.github.jsonsubschema.SubschemaLogging.LOG;

/// Member-wise comparison of [ObjectDescriptor]s.
///
/// Names declared on either side are compared one by one. Every other name falls into a
/// region: the set of names matched by exactly the same pattern properties on both sides.
/// Regions are enumerated by splitting the undeclared names with each pattern automaton
/// and dropping empty pieces; the region matched by no pattern compares
/// `additionalProperties`. Meet and join write regions back as disjoint pattern
/// properties that exclude every declared name.
final class ObjectAlgebra {

  /// A set of undeclared member names and the patterns of each side that match all of them.
  record Region(Automaton names, BitSet left, BitSet right) {
    boolean matchedByAny() {
      return !left.isEmpty() || !right.isEmpty();
    }
  }

  private final SchemaAlgebra algebra;

  ObjectAlgebra(SchemaAlgebra algebra) {
    this.algebra = algebra;
  }

  /// Schema the member `name` must satisfy.
  CanonicalSchema schemaFor(ObjectDescriptor d, String name) {
    CanonicalSchema result = d.properties().get(name);
    for (PatternProperty pattern : d.patternProperties()) {
      if (pattern.matches(name)) {
        result = result == null ? pattern.schema() : algebra.meet(result, pattern.schema());
      }
    }
    return result == null ? d.additionalProperties() : result;
  }

  /// Raises the minimum member count to the required names, caps a closed object at its
  /// declared names, and rejects a required name whose schema is Bottom.
  Optional<ObjectDescriptor> normalize(ObjectDescriptor d) {
    for (String name : d.required()) {
      if (schemaFor(d, name).isBottom()) {
        LOG.finer(() -> "ObjectAlgebra.normalize required member '" + name + "' is uninhabited");
        return Optional.empty();
      }
    }
    SizeRange count = d.propertyCount().atLeast(d.required().size());
    if (d.isClosed()) {
      int allowed = (int) d.properties().values().stream().filter(s -> !s.isBottom()).count();
      count = count.atMost(allowed);
    }
    if (count.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new ObjectDescriptor(d.properties(), d.required(), d.patternProperties(),
        d.additionalProperties(), count));
  }

  boolean isSubtype(ObjectDescriptor a, ObjectDescriptor b) {
    if (!b.propertyCount().contains(a.propertyCount())) {
      return false;
    }
    if (!a.required().containsAll(b.required())) {
      return false;
    }
    Set<String> names = new TreeSet<>();
    names.addAll(a.properties().keySet());
    names.addAll(b.properties().keySet());
    names.addAll(a.required());
    names.addAll(b.required());
    for (String name : names) {
      CanonicalSchema left = schemaFor(a, name);
      if (!left.isBottom() && !algebra.isSubtype(left, schemaFor(b, name))) {
        LOG.finer(() -> "ObjectAlgebra.isSubtype member '" + name + "' is not contained");
        return false;
      }
    }
    for (Region region : regions(a, b, names)) {
      CanonicalSchema left = regionSchema(a, region.left());
      if (!left.isBottom() && !algebra.isSubtype(left, regionSchema(b, region.right()))) {
        LOG.finer(() -> "ObjectAlgebra.isSubtype undeclared names are not contained");
        return false;
      }
    }
    return true;
  }

  Optional<ObjectDescriptor> meet(ObjectDescriptor a, ObjectDescriptor b) {
    Set<String> declared = declaredNames(a, b);
    Map<String, CanonicalSchema> properties = new LinkedHashMap<>();
    for (String name : declared) {
      properties.put(name, algebra.meet(schemaFor(a, name), schemaFor(b, name)));
    }
    Set<String> required = new TreeSet<>(a.required());
    required.addAll(b.required());
    List<PatternProperty> patterns;
    if (b.patternProperties().isEmpty() && b.additionalProperties().isVacuous()) {
      patterns = a.patternProperties();
    } else if (a.patternProperties().isEmpty() && a.additionalProperties().isVacuous()) {
      patterns = b.patternProperties();
    } else {
      patterns = combinePatterns(a, b, declared, algebra::meet);
    }
    ObjectDescriptor result = new ObjectDescriptor(properties, required, patterns,
        algebra.meet(a.additionalProperties(), b.additionalProperties()),
        a.propertyCount().intersect(b.propertyCount()));
    return normalize(result);
  }

  /// An upper bound: required names are intersected and every member schema is joined.
  ObjectDescriptor join(ObjectDescriptor a, ObjectDescriptor b) {
    Set<String> declared = declaredNames(a, b);
    Map<String, CanonicalSchema> properties = new LinkedHashMap<>();
    for (String name : declared) {
      properties.put(name, algebra.join(schemaFor(a, name), schemaFor(b, name)));
    }
    Set<String> required = new TreeSet<>(a.required());
    required.retainAll(b.required());
    ObjectDescriptor result = new ObjectDescriptor(properties, required,
        combinePatterns(a, b, declared, algebra::join),
        algebra.join(a.additionalProperties(), b.additionalProperties()),
        a.propertyCount().hull(b.propertyCount()));
    return normalize(result).orElseThrow(() -> new IllegalStateException("join of inhabited objects is empty"));
  }

  static Optional<ObjectDescriptor> complement(ObjectDescriptor d) {
    if (d.isUnconstrained()) {
      return Optional.empty();
    }
    throw new UnsupportedSchemaException("not: the objects rejected by member constraints are not a single atom");
  }

  private List<PatternProperty> combinePatterns(
      ObjectDescriptor a, ObjectDescriptor b, Set<String> declared, BinaryOperator<CanonicalSchema> combine) {
    if (a.patternProperties().isEmpty() && b.patternProperties().isEmpty()) {
      return List.of();
    }
    List<PatternProperty> result = new ArrayList<>();
    for (Region region : regions(a, b, declared)) {
      if (region.matchedByAny()) {
        CanonicalSchema schema = combine.apply(regionSchema(a, region.left()), regionSchema(b, region.right()));
        result.add(new PatternProperty(RegexWriter.write(region.names()), region.names(), schema));
      }
    }
    return result;
  }

  private static Set<String> declaredNames(ObjectDescriptor a, ObjectDescriptor b) {
    Set<String> names = new LinkedHashSet<>(a.properties().keySet());
    names.addAll(b.properties().keySet());
    return names;
  }

  private CanonicalSchema regionSchema(ObjectDescriptor d, BitSet matches) {
    if (matches.isEmpty()) {
      return d.additionalProperties();
    }
    CanonicalSchema result = null;
    for (int i = matches.nextSetBit(0); i >= 0; i = matches.nextSetBit(i + 1)) {
      CanonicalSchema schema = d.patternProperties().get(i).schema();
      result = result == null ? schema : algebra.meet(result, schema);
    }
    return result;
  }

  /// Non-empty regions of names outside `declared`.
  List<Region> regions(ObjectDescriptor a, ObjectDescriptor b, Set<String> declared) {
    Automaton undeclared = declared.isEmpty()
        ? Automaton.makeAnyString()
        : Automaton.makeAnyString().minus(Automaton.makeStringUnion(declared.toArray(new CharSequence[0])));
    List<Region> regions = new ArrayList<>();
    regions.add(new Region(undeclared, new BitSet(), new BitSet()));
    regions = split(regions, a.patternProperties(), true);
    regions = split(regions, b.patternProperties(), false);
    if (LOG.isLoggable(java.util.logging.Level.FINEST)) {
      int count = regions.size();
      LOG.finest(() -> "ObjectAlgebra.regions count=" + count);
    }
    return regions;
  }

  private static List<Region> split(List<Region> regions, List<PatternProperty> patterns, boolean left) {
    List<Region> current = regions;
    for (int i = 0; i < patterns.size(); i++) {
      Automaton names = patterns.get(i).names();
      List<Region> next = new ArrayList<>();
      for (Region region : current) {
        Automaton inside = region.names().intersection(names);
        if (!StringDescriptor.isEmptyLanguage(inside)) {
          BitSet l = (BitSet) region.left().clone();
          BitSet r = (BitSet) region.right().clone();
          (left ? l : r).set(i);
          next.add(new Region(inside, l, r));
        }
        Automaton outside = region.names().minus(names);
        if (!StringDescriptor.isEmptyLanguage(outside)) {
          next.add(new Region(outside, region.left(), region.right()));
        }
      }
      current = next;
    }
    return current;
  }
}
