package io.github.jsonsubschema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Objects described by declared properties, pattern properties and a schema for every
/// other member.
///
/// The schema a member named `n` must satisfy is the meet of its declared schema and every
/// matching pattern schema; when neither applies it is `additionalProperties`.
/// Required names need not be declared.
public record ObjectDescriptor(
    Map<String, CanonicalSchema> properties,
    Set<String> required,
    List<PatternProperty> patternProperties,
    CanonicalSchema additionalProperties,
    SizeRange propertyCount
) implements KindDescriptor {

  public ObjectDescriptor {
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    required = Collections.unmodifiableSet(new TreeSet<>(required));
    patternProperties = List.copyOf(patternProperties);
    Objects.requireNonNull(additionalProperties, "additionalProperties");
    Objects.requireNonNull(propertyCount, "propertyCount");
  }

  public static ObjectDescriptor any() {
    return new ObjectDescriptor(Map.of(), Set.of(), List.of(), CanonicalSchema.top(), SizeRange.ANY);
  }

  @Override
  public JsonKind kind() {
    return JsonKind.OBJECT;
  }

  @Override
  public boolean isUnconstrained() {
    return properties.values().stream().allMatch(CanonicalSchema::isVacuous)
        && required.isEmpty()
        && patternProperties.stream().allMatch(p -> p.schema().isVacuous())
        && additionalProperties.isVacuous()
        && propertyCount.isUnconstrained();
  }

  /// True when only declared names may appear.
  public boolean isClosed() {
    return patternProperties.isEmpty() && additionalProperties.isBottom();
  }
}
