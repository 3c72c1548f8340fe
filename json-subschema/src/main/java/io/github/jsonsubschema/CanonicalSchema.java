package io.github.jsonsubschema;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Kind-tagged normal form of a schema: one [KindDescriptor] per accepted [JsonKind]
/// plus an optional semantic annotation.
///
/// A value is accepted iff its kind is present and its descriptor accepts it. [#top()]
/// is a distinguished marker that lends out unconstrained descriptors on demand, so an
/// unconstrained array or object can refer back to it without a cycle. A map covering
/// every kind with unconstrained descriptors collapses into the marker.
public final class CanonicalSchema {

  private static final CanonicalSchema TOP = new CanonicalSchema(null, null);
  private static final CanonicalSchema BOTTOM = new CanonicalSchema(new EnumMap<>(JsonKind.class), null);

  /// null for Top
  private final Map<JsonKind, KindDescriptor> kinds;
  private final String semanticType;

  private CanonicalSchema(Map<JsonKind, KindDescriptor> kinds, String semanticType) {
    this.kinds = kinds == null ? null : Collections.unmodifiableMap(kinds);
    this.semanticType = semanticType;
  }

  /// Accepts every JSON value.
  public static CanonicalSchema top() {
    return TOP;
  }

  /// Accepts nothing.
  public static CanonicalSchema bottom() {
    return BOTTOM;
  }

  public static CanonicalSchema of(KindDescriptor descriptor) {
    return of(Map.of(descriptor.kind(), descriptor), null);
  }

  public static CanonicalSchema of(Map<JsonKind, KindDescriptor> kinds, String semanticType) {
    EnumMap<JsonKind, KindDescriptor> copy = new EnumMap<>(JsonKind.class);
    for (Map.Entry<JsonKind, KindDescriptor> entry : kinds.entrySet()) {
      KindDescriptor descriptor = Objects.requireNonNull(entry.getValue(), "descriptor");
      if (descriptor.kind() != entry.getKey()) {
        throw new IllegalArgumentException(entry.getKey() + " mapped to " + descriptor.kind() + " descriptor");
      }
      copy.put(entry.getKey(), descriptor);
    }
    boolean everything = copy.size() == JsonKind.values().length
        && copy.values().stream().allMatch(KindDescriptor::isUnconstrained);
    if (everything) {
      return semanticType == null ? TOP : new CanonicalSchema(null, semanticType);
    }
    if (copy.isEmpty() && semanticType == null) {
      return BOTTOM;
    }
    return new CanonicalSchema(copy, semanticType);
  }

  public boolean isTop() {
    return kinds == null;
  }

  public boolean isBottom() {
    return kinds != null && kinds.isEmpty();
  }

  /// Top without an annotation. A member schema like this constrains nothing.
  public boolean isVacuous() {
    return kinds == null && semanticType == null;
  }

  /// True when this node or any member schema below it carries a semantic annotation.
  public boolean isAnnotated() {
    if (semanticType != null) {
      return true;
    }
    if (kinds == null) {
      return false;
    }
    for (KindDescriptor descriptor : kinds.values()) {
      if (descriptor instanceof ArrayDescriptor array) {
        if (array.additionalItems().isAnnotated()
            || array.prefixItems().stream().anyMatch(CanonicalSchema::isAnnotated)) {
          return true;
        }
      } else if (descriptor instanceof ObjectDescriptor object) {
        if (object.additionalProperties().isAnnotated()
            || object.properties().values().stream().anyMatch(CanonicalSchema::isAnnotated)
            || object.patternProperties().stream().anyMatch(p -> p.schema().isAnnotated())) {
          return true;
        }
      }
    }
    return false;
  }

  /// The accepted kinds.
  public Set<JsonKind> kinds() {
    if (kinds == null) {
      return Collections.unmodifiableSet(EnumSet.allOf(JsonKind.class));
    }
    return kinds.keySet();
  }

  public boolean accepts(JsonKind kind) {
    return kinds == null || kinds.containsKey(kind);
  }

  public Optional<KindDescriptor> descriptor(JsonKind kind) {
    if (kinds == null) {
      return Optional.of(kind.unconstrained());
    }
    return Optional.ofNullable(kinds.get(kind));
  }

  /// Kind to descriptor, materialized for Top.
  public Map<JsonKind, KindDescriptor> descriptors() {
    if (kinds != null) {
      return kinds;
    }
    EnumMap<JsonKind, KindDescriptor> all = new EnumMap<>(JsonKind.class);
    for (JsonKind kind : JsonKind.values()) {
      all.put(kind, kind.unconstrained());
    }
    return Collections.unmodifiableMap(all);
  }

  /// Concept identifier attached to this node, or null.
  public String semanticType() {
    return semanticType;
  }

  public CanonicalSchema withSemanticType(String semanticType) {
    if (Objects.equals(this.semanticType, semanticType)) {
      return this;
    }
    if (kinds == null) {
      return semanticType == null ? TOP : new CanonicalSchema(null, semanticType);
    }
    if (kinds.isEmpty() && semanticType == null) {
      return BOTTOM;
    }
    return new CanonicalSchema(kinds, semanticType);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CanonicalSchema that)) {
      return false;
    }
    return Objects.equals(kinds, that.kinds) && Objects.equals(semanticType, that.semanticType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kinds == null ? 0 : kinds.keySet(), semanticType);
  }

  @Override
  public String toString() {
    if (isTop()) {
      return semanticType == null ? "Top" : "Top[" + semanticType + "]";
    }
    if (isBottom()) {
      return semanticType == null ? "Bottom" : "Bottom[" + semanticType + "]";
    }
    return "CanonicalSchema" + kinds.keySet() + (semanticType == null ? "" : "[" + semanticType + "]");
  }
}
