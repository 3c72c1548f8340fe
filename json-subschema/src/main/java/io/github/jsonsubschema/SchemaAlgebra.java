package io.github.jsonsubschema;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.jsonsubschema.SubschemaLogging.LOG;

/// Subtyping, meet, join and complement of [CanonicalSchema]s, dispatched per [JsonKind].
///
/// Subtyping ignores semantic annotations. Meet and join ask the [AnnotationLattice] for
/// the annotation of their result.
public final class SchemaAlgebra {

  private final AnnotationLattice annotations;
  private final ArrayAlgebra arrays;
  private final ObjectAlgebra objects;

  public SchemaAlgebra(AnnotationLattice annotations) {
    this.annotations = Objects.requireNonNull(annotations, "annotations");
    this.arrays = new ArrayAlgebra(this);
    this.objects = new ObjectAlgebra(this);
  }

  public AnnotationLattice annotations() {
    return annotations;
  }

  /// True when every value `a` accepts is accepted by `b`.
  public boolean isSubtype(CanonicalSchema a, CanonicalSchema b) {
    if (a.isBottom() || b.isTop()) {
      return true;
    }
    for (Map.Entry<JsonKind, KindDescriptor> entry : a.descriptors().entrySet()) {
      Optional<KindDescriptor> other = b.descriptor(entry.getKey());
      if (other.isEmpty()) {
        LOG.finer(() -> "SchemaAlgebra.isSubtype kind " + entry.getKey() + " missing on the right");
        return false;
      }
      if (!isSubtype(entry.getValue(), other.get())) {
        LOG.finer(() -> "SchemaAlgebra.isSubtype kind " + entry.getKey() + " not contained");
        return false;
      }
    }
    return true;
  }

  public CanonicalSchema meet(CanonicalSchema a, CanonicalSchema b) {
    if (annotations.conflicts(a.semanticType(), b.semanticType())) {
      return CanonicalSchema.bottom();
    }
    String semanticType = annotations.meet(a.semanticType(), b.semanticType());
    if (a.isTop()) {
      return b.withSemanticType(semanticType);
    }
    if (b.isTop()) {
      return a.withSemanticType(semanticType);
    }
    Map<JsonKind, KindDescriptor> kinds = new EnumMap<>(JsonKind.class);
    for (Map.Entry<JsonKind, KindDescriptor> entry : a.descriptors().entrySet()) {
      Optional<KindDescriptor> other = b.descriptor(entry.getKey());
      if (other.isPresent()) {
        meet(entry.getValue(), other.get()).ifPresent(d -> kinds.put(entry.getKey(), d));
      }
    }
    return CanonicalSchema.of(kinds, kinds.isEmpty() ? null : semanticType);
  }

  public CanonicalSchema join(CanonicalSchema a, CanonicalSchema b) {
    if (a.isBottom()) {
      return b;
    }
    if (b.isBottom()) {
      return a;
    }
    String semanticType = annotations.join(a.semanticType(), b.semanticType());
    Map<JsonKind, KindDescriptor> kinds = new EnumMap<>(a.descriptors());
    for (Map.Entry<JsonKind, KindDescriptor> entry : b.descriptors().entrySet()) {
      KindDescriptor mine = kinds.get(entry.getKey());
      kinds.put(entry.getKey(), mine == null ? entry.getValue() : join(mine, entry.getValue()));
    }
    return CanonicalSchema.of(kinds, semanticType);
  }

  /// The values `schema` rejects. Annotations do not survive negation.
  public CanonicalSchema complement(CanonicalSchema schema) {
    if (schema.isTop()) {
      return CanonicalSchema.bottom();
    }
    if (schema.isBottom()) {
      return CanonicalSchema.top();
    }
    Map<JsonKind, KindDescriptor> kinds = new EnumMap<>(JsonKind.class);
    for (JsonKind kind : JsonKind.values()) {
      Optional<KindDescriptor> present = schema.descriptor(kind);
      if (present.isEmpty()) {
        kinds.put(kind, kind.unconstrained());
      } else {
        complement(present.get()).ifPresent(d -> kinds.put(kind, d));
      }
    }
    return CanonicalSchema.of(kinds, null);
  }

  /// Object descriptor with its member count reconciled against required and declared names.
  Optional<ObjectDescriptor> normalize(ObjectDescriptor d) {
    return objects.normalize(d);
  }

  boolean isSubtype(KindDescriptor a, KindDescriptor b) {
    if (b.isUnconstrained()) {
      return true;
    }
    if (a instanceof NullDescriptor) {
      return true;
    }
    if (a instanceof BooleanDescriptor x && b instanceof BooleanDescriptor y) {
      return y.values().containsAll(x.values());
    }
    if (a instanceof NumberDescriptor x && b instanceof NumberDescriptor y) {
      return NumberAlgebra.isSubtype(x, y);
    }
    if (a instanceof StringDescriptor x && b instanceof StringDescriptor y) {
      return StringAlgebra.isSubtype(x, y);
    }
    if (a instanceof ArrayDescriptor x && b instanceof ArrayDescriptor y) {
      return arrays.isSubtype(x, y);
    }
    if (a instanceof ObjectDescriptor x && b instanceof ObjectDescriptor y) {
      return objects.isSubtype(x, y);
    }
    throw new IllegalArgumentException("descriptors of different kinds: " + a.kind() + ", " + b.kind());
  }

  Optional<? extends KindDescriptor> meet(KindDescriptor a, KindDescriptor b) {
    if (a.isUnconstrained()) {
      return Optional.of(b);
    }
    if (b.isUnconstrained()) {
      return Optional.of(a);
    }
    if (a instanceof NullDescriptor) {
      return Optional.of(a);
    }
    if (a instanceof BooleanDescriptor x && b instanceof BooleanDescriptor y) {
      Set<Boolean> values = new HashSet<>(x.values());
      values.retainAll(y.values());
      return BooleanDescriptor.of(values);
    }
    if (a instanceof NumberDescriptor x && b instanceof NumberDescriptor y) {
      return NumberAlgebra.meet(x, y);
    }
    if (a instanceof StringDescriptor x && b instanceof StringDescriptor y) {
      return StringAlgebra.meet(x, y);
    }
    if (a instanceof ArrayDescriptor x && b instanceof ArrayDescriptor y) {
      return arrays.meet(x, y);
    }
    if (a instanceof ObjectDescriptor x && b instanceof ObjectDescriptor y) {
      return objects.meet(x, y);
    }
    throw new IllegalArgumentException("descriptors of different kinds: " + a.kind() + ", " + b.kind());
  }

  /// Returns the larger operand when one contains the other, unless member annotations
  /// are involved: those are joined member by member.
  KindDescriptor join(KindDescriptor a, KindDescriptor b) {
    if (!annotated(a) && !annotated(b)) {
      if (isSubtype(a, b)) {
        return b;
      }
      if (isSubtype(b, a)) {
        return a;
      }
    }
    if (a instanceof BooleanDescriptor x && b instanceof BooleanDescriptor y) {
      Set<Boolean> values = new HashSet<>(x.values());
      values.addAll(y.values());
      return new BooleanDescriptor(values);
    }
    if (a instanceof NumberDescriptor x && b instanceof NumberDescriptor y) {
      return NumberAlgebra.join(x, y);
    }
    if (a instanceof StringDescriptor x && b instanceof StringDescriptor y) {
      return StringAlgebra.join(x, y);
    }
    if (a instanceof ArrayDescriptor x && b instanceof ArrayDescriptor y) {
      return arrays.join(x, y);
    }
    if (a instanceof ObjectDescriptor x && b instanceof ObjectDescriptor y) {
      return objects.join(x, y);
    }
    throw new IllegalArgumentException("descriptors of different kinds: " + a.kind() + ", " + b.kind());
  }

  private static boolean annotated(KindDescriptor d) {
    return (d instanceof ArrayDescriptor || d instanceof ObjectDescriptor) && CanonicalSchema.of(d).isAnnotated();
  }

  static Optional<? extends KindDescriptor> complement(KindDescriptor d) {
    if (d instanceof NullDescriptor) {
      return Optional.empty();
    }
    if (d instanceof BooleanDescriptor x) {
      Set<Boolean> values = new HashSet<>(BooleanDescriptor.ANY.values());
      values.removeAll(x.values());
      return BooleanDescriptor.of(values);
    }
    if (d instanceof NumberDescriptor x) {
      return NumberAlgebra.complement(x);
    }
    if (d instanceof StringDescriptor x) {
      return StringAlgebra.complement(x);
    }
    if (d instanceof ArrayDescriptor x) {
      return ArrayAlgebra.complement(x);
    }
    return ObjectAlgebra.complement((ObjectDescriptor) d);
  }
}
