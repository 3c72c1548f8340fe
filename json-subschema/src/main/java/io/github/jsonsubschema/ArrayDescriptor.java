package io.github.jsonsubschema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Arrays as an (infinite) tuple: `prefixItems` for the leading positions, then
/// `additionalItems` for every later one. A homogeneous array has an empty prefix.
public record ArrayDescriptor(
    List<CanonicalSchema> prefixItems,
    CanonicalSchema additionalItems,
    SizeRange length,
    boolean unique
) implements KindDescriptor {

  public ArrayDescriptor {
    prefixItems = List.copyOf(prefixItems);
    Objects.requireNonNull(additionalItems, "additionalItems");
    Objects.requireNonNull(length, "length");
  }

  public static ArrayDescriptor any() {
    return new ArrayDescriptor(List.of(), CanonicalSchema.top(), SizeRange.ANY, false);
  }

  /// Normalizes the length against the positions: a Bottom position `i` caps the length
  /// at `i`, a Bottom tail caps it at the prefix size, and prefix positions past the
  /// maximum length are dropped. Empty when no array fits.
  public static Optional<ArrayDescriptor> of(
      List<CanonicalSchema> prefixItems, CanonicalSchema additionalItems, SizeRange length, boolean unique) {
    SizeRange range = length;
    List<CanonicalSchema> prefix = new ArrayList<>(prefixItems);
    for (int i = 0; i < prefix.size(); i++) {
      if (prefix.get(i).isBottom()) {
        range = range.atMost(i);
        prefix = new ArrayList<>(prefix.subList(0, i));
        break;
      }
    }
    if (additionalItems.isBottom()) {
      range = range.atMost(prefix.size());
    }
    if (range.isEmpty()) {
      return Optional.empty();
    }
    if (range.max() != null && prefix.size() > range.max()) {
      prefix = new ArrayList<>(prefix.subList(0, range.max()));
    }
    boolean isUnique = unique && (range.max() == null || range.max() > 1);
    return Optional.of(new ArrayDescriptor(prefix, additionalItems, range, isUnique));
  }

  @Override
  public JsonKind kind() {
    return JsonKind.ARRAY;
  }

  @Override
  public boolean isUnconstrained() {
    return prefixItems.isEmpty() && additionalItems.isVacuous() && length.isUnconstrained() && !unique;
  }

  /// Schema of position `index`.
  public CanonicalSchema itemAt(int index) {
    return index < prefixItems.size() ? prefixItems.get(index) : additionalItems;
  }

  /// True when some accepted array has an element at `index`.
  public boolean reaches(int index) {
    return length.max() == null || length.max() > index;
  }
}
