package io.github.jsonsubschema.semantic;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.jsonsubschema.semantic.SemanticLogging.LOG;

/// Walks two raw schema trees in lock-step and compares their `stype` annotations.
///
/// [#isCompatible] reads "the left schema is semantically no more general than the
/// right one". [#areComparable] accepts either direction at every node and decides
/// whether a meet of the two may carry a shared meaning.
///
/// A declared member name is compared against every schema the other side applies to it:
/// its declaration and matching `patternProperties`, or `additionalProperties` when neither
/// exists. A side that says nothing about the name is skipped. Uninhabited schemas
/// (`false`, `{"not":{}}`, or whatever the supplied emptiness test accepts) are compatible
/// with anything, and the items of an array capped at `maxItems: 0` are not compared.
///
/// Both trees must be finite; cyclic documents are rejected before this walk.
public final class SemanticCompatibility {

  public static final String STYPE = "stype";

  private enum Mode {
    NARROWER,
    EITHER
  }

  private final SemanticTypeResolver resolver;
  private final Predicate<JsonNode> empty;

  public SemanticCompatibility(SemanticTypeResolver resolver) {
    this(resolver, schema -> false);
  }

  /// @param empty recognizes schemas that accept no value beyond the literal forms,
  ///              e.g. a required member that is `false`
  public SemanticCompatibility(SemanticTypeResolver resolver, Predicate<JsonNode> empty) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.empty = Objects.requireNonNull(empty, "empty");
  }

  public SemanticTypeResolver resolver() {
    return resolver;
  }

  public boolean isCompatible(JsonNode left, JsonNode right) {
    return walk(left, right, Mode.NARROWER, "#");
  }

  public boolean areComparable(JsonNode left, JsonNode right) {
    return walk(left, right, Mode.EITHER, "#");
  }

  /// The `stype` of a schema node, or null when the node has none.
  public static String annotationOf(JsonNode schema) {
    if (schema == null || !schema.isObject()) {
      return null;
    }
    JsonNode stype = schema.get(STYPE);
    return stype != null && stype.isTextual() ? stype.textValue() : null;
  }

  private boolean accepts(Mode mode, String left, String right) {
    return mode == Mode.NARROWER ? directed(left, right) : directed(left, right) || directed(right, left);
  }

  private boolean directed(String left, String right) {
    if (right == null) {
      return true;
    }
    if (left == null) {
      return false;
    }
    return resolver.isSubtypeOf(left, right);
  }

  private boolean walk(JsonNode left, JsonNode right, Mode mode, String pointer) {
    if (acceptsNothing(left) || (mode == Mode.EITHER && acceptsNothing(right))) {
      return true;
    }
    String l = annotationOf(left);
    String r = annotationOf(right);
    if (!accepts(mode, l, r)) {
      LOG.fine(() -> "semantic.mismatch at " + pointer + " left=" + l + " right=" + r);
      return false;
    }
    if (left == null || right == null || !left.isObject() || !right.isObject()) {
      return true;
    }
    return members(left, right, mode, pointer)
        && items(left, right, mode, pointer)
        && additionalProperties(left, right, mode, pointer)
        && sharedMembers(left, right, "patternProperties", mode, pointer)
        && connectives(left, right, mode, pointer);
  }

  private boolean acceptsNothing(JsonNode schema) {
    return schema != null && (isUninhabited(schema) || empty.test(schema));
  }

  /// `false` and `{"not":{}}` accept no value.
  static boolean isUninhabited(JsonNode schema) {
    if (schema == null) {
      return false;
    }
    if (schema.isBoolean()) {
      return !schema.booleanValue();
    }
    if (!schema.isObject() || schema.size() != 1) {
      return false;
    }
    JsonNode not = schema.get("not");
    return not != null && ((not.isObject() && not.isEmpty()) || (not.isBoolean() && not.booleanValue()));
  }

  /// Every name declared on either side, paired with the schemas each side applies to it.
  /// Under [Mode#NARROWER] each right schema needs a compatible left one; under
  /// [Mode#EITHER] every pair must be comparable.
  private boolean members(JsonNode left, JsonNode right, Mode mode, String pointer) {
    Set<String> names = new TreeSet<>();
    names.addAll(declaredNames(left));
    names.addAll(declaredNames(right));
    for (String name : names) {
      String at = pointer + "/properties/" + escape(name);
      List<JsonNode> lefts = schemasFor(left, name, pointer);
      List<JsonNode> rights = schemasFor(right, name, pointer);
      if (lefts.isEmpty() || rights.isEmpty()) {
        continue;
      }
      for (JsonNode r : rights) {
        boolean matched = mode == Mode.EITHER;
        for (JsonNode l : lefts) {
          boolean ok = walk(l, r, mode, at);
          if (mode == Mode.EITHER && !ok) {
            return false;
          }
          if (mode == Mode.NARROWER && ok) {
            matched = true;
            break;
          }
        }
        if (!matched) {
          LOG.fine(() -> "semantic.mismatch at " + at + " no compatible member schema");
          return false;
        }
      }
    }
    return true;
  }

  private static Set<String> declaredNames(JsonNode schema) {
    Set<String> names = new TreeSet<>();
    JsonNode properties = schema.get("properties");
    if (properties != null && properties.isObject()) {
      properties.fieldNames().forEachRemaining(names::add);
    }
    return names;
  }

  /// The declaration of `name` and every matching pattern schema; `additionalProperties`
  /// when neither exists. Empty when the schema says nothing about `name`.
  private static List<JsonNode> schemasFor(JsonNode schema, String name, String pointer) {
    List<JsonNode> result = new ArrayList<>();
    JsonNode properties = schema.get("properties");
    if (properties != null && properties.isObject() && properties.has(name)) {
      result.add(properties.get(name));
    }
    JsonNode patterns = schema.get("patternProperties");
    if (patterns != null && patterns.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = patterns.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> pattern = it.next();
        if (matches(pattern.getKey(), name, pointer)) {
          result.add(pattern.getValue());
        }
      }
    }
    JsonNode additional = schema.get("additionalProperties");
    if (result.isEmpty() && additional != null) {
      result.add(additional);
    }
    return result;
  }

  private static boolean matches(String pattern, String name, String pointer) {
    try {
      return Pattern.compile(pattern).matcher(name).find();
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException(
          "invalid pattern at " + pointer + "/patternProperties/" + escape(pattern) + ": " + e.getDescription(), e);
    }
  }

  private boolean sharedMembers(JsonNode left, JsonNode right, String keyword, Mode mode, String pointer) {
    JsonNode lm = left.get(keyword);
    JsonNode rm = right.get(keyword);
    if (lm == null || rm == null || !lm.isObject() || !rm.isObject()) {
      return true;
    }
    for (Iterator<Map.Entry<String, JsonNode>> it = lm.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> member = it.next();
      JsonNode other = rm.get(member.getKey());
      if (other != null && !walk(member.getValue(), other, mode,
          pointer + "/" + keyword + "/" + escape(member.getKey()))) {
        return false;
      }
    }
    return true;
  }

  private boolean items(JsonNode left, JsonNode right, Mode mode, String pointer) {
    JsonNode li = left.get("items");
    JsonNode ri = right.get("items");
    if (li == null || ri == null || noItems(left) || noItems(right)) {
      return true;
    }
    if (li.isArray() && ri.isArray()) {
      int shared = Math.min(li.size(), ri.size());
      for (int i = 0; i < shared; i++) {
        if (!walk(li.get(i), ri.get(i), mode, pointer + "/items/" + i)) {
          return false;
        }
      }
      return true;
    }
    if (li.isArray() || ri.isArray()) {
      // tuple against single schema: only annotated items make the pair incompatible
      boolean annotated = annotatedItems(li) || annotatedItems(ri);
      if (annotated) {
        LOG.fine(() -> "semantic.mismatch at " + pointer + "/items mixed tuple and schema forms");
      }
      return !annotated;
    }
    return walk(li, ri, mode, pointer + "/items");
  }

  private static boolean noItems(JsonNode schema) {
    JsonNode max = schema.get("maxItems");
    return max != null && max.isNumber() && max.decimalValue().signum() == 0;
  }

  private static boolean annotatedItems(JsonNode items) {
    if (items.isArray()) {
      for (JsonNode item : items) {
        if (annotationOf(item) != null) {
          return true;
        }
      }
      return false;
    }
    if (annotationOf(items) != null) {
      return true;
    }
    if (items.isObject()) {
      for (JsonNode member : items) {
        if (annotationOf(member) != null) {
          return true;
        }
      }
    }
    return false;
  }

  private boolean additionalProperties(JsonNode left, JsonNode right, Mode mode, String pointer) {
    JsonNode la = left.get("additionalProperties");
    JsonNode ra = right.get("additionalProperties");
    if (la == null || ra == null || !la.isObject() || !ra.isObject()) {
      return true;
    }
    return walk(la, ra, mode, pointer + "/additionalProperties");
  }

  private boolean connectives(JsonNode left, JsonNode right, Mode mode, String pointer) {
    JsonNode lAll = branches(left, "allOf");
    JsonNode rAll = branches(right, "allOf");
    if (lAll != null && rAll != null) {
      for (int i = 0; i < lAll.size(); i++) {
        if (!matchesAny(lAll.get(i), rAll, mode, pointer + "/allOf/" + i)) {
          return false;
        }
      }
    }
    return someBranchPair(left, right, "anyOf", mode, pointer)
        && someBranchPair(left, right, "oneOf", mode, pointer);
  }

  // oneOf shares the anyOf rule: exclusivity between branches is not checked
  private boolean someBranchPair(JsonNode left, JsonNode right, String keyword, Mode mode, String pointer) {
    JsonNode lb = branches(left, keyword);
    JsonNode rb = branches(right, keyword);
    if (lb == null || rb == null) {
      return true;
    }
    for (int i = 0; i < lb.size(); i++) {
      if (matchesAny(lb.get(i), rb, mode, pointer + "/" + keyword + "/" + i)) {
        return true;
      }
    }
    LOG.fine(() -> "semantic.mismatch at " + pointer + "/" + keyword + " no compatible branch pair");
    return false;
  }

  private boolean matchesAny(JsonNode branch, JsonNode candidates, Mode mode, String pointer) {
    for (JsonNode candidate : candidates) {
      if (walk(branch, candidate, mode, pointer)) {
        return true;
      }
    }
    return false;
  }

  private static JsonNode branches(JsonNode schema, String keyword) {
    JsonNode list = schema.get(keyword);
    return list != null && list.isArray() && list.size() > 0 ? list : null;
  }

  private static String escape(String token) {
    return token.replace("~", "~0").replace("/", "~1");
  }
}
