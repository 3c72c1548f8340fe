package io.github.jsonsubschema;

import com.fasterxml.jackson.databind.JsonNode;
import dk.brics.automaton.Automaton;
import io.github.jsonsubschema.semantic.ConceptIri;
import io.github.jsonsubschema.semantic.SemanticCompatibility;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;

import static io.github.jsonsubschema.SubschemaLogging.LOG;

/// Turns a reference-free draft-4 schema tree into a [CanonicalSchema].
///
/// Every keyword is parsed eagerly; anything outside the supported vocabulary fails here
/// with an [UnsupportedSchemaException] carrying the side and JSON pointer. A node's own
/// keywords form a base atom which is then met with its `enum`/`const` literals and its
/// connectives. The nodes on the current descent path are tracked by identity, so a tree
/// that contains itself fails with [UnsupportedRecursiveRefException] instead of
/// overflowing the stack.
final class Canonicalizer {

  static final int MAX_DEPTH = 512;

  private static final Set<String> ANNOTATIONS = Set.of(
      "title", "description", "default", "examples", "$schema", "$id", "id", "$comment", "definitions", "$defs");

  private static final Set<String> KEYWORDS = Set.of(
      "type", "enum", "const",
      "minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum", "multipleOf",
      "minLength", "maxLength", "pattern", "format",
      "items", "additionalItems", "minItems", "maxItems", "uniqueItems",
      "properties", "patternProperties", "additionalProperties", "required", "minProperties", "maxProperties",
      "allOf", "anyOf", "oneOf", "not",
      SemanticCompatibility.STYPE);

  private final SchemaAlgebra algebra;
  private final boolean warnUninhabited;
  private final Level diagnostics;

  Canonicalizer(SchemaAlgebra algebra, boolean warnUninhabited, Level diagnostics) {
    this.algebra = Objects.requireNonNull(algebra, "algebra");
    this.warnUninhabited = warnUninhabited;
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  CanonicalSchema canonicalize(JsonNode schema, Side side) {
    Objects.requireNonNull(schema, "schema");
    LOG.fine(() -> "canonicalize: side=" + side);
    return new Walk(side).visit(schema, "", 0);
  }

  /// One descent over one schema document.
  private final class Walk {

    private final Side side;
    private final Set<JsonNode> path = Collections.newSetFromMap(new IdentityHashMap<>());

    Walk(Side side) {
      this.side = side;
    }

    CanonicalSchema visit(JsonNode node, String pointer, int depth) {
      if (depth > MAX_DEPTH) {
        throw new UnsupportedRecursiveRefException(side, pointer, node,
            "schema nests deeper than " + MAX_DEPTH + " levels");
      }
      if (!node.isContainerNode()) {
        return leaf(node, pointer);
      }
      if (!path.add(node)) {
        throw new UnsupportedRecursiveRefException(side, pointer, node, "subschema contains itself");
      }
      try {
        CanonicalSchema result = schema(node, pointer, depth);
        if (LOG.isLoggable(Level.FINEST)) {
          LOG.finest(() -> "canonicalize: " + side + " " + display(pointer) + " -> " + result);
        }
        if (warnUninhabited && result.isBottom() && !isLiterallyEmpty(node)) {
          LOG.warning(() -> "canonicalize: " + side + " " + display(pointer) + " accepts no value");
        }
        return result;
      } catch (UnsupportedSchemaException e) {
        throw e.locate(side, pointer);
      } finally {
        path.remove(node);
      }
    }

    private CanonicalSchema leaf(JsonNode node, String pointer) {
      if (!node.isBoolean()) {
        throw new UnsupportedSchemaException(side, pointer, "a schema must be an object or a boolean");
      }
      return node.booleanValue() ? CanonicalSchema.top() : CanonicalSchema.bottom();
    }

    private CanonicalSchema schema(JsonNode node, String pointer, int depth) {
      if (!node.isObject()) {
        throw new UnsupportedSchemaException(side, pointer, "a schema must be an object or a boolean");
      }
      Iterator<String> names = node.fieldNames();
      while (names.hasNext()) {
        String name = names.next();
        if ("$ref".equals(name)) {
          throw new UnsupportedSchemaException(side, pointer, "$ref must be resolved before comparison");
        }
        if (!KEYWORDS.contains(name) && !ANNOTATIONS.contains(name)) {
          throw new UnsupportedSchemaException(side, pointer, "unsupported keyword '" + name + "'");
        }
      }

      CanonicalSchema result = atom(node, pointer, depth);
      if (node.has("const")) {
        result = algebra.meet(result, literal(node.get("const")));
      }
      if (node.has("enum")) {
        result = algebra.meet(result, enumeration(node.get("enum"), pointer));
      }
      if (node.has("allOf")) {
        for (CanonicalSchema branch : branches(node, "allOf", pointer, depth)) {
          result = algebra.meet(result, branch);
        }
      }
      if (node.has("anyOf")) {
        result = algebra.meet(result, union(branches(node, "anyOf", pointer, depth)));
      }
      if (node.has("oneOf")) {
        List<CanonicalSchema> branches = branches(node, "oneOf", pointer, depth);
        reportOverlaps(branches, pointer);
        result = algebra.meet(result, union(branches));
      }
      if (node.has("not")) {
        CanonicalSchema negated = visit(node.get("not"), pointer + "/not", depth + 1);
        result = algebra.meet(result, algebra.complement(negated));
      }
      if (node.has(SemanticCompatibility.STYPE)) {
        JsonNode stype = node.get(SemanticCompatibility.STYPE);
        if (!stype.isTextual()) {
          throw new UnsupportedSchemaException(side, pointer + "/" + SemanticCompatibility.STYPE, "stype must be a string");
        }
        String own = ConceptIri.normalize(stype.textValue());
        if (algebra.annotations().conflicts(own, result.semanticType())) {
          result = CanonicalSchema.bottom();
        } else if (!result.isBottom()) {
          result = result.withSemanticType(algebra.annotations().meet(own, result.semanticType()));
        }
      }
      return result;
    }

    private List<CanonicalSchema> branches(JsonNode node, String keyword, String pointer, int depth) {
      JsonNode array = node.get(keyword);
      if (!array.isArray() || array.isEmpty()) {
        throw new UnsupportedSchemaException(side, pointer + "/" + keyword, keyword + " must be a non-empty array");
      }
      List<CanonicalSchema> result = new ArrayList<>(array.size());
      for (int i = 0; i < array.size(); i++) {
        result.add(visit(array.get(i), pointer + "/" + keyword + "/" + i, depth + 1));
      }
      return result;
    }

    private CanonicalSchema union(List<CanonicalSchema> branches) {
      CanonicalSchema result = CanonicalSchema.bottom();
      for (CanonicalSchema branch : branches) {
        result = algebra.join(result, branch);
      }
      return result;
    }

    /// `oneOf` is read as a union; branches that share values are only reported.
    private void reportOverlaps(List<CanonicalSchema> branches, String pointer) {
      if (!LOG.isLoggable(diagnostics)) {
        return;
      }
      for (int i = 0; i < branches.size(); i++) {
        for (int j = i + 1; j < branches.size(); j++) {
          if (!algebra.meet(branches.get(i), branches.get(j)).isBottom()) {
            int first = i;
            int second = j;
            LOG.log(diagnostics, () -> "canonicalize: " + side + " " + display(pointer) + "/oneOf branches "
                + first + " and " + second + " overlap; treated as anyOf");
          }
        }
      }
    }

    private CanonicalSchema atom(JsonNode node, String pointer, int depth) {
      Set<JsonKind> kinds = EnumSet.allOf(JsonKind.class);
      boolean integer = false;
      if (node.has("type")) {
        kinds = EnumSet.noneOf(JsonKind.class);
        Set<String> typeNames = typeNames(node.get("type"), pointer);
        for (String typeName : typeNames) {
          JsonKind kind = JsonKind.ofTypeName(typeName).orElseThrow(() ->
              new UnsupportedSchemaException(side, pointer + "/type", "unknown type '" + typeName + "'"));
          kinds.add(kind);
        }
        integer = typeNames.contains("integer") && !typeNames.contains("number");
      }
      Map<JsonKind, KindDescriptor> descriptors = new EnumMap<>(JsonKind.class);
      for (JsonKind kind : kinds) {
        switch (kind) {
          case NULL:
            descriptors.put(kind, NullDescriptor.INSTANCE);
            break;
          case BOOLEAN:
            descriptors.put(kind, BooleanDescriptor.ANY);
            break;
          case NUMBER:
            number(node, pointer, integer).ifPresent(d -> descriptors.put(JsonKind.NUMBER, d));
            break;
          case STRING:
            string(node, pointer).ifPresent(d -> descriptors.put(JsonKind.STRING, d));
            break;
          case ARRAY:
            array(node, pointer, depth).ifPresent(d -> descriptors.put(JsonKind.ARRAY, d));
            break;
          case OBJECT:
            object(node, pointer, depth).ifPresent(d -> descriptors.put(JsonKind.OBJECT, d));
            break;
          default:
            throw new AssertionError(kind);
        }
      }
      return CanonicalSchema.of(descriptors, null);
    }

    private Set<String> typeNames(JsonNode type, String pointer) {
      Set<String> names = new LinkedHashSet<>();
      if (type.isTextual()) {
        names.add(type.textValue());
      } else if (type.isArray() && !type.isEmpty()) {
        for (JsonNode element : type) {
          if (!element.isTextual()) {
            throw new UnsupportedSchemaException(side, pointer + "/type", "type array entries must be strings");
          }
          names.add(element.textValue());
        }
      } else {
        throw new UnsupportedSchemaException(side, pointer + "/type", "type must be a string or a non-empty array");
      }
      return names;
    }

    private Optional<NumberDescriptor> number(JsonNode node, String pointer, boolean integer) {
      Bound lower = Bound.UNBOUNDED;
      Bound upper = Bound.UNBOUNDED;
      JsonNode exclusiveMinimum = node.get("exclusiveMinimum");
      JsonNode exclusiveMaximum = node.get("exclusiveMaximum");
      if (node.has("minimum")) {
        BigDecimal minimum = decimal(node, "minimum", pointer);
        boolean open = exclusiveMinimum != null && exclusiveMinimum.isBoolean() && exclusiveMinimum.booleanValue();
        lower = new Bound.Finite(minimum, !open);
      }
      if (node.has("maximum")) {
        BigDecimal maximum = decimal(node, "maximum", pointer);
        boolean open = exclusiveMaximum != null && exclusiveMaximum.isBoolean() && exclusiveMaximum.booleanValue();
        upper = new Bound.Finite(maximum, !open);
      }
      if (exclusiveMinimum != null && !exclusiveMinimum.isBoolean()) {
        lower = Bound.tighterLower(lower, Bound.exclusive(decimal(node, "exclusiveMinimum", pointer)));
      }
      if (exclusiveMaximum != null && !exclusiveMaximum.isBoolean()) {
        upper = Bound.tighterUpper(upper, Bound.exclusive(decimal(node, "exclusiveMaximum", pointer)));
      }
      BigDecimal step = null;
      if (node.has("multipleOf")) {
        step = decimal(node, "multipleOf", pointer);
        if (step.signum() <= 0) {
          throw new UnsupportedSchemaException(side, pointer + "/multipleOf", "multipleOf must be greater than 0");
        }
      }
      return NumberDescriptor.of(new NumericInterval(lower, upper), step, integer);
    }

    private Optional<StringDescriptor> string(JsonNode node, String pointer) {
      SizeRange length = range(node, "minLength", "maxLength", pointer);
      Automaton language = Automaton.makeAnyString();
      if (node.has("pattern")) {
        language = language.intersection(pattern(node.get("pattern"), pointer + "/pattern"));
      }
      if (node.has("format")) {
        JsonNode format = node.get("format");
        if (!format.isTextual()) {
          throw new UnsupportedSchemaException(side, pointer + "/format", "format must be a string");
        }
        Format known = Format.byName(format.textValue()).orElseThrow(() ->
            new UnsupportedSchemaException(side, pointer + "/format", "unsupported format '" + format.textValue() + "'"));
        language = language.intersection(known.language());
      }
      return StringDescriptor.of(length, language);
    }

    private Automaton pattern(JsonNode pattern, String pointer) {
      if (!pattern.isTextual()) {
        throw new UnsupportedSchemaException(side, pointer, "pattern must be a string");
      }
      return compilePattern(pattern.textValue(), pointer);
    }

    private Automaton compilePattern(String source, String pointer) {
      try {
        return PatternCompiler.compile(source);
      } catch (IllegalArgumentException e) {
        throw new UnsupportedSchemaException(side, pointer,
            "unsupported regular expression '" + source + "': " + e.getMessage(), e);
      }
    }

    private Optional<ArrayDescriptor> array(JsonNode node, String pointer, int depth) {
      List<CanonicalSchema> prefix = new ArrayList<>();
      CanonicalSchema additional = CanonicalSchema.top();
      JsonNode items = node.get("items");
      if (items != null && items.isArray()) {
        for (int i = 0; i < items.size(); i++) {
          prefix.add(visit(items.get(i), pointer + "/items/" + i, depth + 1));
        }
        if (node.has("additionalItems")) {
          additional = visit(node.get("additionalItems"), pointer + "/additionalItems", depth + 1);
        }
      } else if (items != null) {
        additional = visit(items, pointer + "/items", depth + 1);
      }
      SizeRange length = range(node, "minItems", "maxItems", pointer);
      boolean unique = false;
      if (node.has("uniqueItems")) {
        JsonNode uniqueItems = node.get("uniqueItems");
        if (!uniqueItems.isBoolean()) {
          throw new UnsupportedSchemaException(side, pointer + "/uniqueItems", "uniqueItems must be a boolean");
        }
        unique = uniqueItems.booleanValue();
      }
      return ArrayDescriptor.of(prefix, additional, length, unique);
    }

    private Optional<ObjectDescriptor> object(JsonNode node, String pointer, int depth) {
      Map<String, CanonicalSchema> properties = new LinkedHashMap<>();
      JsonNode declared = node.get("properties");
      if (declared != null) {
        requireObject(declared, pointer + "/properties");
        Iterator<Map.Entry<String, JsonNode>> fields = declared.fields();
        while (fields.hasNext()) {
          Map.Entry<String, JsonNode> field = fields.next();
          String at = pointer + "/properties/" + escape(field.getKey());
          properties.put(field.getKey(), visit(field.getValue(), at, depth + 1));
        }
      }
      List<PatternProperty> patterns = new ArrayList<>();
      JsonNode patternProperties = node.get("patternProperties");
      if (patternProperties != null) {
        requireObject(patternProperties, pointer + "/patternProperties");
        Iterator<Map.Entry<String, JsonNode>> fields = patternProperties.fields();
        while (fields.hasNext()) {
          Map.Entry<String, JsonNode> field = fields.next();
          String at = pointer + "/patternProperties/" + escape(field.getKey());
          Automaton names = compilePattern(field.getKey(), at);
          patterns.add(new PatternProperty(field.getKey(), names, visit(field.getValue(), at, depth + 1)));
        }
      }
      CanonicalSchema additional = CanonicalSchema.top();
      if (node.has("additionalProperties")) {
        additional = visit(node.get("additionalProperties"), pointer + "/additionalProperties", depth + 1);
      }
      Set<String> required = new LinkedHashSet<>();
      JsonNode requiredNode = node.get("required");
      if (requiredNode != null) {
        if (!requiredNode.isArray()) {
          throw new UnsupportedSchemaException(side, pointer + "/required", "required must be an array of strings");
        }
        for (JsonNode name : requiredNode) {
          if (!name.isTextual()) {
            throw new UnsupportedSchemaException(side, pointer + "/required", "required must be an array of strings");
          }
          required.add(name.textValue());
        }
      }
      SizeRange count = range(node, "minProperties", "maxProperties", pointer);
      return algebra.normalize(new ObjectDescriptor(properties, required, patterns, additional, count));
    }

    private CanonicalSchema enumeration(JsonNode values, String pointer) {
      if (!values.isArray()) {
        throw new UnsupportedSchemaException(side, pointer + "/enum", "enum must be an array");
      }
      CanonicalSchema result = CanonicalSchema.bottom();
      for (JsonNode value : values) {
        result = algebra.join(result, literal(value));
      }
      return result;
    }

    /// The schema accepting exactly `value`, up to the numeric hull of joined literals.
    private CanonicalSchema literal(JsonNode value) {
      if (value.isNull()) {
        return CanonicalSchema.of(NullDescriptor.INSTANCE);
      }
      if (value.isBoolean()) {
        return CanonicalSchema.of(new BooleanDescriptor(Set.of(value.booleanValue())));
      }
      if (value.isNumber()) {
        return CanonicalSchema.of(NumberDescriptor.point(value.decimalValue()));
      }
      if (value.isTextual()) {
        return CanonicalSchema.of(StringDescriptor.literal(value.textValue()));
      }
      if (value.isArray()) {
        List<CanonicalSchema> elements = new ArrayList<>(value.size());
        for (JsonNode element : value) {
          elements.add(literal(element));
        }
        return ArrayDescriptor.of(elements, CanonicalSchema.bottom(), SizeRange.exactly(value.size()), false)
            .map(CanonicalSchema::of)
            .orElseGet(CanonicalSchema::bottom);
      }
      Map<String, CanonicalSchema> members = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        members.put(field.getKey(), literal(field.getValue()));
      }
      ObjectDescriptor object = new ObjectDescriptor(members, members.keySet(), List.of(),
          CanonicalSchema.bottom(), SizeRange.exactly(members.size()));
      return algebra.normalize(object).map(CanonicalSchema::of).orElseGet(CanonicalSchema::bottom);
    }

    private SizeRange range(JsonNode node, String minKeyword, String maxKeyword, String pointer) {
      int min = node.has(minKeyword) ? count(node, minKeyword, pointer) : 0;
      Integer max = node.has(maxKeyword) ? count(node, maxKeyword, pointer) : null;
      return new SizeRange(min, max);
    }

    private int count(JsonNode node, String keyword, String pointer) {
      JsonNode value = node.get(keyword);
      if (!value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
        throw new UnsupportedSchemaException(side, pointer + "/" + keyword, keyword + " must be a non-negative integer");
      }
      return value.intValue();
    }

    private BigDecimal decimal(JsonNode node, String keyword, String pointer) {
      JsonNode value = node.get(keyword);
      if (!value.isNumber()) {
        throw new UnsupportedSchemaException(side, pointer + "/" + keyword, keyword + " must be a number");
      }
      return value.decimalValue();
    }

    private void requireObject(JsonNode node, String pointer) {
      if (!node.isObject()) {
        throw new UnsupportedSchemaException(side, pointer, "expected an object of schemas");
      }
    }
  }

  /// `false` and `{"not":{}}` are deliberate; anything else that accepts nothing is worth a warning.
  private static boolean isLiterallyEmpty(JsonNode node) {
    if (node.isBoolean()) {
      return !node.booleanValue();
    }
    if (node.isObject() && node.size() == 1 && node.has("not")) {
      JsonNode negated = node.get("not");
      return (negated.isObject() && negated.isEmpty()) || (negated.isBoolean() && negated.booleanValue());
    }
    return false;
  }

  static String escape(String name) {
    return name.replace("~", "~0").replace("/", "~1");
  }

  private static String display(String pointer) {
    return "#" + pointer;
  }
}
