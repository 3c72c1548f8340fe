package io.github.jsonsubschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.jsonsubschema.semantic.SemanticCompatibility;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/// Serializes a [CanonicalSchema] back to draft-4 JSON Schema.
///
/// Bottom is written as `{"not":{}}` and Top as `{}`. Exclusive bounds use the draft-4
/// boolean form and string languages become anchored patterns from [RegexWriter].
final class SchemaWriter {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  /// Finite string languages up to this size are written as `enum`.
  private static final int MAX_ENUM_STRINGS = 16;

  private SchemaWriter() {}

  static ObjectNode write(CanonicalSchema schema) {
    if (schema.isBottom()) {
      ObjectNode bottom = NODES.objectNode();
      bottom.set("not", NODES.objectNode());
      return bottom;
    }
    ObjectNode node;
    if (schema.isTop()) {
      node = NODES.objectNode();
    } else {
      Map<JsonKind, KindDescriptor> kinds = schema.descriptors();
      if (kinds.size() == 1) {
        node = write(kinds.values().iterator().next());
      } else if (kinds.values().stream().allMatch(KindDescriptor::isUnconstrained)) {
        node = NODES.objectNode();
        ArrayNode types = node.putArray("type");
        kinds.keySet().forEach(kind -> types.add(kind.typeName()));
      } else {
        node = NODES.objectNode();
        ArrayNode anyOf = node.putArray("anyOf");
        kinds.values().forEach(descriptor -> anyOf.add(write(descriptor)));
      }
    }
    if (schema.semanticType() != null) {
      node.put(SemanticCompatibility.STYPE, schema.semanticType());
    }
    return node;
  }

  /// `false` for Bottom where draft 4 takes a boolean, otherwise the schema.
  private static JsonNode writeOrFalse(CanonicalSchema schema) {
    return schema.isBottom() ? NODES.booleanNode(false) : write(schema);
  }

  static ObjectNode write(KindDescriptor descriptor) {
    if (descriptor instanceof NullDescriptor) {
      return typed("null");
    }
    if (descriptor instanceof BooleanDescriptor d) {
      ObjectNode node = typed("boolean");
      if (!d.isUnconstrained()) {
        node.putArray("enum").add(d.values().iterator().next());
      }
      return node;
    }
    if (descriptor instanceof NumberDescriptor d) {
      return number(d);
    }
    if (descriptor instanceof StringDescriptor d) {
      return string(d);
    }
    if (descriptor instanceof ArrayDescriptor d) {
      return array(d);
    }
    return object((ObjectDescriptor) descriptor);
  }

  private static ObjectNode typed(String type) {
    ObjectNode node = NODES.objectNode();
    node.put("type", type);
    return node;
  }

  private static ObjectNode number(NumberDescriptor d) {
    BigDecimal point = d.pointValue();
    if (point != null) {
      ObjectNode node = typed(d.integer() ? "integer" : "number");
      node.putArray("enum").add(number(point));
      return node;
    }
    ObjectNode node = typed(d.integer() ? "integer" : "number");
    if (d.interval().lower() instanceof Bound.Finite lower) {
      node.set("minimum", number(lower.value()));
      if (!lower.inclusive()) {
        node.put("exclusiveMinimum", true);
      }
    }
    if (d.interval().upper() instanceof Bound.Finite upper) {
      node.set("maximum", number(upper.value()));
      if (!upper.inclusive()) {
        node.put("exclusiveMaximum", true);
      }
    }
    if (d.multipleOf() != null) {
      node.set("multipleOf", number(d.multipleOf()));
    }
    return node;
  }

  /// Integral values without a fraction, everything else as a plain decimal.
  static JsonNode number(BigDecimal value) {
    BigDecimal stripped = value.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      return NODES.numberNode(stripped.toBigIntegerExact());
    }
    return NODES.numberNode(stripped);
  }

  private static ObjectNode string(StringDescriptor d) {
    ObjectNode node = typed("string");
    Set<String> finite = d.effectiveLanguage().clone().getFiniteStrings(MAX_ENUM_STRINGS);
    if (finite != null && !finite.isEmpty()) {
      ArrayNode values = node.putArray("enum");
      new TreeSet<>(finite).forEach(values::add);
      return node;
    }
    if (d.length().min() > 0) {
      node.put("minLength", d.length().min());
    }
    if (d.length().max() != null) {
      node.put("maxLength", d.length().max());
    }
    if (!StringDescriptor.isTotalLanguage(d.language())) {
      node.put("pattern", RegexWriter.write(d.language()));
    }
    return node;
  }

  private static ObjectNode array(ArrayDescriptor d) {
    ObjectNode node = typed("array");
    if (d.prefixItems().isEmpty()) {
      if (!d.additionalItems().isVacuous()) {
        node.set("items", write(d.additionalItems()));
      }
    } else {
      ArrayNode items = node.putArray("items");
      d.prefixItems().forEach(item -> items.add(write(item)));
      if (!d.additionalItems().isVacuous()) {
        node.set("additionalItems", writeOrFalse(d.additionalItems()));
      }
    }
    if (d.length().min() > 0) {
      node.put("minItems", d.length().min());
    }
    if (d.length().max() != null) {
      node.put("maxItems", d.length().max());
    }
    if (d.unique()) {
      node.put("uniqueItems", true);
    }
    return node;
  }

  private static ObjectNode object(ObjectDescriptor d) {
    ObjectNode node = typed("object");
    if (!d.properties().isEmpty()) {
      ObjectNode properties = node.putObject("properties");
      d.properties().forEach((name, schema) -> properties.set(name, write(schema)));
    }
    if (!d.required().isEmpty()) {
      ArrayNode required = node.putArray("required");
      d.required().forEach(required::add);
    }
    if (!d.patternProperties().isEmpty()) {
      ObjectNode patterns = node.putObject("patternProperties");
      for (PatternProperty pattern : d.patternProperties()) {
        patterns.set(pattern.source(), write(pattern.schema()));
      }
    }
    if (!d.additionalProperties().isVacuous()) {
      node.set("additionalProperties", writeOrFalse(d.additionalProperties()));
    }
    if (d.propertyCount().min() > d.required().size()) {
      node.put("minProperties", d.propertyCount().min());
    }
    if (d.propertyCount().max() != null) {
      node.put("maxProperties", d.propertyCount().max());
    }
    return node;
  }
}
