package io.github.jsonsubschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jsonsubschema.semantic.SemanticCompatibility;
import io.github.jsonsubschema.semantic.SemanticTypeResolver;

import java.util.Objects;
import java.util.logging.Level;

import static io.github.jsonsubschema.SubschemaLogging.LOG;

/// Subschema checks, meet, join and equivalence of JSON Schema documents.
///
/// Schemas are reference-free draft-4 documents, optionally annotated with `stype`
/// concept identifiers. Structural questions are answered on the canonical form; when
/// semantic reasoning is enabled the annotations must also agree with the concept
/// hierarchy of the context's resolver.
///
/// ```java
/// JsonSubschema subschema = new JsonSubschema(SubschemaContext.defaults());
/// boolean narrower = subschema.isSubschema(
///     "{\"type\":\"integer\",\"minimum\":5}",
///     "{\"type\":\"number\",\"minimum\":0}");
/// ```
///
/// Every operation canonicalizes both operands before anything else, so malformed,
/// unsupported or self-containing documents fail with an [UnsupportedSchemaException]
/// before the semantic walk sees them. The walk therefore only ever runs over finite trees.
///
/// Instances are immutable and safe to share between threads.
public final class JsonSubschema {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private final SubschemaContext context;
  private final SchemaAlgebra algebra;
  private final Canonicalizer canonicalizer;
  private final SemanticCompatibility compatibility;
  private final Level diagnostics;

  public JsonSubschema(SubschemaContext context) {
    this.context = Objects.requireNonNull(context, "context");
    this.algebra = context.algebra();
    this.diagnostics = context.options().diagnosticLevel();
    this.canonicalizer = new Canonicalizer(algebra, context.options().warnUninhabited(), diagnostics);
    Canonicalizer quiet = new Canonicalizer(algebra, false, diagnostics);
    this.compatibility = context.compatibility(schema -> quiet.canonicalize(schema, Side.LEFT).isBottom());
  }

  public SubschemaContext context() {
    return context;
  }

  /// True when every instance accepted by `left` is accepted by `right`.
  ///
  /// Both sides are canonicalized first; a cyclic document fails with
  /// [UnsupportedRecursiveRefException] before the annotations are compared. With semantic
  /// reasoning on, the annotations of `left` must also be no broader than those of
  /// `right`. A `left` that accepts nothing is a subschema of anything.
  public boolean isSubschema(JsonNode left, JsonNode right) {
    CanonicalSchema a = canonicalizer.canonicalize(left, Side.LEFT);
    CanonicalSchema b = canonicalizer.canonicalize(right, Side.RIGHT);
    if (a.isBottom()) {
      LOG.fine("isSubschema: left accepts no value");
      return true;
    }
    if (semantics() && !compatibility.isCompatible(left, right)) {
      LOG.log(diagnostics, () -> "isSubschema: semantic annotations are incompatible");
      return false;
    }
    boolean result = algebra.isSubtype(a, b);
    LOG.fine(() -> "isSubschema: " + a + " <: " + b + " = " + result);
    return result;
  }

  public boolean isSubschema(String left, String right) {
    return isSubschema(parse(left, Side.LEFT), parse(right, Side.RIGHT));
  }

  /// Schema accepting the instances both operands accept. Operands whose annotations
  /// are unrelated concepts share no instance.
  ///
  /// Both sides are canonicalized, and cycles rejected, before the annotations are
  /// compared; an empty result is written as `{"not":{}}`.
  public JsonNode meet(JsonNode left, JsonNode right) {
    CanonicalSchema a = canonicalizer.canonicalize(left, Side.LEFT);
    CanonicalSchema b = canonicalizer.canonicalize(right, Side.RIGHT);
    if (a.isBottom() || b.isBottom()) {
      return SchemaWriter.write(CanonicalSchema.bottom());
    }
    if (semantics() && !compatibility.areComparable(left, right)) {
      LOG.log(diagnostics, () -> "meet: semantic annotations are not comparable; result is empty");
      return SchemaWriter.write(CanonicalSchema.bottom());
    }
    return SchemaWriter.write(algebra.meet(a, b));
  }

  public JsonNode meet(String left, String right) {
    return meet(parse(left, Side.LEFT), parse(right, Side.RIGHT));
  }

  /// Schema accepting at least the instances either operand accepts.
  public JsonNode join(JsonNode left, JsonNode right) {
    CanonicalSchema a = canonicalizer.canonicalize(left, Side.LEFT);
    CanonicalSchema b = canonicalizer.canonicalize(right, Side.RIGHT);
    return SchemaWriter.write(algebra.join(a, b));
  }

  public JsonNode join(String left, String right) {
    return join(parse(left, Side.LEFT), parse(right, Side.RIGHT));
  }

  /// Mutual subschemas whose root annotations name equivalent concepts. Like
  /// [#isSubschema(JsonNode, JsonNode)], both sides are canonicalized before the semantic
  /// check. Two schemas that accept nothing are equivalent whatever their annotations.
  public boolean isEquivalent(JsonNode left, JsonNode right) {
    CanonicalSchema a = canonicalizer.canonicalize(left, Side.LEFT);
    CanonicalSchema b = canonicalizer.canonicalize(right, Side.RIGHT);
    if (a.isBottom() && b.isBottom()) {
      return true;
    }
    if (semantics()) {
      if (!compatibility.isCompatible(left, right) || !compatibility.isCompatible(right, left)) {
        LOG.log(diagnostics, () -> "isEquivalent: semantic annotations are incompatible");
        return false;
      }
      String leftType = SemanticCompatibility.annotationOf(left);
      String rightType = SemanticCompatibility.annotationOf(right);
      if ((leftType == null) != (rightType == null)) {
        LOG.log(diagnostics, () -> "isEquivalent: only one root carries stype");
        return false;
      }
      if (leftType != null && !resolver().isEquivalent(leftType, rightType)) {
        LOG.log(diagnostics, () -> "isEquivalent: " + leftType + " and " + rightType + " are different concepts");
        return false;
      }
    }
    return algebra.isSubtype(a, b) && algebra.isSubtype(b, a);
  }

  public boolean isEquivalent(String left, String right) {
    return isEquivalent(parse(left, Side.LEFT), parse(right, Side.RIGHT));
  }

  /// Canonical form of `schema`, written back as JSON Schema.
  public JsonNode canonicalize(JsonNode schema) {
    return SchemaWriter.write(canonicalForm(schema));
  }

  public JsonNode canonicalize(String schema) {
    return canonicalize(parse(schema, Side.LEFT));
  }

  /// Canonical form of `schema` as the in-memory model.
  public CanonicalSchema canonicalForm(JsonNode schema) {
    return canonicalizer.canonicalize(schema, Side.LEFT);
  }

  private boolean semantics() {
    return context.options().semanticReasoning();
  }

  private SemanticTypeResolver resolver() {
    return context.resolver();
  }

  private static JsonNode parse(String json, Side side) {
    Objects.requireNonNull(json, "json");
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new UnsupportedSchemaException(side, "", "not valid JSON: " + e.getOriginalMessage(), e);
    }
  }
}
