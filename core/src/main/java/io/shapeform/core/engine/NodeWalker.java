package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.JsonValues;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.schema.ArraySchema;
import io.shapeform.core.schema.DateSchema;
import io.shapeform.core.schema.DefaultSchema;
import io.shapeform.core.schema.DiscriminatedUnionSchema;
import io.shapeform.core.schema.EffectsSchema;
import io.shapeform.core.schema.EnumSchema;
import io.shapeform.core.schema.IntersectionSchema;
import io.shapeform.core.schema.LazySchema;
import io.shapeform.core.schema.LiteralSchema;
import io.shapeform.core.schema.NullableSchema;
import io.shapeform.core.schema.NumberSchema;
import io.shapeform.core.schema.ObjectSchema;
import io.shapeform.core.schema.OptionalSchema;
import io.shapeform.core.schema.RecordSchema;
import io.shapeform.core.schema.Schema;
import io.shapeform.core.schema.StringSchema;
import io.shapeform.core.schema.TupleSchema;
import io.shapeform.core.schema.UnionSchema;
import io.shapeform.core.schema.UnknownKeys;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Recursive evaluator: walks one schema node against one value and produces a {@link NodeResult}.
 *
 * <p>
 * The same walk serves both execution modes. Children of a node are all started before any is
 * awaited; in synchronous mode every returned future is already complete. A structural mismatch
 * stops descent into that subtree only: siblings are always walked.
 *
 * <p>
 * One instance per validation call.
 */
final class NodeWalker {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final CallContext ctx;
    private final UnionResolver unions;
    private final EffectPipeline effects;

    NodeWalker(CallContext ctx) {
        this.ctx = ctx;
        this.unions = new UnionResolver(this, ctx);
        this.effects = new EffectPipeline(this, ctx);
    }

    CompletableFuture<NodeResult> walk(Schema schema, JsonNode value, ValuePath path) {
        return switch (schema.kind()) {
            case STRING -> done(string((StringSchema) schema, value, path));
            case NUMBER -> done(number((NumberSchema) schema, value, path));
            case BOOLEAN -> done(value.isBoolean() ? NodeResult.valid(value) : mismatch("boolean", value, path));
            case DATE -> done(date((DateSchema) schema, value, path));
            case NULL -> done(value.isNull() ? NodeResult.valid(value) : mismatch("null", value, path));
            case UNDEFINED -> done(value.isMissingNode() ? NodeResult.valid(value) : mismatch("undefined", value, path));
            case ANY -> done(NodeResult.valid(value));
            case NEVER -> done(mismatch("never", value, path));
            case LITERAL -> done(literal((LiteralSchema) schema, value, path));
            case ENUM -> done(enumeration((EnumSchema) schema, value, path));
            case OBJECT -> object((ObjectSchema) schema, value, path);
            case ARRAY -> array((ArraySchema) schema, value, path);
            case TUPLE -> tuple((TupleSchema) schema, value, path);
            case UNION -> unions.union((UnionSchema) schema, value, path);
            case DISCRIMINATED_UNION -> unions.discriminated((DiscriminatedUnionSchema) schema, value, path);
            case INTERSECTION -> intersection((IntersectionSchema) schema, value, path);
            case RECORD -> record((RecordSchema) schema, value, path);
            case OPTIONAL -> value.isMissingNode()
                    ? done(NodeResult.valid(value))
                    : walk(((OptionalSchema) schema).unwrap(), value, path);
            case NULLABLE -> value.isNull()
                    ? done(NodeResult.valid(value))
                    : walk(((NullableSchema) schema).unwrap(), value, path);
            case DEFAULT -> {
                DefaultSchema withDefault = (DefaultSchema) schema;
                JsonNode input = value.isMissingNode() ? withDefault.defaultValue() : value;
                yield walk(withDefault.unwrap(), input, path);
            }
            case EFFECTS -> effects.run((EffectsSchema) schema, value, path);
            case LAZY -> walk(((LazySchema) schema).resolve(), value, path);
        };
    }

    // --- Leaves ---

    private NodeResult string(StringSchema schema, JsonNode value, ValuePath path) {
        if (!value.isTextual()) {
            return mismatch("string", value, path);
        }
        return Checks.string(ctx, schema.checks(), value, path);
    }

    private NodeResult number(NumberSchema schema, JsonNode value, ValuePath path) {
        if (!value.isNumber() || Double.isNaN(value.doubleValue())) {
            return mismatch("number", value, path);
        }
        return Checks.number(ctx, schema.checks(), value, path);
    }

    private NodeResult date(DateSchema schema, JsonNode value, ValuePath path) {
        if (!JsonValues.isDate(value)) {
            return mismatch("date", value, path);
        }
        Optional<Instant> instant = JsonValues.toInstant(value);
        if (instant.isEmpty()) {
            return NodeResult.aborted(ctx.issue(IssueCode.INVALID_DATE, path, null, null));
        }
        return Checks.date(ctx, schema.checks(), value, instant.get(), path);
    }

    private NodeResult literal(LiteralSchema schema, JsonNode value, ValuePath path) {
        if (JsonValues.sameValue(schema.value(), value)) {
            return NodeResult.valid(value);
        }
        return NodeResult.aborted(ctx.issue(
                IssueCode.INVALID_LITERAL, path, null, null, "expected", schema.value(), "received", value));
    }

    private NodeResult enumeration(EnumSchema schema, JsonNode value, ValuePath path) {
        if (schema.contains(value)) {
            return NodeResult.valid(value);
        }
        return NodeResult.aborted(ctx.issue(
                IssueCode.INVALID_ENUM_VALUE, path, null, null, "options", schema.options(), "received", value));
    }

    // --- Containers ---

    private CompletableFuture<NodeResult> object(ObjectSchema schema, JsonNode value, ValuePath path) {
        if (!value.isObject()) {
            return done(mismatch("object", value, path));
        }
        Map<String, Schema> shape = schema.shape();
        List<String> names = new ArrayList<>(shape.keySet());
        List<CompletableFuture<NodeResult>> fields = new ArrayList<>(names.size());
        for (String name : names) {
            fields.add(walk(shape.get(name), child(value, name), path.append(name)));
        }
        return AsyncCoordinator.joinInOrder(fields).thenApply(results -> {
            ObjectNode out = NODES.objectNode();
            List<Issue> issues = new ArrayList<>();
            boolean aborted = false;
            for (int i = 0; i < names.size(); i++) {
                NodeResult field = results.get(i);
                issues.addAll(field.issues());
                if (field.isAborted()) {
                    aborted = true;
                } else if (!field.value().isMissingNode()) {
                    out.set(names.get(i), field.value());
                }
            }
            List<String> extras = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                if (shape.containsKey(entry.getKey())) {
                    continue;
                }
                if (schema.unknownKeys() == UnknownKeys.PASSTHROUGH) {
                    out.set(entry.getKey(), entry.getValue());
                } else if (schema.unknownKeys() == UnknownKeys.STRICT) {
                    extras.add(entry.getKey());
                }
            }
            if (!extras.isEmpty()) {
                issues.add(ctx.issue(IssueCode.UNRECOGNIZED_KEYS, path, null, null, "keys", List.copyOf(extras)));
            }
            return aborted ? NodeResult.aborted(issues) : NodeResult.of(out, issues);
        });
    }

    private CompletableFuture<NodeResult> array(ArraySchema schema, JsonNode value, ValuePath path) {
        if (!value.isArray()) {
            return done(mismatch("array", value, path));
        }
        List<Issue> sizeIssues = Checks.size(ctx, schema.checks(), value.size(), path);
        List<CompletableFuture<NodeResult>> elements = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            elements.add(walk(schema.element(), value.get(i), path.append(i)));
        }
        return AsyncCoordinator.joinInOrder(elements).thenApply(results -> assembleArray(sizeIssues, results));
    }

    private CompletableFuture<NodeResult> tuple(TupleSchema schema, JsonNode value, ValuePath path) {
        if (!value.isArray()) {
            return done(mismatch("array", value, path));
        }
        List<Schema> items = schema.items();
        Optional<Schema> rest = schema.rest();
        if (value.size() < items.size()) {
            return done(NodeResult.aborted(
                    Checks.tooSmall(ctx, path, "array", items.size(), rest.isEmpty(), null)));
        }
        List<Issue> arityIssues = new ArrayList<>();
        if (rest.isEmpty() && value.size() > items.size()) {
            arityIssues.add(Checks.tooBig(ctx, path, "array", items.size(), true, null));
        }
        int count = rest.isPresent() ? value.size() : items.size();
        List<CompletableFuture<NodeResult>> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Schema element = i < items.size() ? items.get(i) : rest.get();
            elements.add(walk(element, value.get(i), path.append(i)));
        }
        return AsyncCoordinator.joinInOrder(elements).thenApply(results -> assembleArray(arityIssues, results));
    }

    private CompletableFuture<NodeResult> record(RecordSchema schema, JsonNode value, ValuePath path) {
        if (!value.isObject()) {
            return done(mismatch("object", value, path));
        }
        Optional<Schema> keySchema = schema.key();
        List<String> keys = new ArrayList<>();
        List<CompletableFuture<NodeResult>> walks = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            ValuePath at = path.append(entry.getKey());
            keys.add(entry.getKey());
            if (keySchema.isPresent()) {
                walks.add(walk(keySchema.get(), TextNode.valueOf(entry.getKey()), at));
            }
            walks.add(walk(schema.value(), entry.getValue(), at));
        }
        int stride = keySchema.isPresent() ? 2 : 1;
        return AsyncCoordinator.joinInOrder(walks).thenApply(results -> {
            ObjectNode out = NODES.objectNode();
            List<Issue> issues = new ArrayList<>();
            boolean aborted = false;
            for (int i = 0; i < keys.size(); i++) {
                String key = keys.get(i);
                if (stride == 2) {
                    NodeResult keyResult = results.get(2 * i);
                    issues.addAll(keyResult.issues());
                    if (keyResult.isAborted()) {
                        aborted = true;
                    } else {
                        key = keyResult.value().asText(key);
                    }
                }
                NodeResult entry = results.get(stride * i + stride - 1);
                issues.addAll(entry.issues());
                if (entry.isAborted()) {
                    aborted = true;
                } else if (!entry.value().isMissingNode()) {
                    out.set(key, entry.value());
                }
            }
            return aborted ? NodeResult.aborted(issues) : NodeResult.of(out, issues);
        });
    }

    private CompletableFuture<NodeResult> intersection(IntersectionSchema schema, JsonNode value, ValuePath path) {
        List<CompletableFuture<NodeResult>> sides =
                List.of(walk(schema.left(), value, path), walk(schema.right(), value, path));
        return AsyncCoordinator.joinInOrder(sides).thenApply(results -> {
            NodeResult left = results.get(0);
            NodeResult right = results.get(1);
            List<Issue> issues = new ArrayList<>(left.issues());
            issues.addAll(right.issues());
            if (left.isAborted() || right.isAborted()) {
                return NodeResult.aborted(issues);
            }
            Optional<JsonNode> merged = IntersectionMerger.merge(left.value(), right.value());
            if (merged.isEmpty()) {
                issues.add(ctx.issue(IssueCode.INVALID_INTERSECTION_TYPES, path, null, null));
                return NodeResult.aborted(issues);
            }
            return NodeResult.of(merged.get(), issues);
        });
    }

    // --- Helpers ---

    private static NodeResult assembleArray(List<Issue> leading, List<NodeResult> results) {
        ArrayNode out = NODES.arrayNode(results.size());
        List<Issue> issues = new ArrayList<>(leading);
        boolean aborted = false;
        for (NodeResult element : results) {
            issues.addAll(element.issues());
            if (element.isAborted()) {
                aborted = true;
            } else {
                out.add(element.value().isMissingNode() ? NullNode.getInstance() : element.value());
            }
        }
        return aborted ? NodeResult.aborted(issues) : NodeResult.of(out, issues);
    }

    private NodeResult mismatch(String expected, JsonNode value, ValuePath path) {
        return NodeResult.aborted(ctx.invalidType(expected, value, path));
    }

    private static JsonNode child(JsonNode object, String name) {
        JsonNode child = object.get(name);
        return child == null ? JsonValues.absent() : child;
    }

    private static CompletableFuture<NodeResult> done(NodeResult result) {
        return CompletableFuture.completedFuture(result);
    }
}
