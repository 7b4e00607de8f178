package io.shapeform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.engine.ValidationEngine;
import io.shapeform.core.model.JsonValues;
import io.shapeform.core.model.ParseResult;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Immutable description of an expected value shape. Nodes are built through {@link Schemas} and
 * the modifier methods below; every modifier returns a new node and never mutates the receiver, so
 * one tree can be shared by any number of concurrent validations.
 *
 * <p>
 * The parse entry points delegate to {@link ValidationEngine#defaultEngine()}; use a configured
 * {@link ValidationEngine} directly for custom options.
 */
public abstract sealed class Schema
        permits StringSchema,
                NumberSchema,
                BooleanSchema,
                DateSchema,
                NullSchema,
                UndefinedSchema,
                AnySchema,
                NeverSchema,
                LiteralSchema,
                EnumSchema,
                ObjectSchema,
                ArraySchema,
                TupleSchema,
                UnionSchema,
                DiscriminatedUnionSchema,
                IntersectionSchema,
                RecordSchema,
                OptionalSchema,
                NullableSchema,
                DefaultSchema,
                EffectsSchema,
                LazySchema {

    Schema() {}

    /** The node kind the engine dispatches on. */
    public abstract SchemaKind kind();

    // --- Entry points ---

    /**
     * Validates {@code value} and returns the validated (possibly transformed) value.
     *
     * @throws io.shapeform.core.error.ValidationException carrying every issue found
     */
    public final JsonNode parse(Object value) {
        return ValidationEngine.defaultEngine().parse(this, value);
    }

    /** Validates {@code value} and reads the result as {@code type}. */
    public final <T> T parse(Object value, Class<T> type) {
        return ValidationEngine.defaultEngine().safeParse(this, value).orElseThrow(type);
    }

    /** Validates {@code value}; failures are returned as data, never raised. */
    public final ParseResult safeParse(Object value) {
        return ValidationEngine.defaultEngine().safeParse(this, value);
    }

    /** Asynchronous {@link #parse(Object)}; the future fails with the aggregated error. */
    public final CompletableFuture<JsonNode> parseAsync(Object value) {
        return ValidationEngine.defaultEngine().parseAsync(this, value);
    }

    /** Asynchronous {@link #safeParse(Object)}. */
    public final CompletableFuture<ParseResult> safeParseAsync(Object value) {
        return ValidationEngine.defaultEngine().safeParseAsync(this, value);
    }

    // --- Wrapping modifiers ---

    /** Accepts the absent value in addition to this shape. */
    public OptionalSchema optional() {
        return new OptionalSchema(this);
    }

    /** Accepts {@code null} in addition to this shape. */
    public NullableSchema nullable() {
        return new NullableSchema(this);
    }

    /** Accepts both {@code null} and the absent value. */
    public OptionalSchema nullish() {
        return nullable().optional();
    }

    /** Substitutes {@code value} (converted to a tree, copied per use) when the input is absent. */
    public DefaultSchema withDefault(Object value) {
        JsonNode node = JsonValues.toNode(value);
        return new DefaultSchema(this, node::deepCopy);
    }

    /** Substitutes a freshly supplied value when the input is absent. */
    public DefaultSchema withDefault(Supplier<?> supplier) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        return new DefaultSchema(this, () -> JsonValues.toNode(supplier.get()));
    }

    /** An array whose elements match this node. */
    public ArraySchema array() {
        return new ArraySchema(this, List.of());
    }

    /** A union of this node and {@code other}, tried in that order. */
    public UnionSchema or(Schema other) {
        return new UnionSchema(List.of(this, Objects.requireNonNull(other, "other must not be null")));
    }

    /** An intersection of this node and {@code other}. */
    public IntersectionSchema and(Schema other) {
        return new IntersectionSchema(this, Objects.requireNonNull(other, "other must not be null"));
    }

    // --- Effects ---

    public EffectsSchema refine(Predicate<JsonNode> check) {
        return refine(check, RefineOptions.DEFAULT);
    }

    public EffectsSchema refine(Predicate<JsonNode> check, String message) {
        return refine(check, RefineOptions.of(message));
    }

    public EffectsSchema refine(Predicate<JsonNode> check, RefineOptions options) {
        return withEffect(new Effect.Refine(check, options));
    }

    public EffectsSchema refineAsync(Function<JsonNode, ? extends CompletionStage<Boolean>> check, String message) {
        return refineAsync(check, RefineOptions.of(message));
    }

    public EffectsSchema refineAsync(
            Function<JsonNode, ? extends CompletionStage<Boolean>> check, RefineOptions options) {
        return withEffect(new Effect.AsyncRefine(check, options));
    }

    public EffectsSchema superRefine(BiConsumer<JsonNode, RefinementContext> check) {
        return withEffect(new Effect.SuperRefine(check));
    }

    public EffectsSchema superRefineAsync(
            BiFunction<JsonNode, RefinementContext, ? extends CompletionStage<?>> check) {
        return withEffect(new Effect.AsyncSuperRefine(check));
    }

    /**
     * Maps the validated value. A non-{@link JsonNode} result is stored in the output tree (scalars as
     * value nodes, other objects wrapped as POJOs).
     */
    public EffectsSchema transform(Function<JsonNode, ?> mapper) {
        return withEffect(new Effect.Transform(mapper));
    }

    public EffectsSchema transformAsync(Function<JsonNode, ? extends CompletionStage<?>> mapper) {
        return withEffect(new Effect.AsyncTransform(mapper));
    }

    EffectsSchema withEffect(Effect effect) {
        return new EffectsSchema(this, List.of(effect));
    }

    @Override
    public String toString() {
        return kind().name().toLowerCase();
    }
}
