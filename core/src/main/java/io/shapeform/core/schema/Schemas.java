package io.shapeform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.model.JsonValues;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for building schemas.
 *
 * <pre>{@code
 * ObjectSchema user = Schemas.object(
 *         Schemas.field("name", Schemas.string().min(1)),
 *         Schemas.field("age", Schemas.number().integer().nonnegative().optional()));
 * JsonNode valid = user.parse(Map.of("name", "Ada"));
 * }</pre>
 *
 * <p>
 * Names that clash with Java keywords carry a trailing underscore.
 */
public final class Schemas {

    private Schemas() {}

    public static StringSchema string() {
        return new StringSchema(List.of());
    }

    public static NumberSchema number() {
        return new NumberSchema(List.of());
    }

    public static BooleanSchema boolean_() {
        return BooleanSchema.INSTANCE;
    }

    public static DateSchema date() {
        return new DateSchema(List.of());
    }

    public static NullSchema null_() {
        return NullSchema.INSTANCE;
    }

    public static UndefinedSchema undefined_() {
        return UndefinedSchema.INSTANCE;
    }

    public static AnySchema any() {
        return AnySchema.INSTANCE;
    }

    /** Same acceptance as {@link #any()}. */
    public static AnySchema unknown() {
        return AnySchema.INSTANCE;
    }

    public static NeverSchema never() {
        return NeverSchema.INSTANCE;
    }

    /** A literal of a scalar value; converted with {@link JsonValues#toNode(Object)}. */
    public static LiteralSchema literal(Object value) {
        return new LiteralSchema(JsonValues.toNode(value));
    }

    public static EnumSchema enum_(Object... options) {
        List<JsonNode> nodes = new ArrayList<>(options.length);
        for (Object option : options) {
            nodes.add(JsonValues.toNode(option));
        }
        return new EnumSchema(nodes);
    }

    /** An enum of the constant names of a Java enum type. */
    public static <E extends Enum<E>> EnumSchema enum_(Class<E> type) {
        return enum_((Object[]) type.getEnumConstants());
    }

    public static ObjectSchema.Field field(String name, Schema schema) {
        return new ObjectSchema.Field(name, schema);
    }

    public static ObjectSchema object(ObjectSchema.Field... fields) {
        return ObjectSchema.of(Arrays.asList(fields));
    }

    /** An object from a shape map; iteration order of the map becomes field order. */
    public static ObjectSchema object(Map<String, ? extends Schema> shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        List<ObjectSchema.Field> fields = new ArrayList<>(shape.size());
        shape.forEach((name, schema) -> fields.add(new ObjectSchema.Field(name, schema)));
        return ObjectSchema.of(fields);
    }

    public static ArraySchema array(Schema element) {
        return new ArraySchema(element, List.of());
    }

    public static TupleSchema tuple(Schema... items) {
        for (Schema item : items) {
            Objects.requireNonNull(item, "tuple item must not be null");
        }
        return new TupleSchema(Arrays.asList(items), null);
    }

    public static UnionSchema union(Schema... options) {
        for (Schema option : options) {
            Objects.requireNonNull(option, "union option must not be null");
        }
        return new UnionSchema(Arrays.asList(options));
    }

    public static DiscriminatedUnionSchema discriminatedUnion(String discriminator, ObjectSchema... options) {
        return DiscriminatedUnionSchema.of(discriminator, Arrays.asList(options));
    }

    /** A discriminated union with an explicit value-to-branch mapping. */
    public static DiscriminatedUnionSchema discriminatedUnion(
            String discriminator, Map<String, ObjectSchema> mapping) {
        return DiscriminatedUnionSchema.of(discriminator, mapping);
    }

    public static IntersectionSchema intersection(Schema left, Schema right) {
        return new IntersectionSchema(left, right);
    }

    /** A record with text keys. */
    public static RecordSchema record(Schema value) {
        return new RecordSchema(null, value);
    }

    /** A record whose keys are validated by {@code key}. */
    public static RecordSchema record(Schema key, Schema value) {
        return new RecordSchema(Objects.requireNonNull(key, "key must not be null"), value);
    }

    public static LazySchema lazy(Supplier<? extends Schema> supplier) {
        return new LazySchema(supplier);
    }

    /** Maps the raw input with {@code mapper} before {@code inner} sees it. */
    public static EffectsSchema preprocess(Function<JsonNode, ?> mapper, Schema inner) {
        return new EffectsSchema(inner, List.of(new Effect.Preprocess(mapper)));
    }
}
