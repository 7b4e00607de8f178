package io.shapeform.core.schema;

import io.shapeform.core.error.SchemaDefinitionException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Accepts an object whose declared fields match their nodes. Fields keep declaration order, which
 * is also the order issues and output keys are produced in. Keys not in the shape are handled by
 * the {@link UnknownKeys} policy ({@link UnknownKeys#STRIP} by default).
 *
 * <p>
 * All combinators return new nodes.
 */
public final class ObjectSchema extends Schema {

    /** One named field of an object shape. */
    public record Field(String name, Schema schema) {
        public Field {
            Objects.requireNonNull(name, "field name must not be null");
            Objects.requireNonNull(schema, "schema of field '" + name + "' must not be null");
        }
    }

    private final Map<String, Schema> shape;
    private final UnknownKeys unknownKeys;

    ObjectSchema(Map<String, Schema> shape, UnknownKeys unknownKeys) {
        Map<String, Schema> copy = new LinkedHashMap<>();
        shape.forEach((name, schema) -> copy.put(
                Objects.requireNonNull(name, "field name must not be null"),
                Objects.requireNonNull(schema, "schema of field '" + name + "' must not be null")));
        this.shape = Collections.unmodifiableMap(copy);
        this.unknownKeys = Objects.requireNonNull(unknownKeys, "unknownKeys must not be null");
    }

    static ObjectSchema of(List<Field> fields) {
        Map<String, Schema> shape = new LinkedHashMap<>();
        for (Field field : fields) {
            if (shape.putIfAbsent(field.name(), field.schema()) != null) {
                throw new SchemaDefinitionException("Duplicate field in object shape: '" + field.name() + "'");
            }
        }
        return new ObjectSchema(shape, UnknownKeys.STRIP);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.OBJECT;
    }

    /** Declared fields in declaration order. */
    public Map<String, Schema> shape() {
        return shape;
    }

    public UnknownKeys unknownKeys() {
        return unknownKeys;
    }

    /** Reports undeclared keys as an {@code unrecognized_keys} issue. */
    public ObjectSchema strict() {
        return withUnknownKeys(UnknownKeys.STRICT);
    }

    /** Drops undeclared keys from the output. */
    public ObjectSchema strip() {
        return withUnknownKeys(UnknownKeys.STRIP);
    }

    /** Copies undeclared keys to the output unvalidated. */
    public ObjectSchema passthrough() {
        return withUnknownKeys(UnknownKeys.PASSTHROUGH);
    }

    /** Adds fields; a field with an existing name replaces it in place. */
    public ObjectSchema extend(Map<String, Schema> fields) {
        return new ObjectSchema(ObjectShapes.extend(shape, fields), unknownKeys);
    }

    public ObjectSchema extend(Field... fields) {
        Map<String, Schema> extra = new LinkedHashMap<>();
        for (Field field : fields) {
            extra.put(field.name(), field.schema());
        }
        return extend(extra);
    }

    /** Adds all of {@code other}'s fields, which win on conflicts. Keeps this node's unknown-key policy. */
    public ObjectSchema merge(ObjectSchema other) {
        Objects.requireNonNull(other, "other must not be null");
        return new ObjectSchema(ObjectShapes.extend(shape, other.shape), unknownKeys);
    }

    /** Makes every field optional. Applying it twice yields the same shape as once. */
    public ObjectSchema partial() {
        return new ObjectSchema(ObjectShapes.partial(shape, shape.keySet()), unknownKeys);
    }

    /** Makes the named fields optional. */
    public ObjectSchema partial(String... names) {
        return new ObjectSchema(ObjectShapes.partial(shape, ObjectShapes.known(shape, names)), unknownKeys);
    }

    /** Removes the optional wrapper from every field. */
    public ObjectSchema required() {
        return new ObjectSchema(ObjectShapes.required(shape, shape.keySet()), unknownKeys);
    }

    /** Removes the optional wrapper from the named fields. */
    public ObjectSchema required(String... names) {
        return new ObjectSchema(ObjectShapes.required(shape, ObjectShapes.known(shape, names)), unknownKeys);
    }

    /** Keeps only the named fields, in declaration order. */
    public ObjectSchema pick(String... names) {
        return new ObjectSchema(ObjectShapes.pick(shape, ObjectShapes.known(shape, names)), unknownKeys);
    }

    /** Drops the named fields. */
    public ObjectSchema omit(String... names) {
        return new ObjectSchema(ObjectShapes.omit(shape, ObjectShapes.known(shape, names)), unknownKeys);
    }

    /**
     * An enum of the declared field names.
     *
     * @throws SchemaDefinitionException if the shape is empty
     */
    public EnumSchema keyof() {
        return Schemas.enum_(shape.keySet().toArray());
    }

    private ObjectSchema withUnknownKeys(UnknownKeys policy) {
        return policy == unknownKeys ? this : new ObjectSchema(shape, policy);
    }

    @Override
    public String toString() {
        return "object" + shape.keySet();
    }
}
