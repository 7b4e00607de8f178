package io.shapeform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Substitutes a default when the input is absent, then validates the substitute with the wrapped
 * node. A present input (including {@code null}) is passed through unchanged.
 */
public final class DefaultSchema extends Schema {

    private final Schema inner;
    private final Supplier<JsonNode> defaultValue;

    DefaultSchema(Schema inner, Supplier<JsonNode> defaultValue) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.DEFAULT;
    }

    public Schema unwrap() {
        return inner;
    }

    /** Produces a fresh default value. */
    public JsonNode defaultValue() {
        return defaultValue.get();
    }
}
