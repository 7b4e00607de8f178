package io.shapeform.core.schema;

import java.util.Objects;

/** Accepts {@code null}; anything else goes to the wrapped node. */
public final class NullableSchema extends Schema {

    private final Schema inner;

    NullableSchema(Schema inner) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.NULLABLE;
    }

    public Schema unwrap() {
        return inner;
    }

    @Override
    public NullableSchema nullable() {
        return this;
    }

    @Override
    public String toString() {
        return inner + "|null";
    }
}
