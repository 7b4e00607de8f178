package io.shapeform.core.schema;

import java.util.Objects;

/** Accepts the absent value; anything else goes to the wrapped node. */
public final class OptionalSchema extends Schema {

    private final Schema inner;

    OptionalSchema(Schema inner) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.OPTIONAL;
    }

    public Schema unwrap() {
        return inner;
    }

    /** Already optional: returns this node, so repeated wrapping is a no-op. */
    @Override
    public OptionalSchema optional() {
        return this;
    }

    @Override
    public String toString() {
        return inner + "?";
    }
}
