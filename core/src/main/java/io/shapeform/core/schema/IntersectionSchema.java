package io.shapeform.core.schema;

import java.util.Objects;

/** Accepts a value matching both sides; the two outputs are merged into one. */
public final class IntersectionSchema extends Schema {

    private final Schema left;
    private final Schema right;

    IntersectionSchema(Schema left, Schema right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.INTERSECTION;
    }

    public Schema left() {
        return left;
    }

    public Schema right() {
        return right;
    }
}
