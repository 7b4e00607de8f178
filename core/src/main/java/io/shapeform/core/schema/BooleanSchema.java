package io.shapeform.core.schema;

/** Accepts {@code true} and {@code false}. */
public final class BooleanSchema extends Schema {

    static final BooleanSchema INSTANCE = new BooleanSchema();

    private BooleanSchema() {}

    @Override
    public SchemaKind kind() {
        return SchemaKind.BOOLEAN;
    }
}
