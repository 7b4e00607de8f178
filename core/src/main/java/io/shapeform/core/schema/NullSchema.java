package io.shapeform.core.schema;

/** Accepts only {@code null}. */
public final class NullSchema extends Schema {

    static final NullSchema INSTANCE = new NullSchema();

    private NullSchema() {}

    @Override
    public SchemaKind kind() {
        return SchemaKind.NULL;
    }
}
