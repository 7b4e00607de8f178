package io.shapeform.core.schema;

/** Accepts every value, including the absent one. Backs both {@code any()} and {@code unknown()}. */
public final class AnySchema extends Schema {

    static final AnySchema INSTANCE = new AnySchema();

    private AnySchema() {}

    @Override
    public SchemaKind kind() {
        return SchemaKind.ANY;
    }
}
