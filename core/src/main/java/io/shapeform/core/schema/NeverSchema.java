package io.shapeform.core.schema;

/** Rejects every value. */
public final class NeverSchema extends Schema {

    static final NeverSchema INSTANCE = new NeverSchema();

    private NeverSchema() {}

    @Override
    public SchemaKind kind() {
        return SchemaKind.NEVER;
    }
}
