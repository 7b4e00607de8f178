package io.shapeform.core.schema;

/** Accepts only the absent value. */
public final class UndefinedSchema extends Schema {

    static final UndefinedSchema INSTANCE = new UndefinedSchema();

    private UndefinedSchema() {}

    @Override
    public SchemaKind kind() {
        return SchemaKind.UNDEFINED;
    }
}
