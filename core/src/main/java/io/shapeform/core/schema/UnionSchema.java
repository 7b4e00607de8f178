package io.shapeform.core.schema;

import io.shapeform.core.error.SchemaDefinitionException;
import java.util.List;

/** Accepts a value matching any of its alternatives; the first matching alternative wins. */
public final class UnionSchema extends Schema {

    private final List<Schema> options;

    UnionSchema(List<Schema> options) {
        if (options.isEmpty()) {
            throw new SchemaDefinitionException("union requires at least one option");
        }
        this.options = List.copyOf(options);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.UNION;
    }

    public List<Schema> options() {
        return options;
    }

    @Override
    public String toString() {
        return "union" + options;
    }
}
