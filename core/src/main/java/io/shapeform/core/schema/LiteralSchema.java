package io.shapeform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** Accepts exactly one value, compared with numeric-aware equality. */
public final class LiteralSchema extends Schema {

    private final JsonNode value;

    LiteralSchema(JsonNode value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.LITERAL;
    }

    public JsonNode value() {
        return value;
    }

    @Override
    public String toString() {
        return "literal(" + value + ")";
    }
}
