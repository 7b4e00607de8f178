package io.shapeform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.error.SchemaDefinitionException;
import io.shapeform.core.model.JsonValues;
import java.util.ArrayList;
import java.util.List;

/** Accepts any one of a fixed, ordered set of scalar values. */
public final class EnumSchema extends Schema {

    private final List<JsonNode> options;

    EnumSchema(List<JsonNode> options) {
        if (options.isEmpty()) {
            throw new SchemaDefinitionException("enum requires at least one option");
        }
        List<JsonNode> distinct = new ArrayList<>(options.size());
        for (JsonNode option : options) {
            if (!option.isValueNode() || option.isMissingNode()) {
                throw new SchemaDefinitionException("enum options must be scalar values, got: " + option);
            }
            if (indexOf(distinct, option) >= 0) {
                throw new SchemaDefinitionException("Duplicate enum option: " + option);
            }
            distinct.add(option);
        }
        this.options = List.copyOf(distinct);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ENUM;
    }

    public List<JsonNode> options() {
        return options;
    }

    /** Returns {@code true} if {@code value} is one of the options. */
    public boolean contains(JsonNode value) {
        return indexOf(options, value) >= 0;
    }

    /** A new enum restricted to the given options, which must all belong to this enum. */
    public EnumSchema extract(Object... values) {
        List<JsonNode> kept = new ArrayList<>();
        for (Object value : values) {
            JsonNode node = JsonValues.toNode(value);
            if (!contains(node)) {
                throw new SchemaDefinitionException("Not an option of this enum: " + node);
            }
            kept.add(node);
        }
        return new EnumSchema(kept);
    }

    /** A new enum without the given options. */
    public EnumSchema exclude(Object... values) {
        List<JsonNode> removed = new ArrayList<>();
        for (Object value : values) {
            removed.add(JsonValues.toNode(value));
        }
        List<JsonNode> kept = new ArrayList<>();
        for (JsonNode option : options) {
            if (indexOf(removed, option) < 0) {
                kept.add(option);
            }
        }
        return new EnumSchema(kept);
    }

    private static int indexOf(List<JsonNode> nodes, JsonNode value) {
        for (int i = 0; i < nodes.size(); i++) {
            if (JsonValues.sameValue(nodes.get(i), value)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "enum" + options;
    }
}
