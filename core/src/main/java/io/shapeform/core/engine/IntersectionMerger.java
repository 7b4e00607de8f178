package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shapeform.core.model.JsonValues;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Merges the two outputs of an intersection. Objects merge by key union (shared keys merge
 * recursively), equal-length arrays merge element-wise, and anything else must be equal.
 */
final class IntersectionMerger {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private IntersectionMerger() {}

    /** Returns the merged value, or empty if the two sides conflict. */
    static Optional<JsonNode> merge(JsonNode left, JsonNode right) {
        if (left.isObject() && right.isObject()) {
            return mergeObjects((ObjectNode) left, (ObjectNode) right);
        }
        if (left.isArray() && right.isArray()) {
            return mergeArrays((ArrayNode) left, (ArrayNode) right);
        }
        return JsonValues.sameValue(left, right) ? Optional.of(left) : Optional.empty();
    }

    private static Optional<JsonNode> mergeObjects(ObjectNode left, ObjectNode right) {
        ObjectNode merged = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = left.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode other = right.get(field.getKey());
            if (other == null) {
                merged.set(field.getKey(), field.getValue());
                continue;
            }
            Optional<JsonNode> value = merge(field.getValue(), other);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            merged.set(field.getKey(), value.get());
        }
        Iterator<Map.Entry<String, JsonNode>> rest = right.fields();
        while (rest.hasNext()) {
            Map.Entry<String, JsonNode> field = rest.next();
            if (!merged.has(field.getKey())) {
                merged.set(field.getKey(), field.getValue());
            }
        }
        return Optional.of(merged);
    }

    private static Optional<JsonNode> mergeArrays(ArrayNode left, ArrayNode right) {
        if (left.size() != right.size()) {
            return Optional.empty();
        }
        ArrayNode merged = NODES.arrayNode(left.size());
        for (int i = 0; i < left.size(); i++) {
            Optional<JsonNode> element = merge(left.get(i), right.get(i));
            if (element.isEmpty()) {
                return Optional.empty();
            }
            merged.add(element.get());
        }
        return Optional.of(merged);
    }
}
