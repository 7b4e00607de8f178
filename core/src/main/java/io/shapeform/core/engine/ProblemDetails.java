package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shapeform.core.error.ValidationException;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.JsonValues;
import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;

/**
 * Builds RFC 9457 Problem Details bodies from a {@link ValidationException}, for boundary layers
 * that map a failed {@code parse} to a 4xx response. Each issue is listed verbatim under
 * {@code issues} with its code, JSON Pointer path, segment list, message and params.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ProblemDetails {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final int DEFAULT_STATUS = 400;
    private static final String DEFAULT_TITLE = "Validation Failed";

    private final int status;
    private final String title;

    /** Creates a builder with status 400. */
    public ProblemDetails() {
        this(DEFAULT_STATUS);
    }

    /**
     * @param status the HTTP status code, typically 400 or 422
     */
    public ProblemDetails(int status) {
        this(status, DEFAULT_TITLE);
    }

    public ProblemDetails(int status, String title) {
        if (status < 400 || status > 499) {
            throw new IllegalArgumentException("status must be a 4xx code, got: " + status);
        }
        this.status = status;
        this.title = title == null ? DEFAULT_TITLE : title;
    }

    /**
     * Builds the problem body.
     *
     * @param exception    the aggregated validation error
     * @param instancePath the request path, may be null
     */
    public ObjectNode build(ValidationException exception, String instancePath) {
        ObjectNode response = NODES.objectNode();
        response.put("type", ValidationException.URN);
        response.put("title", title);
        response.put("status", status);
        response.put("detail", exception.getMessage());
        if (instancePath != null) {
            response.put("instance", instancePath);
        } else {
            response.putNull("instance");
        }
        ArrayNode issues = response.putArray("issues");
        for (Issue issue : exception.issues()) {
            issues.add(toJson(issue));
        }
        return response;
    }

    public int status() {
        return status;
    }

    /** Renders one issue as JSON. */
    public static ObjectNode toJson(Issue issue) {
        ObjectNode node = NODES.objectNode();
        node.put("code", issue.code().id());
        node.put("pointer", issue.path().toJsonPointer());
        ArrayNode path = node.putArray("path");
        for (Object segment : issue.path().segments()) {
            if (segment instanceof Integer index) {
                path.add(index);
            } else {
                path.add((String) segment);
            }
        }
        node.put("message", issue.message());
        if (!issue.params().isEmpty()) {
            ObjectNode params = node.putObject("params");
            issue.params().forEach((name, value) -> params.set(name, paramToJson(value)));
        }
        return node;
    }

    private static JsonNode paramToJson(Object value) {
        if (value instanceof Issue nested) {
            return toJson(nested);
        }
        if (value instanceof JsonNode node) {
            if (node.isMissingNode()) {
                return NODES.nullNode();
            }
            if (JsonValues.isDate(node)) {
                return JsonValues.toInstant(node)
                        .<JsonNode>map(instant -> NODES.textNode(instant.toString()))
                        .orElse(NODES.nullNode());
            }
            return node;
        }
        if (value instanceof Collection<?> items) {
            ArrayNode array = NODES.arrayNode(items.size());
            items.forEach(item -> array.add(paramToJson(item)));
            return array;
        }
        if (value instanceof BigDecimal decimal) {
            return NODES.numberNode(new BigDecimal(decimal.stripTrailingZeros().toPlainString()));
        }
        if (value instanceof TemporalAccessor temporal) {
            return NODES.textNode(temporal.toString());
        }
        return JsonValues.toNode(value);
    }
}
