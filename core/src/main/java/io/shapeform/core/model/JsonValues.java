package io.shapeform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.POJONode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions between plain Java data and the {@link JsonNode} tree the engine walks.
 *
 * <ul>
 * <li>{@code null} → {@link NullNode}</li>
 * <li>{@link Map} → {@link ObjectNode} (keys via {@code String.valueOf}), {@link Collection} and
 * arrays → {@link ArrayNode}</li>
 * <li>String, Number, Boolean → value nodes</li>
 * <li>{@code java.time} values and {@link Date} → {@link POJONode}; these are the "date" kind</li>
 * <li>anything else → {@link POJONode}</li>
 * </ul>
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonValues {

    /** Shared mapper for typed reads of validated trees. */
    public static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {}

    /** The absent ("undefined") sentinel. */
    public static JsonNode absent() {
        return MissingNode.getInstance();
    }

    /** Converts plain Java data into a tree. {@link JsonNode} input is returned unchanged. */
    public static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? toNode(optional.get()) : absent();
        }
        if (value instanceof String s) {
            return NODES.textNode(s);
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Number n) {
            return numberNode(n);
        }
        if (value instanceof Character c) {
            return NODES.textNode(String.valueOf(c));
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode object = NODES.objectNode();
            map.forEach((k, v) -> {
                JsonNode child = toNode(v);
                if (!child.isMissingNode()) {
                    object.set(String.valueOf(k), child);
                }
            });
            return object;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode array = NODES.arrayNode(collection.size());
            collection.forEach(v -> array.add(toNode(v)));
            return array;
        }
        if (value instanceof Object[] elements) {
            ArrayNode array = NODES.arrayNode(elements.length);
            for (Object element : elements) {
                array.add(toNode(element));
            }
            return array;
        }
        if (value instanceof Enum<?> e) {
            return NODES.textNode(e.name());
        }
        return NODES.pojoNode(value);
    }

    /**
     * Returns {@code true} if the node is a date value: a {@link POJONode} wrapping a
     * {@link TemporalAccessor} or a {@link Date}.
     */
    public static boolean isDate(JsonNode node) {
        if (!(node instanceof POJONode pojo)) {
            return false;
        }
        Object wrapped = pojo.getPojo();
        return wrapped instanceof TemporalAccessor || wrapped instanceof Date;
    }

    /**
     * Resolves a date node to an instant. Local dates and date-times are read as UTC. Returns empty
     * when the wrapped temporal carries no date (e.g. a {@code LocalTime}).
     */
    public static Optional<Instant> toInstant(JsonNode node) {
        if (!(node instanceof POJONode pojo)) {
            return Optional.empty();
        }
        Object wrapped = pojo.getPojo();
        if (wrapped instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (wrapped instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (wrapped instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (wrapped instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toInstant(ZoneOffset.UTC));
        }
        if (wrapped instanceof TemporalAccessor temporal && temporal.isSupported(ChronoField.INSTANT_SECONDS)) {
            return Optional.of(Instant.from(temporal));
        }
        return Optional.empty();
    }

    /**
     * Returns the kind name of a value as reported in {@code invalid_type} issues: {@code string},
     * {@code number}, {@code nan}, {@code boolean}, {@code date}, {@code null}, {@code undefined},
     * {@code array}, {@code object} or {@code unknown}.
     */
    public static String typeName(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "undefined";
        }
        if (node.isNull()) {
            return "null";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isNumber()) {
            return Double.isNaN(node.doubleValue()) ? "nan" : "number";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        if (node.isArray()) {
            return "array";
        }
        if (node.isObject()) {
            return "object";
        }
        if (isDate(node)) {
            return "date";
        }
        return "unknown";
    }

    /** Numeric equality across node representations (e.g. {@code 1} equals {@code 1.0}). */
    public static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            double da = a.doubleValue();
            double db = b.doubleValue();
            if (Double.isNaN(da) || Double.isNaN(db) || Double.isInfinite(da) || Double.isInfinite(db)) {
                return da == db;
            }
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (isDate(a) && isDate(b)) {
            return toInstant(a).equals(toInstant(b));
        }
        return a.equals(b);
    }

    private static JsonNode numberNode(Number n) {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return NODES.numberNode(n.intValue());
        }
        if (n instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (n instanceof Float f) {
            return NODES.numberNode(f);
        }
        if (n instanceof BigDecimal d) {
            return NODES.numberNode(d);
        }
        if (n instanceof BigInteger i) {
            return NODES.numberNode(i);
        }
        return NODES.numberNode(n.doubleValue());
    }
}
