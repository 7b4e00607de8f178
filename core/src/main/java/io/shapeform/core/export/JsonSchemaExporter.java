package io.shapeform.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shapeform.core.schema.ArraySchema;
import io.shapeform.core.schema.DefaultSchema;
import io.shapeform.core.schema.DiscriminatedUnionSchema;
import io.shapeform.core.schema.Effect;
import io.shapeform.core.schema.EffectsSchema;
import io.shapeform.core.schema.EnumSchema;
import io.shapeform.core.schema.IntersectionSchema;
import io.shapeform.core.schema.LazySchema;
import io.shapeform.core.schema.LiteralSchema;
import io.shapeform.core.schema.NullableSchema;
import io.shapeform.core.schema.NumberCheck;
import io.shapeform.core.schema.NumberSchema;
import io.shapeform.core.schema.ObjectSchema;
import io.shapeform.core.schema.OptionalSchema;
import io.shapeform.core.schema.RecordSchema;
import io.shapeform.core.schema.Schema;
import io.shapeform.core.schema.SizeCheck;
import io.shapeform.core.schema.StringCheck;
import io.shapeform.core.schema.StringSchema;
import io.shapeform.core.schema.TupleSchema;
import io.shapeform.core.schema.UnionSchema;
import io.shapeform.core.schema.UnknownKeys;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a schema tree as a JSON Schema 2020-12 document describing the accepted input.
 *
 * <p>
 * Refinements and transforms have no JSON Schema counterpart and are left out; a node with a
 * preprocess step accepts any input. Dates export as {@code date-time} strings, their JSON
 * form. Lazy nodes become entries under {@code $defs} referenced with {@code $ref}, which keeps
 * recursive schemas finite.
 *
 * <p>
 * Not thread-safe: use one instance per export.
 */
public final class JsonSchemaExporter {

    public static final String DIALECT = "https://json-schema.org/draft/2020-12/schema";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final String META_CHARS = "\\^$.|?*+()[]{}/";

    private final Map<LazySchema, String> lazyNames = new IdentityHashMap<>();
    private final ObjectNode defs = NODES.objectNode();

    private JsonSchemaExporter() {}

    /** Exports {@code schema} as a standalone 2020-12 document. */
    public static ObjectNode export(Schema schema) {
        JsonSchemaExporter exporter = new JsonSchemaExporter();
        ObjectNode body = exporter.node(schema);
        ObjectNode document = NODES.objectNode();
        document.put("$schema", DIALECT);
        document.setAll(body);
        if (!exporter.defs.isEmpty()) {
            document.set("$defs", exporter.defs);
        }
        return document;
    }

    private ObjectNode node(Schema schema) {
        return switch (schema.kind()) {
            case STRING -> string((StringSchema) schema);
            case NUMBER -> number((NumberSchema) schema);
            case BOOLEAN -> type("boolean");
            case DATE -> dateTime();
            case NULL -> type("null");
            case UNDEFINED, NEVER -> nothing();
            case ANY -> NODES.objectNode();
            case LITERAL -> {
                ObjectNode out = NODES.objectNode();
                out.set("const", ((LiteralSchema) schema).value());
                yield out;
            }
            case ENUM -> {
                ObjectNode out = NODES.objectNode();
                ArrayNode values = out.putArray("enum");
                ((EnumSchema) schema).options().forEach(values::add);
                yield out;
            }
            case OBJECT -> object((ObjectSchema) schema);
            case ARRAY -> array((ArraySchema) schema);
            case TUPLE -> tuple((TupleSchema) schema);
            case UNION -> combined("anyOf", ((UnionSchema) schema).options());
            case DISCRIMINATED_UNION -> combined("oneOf", ((DiscriminatedUnionSchema) schema).options());
            case INTERSECTION -> {
                IntersectionSchema both = (IntersectionSchema) schema;
                yield combined("allOf", List.of(both.left(), both.right()));
            }
            case RECORD -> record((RecordSchema) schema);
            case OPTIONAL -> node(((OptionalSchema) schema).unwrap());
            case NULLABLE -> {
                ObjectNode out = NODES.objectNode();
                ArrayNode anyOf = out.putArray("anyOf");
                anyOf.add(node(((NullableSchema) schema).unwrap()));
                anyOf.add(type("null"));
                yield out;
            }
            case DEFAULT -> {
                DefaultSchema withDefault = (DefaultSchema) schema;
                ObjectNode out = node(withDefault.unwrap());
                JsonNode value = withDefault.defaultValue();
                if (!value.isMissingNode() && !value.isPojo()) {
                    out.set("default", value);
                }
                yield out;
            }
            case EFFECTS -> {
                EffectsSchema effects = (EffectsSchema) schema;
                boolean preprocessed = effects.effects().stream().anyMatch(e -> e instanceof Effect.Preprocess);
                yield preprocessed ? NODES.objectNode() : node(effects.inner());
            }
            case LAZY -> lazy((LazySchema) schema);
        };
    }

    private ObjectNode string(StringSchema schema) {
        ObjectNode out = type("string");
        ArrayNode patterns = NODES.arrayNode();
        for (StringCheck check : schema.checks()) {
            switch (check.kind()) {
                case MIN_LENGTH -> out.put("minLength", check.length());
                case MAX_LENGTH -> out.put("maxLength", check.length());
                case LENGTH -> {
                    out.put("minLength", check.length());
                    out.put("maxLength", check.length());
                }
                case REGEX -> patterns.add(check.pattern().pattern());
                case EMAIL -> out.put("format", "email");
                case URL -> out.put("format", "uri");
                case UUID -> out.put("format", "uuid");
                case STARTS_WITH -> patterns.add("^" + escape(check.text()));
                case ENDS_WITH -> patterns.add(escape(check.text()) + "$");
                case INCLUDES -> patterns.add(escape(check.text()));
                default -> {
                    // normalizing checks do not constrain the input
                }
            }
        }
        if (patterns.size() == 1) {
            out.set("pattern", patterns.get(0));
        } else if (patterns.size() > 1) {
            ArrayNode allOf = out.putArray("allOf");
            patterns.forEach(p -> allOf.addObject().set("pattern", p));
        }
        return out;
    }

    private ObjectNode number(NumberSchema schema) {
        boolean integer = schema.checks().stream().anyMatch(c -> c.kind() == NumberCheck.Kind.INT);
        ObjectNode out = type(integer ? "integer" : "number");
        for (NumberCheck check : schema.checks()) {
            switch (check.kind()) {
                case MIN -> out.put(check.inclusive() ? "minimum" : "exclusiveMinimum", check.value());
                case MAX -> out.put(check.inclusive() ? "maximum" : "exclusiveMaximum", check.value());
                case MULTIPLE_OF -> out.put("multipleOf", check.value());
                case SAFE -> {
                    out.put("minimum", NumberCheck.MAX_SAFE_INTEGER.negate());
                    out.put("maximum", NumberCheck.MAX_SAFE_INTEGER);
                }
                default -> {
                    // INT is carried by the type; JSON numbers are always finite
                }
            }
        }
        return out;
    }

    private static ObjectNode dateTime() {
        ObjectNode out = type("string");
        out.put("format", "date-time");
        return out;
    }

    private ObjectNode object(ObjectSchema schema) {
        ObjectNode out = type("object");
        ObjectNode properties = out.putObject("properties");
        ArrayNode required = NODES.arrayNode();
        schema.shape().forEach((name, field) -> {
            properties.set(name, node(field));
            if (!acceptsAbsent(field)) {
                required.add(name);
            }
        });
        if (!required.isEmpty()) {
            out.set("required", required);
        }
        if (schema.unknownKeys() == UnknownKeys.STRICT) {
            out.put("additionalProperties", false);
        }
        return out;
    }

    private ObjectNode array(ArraySchema schema) {
        ObjectNode out = type("array");
        out.set("items", node(schema.element()));
        for (SizeCheck check : schema.checks()) {
            switch (check.kind()) {
                case MIN -> out.put("minItems", check.value());
                case MAX -> out.put("maxItems", check.value());
                case EXACT -> {
                    out.put("minItems", check.value());
                    out.put("maxItems", check.value());
                }
            }
        }
        return out;
    }

    private ObjectNode tuple(TupleSchema schema) {
        ObjectNode out = type("array");
        ArrayNode prefix = out.putArray("prefixItems");
        schema.items().forEach(item -> prefix.add(node(item)));
        out.put("minItems", schema.items().size());
        if (schema.rest().isPresent()) {
            out.set("items", node(schema.rest().get()));
        } else {
            out.put("items", false);
        }
        return out;
    }

    private ObjectNode record(RecordSchema schema) {
        ObjectNode out = type("object");
        schema.key().ifPresent(key -> out.set("propertyNames", node(key)));
        out.set("additionalProperties", node(schema.value()));
        return out;
    }

    private ObjectNode combined(String keyword, List<? extends Schema> options) {
        ObjectNode out = NODES.objectNode();
        ArrayNode list = out.putArray(keyword);
        options.forEach(option -> list.add(node(option)));
        return out;
    }

    private ObjectNode lazy(LazySchema schema) {
        String name = lazyNames.get(schema);
        if (name == null) {
            name = "Lazy" + (lazyNames.size() + 1);
            lazyNames.put(schema, name);
            defs.set(name, NODES.objectNode());
            defs.set(name, node(schema.resolve()));
        }
        ObjectNode ref = NODES.objectNode();
        ref.put("$ref", "#/$defs/" + name);
        return ref;
    }

    /** Whether a field with this node may be left out of an object. */
    private static boolean acceptsAbsent(Schema schema) {
        return switch (schema.kind()) {
            case OPTIONAL, DEFAULT, ANY, UNDEFINED -> true;
            case NULLABLE -> acceptsAbsent(((NullableSchema) schema).unwrap());
            case EFFECTS -> acceptsAbsent(((EffectsSchema) schema).inner());
            case LAZY -> acceptsAbsent(((LazySchema) schema).resolve());
            default -> false;
        };
    }

    private static ObjectNode type(String name) {
        ObjectNode out = NODES.objectNode();
        out.put("type", name);
        return out;
    }

    private static ObjectNode nothing() {
        ObjectNode out = NODES.objectNode();
        out.putObject("not");
        return out;
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (char c : text.toCharArray()) {
            if (META_CHARS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
