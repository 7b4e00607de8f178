package io.shapeform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.error.SchemaDefinitionException;
import io.shapeform.core.model.JsonValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A union of object branches selected by the value of one shared field, the discriminator. The
 * branch is found by a single map lookup instead of trying each alternative.
 *
 * <p>
 * Discriminator values are text, numbers or booleans. Numbers are keyed by their normalized decimal
 * form so that {@code 1} and {@code 1.0} select the same branch.
 */
public final class DiscriminatedUnionSchema extends Schema {

    private final String discriminator;
    private final Map<String, ObjectSchema> branches;
    private final List<JsonNode> values;

    private DiscriminatedUnionSchema(String discriminator, Map<String, ObjectSchema> branches, List<JsonNode> values) {
        this.discriminator = discriminator;
        this.branches = Collections.unmodifiableMap(branches);
        this.values = List.copyOf(values);
    }

    /**
     * Builds the lookup table from each branch's discriminator field, which must be a literal or an
     * enum.
     *
     * @throws SchemaDefinitionException if a branch lacks the field, the field is not a literal or
     *                                   enum, or two branches share a value
     */
    static DiscriminatedUnionSchema of(String discriminator, List<ObjectSchema> options) {
        Objects.requireNonNull(discriminator, "discriminator must not be null");
        if (options.isEmpty()) {
            throw new SchemaDefinitionException("discriminatedUnion requires at least one option");
        }
        Map<String, ObjectSchema> branches = new LinkedHashMap<>();
        List<JsonNode> values = new ArrayList<>();
        for (ObjectSchema option : options) {
            for (JsonNode value : discriminatorValues(discriminator, option)) {
                register(branches, values, value, option);
            }
        }
        return new DiscriminatedUnionSchema(discriminator, branches, values);
    }

    /**
     * Builds the lookup table from an explicit mapping of text discriminator values to branches.
     * Each branch must still declare the discriminator field.
     */
    static DiscriminatedUnionSchema of(String discriminator, Map<String, ObjectSchema> mapping) {
        Objects.requireNonNull(discriminator, "discriminator must not be null");
        if (mapping.isEmpty()) {
            throw new SchemaDefinitionException("discriminatedUnion requires at least one option");
        }
        Map<String, ObjectSchema> branches = new LinkedHashMap<>();
        List<JsonNode> values = new ArrayList<>();
        mapping.forEach((value, option) -> {
            Objects.requireNonNull(option, "branch for '" + value + "' must not be null");
            if (!option.shape().containsKey(discriminator)) {
                throw new SchemaDefinitionException(
                        "Branch for '" + value + "' does not declare discriminator field '" + discriminator + "'");
            }
            register(branches, values, JsonValues.toNode(value), option);
        });
        return new DiscriminatedUnionSchema(discriminator, branches, values);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.DISCRIMINATED_UNION;
    }

    public String discriminator() {
        return discriminator;
    }

    /** The accepted discriminator values, in declaration order. */
    public List<JsonNode> values() {
        return values;
    }

    /** Distinct branches in declaration order. */
    public List<ObjectSchema> options() {
        return branches.values().stream().distinct().toList();
    }

    /** Looks up the branch for a discriminator value. */
    public Optional<ObjectSchema> branchFor(JsonNode value) {
        if (value == null || !isKeyable(value)) {
            return Optional.empty();
        }
        return Optional.ofNullable(branches.get(key(value)));
    }

    private static List<JsonNode> discriminatorValues(String discriminator, ObjectSchema option) {
        Schema field = option.shape().get(discriminator);
        if (field == null) {
            throw new SchemaDefinitionException(
                    "Option " + option + " does not declare discriminator field '" + discriminator + "'");
        }
        if (field instanceof LiteralSchema literal) {
            return List.of(literal.value());
        }
        if (field instanceof EnumSchema enumeration) {
            return enumeration.options();
        }
        throw new SchemaDefinitionException("Discriminator field '" + discriminator
                + "' must be a literal or enum, got: " + field.kind().name().toLowerCase());
    }

    private static void register(
            Map<String, ObjectSchema> branches, List<JsonNode> values, JsonNode value, ObjectSchema option) {
        if (!isKeyable(value)) {
            throw new SchemaDefinitionException("Discriminator value must be text, number or boolean, got: " + value);
        }
        if (branches.putIfAbsent(key(value), option) != null) {
            throw new SchemaDefinitionException("Duplicate discriminator value: " + value);
        }
        values.add(value);
    }

    private static boolean isKeyable(JsonNode value) {
        if (value.isNumber()) {
            double d = value.doubleValue();
            return !Double.isNaN(d) && !Double.isInfinite(d);
        }
        return value.isTextual() || value.isBoolean();
    }

    private static String key(JsonNode value) {
        if (value.isTextual()) {
            return "s:" + value.textValue();
        }
        if (value.isNumber()) {
            return "n:" + value.decimalValue().stripTrailingZeros().toPlainString();
        }
        return "b:" + value.booleanValue();
    }

    @Override
    public String toString() {
        return "discriminatedUnion(" + discriminator + ")" + values;
    }
}
