package io.shapeform.core.export;

import static io.shapeform.core.schema.Schemas.array;
import static io.shapeform.core.schema.Schemas.date;
import static io.shapeform.core.schema.Schemas.discriminatedUnion;
import static io.shapeform.core.schema.Schemas.enum_;
import static io.shapeform.core.schema.Schemas.field;
import static io.shapeform.core.schema.Schemas.lazy;
import static io.shapeform.core.schema.Schemas.literal;
import static io.shapeform.core.schema.Schemas.never;
import static io.shapeform.core.schema.Schemas.number;
import static io.shapeform.core.schema.Schemas.object;
import static io.shapeform.core.schema.Schemas.preprocess;
import static io.shapeform.core.schema.Schemas.string;
import static io.shapeform.core.schema.Schemas.tuple;
import static io.shapeform.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import io.shapeform.core.schema.ObjectSchema;
import io.shapeform.core.schema.Schema;
import io.shapeform.core.schema.Schemas;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Checks the exported documents structurally and, for the constraints JSON Schema can express,
 * that an independent 2020-12 validator accepts and rejects the same inputs as the engine.
 */
@DisplayName("JsonSchemaExporterTest")
class JsonSchemaExporterTest {

    private static final JsonSchemaFactory FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static boolean validatorAccepts(ObjectNode document, JsonNode value) {
        JsonSchema schema = FACTORY.getSchema(document);
        return schema.validate(value).isEmpty();
    }

    private static void assertAgreement(Schema schema, String... inputs) {
        ObjectNode document = JsonSchemaExporter.export(schema);
        for (String input : inputs) {
            JsonNode value = json(input);
            assertThat(validatorAccepts(document, value))
                    .as("validator verdict for %s", input)
                    .isEqualTo(schema.safeParse(value).isSuccess());
        }
    }

    // --- Structure ---

    @Test
    void documentDeclaresDialect() {
        assertThat(JsonSchemaExporter.export(string()).get("$schema").asText())
                .isEqualTo("https://json-schema.org/draft/2020-12/schema");
    }

    @Test
    void stringConstraints() {
        ObjectNode out = JsonSchemaExporter.export(string().min(2).max(5).email().regex("^a").startsWith("a.b"));

        assertThat(out.get("type").asText()).isEqualTo("string");
        assertThat(out.get("minLength").asInt()).isEqualTo(2);
        assertThat(out.get("maxLength").asInt()).isEqualTo(5);
        assertThat(out.get("format").asText()).isEqualTo("email");
        assertThat(out.get("allOf")).isEqualTo(json("[{pattern: '^a'}, {pattern: '^a\\\\.b'}]"));
    }

    @Test
    void numberConstraints() {
        ObjectNode out = JsonSchemaExporter.export(number().integer().gt(0).lte(100).multipleOf(5));

        assertThat(out.get("type").asText()).isEqualTo("integer");
        assertThat(out.get("exclusiveMinimum").asInt()).isZero();
        assertThat(out.get("maximum").asInt()).isEqualTo(100);
        assertThat(out.get("multipleOf").asInt()).isEqualTo(5);
    }

    @Test
    void objectRequiredAndStrictness() {
        ObjectNode out = JsonSchemaExporter.export(object(
                        field("id", number()),
                        field("nick", string().optional()),
                        field("role", string().withDefault("user")),
                        field("note", string().nullable()))
                .strict());

        assertThat(out.get("required")).isEqualTo(json("['id', 'note']"));
        assertThat(out.get("additionalProperties").asBoolean()).isFalse();
        assertThat(out.at("/properties/role/default").asText()).isEqualTo("user");
        assertThat(out.at("/properties/note/anyOf/1/type").asText()).isEqualTo("null");
    }

    @Test
    void tuplesUsePrefixItems() {
        ObjectNode closed = JsonSchemaExporter.export(tuple(string(), number()));
        ObjectNode open = JsonSchemaExporter.export(tuple(string()).rest(number()));

        assertThat(closed.get("prefixItems")).hasSize(2);
        assertThat(closed.get("items").asBoolean(true)).isFalse();
        assertThat(open.at("/items/type").asText()).isEqualTo("number");
    }

    @Test
    void unionsAndSpecialNodes() {
        assertThat(JsonSchemaExporter.export(string().or(number())).get("anyOf")).hasSize(2);
        assertThat(JsonSchemaExporter.export(number().and(number().min(1))).get("allOf")).hasSize(2);
        assertThat(JsonSchemaExporter.export(date()).get("format").asText()).isEqualTo("date-time");
        assertThat(JsonSchemaExporter.export(never()).has("not")).isTrue();
        assertThat(JsonSchemaExporter.export(preprocess(v -> v, number())).size()).isEqualTo(1);
        assertThat(JsonSchemaExporter.export(Schemas.record(string().min(1), number())).has("propertyNames")).isTrue();
    }

    @Test
    void lazyNodesBecomeDefinitions() {
        AtomicReference<Schema> ref = new AtomicReference<>();
        ObjectSchema tree = object(field("value", number()), field("children", array(lazy(ref::get))));
        ref.set(tree);

        ObjectNode out = JsonSchemaExporter.export(tree);

        assertThat(out.at("/properties/children/items/$ref").asText()).isEqualTo("#/$defs/Lazy1");
        assertThat(out.at("/$defs/Lazy1/properties/children/items/$ref").asText()).isEqualTo("#/$defs/Lazy1");
    }

    // --- Agreement with an independent validator ---

    @Test
    void objectAgreement() {
        Schema schema = object(
                        field("name", string().min(1).max(10)),
                        field("age", number().integer().gte(0)),
                        field("tags", array(enum_("a", "b")).max(2).optional()))
                .strict();

        assertAgreement(
                schema,
                "{name: 'Ada', age: 36}",
                "{name: 'Ada', age: 36, tags: ['a', 'b']}",
                "{name: '', age: 36}",
                "{name: 'Ada', age: -1}",
                "{name: 'Ada', age: 1.5}",
                "{name: 'Ada'}",
                "{name: 'Ada', age: 1, extra: true}",
                "{name: 'Ada', age: 1, tags: ['c']}",
                "{name: 'Ada', age: 1, tags: ['a', 'a', 'b']}",
                "[]");
    }

    @Test
    void discriminatedUnionAgreement() {
        Schema schema = discriminatedUnion(
                "type",
                object(field("type", literal("user")), field("name", string())),
                object(field("type", literal("admin")), field("level", number())));

        assertAgreement(
                schema,
                "{type: 'user', name: 'Bob'}",
                "{type: 'admin', level: 3}",
                "{type: 'guest', name: 'Bob'}",
                "{type: 'admin', name: 'Bob'}");
    }

    @Test
    void tupleAgreement() {
        assertAgreement(tuple(number(), number()).rest(string()), "[1, 2]", "[1, 2, 'x', 'y']", "[1]", "[1, 2, 3]");
        assertAgreement(tuple(number()), "[1]", "[1, 2]", "['x']");
    }

    @Test
    void recursiveAgreement() {
        AtomicReference<Schema> ref = new AtomicReference<>();
        ObjectSchema tree = object(field("value", number()), field("children", array(lazy(ref::get))));
        ref.set(tree);

        assertAgreement(
                tree,
                "{value: 1, children: []}",
                "{value: 1, children: [{value: 2, children: []}]}",
                "{value: 1, children: [{value: 'x', children: []}]}",
                "{value: 1, children: [{value: 2}]}");
    }
}
