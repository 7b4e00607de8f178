package io.shapeform.core.schema;

import static io.shapeform.core.schema.Schemas.field;
import static io.shapeform.core.schema.Schemas.number;
import static io.shapeform.core.schema.Schemas.object;
import static io.shapeform.core.schema.Schemas.string;
import static io.shapeform.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.TextNode;
import io.shapeform.core.error.SchemaDefinitionException;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.ValuePath;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ObjectCombinatorTest")
class ObjectCombinatorTest {

    private final ObjectSchema base = object(field("id", number()), field("name", string()), field("email", string()));

    // --- extend / merge ---

    @Test
    void extendAppendsAndReplacesInPlace() {
        ObjectSchema extended = base.extend(field("role", string()), field("id", string()));

        assertThat(extended.shape().keySet()).containsExactly("id", "name", "email", "role");
        assertThat(extended.shape().get("id").kind()).isEqualTo(SchemaKind.STRING);
        assertThat(base.shape()).hasSize(3);
    }

    @Test
    void mergeTakesOtherFieldsAndKeepsReceiverPolicy() {
        ObjectSchema other = object(field("name", number()), field("active", Schemas.boolean_())).passthrough();

        ObjectSchema merged = base.strict().merge(other);

        assertThat(merged.shape().keySet()).containsExactly("id", "name", "email", "active");
        assertThat(merged.shape().get("name").kind()).isEqualTo(SchemaKind.NUMBER);
        assertThat(merged.unknownKeys()).isEqualTo(UnknownKeys.STRICT);
    }

    // --- partial / required ---

    @Test
    void partialAcceptsEmptyObject() {
        assertThat(base.partial().parse(json("{}"))).isEqualTo(json("{}"));
    }

    @Test
    @DisplayName("partial applied twice equals partial once")
    void partialIsIdempotent() {
        ObjectSchema once = base.partial();
        ObjectSchema twice = once.partial();

        once.shape().forEach((name, schema) -> {
            assertThat(twice.shape().get(name)).isSameAs(schema);
            assertThat(((OptionalSchema) schema).unwrap()).isNotInstanceOf(OptionalSchema.class);
        });
    }

    @Test
    void partialByName() {
        ObjectSchema schema = base.partial("email");

        assertThat(schema.shape().get("email")).isInstanceOf(OptionalSchema.class);
        assertThat(schema.shape().get("name")).isSameAs(base.shape().get("name"));
        assertThat(schema.safeParse(json("{id: 1, name: 'a'}")).isSuccess()).isTrue();
    }

    @Test
    void requiredUndoesPartial() {
        ObjectSchema schema = base.partial().required();

        assertThat(schema.shape()).isEqualTo(base.shape());
        assertThat(schema.safeParse(json("{}")).issues()).extracting(Issue::path)
                .containsExactly(ValuePath.of("id"), ValuePath.of("name"), ValuePath.of("email"));
    }

    @Test
    void requiredByName() {
        ObjectSchema schema = base.partial().required("id");

        assertThat(schema.safeParse(json("{}")).issues()).extracting(Issue::path).containsExactly(ValuePath.of("id"));
    }

    // --- pick / omit ---

    @Test
    void pickKeepsDeclarationOrder() {
        assertThat(base.pick("email", "id").shape().keySet()).containsExactly("id", "email");
    }

    @Test
    void omitDropsFields() {
        ObjectSchema schema = base.omit("email");

        assertThat(schema.shape().keySet()).containsExactly("id", "name");
        assertThat(schema.parse(json("{id: 1, name: 'a', email: 'x'}"))).isEqualTo(json("{id: 1, name: 'a'}"));
    }

    @Test
    void unknownFieldNamesAreDefinitionErrors() {
        assertThatThrownBy(() -> base.pick("nope"))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> base.omit("nope")).isInstanceOf(SchemaDefinitionException.class);
        assertThatThrownBy(() -> base.partial("nope")).isInstanceOf(SchemaDefinitionException.class);
    }

    // --- keyof ---

    @Test
    void keyofEnumeratesFieldNames() {
        EnumSchema keys = base.keyof();

        assertThat(keys.options()).containsExactly(
                TextNode.valueOf("id"), TextNode.valueOf("name"), TextNode.valueOf("email"));
        assertThat(keys.safeParse("other").isFailure()).isTrue();
    }

    @Test
    void keyofEmptyShapeIsRejected() {
        assertThatThrownBy(() -> object(Map.of()).keyof()).isInstanceOf(SchemaDefinitionException.class);
    }
}
