package io.shapeform.core.schema;

import static io.shapeform.core.schema.Schemas.array;
import static io.shapeform.core.schema.Schemas.field;
import static io.shapeform.core.schema.Schemas.number;
import static io.shapeform.core.schema.Schemas.object;
import static io.shapeform.core.schema.Schemas.string;
import static io.shapeform.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shapeform.core.error.SchemaDefinitionException;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.ParseResult;
import io.shapeform.core.model.ValuePath;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ObjectSchemaTest")
class ObjectSchemaTest {

    private final ObjectSchema user = object(
            field("name", string()), field("age", number().integer()), field("email", string().email()));

    record User(String name, int age, String email) {}

    // --- Fields ---

    @Test
    void validObjectIsReturned() {
        var input = json("{name: 'Ada', age: 36, email: 'ada@example.com'}");

        assertThat(user.parse(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("every field is checked; issues follow declaration order")
    void noShortCircuit() {
        ParseResult result = user.safeParse(json("{email: 'bad', age: 'x', name: 1}"));

        assertThat(result.issues()).extracting(Issue::path)
                .containsExactly(ValuePath.of("name"), ValuePath.of("age"), ValuePath.of("email"));
        assertThat(result.issues()).extracting(Issue::code).containsExactly(
                IssueCode.INVALID_TYPE, IssueCode.INVALID_TYPE, IssueCode.INVALID_STRING_FORMAT);
    }

    @Test
    void missingFieldIsRequired() {
        ParseResult result = user.safeParse(json("{name: 'Ada', email: 'ada@example.com'}"));

        assertThat(result.issues()).hasSize(1);
        assertThat(result.issues().get(0).path()).isEqualTo(ValuePath.of("age"));
        assertThat(result.issues().get(0).message()).isEqualTo("Required");
    }

    @Test
    @DisplayName("nested issues carry the full path")
    void nestedPath() {
        ObjectSchema order = object(field("items", array(object(field("name", string())))));

        ParseResult result = order.safeParse(json("{items: [{name: 'a'}, {name: 'b'}, {name: 3}]}"));

        assertThat(result.issues()).extracting(Issue::path).containsExactly(ValuePath.of("items", 2, "name"));
        assertThat(result.issues().get(0).path().toString()).isEqualTo("items[2].name");
    }

    @Test
    void nonObjectInput() {
        assertThat(user.safeParse(json("[1]")).issues()).extracting(Issue::message)
                .containsExactly("Expected object, received array");
    }

    @Test
    void readsAsJavaRecord() {
        User parsed = user.parse(json("{name: 'Ada', age: 36, email: 'ada@example.com'}"), User.class);

        assertThat(parsed).isEqualTo(new User("Ada", 36, "ada@example.com"));
    }

    @Test
    void acceptsPlainMaps() {
        assertThat(user.safeParse(Map.of("name", "Ada", "age", 36, "email", "ada@example.com")).isSuccess())
                .isTrue();
    }

    // --- Unknown keys ---

    @Test
    @DisplayName("strip is the default and drops undeclared keys")
    void stripByDefault() {
        ObjectSchema schema = object(field("a", number()));

        assertThat(schema.unknownKeys()).isEqualTo(UnknownKeys.STRIP);
        assertThat(schema.parse(json("{a: 1, b: 2}"))).isEqualTo(json("{a: 1}"));
    }

    @Test
    void passthroughKeepsUndeclaredKeys() {
        ObjectSchema schema = object(field("a", number())).passthrough();

        assertThat(schema.parse(json("{a: 1, b: 2, c: 'x'}"))).isEqualTo(json("{a: 1, b: 2, c: 'x'}"));
    }

    @Test
    @DisplayName("strict reports every undeclared key after field issues")
    void strictReportsKeys() {
        ObjectSchema schema = object(field("a", number())).strict();

        ParseResult result = schema.safeParse(json("{a: 'x', b: 2, c: 3}"));

        assertThat(result.issues()).extracting(Issue::code)
                .containsExactly(IssueCode.INVALID_TYPE, IssueCode.UNRECOGNIZED_KEYS);
        Issue keys = result.issues().get(1);
        assertThat(keys.path()).isEqualTo(ValuePath.root());
        assertThat(keys.param("keys")).isEqualTo(List.of("b", "c"));
        assertThat(keys.message()).isEqualTo("Unrecognized key(s) in object: 'b', 'c'");
    }

    @Test
    void policySwitchesReturnNewNodes() {
        ObjectSchema base = object(field("a", number()));

        assertThat(base.strict()).isNotSameAs(base);
        assertThat(base.strip()).isSameAs(base);
        assertThat(base.strict().strip().unknownKeys()).isEqualTo(UnknownKeys.STRIP);
    }

    // --- Definition ---

    @Test
    void duplicateFieldIsRejected() {
        assertThatThrownBy(() -> object(field("a", string()), field("a", number())))
                .isInstanceOf(SchemaDefinitionException.class)
                .hasMessageContaining("'a'");
    }

    @Test
    void shapeKeepsDeclarationOrder() {
        assertThat(user.shape().keySet()).containsExactly("name", "age", "email");
    }
}
