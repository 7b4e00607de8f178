package io.shapeform.core.engine;

import static io.shapeform.core.schema.Schemas.array;
import static io.shapeform.core.schema.Schemas.discriminatedUnion;
import static io.shapeform.core.schema.Schemas.field;
import static io.shapeform.core.schema.Schemas.literal;
import static io.shapeform.core.schema.Schemas.number;
import static io.shapeform.core.schema.Schemas.object;
import static io.shapeform.core.schema.Schemas.string;
import static io.shapeform.core.schema.Schemas.tuple;
import static io.shapeform.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.error.ValidationException;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.ParseResult;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.schema.ObjectSchema;
import io.shapeform.core.schema.Schema;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** End-to-end behaviour of the documented usage scenarios. */
@DisplayName("ScenarioTest")
class ScenarioTest {

    @Nested
    @DisplayName("A: plain string")
    class PlainString {

        @Test
        void acceptsText() {
            assertThat(string().parse("Hello").textValue()).isEqualTo("Hello");
        }

        @Test
        void rejectsNumberWithSingleRootIssue() {
            ParseResult result = string().safeParse(123);

            assertThat(result.isFailure()).isTrue();
            assertThat(result.issues()).hasSize(1);
            Issue issue = result.issues().get(0);
            assertThat(issue.code()).isEqualTo(IssueCode.INVALID_TYPE);
            assertThat(issue.path()).isEqualTo(ValuePath.root());
            assertThat(issue.message()).isEqualTo("Expected string, received number");
        }

        @Test
        void parseRaisesAggregatedError() {
            assertThatThrownBy(() -> string().parse(123))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).issues()).hasSize(1));
        }
    }

    @Nested
    @DisplayName("B: tuple with rest")
    class TupleWithRest {

        private final Schema schema = tuple(number(), number()).rest(string());

        @Test
        void acceptsTrailingRestElements() {
            JsonNode input = json("[10, 20, 'red', 'large']");

            assertThat(schema.parse(input)).isEqualTo(input);
        }

        @Test
        void reportsBadRestElementAtItsIndex() {
            ParseResult result = schema.safeParse(json("[10, 20, true]"));

            assertThat(result.issues()).hasSize(1);
            assertThat(result.issues().get(0).path()).isEqualTo(ValuePath.of(2));
            assertThat(result.issues().get(0).code()).isEqualTo(IssueCode.INVALID_TYPE);
        }
    }

    @Nested
    @DisplayName("C: discriminated union")
    class DiscriminatedDispatch {

        private final Schema schema = discriminatedUnion(
                "type",
                Map.<String, ObjectSchema>of(
                        "user", object(field("type", literal("user")), field("name", string())),
                        "admin",
                        object(
                                field("type", literal("admin")),
                                field("name", string()),
                                field("permissions", array(string())))));

        @Test
        void unknownDiscriminatorYieldsOneIssueAtDiscriminator() {
            ParseResult result = schema.safeParse(json("{type: 'guest', name: 'Bob'}"));

            assertThat(result.issues()).hasSize(1);
            assertThat(result.issues().get(0).path()).isEqualTo(ValuePath.of("type"));
            assertThat(result.issues().get(0).code()).isEqualTo(IssueCode.INVALID_UNION_DISCRIMINATOR);
        }

        @Test
        void matchedBranchValidates() {
            JsonNode admin = json("{type: 'admin', name: 'Ada', permissions: ['read']}");

            assertThat(schema.parse(admin)).isEqualTo(admin);
        }
    }

    @Nested
    @DisplayName("D: password rules")
    class PasswordRules {

        private final Schema schema = string()
                .min(8)
                .refine(v -> Pattern.compile("[A-Z]").matcher(v.textValue()).find(), "Missing uppercase letter")
                .refine(v -> Pattern.compile("[a-z]").matcher(v.textValue()).find(), "Missing lowercase letter")
                .refine(v -> Pattern.compile("[0-9]").matcher(v.textValue()).find(), "Missing digit")
                .refine(v -> Pattern.compile("[^A-Za-z0-9]").matcher(v.textValue()).find(), "Missing special character");

        @Test
        void reportsLengthAndEveryFailingRuleInDeclarationOrder() {
            ParseResult result = schema.safeParse("abc123");

            assertThat(result.issues())
                    .extracting(Issue::code)
                    .containsExactly(IssueCode.TOO_SMALL, IssueCode.CUSTOM, IssueCode.CUSTOM);
            assertThat(result.issues())
                    .extracting(Issue::message)
                    .containsExactly(
                            "String must contain at least 8 character(s)",
                            "Missing uppercase letter",
                            "Missing special character");
        }

        @Test
        void acceptsStrongPassword() {
            assertThat(schema.parse("Abcdef1!").textValue()).isEqualTo("Abcdef1!");
        }
    }

    @Nested
    @DisplayName("E: asynchronous refinement")
    class AsyncRefinement {

        private final Schema schema = string()
                .refineAsync(v -> CompletableFuture.supplyAsync(() -> !"admin".equals(v.textValue())), "Name is reserved");

        @Test
        void rejectsReservedNameWithOneCustomIssue() {
            ParseResult result = schema.safeParseAsync("admin").join();

            assertThat(result.issues()).hasSize(1);
            assertThat(result.issues().get(0).code()).isEqualTo(IssueCode.CUSTOM);
            assertThat(result.issues().get(0).message()).isEqualTo("Name is reserved");
        }

        @Test
        void acceptsOtherNames() {
            assertThat(schema.parseAsync("alice").join().textValue()).isEqualTo("alice");
        }

        @Test
        void parseAsyncFailsWithAggregatedError() {
            assertThatThrownBy(() -> schema.parseAsync("admin").join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(ValidationException.class);
        }

        @Test
        void synchronousParseRefusesAsyncEffect() {
            ParseResult result = schema.safeParse("alice");

            assertThat(result.issues())
                    .extracting(Issue::code)
                    .isEqualTo(List.of(IssueCode.ASYNC_EFFECT_ENCOUNTERED));
        }
    }
}
