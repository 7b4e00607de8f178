package io.shapeform.core.engine;

import static io.shapeform.core.schema.Schemas.field;
import static io.shapeform.core.schema.Schemas.number;
import static io.shapeform.core.schema.Schemas.object;
import static io.shapeform.core.schema.Schemas.preprocess;
import static io.shapeform.core.schema.Schemas.string;
import static io.shapeform.core.schema.Schemas.union;
import static io.shapeform.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shapeform.core.error.EffectEvalException;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.ParseResult;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.schema.RefineOptions;
import io.shapeform.core.schema.RefinementContext;
import io.shapeform.core.schema.Schema;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EffectPipelineTest")
class EffectPipelineTest {

    record Money(long cents) {}

    // --- Refine ---

    @Test
    void failingRefineAddsCustomIssue() {
        ParseResult result = number().refine(v -> v.intValue() % 2 == 0, "Must be even").safeParse(3);

        assertThat(result.issues()).hasSize(1);
        assertThat(result.issues().get(0).code()).isEqualTo(IssueCode.CUSTOM);
        assertThat(result.issues().get(0).message()).isEqualTo("Must be even");
    }

    @Test
    void refineWithoutMessageUsesCatalogDefault() {
        assertThat(number().refine(v -> false).safeParse(3).issues()).extracting(Issue::message)
                .containsExactly("Invalid input");
    }

    @Test
    void refineOptionsRelocateTheIssue() {
        Schema schema = object(field("password", string()), field("confirm", string()))
                .refine(
                        v -> v.get("password").equals(v.get("confirm")),
                        RefineOptions.of("Passwords do not match").at("confirm").withParams(Map.of("rule", "match")));

        Issue issue = schema.safeParse(json("{password: 'a', confirm: 'b'}")).issues().get(0);

        assertThat(issue.path()).isEqualTo(ValuePath.of("confirm"));
        assertThat(issue.param("rule")).isEqualTo("match");
    }

    @Test
    @DisplayName("refinements do not run on a value of the wrong kind")
    void refineSkippedAfterTypeMismatch() {
        AtomicBoolean ran = new AtomicBoolean();
        Schema schema = string().refine(v -> ran.getAndSet(true));

        assertThat(schema.safeParse(5).issues()).extracting(Issue::code).containsExactly(IssueCode.INVALID_TYPE);
        assertThat(ran).isFalse();
    }

    @Test
    @DisplayName("refinements still run after constraint issues")
    void refineRunsAfterConstraintIssue() {
        ParseResult result = string().min(5).refine(v -> false, "also bad").safeParse("abc");

        assertThat(result.issues()).extracting(Issue::code).containsExactly(IssueCode.TOO_SMALL, IssueCode.CUSTOM);
    }

    // --- SuperRefine ---

    @Test
    void superRefineEmitsSeveralIssuesAtSubPaths() {
        Schema schema = object(field("start", number()), field("end", number())).superRefine((v, ctx) -> {
            if (v.get("end").intValue() < v.get("start").intValue()) {
                ctx.addIssue("end before start", ValuePath.of("end"));
                ctx.addIssue("range is inverted");
            }
        });

        ParseResult result = schema.safeParse(json("{start: 5, end: 1}"));

        assertThat(result.issues()).extracting(Issue::path).containsExactly(ValuePath.of("end"), ValuePath.root());
    }

    @Test
    void superRefineWithCatalogCode() {
        Schema schema = string().superRefine((v, ctx) -> ctx.addIssue(
                IssueCode.TOO_SMALL, null, ValuePath.root(), Map.of("type", "string", "minimum", 4)));

        assertThat(schema.safeParse("abc").issues()).extracting(Issue::message)
                .containsExactly("Value is too small");
    }

    @Test
    @DisplayName("issues added after the callback returned are rejected")
    void contextClosesAfterCallback() {
        AtomicReference<RefinementContext> leaked = new AtomicReference<>();
        Schema schema = string().superRefine((v, ctx) -> leaked.set(ctx));

        assertThat(schema.safeParse("x").isSuccess()).isTrue();
        assertThat(leaked.get().path()).isEqualTo(ValuePath.root());
        assertThatThrownBy(() -> leaked.get().addIssue("late")).isInstanceOf(IllegalStateException.class);
    }

    // --- Transform ---

    @Test
    void transformMapsTheValue() {
        assertThat(string().transform(v -> v.textValue().length()).parse("hello").intValue()).isEqualTo(5);
    }

    @Test
    void transformToJavaObject() {
        Schema schema = number().integer().transform(v -> new Money(v.longValue()));

        assertThat(schema.parse(250, Money.class)).isEqualTo(new Money(250));
    }

    @Test
    @DisplayName("a transform is skipped once the node has issues, and so is everything after it")
    void transformSkippedWhenDirty() {
        AtomicBoolean transformed = new AtomicBoolean();
        AtomicBoolean laterRefine = new AtomicBoolean();
        Schema schema = string()
                .refine(v -> false, "nope")
                .transform(v -> {
                    transformed.set(true);
                    return v;
                })
                .refine(v -> laterRefine.getAndSet(true));

        ParseResult result = schema.safeParse("x");

        assertThat(result.issues()).extracting(Issue::message).containsExactly("nope");
        assertThat(transformed).isFalse();
        assertThat(laterRefine).isFalse();
    }

    @Test
    @DisplayName("steps run in declaration order and later steps see transformed values")
    void declarationOrder() {
        List<String> log = new ArrayList<>();
        Schema schema = string()
                .refine(v -> log.add("refine:" + v.textValue()))
                .transform(v -> v.textValue().toUpperCase())
                .refine(v -> log.add("refine:" + v.textValue()));

        assertThat(schema.parse("ab").textValue()).isEqualTo("AB");
        assertThat(log).containsExactly("refine:ab", "refine:AB");
    }

    @Test
    @DisplayName("a parent's effects run after its children")
    void childrenBeforeParent() {
        List<String> log = new ArrayList<>();
        Schema schema = object(
                        field("a", string().refine(v -> log.add("a"))),
                        field("b", string().refine(v -> log.add("b"))))
                .refine(v -> log.add("parent"));

        schema.parse(json("{a: 'x', b: 'y'}"));

        assertThat(log).containsExactly("a", "b", "parent");
    }

    // --- Preprocess ---

    @Test
    void preprocessRunsBeforeTypeCheck() {
        Schema schema = preprocess(v -> v.isTextual() ? Integer.parseInt(v.textValue().trim()) : v, number().min(10));

        assertThat(schema.parse(" 42 ").intValue()).isEqualTo(42);
        assertThat(schema.safeParse("5").issues()).extracting(Issue::code).containsExactly(IssueCode.TOO_SMALL);
        assertThat(schema.parse(12).intValue()).isEqualTo(12);
    }

    @Test
    void preprocessCanFillAbsentValues() {
        Schema schema = object(field("tags", preprocess(v -> v.isMissingNode() ? List.of() : v, string().array())));

        assertThat(schema.parse(json("{}"))).isEqualTo(json("{tags: []}"));
    }

    // --- Callback failures ---

    @Test
    @DisplayName("a throwing callback propagates from safeParse as EffectEvalException")
    void throwingRefinePropagates() {
        Schema schema = object(field("a", string().refine(v -> {
            throw new IllegalStateException("boom");
        })));

        assertThatThrownBy(() -> schema.safeParse(json("{a: 'x'}")))
                .isInstanceOf(EffectEvalException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> {
                    EffectEvalException failure = (EffectEvalException) e;
                    assertThat(failure.effect()).isEqualTo("refine");
                    assertThat(failure.path()).isEqualTo(ValuePath.of("a"));
                });
    }

    @Test
    void throwingTransformAndPreprocessPropagate() {
        Schema transform = string().transform(v -> {
            throw new IllegalArgumentException("bad");
        });
        Schema pre = preprocess(v -> {
            throw new IllegalArgumentException("bad");
        }, string());

        assertThatThrownBy(() -> transform.safeParse("x")).isInstanceOf(EffectEvalException.class)
                .hasMessageContaining("transform failed at '<root>'");
        assertThatThrownBy(() -> pre.safeParse("x")).isInstanceOf(EffectEvalException.class);
    }

    @Test
    void throwingCallbackInsideUnionPropagates() {
        Schema schema = union(
                string().refine(v -> {
                    throw new IllegalStateException("boom");
                }),
                number());

        assertThatThrownBy(() -> schema.safeParse("x")).isInstanceOf(EffectEvalException.class);
    }
}
