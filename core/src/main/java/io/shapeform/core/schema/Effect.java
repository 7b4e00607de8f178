package io.shapeform.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A preprocess, refinement or transform step attached to an {@link EffectsSchema}. Preprocess steps
 * run on the raw value before the inner node; all other steps run after it, in declaration order.
 *
 * <p>
 * Asynchronous variants ({@link #isAsync()}) may only run under {@code parseAsync}/{@code
 * safeParseAsync}.
 */
public sealed interface Effect {

    /** Short name used in logs and error messages. */
    String name();

    default boolean isAsync() {
        return false;
    }

    /** Maps the raw input before any type check. The result is converted with {@code JsonValues.toNode}. */
    record Preprocess(Function<JsonNode, ?> mapper) implements Effect {
        public Preprocess {
            Objects.requireNonNull(mapper, "mapper must not be null");
        }

        @Override
        public String name() {
            return "preprocess";
        }
    }

    /** Predicate check; {@code false} appends one custom issue. */
    record Refine(Predicate<JsonNode> check, RefineOptions options) implements Effect {
        public Refine {
            Objects.requireNonNull(check, "check must not be null");
            Objects.requireNonNull(options, "options must not be null");
        }

        @Override
        public String name() {
            return "refine";
        }
    }

    /** Asynchronous predicate check; a stage completing with {@code false} appends one custom issue. */
    record AsyncRefine(Function<JsonNode, ? extends CompletionStage<Boolean>> check, RefineOptions options)
            implements Effect {
        public AsyncRefine {
            Objects.requireNonNull(check, "check must not be null");
            Objects.requireNonNull(options, "options must not be null");
        }

        @Override
        public String name() {
            return "refine";
        }

        @Override
        public boolean isAsync() {
            return true;
        }
    }

    /** Context-aware check that may append any number of issues. */
    record SuperRefine(BiConsumer<JsonNode, RefinementContext> check) implements Effect {
        public SuperRefine {
            Objects.requireNonNull(check, "check must not be null");
        }

        @Override
        public String name() {
            return "superRefine";
        }
    }

    /** Asynchronous context-aware check; completion of the returned stage ends issue emission. */
    record AsyncSuperRefine(BiFunction<JsonNode, RefinementContext, ? extends CompletionStage<?>> check)
            implements Effect {
        public AsyncSuperRefine {
            Objects.requireNonNull(check, "check must not be null");
        }

        @Override
        public String name() {
            return "superRefine";
        }

        @Override
        public boolean isAsync() {
            return true;
        }
    }

    /** Maps a validated value to a new value. Skipped if any issue was found in the node so far. */
    record Transform(Function<JsonNode, ?> mapper) implements Effect {
        public Transform {
            Objects.requireNonNull(mapper, "mapper must not be null");
        }

        @Override
        public String name() {
            return "transform";
        }
    }

    /** Asynchronous value mapping. */
    record AsyncTransform(Function<JsonNode, ? extends CompletionStage<?>> mapper) implements Effect {
        public AsyncTransform {
            Objects.requireNonNull(mapper, "mapper must not be null");
        }

        @Override
        public String name() {
            return "transform";
        }

        @Override
        public boolean isAsync() {
            return true;
        }
    }
}
