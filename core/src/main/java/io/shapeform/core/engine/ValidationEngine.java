package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.message.MessageCatalog;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.JsonValues;
import io.shapeform.core.model.ParseResult;
import io.shapeform.core.schema.Schema;
import io.shapeform.core.spi.ExecutionMode;
import io.shapeform.core.spi.ValidationListener;
import io.shapeform.core.spi.ValidationListener.ValidationEvent;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates values against schema trees.
 *
 * <p>
 * Two entry families share one tree walk:
 * <ul>
 * <li><b>Synchronous</b> ({@link #parse}, {@link #safeParse}, {@link #validate}) never suspends.
 * A schema containing an asynchronous refinement or transform on the walked path fails the call
 * with an {@code async_effect_encountered} issue; the effect is never skipped silently.</li>
 * <li><b>Asynchronous</b> ({@link #parseAsync}, {@link #safeParseAsync}, {@link #validateAsync})
 * may suspend at asynchronous effects. Sibling subtrees run their effects concurrently; the issue
 * order is the same as in synchronous mode.</li>
 * </ul>
 *
 * <p>
 * An exception thrown by a user callback surfaces as an
 * {@link io.shapeform.core.error.EffectEvalException} from every entry point, including the safe
 * ones.
 *
 * <p>
 * Thread-safe. Engines hold configuration only; every call owns its own state.
 */
public final class ValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationEngine.class);

    private final ValidationOptions options;
    private final MessageCatalog catalog;

    /** Creates an engine with {@link ValidationOptions#DEFAULT}. */
    public ValidationEngine() {
        this(ValidationOptions.DEFAULT);
    }

    public ValidationEngine(ValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.catalog = options.catalog() != null ? options.catalog() : MessageCatalog.defaults();
    }

    /** The engine behind {@code Schema.parse} and friends. */
    public static ValidationEngine defaultEngine() {
        return DefaultHolder.INSTANCE;
    }

    public ValidationOptions options() {
        return options;
    }

    /** Alias of {@link #safeParse(Schema, Object)}. */
    public ParseResult validate(Schema schema, Object value) {
        return safeParse(schema, value);
    }

    /** Alias of {@link #safeParseAsync(Schema, Object)}. */
    public CompletableFuture<ParseResult> validateAsync(Schema schema, Object value) {
        return safeParseAsync(schema, value);
    }

    /**
     * Validates synchronously and returns the result as data.
     *
     * @throws io.shapeform.core.error.EffectEvalException if a user callback throws
     */
    public ParseResult safeParse(Schema schema, Object value) {
        Objects.requireNonNull(schema, "schema must not be null");
        long start = System.nanoTime();
        CallContext ctx = new CallContext(ExecutionMode.SYNC, catalog);
        NodeResult walked;
        try {
            walked = new NodeWalker(ctx).walk(schema, JsonValues.toNode(value), options.pathPrefix()).join();
        } catch (CompletionException e) {
            throw rethrow(AsyncCoordinator.unwrap(e));
        }
        return complete(ctx, walked, start);
    }

    /**
     * Validates synchronously and returns the validated value.
     *
     * @throws io.shapeform.core.error.ValidationException carrying every issue found
     */
    public JsonNode parse(Schema schema, Object value) {
        return safeParse(schema, value).orElseThrow();
    }

    /**
     * Validates asynchronously. The future fails only if a user callback fails, with the
     * {@link io.shapeform.core.error.EffectEvalException} as its cause.
     */
    public CompletableFuture<ParseResult> safeParseAsync(Schema schema, Object value) {
        Objects.requireNonNull(schema, "schema must not be null");
        long start = System.nanoTime();
        CallContext ctx = new CallContext(ExecutionMode.ASYNC, catalog);
        CompletableFuture<NodeResult> walked;
        try {
            walked = new NodeWalker(ctx).walk(schema, JsonValues.toNode(value), options.pathPrefix());
        } catch (RuntimeException e) {
            walked = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<ParseResult> result = new CompletableFuture<>();
        walked.whenComplete((node, error) -> {
            if (error != null) {
                result.completeExceptionally(AsyncCoordinator.unwrap(error));
                return;
            }
            try {
                result.complete(complete(ctx, node, start));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Validates asynchronously. The future fails with a
     * {@link io.shapeform.core.error.ValidationException} cause when the value is invalid.
     */
    public CompletableFuture<JsonNode> parseAsync(Schema schema, Object value) {
        return safeParseAsync(schema, value)
                .thenCompose(result -> result.isSuccess()
                        ? CompletableFuture.completedFuture(result.data())
                        : CompletableFuture.failedFuture(result.error()));
    }

    private ParseResult complete(CallContext ctx, NodeResult walked, long start) {
        List<Issue> fatal = ctx.fatalIssues();
        ParseResult result;
        if (!fatal.isEmpty()) {
            result = ParseResult.failure(fatal);
        } else if (walked.isValid()) {
            result = ParseResult.success(walked.value());
        } else {
            result = ParseResult.failure(walked.issues());
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        LOG.debug(
                "validation.completed mode={} outcome={} issues={} duration_us={}",
                ctx.mode(),
                result.type(),
                result.issues().size(),
                duration.toNanos() / 1_000);
        notifyListener(new ValidationEvent(ctx.mode(), result.isSuccess(), result.issues().size(), duration));
        return result;
    }

    private void notifyListener(ValidationEvent event) {
        ValidationListener listener = options.listener();
        if (listener == null) {
            return;
        }
        try {
            listener.onValidationCompleted(event);
        } catch (Exception e) {
            LOG.warn("ValidationListener.onValidationCompleted failed", e);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Validation failed unexpectedly", cause);
    }

    private static final class DefaultHolder {
        private static final ValidationEngine INSTANCE = new ValidationEngine();
    }
}
