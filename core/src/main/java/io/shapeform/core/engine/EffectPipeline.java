package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.error.EffectEvalException;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.JsonValues;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.schema.Effect;
import io.shapeform.core.schema.EffectsSchema;
import io.shapeform.core.schema.RefineOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the effects of an {@link EffectsSchema}.
 *
 * <ol>
 * <li>Preprocess steps map the raw value, in order, before the inner node sees it.</li>
 * <li>The inner node is walked; its children resolve before any step below starts.</li>
 * <li>Refinements and transforms run strictly one after another in declaration order.
 * Refinements run unless the node aborted; a transform runs only while the node has no issue,
 * and once one is skipped every later step is skipped too.</li>
 * </ol>
 *
 * <p>
 * In synchronous mode an asynchronous step is never invoked: it produces an
 * {@code async_effect_encountered} issue that fails the whole call.
 */
final class EffectPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(EffectPipeline.class);

    private final NodeWalker walker;
    private final CallContext ctx;

    EffectPipeline(NodeWalker walker, CallContext ctx) {
        this.walker = walker;
        this.ctx = ctx;
    }

    CompletableFuture<NodeResult> run(EffectsSchema schema, JsonNode value, ValuePath path) {
        JsonNode input = value;
        List<Effect> steps = new ArrayList<>();
        for (Effect effect : schema.effects()) {
            if (effect instanceof Effect.Preprocess preprocess) {
                input = preprocess(preprocess, input, path);
            } else {
                steps.add(effect);
            }
        }
        return walker.walk(schema.inner(), input, path)
                .thenCompose(result -> applyFrom(steps, 0, result, path));
    }

    private CompletableFuture<NodeResult> applyFrom(List<Effect> steps, int index, NodeResult result, ValuePath path) {
        if (index == steps.size() || result.isAborted()) {
            return CompletableFuture.completedFuture(result);
        }
        Effect step = steps.get(index);
        boolean transform = step instanceof Effect.Transform || step instanceof Effect.AsyncTransform;
        if (transform && !result.isValid()) {
            return CompletableFuture.completedFuture(result);
        }
        return apply(step, result, path).thenCompose(next -> applyFrom(steps, index + 1, next, path));
    }

    private CompletableFuture<NodeResult> apply(Effect step, NodeResult result, ValuePath path) {
        if (step.isAsync() && ctx.isSync()) {
            return CompletableFuture.completedFuture(refuse(step, result, path));
        }
        JsonNode value = result.value();
        if (step instanceof Effect.Refine refine) {
            boolean ok;
            try {
                ok = refine.check().test(value);
            } catch (RuntimeException e) {
                throw new EffectEvalException(step.name(), path, e);
            }
            return CompletableFuture.completedFuture(ok ? result : result.withIssues(refineIssue(refine.options(), path)));
        }
        if (step instanceof Effect.AsyncRefine refine) {
            return AsyncCoordinator.invoke(step.name(), path, () -> refine.check().apply(value))
                    .thenApply(ok -> Boolean.TRUE.equals(ok)
                            ? result
                            : result.withIssues(refineIssue(refine.options(), path)));
        }
        if (step instanceof Effect.SuperRefine superRefine) {
            CollectingRefinementContext issues = new CollectingRefinementContext(ctx, path);
            try {
                superRefine.check().accept(value, issues);
            } catch (RuntimeException e) {
                throw new EffectEvalException(step.name(), path, e);
            }
            return CompletableFuture.completedFuture(result.withIssues(issues.close()));
        }
        if (step instanceof Effect.AsyncSuperRefine superRefine) {
            CollectingRefinementContext issues = new CollectingRefinementContext(ctx, path);
            return AsyncCoordinator.invoke(step.name(), path, () -> superRefine.check().apply(value, issues))
                    .thenApply(done -> result.withIssues(issues.close()));
        }
        if (step instanceof Effect.Transform transform) {
            Object mapped;
            try {
                mapped = transform.mapper().apply(value);
            } catch (RuntimeException e) {
                throw new EffectEvalException(step.name(), path, e);
            }
            return CompletableFuture.completedFuture(result.withValue(JsonValues.toNode(mapped)));
        }
        if (step instanceof Effect.AsyncTransform transform) {
            return AsyncCoordinator.invoke(step.name(), path, () -> transform.mapper().apply(value))
                    .thenApply(mapped -> result.withValue(JsonValues.toNode(mapped)));
        }
        throw new IllegalStateException("Unexpected effect after inner node: " + step.name());
    }

    private JsonNode preprocess(Effect.Preprocess step, JsonNode value, ValuePath path) {
        try {
            return JsonValues.toNode(step.mapper().apply(value));
        } catch (RuntimeException e) {
            throw new EffectEvalException(step.name(), path, e);
        }
    }

    private List<Issue> refineIssue(RefineOptions options, ValuePath path) {
        return List.of(ctx.issue(IssueCode.CUSTOM, path.concat(options.path()), null, options.message(), options.params()));
    }

    private NodeResult refuse(Effect step, NodeResult result, ValuePath path) {
        Issue issue = ctx.issue(IssueCode.ASYNC_EFFECT_ENCOUNTERED, path, null, null, "effect", step.name());
        ctx.addFatal(issue);
        LOG.warn("validation.async_effect_refused effect={} path={}", step.name(), path.toJsonPointer());
        List<Issue> issues = new ArrayList<>(result.issues());
        issues.add(issue);
        return NodeResult.aborted(issues);
    }
}
