package io.shapeform.core.engine;

import io.shapeform.core.error.EffectEvalException;
import io.shapeform.core.model.ValuePath;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Joins concurrently started sibling walks and adapts user-supplied asynchronous callbacks.
 *
 * <p>
 * Siblings are started before any of them is awaited, so their asynchronous effects overlap. The
 * joined list keeps the siblings' declaration order whatever order they complete in, which keeps
 * issue order independent of scheduling. In synchronous mode every future handed in is already
 * complete and joining costs nothing.
 */
final class AsyncCoordinator {

    private AsyncCoordinator() {}

    /** Completes with all results in input order once every sibling has resolved. */
    static CompletableFuture<List<NodeResult>> joinInOrder(List<CompletableFuture<NodeResult>> siblings) {
        if (siblings.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.allOf(siblings.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<NodeResult> results = new ArrayList<>(siblings.size());
                    for (CompletableFuture<NodeResult> sibling : siblings) {
                        results.add(sibling.join());
                    }
                    return results;
                });
    }

    /**
     * Invokes an asynchronous callback. A throw, a {@code null} stage or an exceptional completion
     * fails the returned future with an {@link EffectEvalException}.
     */
    static CompletableFuture<Object> invoke(String effect, ValuePath path, Supplier<? extends CompletionStage<?>> call) {
        CompletionStage<?> stage;
        try {
            stage = call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new EffectEvalException(effect, path, e));
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(
                    new EffectEvalException(effect, path, new NullPointerException("callback returned no stage")));
        }
        CompletableFuture<Object> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                Throwable cause = unwrap(error);
                result.completeExceptionally(
                        cause instanceof EffectEvalException ? cause : new EffectEvalException(effect, path, cause));
            }
        });
        return result;
    }

    /** Strips the wrappers {@link CompletableFuture} adds around a failure. */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
