package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.JsonValues;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.schema.DiscriminatedUnionSchema;
import io.shapeform.core.schema.ObjectSchema;
import io.shapeform.core.schema.Schema;
import io.shapeform.core.schema.UnionSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Branch selection for unions.
 *
 * <p>
 * Plain unions: the first alternative, in declaration order, that validates without any issue
 * wins. Synchronous calls try alternatives one at a time and stop at the winner. Asynchronous
 * calls start every alternative and pick after all have resolved. A callback failure in an
 * alternative is raised only when no earlier alternative matched, so both modes agree on the
 * winner and on which failures surface. When no alternative matches, a single {@code invalid_union} issue carries each
 * alternative's issues in the {@code unionErrors} param.
 *
 * <p>
 * Discriminated unions: one lookup on the discriminator value. A missing or unknown value yields a
 * single issue at the discriminator field; the matched branch's own issues surface unwrapped.
 */
final class UnionResolver {

    private final NodeWalker walker;
    private final CallContext ctx;

    UnionResolver(NodeWalker walker, CallContext ctx) {
        this.walker = walker;
        this.ctx = ctx;
    }

    CompletableFuture<NodeResult> union(UnionSchema schema, JsonNode value, ValuePath path) {
        if (ctx.isSync()) {
            List<NodeResult> failures = new ArrayList<>();
            for (Schema option : schema.options()) {
                NodeResult result = walker.walk(option, value, path).join();
                if (result.isValid()) {
                    return CompletableFuture.completedFuture(result);
                }
                failures.add(result);
            }
            return CompletableFuture.completedFuture(noMatch(failures, path));
        }
        List<CompletableFuture<Attempt>> attempts = new ArrayList<>();
        for (Schema option : schema.options()) {
            attempts.add(start(option, value, path).handle(Attempt::new));
        }
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<NodeResult> failures = new ArrayList<>(attempts.size());
                    for (CompletableFuture<Attempt> pending : attempts) {
                        Attempt attempt = pending.join();
                        if (attempt.error() != null) {
                            // every earlier alternative failed to match
                            throw new CompletionException(AsyncCoordinator.unwrap(attempt.error()));
                        }
                        if (attempt.result().isValid()) {
                            return attempt.result();
                        }
                        failures.add(attempt.result());
                    }
                    return noMatch(failures, path);
                });
    }

    private CompletableFuture<NodeResult> start(Schema option, JsonNode value, ValuePath path) {
        try {
            return walker.walk(option, value, path);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    CompletableFuture<NodeResult> discriminated(DiscriminatedUnionSchema schema, JsonNode value, ValuePath path) {
        if (!value.isObject()) {
            return CompletableFuture.completedFuture(NodeResult.aborted(ctx.invalidType("object", value, path)));
        }
        JsonNode discriminator = value.get(schema.discriminator());
        Optional<ObjectSchema> branch = schema.branchFor(discriminator);
        if (branch.isEmpty()) {
            Issue issue = ctx.issue(
                    IssueCode.INVALID_UNION_DISCRIMINATOR,
                    path.append(schema.discriminator()),
                    null,
                    null,
                    "options", schema.values(),
                    "received", discriminator == null ? JsonValues.absent() : discriminator);
            return CompletableFuture.completedFuture(NodeResult.aborted(issue));
        }
        return walker.walk(branch.get(), value, path);
    }

    /** One alternative's outcome; exactly one of the two is set. */
    private record Attempt(NodeResult result, Throwable error) {}

    private NodeResult noMatch(List<NodeResult> failures, ValuePath path) {
        List<List<Issue>> unionErrors = new ArrayList<>(failures.size());
        for (NodeResult failure : failures) {
            unionErrors.add(failure.issues());
        }
        return NodeResult.aborted(
                ctx.issue(IssueCode.INVALID_UNION, path, null, null, "unionErrors", List.copyOf(unionErrors)));
    }
}
