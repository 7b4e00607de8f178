package io.shapeform.core.engine;

import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.schema.RefinementContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Collects the issues one {@code superRefine} invocation emits. Closed once the callback is done. */
final class CollectingRefinementContext implements RefinementContext {

    private final CallContext ctx;
    private final ValuePath path;
    private final List<Issue> issues = new ArrayList<>();
    private boolean closed;

    CollectingRefinementContext(CallContext ctx, ValuePath path) {
        this.ctx = ctx;
        this.path = path;
    }

    @Override
    public ValuePath path() {
        return path;
    }

    @Override
    public void addIssue(String message) {
        addIssue(IssueCode.CUSTOM, message, ValuePath.root(), Map.of());
    }

    @Override
    public void addIssue(String message, ValuePath relativePath) {
        addIssue(IssueCode.CUSTOM, message, relativePath, Map.of());
    }

    @Override
    public synchronized void addIssue(
            IssueCode code, String message, ValuePath relativePath, Map<String, Object> params) {
        Objects.requireNonNull(code, "code must not be null");
        if (closed) {
            throw new IllegalStateException("superRefine at '" + path + "' already completed; issue rejected");
        }
        ValuePath at = relativePath == null ? path : path.concat(relativePath);
        issues.add(ctx.issue(code, at, null, message, params == null ? Map.of() : params));
    }

    /** Stops accepting issues and returns those collected, in emission order. */
    synchronized List<Issue> close() {
        closed = true;
        return List.copyOf(issues);
    }
}
