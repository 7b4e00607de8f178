package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.model.Issue;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of walking one node.
 *
 * <ul>
 * <li>{@link Status#VALID}: no issues; {@code value} is the output.</li>
 * <li>{@link Status#DIRTY}: the value has the right shape but violated constraints or
 * refinements; refinements still run, transforms do not.</li>
 * <li>{@link Status#ABORTED}: structural mismatch; nothing further runs on this node or its
 * parents' effects.</li>
 * </ul>
 */
record NodeResult(Status status, JsonNode value, List<Issue> issues) {

    enum Status {
        VALID,
        DIRTY,
        ABORTED
    }

    NodeResult {
        issues = List.copyOf(issues);
    }

    static NodeResult valid(JsonNode value) {
        return new NodeResult(Status.VALID, value, List.of());
    }

    static NodeResult aborted(Issue issue) {
        return new NodeResult(Status.ABORTED, null, List.of(issue));
    }

    static NodeResult aborted(List<Issue> issues) {
        return new NodeResult(Status.ABORTED, null, issues);
    }

    /** VALID when {@code issues} is empty, DIRTY otherwise. */
    static NodeResult of(JsonNode value, List<Issue> issues) {
        return new NodeResult(issues.isEmpty() ? Status.VALID : Status.DIRTY, value, issues);
    }

    boolean isValid() {
        return status == Status.VALID;
    }

    boolean isAborted() {
        return status == Status.ABORTED;
    }

    /** This result with more issues appended; VALID becomes DIRTY. */
    NodeResult withIssues(List<Issue> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<Issue> all = new ArrayList<>(issues);
        all.addAll(more);
        return new NodeResult(status == Status.VALID ? Status.DIRTY : status, value, all);
    }

    NodeResult withValue(JsonNode next) {
        return new NodeResult(status, next, issues);
    }
}
