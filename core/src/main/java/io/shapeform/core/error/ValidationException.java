package io.shapeform.core.error;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shapeform.core.model.Issue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The aggregated validation error raised by {@code parse} and {@code parseAsync}. Carries every
 * {@link Issue} found, in deterministic tree order. URN: {@code
 * urn:shapeform:error:validation-failed}
 */
public final class ValidationException extends ShapeformException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:shapeform:error:validation-failed";

    private static final String ERRORS_KEY = "_errors";

    private final transient List<Issue> issues;

    public ValidationException(List<Issue> issues) {
        super(summarize(issues), Phase.VALIDATION);
        this.issues = List.copyOf(issues);
    }

    /** The ordered, non-empty issue list. */
    public List<Issue> issues() {
        return issues;
    }

    /**
     * Splits messages into root-level ("form") messages and messages grouped by the first path
     * segment ("fields"). Nested paths are grouped under their top-level field.
     */
    public FlattenedIssues flatten() {
        List<String> formErrors = new ArrayList<>();
        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        for (Issue issue : issues) {
            if (issue.path().isRoot()) {
                formErrors.add(issue.message());
            } else {
                fieldErrors
                        .computeIfAbsent(String.valueOf(issue.path().head()), k -> new ArrayList<>())
                        .add(issue.message());
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        fieldErrors.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new FlattenedIssues(List.copyOf(formErrors), Collections.unmodifiableMap(frozen));
    }

    /**
     * Renders the issues as a tree mirroring the value's shape. Every level carries an {@code
     * _errors} array with the messages of issues located exactly there.
     */
    public ObjectNode format() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode root = nodes.objectNode();
        root.putArray(ERRORS_KEY);
        for (Issue issue : issues) {
            ObjectNode current = root;
            for (Object segment : issue.path().segments()) {
                String key = String.valueOf(segment);
                ObjectNode child = current.get(key) instanceof ObjectNode existing ? existing : null;
                if (child == null) {
                    child = current.putObject(key);
                    child.putArray(ERRORS_KEY);
                }
                current = child;
            }
            ((ArrayNode) current.get(ERRORS_KEY)).add(issue.message());
        }
        return root;
    }

    private static String summarize(List<Issue> issues) {
        Objects.requireNonNull(issues, "issues must not be null");
        if (issues.isEmpty()) {
            throw new IllegalArgumentException("ValidationException requires at least one issue");
        }
        StringBuilder sb = new StringBuilder("Validation failed with ")
                .append(issues.size())
                .append(issues.size() == 1 ? " issue: " : " issues: ");
        for (int i = 0; i < issues.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(issues.get(i));
        }
        return sb.toString();
    }

    /**
     * Issue messages split for presentation layers.
     *
     * @param formErrors  messages of issues at the root path
     * @param fieldErrors messages keyed by top-level field name (or index), in first-seen order
     */
    public record FlattenedIssues(List<String> formErrors, Map<String, List<String>> fieldErrors) {}
}
