package io.shapeform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One validation failure: what went wrong ({@code code}), where ({@code path}), a human-readable
 * {@code message} and kind-specific {@code params} (e.g. {@code minimum}, {@code expected},
 * {@code keys}).
 *
 * <p>
 * Immutable. Params keep their insertion order.
 */
public record Issue(IssueCode code, ValuePath path, String message, Map<String, Object> params) {

    public Issue {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
        params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public Issue(IssueCode code, ValuePath path, String message) {
        this(code, path, message, Map.of());
    }

    /** Returns a single param, or {@code null} if absent. */
    public Object param(String name) {
        return params.get(name);
    }

    @Override
    public String toString() {
        String where = path.isRoot() ? "<root>" : path.toString();
        return code.id() + " at " + where + ": " + message;
    }
}
