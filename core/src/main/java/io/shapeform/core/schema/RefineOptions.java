package io.shapeform.core.schema;

import io.shapeform.core.model.ValuePath;
import java.util.Map;
import java.util.Objects;

/**
 * Options for a failing {@code refine}: the issue message, a path relative to the refined value at
 * which to report it, and extra issue params.
 *
 * @param message the issue message, or {@code null} for the catalog's custom message
 * @param path    relative path to report the issue at; root means the refined value itself
 * @param params  extra params copied into the issue
 */
public record RefineOptions(String message, ValuePath path, Map<String, Object> params) {

    public static final RefineOptions DEFAULT = new RefineOptions(null, ValuePath.root(), Map.of());

    public RefineOptions {
        path = path == null ? ValuePath.root() : path;
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static RefineOptions of(String message) {
        return new RefineOptions(Objects.requireNonNull(message, "message must not be null"), null, null);
    }

    /** Returns a copy reporting at the given relative path. */
    public RefineOptions at(Object... segments) {
        return new RefineOptions(message, ValuePath.of(segments), params);
    }

    /** Returns a copy carrying the given params. */
    public RefineOptions withParams(Map<String, Object> extra) {
        return new RefineOptions(message, path, extra);
    }
}
