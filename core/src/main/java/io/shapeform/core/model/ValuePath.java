package io.shapeform.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Location of a sub-value inside a validated value: an ordered sequence of object field names
 * ({@link String}) and array/tuple indexes ({@link Integer}). The empty path denotes the root.
 *
 * <p>
 * Immutable. {@link #append} returns a new path and never mutates the receiver.
 */
public final class ValuePath {

    private static final ValuePath ROOT = new ValuePath(List.of());

    private final List<Object> segments;

    private ValuePath(List<Object> segments) {
        this.segments = segments;
    }

    /** Returns the empty (root) path. */
    public static ValuePath root() {
        return ROOT;
    }

    /**
     * Creates a path from field names and indexes.
     *
     * @throws IllegalArgumentException if a segment is neither a String nor an Integer
     */
    public static ValuePath of(Object... segments) {
        return of(List.of(segments));
    }

    /** Creates a path from a list of field names and indexes. */
    public static ValuePath of(List<?> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            return ROOT;
        }
        List<Object> copy = new ArrayList<>(segments.size());
        for (Object segment : segments) {
            copy.add(checkSegment(segment));
        }
        return new ValuePath(Collections.unmodifiableList(copy));
    }

    /** Returns a new path with the given field name appended. */
    public ValuePath append(String field) {
        return appendSegment(Objects.requireNonNull(field, "field must not be null"));
    }

    /** Returns a new path with the given index appended. */
    public ValuePath append(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        return appendSegment(index);
    }

    /** Returns a new path with all segments of {@code suffix} appended. */
    public ValuePath concat(ValuePath suffix) {
        if (suffix.isRoot()) {
            return this;
        }
        if (isRoot()) {
            return suffix;
        }
        List<Object> joined = new ArrayList<>(segments.size() + suffix.segments.size());
        joined.addAll(segments);
        joined.addAll(suffix.segments);
        return new ValuePath(Collections.unmodifiableList(joined));
    }

    /** The segments, in order from the root. */
    public List<Object> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** Returns the first segment, or {@code null} for the root path. */
    public Object head() {
        return segments.isEmpty() ? null : segments.get(0);
    }

    /** Renders the path as an RFC 6901 JSON Pointer, e.g. {@code /items/2/name}. */
    public String toJsonPointer() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : segments) {
            sb.append('/');
            sb.append(segment.toString().replace("~", "~0").replace("/", "~1"));
        }
        return sb.toString();
    }

    /** Renders the path in accessor form, e.g. {@code items[2].name}. The root renders as "". */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(segment);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ValuePath other && segments.equals(other.segments));
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    private ValuePath appendSegment(Object segment) {
        List<Object> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(segment);
        return new ValuePath(Collections.unmodifiableList(extended));
    }

    private static Object checkSegment(Object segment) {
        if (segment instanceof String) {
            return segment;
        }
        if (segment instanceof Integer index) {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative, got: " + index);
            }
            return index;
        }
        throw new IllegalArgumentException(
                "path segment must be a String or Integer, got: " + (segment == null ? "null" : segment.getClass()));
    }
}
