package io.shapeform.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.error.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one validation call. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: the value conforms; {@link #data()} holds the validated (and possibly
 * transformed) value. Implies zero issues anywhere in the tree.</li>
 * <li>{@link Type#FAILURE}: {@link #issues()} holds the non-empty ordered issue list and
 * {@link #error()} the same issues as a {@link ValidationException}.</li>
 * </ul>
 *
 * <p>
 * Immutable. Owned entirely by the caller.
 */
public final class ParseResult {

    /** The type of validation outcome. */
    public enum Type {
        SUCCESS,
        FAILURE
    }

    private final Type type;
    private final JsonNode data;
    private final List<Issue> issues;

    private ParseResult(Type type, JsonNode data, List<Issue> issues) {
        this.type = type;
        this.data = data;
        this.issues = issues;
    }

    /** Creates a SUCCESS result. An absent root value is represented by a {@code MissingNode}. */
    public static ParseResult success(JsonNode data) {
        Objects.requireNonNull(data, "data must not be null for SUCCESS");
        return new ParseResult(Type.SUCCESS, data, List.of());
    }

    /** Creates a FAILURE result from a non-empty issue list. */
    public static ParseResult failure(List<Issue> issues) {
        Objects.requireNonNull(issues, "issues must not be null for FAILURE");
        if (issues.isEmpty()) {
            throw new IllegalArgumentException("FAILURE requires at least one issue");
        }
        return new ParseResult(Type.FAILURE, null, List.copyOf(issues));
    }

    public Type type() {
        return type;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isFailure() {
        return type == Type.FAILURE;
    }

    /** Returns the validated value. Only valid when {@code isSuccess()}. */
    public JsonNode data() {
        if (type != Type.SUCCESS) {
            throw new IllegalStateException("data() is only available on SUCCESS results");
        }
        return data;
    }

    /**
     * Reads the validated value as {@code type}. A transform output wrapped as a POJO of that type is
     * returned as-is.
     *
     * @throws IllegalArgumentException if the value cannot be mapped to {@code type}
     */
    public <T> T data(Class<T> type) {
        try {
            return JsonValues.MAPPER.treeToValue(data(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to read validated value as " + type.getName(), e);
        }
    }

    /** Returns the issues; empty on SUCCESS. */
    public List<Issue> issues() {
        return issues;
    }

    /** Returns the issues wrapped in a {@link ValidationException}. Only valid when {@code isFailure()}. */
    public ValidationException error() {
        if (type != Type.FAILURE) {
            throw new IllegalStateException("error() is only available on FAILURE results");
        }
        return new ValidationException(issues);
    }

    /** Returns the value on SUCCESS, or throws {@link #error()} on FAILURE. */
    public JsonNode orElseThrow() {
        if (type == Type.FAILURE) {
            throw error();
        }
        return data;
    }

    /** Returns the value read as {@code type} on SUCCESS, or throws {@link #error()} on FAILURE. */
    public <T> T orElseThrow(Class<T> type) {
        if (this.type == Type.FAILURE) {
            throw error();
        }
        return data(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParseResult other)) {
            return false;
        }
        return type == other.type && Objects.equals(data, other.data) && issues.equals(other.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, data, issues);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "ParseResult[SUCCESS]";
            case FAILURE -> "ParseResult[FAILURE, issues=" + issues.size() + "]";
        };
    }
}
