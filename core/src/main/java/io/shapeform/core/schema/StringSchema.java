package io.shapeform.core.schema;

import io.shapeform.core.error.SchemaDefinitionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Accepts text values. Constraints run in declaration order and all of them are evaluated. */
public final class StringSchema extends Schema {

    private final List<StringCheck> checks;

    StringSchema(List<StringCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.STRING;
    }

    public List<StringCheck> checks() {
        return checks;
    }

    public StringSchema min(int length) {
        return min(length, null);
    }

    public StringSchema min(int length, String message) {
        return with(new StringCheck(StringCheck.Kind.MIN_LENGTH, length, null, null, message));
    }

    public StringSchema max(int length) {
        return max(length, null);
    }

    public StringSchema max(int length, String message) {
        return with(new StringCheck(StringCheck.Kind.MAX_LENGTH, length, null, null, message));
    }

    public StringSchema length(int length) {
        return length(length, null);
    }

    public StringSchema length(int length, String message) {
        return with(new StringCheck(StringCheck.Kind.LENGTH, length, null, null, message));
    }

    /** Shorthand for {@code min(1)}. */
    public StringSchema nonempty() {
        return min(1);
    }

    public StringSchema nonempty(String message) {
        return min(1, message);
    }

    /** Requires a match of {@code pattern} somewhere in the value (find semantics). */
    public StringSchema regex(Pattern pattern) {
        return regex(pattern, null);
    }

    public StringSchema regex(Pattern pattern, String message) {
        return with(new StringCheck(StringCheck.Kind.REGEX, 0, pattern, null, message));
    }

    /**
     * @throws SchemaDefinitionException if {@code regex} does not compile
     */
    public StringSchema regex(String regex) {
        Objects.requireNonNull(regex, "regex must not be null");
        try {
            return regex(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new SchemaDefinitionException("Invalid regex pattern: " + regex, e);
        }
    }

    public StringSchema email() {
        return email(null);
    }

    public StringSchema email(String message) {
        return with(new StringCheck(StringCheck.Kind.EMAIL, 0, null, null, message));
    }

    public StringSchema url() {
        return url(null);
    }

    public StringSchema url(String message) {
        return with(new StringCheck(StringCheck.Kind.URL, 0, null, null, message));
    }

    public StringSchema uuid() {
        return uuid(null);
    }

    public StringSchema uuid(String message) {
        return with(new StringCheck(StringCheck.Kind.UUID, 0, null, null, message));
    }

    public StringSchema startsWith(String prefix) {
        return with(new StringCheck(StringCheck.Kind.STARTS_WITH, 0, null, prefix, null));
    }

    public StringSchema endsWith(String suffix) {
        return with(new StringCheck(StringCheck.Kind.ENDS_WITH, 0, null, suffix, null));
    }

    public StringSchema includes(String text) {
        return with(new StringCheck(StringCheck.Kind.INCLUDES, 0, null, text, null));
    }

    /** Strips leading and trailing whitespace before the following checks. */
    public StringSchema trim() {
        return with(new StringCheck(StringCheck.Kind.TRIM, 0, null, null, null));
    }

    public StringSchema toLowerCase() {
        return with(new StringCheck(StringCheck.Kind.TO_LOWER_CASE, 0, null, null, null));
    }

    public StringSchema toUpperCase() {
        return with(new StringCheck(StringCheck.Kind.TO_UPPER_CASE, 0, null, null, null));
    }

    private StringSchema with(StringCheck check) {
        List<StringCheck> next = new ArrayList<>(checks);
        next.add(check);
        return new StringSchema(next);
    }
}
