package io.shapeform.core.schema;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One constraint on a {@link StringSchema}. Normalizing kinds ({@link Kind#TRIM},
 * {@link Kind#TO_LOWER_CASE}, {@link Kind#TO_UPPER_CASE}) rewrite the value seen by later checks
 * and by the output instead of producing issues.
 *
 * @param kind    the constraint kind
 * @param length  bound for the length kinds, otherwise 0
 * @param pattern pattern for {@link Kind#REGEX}, otherwise {@code null}
 * @param text    operand for the starts/ends/includes kinds, otherwise {@code null}
 * @param message custom issue message, or {@code null} to use the catalog
 */
public record StringCheck(Kind kind, int length, Pattern pattern, String text, String message) {

    public enum Kind {
        MIN_LENGTH,
        MAX_LENGTH,
        LENGTH,
        REGEX,
        EMAIL,
        URL,
        UUID,
        STARTS_WITH,
        ENDS_WITH,
        INCLUDES,
        TRIM,
        TO_LOWER_CASE,
        TO_UPPER_CASE
    }

    public StringCheck {
        Objects.requireNonNull(kind, "kind must not be null");
        if (length < 0) {
            throw new IllegalArgumentException("length bound must not be negative, got: " + length);
        }
        if (kind == Kind.REGEX) {
            Objects.requireNonNull(pattern, "pattern must not be null for REGEX");
        }
        if (kind == Kind.STARTS_WITH || kind == Kind.ENDS_WITH || kind == Kind.INCLUDES) {
            Objects.requireNonNull(text, "text must not be null for " + kind);
        }
    }

    /** The format name reported in {@code invalid_string_format} issues. */
    public String formatName() {
        return switch (kind) {
            case REGEX -> "regex";
            case EMAIL -> "email";
            case URL -> "url";
            case UUID -> "uuid";
            case STARTS_WITH -> "starts_with";
            case ENDS_WITH -> "ends_with";
            case INCLUDES -> "includes";
            default -> kind.name().toLowerCase();
        };
    }
}
