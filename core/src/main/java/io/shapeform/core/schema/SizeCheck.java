package io.shapeform.core.schema;

import java.util.Objects;

/**
 * Element-count constraint on an {@link ArraySchema}.
 *
 * @param kind    minimum, maximum or exact count
 * @param value   the count bound
 * @param message custom issue message, or {@code null} to use the catalog
 */
public record SizeCheck(Kind kind, int value, String message) {

    public enum Kind {
        MIN,
        MAX,
        EXACT
    }

    public SizeCheck {
        Objects.requireNonNull(kind, "kind must not be null");
        if (value < 0) {
            throw new IllegalArgumentException("size bound must not be negative, got: " + value);
        }
    }
}
