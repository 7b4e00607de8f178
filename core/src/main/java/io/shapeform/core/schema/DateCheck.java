package io.shapeform.core.schema;

import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive bound on a {@link DateSchema}.
 *
 * @param kind    earliest or latest admitted instant
 * @param value   the bound
 * @param message custom issue message, or {@code null} to use the catalog
 */
public record DateCheck(Kind kind, Instant value, String message) {

    public enum Kind {
        MIN,
        MAX
    }

    public DateCheck {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
