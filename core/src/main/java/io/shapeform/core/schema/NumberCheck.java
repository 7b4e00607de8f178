package io.shapeform.core.schema;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One constraint on a {@link NumberSchema}.
 *
 * @param kind      the constraint kind
 * @param value     the bound or divisor; {@code null} for {@link Kind#INT}, {@link Kind#FINITE},
 *                  {@link Kind#SAFE}
 * @param inclusive whether a {@link Kind#MIN}/{@link Kind#MAX} bound admits equality
 * @param message   custom issue message, or {@code null} to use the catalog
 */
public record NumberCheck(Kind kind, BigDecimal value, boolean inclusive, String message) {

    /** Largest integer a double represents exactly (2^53 - 1). */
    public static final BigDecimal MAX_SAFE_INTEGER = BigDecimal.valueOf(9007199254740991L);

    public enum Kind {
        MIN,
        MAX,
        INT,
        MULTIPLE_OF,
        FINITE,
        SAFE
    }

    public NumberCheck {
        Objects.requireNonNull(kind, "kind must not be null");
        if ((kind == Kind.MIN || kind == Kind.MAX || kind == Kind.MULTIPLE_OF) && value == null) {
            throw new IllegalArgumentException(kind + " requires a value");
        }
    }
}
