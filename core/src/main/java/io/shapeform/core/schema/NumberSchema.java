package io.shapeform.core.schema;

import io.shapeform.core.error.SchemaDefinitionException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accepts numeric values (any Jackson numeric node except NaN). No coercion from text. Bounds are
 * compared exactly using {@link BigDecimal}.
 */
public final class NumberSchema extends Schema {

    private final List<NumberCheck> checks;

    NumberSchema(List<NumberCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.NUMBER;
    }

    public List<NumberCheck> checks() {
        return checks;
    }

    public NumberSchema gt(Number bound) {
        return gt(bound, null);
    }

    public NumberSchema gt(Number bound, String message) {
        return with(new NumberCheck(NumberCheck.Kind.MIN, decimal(bound), false, message));
    }

    public NumberSchema gte(Number bound) {
        return gte(bound, null);
    }

    public NumberSchema gte(Number bound, String message) {
        return with(new NumberCheck(NumberCheck.Kind.MIN, decimal(bound), true, message));
    }

    /** Alias of {@link #gte(Number)}. */
    public NumberSchema min(Number bound) {
        return gte(bound);
    }

    public NumberSchema min(Number bound, String message) {
        return gte(bound, message);
    }

    public NumberSchema lt(Number bound) {
        return lt(bound, null);
    }

    public NumberSchema lt(Number bound, String message) {
        return with(new NumberCheck(NumberCheck.Kind.MAX, decimal(bound), false, message));
    }

    public NumberSchema lte(Number bound) {
        return lte(bound, null);
    }

    public NumberSchema lte(Number bound, String message) {
        return with(new NumberCheck(NumberCheck.Kind.MAX, decimal(bound), true, message));
    }

    /** Alias of {@link #lte(Number)}. */
    public NumberSchema max(Number bound) {
        return lte(bound);
    }

    public NumberSchema max(Number bound, String message) {
        return lte(bound, message);
    }

    public NumberSchema positive() {
        return gt(0);
    }

    public NumberSchema negative() {
        return lt(0);
    }

    public NumberSchema nonnegative() {
        return gte(0);
    }

    public NumberSchema nonpositive() {
        return lte(0);
    }

    /** Requires an integral value. */
    public NumberSchema integer() {
        return integer(null);
    }

    public NumberSchema integer(String message) {
        return with(new NumberCheck(NumberCheck.Kind.INT, null, true, message));
    }

    /**
     * @throws SchemaDefinitionException if {@code divisor} is not positive
     */
    public NumberSchema multipleOf(Number divisor) {
        return multipleOf(divisor, null);
    }

    public NumberSchema multipleOf(Number divisor, String message) {
        BigDecimal value = decimal(divisor);
        if (value.signum() <= 0) {
            throw new SchemaDefinitionException("multipleOf requires a positive divisor, got: " + divisor);
        }
        return with(new NumberCheck(NumberCheck.Kind.MULTIPLE_OF, value, true, message));
    }

    /** Rejects infinities. */
    public NumberSchema finite() {
        return with(new NumberCheck(NumberCheck.Kind.FINITE, null, true, null));
    }

    /**
     * Bounds the value to the safe-integer range (|n| &lt;= 2^53 - 1). Fractions inside the range
     * pass; chain {@link #integer()} to require a whole number as well.
     */
    public NumberSchema safe() {
        return with(new NumberCheck(NumberCheck.Kind.SAFE, null, true, null));
    }

    private NumberSchema with(NumberCheck check) {
        List<NumberCheck> next = new ArrayList<>(checks);
        next.add(check);
        return new NumberSchema(next);
    }

    static BigDecimal decimal(Number n) {
        Objects.requireNonNull(n, "bound must not be null");
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new SchemaDefinitionException("Numeric bound must be finite, got: " + n);
        }
        return BigDecimal.valueOf(d);
    }
}
