package io.shapeform.core.schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Accepts date values: {@code java.time} temporals and {@link java.util.Date} wrapped as POJO nodes.
 * Text is never parsed into a date.
 */
public final class DateSchema extends Schema {

    private final List<DateCheck> checks;

    DateSchema(List<DateCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.DATE;
    }

    public List<DateCheck> checks() {
        return checks;
    }

    public DateSchema min(Instant earliest) {
        return min(earliest, null);
    }

    public DateSchema min(Instant earliest, String message) {
        return with(new DateCheck(DateCheck.Kind.MIN, earliest, message));
    }

    public DateSchema max(Instant latest) {
        return max(latest, null);
    }

    public DateSchema max(Instant latest, String message) {
        return with(new DateCheck(DateCheck.Kind.MAX, latest, message));
    }

    private DateSchema with(DateCheck check) {
        List<DateCheck> next = new ArrayList<>(checks);
        next.add(check);
        return new DateSchema(next);
    }
}
