package io.shapeform.core.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accepts a fixed-length, positionally typed list. With a {@link #rest()} node, elements beyond the
 * fixed positions are accepted if they match it.
 */
public final class TupleSchema extends Schema {

    private final List<Schema> items;
    private final Schema rest;

    TupleSchema(List<Schema> items, Schema rest) {
        this.items = List.copyOf(items);
        this.rest = rest;
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.TUPLE;
    }

    public List<Schema> items() {
        return items;
    }

    public Optional<Schema> rest() {
        return Optional.ofNullable(rest);
    }

    /** A new tuple accepting trailing elements that match {@code rest}. */
    public TupleSchema rest(Schema rest) {
        return new TupleSchema(items, Objects.requireNonNull(rest, "rest must not be null"));
    }

    @Override
    public String toString() {
        return "tuple" + items + (rest == null ? "" : "..." + rest);
    }
}
