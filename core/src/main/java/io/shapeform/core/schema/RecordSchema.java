package io.shapeform.core.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * Accepts an object with arbitrary keys whose every value matches {@link #value()}. An optional key
 * node validates each key as text; its output replaces the key.
 */
public final class RecordSchema extends Schema {

    private final Schema key;
    private final Schema value;

    RecordSchema(Schema key, Schema value) {
        this.key = key;
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.RECORD;
    }

    public Optional<Schema> key() {
        return Optional.ofNullable(key);
    }

    public Schema value() {
        return value;
    }
}
