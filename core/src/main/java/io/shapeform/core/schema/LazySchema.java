package io.shapeform.core.schema;

import io.shapeform.core.error.SchemaDefinitionException;
import java.util.Objects;
import java.util.function.Supplier;

/** Defers construction of a node until first use; enables recursive shapes. */
public final class LazySchema extends Schema {

    private final Supplier<? extends Schema> supplier;
    private volatile Schema resolved;

    LazySchema(Supplier<? extends Schema> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "supplier must not be null");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.LAZY;
    }

    /**
     * Returns the deferred node, resolving it on first call.
     *
     * @throws SchemaDefinitionException if the supplier returns {@code null}
     */
    public Schema resolve() {
        Schema current = resolved;
        if (current == null) {
            current = supplier.get();
            if (current == null) {
                throw new SchemaDefinitionException("lazy supplier returned null");
            }
            resolved = current;
        }
        return current;
    }

    @Override
    public String toString() {
        return "lazy";
    }
}
