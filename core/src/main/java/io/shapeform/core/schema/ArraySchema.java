package io.shapeform.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Accepts a list whose every element matches {@link #element()}. */
public final class ArraySchema extends Schema {

    private final Schema element;
    private final List<SizeCheck> checks;

    ArraySchema(Schema element, List<SizeCheck> checks) {
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.checks = List.copyOf(checks);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ARRAY;
    }

    public Schema element() {
        return element;
    }

    public List<SizeCheck> checks() {
        return checks;
    }

    public ArraySchema min(int count) {
        return min(count, null);
    }

    public ArraySchema min(int count, String message) {
        return with(new SizeCheck(SizeCheck.Kind.MIN, count, message));
    }

    public ArraySchema max(int count) {
        return max(count, null);
    }

    public ArraySchema max(int count, String message) {
        return with(new SizeCheck(SizeCheck.Kind.MAX, count, message));
    }

    public ArraySchema length(int count) {
        return length(count, null);
    }

    public ArraySchema length(int count, String message) {
        return with(new SizeCheck(SizeCheck.Kind.EXACT, count, message));
    }

    public ArraySchema nonempty() {
        return min(1);
    }

    public ArraySchema nonempty(String message) {
        return min(1, message);
    }

    private ArraySchema with(SizeCheck check) {
        List<SizeCheck> next = new ArrayList<>(checks);
        next.add(check);
        return new ArraySchema(element, next);
    }

    @Override
    public String toString() {
        return "array<" + element + ">";
    }
}
