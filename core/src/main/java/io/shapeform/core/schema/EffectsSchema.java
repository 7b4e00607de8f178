package io.shapeform.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node with preprocess, refinement and transform steps around an inner node. Chaining further
 * effects appends to the same list, so steps always run in declaration order.
 */
public final class EffectsSchema extends Schema {

    private final Schema inner;
    private final List<Effect> effects;

    EffectsSchema(Schema inner, List<Effect> effects) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
        this.effects = List.copyOf(effects);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.EFFECTS;
    }

    public Schema inner() {
        return inner;
    }

    public List<Effect> effects() {
        return effects;
    }

    @Override
    EffectsSchema withEffect(Effect effect) {
        List<Effect> next = new ArrayList<>(effects);
        next.add(effect);
        return new EffectsSchema(inner, next);
    }

    @Override
    public String toString() {
        return inner + "+effects" + effects.stream().map(Effect::name).toList();
    }
}
