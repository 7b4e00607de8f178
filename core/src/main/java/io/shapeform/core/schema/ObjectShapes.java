package io.shapeform.core.schema;

import io.shapeform.core.error.SchemaDefinitionException;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Shape arithmetic behind the {@link ObjectSchema} combinators. Inputs are never mutated. */
final class ObjectShapes {

    private ObjectShapes() {}

    /** Validates that every name is a declared field. */
    static Set<String> known(Map<String, Schema> shape, String... names) {
        Set<String> result = new LinkedHashSet<>(Arrays.asList(names));
        for (String name : result) {
            if (!shape.containsKey(name)) {
                throw new SchemaDefinitionException("Unknown field '" + name + "', declared fields: " + shape.keySet());
            }
        }
        return result;
    }

    static Map<String, Schema> extend(Map<String, Schema> shape, Map<String, Schema> extra) {
        Map<String, Schema> result = new LinkedHashMap<>(shape);
        result.putAll(extra);
        return result;
    }

    static Map<String, Schema> partial(Map<String, Schema> shape, Collection<String> names) {
        Map<String, Schema> result = new LinkedHashMap<>(shape);
        for (String name : names) {
            result.put(name, shape.get(name).optional());
        }
        return result;
    }

    static Map<String, Schema> required(Map<String, Schema> shape, Collection<String> names) {
        Map<String, Schema> result = new LinkedHashMap<>(shape);
        for (String name : names) {
            Schema schema = shape.get(name);
            while (schema instanceof OptionalSchema optional) {
                schema = optional.unwrap();
            }
            result.put(name, schema);
        }
        return result;
    }

    static Map<String, Schema> pick(Map<String, Schema> shape, Collection<String> names) {
        Map<String, Schema> result = new LinkedHashMap<>();
        shape.forEach((name, schema) -> {
            if (names.contains(name)) {
                result.put(name, schema);
            }
        });
        return result;
    }

    static Map<String, Schema> omit(Map<String, Schema> shape, Collection<String> names) {
        Map<String, Schema> result = new LinkedHashMap<>(shape);
        result.keySet().removeAll(names);
        return result;
    }
}
