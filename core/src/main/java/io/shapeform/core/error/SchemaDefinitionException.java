package io.shapeform.core.error;

/**
 * Thrown while building a schema tree: duplicate object fields, combinators naming unknown fields,
 * conflicting discriminator values, invalid bounds.
 */
public final class SchemaDefinitionException extends ShapeformException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message) {
        super(message, Phase.DEFINITION);
    }

    public SchemaDefinitionException(String message, Throwable cause) {
        super(message, cause, Phase.DEFINITION);
    }
}
