package io.shapeform.core.schema;

/** Closed set of node kinds. The engine dispatches on this tag. */
public enum SchemaKind {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    NULL,
    UNDEFINED,
    ANY,
    NEVER,
    LITERAL,
    ENUM,
    OBJECT,
    ARRAY,
    TUPLE,
    UNION,
    DISCRIMINATED_UNION,
    INTERSECTION,
    RECORD,
    OPTIONAL,
    NULLABLE,
    DEFAULT,
    EFFECTS,
    LAZY
}
