package io.shapeform.core.schema;

/** What an {@link ObjectSchema} does with input keys its shape does not declare. */
public enum UnknownKeys {
    /** Report one {@code unrecognized_keys} issue listing every extra key. */
    STRICT,
    /** Drop extra keys from the output (default). */
    STRIP,
    /** Copy extra keys to the output unchanged. */
    PASSTHROUGH
}
