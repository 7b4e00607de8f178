package io.shapeform.core.model;

/**
 * Kind of a validation {@link Issue}. The {@link #id()} is the stable snake_case identifier used in
 * message catalogs and serialized issue lists.
 */
public enum IssueCode {
    INVALID_TYPE("invalid_type"),
    INVALID_LITERAL("invalid_literal"),
    INVALID_ENUM_VALUE("invalid_enum_value"),
    UNRECOGNIZED_KEYS("unrecognized_keys"),
    INVALID_UNION("invalid_union"),
    INVALID_UNION_DISCRIMINATOR("invalid_union_discriminator"),
    INVALID_INTERSECTION_TYPES("invalid_intersection_types"),
    TOO_SMALL("too_small"),
    TOO_BIG("too_big"),
    NOT_MULTIPLE_OF("not_multiple_of"),
    NOT_FINITE("not_finite"),
    INVALID_STRING_FORMAT("invalid_string_format"),
    INVALID_DATE("invalid_date"),
    /** A synchronous entry point met an asynchronous refinement or transform. Fatal for the call. */
    ASYNC_EFFECT_ENCOUNTERED("async_effect_encountered"),
    /** Raised by user refinements. */
    CUSTOM("custom");

    private final String id;

    IssueCode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
