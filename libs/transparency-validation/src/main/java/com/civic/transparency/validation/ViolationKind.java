package com.civic.transparency.validation;

/**
 * Category of a single {@link Violation}.
 */
public enum ViolationKind {

    /** A categorical field holds a value outside its closed set. */
    INVALID_ENUM_VALUE,

    /** A fixed-length pattern field (the dedup hash) has the wrong shape. */
    MALFORMED_FIXED_PATTERN,

    /** An optional pattern field (the origin hint) is present but has the wrong shape. */
    MALFORMED_VARIABLE_PATTERN,

    /** A required string is null or empty. */
    EMPTY_REQUIRED_FIELD,

    /** A required value (timestamp, nested record) is missing. */
    UNSET_REQUIRED_FIELD,

    /** A number lies outside its permitted range. */
    OUT_OF_RANGE_VALUE,

    /** A required collection has no elements. */
    EMPTY_REQUIRED_COLLECTION
}
