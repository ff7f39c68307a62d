package com.listquery.validation;

/**
 * Reason a list parameter was rejected.
 */
public enum Violation {
    /** No allow-list was configured, nothing can be validated. */
    EMPTY_ALLOW_LIST("EMPTY_ALLOW_LIST"),

    /** A referenced column is not on the allow-list. */
    UNKNOWN_COLUMN("INVALID_COLUMN"),

    /** Missing, unknown or unsupported comparator. */
    BAD_COMPARATOR("INVALID_COMPARATOR"),

    /** Literal is neither a single-quoted string nor a number. */
    BAD_LITERAL("INVALID_VALUE"),

    /** Conditions and connectives, or sort columns and directions, do not pair up. */
    CARDINALITY_MISMATCH("INVALID_STRUCTURE"),

    /** Sort direction is not ASC or DESC. */
    UNKNOWN_DIRECTION("INVALID_DIRECTION"),

    /** Input does not fit the grammar at all. */
    MALFORMED_EXPRESSION("INVALID_FORMAT"),

    /** Input exceeds the configured maximum length. */
    TOO_LONG("TOO_LONG"),

    /** Page limit is not an integer or is below the minimum. */
    INVALID_LIMIT("INVALID_LIMIT"),

    /** Pagination cursor token cannot be decoded. */
    INVALID_CURSOR("INVALID_CURSOR");

    private final String code;

    Violation(String code) {
        this.code = code;
    }

    /**
     * Error code reported to API clients.
     */
    public String code() {
        return code;
    }
}
