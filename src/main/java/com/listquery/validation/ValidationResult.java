package com.listquery.validation;

/**
 * Result of validating one list parameter.
 */
public interface ValidationResult {

    /**
     * Check if the expression was accepted.
     */
    boolean isValid();

    /**
     * Get the reason for rejection. Null for a valid result.
     */
    Violation getViolation();

    /**
     * Get the offending token as written by the client. Null for a valid result.
     */
    String getToken();

    /**
     * Get the position of the offending token, or -1 when not applicable.
     */
    int getPosition();

    /**
     * Get human-readable explanation of the decision.
     */
    String getExplanation();
}
