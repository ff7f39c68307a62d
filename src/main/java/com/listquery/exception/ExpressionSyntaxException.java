package com.listquery.exception;

import com.listquery.validation.Violation;

/**
 * Raised by the filter lexer and parser, and by the fields and sort validators, when a
 * list parameter is rejected.
 * Validators turn it into an invalid {@code ValidationResult}; it never reaches callers
 * of the boolean API.
 */
public class ExpressionSyntaxException extends ListQueryException {

    private final Violation violation;
    private final String token;
    private final int position;

    public ExpressionSyntaxException(Violation violation, String token, int position, String message) {
        super(message);
        this.violation = violation;
        this.token = token;
        this.position = position;
    }

    public Violation getViolation() {
        return violation;
    }

    public String getToken() {
        return token;
    }

    public int getPosition() {
        return position;
    }
}
