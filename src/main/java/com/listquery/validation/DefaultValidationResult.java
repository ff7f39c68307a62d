package com.listquery.validation;

import com.listquery.exception.ExpressionSyntaxException;

/**
 * Default implementation of ValidationResult.
 */
public class DefaultValidationResult implements ValidationResult {

    private static final ValidationResult VALID =
            new DefaultValidationResult(true, null, null, -1, "Expression is valid");

    private final boolean valid;
    private final Violation violation;
    private final String token;
    private final int position;
    private final String explanation;

    private DefaultValidationResult(boolean valid, Violation violation, String token,
                                    int position, String explanation) {
        this.valid = valid;
        this.violation = violation;
        this.token = token;
        this.position = position;
        this.explanation = explanation;
    }

    @Override
    public boolean isValid() {
        return valid;
    }

    @Override
    public Violation getViolation() {
        return violation;
    }

    @Override
    public String getToken() {
        return token;
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        if (valid) {
            return "ValidationResult{valid}";
        }
        return "ValidationResult{" +
                "violation=" + violation +
                ", token='" + token + '\'' +
                ", position=" + position +
                '}';
    }

    /**
     * The shared result for an accepted expression.
     */
    public static ValidationResult valid() {
        return VALID;
    }

    /**
     * Create a result for a rejected expression.
     */
    public static ValidationResult invalid(Violation violation, String token, int position, String explanation) {
        return new DefaultValidationResult(false, violation, token, position, explanation);
    }

    /**
     * Create a result from a lexer, parser or validator failure.
     */
    public static ValidationResult invalid(ExpressionSyntaxException e) {
        return invalid(e.getViolation(), e.getToken(), e.getPosition(), e.getMessage());
    }
}
