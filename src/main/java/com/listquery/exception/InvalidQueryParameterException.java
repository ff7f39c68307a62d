package com.listquery.exception;

import com.listquery.validation.ValidationResult;

/**
 * Exception thrown when a list query parameter is rejected.
 * HTTP callers map it to 400 Bad Request.
 */
public class InvalidQueryParameterException extends ListQueryException {

    private final String parameter;
    private final ValidationResult result;

    public InvalidQueryParameterException(String parameter, ValidationResult result) {
        super("Invalid " + parameter + " parameter: " + result.getExplanation());
        this.parameter = parameter;
        this.result = result;
    }

    /**
     * Name of the offending query parameter (sort, filter, fields, limit, next_token, prev_token).
     */
    public String getParameter() {
        return parameter;
    }

    public ValidationResult getResult() {
        return result;
    }
}
