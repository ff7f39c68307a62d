package com.listquery.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listquery.exception.InvalidQueryParameterException;
import com.listquery.validation.ValidationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a rejected list parameter as the JSON body of a 400 response:
 * {@code {"field": "filter", "message": "...", "code": "INVALID_COLUMN"}}.
 */
public class ValidationErrorRenderer {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Render the error body for a rejected parameter.
     *
     * @param e rejection raised by {@link ListQueryParser}
     * @return JSON object with field, message and code
     */
    public static String render(InvalidQueryParameterException e) {
        return render(e.getParameter(), e.getResult());
    }

    public static String render(String parameter, ValidationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", parameter);
        body.put("message", result.getExplanation());
        body.put("code", result.getViolation() != null ? result.getViolation().code() : null);
        if (result.getToken() != null && !result.getToken().isEmpty()) {
            body.put("token", result.getToken());
        }

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render validation error: " + e.getMessage(), e);
        }
    }
}
