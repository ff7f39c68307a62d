package com.listquery.validation;

import com.listquery.exception.ExpressionSyntaxException;
import com.listquery.expression.ListTokenizer;
import com.listquery.expression.ListTokenizer.Piece;
import com.listquery.model.ColumnAllowList;
import com.listquery.model.FieldsExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the {@code fields} projection parameter.
 * <p>
 * Example: {@code "id, first_name, last_name"}.
 */
public final class FieldsValidator {

    private static final Logger log = LoggerFactory.getLogger(FieldsValidator.class);

    private FieldsValidator() {
    }

    public static ValidationResult validate(ColumnAllowList allowList, String raw) {
        try {
            parse(allowList, raw);
            return DefaultValidationResult.valid();
        } catch (ExpressionSyntaxException e) {
            log.debug("Rejected fields '{}': {} at '{}'", raw, e.getViolation(), e.getToken());
            return DefaultValidationResult.invalid(e);
        }
    }

    public static boolean isValid(ColumnAllowList allowList, String raw) {
        return validate(allowList, raw).isValid();
    }

    /**
     * Parse a fields expression.
     *
     * @param allowList columns the resource exposes
     * @param raw       client input, may be empty
     * @return the requested columns; empty when {@code raw} is empty
     * @throws ExpressionSyntaxException if the allow-list is empty or a column is not allowed
     */
    public static FieldsExpression parse(ColumnAllowList allowList, String raw) {
        if (allowList == null || allowList.isEmpty()) {
            throw new ExpressionSyntaxException(Violation.EMPTY_ALLOW_LIST, "", -1,
                    "No fields are allowed for this resource");
        }
        if (raw == null || raw.isEmpty()) {
            return FieldsExpression.all();
        }

        List<String> columns = new ArrayList<>();
        for (Piece token : ListTokenizer.tokenizeFields(raw)) {
            if (!ColumnGate.isAllowed(token.text(), allowList)) {
                throw new ExpressionSyntaxException(Violation.UNKNOWN_COLUMN, token.text(), token.position(),
                        "Unknown field '" + token.text() + "', allowed: " + allowList);
            }
            columns.add(token.text());
        }
        return new FieldsExpression(columns);
    }
}
