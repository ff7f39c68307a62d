package com.listquery.validation;

import com.listquery.exception.ExpressionSyntaxException;
import com.listquery.expression.FilterParser;
import com.listquery.expression.FilterSyntax;
import com.listquery.model.ColumnAllowList;
import com.listquery.model.FilterCondition;
import com.listquery.model.FilterExpression;
import com.listquery.model.Literal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the {@code filter} parameter.
 * <p>
 * Example: {@code "id>1 AND first_name='Alice' OR last_name='Smith'"}.
 * Structure is checked first, then columns, then literals.
 */
public final class FilterValidator {

    private static final Logger log = LoggerFactory.getLogger(FilterValidator.class);

    private FilterValidator() {
    }

    public static ValidationResult validate(ColumnAllowList allowList, String raw) {
        try {
            parse(allowList, raw);
            return DefaultValidationResult.valid();
        } catch (ExpressionSyntaxException e) {
            log.debug("Rejected filter '{}': {} at '{}'", raw, e.getViolation(), e.getToken());
            return DefaultValidationResult.invalid(e);
        }
    }

    public static boolean isValid(ColumnAllowList allowList, String raw) {
        return validate(allowList, raw).isValid();
    }

    /**
     * Parse a filter expression.
     *
     * @param allowList columns the resource can be filtered by
     * @param raw       client input, may be empty
     * @return conditions and connectives; empty when {@code raw} is empty
     * @throws ExpressionSyntaxException if the expression is rejected
     */
    public static FilterExpression parse(ColumnAllowList allowList, String raw) {
        if (allowList == null || allowList.isEmpty()) {
            throw new ExpressionSyntaxException(Violation.EMPTY_ALLOW_LIST, "", -1,
                    "No filter columns are allowed for this resource");
        }
        if (raw == null || raw.isEmpty()) {
            return FilterExpression.none();
        }

        FilterSyntax syntax = FilterParser.parse(raw);

        for (FilterSyntax.Clause clause : syntax.clauses()) {
            String column = clause.column().text();
            if (!ColumnGate.isAllowed(column, allowList)) {
                throw new ExpressionSyntaxException(Violation.UNKNOWN_COLUMN, column, clause.column().position(),
                        "Unknown filter column '" + column + "', allowed: " + allowList);
            }
        }

        List<FilterCondition> conditions = new ArrayList<>(syntax.clauses().size());
        for (FilterSyntax.Clause clause : syntax.clauses()) {
            String value = clause.value().text();
            Literal literal = LiteralClassifier.classify(value).orElseThrow(() ->
                    new ExpressionSyntaxException(Violation.BAD_LITERAL, value, clause.value().position(),
                            "Value " + value + " must be a single-quoted string or a number"));
            conditions.add(new FilterCondition(clause.column().text(), clause.comparator(), literal));
        }

        return new FilterExpression(conditions, syntax.connectives());
    }
}
