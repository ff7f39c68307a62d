package com.listquery.validation;

import com.listquery.exception.ExpressionSyntaxException;
import com.listquery.expression.ListTokenizer;
import com.listquery.expression.ListTokenizer.Piece;
import com.listquery.model.ColumnAllowList;
import com.listquery.model.SortDirection;
import com.listquery.model.SortExpression;
import com.listquery.model.SortKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import static com.listquery.expression.ExpressionConfig.WHITESPACE_RUN;

/**
 * Validates the {@code sort} parameter.
 * <p>
 * Every comma-separated token must be {@code <column> <ASC|DESC>}; a bare column is rejected.
 * Example: {@code "id ASC, first_name DESC"}.
 */
public final class SortValidator {

    private static final Logger log = LoggerFactory.getLogger(SortValidator.class);

    private SortValidator() {
    }

    public static ValidationResult validate(ColumnAllowList allowList, String raw) {
        try {
            parse(allowList, raw);
            return DefaultValidationResult.valid();
        } catch (ExpressionSyntaxException e) {
            log.debug("Rejected sort '{}': {} at '{}'", raw, e.getViolation(), e.getToken());
            return DefaultValidationResult.invalid(e);
        }
    }

    public static boolean isValid(ColumnAllowList allowList, String raw) {
        return validate(allowList, raw).isValid();
    }

    /**
     * Parse a sort expression.
     *
     * @param allowList columns the resource can be sorted by
     * @param raw       client input, may be empty
     * @return sort keys in client order; empty when {@code raw} is empty
     * @throws ExpressionSyntaxException if any token is not {@code <allowed column> <direction>}
     */
    public static SortExpression parse(ColumnAllowList allowList, String raw) {
        if (allowList == null || allowList.isEmpty()) {
            throw new ExpressionSyntaxException(Violation.EMPTY_ALLOW_LIST, "", -1,
                    "No sort columns are allowed for this resource");
        }
        if (raw == null || raw.isEmpty()) {
            return SortExpression.none();
        }

        List<Piece> columns = new ArrayList<>();
        List<Piece> directions = new ArrayList<>();
        for (Piece token : ListTokenizer.tokenizeSort(raw)) {
            Piece stripped = ListTokenizer.strip(token);
            Matcher separator = WHITESPACE_RUN.matcher(stripped.text());
            if (separator.find()) {
                columns.add(new Piece(stripped.text().substring(0, separator.start()), stripped.position()));
                directions.add(new Piece(stripped.text().substring(separator.end()),
                        stripped.position() + separator.end()));
            } else {
                columns.add(stripped);
            }
        }

        if (columns.isEmpty()) {
            throw new ExpressionSyntaxException(Violation.MALFORMED_EXPRESSION, raw, 0,
                    "Sort expression has no columns");
        }

        for (Piece column : columns) {
            if (!ColumnGate.isAllowed(column.text(), allowList)) {
                throw new ExpressionSyntaxException(Violation.UNKNOWN_COLUMN, column.text(), column.position(),
                        "Unknown sort column '" + column.text() + "', allowed: " + allowList);
            }
        }

        if (directions.size() != columns.size()) {
            throw new ExpressionSyntaxException(Violation.CARDINALITY_MISMATCH, raw, -1,
                    "Every sort column needs ASC or DESC: " + columns.size() + " columns, "
                            + directions.size() + " directions");
        }

        List<SortKey> keys = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            Piece direction = directions.get(i);
            SortDirection parsed = SortDirection.parse(direction.text()).orElseThrow(() ->
                    new ExpressionSyntaxException(Violation.UNKNOWN_DIRECTION, direction.text(), direction.position(),
                            "Unknown sort direction '" + direction.text() + "', expected ASC or DESC"));
            keys.add(new SortKey(columns.get(i).text(), parsed));
        }
        return new SortExpression(keys);
    }
}
