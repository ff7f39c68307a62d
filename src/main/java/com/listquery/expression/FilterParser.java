package com.listquery.expression;

import com.listquery.exception.ExpressionSyntaxException;
import com.listquery.model.Comparator;
import com.listquery.model.Connective;
import com.listquery.validation.Violation;

import java.util.ArrayList;
import java.util.List;

import static com.listquery.expression.ExpressionConfig.COMPARATORS;
import static com.listquery.expression.ExpressionConfig.CONNECTIVE_VALUES;

/**
 * Parser for filter expressions.
 * Converts tokens into a {@link FilterSyntax} using recursive descent parsing.
 * <p>
 * Grammar (connectives are kept flat, left to right, without precedence):
 * <pre>
 * filter     := condition (connective condition)* EOF
 * condition  := IDENT '=' | '!=' STRING
 *             | IDENT '=' | '&gt;' | '&gt;=' | '&lt;' | '&lt;=' NUMBER
 * connective := 'AND' | 'OR'
 * </pre>
 */
public final class FilterParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public FilterParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Tokenize and parse a filter expression.
     *
     * @param input filter expression, not empty
     * @return parsed structure
     * @throws ExpressionSyntaxException if the expression does not fit the grammar
     */
    public static FilterSyntax parse(String input) {
        List<Token> tokens = new ExpressionTokenizer(input).tokenize();
        return new FilterParser(input, tokens).parse();
    }

    /**
     * Parse the token stream.
     *
     * @return parsed structure with one connective fewer than clauses
     */
    public FilterSyntax parse() {
        if (check(TokenType.EOF)) {
            throw error(Violation.MALFORMED_EXPRESSION, "Expected at least one condition");
        }

        List<FilterSyntax.Clause> clauses = new ArrayList<>();
        List<Connective> connectives = new ArrayList<>();
        clauses.add(parseCondition());

        while (!check(TokenType.EOF)) {
            if (!peek().type().isConnective()) {
                throw error(Violation.CARDINALITY_MISMATCH, "Expected AND or OR between conditions");
            }
            connectives.add(CONNECTIVE_VALUES.get(advance().type()));
            if (check(TokenType.EOF)) {
                throw error(Violation.CARDINALITY_MISMATCH,
                        "Connective '" + previous().text() + "' is not followed by a condition");
            }
            clauses.add(parseCondition());
        }

        return new FilterSyntax(clauses, connectives);
    }

    private FilterSyntax.Clause parseCondition() {
        if (peek().type().isConnective()) {
            throw error(Violation.CARDINALITY_MISMATCH, "Connective without a preceding condition");
        }
        Token column = consume(TokenType.IDENT, Violation.MALFORMED_EXPRESSION, "Expected column name");

        if (!peek().type().isComparator()) {
            throw error(Violation.BAD_COMPARATOR, "Expected comparator after '" + column.text() + "'");
        }
        Token operator = advance();
        Comparator comparator = COMPARATORS.get(operator.type());

        if (!peek().type().isLiteral()) {
            throw error(Violation.BAD_LITERAL, "Expected quoted string or number after '" + operator.text() + "'");
        }
        Token value = advance();

        if (value.type() == TokenType.STRING && !comparator.acceptsString()) {
            throw error(Violation.BAD_COMPARATOR, operator,
                    "'" + operator.text() + "' cannot compare against a string");
        }
        if (value.type() == TokenType.NUMBER && !comparator.acceptsNumber()) {
            throw error(Violation.BAD_COMPARATOR, operator,
                    "'" + operator.text() + "' cannot compare against a number");
        }

        return new FilterSyntax.Clause(column, comparator, value);
    }

    private Token consume(TokenType type, Violation violation, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(violation, message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ExpressionSyntaxException error(Violation violation, String message) {
        return error(violation, peek(), message);
    }

    private ExpressionSyntaxException error(Violation violation, Token token, String message) {
        return new ExpressionSyntaxException(violation, token.text(), token.position(),
                "Invalid filter at position " + token.position() + ": " + message + " in '" + input + "'");
    }
}
