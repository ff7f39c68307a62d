package com.listquery.expression;

import com.listquery.model.Comparator;
import com.listquery.model.Connective;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Vocabulary shared by the list-parameter tokenizers.
 * <p>
 * Everything here is built once when the class loads and is never mutated, so it is
 * shared by all concurrent validations. Do not rebuild these tables per call.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Connective keywords (upper-cased) mapped to token types.
     */
    public static final Map<String, TokenType> CONNECTIVES = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR
    );

    /**
     * Comparator token types mapped to their model value.
     */
    public static final Map<TokenType, Comparator> COMPARATORS = Map.of(
            TokenType.EQ, Comparator.EQUAL,
            TokenType.NE, Comparator.NOT_EQUAL,
            TokenType.GT, Comparator.GREATER_THAN,
            TokenType.GTE, Comparator.GREATER_OR_EQUAL,
            TokenType.LT, Comparator.LESS_THAN,
            TokenType.LTE, Comparator.LESS_OR_EQUAL
    );

    /**
     * Connective token types mapped to their model value.
     */
    public static final Map<TokenType, Connective> CONNECTIVE_VALUES = Map.of(
            TokenType.AND, Connective.AND,
            TokenType.OR, Connective.OR
    );

    /**
     * Maximum digits before and after the decimal point of a numeric literal.
     */
    public static final int MAX_INTEGER_DIGITS = 15;
    public static final int MAX_FRACTION_DIGITS = 15;

    /**
     * Separator between entries of a fields or sort expression.
     */
    public static final String LIST_SEPARATOR = ",";

    /**
     * Splits a sort token into column and direction on the first whitespace run.
     */
    public static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char QUOTE_SINGLE = '\'';
        public static final char QUOTE_DOUBLE = '"';
        public static final char DOT = '.';
        public static final char MINUS = '-';
        public static final char PLUS = '+';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
