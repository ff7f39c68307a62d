package com.listquery.validation;

import com.listquery.model.Literal;

import java.util.Optional;

/**
 * Recognizes filter literals: single-quoted strings and base-10 numbers.
 */
public final class LiteralClassifier {

    private static final char QUOTE = '\'';

    private LiteralClassifier() {
    }

    /**
     * Classify a literal token.
     *
     * @param token literal as written, quotes included
     * @return the literal, or empty if it is neither a quoted string nor a number
     */
    public static Optional<Literal> classify(String token) {
        if (isQuotedString(token)) {
            return Optional.of(Literal.quoted(token));
        }
        if (isNumber(token)) {
            return Optional.of(Literal.number(token));
        }
        return Optional.empty();
    }

    public static boolean isValue(String token) {
        return isQuotedString(token) || isNumber(token);
    }

    /**
     * First and last characters are single quotes. Content is not inspected.
     */
    public static boolean isQuotedString(String token) {
        return token != null
                && token.length() >= 2
                && token.charAt(0) == QUOTE
                && token.charAt(token.length() - 1) == QUOTE;
    }

    /**
     * Parses as a base-10 integer or floating point value.
     * Surrounding whitespace and Java type suffixes (1d, 2f, 3L) are not accepted.
     */
    public static boolean isNumber(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        if (Character.isWhitespace(token.charAt(0))
                || Character.isWhitespace(token.charAt(token.length() - 1))) {
            return false;
        }
        char last = Character.toLowerCase(token.charAt(token.length() - 1));
        if (last == 'd' || last == 'f') {
            return false;
        }
        try {
            Long.parseLong(token);
            return true;
        } catch (NumberFormatException notInteger) {
            try {
                Double.parseDouble(token);
                return true;
            } catch (NumberFormatException notDecimal) {
                return false;
            }
        }
    }
}
