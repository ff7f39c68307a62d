package com.listquery.expression;

import com.listquery.exception.ExpressionSyntaxException;
import com.listquery.validation.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.listquery.expression.ExpressionConfig.*;

/**
 * Tokenizer for filter expressions.
 * Converts input string into a sequence of tokens.
 * <p>
 * {@code AND} and {@code OR} (any case) are connectives only when whitespace sits on both
 * sides of them; anywhere else they are plain identifiers. Single-quoted strings may
 * contain a quote written twice ({@code 'O''Brien'}). Double-quoted strings are lexed
 * without escapes and left for the literal check to reject.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by {@link TokenType#EOF}
     * @throws ExpressionSyntaxException if the input contains text no token can start with
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.EQUALS -> {
                    advance();
                    tokens.add(new Token(TokenType.EQ, "=", start));
                }
                case Operators.BANG -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.NE, "!=", start));
                    } else {
                        throw error(Violation.BAD_COMPARATOR, "!", start, "Unexpected '!'");
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", start));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", start));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", start));
                    }
                }
                case Operators.QUOTE_SINGLE -> tokens.add(readSingleQuoted());
                case Operators.QUOTE_DOUBLE -> tokens.add(readDoubleQuoted());
                case Operators.MINUS, Operators.PLUS ->
                        throw error(Violation.BAD_LITERAL, String.valueOf(c), start,
                                "Signed numbers are not supported");
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrConnective());
                    } else if (isDigit(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error(Violation.MALFORMED_EXPRESSION, String.valueOf(c), start,
                                "Unexpected character '" + c + "'");
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private Token readIdentifierOrConnective() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType connective = CONNECTIVES.get(text.toUpperCase(Locale.ROOT));
        if (connective != null && whitespaceBefore(start) && whitespaceAfter(pos)) {
            return new Token(connective, text, start);
        }

        return new Token(TokenType.IDENT, text, start);
    }

    private Token readNumber() {
        int start = pos;

        int integerDigits = 0;
        while (!isAtEnd() && isDigit(peek())) {
            advance();
            integerDigits++;
        }

        int fractionDigits = -1;
        if (!isAtEnd() && peek() == Operators.DOT) {
            advance();
            fractionDigits = 0;
            while (!isAtEnd() && isDigit(peek())) {
                advance();
                fractionDigits++;
            }
        }

        String text = input.substring(start, pos);

        if (!isAtEnd() && (isIdentifierPart(peek()) || peek() == Operators.DOT)) {
            while (!isAtEnd() && (isIdentifierPart(peek()) || peek() == Operators.DOT)) {
                advance();
            }
            String junk = input.substring(start, pos);
            throw error(Violation.BAD_LITERAL, junk, start, "Invalid number '" + junk + "'");
        }
        if (fractionDigits == 0) {
            throw error(Violation.BAD_LITERAL, text, start, "Missing digits after decimal point");
        }
        if (integerDigits > MAX_INTEGER_DIGITS || fractionDigits > MAX_FRACTION_DIGITS) {
            throw error(Violation.BAD_LITERAL, text, start,
                    "Number '" + text + "' exceeds " + MAX_INTEGER_DIGITS + " digits");
        }

        return new Token(TokenType.NUMBER, text, start);
    }

    private Token readSingleQuoted() {
        int start = pos;
        advance(); // opening quote

        while (!isAtEnd()) {
            char c = advance();
            if (c == Operators.QUOTE_SINGLE) {
                if (match(Operators.QUOTE_SINGLE)) {
                    continue; // doubled quote
                }
                return new Token(TokenType.STRING, input.substring(start, pos), start);
            }
        }

        throw error(Violation.BAD_LITERAL, input.substring(start), start, "Unterminated string");
    }

    private Token readDoubleQuoted() {
        int start = pos;
        advance(); // opening quote

        while (!isAtEnd()) {
            if (advance() == Operators.QUOTE_DOUBLE) {
                return new Token(TokenType.STRING, input.substring(start, pos), start);
            }
        }

        throw error(Violation.BAD_LITERAL, input.substring(start), start, "Unterminated string");
    }

    private boolean whitespaceBefore(int index) {
        return index > 0 && Character.isWhitespace(input.charAt(index - 1));
    }

    private boolean whitespaceAfter(int index) {
        return index < length && Character.isWhitespace(input.charAt(index));
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ExpressionSyntaxException error(Violation violation, String token, int position, String message) {
        return new ExpressionSyntaxException(violation, token, position,
                "Invalid filter at position " + position + ": " + message + " in '" + input + "'");
    }
}
