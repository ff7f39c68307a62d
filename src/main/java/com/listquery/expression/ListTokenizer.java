package com.listquery.expression;

import java.util.ArrayList;
import java.util.List;

import static com.listquery.expression.ExpressionConfig.LIST_SEPARATOR;

/**
 * Splits comma-separated fields and sort expressions.
 * No escaping of commas is supported.
 */
public final class ListTokenizer {

    private ListTokenizer() {
    }

    /**
     * A comma-separated piece and the offset of its text in the input.
     *
     * @param text     piece text
     * @param position offset of the first character of {@code text}
     */
    public record Piece(String text, int position) {
    }

    /**
     * Split a fields expression on commas and trim every piece.
     * Pieces that are empty after trimming are kept as empty strings, positioned
     * at the end of their whitespace.
     *
     * @param input fields expression
     * @return trimmed pieces, in input order
     */
    public static List<Piece> tokenizeFields(String input) {
        List<Piece> pieces = new ArrayList<>();
        for (Piece piece : split(input)) {
            pieces.add(strip(piece));
        }
        return pieces;
    }

    /**
     * Split a sort expression on commas. Pieces are left untrimmed.
     *
     * @param input sort expression
     * @return raw pieces, in input order
     */
    public static List<Piece> tokenizeSort(String input) {
        return split(input);
    }

    /**
     * Trim a piece, moving its position past the leading whitespace.
     */
    public static Piece strip(Piece piece) {
        String text = piece.text();
        int leading = 0;
        while (leading < text.length() && Character.isWhitespace(text.charAt(leading))) {
            leading++;
        }
        return new Piece(text.strip(), piece.position() + leading);
    }

    private static List<Piece> split(String input) {
        List<Piece> pieces = new ArrayList<>();
        int start = 0;
        int next;
        while ((next = input.indexOf(LIST_SEPARATOR, start)) >= 0) {
            pieces.add(new Piece(input.substring(start, next), start));
            start = next + LIST_SEPARATOR.length();
        }
        pieces.add(new Piece(input.substring(start), start));
        return pieces;
    }
}
