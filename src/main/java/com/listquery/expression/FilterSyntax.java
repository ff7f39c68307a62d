package com.listquery.expression;

import com.listquery.model.Comparator;
import com.listquery.model.Connective;

import java.util.List;

/**
 * Structure of a filter expression before columns and literals are checked.
 *
 * @param clauses     Conditions in input order
 * @param connectives Connectives between consecutive clauses
 */
public record FilterSyntax(List<Clause> clauses, List<Connective> connectives) {

    public FilterSyntax {
        clauses = List.copyOf(clauses);
        connectives = List.copyOf(connectives);
    }

    /**
     * A single condition as written.
     *
     * @param column     Identifier token
     * @param comparator Comparator between column and value
     * @param value      String or number token
     */
    public record Clause(Token column, Comparator comparator, Token value) {
    }
}
