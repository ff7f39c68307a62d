package com.listquery.model;

/**
 * Kind of a filter literal.
 */
public enum LiteralKind {
    QUOTED_STRING,
    NUMBER
}
