package com.listquery.model;

/**
 * Boolean connective joining two filter conditions.
 */
public enum Connective {
    AND,
    OR
}
