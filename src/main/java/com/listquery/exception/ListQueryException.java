package com.listquery.exception;

/**
 * Base exception for list-query.
 */
public class ListQueryException extends RuntimeException {

    public ListQueryException(String message) {
        super(message);
    }

    public ListQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
