package com.listquery.exception;

/**
 * Exception thrown when a pagination cursor token cannot be decoded.
 */
public class InvalidCursorException extends ListQueryException {

    public InvalidCursorException(String message) {
        super(message);
    }

    public InvalidCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
