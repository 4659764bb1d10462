package com.pyparser.json;

/**
 * Thrown when a syntax tree cannot be written to or read from JSON.
 */
public class TreeJsonException extends RuntimeException {

    public TreeJsonException(String message) {
        super(message);
    }

    public TreeJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public TreeJsonException(Throwable cause) {
        super(cause);
    }
}
