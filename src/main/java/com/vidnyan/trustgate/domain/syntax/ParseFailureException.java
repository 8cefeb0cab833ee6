package com.vidnyan.trustgate.domain.syntax;

/**
 * Thrown when a grammar cannot produce any syntax tree for its input.
 */
public class ParseFailureException extends RuntimeException {

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
