package com.appjwt.generator.exception;

/**
 * Thrown when a token id is not a canonical UUIDv4 string.
 */
public class InvalidJtiException extends IllegalArgumentException {

    public InvalidJtiException(String message) {
        super(message);
    }
}
