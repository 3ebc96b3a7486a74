package com.appjwt.generator.exception;

/**
 * Thrown when reading an optional claim that was never set.
 */
public class NotConfiguredException extends IllegalStateException {

    public NotConfiguredException(String message) {
        super(message);
    }
}
