package com.appjwt.generator.exception;

/**
 * The token could not be produced: claims that Jackson cannot encode, unreadable PEM,
 * a non-RSA key, a key too short for RS256 or a provider failure.
 */
public class TokenSigningException extends RuntimeException {

    public TokenSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
