package io.springsecurity.jwtguard.exception;

/**
 * Signing or serialization of a token failed.
 */
public class TokenGenerationException extends RuntimeException {

    public TokenGenerationException(String message) {
        super(message);
    }

    public TokenGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
