package io.springsecurity.jwtguard.exception;

/**
 * A rate limiter could not reach a decision, for example because its backend failed
 * or the limiter has been closed.
 */
public class LimiterException extends RuntimeException {

    public LimiterException(String message) {
        super(message);
    }

    public LimiterException(String message, Throwable cause) {
        super(message, cause);
    }
}
