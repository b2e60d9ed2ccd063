package io.springsecurity.jwtguard.exception;

/**
 * A blocking limiter gave up waiting, either because the deadline passed or because
 * the waiting thread was interrupted.
 */
public class LimiterTimeoutException extends LimiterException {

    public LimiterTimeoutException(String message) {
        super(message);
    }

    public LimiterTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
