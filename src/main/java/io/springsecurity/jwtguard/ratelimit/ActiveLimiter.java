package io.springsecurity.jwtguard.ratelimit;

/**
 * Bounds the number of requests in progress per key.
 *
 * <p>A {@link #limit(String)} call returning {@code false} occupies a slot that must be given back
 * with exactly one {@link #release(String)}. A rejected call occupies nothing.
 */
public interface ActiveLimiter extends Limiter {

    void release(String key);
}
