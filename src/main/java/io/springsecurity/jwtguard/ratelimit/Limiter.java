package io.springsecurity.jwtguard.ratelimit;

/**
 * Admission decision for one event under {@code key}.
 */
public interface Limiter {

    /**
     * @return {@code true} when the request must be rejected
     * @throws io.springsecurity.jwtguard.exception.LimiterException when no decision could be made
     */
    boolean limit(String key);
}
