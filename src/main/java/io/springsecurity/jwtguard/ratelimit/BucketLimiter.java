package io.springsecurity.jwtguard.ratelimit;

import java.time.Duration;

/**
 * Capacity based limiter shared by all requests. Owns a refill task that runs until {@link #close()}.
 */
public interface BucketLimiter extends AutoCloseable {

    /**
     * Takes a token if one is available.
     *
     * @return {@code true} when the bucket is empty and the request must be rejected
     * @throws io.springsecurity.jwtguard.exception.LimiterException when the limiter is closed
     */
    boolean limit();

    /**
     * Waits up to {@code timeout} for a token.
     *
     * @throws io.springsecurity.jwtguard.exception.LimiterTimeoutException when no token arrived in time
     *                                                                      or the thread was interrupted
     * @throws io.springsecurity.jwtguard.exception.LimiterException        when the limiter is closed
     */
    void blockLimit(Duration timeout);

    /**
     * Stops the refill task. Idempotent.
     */
    @Override
    void close();
}
