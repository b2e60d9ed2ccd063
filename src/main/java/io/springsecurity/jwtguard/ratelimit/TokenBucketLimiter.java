package io.springsecurity.jwtguard.ratelimit;

import io.springsecurity.jwtguard.exception.LimiterException;
import io.springsecurity.jwtguard.exception.LimiterTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token bucket holding at most {@code capacity} tokens, one token added every {@code interval}.
 * The bucket starts full. Each instance owns one refill thread, started here and stopped by {@link #close()}.
 */
@Slf4j
public class TokenBucketLimiter implements BucketLimiter {

    private static final Object TOKEN = new Object();

    private final BlockingQueue<Object> tokens;
    private final ScheduledExecutorService refiller;
    private final AtomicBoolean closed = new AtomicBoolean();

    public TokenBucketLimiter(int capacity, Duration interval) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.tokens = new ArrayBlockingQueue<>(capacity);
        for (int i = 0; i < capacity; i++) {
            tokens.offer(TOKEN);
        }
        this.refiller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "token-bucket-refill");
            thread.setDaemon(true);
            return thread;
        });
        long nanos = interval.toNanos();
        refiller.scheduleAtFixedRate(() -> tokens.offer(TOKEN), nanos, nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public boolean limit() {
        ensureOpen();
        return tokens.poll() == null;
    }

    @Override
    public void blockLimit(Duration timeout) {
        ensureOpen();
        Object token;
        try {
            token = tokens.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LimiterTimeoutException("Interrupted while waiting for a token", e);
        }
        if (token == null) {
            throw new LimiterTimeoutException("No token available within " + timeout);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            refiller.shutdownNow();
            log.debug("Token bucket refill stopped");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Tokens currently in the bucket.
     */
    public int available() {
        return tokens.size();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new LimiterException("Token bucket limiter is closed");
        }
    }
}
