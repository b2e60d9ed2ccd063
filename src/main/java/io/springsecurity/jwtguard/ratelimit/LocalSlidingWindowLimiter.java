package io.springsecurity.jwtguard.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process sliding window: at most {@code threshold} admitted events per key within any trailing
 * {@code window}. Suited to a single instance; use {@link RedisSlidingWindowLimiter} when instances
 * share the limit.
 *
 * <p>Keys whose window has drained are dropped, at the latest one window after their last event.
 */
public class LocalSlidingWindowLimiter implements Limiter {

    private final long windowMillis;
    private final int threshold;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong nextSweep;

    public LocalSlidingWindowLimiter(Duration window, int threshold) {
        this(window, threshold, Clock.systemUTC());
    }

    public LocalSlidingWindowLimiter(Duration window, int threshold, Clock clock) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must not be negative");
        }
        this.windowMillis = window.toMillis();
        this.threshold = threshold;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.nextSweep = new AtomicLong(clock.millis() + windowMillis);
    }

    @Override
    public boolean limit(String key) {
        long now = clock.millis();
        sweepIfDue(now);

        AtomicBoolean limited = new AtomicBoolean();
        windows.compute(key, (k, window) -> {
            Window current = window == null ? new Window() : window;
            current.evict(now);
            if (current.size() >= threshold) {
                limited.set(true);
            } else {
                current.admit(now);
            }
            return current.isEmpty() ? null : current;
        });
        return limited.get();
    }

    /**
     * Number of keys holding events.
     */
    public int getTrackedKeys() {
        return windows.size();
    }

    private void sweepIfDue(long now) {
        long due = nextSweep.get();
        if (now < due || !nextSweep.compareAndSet(due, now + windowMillis)) {
            return;
        }
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> {
                window.evict(now);
                return window.isEmpty() ? null : window;
            });
        }
    }

    // Only touched inside ConcurrentMap.compute, which serializes access per key.
    private final class Window {

        private final Deque<Long> admitted = new ArrayDeque<>();

        void evict(long now) {
            long windowStart = now - windowMillis;
            while (!admitted.isEmpty() && admitted.peekFirst() <= windowStart) {
                admitted.pollFirst();
            }
        }

        void admit(long now) {
            admitted.addLast(now);
        }

        int size() {
            return admitted.size();
        }

        boolean isEmpty() {
            return admitted.isEmpty();
        }
    }
}
