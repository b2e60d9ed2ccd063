package io.springsecurity.jwtguard.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process active request counter. A key is only tracked while it holds at least one slot.
 */
@Slf4j
public class LocalActiveLimiter implements ActiveLimiter {

    private final long maxActive;
    private final ConcurrentMap<String, Long> active = new ConcurrentHashMap<>();

    public LocalActiveLimiter(long maxActive) {
        if (maxActive < 0) {
            throw new IllegalArgumentException("maxActive must not be negative");
        }
        this.maxActive = maxActive;
    }

    @Override
    public boolean limit(String key) {
        AtomicBoolean limited = new AtomicBoolean();
        active.compute(key, (k, count) -> {
            long current = count == null ? 0 : count;
            if (current >= maxActive) {
                limited.set(true);
                return count;
            }
            return current + 1;
        });
        return limited.get();
    }

    @Override
    public void release(String key) {
        AtomicBoolean unmatched = new AtomicBoolean();
        active.compute(key, (k, count) -> {
            if (count == null) {
                unmatched.set(true);
                return null;
            }
            return count == 1 ? null : count - 1;
        });
        if (unmatched.get()) {
            log.warn("Release without a matching admission for key: {}", key);
        }
    }

    public long getActive(String key) {
        return active.getOrDefault(key, 0L);
    }

    /**
     * Number of keys holding at least one slot.
     */
    public int getTrackedKeys() {
        return active.size();
    }
}
