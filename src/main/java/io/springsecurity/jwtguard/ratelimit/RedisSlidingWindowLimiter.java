package io.springsecurity.jwtguard.ratelimit;

import io.springsecurity.jwtguard.exception.LimiterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.UUID;

/**
 * Sliding window kept in a Redis sorted set per key, scored by admission time in milliseconds.
 * Eviction, counting and admission run in one script so concurrent instances see a consistent count.
 */
@Slf4j
public class RedisSlidingWindowLimiter implements Limiter {

    // KEYS[1] window key, ARGV: window millis, threshold, now millis, unique member
    private static final String SLIDING_WINDOW_SCRIPT =
            "local key = KEYS[1] " +
                    "local window = tonumber(ARGV[1]) " +
                    "local threshold = tonumber(ARGV[2]) " +
                    "local now = tonumber(ARGV[3]) " +
                    "redis.call('ZREMRANGEBYSCORE', key, '-inf', now - window) " +
                    "local count = redis.call('ZCOUNT', key, '-inf', '+inf') " +
                    "if count >= threshold then " +
                    "  return 1 " +
                    "end " +
                    "redis.call('ZADD', key, now, ARGV[4]) " +
                    "redis.call('PEXPIRE', key, window) " +
                    "return 0";

    private static final RedisScript<Long> SCRIPT = new DefaultRedisScript<>(SLIDING_WINDOW_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final long windowMillis;
    private final int threshold;
    private final Clock clock;

    public RedisSlidingWindowLimiter(StringRedisTemplate redisTemplate, Duration window, int threshold) {
        this(redisTemplate, window, threshold, Clock.systemUTC());
    }

    public RedisSlidingWindowLimiter(StringRedisTemplate redisTemplate, Duration window, int threshold, Clock clock) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "StringRedisTemplate cannot be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.windowMillis = window.toMillis();
        this.threshold = threshold;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public boolean limit(String key) {
        Long result;
        try {
            result = redisTemplate.execute(SCRIPT, Collections.singletonList(key),
                    Long.toString(windowMillis),
                    Integer.toString(threshold),
                    Long.toString(clock.millis()),
                    UUID.randomUUID().toString());
        } catch (RuntimeException e) {
            throw new LimiterException("Sliding window script failed for key " + key, e);
        }
        if (result == null) {
            throw new LimiterException("Sliding window script returned no result for key " + key);
        }
        boolean limited = result == 1L;
        if (limited) {
            log.debug("Sliding window limit reached for key: {}", key);
        }
        return limited;
    }
}
