package io.springsecurity.jwtguard.ratelimit;

import io.springsecurity.jwtguard.exception.LimiterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;

/**
 * Active request counter shared through Redis. The increment is reverted inside the same script when
 * it would exceed the ceiling, so rejected requests never hold a slot.
 *
 * <p>Every admission and release pushes the counter's expiry {@code slotTtl} ahead, so slots held by an
 * instance that died mid-request are given back once the key goes idle.
 */
@Slf4j
public class RedisActiveLimiter implements ActiveLimiter {

    public static final Duration DEFAULT_SLOT_TTL = Duration.ofMinutes(5);

    private static final String ACQUIRE_SCRIPT =
            "local count = redis.call('INCR', KEYS[1]) " +
                    "if count > tonumber(ARGV[1]) then " +
                    "  if redis.call('DECR', KEYS[1]) <= 0 then " +
                    "    redis.call('DEL', KEYS[1]) " +
                    "  end " +
                    "  return 1 " +
                    "end " +
                    "redis.call('PEXPIRE', KEYS[1], ARGV[2]) " +
                    "return 0";

    private static final String RELEASE_SCRIPT =
            "local count = tonumber(redis.call('GET', KEYS[1]) or '0') " +
                    "if count <= 0 then " +
                    "  return -1 " +
                    "end " +
                    "if count == 1 then " +
                    "  redis.call('DEL', KEYS[1]) " +
                    "  return 0 " +
                    "end " +
                    "local remaining = redis.call('DECR', KEYS[1]) " +
                    "redis.call('PEXPIRE', KEYS[1], ARGV[1]) " +
                    "return remaining";

    private static final RedisScript<Long> ACQUIRE = new DefaultRedisScript<>(ACQUIRE_SCRIPT, Long.class);
    private static final RedisScript<Long> RELEASE = new DefaultRedisScript<>(RELEASE_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final long maxActive;
    private final String slotTtlMillis;

    public RedisActiveLimiter(StringRedisTemplate redisTemplate, long maxActive) {
        this(redisTemplate, maxActive, DEFAULT_SLOT_TTL);
    }

    public RedisActiveLimiter(StringRedisTemplate redisTemplate, long maxActive, Duration slotTtl) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "StringRedisTemplate cannot be null");
        Objects.requireNonNull(slotTtl, "slotTtl cannot be null");
        if (slotTtl.toMillis() <= 0) {
            throw new IllegalArgumentException("slotTtl must be at least one millisecond");
        }
        this.maxActive = maxActive;
        this.slotTtlMillis = Long.toString(slotTtl.toMillis());
    }

    @Override
    public boolean limit(String key) {
        return run(ACQUIRE, key, "Active limiter script", Long.toString(maxActive), slotTtlMillis) == 1L;
    }

    @Override
    public void release(String key) {
        if (run(RELEASE, key, "Active slot release", slotTtlMillis) < 0) {
            log.warn("Release without a matching admission for key: {}", key);
        }
    }

    private long run(RedisScript<Long> script, String key, String operation, Object... args) {
        Long result;
        try {
            result = redisTemplate.execute(script, Collections.singletonList(key), args);
        } catch (RuntimeException e) {
            throw new LimiterException(operation + " failed for key " + key, e);
        }
        if (result == null) {
            throw new LimiterException(operation + " returned no result for key " + key);
        }
        return result;
    }
}
