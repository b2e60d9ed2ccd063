package io.springsecurity.jwtguard.properties;

import io.springsecurity.jwtguard.enums.LimiterStoreType;
import io.springsecurity.jwtguard.enums.RateLimitType;
import lombok.Data;
import org.springframework.boot.autoconfigure.security.SecurityProperties;

import java.time.Duration;

@Data
public class RateLimitSettings {

    private RateLimitType type = RateLimitType.NONE;

    /**
     * Counter store of the sliding window and active limiters.
     */
    private LimiterStoreType store = LimiterStoreType.MEMORY;

    // sliding window
    private Duration window = Duration.ofSeconds(1);
    private int threshold = 100;

    // active
    private long maxActive = 100;

    /**
     * Expiry of the shared active counter, pushed back on every admission and release.
     */
    private Duration slotTtl = Duration.ofMinutes(5);

    // bucket
    private int capacity = 100;
    private Duration interval = Duration.ofMillis(10);

    /**
     * Wait up to this long for a bucket token; unset means reject at once.
     */
    private Duration blockTimeout;

    /**
     * Limit each client address separately instead of the service as a whole.
     */
    private boolean keyByIp = false;

    /**
     * Registration order of the limiter filter, ahead of the Spring Security chain by default.
     */
    private int filterOrder = SecurityProperties.DEFAULT_FILTER_ORDER - 10;
}
