package io.springsecurity.jwtguard.ratelimit;

import io.springsecurity.jwtguard.exception.LimiterException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;

/**
 * Caps the number of requests in progress. Limits the whole service by default,
 * {@link #keyByClientIp()} caps each client separately.
 *
 * <p>An admitted request releases its slot when the rest of the chain returns, whether it completed
 * normally or threw.
 */
@Slf4j
public class ActiveLimitFilter extends OncePerRequestFilter {

    private final ActiveLimiter limiter;
    private RequestKeyResolver keyResolver = RequestKeyResolver.fixed(RequestKeyResolver.ALL_REQUESTS_ACTIVE_KEY);

    public ActiveLimitFilter(ActiveLimiter limiter) {
        this.limiter = Objects.requireNonNull(limiter, "ActiveLimiter cannot be null");
    }

    public ActiveLimitFilter keyResolver(RequestKeyResolver keyResolver) {
        this.keyResolver = Objects.requireNonNull(keyResolver, "RequestKeyResolver cannot be null");
        return this;
    }

    public ActiveLimitFilter keyByClientIp() {
        return keyResolver(RequestKeyResolver.clientIp(RequestKeyResolver.IP_ACTIVE_LIMITER_PREFIX));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String key = keyResolver.resolve(request);
        boolean limited;
        try {
            limited = limiter.limit(key);
        } catch (LimiterException e) {
            log.error("Active limiter failed for key: {}", key, e);
            response.setStatus(HttpStatus.INTERNAL_SERVER_ERROR.value());
            return;
        }
        if (limited) {
            log.debug("Too many active requests for key: {}", key);
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            return;
        }

        try {
            chain.doFilter(request, response);
        } finally {
            release(key);
        }
    }

    private void release(String key) {
        try {
            limiter.release(key);
        } catch (LimiterException e) {
            log.error("Failed to release active slot for key: {}", key, e);
        }
    }
}
