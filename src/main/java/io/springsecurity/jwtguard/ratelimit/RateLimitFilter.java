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
 * Rejects requests the {@link Limiter} refuses with 429. A limiter failure is answered with 500
 * rather than letting the request through.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final Limiter limiter;
    private final RequestKeyResolver keyResolver;

    public RateLimitFilter(Limiter limiter) {
        this(limiter, RequestKeyResolver.clientIp(RequestKeyResolver.IP_LIMITER_PREFIX));
    }

    public RateLimitFilter(Limiter limiter, RequestKeyResolver keyResolver) {
        this.limiter = Objects.requireNonNull(limiter, "Limiter cannot be null");
        this.keyResolver = Objects.requireNonNull(keyResolver, "RequestKeyResolver cannot be null");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String key = keyResolver.resolve(request);
        boolean limited;
        try {
            limited = limiter.limit(key);
        } catch (LimiterException e) {
            log.error("Rate limiter failed for key: {}", key, e);
            response.setStatus(HttpStatus.INTERNAL_SERVER_ERROR.value());
            return;
        }
        if (limited) {
            log.debug("Request rate limited for key: {}", key);
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            return;
        }
        chain.doFilter(request, response);
    }
}
