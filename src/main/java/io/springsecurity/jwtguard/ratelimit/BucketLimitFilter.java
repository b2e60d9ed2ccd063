package io.springsecurity.jwtguard.ratelimit;

import io.springsecurity.jwtguard.exception.LimiterException;
import io.springsecurity.jwtguard.exception.LimiterTimeoutException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Admits requests while the {@link BucketLimiter} has tokens.
 *
 * <ul>
 *     <li>bucket empty: 429</li>
 *     <li>blocking mode, no token within the timeout or the thread was interrupted: 504</li>
 *     <li>any other limiter failure: 500</li>
 * </ul>
 */
@Slf4j
public class BucketLimitFilter extends OncePerRequestFilter {

    private final BucketLimiter limiter;
    private final Duration blockTimeout;

    private BucketLimitFilter(BucketLimiter limiter, Duration blockTimeout) {
        this.limiter = Objects.requireNonNull(limiter, "BucketLimiter cannot be null");
        this.blockTimeout = blockTimeout;
    }

    public static BucketLimitFilter nonBlocking(BucketLimiter limiter) {
        return new BucketLimitFilter(limiter, null);
    }

    public static BucketLimitFilter blocking(BucketLimiter limiter, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return new BucketLimitFilter(limiter, timeout);
    }

    public boolean isBlocking() {
        return blockTimeout != null;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        try {
            if (isBlocking()) {
                limiter.blockLimit(blockTimeout);
            } else if (limiter.limit()) {
                log.debug("Bucket empty, rejecting {}", request.getRequestURI());
                response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
                return;
            }
        } catch (LimiterTimeoutException e) {
            log.debug("Gave up waiting for a token on {}: {}", request.getRequestURI(), e.getMessage());
            response.setStatus(HttpStatus.GATEWAY_TIMEOUT.value());
            return;
        } catch (LimiterException e) {
            log.error("Bucket limiter failed", e);
            response.setStatus(HttpStatus.INTERNAL_SERVER_ERROR.value());
            return;
        }
        chain.doFilter(request, response);
    }
}
