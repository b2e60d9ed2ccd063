package io.springsecurity.jwtguard.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the limiter key of a request.
 */
@FunctionalInterface
public interface RequestKeyResolver {

    String IP_LIMITER_PREFIX = "ip-limiter:";
    String IP_RATE_LIMITER_PREFIX = "ip_rate_limiter:";
    String IP_ACTIVE_LIMITER_PREFIX = "ip_active_limiter:";
    String ALL_REQUESTS_RATE_KEY = "all_req_rate_limiter";
    String ALL_REQUESTS_ACTIVE_KEY = "all_req_active_limiter";

    String resolve(HttpServletRequest request);

    /**
     * One key per client address. Behind a proxy, pair with Spring's {@code ForwardedHeaderFilter}
     * so that the remote address is the client's.
     */
    static RequestKeyResolver clientIp(String prefix) {
        return request -> prefix + request.getRemoteAddr();
    }

    /**
     * The same key for every request, limiting the service as a whole.
     */
    static RequestKeyResolver fixed(String key) {
        return request -> key;
    }
}
