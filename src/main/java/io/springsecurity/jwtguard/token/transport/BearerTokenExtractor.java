package io.springsecurity.jwtguard.token.transport;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Reads {@code <header>: Bearer <token>}. A missing header, another scheme or an empty
 * remainder all mean "no token".
 */
public class BearerTokenExtractor implements TokenExtractor {

    public static final String BEARER_PREFIX = "Bearer ";

    private final String headerName;

    public BearerTokenExtractor() {
        this(HttpHeaders.AUTHORIZATION);
    }

    public BearerTokenExtractor(String headerName) {
        this.headerName = headerName;
    }

    @Override
    public String extract(HttpServletRequest request) {
        String header = request.getHeader(headerName);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length());
        return StringUtils.hasLength(token) ? token : null;
    }
}
