package io.springsecurity.jwtguard.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.HttpRequestHandler;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.Objects;

/**
 * Serves the refresh endpoint in front of the dispatcher. Matching requests are answered by the
 * refresh handler and never reach the rest of the chain.
 */
@Slf4j
public class JwtRefreshFilter extends OncePerRequestFilter {

    private final RequestMatcher refreshMatcher;
    private final HttpRequestHandler refreshHandler;

    public JwtRefreshFilter(String refreshUri, HttpRequestHandler refreshHandler) {
        this(new AntPathRequestMatcher(refreshUri, HttpMethod.POST.name(), true, new UrlPathHelper()), refreshHandler);
    }

    public JwtRefreshFilter(RequestMatcher refreshMatcher, HttpRequestHandler refreshHandler) {
        this.refreshMatcher = Objects.requireNonNull(refreshMatcher, "refreshMatcher cannot be null");
        this.refreshHandler = Objects.requireNonNull(refreshHandler, "refreshHandler cannot be null");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (!refreshMatcher.matches(request)) {
            chain.doFilter(request, response);
            return;
        }
        log.debug("Processing token refresh for {}", request.getRequestURI());
        refreshHandler.handleRequest(request, response);
    }
}
