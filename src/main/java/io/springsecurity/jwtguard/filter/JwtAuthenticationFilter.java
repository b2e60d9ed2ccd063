package io.springsecurity.jwtguard.filter;

import io.springsecurity.jwtguard.context.ClaimsSetter;
import io.springsecurity.jwtguard.exception.TokenVerificationException;
import io.springsecurity.jwtguard.token.claims.StandardClaims;
import io.springsecurity.jwtguard.token.codec.TokenCodec;
import io.springsecurity.jwtguard.token.transport.BearerTokenExtractor;
import io.springsecurity.jwtguard.token.transport.TokenExtractor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Verifies the access token of every request that is not exempt and attaches the claims.
 *
 * <ul>
 *     <li>exempt request: passes through untouched</li>
 *     <li>no token, or a token the codec rejects: 401 without body, the chain stops</li>
 *     <li>valid token: claims handed to the {@link ClaimsSetter}, the chain continues</li>
 * </ul>
 *
 * <pre>{@code
 * JwtAuthenticationFilter<UserClaims> filter = JwtAuthenticationFilter.builder(accessCodec)
 *         .ignorePathPatterns("/login", "/signup", "/user/{id}/avatar")
 *         .build();
 * }</pre>
 */
@Slf4j
public class JwtAuthenticationFilter<C extends StandardClaims> extends OncePerRequestFilter
        implements RequestAuthenticator<C> {

    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final TokenCodec<C> tokenCodec;
    private final RequestMatcher ignoreMatcher;
    private final TokenExtractor tokenExtractor;
    private final ClaimsSetter<C> claimsSetter;

    private JwtAuthenticationFilter(Builder<C> builder) {
        this.tokenCodec = builder.tokenCodec;
        this.ignoreMatcher = builder.ignoreMatcher;
        this.tokenExtractor = builder.tokenExtractor;
        this.claimsSetter = builder.claimsSetter;
    }

    public static <C extends StandardClaims> Builder<C> builder(TokenCodec<C> tokenCodec) {
        return new Builder<>(tokenCodec);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        AuthenticationOutcome<C> outcome = authenticate(request, response);
        if (outcome.isRejected()) {
            return;
        }
        if (!outcome.isAuthenticated()) {
            chain.doFilter(request, response);
            return;
        }

        try {
            chain.doFilter(request, response);
        } finally {
            clear(request);
        }
    }

    @Override
    public AuthenticationOutcome<C> authenticate(HttpServletRequest request, HttpServletResponse response) {
        if (ignoreMatcher.matches(request)) {
            return AuthenticationOutcome.exempt();
        }

        String token = tokenExtractor.extract(request);
        if (!StringUtils.hasText(token)) {
            log.debug("No token found on {} {}", request.getMethod(), request.getRequestURI());
            return reject(response);
        }

        C claims;
        try {
            claims = tokenCodec.verify(token);
        } catch (TokenVerificationException e) {
            log.debug("Token rejected on {} {}: {} ({})", request.getMethod(), request.getRequestURI(),
                    e.getReason(), e.getMessage());
            return reject(response);
        } catch (RuntimeException e) {
            log.warn("Token verification failed on {} {}", request.getMethod(), request.getRequestURI(), e);
            return reject(response);
        }

        claimsSetter.set(request, claims);
        return AuthenticationOutcome.authenticated(claims);
    }

    @Override
    public void clear(HttpServletRequest request) {
        claimsSetter.clear(request);
    }

    private AuthenticationOutcome<C> reject(HttpServletResponse response) {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        return AuthenticationOutcome.rejected();
    }

    static String pathWithinApplication(HttpServletRequest request) {
        return PATH_HELPER.getPathWithinApplication(request);
    }

    public static class Builder<C extends StandardClaims> {

        private final TokenCodec<C> tokenCodec;
        private RequestMatcher ignoreMatcher = request -> false;
        private TokenExtractor tokenExtractor = new BearerTokenExtractor();
        private ClaimsSetter<C> claimsSetter = ClaimsSetter.requestAttribute();

        private Builder(TokenCodec<C> tokenCodec) {
            this.tokenCodec = Objects.requireNonNull(tokenCodec, "TokenCodec cannot be null");
        }

        /**
         * Requests matching {@code matcher} skip authentication. Replaces any earlier exemption.
         */
        public Builder<C> ignoreRequest(RequestMatcher matcher) {
            this.ignoreMatcher = Objects.requireNonNull(matcher, "matcher cannot be null");
            return this;
        }

        /**
         * Exempts requests whose path within the application equals one of {@code paths}.
         */
        public Builder<C> ignorePaths(String... paths) {
            Set<String> ignored = Set.copyOf(Arrays.asList(paths));
            return ignoreRequest(request -> ignored.contains(pathWithinApplication(request)));
        }

        /**
         * Exempts requests matching one of the route templates, e.g. {@code /user/{id}} or {@code /public/**}.
         */
        public Builder<C> ignorePathPatterns(String... patterns) {
            List<RequestMatcher> matchers = Arrays.stream(patterns)
                    .map(pattern -> (RequestMatcher) new AntPathRequestMatcher(pattern, null, true, PATH_HELPER))
                    .toList();
            return ignoreRequest(matchers.isEmpty() ? request -> false : new OrRequestMatcher(matchers));
        }

        public Builder<C> tokenExtractor(TokenExtractor tokenExtractor) {
            this.tokenExtractor = Objects.requireNonNull(tokenExtractor, "tokenExtractor cannot be null");
            return this;
        }

        public Builder<C> claimsSetter(ClaimsSetter<C> claimsSetter) {
            this.claimsSetter = Objects.requireNonNull(claimsSetter, "claimsSetter cannot be null");
            return this;
        }

        public JwtAuthenticationFilter<C> build() {
            return new JwtAuthenticationFilter<>(this);
        }
    }
}
