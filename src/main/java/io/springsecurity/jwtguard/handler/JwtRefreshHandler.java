package io.springsecurity.jwtguard.handler;

import io.springsecurity.jwtguard.context.ClaimsGetter;
import io.springsecurity.jwtguard.filter.AuthenticationOutcome;
import io.springsecurity.jwtguard.filter.JwtAuthenticationFilter;
import io.springsecurity.jwtguard.filter.RequestAuthenticator;
import io.springsecurity.jwtguard.token.claims.StandardClaims;
import io.springsecurity.jwtguard.token.codec.TokenCodec;
import io.springsecurity.jwtguard.token.transport.ResponseFinalizer;
import io.springsecurity.jwtguard.token.transport.TokenSetter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.HttpRequestHandler;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues a new access token in exchange for a valid refresh token, and a new refresh token as well
 * when rotation is enabled.
 *
 * <pre>{@code
 * JwtRefreshHandler<UserClaims> refresh = JwtRefreshHandler.create(accessCodec, refreshCodec,
 *         JwtRefreshHandler.withRotateRefreshToken(true));
 * }</pre>
 *
 * The refresh token is authenticated with a {@link JwtAuthenticationFilter} bound to the refresh codec
 * unless another {@link RequestAuthenticator} is configured. A rejected refresh token ends the request
 * with the 401 written by the authenticator. Failing to issue a token ends it with 500; an access token
 * already handed to the {@link TokenSetter} at that point is not taken back.
 */
@Slf4j
public class JwtRefreshHandler<C extends StandardClaims> implements HttpRequestHandler {

    private final TokenCodec<C> accessCodec;
    private final TokenCodec<C> refreshCodec;
    private final Settings<C> settings;

    private JwtRefreshHandler(TokenCodec<C> accessCodec, TokenCodec<C> refreshCodec, Settings<C> settings) {
        this.accessCodec = accessCodec;
        this.refreshCodec = refreshCodec;
        this.settings = settings;
    }

    @SafeVarargs
    public static <C extends StandardClaims> JwtRefreshHandler<C> create(TokenCodec<C> accessCodec,
                                                                         TokenCodec<C> refreshCodec,
                                                                         Option<C>... options) {
        Objects.requireNonNull(accessCodec, "accessCodec cannot be null");
        Objects.requireNonNull(refreshCodec, "refreshCodec cannot be null");
        return new JwtRefreshHandler<>(accessCodec, refreshCodec, Settings.defaults(refreshCodec))
                .withOptions(options);
    }

    /**
     * @return a copy of this handler with {@code options} applied on top of its current settings
     */
    @SafeVarargs
    public final JwtRefreshHandler<C> withOptions(Option<C>... options) {
        Settings<C> copy = settings.copy();
        for (Option<C> option : options) {
            option.apply(copy);
        }
        return new JwtRefreshHandler<>(accessCodec, refreshCodec, copy);
    }

    @Override
    public void handleRequest(HttpServletRequest request, HttpServletResponse response) throws IOException {
        AuthenticationOutcome<C> outcome = settings.refreshAuthenticator.authenticate(request, response);
        if (outcome.isRejected()) {
            return;
        }

        try {
            reissue(request, response);
        } finally {
            if (outcome.isAuthenticated()) {
                settings.refreshAuthenticator.clear(request);
            }
        }
    }

    private void reissue(HttpServletRequest request, HttpServletResponse response) throws IOException {
        Optional<C> claims = settings.claimsGetter.get(request);
        if (claims.isEmpty()) {
            log.error("No refresh token claims attached to {} {}, check that the claims getter matches the authenticator",
                    request.getMethod(), request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            return;
        }

        String accessToken = issue(accessCodec, claims.get(), "access");
        if (accessToken == null) {
            response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            return;
        }
        settings.accessTokenSetter.set(request, response, accessToken);

        if (settings.rotateRefreshToken) {
            String refreshToken = issue(refreshCodec, claims.get(), "refresh");
            if (refreshToken == null) {
                response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
                return;
            }
            settings.refreshTokenSetter.set(request, response, refreshToken);
        }

        settings.responseFinalizer.finish(request, response);
    }

    private String issue(TokenCodec<C> codec, C claims, String kind) {
        try {
            return codec.generate(claims);
        } catch (RuntimeException e) {
            log.error("Failed to issue {} token", kind, e);
            return null;
        }
    }

    public boolean isRotateRefreshToken() {
        return settings.rotateRefreshToken;
    }

    public static <C extends StandardClaims> Option<C> withRotateRefreshToken(boolean rotate) {
        return settings -> settings.rotateRefreshToken = rotate;
    }

    public static <C extends StandardClaims> Option<C> withRefreshAuthenticator(RequestAuthenticator<C> authenticator) {
        Objects.requireNonNull(authenticator, "authenticator cannot be null");
        return settings -> settings.refreshAuthenticator = authenticator;
    }

    public static <C extends StandardClaims> Option<C> withClaimsGetter(ClaimsGetter<C> claimsGetter) {
        Objects.requireNonNull(claimsGetter, "claimsGetter cannot be null");
        return settings -> settings.claimsGetter = claimsGetter;
    }

    public static <C extends StandardClaims> Option<C> withAccessTokenSetter(TokenSetter tokenSetter) {
        Objects.requireNonNull(tokenSetter, "tokenSetter cannot be null");
        return settings -> settings.accessTokenSetter = tokenSetter;
    }

    public static <C extends StandardClaims> Option<C> withRefreshTokenSetter(TokenSetter tokenSetter) {
        Objects.requireNonNull(tokenSetter, "tokenSetter cannot be null");
        return settings -> settings.refreshTokenSetter = tokenSetter;
    }

    public static <C extends StandardClaims> Option<C> withResponseFinalizer(ResponseFinalizer finalizer) {
        Objects.requireNonNull(finalizer, "finalizer cannot be null");
        return settings -> settings.responseFinalizer = finalizer;
    }

    @FunctionalInterface
    public interface Option<C extends StandardClaims> {
        void apply(Settings<C> settings);
    }

    public static final class Settings<C extends StandardClaims> {

        private boolean rotateRefreshToken;
        private RequestAuthenticator<C> refreshAuthenticator;
        private ClaimsGetter<C> claimsGetter;
        private TokenSetter accessTokenSetter;
        private TokenSetter refreshTokenSetter;
        private ResponseFinalizer responseFinalizer;

        private Settings() {
        }

        private static <C extends StandardClaims> Settings<C> defaults(TokenCodec<C> refreshCodec) {
            Settings<C> settings = new Settings<>();
            settings.refreshAuthenticator = JwtAuthenticationFilter.builder(refreshCodec).build();
            settings.claimsGetter = ClaimsGetter.requestAttribute(refreshCodec.getClaimsType());
            settings.accessTokenSetter = TokenSetter.header(TokenSetter.ACCESS_TOKEN_HEADER);
            settings.refreshTokenSetter = TokenSetter.header(TokenSetter.REFRESH_TOKEN_HEADER);
            settings.responseFinalizer = ResponseFinalizer.noContent();
            return settings;
        }

        private Settings<C> copy() {
            Settings<C> copy = new Settings<>();
            copy.rotateRefreshToken = rotateRefreshToken;
            copy.refreshAuthenticator = refreshAuthenticator;
            copy.claimsGetter = claimsGetter;
            copy.accessTokenSetter = accessTokenSetter;
            copy.refreshTokenSetter = refreshTokenSetter;
            copy.responseFinalizer = responseFinalizer;
            return copy;
        }
    }
}
