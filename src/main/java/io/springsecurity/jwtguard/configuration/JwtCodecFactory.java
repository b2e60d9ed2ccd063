package io.springsecurity.jwtguard.configuration;

import io.springsecurity.jwtguard.filter.JwtAuthenticationFilter;
import io.springsecurity.jwtguard.filter.JwtRefreshFilter;
import io.springsecurity.jwtguard.handler.JwtRefreshHandler;
import io.springsecurity.jwtguard.properties.JwtGuardProperties;
import io.springsecurity.jwtguard.properties.TokenSettings;
import io.springsecurity.jwtguard.token.claims.StandardClaims;
import io.springsecurity.jwtguard.token.codec.JwtTokenCodec;
import io.springsecurity.jwtguard.token.codec.TokenCodecOption;
import io.springsecurity.jwtguard.token.codec.TokenCodecOptions;
import io.springsecurity.jwtguard.token.transport.TokenSetter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds codecs, filters and the refresh handler for an application claims type from
 * {@link JwtGuardProperties}.
 *
 * <pre>{@code
 * @Bean
 * JwtAuthenticationFilter<UserClaims> jwtFilter(JwtCodecFactory factory) {
 *     return factory.authenticationFilter(UserClaims.class);
 * }
 * }</pre>
 */
@Slf4j
@RequiredArgsConstructor
public class JwtCodecFactory {

    private final JwtGuardProperties properties;

    public <C extends StandardClaims> JwtTokenCodec<C> accessCodec(Class<C> claimsType, TokenCodecOption... options) {
        return codec("access", properties.getAccess(), claimsType, options);
    }

    public <C extends StandardClaims> JwtTokenCodec<C> refreshCodec(Class<C> claimsType, TokenCodecOption... options) {
        return codec("refresh", properties.getRefresh(), claimsType, options);
    }

    public <C extends StandardClaims> JwtAuthenticationFilter<C> authenticationFilter(Class<C> claimsType) {
        JwtAuthenticationFilter.Builder<C> builder = JwtAuthenticationFilter.builder(accessCodec(claimsType));
        if (!properties.getIgnorePaths().isEmpty()) {
            builder.ignorePathPatterns(properties.getIgnorePaths().toArray(String[]::new));
        }
        return builder.build();
    }

    public <C extends StandardClaims> JwtRefreshHandler<C> refreshHandler(Class<C> claimsType) {
        return JwtRefreshHandler.create(accessCodec(claimsType), refreshCodec(claimsType),
                JwtRefreshHandler.withRotateRefreshToken(properties.isRotateRefreshToken()),
                JwtRefreshHandler.withAccessTokenSetter(TokenSetter.header(properties.getAccessTokenHeader())),
                JwtRefreshHandler.withRefreshTokenSetter(TokenSetter.header(properties.getRefreshTokenHeader())));
    }

    public <C extends StandardClaims> JwtRefreshFilter refreshFilter(Class<C> claimsType) {
        return new JwtRefreshFilter(properties.getRefreshUri(), refreshHandler(claimsType));
    }

    private <C extends StandardClaims> JwtTokenCodec<C> codec(String name, TokenSettings settings, Class<C> claimsType,
                                                            TokenCodecOption... options) {
        if (!StringUtils.hasText(settings.getSecret())) {
            throw new IllegalStateException("jwt-guard." + name + ".secret must be configured");
        }
        if (settings.getExpire() == null) {
            throw new IllegalStateException("jwt-guard." + name + ".expire must be configured");
        }
        List<TokenCodecOption> all = new ArrayList<>();
        if (StringUtils.hasText(settings.getIssuer())) {
            all.add(TokenCodecOptions.withIssuer(settings.getIssuer()));
        }
        all.addAll(List.of(options));
        log.debug("Creating {} token codec for {} (expire {})", name, claimsType.getSimpleName(), settings.getExpire());
        return JwtTokenCodec.hmac(settings.getSecret(), settings.getExpire(), claimsType,
                all.toArray(TokenCodecOption[]::new));
    }
}
