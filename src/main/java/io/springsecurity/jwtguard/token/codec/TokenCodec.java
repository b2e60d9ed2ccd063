package io.springsecurity.jwtguard.token.codec;

import io.jsonwebtoken.JwtParserBuilder;
import io.springsecurity.jwtguard.token.claims.StandardClaims;

import java.util.function.Consumer;

/**
 * Turns claims into a signed, expiring token and back.
 *
 * @param <C> claims type
 */
public interface TokenCodec<C extends StandardClaims> {

    Class<C> getClaimsType();

    /**
     * Signs a copy of {@code claims} with the registered time and identity claims stamped by the codec.
     *
     * @throws io.springsecurity.jwtguard.exception.TokenGenerationException if signing or serialization fails
     */
    String generate(C claims);

    /**
     * @throws io.springsecurity.jwtguard.exception.TokenVerificationException if the token is not valid
     */
    default C verify(String token) {
        return verify(token, parser -> {
        });
    }

    /**
     * Verifies a token with additional parser requirements, for example
     * {@code parser -> parser.requireAudience("api")}.
     *
     * @throws io.springsecurity.jwtguard.exception.TokenVerificationException if the token is not valid
     */
    C verify(String token, Consumer<JwtParserBuilder> parserCustomizer);
}
