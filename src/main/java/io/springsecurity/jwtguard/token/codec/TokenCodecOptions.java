package io.springsecurity.jwtguard.token.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.security.SecureDigestAlgorithm;

import java.security.Key;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Factory methods for {@link TokenCodecOption}s.
 */
public final class TokenCodecOptions {

    private TokenCodecOptions() {
    }

    /**
     * Key used to verify signatures, for asymmetric algorithms or key rotation.
     */
    public static TokenCodecOption withVerificationKey(Key key) {
        Objects.requireNonNull(key, "verification key cannot be null");
        return settings -> settings.setVerificationKey(key);
    }

    public static TokenCodecOption withAlgorithm(SecureDigestAlgorithm<?, ?> algorithm) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        return settings -> settings.setAlgorithm(algorithm);
    }

    public static TokenCodecOption withIssuer(String issuer) {
        return settings -> settings.setIssuer(issuer);
    }

    /**
     * Generator of the {@code jti} claim.
     */
    public static TokenCodecOption withIdGenerator(Supplier<String> idGenerator) {
        Objects.requireNonNull(idGenerator, "id generator cannot be null");
        return settings -> settings.setIdGenerator(idGenerator);
    }

    /**
     * Clock used for both stamping and validating tokens. A fixed clock makes tokens deterministic.
     */
    public static TokenCodecOption withClock(Clock clock) {
        Objects.requireNonNull(clock, "clock cannot be null");
        return settings -> settings.setClock(clock);
    }

    public static TokenCodecOption withObjectMapper(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        return settings -> settings.setObjectMapper(objectMapper);
    }
}
