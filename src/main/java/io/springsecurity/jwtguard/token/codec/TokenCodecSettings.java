package io.springsecurity.jwtguard.token.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import lombok.Getter;
import lombok.Setter;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Mutable settings of a {@link JwtTokenCodec}. A codec only ever sees its own copy.
 */
@Getter
@Setter
public class TokenCodecSettings {

    private Key signingKey;

    /** Defaults to the signing key (symmetric algorithms). */
    private Key verificationKey;

    private SecureDigestAlgorithm<?, ?> algorithm = Jwts.SIG.HS256;

    private String issuer;

    private Duration expire;

    /** An empty or {@code null} id leaves the {@code jti} claim out. */
    private Supplier<String> idGenerator = () -> null;

    private Clock clock = Clock.systemUTC();

    /** Maps the private claims of the claims type. */
    private ObjectMapper objectMapper = defaultObjectMapper();

    TokenCodecSettings(Key signingKey, Duration expire) {
        this.signingKey = signingKey;
        this.verificationKey = signingKey;
        this.expire = expire;
    }

    private TokenCodecSettings(TokenCodecSettings source) {
        this.signingKey = source.signingKey;
        this.verificationKey = source.verificationKey;
        this.algorithm = source.algorithm;
        this.issuer = source.issuer;
        this.expire = source.expire;
        this.idGenerator = source.idGenerator;
        this.clock = source.clock;
        this.objectMapper = source.objectMapper;
    }

    TokenCodecSettings copy() {
        return new TokenCodecSettings(this);
    }

    static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }
}
