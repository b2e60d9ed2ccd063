package io.springsecurity.jwtguard.token.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import io.jsonwebtoken.security.SecurityException;
import io.springsecurity.jwtguard.exception.TokenGenerationException;
import io.springsecurity.jwtguard.exception.TokenVerificationException;
import io.springsecurity.jwtguard.exception.TokenVerificationException.Reason;
import io.springsecurity.jwtguard.token.claims.StandardClaims;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * {@link TokenCodec} backed by JJWT.
 *
 * <p>Generated tokens carry the header {@code {"alg":..., "typ":"JWT"}}. Payloads hold the private
 * claims of the claims type, in Jackson property order, followed by the registered claims in RFC 7519
 * order. The codec sets {@code iss}, {@code exp},
 * {@code iat} and {@code jti}; {@code sub}, {@code aud} and {@code nbf} are copied from the claims.
 *
 * <p>Instances are immutable. {@link #withOptions(TokenCodecOption...)} returns a reconfigured copy.
 *
 * <pre>{@code
 * JwtTokenCodec<UserClaims> accessCodec = JwtTokenCodec.hmac(accessSecret, Duration.ofMinutes(10), UserClaims.class);
 * String token = accessCodec.generate(claims);
 * UserClaims verified = accessCodec.verify(token);
 * }</pre>
 */
@Slf4j
public class JwtTokenCodec<C extends StandardClaims> implements TokenCodec<C> {

    private static final Set<String> REGISTERED_CLAIMS = Set.of(
            Claims.ISSUER, Claims.SUBJECT, Claims.AUDIENCE, Claims.EXPIRATION,
            Claims.NOT_BEFORE, Claims.ISSUED_AT, Claims.ID);

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private static final String ALGORITHM_HEADER = "alg";
    private static final int MIN_HMAC_SECRET_BYTES = 32;
    private static final String JWT_TYPE = "JWT";

    private final Class<C> claimsType;
    private final TokenCodecSettings settings;
    private final HmacSignatureAlgorithm hmacAlgorithm;

    private JwtTokenCodec(Class<C> claimsType, TokenCodecSettings settings) {
        this.claimsType = claimsType;
        this.settings = settings;
        this.hmacAlgorithm = HmacSignatureAlgorithm.replacing(settings.getAlgorithm()).orElse(null);
    }

    /**
     * Codec signing with {@code HS256} (unless overridden) and the UTF-8 bytes of {@code secret}.
     * Secrets of any length are accepted. A secret under 32 bytes is logged as weak.
     */
    public static <C extends StandardClaims> JwtTokenCodec<C> hmac(String secret, Duration expire,
                                                                   Class<C> claimsType, TokenCodecOption... options) {
        Objects.requireNonNull(secret, "secret cannot be null");
        if (secret.isEmpty()) {
            throw new IllegalArgumentException("secret cannot be empty");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_HMAC_SECRET_BYTES) {
            log.warn("HMAC secret is shorter than {} bytes, consider a longer secret", MIN_HMAC_SECRET_BYTES);
        }
        Key key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        return of(key, expire, claimsType, options);
    }

    public static <C extends StandardClaims> JwtTokenCodec<C> of(Key signingKey, Duration expire,
                                                                 Class<C> claimsType, TokenCodecOption... options) {
        Objects.requireNonNull(signingKey, "signingKey cannot be null");
        Objects.requireNonNull(expire, "expire cannot be null");
        Objects.requireNonNull(claimsType, "claimsType cannot be null");
        return new JwtTokenCodec<>(claimsType, new TokenCodecSettings(signingKey, expire))
                .withOptions(options);
    }

    public JwtTokenCodec<C> withOptions(TokenCodecOption... options) {
        TokenCodecSettings copy = settings.copy();
        for (TokenCodecOption option : options) {
            option.apply(copy);
        }
        return new JwtTokenCodec<>(claimsType, copy);
    }

    @Override
    public String generate(C claims) {
        Objects.requireNonNull(claims, "claims cannot be null");
        Instant now = settings.getClock().instant();

        JwtBuilder builder = Jwts.builder()
                .header()
                .add(ALGORITHM_HEADER, settings.getAlgorithm().getId())
                .type(JWT_TYPE)
                .and();
        privateClaims(claims).forEach(builder::claim);

        if (StringUtils.hasText(settings.getIssuer())) {
            builder.issuer(settings.getIssuer());
        }
        if (StringUtils.hasText(claims.getSubject())) {
            builder.subject(claims.getSubject());
        }
        if (!CollectionUtils.isEmpty(claims.getAudience())) {
            builder.audience().add(claims.getAudience()).and();
        }
        builder.expiration(Date.from(now.plus(settings.getExpire())));
        if (claims.getNotBefore() != null) {
            builder.notBefore(Date.from(claims.getNotBefore()));
        }
        builder.issuedAt(Date.from(now));
        String id = settings.getIdGenerator().get();
        if (StringUtils.hasText(id)) {
            builder.id(id);
        }

        try {
            return builder.signWith(settings.getSigningKey(), signatureAlgorithm()).compact();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenGenerationException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    @Override
    public C verify(String token, Consumer<JwtParserBuilder> parserCustomizer) {
        Instant now = settings.getClock().instant();
        Jws<Claims> jws = parse(token, now, parserCustomizer);

        String algorithm = jws.getHeader().getAlgorithm();
        if (!settings.getAlgorithm().getId().equals(algorithm)) {
            throw new TokenVerificationException(Reason.SIGNATURE_INVALID,
                    "Unexpected signing algorithm: " + algorithm);
        }

        Claims payload = jws.getPayload();
        // JJWT accepts now == exp, a token is no longer valid at its expiration instant
        Date expiration = payload.getExpiration();
        if (expiration != null && !now.isBefore(expiration.toInstant())) {
            throw new TokenVerificationException(Reason.EXPIRED, "Token expired at " + expiration.toInstant());
        }
        return toClaims(payload);
    }

    private Jws<Claims> parse(String token, Instant now, Consumer<JwtParserBuilder> parserCustomizer) {
        try {
            JwtParserBuilder parser = Jwts.parser()
                    .keyLocator(header -> settings.getVerificationKey())
                    .clock(() -> Date.from(now));
            if (hmacAlgorithm != null) {
                parser.sig().add(HmacSignatureAlgorithm.ALL).and();
            }
            parserCustomizer.accept(parser);
            return parser.build().parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(Reason.EXPIRED, e.getMessage(), e);
        } catch (PrematureJwtException e) {
            throw new TokenVerificationException(Reason.NOT_YET_VALID, e.getMessage(), e);
        } catch (InvalidClaimException e) {
            throw new TokenVerificationException(Reason.CLAIMS_INVALID, e.getMessage(), e);
        } catch (SecurityException e) {
            throw new TokenVerificationException(Reason.SIGNATURE_INVALID, e.getMessage(), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenVerificationException(Reason.MALFORMED, e.getMessage(), e);
        }
    }

    private Map<String, Object> privateClaims(C claims) {
        Map<String, Object> payload;
        try {
            payload = settings.getObjectMapper().convertValue(claims, PAYLOAD_TYPE);
        } catch (IllegalArgumentException e) {
            throw new TokenGenerationException("Failed to serialize claims of type " + claimsType.getName(), e);
        }
        if (payload == null) {
            return new LinkedHashMap<>();
        }
        REGISTERED_CLAIMS.forEach(payload::remove);
        return payload;
    }

    private C toClaims(Claims payload) {
        Map<String, Object> privateClaims = new LinkedHashMap<>();
        payload.forEach((name, value) -> {
            if (!REGISTERED_CLAIMS.contains(name)) {
                privateClaims.put(name, value);
            }
        });

        C claims;
        try {
            claims = settings.getObjectMapper().convertValue(privateClaims, claimsType);
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(Reason.CLAIMS_TYPE_MISMATCH,
                    "Token payload does not match " + claimsType.getName(), e);
        }

        claims.setIssuer(payload.getIssuer());
        claims.setSubject(payload.getSubject());
        Set<String> audience = payload.getAudience();
        claims.setAudience(CollectionUtils.isEmpty(audience) ? null : new ArrayList<>(audience));
        claims.setExpiresAt(toInstant(payload.getExpiration()));
        claims.setNotBefore(toInstant(payload.getNotBefore()));
        claims.setIssuedAt(toInstant(payload.getIssuedAt()));
        claims.setId(payload.getId());
        return claims;
    }

    @SuppressWarnings("unchecked")
    private SecureDigestAlgorithm<Key, ?> signatureAlgorithm() {
        if (hmacAlgorithm != null) {
            return hmacAlgorithm;
        }
        return (SecureDigestAlgorithm<Key, ?>) settings.getAlgorithm();
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    @Override
    public Class<C> getClaimsType() {
        return claimsType;
    }

    public Key getSigningKey() {
        return settings.getSigningKey();
    }

    public Key getVerificationKey() {
        return settings.getVerificationKey();
    }

    public SecureDigestAlgorithm<?, ?> getAlgorithm() {
        return settings.getAlgorithm();
    }

    public String getIssuer() {
        return settings.getIssuer();
    }

    public Duration getExpire() {
        return settings.getExpire();
    }
}
