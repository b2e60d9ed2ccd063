package io.springsecurity.jwtguard.token.codec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.springsecurity.jwtguard.exception.TokenGenerationException;
import io.springsecurity.jwtguard.exception.TokenVerificationException;
import io.springsecurity.jwtguard.exception.TokenVerificationException.Reason;
import io.springsecurity.jwtguard.token.claims.RegisteredClaims;
import io.springsecurity.jwtguard.token.claims.StandardClaims;
import io.springsecurity.jwtguard.token.claims.UserClaims;
import lombok.Data;
import lombok.experimental.Delegate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static io.springsecurity.jwtguard.token.codec.TokenCodecOptions.withAlgorithm;
import static io.springsecurity.jwtguard.token.codec.TokenCodecOptions.withClock;
import static io.springsecurity.jwtguard.token.codec.TokenCodecOptions.withIdGenerator;
import static io.springsecurity.jwtguard.token.codec.TokenCodecOptions.withIssuer;
import static io.springsecurity.jwtguard.token.codec.TokenCodecOptions.withVerificationKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtTokenCodec")
class JwtTokenCodecTest {

    static final String ACCESS_KEY = "access key";
    static final Instant T0 = Instant.ofEpochMilli(1695571200000L);
    static final Duration EXPIRE = Duration.ofMinutes(10);

    static final String GOLDEN_TOKEN = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9"
            + ".eyJ1aWQiOjEsImV4cCI6MTY5NTU3MTgwMCwiaWF0IjoxNjk1NTcxMjAwfQ"
            + ".Azhc3P_Iks_DRWRZUrZwpKWLiZ9LY7fI0BqhLzOsEgI";

    private JwtTokenCodec<UserClaims> codec;

    @BeforeEach
    void setUp() {
        codec = JwtTokenCodec.hmac(ACCESS_KEY, EXPIRE, UserClaims.class, withClock(fixedAt(T0)));
    }

    @Test
    @DisplayName("Should produce the golden token for a fixed clock")
    void shouldProduceGoldenToken() {
        assertThat(codec.generate(UserClaims.of(1))).isEqualTo(GOLDEN_TOKEN);
    }

    @Test
    @DisplayName("Should verify the golden token")
    void shouldVerifyGoldenToken() {
        UserClaims claims = codec.verify(GOLDEN_TOKEN);

        assertThat(claims.getUid()).isEqualTo(1);
        assertThat(claims.getExpiresAt()).isEqualTo(T0.plus(EXPIRE));
        assertThat(claims.getIssuedAt()).isEqualTo(T0);
        assertThat(claims.getIssuer()).isNull();
        assertThat(claims.getId()).isNull();
    }

    @Test
    @DisplayName("Should round trip caller fields and stamp the codec's registered claims")
    void shouldRoundTrip() {
        JwtTokenCodec<UserClaims> stamping = codec.withOptions(withIssuer("jwt-guard"), withIdGenerator(() -> "id-1"));
        UserClaims claims = UserClaims.of(42);
        claims.setSubject("alice");
        claims.setAudience(List.of("api"));
        claims.setIssuer("forged");
        claims.setExpiresAt(T0.plus(Duration.ofDays(365)));
        claims.setId("forged-id");

        UserClaims verified = stamping.verify(stamping.generate(claims));

        assertThat(verified.getUid()).isEqualTo(42);
        assertThat(verified.getSubject()).isEqualTo("alice");
        assertThat(verified.getAudience()).containsExactly("api");
        assertThat(verified.getIssuer()).isEqualTo("jwt-guard");
        assertThat(verified.getExpiresAt()).isEqualTo(T0.plus(EXPIRE));
        assertThat(verified.getIssuedAt()).isEqualTo(T0);
        assertThat(verified.getId()).isEqualTo("id-1");
    }

    @Test
    @DisplayName("Should not modify the claims passed to generate")
    void shouldNotMutateCallerClaims() {
        UserClaims claims = UserClaims.of(7);

        codec.withOptions(withIssuer("jwt-guard"), withIdGenerator(() -> "id-1")).generate(claims);

        assertThat(claims.getIssuer()).isNull();
        assertThat(claims.getExpiresAt()).isNull();
        assertThat(claims.getIssuedAt()).isNull();
        assertThat(claims.getId()).isNull();
    }

    @Test
    @DisplayName("Should accept a token until the instant it expires")
    void shouldHonourExpiryBoundary() {
        String token = codec.generate(UserClaims.of(1));
        Instant expiresAt = T0.plus(EXPIRE);

        assertThat(codec.withOptions(withClock(fixedAt(expiresAt.minusNanos(1)))).verify(token).getUid())
                .isEqualTo(1);
        assertVerificationFails(codec.withOptions(withClock(fixedAt(expiresAt))), token, Reason.EXPIRED);
        assertVerificationFails(codec.withOptions(withClock(fixedAt(expiresAt.plusSeconds(60)))), token, Reason.EXPIRED);
    }

    @Test
    @DisplayName("Should reject a token used before its not-before time")
    void shouldRejectPrematureToken() {
        UserClaims claims = UserClaims.of(1);
        claims.setNotBefore(T0.plus(Duration.ofMinutes(5)));

        String token = codec.generate(claims);

        assertVerificationFails(codec, token, Reason.NOT_YET_VALID);
        assertThat(codec.withOptions(withClock(fixedAt(T0.plus(Duration.ofMinutes(5))))).verify(token).getNotBefore())
                .isEqualTo(T0.plus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Should reject a token whose signature was tampered with")
    void shouldRejectTamperedSignature() {
        String token = codec.generate(UserClaims.of(1));
        int signatureStart = token.lastIndexOf('.') + 1;
        char replacement = token.charAt(signatureStart) == 'A' ? 'B' : 'A';
        String tampered = token.substring(0, signatureStart) + replacement + token.substring(signatureStart + 1);

        assertVerificationFails(codec, tampered, Reason.SIGNATURE_INVALID);
    }

    @Test
    @DisplayName("Should reject a token signed with another key")
    void shouldRejectForeignKey() {
        JwtTokenCodec<UserClaims> other = JwtTokenCodec.hmac("another key that is long enough for HS256",
                EXPIRE, UserClaims.class, withClock(fixedAt(T0)));

        assertVerificationFails(codec, other.generate(UserClaims.of(1)), Reason.SIGNATURE_INVALID);
    }

    @Test
    @DisplayName("Should reject a token signed with an algorithm other than the configured one")
    void shouldRejectUnexpectedAlgorithm() {
        JwtTokenCodec<UserClaims> hs512 = codec.withOptions(withAlgorithm(Jwts.SIG.HS512));

        assertVerificationFails(hs512, codec.generate(UserClaims.of(1)), Reason.SIGNATURE_INVALID);
    }

    @Test
    @DisplayName("Should report malformed input")
    void shouldRejectMalformedToken() {
        assertVerificationFails(codec, "bad_token", Reason.MALFORMED);
        assertVerificationFails(codec, "", Reason.MALFORMED);
    }

    @Test
    @DisplayName("Should report a payload that does not fit the claims type")
    void shouldRejectClaimsTypeMismatch() {
        JwtTokenCodec<NamedClaims> named = JwtTokenCodec.hmac(ACCESS_KEY, EXPIRE, NamedClaims.class,
                withClock(fixedAt(T0)));
        NamedClaims claims = new NamedClaims();
        claims.setUid("not-a-number");

        assertVerificationFails(codec, named.generate(claims), Reason.CLAIMS_TYPE_MISMATCH);
    }

    @Test
    @DisplayName("Should apply parser requirements passed to verify")
    void shouldApplyParserCustomizer() {
        UserClaims claims = UserClaims.of(1);
        claims.setSubject("alice");
        String token = codec.generate(claims);

        assertThat(codec.verify(token, parser -> parser.requireSubject("alice")).getSubject()).isEqualTo("alice");
        assertThatThrownBy(() -> codec.verify(token, parser -> parser.requireSubject("bob")))
                .isInstanceOfSatisfying(TokenVerificationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.CLAIMS_INVALID));
    }

    @Test
    @DisplayName("Should sign with a private key and verify with the public key")
    void shouldSupportAsymmetricKeys() {
        KeyPair pair = Jwts.SIG.RS256.keyPair().build();
        JwtTokenCodec<UserClaims> rsa = JwtTokenCodec.of(pair.getPrivate(), EXPIRE, UserClaims.class,
                withAlgorithm(Jwts.SIG.RS256), withVerificationKey(pair.getPublic()), withClock(fixedAt(T0)));

        String token = rsa.generate(UserClaims.of(3));

        assertThat(rsa.verify(token).getUid()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should interoperate with tokens signed by the standard HS256 implementation")
    void shouldVerifyStandardHmacToken() {
        String secret = "another key that is long enough for HS256";
        JwtTokenCodec<UserClaims> strong = JwtTokenCodec.hmac(secret, EXPIRE, UserClaims.class, withClock(fixedAt(T0)));
        String token = Jwts.builder()
                .claim("uid", 5)
                .expiration(Date.from(T0.plus(EXPIRE)))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        assertThat(strong.verify(token).getUid()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should refuse to sign with an empty secret")
    void shouldRejectEmptySecret() {
        assertThatThrownBy(() -> JwtTokenCodec.hmac("", EXPIRE, UserClaims.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report a signing failure as a generation error")
    void shouldReportSigningFailure() {
        KeyPair pair = Jwts.SIG.RS256.keyPair().build();
        JwtTokenCodec<UserClaims> misconfigured = JwtTokenCodec.of(pair.getPrivate(), EXPIRE, UserClaims.class);

        assertThatThrownBy(() -> misconfigured.generate(UserClaims.of(1)))
                .isInstanceOf(TokenGenerationException.class);
    }

    @Test
    @DisplayName("Should leave the original codec untouched when deriving with options")
    void shouldCopyOnWithOptions() {
        JwtTokenCodec<UserClaims> derived = codec.withOptions(withIssuer("issuer-x"), withIdGenerator(() -> "jti-x"),
                withClock(fixedAt(T0.plusSeconds(30))));

        UserClaims fromDerived = derived.verify(derived.generate(UserClaims.of(1)));
        UserClaims fromOriginal = codec.verify(codec.generate(UserClaims.of(1)));

        assertThat(derived).isNotSameAs(codec);
        assertThat(fromDerived.getIssuer()).isEqualTo("issuer-x");
        assertThat(fromDerived.getId()).isEqualTo("jti-x");
        assertThat(fromDerived.getIssuedAt()).isEqualTo(T0.plusSeconds(30));
        assertThat(fromOriginal.getIssuer()).isNull();
        assertThat(fromOriginal.getId()).isNull();
        assertThat(fromOriginal.getIssuedAt()).isEqualTo(T0);
        assertThat(derived.getSigningKey()).isSameAs(codec.getSigningKey());
        assertThat(derived.getVerificationKey()).isSameAs(codec.getSigningKey());
        assertThat(derived.getAlgorithm()).isEqualTo(Jwts.SIG.HS256);
        assertThat(derived.getExpire()).isEqualTo(EXPIRE);
    }

    private static void assertVerificationFails(JwtTokenCodec<?> codec, String token, Reason reason) {
        assertThatThrownBy(() -> codec.verify(token))
                .isInstanceOfSatisfying(TokenVerificationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(reason));
    }

    static Clock fixedAt(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    @Data
    public static class NamedClaims implements StandardClaims {

        private String uid;

        @JsonIgnore
        @Delegate(types = StandardClaims.class)
        private final RegisteredClaims registered = new RegisteredClaims();
    }
}
