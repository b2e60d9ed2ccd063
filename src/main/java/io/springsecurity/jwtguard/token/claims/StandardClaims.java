package io.springsecurity.jwtguard.token.claims;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Registered JWT claim names (RFC 7519 section 4.1) exposed as accessors.
 *
 * <p>Any claims type handled by a {@link io.springsecurity.jwtguard.token.codec.TokenCodec}
 * implements this interface. The usual way is to hold a {@link RegisteredClaims} and delegate to it:
 *
 * <pre>{@code
 * @Data
 * public class UserClaims implements StandardClaims {
 *     private long uid;
 *
 *     @JsonIgnore
 *     @Delegate(types = StandardClaims.class)
 *     private final RegisteredClaims registered = new RegisteredClaims();
 * }
 * }</pre>
 *
 * The accessors are ignored by Jackson; the codec reads and writes the registered claims itself,
 * everything else on the claims type is mapped as a private claim.
 */
public interface StandardClaims {

    @JsonIgnore
    String getIssuer();

    @JsonIgnore
    void setIssuer(String issuer);

    @JsonIgnore
    String getSubject();

    @JsonIgnore
    void setSubject(String subject);

    @JsonIgnore
    List<String> getAudience();

    @JsonIgnore
    void setAudience(List<String> audience);

    @JsonIgnore
    Instant getExpiresAt();

    @JsonIgnore
    void setExpiresAt(Instant expiresAt);

    @JsonIgnore
    Instant getNotBefore();

    @JsonIgnore
    void setNotBefore(Instant notBefore);

    @JsonIgnore
    Instant getIssuedAt();

    @JsonIgnore
    void setIssuedAt(Instant issuedAt);

    @JsonIgnore
    String getId();

    @JsonIgnore
    void setId(String id);
}
