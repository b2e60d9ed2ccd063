package io.springsecurity.jwtguard.token.claims;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Mutable holder of the registered claims, meant to be embedded in caller claim types.
 */
@Data
@NoArgsConstructor
public class RegisteredClaims implements StandardClaims {

    private String issuer;
    private String subject;
    private List<String> audience;
    private Instant expiresAt;
    private Instant notBefore;
    private Instant issuedAt;
    private String id;
}
