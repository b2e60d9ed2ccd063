package io.springsecurity.jwtguard.context;

import io.springsecurity.jwtguard.token.claims.StandardClaims;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

/**
 * An authenticated {@link org.springframework.security.core.Authentication} carrying verified token claims.
 * The principal is the {@code sub} claim when present, otherwise the claims themselves.
 */
public class ClaimsAuthenticationToken extends AbstractAuthenticationToken {

    private final Object claims;

    public ClaimsAuthenticationToken(Object claims) {
        super(AuthorityUtils.NO_AUTHORITIES);
        this.claims = claims;
        setAuthenticated(true);
    }

    public Object getClaims() {
        return claims;
    }

    @Override
    public Object getCredentials() {
        return "";
    }

    @Override
    public Object getPrincipal() {
        if (claims instanceof StandardClaims standardClaims && standardClaims.getSubject() != null) {
            return standardClaims.getSubject();
        }
        return claims;
    }
}
