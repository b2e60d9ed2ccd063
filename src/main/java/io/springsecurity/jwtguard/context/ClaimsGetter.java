package io.springsecurity.jwtguard.context;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

/**
 * Reads back the claims a {@link ClaimsSetter} attached. Setter and getter must be used in pairs.
 */
@FunctionalInterface
public interface ClaimsGetter<C> {

    Optional<C> get(HttpServletRequest request);

    static <C> ClaimsGetter<C> requestAttribute(Class<C> claimsType) {
        return request -> ClaimsContext.getClaims(request, claimsType);
    }

    static <C> ClaimsGetter<C> securityContext(Class<C> claimsType) {
        return request -> {
            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
            if (authentication instanceof ClaimsAuthenticationToken token && claimsType.isInstance(token.getClaims())) {
                return Optional.of(claimsType.cast(token.getClaims()));
            }
            return Optional.empty();
        };
    }
}
