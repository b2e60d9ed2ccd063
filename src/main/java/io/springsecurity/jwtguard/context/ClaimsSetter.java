package io.springsecurity.jwtguard.context;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Attaches verified claims to the request being processed.
 *
 * @see ClaimsGetter
 */
@FunctionalInterface
public interface ClaimsSetter<C> {

    void set(HttpServletRequest request, C claims);

    /**
     * Detaches what {@link #set} attached, once the request has been handled. Request attributes
     * die with the request, so there is nothing to do by default.
     */
    default void clear(HttpServletRequest request) {
    }

    /**
     * Stores the claims in {@link ClaimsContext}.
     */
    static <C> ClaimsSetter<C> requestAttribute() {
        return ClaimsContext::setClaims;
    }

    /**
     * Stores a {@link ClaimsAuthenticationToken} in a new {@link SecurityContext}, for applications
     * authorizing with Spring Security. Pair with {@link ClaimsGetter#securityContext(Class)}.
     * The holder is thread bound, {@link #clear} empties it so pooled threads do not carry claims over.
     */
    static <C> ClaimsSetter<C> securityContext() {
        return new ClaimsSetter<>() {
            @Override
            public void set(HttpServletRequest request, C claims) {
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(new ClaimsAuthenticationToken(claims));
                SecurityContextHolder.setContext(context);
            }

            @Override
            public void clear(HttpServletRequest request) {
                SecurityContextHolder.clearContext();
            }
        };
    }
}
