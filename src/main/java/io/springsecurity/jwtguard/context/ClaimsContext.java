package io.springsecurity.jwtguard.context;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Request scoped storage of verified claims. Each request carries its own value under a key
 * private to this class.
 */
public final class ClaimsContext {

    private static final String CLAIMS_ATTRIBUTE = ClaimsContext.class.getName() + ".CLAIMS";

    private ClaimsContext() {
    }

    public static void setClaims(HttpServletRequest request, Object claims) {
        request.setAttribute(CLAIMS_ATTRIBUTE, claims);
    }

    /**
     * @return the claims attached to {@code request}, or empty when none are attached or they are
     * not of {@code claimsType}
     */
    public static <C> Optional<C> getClaims(HttpServletRequest request, Class<C> claimsType) {
        Object claims = request.getAttribute(CLAIMS_ATTRIBUTE);
        if (!claimsType.isInstance(claims)) {
            return Optional.empty();
        }
        return Optional.of(claimsType.cast(claims));
    }

    public static void clear(HttpServletRequest request) {
        request.removeAttribute(CLAIMS_ATTRIBUTE);
    }
}
