package io.springsecurity.jwtguard.token.transport;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Pulls the raw token out of a request.
 */
@FunctionalInterface
public interface TokenExtractor {

    /**
     * @return the token, or {@code null} when the request carries none
     */
    String extract(HttpServletRequest request);
}
