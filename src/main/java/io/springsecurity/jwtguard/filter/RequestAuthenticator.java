package io.springsecurity.jwtguard.filter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Authenticates one request. On rejection the implementation has already written the response.
 */
@FunctionalInterface
public interface RequestAuthenticator<C> {

    AuthenticationOutcome<C> authenticate(HttpServletRequest request, HttpServletResponse response);

    /**
     * Called once an authenticated request has been handled.
     */
    default void clear(HttpServletRequest request) {
    }
}
