package io.springsecurity.jwtguard.token.transport;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Hands a freshly issued token to the client.
 */
@FunctionalInterface
public interface TokenSetter {

    String ACCESS_TOKEN_HEADER = "x-access-token";
    String REFRESH_TOKEN_HEADER = "x-refresh-token";

    void set(HttpServletRequest request, HttpServletResponse response, String token);

    static TokenSetter header(String name) {
        return (request, response, token) -> response.setHeader(name, token);
    }
}
