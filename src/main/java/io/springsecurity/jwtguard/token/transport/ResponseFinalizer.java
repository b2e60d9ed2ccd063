package io.springsecurity.jwtguard.token.transport;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * Completes the response once every token has been handed over.
 */
@FunctionalInterface
public interface ResponseFinalizer {

    void finish(HttpServletRequest request, HttpServletResponse response) throws IOException;

    static ResponseFinalizer noContent() {
        return (request, response) -> response.setStatus(HttpServletResponse.SC_NO_CONTENT);
    }
}
