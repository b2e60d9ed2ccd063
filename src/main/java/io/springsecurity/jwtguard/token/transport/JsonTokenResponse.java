package io.springsecurity.jwtguard.token.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sends issued tokens in a JSON body instead of response headers.
 *
 * <p>The setters only remember the tokens on the request; {@link #responseFinalizer()} writes
 * {@code {"accessToken": "...", "refreshToken": "..."}} with status 200. The three parts are
 * meant to be installed together:
 *
 * <pre>{@code
 * JsonTokenResponse json = new JsonTokenResponse(objectMapper);
 * JwtRefreshHandler.create(accessCodec, refreshCodec,
 *         JwtRefreshHandler.withAccessTokenSetter(json.accessTokenSetter()),
 *         JwtRefreshHandler.withRefreshTokenSetter(json.refreshTokenSetter()),
 *         JwtRefreshHandler.withResponseFinalizer(json.responseFinalizer()));
 * }</pre>
 */
public class JsonTokenResponse {

    public static final String ACCESS_TOKEN_FIELD = "accessToken";
    public static final String REFRESH_TOKEN_FIELD = "refreshToken";

    private static final String ACCESS_TOKEN_ATTRIBUTE = JsonTokenResponse.class.getName() + ".ACCESS_TOKEN";
    private static final String REFRESH_TOKEN_ATTRIBUTE = JsonTokenResponse.class.getName() + ".REFRESH_TOKEN";

    private final ObjectMapper objectMapper;

    public JsonTokenResponse(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    public TokenSetter accessTokenSetter() {
        return (request, response, token) -> request.setAttribute(ACCESS_TOKEN_ATTRIBUTE, token);
    }

    public TokenSetter refreshTokenSetter() {
        return (request, response, token) -> request.setAttribute(REFRESH_TOKEN_ATTRIBUTE, token);
    }

    public ResponseFinalizer responseFinalizer() {
        return (request, response) -> {
            Map<String, Object> body = new LinkedHashMap<>();
            putIfPresent(body, ACCESS_TOKEN_FIELD, request, ACCESS_TOKEN_ATTRIBUTE);
            putIfPresent(body, REFRESH_TOKEN_FIELD, request, REFRESH_TOKEN_ATTRIBUTE);

            response.setStatus(HttpServletResponse.SC_OK);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding("UTF-8");
            objectMapper.writeValue(response.getWriter(), body);
        };
    }

    private static void putIfPresent(Map<String, Object> body, String field, HttpServletRequest request, String attribute) {
        Object token = request.getAttribute(attribute);
        if (token != null) {
            body.put(field, token);
        }
    }
}
