package io.springsecurity.jwtguard.token.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonTokenResponse")
class JsonTokenResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonTokenResponse json = new JsonTokenResponse(objectMapper);

    @Test
    @DisplayName("Should write both tokens as a JSON body")
    void shouldWriteBothTokens() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();

        json.accessTokenSetter().set(request, response, "access");
        json.refreshTokenSetter().set(request, response, "refresh");
        json.responseFinalizer().finish(request, response);

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getContentType()).startsWith(MediaType.APPLICATION_JSON_VALUE);
        assertThat(body.get(JsonTokenResponse.ACCESS_TOKEN_FIELD).asText()).isEqualTo("access");
        assertThat(body.get(JsonTokenResponse.REFRESH_TOKEN_FIELD).asText()).isEqualTo("refresh");
        assertThat(response.getHeader(TokenSetter.ACCESS_TOKEN_HEADER)).isNull();
    }

    @Test
    @DisplayName("Should leave out a token that was not issued")
    void shouldOmitMissingToken() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();

        json.accessTokenSetter().set(request, response, "access");
        json.responseFinalizer().finish(request, response);

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.has(JsonTokenResponse.ACCESS_TOKEN_FIELD)).isTrue();
        assertThat(body.has(JsonTokenResponse.REFRESH_TOKEN_FIELD)).isFalse();
    }
}
