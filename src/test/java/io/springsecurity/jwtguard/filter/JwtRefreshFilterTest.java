package io.springsecurity.jwtguard.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.HttpRequestHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("JwtRefreshFilter")
class JwtRefreshFilterTest {

    @Mock
    private HttpRequestHandler refreshHandler;

    @Test
    @DisplayName("Should hand a POST to the refresh URI to the handler and stop the chain")
    void shouldHandleRefreshRequest() throws Exception {
        JwtRefreshFilter filter = new JwtRefreshFilter("/refresh-token", refreshHandler);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/refresh-token");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        verify(refreshHandler).handleRequest(request, response);
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    @DisplayName("Should pass other requests through")
    void shouldPassOtherRequests() throws Exception {
        JwtRefreshFilter filter = new JwtRefreshFilter("/refresh-token", refreshHandler);

        for (MockHttpServletRequest request : new MockHttpServletRequest[]{
                new MockHttpServletRequest("GET", "/refresh-token"),
                new MockHttpServletRequest("POST", "/orders")}) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(request, new MockHttpServletResponse(), chain);
            assertThat(chain.getRequest()).isSameAs(request);
        }
        verifyNoInteractions(refreshHandler);
    }
}
