package io.springsecurity.jwtguard.ratelimit;

import io.springsecurity.jwtguard.exception.LimiterException;
import io.springsecurity.jwtguard.exception.LimiterTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BucketLimitFilter")
class BucketLimitFilterTest {

    private static final Duration TIMEOUT = Duration.ofMillis(100);

    @Mock
    private BucketLimiter limiter;

    @Test
    @DisplayName("Should admit while tokens are available")
    void shouldAdmit() throws Exception {
        when(limiter.limit()).thenReturn(false);

        assertThat(run(BucketLimitFilter.nonBlocking(limiter)).chainReached()).isTrue();
    }

    @Test
    @DisplayName("Should answer 429 when the bucket is empty")
    void shouldRejectWhenEmpty() throws Exception {
        when(limiter.limit()).thenReturn(true);

        Result result = run(BucketLimitFilter.nonBlocking(limiter));

        assertThat(result.status()).isEqualTo(429);
        assertThat(result.chainReached()).isFalse();
    }

    @Test
    @DisplayName("Should answer 500 when the limiter fails without blocking")
    void shouldFailClosed() throws Exception {
        when(limiter.limit()).thenThrow(new LimiterException("closed"));

        assertThat(run(BucketLimitFilter.nonBlocking(limiter)).status()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should wait for a token in blocking mode")
    void shouldWaitWhenBlocking() throws Exception {
        doNothing().when(limiter).blockLimit(TIMEOUT);
        BucketLimitFilter filter = BucketLimitFilter.blocking(limiter, TIMEOUT);

        assertThat(filter.isBlocking()).isTrue();
        assertThat(run(filter).chainReached()).isTrue();
        verify(limiter, never()).limit();
    }

    @Test
    @DisplayName("Should answer 504 when waiting times out")
    void shouldTimeOut() throws Exception {
        doThrow(new LimiterTimeoutException("no token")).when(limiter).blockLimit(TIMEOUT);

        Result result = run(BucketLimitFilter.blocking(limiter, TIMEOUT));

        assertThat(result.status()).isEqualTo(504);
        assertThat(result.chainReached()).isFalse();
    }

    @Test
    @DisplayName("Should answer 500 when the limiter fails while blocking")
    void shouldFailWhileBlocking() throws Exception {
        doThrow(new LimiterException("closed")).when(limiter).blockLimit(TIMEOUT);

        assertThat(run(BucketLimitFilter.blocking(limiter, TIMEOUT)).status()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should answer 504 against a real bucket that stays empty")
    void shouldTimeOutAgainstRealBucket() throws Exception {
        try (TokenBucketLimiter bucket = new TokenBucketLimiter(1, Duration.ofHours(1))) {
            BucketLimitFilter filter = BucketLimitFilter.blocking(bucket, Duration.ofMillis(20));

            assertThat(run(filter).chainReached()).isTrue();
            assertThat(run(filter).status()).isEqualTo(504);
        }
    }

    private static Result run(BucketLimitFilter filter) throws Exception {
        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest("GET", "/orders"), response, chain);
        return new Result(response.getStatus(), chain.getRequest() != null);
    }

    private record Result(int status, boolean chainReached) {
    }
}
