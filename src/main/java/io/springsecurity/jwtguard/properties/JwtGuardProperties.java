package io.springsecurity.jwtguard.properties;

import io.springsecurity.jwtguard.token.transport.TokenSetter;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "jwt-guard")
public class JwtGuardProperties {

    @NestedConfigurationProperty
    private TokenSettings access = new TokenSettings(Duration.ofMinutes(30));

    @NestedConfigurationProperty
    private TokenSettings refresh = new TokenSettings(Duration.ofDays(7));

    private String refreshUri = "/refresh-token";

    /**
     * Issue a new refresh token on every refresh.
     */
    private boolean rotateRefreshToken = false;

    private String accessTokenHeader = TokenSetter.ACCESS_TOKEN_HEADER;
    private String refreshTokenHeader = TokenSetter.REFRESH_TOKEN_HEADER;

    /**
     * Route patterns that skip access token authentication, e.g. {@code /login} or {@code /user/{id}}.
     */
    private List<String> ignorePaths = new ArrayList<>();

    @NestedConfigurationProperty
    private RateLimitSettings rateLimit = new RateLimitSettings();
}
