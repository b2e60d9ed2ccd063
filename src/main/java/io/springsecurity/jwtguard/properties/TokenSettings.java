package io.springsecurity.jwtguard.properties;

import lombok.Data;

import java.time.Duration;

@Data
public class TokenSettings {

    /**
     * HMAC secret, at least 32 bytes in UTF-8.
     */
    private String secret;

    private Duration expire;

    /**
     * Written as {@code iss} when set.
     */
    private String issuer;

    public TokenSettings() {
    }

    public TokenSettings(Duration expire) {
        this.expire = expire;
    }
}
