package io.springsecurity.jwtguard.enums;

public enum RateLimitType {
    NONE,
    SLIDING_WINDOW,
    ACTIVE,
    BUCKET
}
