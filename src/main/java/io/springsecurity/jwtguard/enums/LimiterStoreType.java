package io.springsecurity.jwtguard.enums;

/**
 * Where shared limiter counters live. Token buckets are always held in memory.
 */
public enum LimiterStoreType {
    MEMORY,
    REDIS
}
