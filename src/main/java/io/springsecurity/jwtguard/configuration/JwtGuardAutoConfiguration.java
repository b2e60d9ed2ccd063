package io.springsecurity.jwtguard.configuration;

import io.springsecurity.jwtguard.enums.LimiterStoreType;
import io.springsecurity.jwtguard.enums.RateLimitType;
import io.springsecurity.jwtguard.properties.JwtGuardProperties;
import io.springsecurity.jwtguard.properties.RateLimitSettings;
import io.springsecurity.jwtguard.ratelimit.ActiveLimitFilter;
import io.springsecurity.jwtguard.ratelimit.ActiveLimiter;
import io.springsecurity.jwtguard.ratelimit.BucketLimitFilter;
import io.springsecurity.jwtguard.ratelimit.BucketLimiter;
import io.springsecurity.jwtguard.ratelimit.Limiter;
import io.springsecurity.jwtguard.ratelimit.LocalActiveLimiter;
import io.springsecurity.jwtguard.ratelimit.LocalSlidingWindowLimiter;
import io.springsecurity.jwtguard.ratelimit.RateLimitFilter;
import io.springsecurity.jwtguard.ratelimit.RedisActiveLimiter;
import io.springsecurity.jwtguard.ratelimit.RedisSlidingWindowLimiter;
import io.springsecurity.jwtguard.ratelimit.RequestKeyResolver;
import io.springsecurity.jwtguard.ratelimit.TokenBucketLimiter;
import jakarta.servlet.Filter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Registers the {@link JwtCodecFactory} and, depending on {@code jwt-guard.rate-limit.type},
 * one limiter with its servlet filter.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(JwtGuardProperties.class)
public class JwtGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JwtCodecFactory jwtCodecFactory(JwtGuardProperties properties) {
        return new JwtCodecFactory(properties);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnRateLimitType(RateLimitType.SLIDING_WINDOW)
    static class SlidingWindowConfiguration {

        @Bean
        @ConditionalOnMissingBean(Limiter.class)
        public Limiter slidingWindowLimiter(JwtGuardProperties properties,
                                            ObjectProvider<StringRedisTemplate> redisTemplate) {
            RateLimitSettings settings = properties.getRateLimit();
            StringRedisTemplate redis = sharedStore(settings, redisTemplate);
            if (redis != null) {
                log.info("Creating Redis sliding window limiter ({} per {})", settings.getThreshold(), settings.getWindow());
                return new RedisSlidingWindowLimiter(redis, settings.getWindow(), settings.getThreshold());
            }
            log.info("Creating in-memory sliding window limiter ({} per {})", settings.getThreshold(), settings.getWindow());
            return new LocalSlidingWindowLimiter(settings.getWindow(), settings.getThreshold());
        }

        @Bean
        public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(Limiter limiter,
                                                                                   JwtGuardProperties properties) {
            RateLimitSettings settings = properties.getRateLimit();
            RequestKeyResolver keyResolver = settings.isKeyByIp()
                    ? RequestKeyResolver.clientIp(RequestKeyResolver.IP_RATE_LIMITER_PREFIX)
                    : RequestKeyResolver.fixed(RequestKeyResolver.ALL_REQUESTS_RATE_KEY);
            return registration(new RateLimitFilter(limiter, keyResolver), settings);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnRateLimitType(RateLimitType.ACTIVE)
    static class ActiveConfiguration {

        @Bean
        @ConditionalOnMissingBean(ActiveLimiter.class)
        public ActiveLimiter activeLimiter(JwtGuardProperties properties,
                                           ObjectProvider<StringRedisTemplate> redisTemplate) {
            RateLimitSettings settings = properties.getRateLimit();
            StringRedisTemplate redis = sharedStore(settings, redisTemplate);
            if (redis != null) {
                log.info("Creating Redis active limiter (max {})", settings.getMaxActive());
                return new RedisActiveLimiter(redis, settings.getMaxActive(), settings.getSlotTtl());
            }
            log.info("Creating in-memory active limiter (max {})", settings.getMaxActive());
            return new LocalActiveLimiter(settings.getMaxActive());
        }

        @Bean
        public FilterRegistrationBean<ActiveLimitFilter> activeLimitFilterRegistration(ActiveLimiter limiter,
                                                                                       JwtGuardProperties properties) {
            ActiveLimitFilter filter = new ActiveLimitFilter(limiter);
            if (properties.getRateLimit().isKeyByIp()) {
                filter.keyByClientIp();
            }
            return registration(filter, properties.getRateLimit());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnRateLimitType(RateLimitType.BUCKET)
    static class BucketConfiguration {

        @Bean
        @ConditionalOnMissingBean(BucketLimiter.class)
        public BucketLimiter bucketLimiter(JwtGuardProperties properties) {
            RateLimitSettings settings = properties.getRateLimit();
            log.info("Creating token bucket limiter (capacity {}, one token every {})",
                    settings.getCapacity(), settings.getInterval());
            return new TokenBucketLimiter(settings.getCapacity(), settings.getInterval());
        }

        @Bean
        public FilterRegistrationBean<BucketLimitFilter> bucketLimitFilterRegistration(BucketLimiter limiter,
                                                                                       JwtGuardProperties properties) {
            RateLimitSettings settings = properties.getRateLimit();
            BucketLimitFilter filter = settings.getBlockTimeout() == null
                    ? BucketLimitFilter.nonBlocking(limiter)
                    : BucketLimitFilter.blocking(limiter, settings.getBlockTimeout());
            return registration(filter, settings);
        }
    }

    private static StringRedisTemplate sharedStore(RateLimitSettings settings,
                                                   ObjectProvider<StringRedisTemplate> redisTemplate) {
        if (settings.getStore() != LimiterStoreType.REDIS) {
            return null;
        }
        StringRedisTemplate redis = redisTemplate.getIfAvailable();
        if (redis == null) {
            log.warn("REDIS limiter store is configured but no StringRedisTemplate is available. " +
                    "Falling back to an in-memory limiter, limits will not be shared between instances.");
        }
        return redis;
    }

    private static <F extends Filter> FilterRegistrationBean<F> registration(F filter, RateLimitSettings settings) {
        FilterRegistrationBean<F> registration = new FilterRegistrationBean<>(filter);
        registration.setOrder(settings.getFilterOrder());
        return registration;
    }
}
