package io.springsecurity.jwtguard.configuration;

import io.springsecurity.jwtguard.enums.RateLimitType;
import org.springframework.context.annotation.Conditional;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Matches when {@code jwt-guard.rate-limit.type} binds to the given type. The property is bound like
 * any configuration property, so {@code sliding-window}, {@code SLIDING_WINDOW} and
 * {@code slidingWindow} all select {@link RateLimitType#SLIDING_WINDOW}.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Conditional(OnRateLimitTypeCondition.class)
public @interface ConditionalOnRateLimitType {

    RateLimitType value();
}
