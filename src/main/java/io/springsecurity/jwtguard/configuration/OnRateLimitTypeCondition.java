package io.springsecurity.jwtguard.configuration;

import io.springsecurity.jwtguard.enums.RateLimitType;
import org.springframework.boot.autoconfigure.condition.ConditionMessage;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

import java.util.Map;

class OnRateLimitTypeCondition extends SpringBootCondition {

    static final String PROPERTY = "jwt-guard.rate-limit.type";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Map<String, Object> attributes = metadata.getAnnotationAttributes(ConditionalOnRateLimitType.class.getName());
        RateLimitType required = (RateLimitType) attributes.get("value");
        RateLimitType configured = Binder.get(context.getEnvironment())
                .bind(PROPERTY, RateLimitType.class)
                .orElse(RateLimitType.NONE);

        ConditionMessage.Builder message = ConditionMessage.forCondition(ConditionalOnRateLimitType.class, required);
        if (configured == required) {
            return ConditionOutcome.match(message.foundExactly(PROPERTY + "=" + configured));
        }
        return ConditionOutcome.noMatch(message.because(PROPERTY + " is " + configured));
    }
}
