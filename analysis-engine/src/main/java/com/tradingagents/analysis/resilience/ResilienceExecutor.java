package com.tradingagents.analysis.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Wraps outbound calls from stage bodies in a named retry and circuit breaker.
 *
 * <p>One breaker and one retry instance exist per {@code name}, created on first use with
 * the policy given then. Each attempt runs under the policy timeout and is recorded by the
 * breaker; the retry sits outside the breaker so an open circuit is not retried.
 */
@Component
public class ResilienceExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilienceExecutor.class);

    private final CircuitBreakerRegistry circuitBreakers = CircuitBreakerRegistry.ofDefaults();
    private final RetryRegistry retries = RetryRegistry.ofDefaults();

    public <T> Mono<T> withResilience(String name, Supplier<Mono<T>> call, ResiliencePolicy policy) {
        CircuitBreaker breaker = circuitBreakers.circuitBreaker(name, breakerConfig(policy));
        Retry retry = retries.retry(name, retryConfig(policy));

        return Mono.defer(call)
            .timeout(policy.timeout())
            .transformDeferred(CircuitBreakerOperator.of(breaker))
            .transformDeferred(RetryOperator.of(retry))
            .doOnError(e -> log.warn("[Resilience] Call failed after retries. name={} breakerState={} reason={}",
                name, breaker.getState(), e.getMessage()));
    }

    public CircuitBreaker.State breakerState(String name) {
        return circuitBreakers.find(name).map(CircuitBreaker::getState).orElse(CircuitBreaker.State.CLOSED);
    }

    private static CircuitBreakerConfig breakerConfig(ResiliencePolicy policy) {
        return CircuitBreakerConfig.custom()
            .failureRateThreshold(policy.failureRateThreshold())
            .waitDurationInOpenState(policy.openStateWait())
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();
    }

    private static RetryConfig retryConfig(ResiliencePolicy policy) {
        return RetryConfig.custom()
            .maxAttempts(Math.max(1, policy.maxAttempts()))
            .intervalFunction(IntervalFunction.ofExponentialBackoff(policy.initialBackoff(), 2.0))
            .ignoreExceptions(CallNotPermittedException.class, IllegalArgumentException.class)
            .build();
    }
}
