package com.tradingagents.analysis.resilience;

import java.time.Duration;

/**
 * Retry and circuit-breaker settings for one kind of outbound call.
 *
 * @param maxAttempts          total attempts including the first
 * @param initialBackoff       wait before the first retry; doubles on each further retry
 * @param failureRateThreshold percentage of failed calls that opens the circuit
 * @param openStateWait        how long an open circuit rejects calls before half-opening
 * @param timeout              per-attempt timeout
 */
public record ResiliencePolicy(
    int maxAttempts,
    Duration initialBackoff,
    float failureRateThreshold,
    Duration openStateWait,
    Duration timeout
) {

    public static ResiliencePolicy llmDefaults() {
        return new ResiliencePolicy(3, Duration.ofSeconds(1), 50f, Duration.ofMinutes(2), Duration.ofSeconds(60));
    }

    public static ResiliencePolicy dataDefaults() {
        return new ResiliencePolicy(3, Duration.ofMillis(500), 50f, Duration.ofMinutes(1), Duration.ofSeconds(15));
    }
}
