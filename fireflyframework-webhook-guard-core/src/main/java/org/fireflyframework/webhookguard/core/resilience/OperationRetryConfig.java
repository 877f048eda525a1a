/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.webhookguard.core.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.Builder;
import lombok.Value;
import org.fireflyframework.webhookguard.core.retry.strategy.ExponentialBackoffStrategy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.DoubleSupplier;

/**
 * Retry, timeout and circuit breaker settings for one kind of operation.
 */
@Value
@Builder(toBuilder = true)
public class OperationRetryConfig {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialWait = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxWait = Duration.ofSeconds(60);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    double jitterPercentage = 10.0;

    /**
     * Honor the retry-after hint of a {@link RateLimitedException}
     */
    @Builder.Default
    boolean respectRetryAfter = true;

    /**
     * Factor applied to the retry-after hint
     */
    @Builder.Default
    double retryAfterMultiplier = 1.5;

    @Builder.Default
    int failureThreshold = 5;

    @Builder.Default
    Duration recoveryTimeout = Duration.ofMinutes(5);

    /**
     * Timeout of a single call
     */
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    public static OperationRetryConfig defaults() {
        return OperationRetryConfig.builder().build();
    }

    /**
     * Built-in configurations of the operations that differ from {@link #defaults()}.
     */
    public static Map<RetryOperation, OperationRetryConfig> builtIn() {
        Map<RetryOperation, OperationRetryConfig> configs = new EnumMap<>(RetryOperation.class);
        // Typeform rate limits: retry harder, back off further on 429
        configs.put(RetryOperation.TYPEFORM_API_REQUEST, OperationRetryConfig.builder()
                .maxAttempts(5)
                .initialWait(Duration.ofSeconds(2))
                .maxWait(Duration.ofSeconds(120))
                .multiplier(1.5)
                .retryAfterMultiplier(2.0)
                .build());
        configs.put(RetryOperation.WEBHOOK_PROCESSING, OperationRetryConfig.builder()
                .maxAttempts(3)
                .initialWait(Duration.ofMillis(500))
                .maxWait(Duration.ofSeconds(10))
                .multiplier(2.0)
                .build());
        configs.put(RetryOperation.DATABASE_OPERATION, OperationRetryConfig.builder()
                .maxAttempts(4)
                .initialWait(Duration.ofSeconds(1))
                .maxWait(Duration.ofSeconds(30))
                .multiplier(2.5)
                .failureThreshold(3)
                .build());
        configs.put(RetryOperation.FORM_RESPONSE_PROCESSING, OperationRetryConfig.builder()
                .maxAttempts(2)
                .initialWait(Duration.ofMillis(1500))
                .maxWait(Duration.ofSeconds(15))
                .multiplier(2.0)
                .build());
        return configs;
    }

    ExponentialBackoffStrategy toStrategy(DoubleSupplier random) {
        return new ExponentialBackoffStrategy(initialWait, maxWait, multiplier, jitterPercentage, maxAttempts,
                OperationRetryConfig::isRetryable, random);
    }

    /**
     * Breaker that opens after {@code failureThreshold} consecutive failures and lets
     * a single trial call through once {@code recoveryTimeout} has elapsed.
     */
    public CircuitBreakerConfig toCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(recoveryTimeout)
                .build();
    }

    private static boolean isRetryable(Throwable error) {
        return !(error instanceof CircuitBreakerOpenException)
                && !(error instanceof CallNotPermittedException)
                && !(error instanceof IllegalArgumentException);
    }
}
