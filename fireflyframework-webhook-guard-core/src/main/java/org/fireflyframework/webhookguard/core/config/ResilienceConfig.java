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

package org.fireflyframework.webhookguard.core.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.resilience.OperationRetryConfig;
import org.fireflyframework.webhookguard.core.resilience.ResilientRetryHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration for the resilience building blocks: the Resilience4j time limiter
 * bounding every retry delivery, the circuit breaker registry and the generic
 * resilient retry handler built on both.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class ResilienceConfig {

    public static final String RETRY_EXECUTOR_TIME_LIMITER = "webhookRetryExecutor";

    private final RetryProperties retryProperties;

    /**
     * Time Limiter Registry whose default timeout is the retry executor timeout.
     */
    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(retryProperties.getExecutorTimeout())
                .cancelRunningFuture(true)
                .build();

        TimeLimiterRegistry registry = TimeLimiterRegistry.of(config);

        // Add event listeners for monitoring
        registry.getEventPublisher()
                .onEntryAdded(event -> {
                    TimeLimiter tl = event.getAddedEntry();
                    tl.getEventPublisher()
                            .onSuccess(e -> log.debug("Time Limiter '{}' completed successfully", tl.getName()))
                            .onError(e -> log.error("Time Limiter '{}' failed: {}",
                                    tl.getName(), e.getThrowable().getMessage()))
                            .onTimeout(e -> log.warn("Time Limiter '{}' timed out", tl.getName()));
                });

        return registry;
    }

    @Bean
    public TimeLimiter retryExecutorTimeLimiter(TimeLimiterRegistry timeLimiterRegistry) {
        return timeLimiterRegistry.timeLimiter(RETRY_EXECUTOR_TIME_LIMITER);
    }

    /**
     * Circuit Breaker Registry of the resilient retry handler. Breakers are added
     * per operation id with the settings of their operation.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
                OperationRetryConfig.defaults().toCircuitBreakerConfig());

        // Add event listeners for monitoring
        registry.getEventPublisher()
                .onEntryAdded(event -> {
                    CircuitBreaker cb = event.getAddedEntry();
                    cb.getEventPublisher()
                            .onStateTransition(e -> log.warn("Circuit Breaker '{}' state changed: {} -> {}",
                                    cb.getName(),
                                    e.getStateTransition().getFromState(),
                                    e.getStateTransition().getToState()))
                            .onError(e -> log.error("Circuit Breaker '{}' recorded error: {}",
                                    cb.getName(), e.getThrowable().getMessage()))
                            .onCallNotPermitted(e -> log.debug("Circuit Breaker '{}' rejected a call", cb.getName()));
                });

        return registry;
    }

    @Bean
    public ResilientRetryHandler resilientRetryHandler(CircuitBreakerRegistry circuitBreakerRegistry) {
        ResilientRetryHandler handler = new ResilientRetryHandler(
                OperationRetryConfig.defaults(),
                retryProperties.toOperationConfigs(),
                circuitBreakerRegistry,
                () -> ThreadLocalRandom.current().nextDouble());
        log.info("Initialized ResilientRetryHandler with {} operation overrides", retryProperties.getOperations().size());
        return handler;
    }
}
