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

package org.fireflyframework.webhookguard.core.health;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.fireflyframework.webhookguard.core.resilience.ResilientRetryHandler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the circuit breakers of the resilient retry handler.
 * DOWN when any breaker is open, HALF_OPEN when one lets a trial call through.
 */
@Component
@RequiredArgsConstructor
public class RetryCircuitBreakerHealthIndicator implements HealthIndicator {

    private final ResilientRetryHandler retryHandler;

    @Override
    public Health health() {
        Map<String, CircuitBreaker> breakers = retryHandler.getCircuitBreakers();
        boolean anyOpen = false;
        boolean anyHalfOpen = false;
        Map<String, Object> details = new LinkedHashMap<>();

        for (Map.Entry<String, CircuitBreaker> entry : breakers.entrySet()) {
            CircuitBreaker.State state = entry.getValue().getState();
            CircuitBreaker.Metrics metrics = entry.getValue().getMetrics();
            switch (state) {
                case OPEN, FORCED_OPEN -> anyOpen = true;
                case HALF_OPEN -> anyHalfOpen = true;
                default -> {
                }
            }
            details.put(entry.getKey(), Map.of(
                    "state", state.name(),
                    "failureRate", String.format("%.2f%%", metrics.getFailureRate()),
                    "numberOfBufferedCalls", metrics.getNumberOfBufferedCalls(),
                    "numberOfFailedCalls", metrics.getNumberOfFailedCalls(),
                    "numberOfSuccessfulCalls", metrics.getNumberOfSuccessfulCalls()));
        }

        Health.Builder builder;
        if (anyOpen) {
            builder = Health.down();
        } else if (anyHalfOpen) {
            builder = Health.status("HALF_OPEN");
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("circuitBreakers", details)
                .withDetail("numberOfCircuitBreakers", breakers.size())
                .build();
    }
}
