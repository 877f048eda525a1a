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
import org.fireflyframework.webhookguard.core.resilience.OperationRetryConfig;
import org.fireflyframework.webhookguard.core.resilience.ResilientRetryHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetryCircuitBreakerHealthIndicator Tests")
class RetryCircuitBreakerHealthIndicatorTest {

    @Mock
    private ResilientRetryHandler retryHandler;

    private RetryCircuitBreakerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new RetryCircuitBreakerHealthIndicator(retryHandler);
    }

    private CircuitBreaker breaker(String name) {
        return CircuitBreaker.of(name, OperationRetryConfig.builder().failureThreshold(1).build()
                .toCircuitBreakerConfig());
    }

    private CircuitBreaker openBreaker(String name) {
        CircuitBreaker breaker = breaker(name);
        breaker.onError(0, TimeUnit.MILLISECONDS, new IllegalStateException("down"));
        return breaker;
    }

    @Test
    @DisplayName("Should report UP when all breakers are closed")
    void shouldReportUpWhenAllBreakersClosed() {
        when(retryHandler.getCircuitBreakers()).thenReturn(Map.of("relay", breaker("relay")));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("numberOfCircuitBreakers", 1);
    }

    @Test
    @DisplayName("Should report DOWN when a breaker is open")
    void shouldReportDownWhenBreakerOpen() {
        CircuitBreaker db = openBreaker("db");
        when(retryHandler.getCircuitBreakers()).thenReturn(Map.of("relay", breaker("relay"), "db", db));

        Health health = indicator.health();

        assertThat(db.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> details = (Map<String, Map<String, Object>>) health.getDetails()
                .get("circuitBreakers");
        assertThat(details.get("db"))
                .containsEntry("state", "OPEN")
                .containsEntry("numberOfFailedCalls", 1);
    }

    @Test
    @DisplayName("Should report HALF_OPEN while a breaker admits a trial call")
    void shouldReportHalfOpenWhileBreakerAdmitsTrialCall() {
        CircuitBreaker breaker = openBreaker("db");
        breaker.transitionToHalfOpenState();
        when(retryHandler.getCircuitBreakers()).thenReturn(Map.of("db", breaker));

        assertThat(indicator.health().getStatus().getCode()).isEqualTo("HALF_OPEN");
    }
}
