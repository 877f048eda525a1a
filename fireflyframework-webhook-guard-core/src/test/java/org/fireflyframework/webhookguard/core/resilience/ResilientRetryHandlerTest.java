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

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResilientRetryHandler Tests")
class ResilientRetryHandlerTest {

    private ResilientRetryHandler handler;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        handler = new ResilientRetryHandler(OperationRetryConfig.defaults(), Map.of(),
                CircuitBreakerRegistry.ofDefaults(), () -> 0.5);
        calls = new AtomicInteger();
    }

    private Mono<String> failingTimes(int failures, RuntimeException error) {
        return Mono.fromCallable(() -> {
            if (calls.incrementAndGet() <= failures) {
                throw error;
            }
            return "ok";
        });
    }

    private static void awaitRecovery() {
        try {
            Thread.sleep(200);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ========================================
    // Retry Tests
    // ========================================

    @Test
    @DisplayName("Should return the result of a successful first attempt")
    void shouldReturnResultOfSuccessfulFirstAttempt() {
        StepVerifier.create(handler.execute(RetryOperation.WEBHOOK_PROCESSING, "relay",
                        () -> failingTimes(0, new RuntimeException())))
                .expectNext("ok")
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry with exponential backoff until success")
    void shouldRetryWithExponentialBackoffUntilSuccess() {
        StepVerifier.withVirtualTime(() -> handler.execute(RetryOperation.WEBHOOK_PROCESSING, "relay",
                        () -> failingTimes(2, new IllegalStateException("503"))))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(1499))
                .thenAwait(Duration.ofMillis(1))
                .expectNext("ok")
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should re-raise the last error once attempts are exhausted")
    void shouldReraiseLastErrorOnceAttemptsExhausted() {
        StepVerifier.withVirtualTime(() -> handler.execute(RetryOperation.WEBHOOK_PROCESSING, "relay",
                        () -> failingTimes(10, new IllegalStateException("still down"))))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(2))
                .expectErrorMatches(e -> e instanceof IllegalStateException && "still down".equals(e.getMessage()))
                .verify();

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should not retry invalid arguments")
    void shouldNotRetryInvalidArguments() {
        StepVerifier.create(handler.execute(RetryOperation.WEBHOOK_PROCESSING, "relay",
                        () -> failingTimes(10, new IllegalArgumentException("bad input"))))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should wait at least the scaled retry-after hint")
    void shouldWaitAtLeastScaledRetryAfterHint() {
        StepVerifier.withVirtualTime(() -> handler.execute(RetryOperation.TYPEFORM_API_REQUEST, "typeform",
                        () -> failingTimes(1, new RateLimitedException("429", Duration.ofSeconds(10)))))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(19))
                .thenAwait(Duration.ofSeconds(1))
                .expectNext("ok")
                .verifyComplete();
    }

    @Test
    @DisplayName("Should time out slow calls")
    void shouldTimeOutSlowCalls() {
        handler.configure(RetryOperation.FORM_RESPONSE_PROCESSING, OperationRetryConfig.builder()
                .maxAttempts(1)
                .timeout(Duration.ofSeconds(2))
                .build());

        StepVerifier.withVirtualTime(() -> handler.execute(RetryOperation.FORM_RESPONSE_PROCESSING, "slow",
                        Mono::<String>never))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(2))
                .expectError(TimeoutException.class)
                .verify();
    }

    // ========================================
    // Circuit Breaker Tests
    // ========================================

    @Test
    @DisplayName("Should stop retrying once the circuit breaker opens")
    void shouldStopRetryingOnceCircuitBreakerOpens() {
        StepVerifier.withVirtualTime(() -> handler.execute(RetryOperation.DATABASE_OPERATION, "db",
                        () -> failingTimes(10, new IllegalStateException("db down"))))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(10))
                .expectErrorMessage("db down")
                .verify();

        assertThat(calls.get()).isEqualTo(3);
        assertThat(handler.getCircuitBreakers().get("db").getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("Should fail fast while the circuit breaker is open")
    void shouldFailFastWhileCircuitBreakerIsOpen() {
        handler.configure(RetryOperation.DATABASE_OPERATION, OperationRetryConfig.builder()
                .maxAttempts(1)
                .failureThreshold(1)
                .build());
        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db",
                        () -> failingTimes(10, new IllegalStateException("db down"))))
                .expectError(IllegalStateException.class)
                .verify();

        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db",
                        () -> failingTimes(0, new IllegalStateException())))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(CircuitBreakerOpenException.class)
                        .hasMessageContaining("db"))
                .verify();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should let a trial call through after the recovery timeout")
    void shouldLetTrialCallThroughAfterRecoveryTimeout() {
        handler.configure(RetryOperation.DATABASE_OPERATION, OperationRetryConfig.builder()
                .maxAttempts(1)
                .failureThreshold(1)
                .recoveryTimeout(Duration.ofMillis(100))
                .build());
        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db",
                        () -> failingTimes(1, new IllegalStateException("db down"))))
                .expectError(IllegalStateException.class)
                .verify();

        awaitRecovery();

        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db",
                        () -> failingTimes(1, new IllegalStateException())))
                .expectNext("ok")
                .verifyComplete();
        assertThat(handler.getCircuitBreakers().get("db").getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should recover after a cancelled trial call")
    void shouldRecoverAfterCancelledTrialCall() {
        handler.configure(RetryOperation.DATABASE_OPERATION, OperationRetryConfig.builder()
                .maxAttempts(1)
                .failureThreshold(1)
                .recoveryTimeout(Duration.ofMillis(100))
                .build());
        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db",
                        () -> Mono.<String>error(new IllegalStateException("db down"))))
                .expectError(IllegalStateException.class)
                .verify();
        awaitRecovery();

        Disposable trial = handler.execute(RetryOperation.DATABASE_OPERATION, "db", Mono::<String>never).subscribe();
        assertThat(handler.getCircuitBreakers().get("db").getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        trial.dispose();

        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db", () -> Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();
        assertThat(handler.getCircuitBreakers().get("db").getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should keep separate breakers per operation id")
    void shouldKeepSeparateBreakersPerOperationId() {
        handler.configure(RetryOperation.DATABASE_OPERATION, OperationRetryConfig.builder()
                .maxAttempts(1)
                .failureThreshold(1)
                .build());
        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db-a",
                        () -> Mono.error(new IllegalStateException("down"))))
                .expectError()
                .verify();

        StepVerifier.create(handler.execute(RetryOperation.DATABASE_OPERATION, "db-b", () -> Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();

        assertThat(handler.getCircuitBreakers()).containsKeys("db-a", "db-b");
    }

    // ========================================
    // Configuration and Statistics Tests
    // ========================================

    @Test
    @DisplayName("Should expose built-in operation configurations")
    void shouldExposeBuiltInOperationConfigurations() {
        OperationRetryConfig typeform = handler.getConfig(RetryOperation.TYPEFORM_API_REQUEST);

        assertThat(typeform.getMaxAttempts()).isEqualTo(5);
        assertThat(typeform.getInitialWait()).isEqualTo(Duration.ofSeconds(2));
        assertThat(typeform.getRetryAfterMultiplier()).isEqualTo(2.0);
        assertThat(handler.getConfig(RetryOperation.DATABASE_OPERATION).getFailureThreshold()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should apply configuration overrides")
    void shouldApplyConfigurationOverrides() {
        ResilientRetryHandler custom = new ResilientRetryHandler(OperationRetryConfig.defaults(),
                Map.of(RetryOperation.WEBHOOK_PROCESSING, OperationRetryConfig.builder().maxAttempts(1).build()),
                CircuitBreakerRegistry.ofDefaults(), () -> 0.5);

        StepVerifier.create(custom.execute(RetryOperation.WEBHOOK_PROCESSING, "relay",
                        () -> failingTimes(1, new IllegalStateException("503"))))
                .expectError(IllegalStateException.class)
                .verify();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should collect attempt statistics per operation")
    void shouldCollectAttemptStatisticsPerOperation() {
        StepVerifier.withVirtualTime(() -> handler.execute(RetryOperation.WEBHOOK_PROCESSING, "relay",
                        () -> failingTimes(1, new IllegalStateException("503"))))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(1))
                .expectNext("ok")
                .verifyComplete();

        RetryStatistics statistics = handler.getStatistics();
        assertThat(statistics.getTotalAttempts()).isEqualTo(2);
        assertThat(statistics.getFailedAttempts()).isEqualTo(1);
        assertThat(statistics.getRecentFailures()).isEqualTo(1);
        assertThat(statistics.getOperations().get(RetryOperation.WEBHOOK_PROCESSING).getSuccessRate())
                .isEqualTo(0.5);
        assertThat(statistics.getCircuitBreakers().get("relay").getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(handler.getStatistics(RetryOperation.DATABASE_OPERATION).getTotalAttempts()).isZero();
    }
}
