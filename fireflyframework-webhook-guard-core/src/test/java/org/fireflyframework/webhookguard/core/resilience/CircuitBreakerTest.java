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
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.fireflyframework.webhookguard.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Operation circuit breaker Tests")
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        breaker = breaker("typeform-api", 3, Duration.ofMinutes(1));
    }

    private CircuitBreaker breaker(String name, int failureThreshold, Duration recoveryTimeout) {
        OperationRetryConfig config = OperationRetryConfig.builder()
                .failureThreshold(failureThreshold)
                .recoveryTimeout(recoveryTimeout)
                .build();
        return new CircuitBreakerStateMachine(name, config.toCircuitBreakerConfig(), clock);
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThat(breaker.tryAcquirePermission()).isTrue();
            breaker.onError(0, TimeUnit.MILLISECONDS, new IllegalStateException("down"));
        }
    }

    private void succeed() {
        assertThat(breaker.tryAcquirePermission()).isTrue();
        breaker.onSuccess(0, TimeUnit.MILLISECONDS);
    }

    @Test
    @DisplayName("Should start closed")
    void shouldStartClosed() {
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.tryAcquirePermission()).isTrue();
        assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isZero();
    }

    @Test
    @DisplayName("Should open after consecutive failures reach the threshold")
    void shouldOpenAfterConsecutiveFailures() {
        failTimes(2);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        failTimes(1);

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.tryAcquirePermission()).isFalse();
    }

    @Test
    @DisplayName("Should stay closed when a success interrupts the failures")
    void shouldStayClosedWhenSuccessInterruptsFailures() {
        failTimes(2);
        succeed();

        failTimes(2);

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should admit a single trial call after the recovery timeout")
    void shouldAdmitSingleTrialCallAfterRecoveryTimeout() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(59));
        assertThat(breaker.tryAcquirePermission()).isFalse();

        clock.advance(Duration.ofSeconds(2));

        assertThat(breaker.tryAcquirePermission()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(breaker.tryAcquirePermission()).isFalse();
    }

    @Test
    @DisplayName("Should close when the trial call succeeds")
    void shouldCloseWhenTrialCallSucceeds() {
        failTimes(3);
        clock.advance(Duration.ofMinutes(2));

        succeed();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isZero();
        assertThat(breaker.tryAcquirePermission()).isTrue();
    }

    @Test
    @DisplayName("Should reopen when the trial call fails")
    void shouldReopenWhenTrialCallFails() {
        failTimes(3);
        clock.advance(Duration.ofMinutes(2));

        failTimes(1);

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.tryAcquirePermission()).isFalse();
        clock.advance(Duration.ofMinutes(2));
        assertThat(breaker.tryAcquirePermission()).isTrue();
    }

    @Test
    @DisplayName("Should hand the trial permission back when the trial call is cancelled")
    void shouldHandTrialPermissionBackWhenTrialCallCancelled() {
        breaker = breaker("db", 1, Duration.ofMinutes(1));
        StepVerifier.create(Mono.error(new IllegalStateException("down"))
                        .transformDeferred(CircuitBreakerOperator.of(breaker)))
                .expectError(IllegalStateException.class)
                .verify();
        clock.advance(Duration.ofMinutes(2));

        Disposable trial = Mono.never()
                .transformDeferred(CircuitBreakerOperator.of(breaker))
                .subscribe();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        trial.dispose();
        clock.advance(Duration.ofHours(5));

        StepVerifier.create(Mono.just("ok").transformDeferred(CircuitBreakerOperator.of(breaker)))
                .expectNext("ok")
                .verifyComplete();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should reject a threshold below one")
    void shouldRejectThresholdBelowOne() {
        OperationRetryConfig config = OperationRetryConfig.builder().failureThreshold(0).build();

        assertThatThrownBy(config::toCircuitBreakerConfig)
                .isInstanceOf(IllegalArgumentException.class);
    }
}
