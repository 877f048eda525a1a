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


package org.fireflyframework.webhookguard.core.retry.strategy;

import org.fireflyframework.webhookguard.core.retry.RetryPolicyConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExponentialBackoffStrategy Tests")
class ExponentialBackoffStrategyTest {

    private final RetryPolicyConfig policy = RetryPolicyConfig.defaults();

    @Test
    @DisplayName("Should double the delay from the initial interval")
    void shouldDoubleDelayFromInitialInterval() {
        ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.forPolicy(policy, () -> 0.5);

        assertThat(strategy.nextDelay(0)).isEqualTo(Duration.ofMinutes(2));
        assertThat(strategy.nextDelay(1)).isEqualTo(Duration.ofMinutes(4));
        assertThat(strategy.nextDelay(2)).isEqualTo(Duration.ofMinutes(8));
        assertThat(strategy.nextDelay(4)).isEqualTo(Duration.ofMinutes(32));
    }

    @Test
    @DisplayName("Should cap the delay at the max interval")
    void shouldCapDelayAtMaxInterval() {
        ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.forPolicy(policy, () -> 0.5);

        assertThat(strategy.nextDelay(5)).isEqualTo(Duration.ofMinutes(60));
        assertThat(strategy.nextDelay(19)).isEqualTo(Duration.ofMinutes(60));
        assertThat(strategy.baseDelay(30)).isEqualTo(Duration.ofMinutes(60));
    }

    @Test
    @DisplayName("Should apply jitter symmetrically around the base delay")
    void shouldApplyJitterSymmetrically() {
        ExponentialBackoffStrategy low = ExponentialBackoffStrategy.forPolicy(policy, () -> 0.0);
        ExponentialBackoffStrategy high = ExponentialBackoffStrategy.forPolicy(policy, () -> 1.0);

        assertThat(low.nextDelay(0)).isEqualTo(Duration.ofSeconds(90));
        assertThat(high.nextDelay(0)).isEqualTo(Duration.ofSeconds(150));
    }

    @Test
    @DisplayName("Should keep jittered delays within bounds")
    void shouldKeepJitteredDelaysWithinBounds() {
        ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.forPolicy(policy);

        for (int i = 0; i < 200; i++) {
            Duration delay = strategy.nextDelay(1);
            assertThat(delay).isBetween(Duration.ofSeconds(180), Duration.ofSeconds(300));
        }
    }

    @Test
    @DisplayName("Should treat zero jitter as deterministic")
    void shouldTreatZeroJitterAsDeterministic() {
        RetryPolicyConfig noJitter = policy.toBuilder().jitterPercentage(0).build();
        ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.forPolicy(noJitter, () -> 0.9);

        assertThat(strategy.nextDelay(1)).isEqualTo(strategy.baseDelay(1));
    }

    @Test
    @DisplayName("Should stop retrying at the attempt budget")
    void shouldStopRetryingAtAttemptBudget() {
        ExponentialBackoffStrategy strategy = ExponentialBackoffStrategy.forPolicy(policy, () -> 0.5);

        assertThat(strategy.getMaxAttempts()).isEqualTo(20);
        assertThat(strategy.shouldRetry(19, null)).isTrue();
        assertThat(strategy.shouldRetry(20, null)).isFalse();
        assertThat(strategy.shouldRetry(3, new RuntimeException("boom"))).isTrue();
    }

    @Test
    @DisplayName("Should not retry errors rejected by the predicate")
    void shouldNotRetryErrorsRejectedByPredicate() {
        ExponentialBackoffStrategy strategy = new ExponentialBackoffStrategy(Duration.ofSeconds(1),
                Duration.ofSeconds(10), 2.0, 0, 5, error -> !(error instanceof IllegalStateException), () -> 0.5);

        assertThat(strategy.shouldRetry(1, new IllegalStateException())).isFalse();
        assertThat(strategy.shouldRetry(1, new RuntimeException())).isTrue();
        assertThat(strategy.nextDelay(2)).isEqualTo(Duration.ofSeconds(4));
    }
}
