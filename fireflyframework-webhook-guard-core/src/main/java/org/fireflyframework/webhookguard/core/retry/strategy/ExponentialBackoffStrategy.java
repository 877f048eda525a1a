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

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Exponential backoff with symmetric jitter.
 * <p>
 * Delay calculation: {@code min(initial * multiplier^n, max) * (1 + U(-jitter, +jitter) / 100)}.
 */
public class ExponentialBackoffStrategy implements RetryStrategy {

    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double multiplier;
    private final double jitterPercentage;
    private final int maxAttempts;
    private final Predicate<Throwable> retryableError;
    private final DoubleSupplier random;

    public ExponentialBackoffStrategy(Duration initialInterval,
                                      Duration maxInterval,
                                      double multiplier,
                                      double jitterPercentage,
                                      int maxAttempts,
                                      Predicate<Throwable> retryableError,
                                      DoubleSupplier random) {
        this.initialInterval = Objects.requireNonNull(initialInterval, "initialInterval");
        this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval");
        this.multiplier = multiplier;
        this.jitterPercentage = jitterPercentage;
        this.maxAttempts = maxAttempts;
        this.retryableError = Objects.requireNonNull(retryableError, "retryableError");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Strategy matching a webhook retry policy. Every error is retryable, the
     * attempt budget is the policy's {@code maxTotalAttempts}.
     */
    public static ExponentialBackoffStrategy forPolicy(RetryPolicyConfig policy) {
        return forPolicy(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    public static ExponentialBackoffStrategy forPolicy(RetryPolicyConfig policy, DoubleSupplier random) {
        return new ExponentialBackoffStrategy(
                policy.getInitialRetryInterval(),
                policy.getMaxRetryInterval(),
                policy.getExponentialBackoffMultiplier(),
                policy.getJitterPercentage(),
                policy.getMaxTotalAttempts(),
                error -> true,
                random);
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable error) {
        if (attempt >= maxAttempts) {
            return false;
        }
        return error == null || retryableError.test(error);
    }

    @Override
    public Duration nextDelay(int attempt) {
        double base = baseDelayMillis(attempt);
        double jitter = (random.getAsDouble() * 2 - 1) * jitterPercentage / 100.0;
        return Duration.ofMillis(Math.max(0L, Math.round(base * (1 + jitter))));
    }

    /**
     * The capped exponential delay before jitter is applied.
     *
     * @param attempt zero-based retry index
     * @return the delay without jitter
     */
    public Duration baseDelay(int attempt) {
        return Duration.ofMillis(Math.round(baseDelayMillis(attempt)));
    }

    private double baseDelayMillis(int attempt) {
        double delay = initialInterval.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        return Math.min(delay, maxInterval.toMillis());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
