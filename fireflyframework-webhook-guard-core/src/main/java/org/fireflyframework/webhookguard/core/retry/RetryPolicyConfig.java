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

package org.fireflyframework.webhookguard.core.retry;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable retry policy for failed webhook deliveries.
 * <p>
 * Values are validated on construction; an invalid combination throws
 * {@link IllegalArgumentException} so a misconfigured service fails at startup.
 * Backoff for attempt {@code n} is {@code min(initial * multiplier^n, maxInterval)},
 * randomized by {@code +/- jitterPercentage}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicyConfig {

    static final Duration MAX_ALLOWED_RETRY_INTERVAL = Duration.ofHours(2);
    static final double MAX_ALLOWED_MULTIPLIER = 5.0;
    static final double MAX_ALLOWED_JITTER_PERCENTAGE = 50.0;
    static final int MIN_ALLOWED_ATTEMPTS = 3;
    static final int MAX_ALLOWED_ATTEMPTS = 50;

    private final Duration initialRetryInterval;
    private final Duration maxRetryInterval;
    private final double exponentialBackoffMultiplier;
    private final double jitterPercentage;
    private final Duration maxRetryDuration;
    private final int maxTotalAttempts;
    private final Set<Integer> immediateDisableStatusCodes;
    private final Set<Integer> retryOnStatusCodes;
    private final double failureRateDisableThreshold;
    private final Duration failureRateEvaluationWindow;
    private final int minimumSampleSize;
    private final int minimumAttemptsInWindow;

    @Builder(toBuilder = true)
    private RetryPolicyConfig(Duration initialRetryInterval,
                              Duration maxRetryInterval,
                              double exponentialBackoffMultiplier,
                              double jitterPercentage,
                              Duration maxRetryDuration,
                              int maxTotalAttempts,
                              Set<Integer> immediateDisableStatusCodes,
                              Set<Integer> retryOnStatusCodes,
                              double failureRateDisableThreshold,
                              Duration failureRateEvaluationWindow,
                              int minimumSampleSize,
                              int minimumAttemptsInWindow) {
        requirePositive(initialRetryInterval, "initialRetryInterval");
        requirePositive(maxRetryInterval, "maxRetryInterval");
        if (initialRetryInterval.compareTo(maxRetryInterval) >= 0) {
            throw new IllegalArgumentException("initialRetryInterval (" + initialRetryInterval
                    + ") must be shorter than maxRetryInterval (" + maxRetryInterval + ")");
        }
        if (maxRetryInterval.compareTo(MAX_ALLOWED_RETRY_INTERVAL) > 0) {
            throw new IllegalArgumentException("maxRetryInterval must not exceed " + MAX_ALLOWED_RETRY_INTERVAL
                    + ", was " + maxRetryInterval);
        }
        if (!(exponentialBackoffMultiplier > 1.0) || exponentialBackoffMultiplier > MAX_ALLOWED_MULTIPLIER) {
            throw new IllegalArgumentException("exponentialBackoffMultiplier must be in (1.0, "
                    + MAX_ALLOWED_MULTIPLIER + "], was " + exponentialBackoffMultiplier);
        }
        if (jitterPercentage < 0 || jitterPercentage > MAX_ALLOWED_JITTER_PERCENTAGE) {
            throw new IllegalArgumentException("jitterPercentage must be in [0, "
                    + MAX_ALLOWED_JITTER_PERCENTAGE + "], was " + jitterPercentage);
        }
        requirePositive(maxRetryDuration, "maxRetryDuration");
        if (maxTotalAttempts < MIN_ALLOWED_ATTEMPTS || maxTotalAttempts > MAX_ALLOWED_ATTEMPTS) {
            throw new IllegalArgumentException("maxTotalAttempts must be in [" + MIN_ALLOWED_ATTEMPTS + ", "
                    + MAX_ALLOWED_ATTEMPTS + "], was " + maxTotalAttempts);
        }
        if (failureRateDisableThreshold < 0 || failureRateDisableThreshold > 100) {
            throw new IllegalArgumentException("failureRateDisableThreshold must be in [0, 100], was "
                    + failureRateDisableThreshold);
        }
        requirePositive(failureRateEvaluationWindow, "failureRateEvaluationWindow");
        if (minimumSampleSize < 1) {
            throw new IllegalArgumentException("minimumSampleSize must be at least 1, was " + minimumSampleSize);
        }
        if (minimumAttemptsInWindow < 0) {
            throw new IllegalArgumentException("minimumAttemptsInWindow must not be negative, was "
                    + minimumAttemptsInWindow);
        }

        this.initialRetryInterval = initialRetryInterval;
        this.maxRetryInterval = maxRetryInterval;
        this.exponentialBackoffMultiplier = exponentialBackoffMultiplier;
        this.jitterPercentage = jitterPercentage;
        this.maxRetryDuration = maxRetryDuration;
        this.maxTotalAttempts = maxTotalAttempts;
        this.immediateDisableStatusCodes = immediateDisableStatusCodes == null
                ? Set.of() : Set.copyOf(immediateDisableStatusCodes);
        this.retryOnStatusCodes = retryOnStatusCodes == null ? Set.of() : Set.copyOf(retryOnStatusCodes);
        this.failureRateDisableThreshold = failureRateDisableThreshold;
        this.failureRateEvaluationWindow = failureRateEvaluationWindow;
        this.minimumSampleSize = minimumSampleSize;
        this.minimumAttemptsInWindow = minimumAttemptsInWindow;
    }

    /**
     * Returns the default policy: 2 minutes doubling up to 1 hour with 25% jitter,
     * at most 20 attempts over 10 hours, 404 and 410 disable immediately.
     *
     * @return the default policy
     */
    public static RetryPolicyConfig defaults() {
        return builder().build();
    }

    public boolean isImmediateDisableStatus(Integer statusCode) {
        return statusCode != null && immediateDisableStatusCodes.contains(statusCode);
    }

    /**
     * Whether {@code statusCode} is one of the statuses expected to recover on retry.
     * Statuses outside this set are still retried unless they disable immediately,
     * so the set only separates expected from unexpected failures.
     */
    public boolean isRetryableStatus(Integer statusCode) {
        return statusCode != null && retryOnStatusCodes.contains(statusCode);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }

    /**
     * Builder pre-populated with the default policy values.
     */
    public static class RetryPolicyConfigBuilder {
        private Duration initialRetryInterval = Duration.ofMinutes(2);
        private Duration maxRetryInterval = Duration.ofMinutes(60);
        private double exponentialBackoffMultiplier = 2.0;
        private double jitterPercentage = 25.0;
        private Duration maxRetryDuration = Duration.ofHours(10);
        private int maxTotalAttempts = 20;
        private Set<Integer> immediateDisableStatusCodes = Set.of(404, 410);
        private Set<Integer> retryOnStatusCodes = Set.of(408, 429, 500, 502, 503, 504);
        private double failureRateDisableThreshold = 100.0;
        private Duration failureRateEvaluationWindow = Duration.ofHours(24);
        private int minimumSampleSize = 5;
        private int minimumAttemptsInWindow = 3;
    }
}
