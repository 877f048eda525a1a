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

import lombok.Data;
import org.fireflyframework.webhookguard.core.resilience.OperationRetryConfig;
import org.fireflyframework.webhookguard.core.resilience.RetryOperation;
import org.fireflyframework.webhookguard.core.retry.RetryPolicyConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for webhook retry delivery.
 * <p>
 * The policy fields are converted into an immutable, validated {@link RetryPolicyConfig}.
 * Per-operation overrides tune the generic resilient retry handler.
 */
@Configuration
@ConfigurationProperties(prefix = "firefly.webhook-guard.retry")
@Data
public class RetryProperties {

    /**
     * Delay before the first retry
     */
    private Duration initialRetryInterval = Duration.ofMinutes(2);

    /**
     * Upper bound of the backoff delay, at most 2 hours
     */
    private Duration maxRetryInterval = Duration.ofMinutes(60);

    /**
     * Multiplier for exponential backoff
     * <p>
     * Delay calculation: min(initialRetryInterval * (multiplier ^ attempt), maxRetryInterval)
     */
    private double exponentialBackoffMultiplier = 2.0;

    /**
     * Symmetric jitter in percent (0 to 50)
     */
    private double jitterPercentage = 25.0;

    /**
     * How long after the first failure a webhook may still be retried
     */
    private Duration maxRetryDuration = Duration.ofHours(10);

    private int maxTotalAttempts = 20;

    /**
     * Status codes that disable a webhook without further retries
     */
    private Set<Integer> immediateDisableStatusCodes = new LinkedHashSet<>(Set.of(404, 410));

    /**
     * Status codes expected to recover on retry; other failures are retried too but logged as unexpected
     */
    private Set<Integer> retryOnStatusCodes = new LinkedHashSet<>(Set.of(408, 429, 500, 502, 503, 504));

    /**
     * Failure rate in percent at which a webhook is disabled
     */
    private double failureRateDisableThreshold = 100.0;

    private Duration failureRateEvaluationWindow = Duration.ofHours(24);

    /**
     * Attempts required before the failure rate is evaluated
     */
    private int minimumSampleSize = 5;

    /**
     * Attempts required inside the evaluation window before the failure rate is evaluated
     */
    private int minimumAttemptsInWindow = 3;

    /**
     * Timeout of a single delivery attempt
     */
    private Duration executorTimeout = Duration.ofSeconds(30);

    /**
     * Deliveries run concurrently within one processing pass
     */
    private int processingConcurrency = 4;

    /**
     * Interval of the periodic retry driver
     */
    private Duration processingInterval = Duration.ofMinutes(1);

    private boolean processingEnabled = true;

    /**
     * Per-operation overrides of the resilient retry handler
     * <p>
     * Example:
     * <pre>
     * firefly:
     *   webhook-guard:
     *     retry:
     *       operations:
     *         webhook-processing:
     *           max-attempts: 5
     *           initial-wait: PT1S
     * </pre>
     */
    private Map<RetryOperation, OperationOverride> operations = new EnumMap<>(RetryOperation.class);

    public RetryPolicyConfig toPolicyConfig() {
        return RetryPolicyConfig.builder()
                .initialRetryInterval(initialRetryInterval)
                .maxRetryInterval(maxRetryInterval)
                .exponentialBackoffMultiplier(exponentialBackoffMultiplier)
                .jitterPercentage(jitterPercentage)
                .maxRetryDuration(maxRetryDuration)
                .maxTotalAttempts(maxTotalAttempts)
                .immediateDisableStatusCodes(immediateDisableStatusCodes)
                .retryOnStatusCodes(retryOnStatusCodes)
                .failureRateDisableThreshold(failureRateDisableThreshold)
                .failureRateEvaluationWindow(failureRateEvaluationWindow)
                .minimumSampleSize(minimumSampleSize)
                .minimumAttemptsInWindow(minimumAttemptsInWindow)
                .build();
    }

    /**
     * Applies the configured overrides on top of the built-in operation configurations.
     */
    public Map<RetryOperation, OperationRetryConfig> toOperationConfigs() {
        Map<RetryOperation, OperationRetryConfig> base = OperationRetryConfig.builtIn();
        Map<RetryOperation, OperationRetryConfig> result = new EnumMap<>(RetryOperation.class);
        operations.forEach((operation, override) -> result.put(operation,
                override.applyTo(base.getOrDefault(operation, OperationRetryConfig.defaults()))));
        return result;
    }

    /**
     * Override of an operation's retry configuration. Unset fields keep the built-in value.
     */
    @Data
    public static class OperationOverride {
        private Integer maxAttempts;
        private Duration initialWait;
        private Duration maxWait;
        private Double multiplier;
        private Double jitterPercentage;
        private Boolean respectRetryAfter;
        private Double retryAfterMultiplier;
        private Integer failureThreshold;
        private Duration recoveryTimeout;
        private Duration timeout;

        OperationRetryConfig applyTo(OperationRetryConfig base) {
            OperationRetryConfig.OperationRetryConfigBuilder builder = base.toBuilder();
            if (maxAttempts != null) {
                builder.maxAttempts(maxAttempts);
            }
            if (initialWait != null) {
                builder.initialWait(initialWait);
            }
            if (maxWait != null) {
                builder.maxWait(maxWait);
            }
            if (multiplier != null) {
                builder.multiplier(multiplier);
            }
            if (jitterPercentage != null) {
                builder.jitterPercentage(jitterPercentage);
            }
            if (respectRetryAfter != null) {
                builder.respectRetryAfter(respectRetryAfter);
            }
            if (retryAfterMultiplier != null) {
                builder.retryAfterMultiplier(retryAfterMultiplier);
            }
            if (failureThreshold != null) {
                builder.failureThreshold(failureThreshold);
            }
            if (recoveryTimeout != null) {
                builder.recoveryTimeout(recoveryTimeout);
            }
            if (timeout != null) {
                builder.timeout(timeout);
            }
            return builder.build();
        }
    }
}
