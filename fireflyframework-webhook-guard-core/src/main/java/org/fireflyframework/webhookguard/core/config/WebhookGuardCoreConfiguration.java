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

import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.ratelimit.OutboundRateLimiter;
import org.fireflyframework.webhookguard.core.ratelimit.RateLimitedWebhookExecutor;
import org.fireflyframework.webhookguard.core.retry.RetryMetricsCollector;
import org.fireflyframework.webhookguard.core.retry.RetryPolicyConfig;
import org.fireflyframework.webhookguard.core.retry.WebhookExecutor;
import org.fireflyframework.webhookguard.core.retry.WebhookRetryManager;
import org.fireflyframework.webhookguard.core.retry.strategy.ExponentialBackoffStrategy;
import org.fireflyframework.webhookguard.core.retry.strategy.RetryStrategy;
import org.fireflyframework.webhookguard.core.security.InMemoryReplayCache;
import org.fireflyframework.webhookguard.core.security.ReplayCache;
import org.fireflyframework.webhookguard.core.security.TypeformSignatureVerifier;
import org.fireflyframework.webhookguard.core.security.VerificationFailureTracker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the verification, rate limiting and retry components.
 * <p>
 * The application must provide a {@link WebhookExecutor} bean performing the actual deliveries.
 */
@Configuration
@Slf4j
public class WebhookGuardCoreConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Process-wide replay cache shared by every verifier.
     */
    @Bean
    @ConditionalOnMissingBean(ReplayCache.class)
    public ReplayCache replayCache(WebhookSecurityProperties securityProperties, Clock clock) {
        return new InMemoryReplayCache(securityProperties.getReplayWindow(),
                securityProperties.getReplayCacheMaxEntries(), clock);
    }

    @Bean
    public TypeformSignatureVerifier typeformSignatureVerifier(WebhookSecurityProperties securityProperties,
                                                               ReplayCache replayCache, Clock clock) {
        return new TypeformSignatureVerifier(securityProperties, replayCache, clock);
    }

    @Bean
    public VerificationFailureTracker verificationFailureTracker(WebhookSecurityProperties securityProperties,
                                                                 Clock clock) {
        return new VerificationFailureTracker(securityProperties.getAlert(), clock);
    }

    @Bean
    public OutboundRateLimiter outboundRateLimiter(RateLimitProperties rateLimitProperties, Clock clock) {
        return new OutboundRateLimiter(rateLimitProperties.getRequestsPerSecond(), clock);
    }

    @Bean
    public RetryPolicyConfig retryPolicyConfig(RetryProperties retryProperties) {
        return retryProperties.toPolicyConfig();
    }

    @Bean
    public RetryStrategy retryBackoffStrategy(RetryPolicyConfig retryPolicyConfig) {
        return ExponentialBackoffStrategy.forPolicy(retryPolicyConfig);
    }

    @Bean
    public WebhookRetryManager webhookRetryManager(RetryPolicyConfig retryPolicyConfig,
                                                   WebhookExecutor webhookExecutor,
                                                   RetryMetricsCollector retryMetricsCollector,
                                                   RetryStrategy retryBackoffStrategy,
                                                   TimeLimiter retryExecutorTimeLimiter,
                                                   RetryProperties retryProperties,
                                                   RateLimitProperties rateLimitProperties,
                                                   OutboundRateLimiter outboundRateLimiter,
                                                   Clock clock) {
        WebhookExecutor executor = rateLimitProperties.isApplyToRetries()
                ? new RateLimitedWebhookExecutor(webhookExecutor, outboundRateLimiter)
                : webhookExecutor;
        return new WebhookRetryManager(retryPolicyConfig, executor, retryMetricsCollector,
                retryBackoffStrategy, retryExecutorTimeLimiter, retryProperties.getProcessingConcurrency(), clock);
    }
}
