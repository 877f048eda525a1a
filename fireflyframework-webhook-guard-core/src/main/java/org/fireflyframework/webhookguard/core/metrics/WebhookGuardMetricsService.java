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

package org.fireflyframework.webhookguard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.retry.RetryEventType;
import org.fireflyframework.webhookguard.core.retry.RetryMetricsCollector;
import org.fireflyframework.webhookguard.core.retry.RetryMetricsEvent;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for recording webhook verification and retry metrics using Micrometer.
 * <p>
 * Also serves as the retry manager's {@link RetryMetricsCollector}.
 */
@Service
@Slf4j
public class WebhookGuardMetricsService implements RetryMetricsCollector {

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> verificationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<RetryEventType, Counter> retryEventCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> disabledCounters = new ConcurrentHashMap<>();
    private final Timer attemptTimer;

    public WebhookGuardMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.attemptTimer = Timer.builder("webhooks.retry.attempt.duration")
                .description("Duration of webhook retry delivery attempts")
                .register(meterRegistry);
    }

    /**
     * Records the outcome of an inbound verification.
     *
     * @param outcome accepted, rejected, skipped or error
     * @param reason  the failure tag, or "none"
     */
    public void recordVerification(String outcome, String reason) {
        getVerificationCounter(outcome, reason != null ? reason : "none").increment();
        log.debug("Recorded verification outcome: {}, reason: {}", outcome, reason);
    }

    /**
     * Records payload size.
     *
     * @param sizeBytes the payload size in bytes
     */
    public void recordPayloadSize(long sizeBytes) {
        meterRegistry.summary("webhooks.payload.size").record(sizeBytes);
    }

    @Override
    public void collect(RetryMetricsEvent event) {
        getRetryEventCounter(event.getType()).increment();

        switch (event.getType()) {
            case ATTEMPT_SUCCEEDED, ATTEMPT_FAILED -> {
                getAttemptCounter(event.getType() == RetryEventType.ATTEMPT_SUCCEEDED ? "success" : "failure")
                        .increment();
                if (event.getDurationMs() != null) {
                    attemptTimer.record(Duration.ofMillis(event.getDurationMs()));
                }
            }
            case IMMEDIATELY_DISABLED, PERMANENTLY_DISABLED, MAX_RETRIES_EXCEEDED -> {
                String reason = event.getPermanentFailureReason() != null
                        ? event.getPermanentFailureReason().name().toLowerCase()
                        : "unknown";
                getDisabledCounter(reason).increment();
            }
            default -> {
                // counted above
            }
        }
        log.debug("Recorded retry event {} for webhook {}", event.getType(), event.getWebhookId());
    }

    // Counter getters with lazy initialization

    private Counter getVerificationCounter(String outcome, String reason) {
        String key = outcome + ":" + reason;
        return verificationCounters.computeIfAbsent(key, k ->
                Counter.builder("webhooks.verification")
                        .description("Inbound webhook verification outcomes")
                        .tag("outcome", outcome)
                        .tag("reason", reason)
                        .register(meterRegistry)
        );
    }

    private Counter getRetryEventCounter(RetryEventType type) {
        return retryEventCounters.computeIfAbsent(type, t ->
                Counter.builder("webhooks.retry.events")
                        .description("Webhook retry lifecycle events")
                        .tag("type", t.tagValue())
                        .register(meterRegistry)
        );
    }

    private Counter getAttemptCounter(String outcome) {
        return attemptCounters.computeIfAbsent(outcome, o ->
                Counter.builder("webhooks.retry.attempts")
                        .description("Webhook retry delivery attempts")
                        .tag("outcome", o)
                        .register(meterRegistry)
        );
    }

    private Counter getDisabledCounter(String reason) {
        return disabledCounters.computeIfAbsent(reason, r ->
                Counter.builder("webhooks.retry.disabled")
                        .description("Webhooks that left the retry queue without success")
                        .tag("reason", r)
                        .register(meterRegistry)
        );
    }
}
