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
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.webhookguard.core.retry.RetryEventType;
import org.fireflyframework.webhookguard.core.retry.RetryMetricsEvent;
import org.fireflyframework.webhookguard.interfaces.enums.PermanentFailureReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebhookGuardMetricsService Tests")
class WebhookGuardMetricsServiceTest {

    private WebhookGuardMetricsService metricsService;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new WebhookGuardMetricsService(meterRegistry);
    }

    private RetryMetricsEvent event(RetryEventType type) {
        return RetryMetricsEvent.builder()
                .type(type)
                .timestamp(Instant.now())
                .webhookId("wh-1")
                .build();
    }

    // ========================================
    // Verification Metrics Tests
    // ========================================

    @Test
    @DisplayName("Should record verification outcome with reason")
    void shouldRecordVerificationOutcomeWithReason() {
        metricsService.recordVerification("rejected", "signature_mismatch");
        metricsService.recordVerification("rejected", "signature_mismatch");
        metricsService.recordVerification("accepted", "none");

        Counter rejected = meterRegistry.find("webhooks.verification")
                .tag("outcome", "rejected")
                .tag("reason", "signature_mismatch")
                .counter();
        Counter accepted = meterRegistry.find("webhooks.verification")
                .tag("outcome", "accepted")
                .counter();

        assertThat(rejected).isNotNull();
        assertThat(rejected.count()).isEqualTo(2.0);
        assertThat(accepted).isNotNull();
        assertThat(accepted.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should default a missing reason to none")
    void shouldDefaultMissingReasonToNone() {
        metricsService.recordVerification("skipped", null);

        assertThat(meterRegistry.find("webhooks.verification").tag("reason", "none").counter()).isNotNull();
    }

    @Test
    @DisplayName("Should record payload size")
    void shouldRecordPayloadSize() {
        metricsService.recordPayloadSize(1024);
        metricsService.recordPayloadSize(2048);

        DistributionSummary summary = meterRegistry.find("webhooks.payload.size").summary();

        assertThat(summary).isNotNull();
        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isEqualTo(3072.0);
    }

    // ========================================
    // Retry Event Metrics Tests
    // ========================================

    @Test
    @DisplayName("Should count retry events by type")
    void shouldCountRetryEventsByType() {
        metricsService.collect(event(RetryEventType.RETRY_SCHEDULED));
        metricsService.collect(event(RetryEventType.RETRY_SCHEDULED));
        metricsService.collect(event(RetryEventType.PROCESSING_SUMMARY));

        assertThat(meterRegistry.find("webhooks.retry.events").tag("type", "retry_scheduled").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.find("webhooks.retry.events").tag("type", "processing_summary").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record attempt outcomes and durations")
    void shouldRecordAttemptOutcomesAndDurations() {
        metricsService.collect(RetryMetricsEvent.builder()
                .type(RetryEventType.ATTEMPT_SUCCEEDED)
                .webhookId("wh-1")
                .statusCode(200)
                .durationMs(150L)
                .build());
        metricsService.collect(RetryMetricsEvent.builder()
                .type(RetryEventType.ATTEMPT_FAILED)
                .webhookId("wh-2")
                .statusCode(503)
                .durationMs(250L)
                .build());

        assertThat(meterRegistry.find("webhooks.retry.attempts").tag("outcome", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.find("webhooks.retry.attempts").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);

        Timer timer = meterRegistry.find("webhooks.retry.attempt.duration").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400.0);
    }

    @Test
    @DisplayName("Should count disabled webhooks by reason")
    void shouldCountDisabledWebhooksByReason() {
        metricsService.collect(RetryMetricsEvent.builder()
                .type(RetryEventType.IMMEDIATELY_DISABLED)
                .webhookId("wh-1")
                .permanentFailureReason(PermanentFailureReason.HTTP_410_GONE)
                .build());
        metricsService.collect(RetryMetricsEvent.builder()
                .type(RetryEventType.MAX_RETRIES_EXCEEDED)
                .webhookId("wh-2")
                .permanentFailureReason(PermanentFailureReason.MAX_RETRIES_EXCEEDED)
                .build());
        metricsService.collect(event(RetryEventType.PERMANENTLY_DISABLED));

        assertThat(meterRegistry.find("webhooks.retry.disabled").tag("reason", "http_410_gone").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.find("webhooks.retry.disabled").tag("reason", "max_retries_exceeded").counter()
                .count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("webhooks.retry.disabled").tag("reason", "unknown").counter().count())
                .isEqualTo(1.0);
    }
}
