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


package org.fireflyframework.webhookguard.web.controllers;

import org.fireflyframework.webhookguard.core.ratelimit.OutboundRateLimiter;
import org.fireflyframework.webhookguard.core.retry.WebhookRetryManager;
import org.fireflyframework.webhookguard.interfaces.dto.RateLimitStatusDTO;
import org.fireflyframework.webhookguard.interfaces.dto.RetryProcessingSummaryDTO;
import org.fireflyframework.webhookguard.interfaces.dto.RetryQueueStatusDTO;
import org.fireflyframework.webhookguard.interfaces.dto.WebhookRetryRecordDTO;
import org.fireflyframework.webhookguard.interfaces.enums.RetryStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;

@WebFluxTest(RetryManagementController.class)
@DisplayName("RetryManagementController Tests")
class RetryManagementControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private WebhookRetryManager retryManager;

    @MockBean
    private OutboundRateLimiter rateLimiter;

    @Test
    @DisplayName("Should return the retry record of a known webhook")
    void shouldReturnRetryRecordOfKnownWebhook() {
        when(retryManager.getRetryStatus("wh-1")).thenReturn(Optional.of(WebhookRetryRecordDTO.builder()
                .webhookId("wh-1")
                .formId("form-1")
                .retryStatus(RetryStatus.PENDING)
                .totalAttempts(2)
                .build()));

        webTestClient.get()
                .uri("/api/v1/webhooks/retries/{id}", "wh-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.webhookId").isEqualTo("wh-1")
                .jsonPath("$.retryStatus").isEqualTo("PENDING")
                .jsonPath("$.totalAttempts").isEqualTo(2);
    }

    @Test
    @DisplayName("Should answer 404 for an unknown webhook")
    void shouldAnswer404ForUnknownWebhook() {
        when(retryManager.getRetryStatus("missing")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/webhooks/retries/{id}", "missing")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Should return the queue status")
    void shouldReturnQueueStatus() {
        when(retryManager.getQueueStatus()).thenReturn(RetryQueueStatusDTO.builder()
                .queueSize(3)
                .totalRecords(4)
                .statusDistribution(Map.of(RetryStatus.PENDING, 3L, RetryStatus.SUCCESS, 1L))
                .build());

        webTestClient.get()
                .uri("/api/v1/webhooks/retries")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.queueSize").isEqualTo(3)
                .jsonPath("$.statusDistribution.SUCCESS").isEqualTo(1);
    }

    @Test
    @DisplayName("Should run a processing pass on demand")
    void shouldRunProcessingPassOnDemand() {
        when(retryManager.processDueRetries()).thenReturn(Mono.just(RetryProcessingSummaryDTO.builder()
                .status(RetryProcessingSummaryDTO.STATUS_COMPLETED)
                .processed(2)
                .successful(1)
                .failed(1)
                .durationMs(12L)
                .build()));

        webTestClient.post()
                .uri("/api/v1/webhooks/retries/process")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("completed")
                .jsonPath("$.processed").isEqualTo(2);
    }

    @Test
    @DisplayName("Should answer 409 while a pass is already running")
    void shouldAnswer409WhileAlreadyProcessing() {
        when(retryManager.processDueRetries()).thenReturn(Mono.just(RetryProcessingSummaryDTO.alreadyProcessing()));

        webTestClient.post()
                .uri("/api/v1/webhooks/retries/process")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.status").isEqualTo("already_processing");
    }

    @Test
    @DisplayName("Should return rate limiter compliance")
    void shouldReturnRateLimiterCompliance() {
        when(rateLimiter.status()).thenReturn(RateLimitStatusDTO.builder()
                .configuredRate(2.0)
                .actualRate60s(0.05)
                .compliancePercent(100.0)
                .compliant(true)
                .totalRequestsTracked(3)
                .build());

        webTestClient.get()
                .uri("/api/v1/webhooks/rate-limit")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.configuredRate").isEqualTo(2.0)
                .jsonPath("$.compliant").isEqualTo(true)
                .jsonPath("$.totalRequestsTracked").isEqualTo(3);
    }
}
