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

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.ratelimit.OutboundRateLimiter;
import org.fireflyframework.webhookguard.core.retry.WebhookRetryManager;
import org.fireflyframework.webhookguard.interfaces.dto.RateLimitStatusDTO;
import org.fireflyframework.webhookguard.interfaces.dto.RetryProcessingSummaryDTO;
import org.fireflyframework.webhookguard.interfaces.dto.RetryQueueStatusDTO;
import org.fireflyframework.webhookguard.interfaces.dto.WebhookRetryRecordDTO;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Operational endpoints for the retry queue and the outbound rate limiter.
 */
@RestController
@RequestMapping(value = "/api/v1/webhooks", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Retries", description = "Retry queue inspection and processing")
public class RetryManagementController {

    private final WebhookRetryManager retryManager;
    private final OutboundRateLimiter rateLimiter;

    @GetMapping("/retries/{webhookId}")
    @Operation(summary = "Get the retry record of a webhook")
    @ApiResponse(
            responseCode = "200",
            description = "Retry record found",
            content = @Content(schema = @Schema(implementation = WebhookRetryRecordDTO.class))
    )
    @ApiResponse(responseCode = "404", description = "No retry record for this webhook")
    public Mono<ResponseEntity<WebhookRetryRecordDTO>> getRetryStatus(
            @Parameter(description = "Webhook id", required = true) @PathVariable String webhookId) {
        return Mono.justOrEmpty(retryManager.getRetryStatus(webhookId))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/retries")
    @Operation(summary = "Get retry queue status")
    @ApiResponse(
            responseCode = "200",
            description = "Queue status",
            content = @Content(schema = @Schema(implementation = RetryQueueStatusDTO.class))
    )
    public Mono<RetryQueueStatusDTO> getQueueStatus() {
        return Mono.fromSupplier(retryManager::getQueueStatus);
    }

    @PostMapping("/retries/process")
    @Operation(
            summary = "Process due retries now",
            description = "Runs one processing pass. Returns 409 when a pass is already running."
    )
    @ApiResponse(
            responseCode = "200",
            description = "Pass completed",
            content = @Content(schema = @Schema(implementation = RetryProcessingSummaryDTO.class))
    )
    @ApiResponse(responseCode = "409", description = "A processing pass is already running")
    public Mono<ResponseEntity<RetryProcessingSummaryDTO>> processRetries() {
        log.info("Manual retry processing requested");
        return retryManager.processDueRetries()
                .map(summary -> summary.isAlreadyProcessing()
                        ? ResponseEntity.status(HttpStatus.CONFLICT).body(summary)
                        : ResponseEntity.ok(summary));
    }

    @GetMapping("/rate-limit")
    @Operation(summary = "Get outbound rate limiter compliance")
    @ApiResponse(
            responseCode = "200",
            description = "Rate limiter status",
            content = @Content(schema = @Schema(implementation = RateLimitStatusDTO.class))
    )
    public Mono<RateLimitStatusDTO> getRateLimitStatus() {
        return Mono.fromSupplier(rateLimiter::status);
    }
}
