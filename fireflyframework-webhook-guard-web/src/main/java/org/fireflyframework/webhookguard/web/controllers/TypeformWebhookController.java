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
import org.fireflyframework.webhookguard.core.metrics.WebhookGuardMetricsService;
import org.fireflyframework.webhookguard.core.security.PayloadTooLargeException;
import org.fireflyframework.webhookguard.core.security.VerificationFailureTracker;
import org.fireflyframework.webhookguard.core.security.VerificationResult;
import org.fireflyframework.webhookguard.core.security.WebhookSignatureValidator;
import org.fireflyframework.webhookguard.interfaces.dto.WebhookVerificationResponseDTO;
import org.fireflyframework.webhookguard.web.config.RelayProperties;
import org.fireflyframework.webhookguard.web.relay.WebhookRelayService;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller receiving Typeform webhooks.
 * <p>
 * Every request is verified against the shared secret before anything else happens.
 * Accepted payloads are relayed to the downstream target in the background, so the
 * response only reflects the verification outcome.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Verified webhook ingestion")
public class TypeformWebhookController {

    private final WebhookSignatureValidator signatureValidator;
    private final VerificationFailureTracker failureTracker;
    private final WebhookGuardMetricsService metricsService;
    private final WebhookRelayService relayService;
    private final RelayProperties relayProperties;

    @PostMapping(value = "/typeform", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Receive a Typeform webhook",
            description = "Verifies the HMAC signature, timestamp and replay protection of a Typeform webhook " +
                    "and relays accepted payloads to the configured target."
    )
    @ApiResponse(
            responseCode = "202",
            description = "Webhook verified and accepted",
            content = @Content(schema = @Schema(implementation = WebhookVerificationResponseDTO.class))
    )
    @ApiResponse(responseCode = "401", description = "Webhook failed verification")
    @ApiResponse(responseCode = "413", description = "Payload exceeds the maximum size")
    @ApiResponse(responseCode = "500", description = "Internal error during verification")
    public Mono<ResponseEntity<WebhookVerificationResponseDTO>> receiveTypeformWebhook(
            @Parameter(description = "Raw webhook payload, verified byte for byte")
            @RequestBody(required = false) String payload,
            ServerHttpRequest request
    ) {
        String body = payload != null ? payload : "";
        Map<String, String> headers = extractHeaders(request);
        String webhookIdHeader = headerValue(headers, relayProperties.getWebhookIdHeader());
        String id = webhookIdHeader != null && !webhookIdHeader.isBlank()
                ? webhookIdHeader
                : UUID.randomUUID().toString();
        String formIdHeader = headerValue(headers, relayProperties.getFormIdHeader());
        String formId = formIdHeader != null && !formIdHeader.isBlank() ? formIdHeader : "unknown";
        String sourceIp = extractSourceIp(request);

        MDC.put("webhookId", id);
        MDC.put("sourceIp", sourceIp);
        log.info("Received Typeform webhook {} from {}", id, sourceIp);
        metricsService.recordPayloadSize(body.getBytes(StandardCharsets.UTF_8).length);

        return signatureValidator.validateSignature(body, headers)
                .map(result -> handleResult(result, id, formId, body, sourceIp))
                .onErrorResume(PayloadTooLargeException.class, e -> {
                    log.warn("Rejected webhook {}: payload of {} bytes exceeds {} bytes",
                            id, e.getPayloadSize(), e.getMaxPayloadSize());
                    metricsService.recordVerification("rejected", "payload_too_large");
                    return Mono.just(ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                            .body(WebhookVerificationResponseDTO.rejected(id, "PAYLOAD_TOO_LARGE", e.getMessage())));
                })
                .onErrorResume(e -> {
                    log.error("Error verifying webhook {}: {}", id, e.getMessage(), e);
                    metricsService.recordVerification("error", "none");
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(WebhookVerificationResponseDTO.error(id, "Webhook verification failed")));
                })
                .doFinally(signal -> {
                    MDC.remove("webhookId");
                    MDC.remove("sourceIp");
                });
    }

    private ResponseEntity<WebhookVerificationResponseDTO> handleResult(VerificationResult result, String webhookId,
                                                                        String formId, String payload,
                                                                        String sourceIp) {
        if (!result.isValid()) {
            String reason = result.getFailure().name();
            log.warn("Rejected webhook {} from {}: {}", webhookId, sourceIp, result.getMessage());
            failureTracker.recordFailure(sourceIp, result.getFailure());
            metricsService.recordVerification("rejected", reason.toLowerCase());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(WebhookVerificationResponseDTO.rejected(webhookId, reason, result.getMessage()));
        }

        if (result.isVerificationSkipped()) {
            log.warn("Webhook {} accepted without signature verification", webhookId);
            metricsService.recordVerification("skipped", "none");
        } else {
            metricsService.recordVerification("accepted", "none");
        }
        relayService.dispatch(webhookId, formId, payload);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(WebhookVerificationResponseDTO.accepted(webhookId));
    }

    /**
     * Extracts headers from the request, keeping the first value of each.
     */
    private Map<String, String> extractHeaders(ServerHttpRequest request) {
        Map<String, String> headers = new HashMap<>();
        request.getHeaders().forEach((key, values) -> {
            if (!values.isEmpty()) {
                headers.put(key, values.get(0));
            }
        });
        return headers;
    }

    private static String headerValue(Map<String, String> headers, String name) {
        return headers.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    /**
     * Extracts the source IP, preferring the first X-Forwarded-For hop.
     */
    private String extractSourceIp(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }
        if (request.getRemoteAddress() != null) {
            return request.getRemoteAddress().getHostString();
        }
        return "unknown";
    }
}
