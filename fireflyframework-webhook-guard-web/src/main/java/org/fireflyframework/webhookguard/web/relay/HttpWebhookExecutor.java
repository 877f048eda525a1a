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


package org.fireflyframework.webhookguard.web.relay;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.retry.RetryAttemptContext;
import org.fireflyframework.webhookguard.core.retry.RetryPolicyConfig;
import org.fireflyframework.webhookguard.core.retry.WebhookExecutionResult;
import org.fireflyframework.webhookguard.core.retry.WebhookExecutor;
import org.fireflyframework.webhookguard.interfaces.enums.FailureKind;
import org.fireflyframework.webhookguard.web.config.RelayProperties;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Delivers webhook payloads to the downstream target over HTTP.
 * <p>
 * Never signals an error: transport problems are returned as failed
 * {@link WebhookExecutionResult}s tagged with a {@link FailureKind}.
 */
@Component
@Slf4j
public class HttpWebhookExecutor implements WebhookExecutor {

    private final WebClient webClient;
    private final RelayPayloadStore payloadStore;
    private final RelayProperties relayProperties;
    private final RetryPolicyConfig retryPolicy;

    public HttpWebhookExecutor(WebClient.Builder webClientBuilder,
                               RelayPayloadStore payloadStore,
                               RelayProperties relayProperties,
                               RetryPolicyConfig retryPolicy) {
        this.webClient = webClientBuilder.build();
        this.payloadStore = payloadStore;
        this.relayProperties = relayProperties;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Mono<WebhookExecutionResult> execute(String webhookId, String formId, String webhookUrl,
                                                RetryAttemptContext context) {
        Optional<String> payload = payloadStore.get(webhookId);
        if (payload.isEmpty()) {
            log.warn("No stored payload for webhook {}, cannot retry delivery", webhookId);
            return Mono.just(WebhookExecutionResult.failure(null,
                    "No stored payload for webhook " + webhookId, FailureKind.PERMANENT));
        }
        log.debug("Retrying delivery of webhook {} (attempt {})", webhookId, context.getAttemptNumber());
        return deliver(webhookId, formId, webhookUrl, payload.get());
    }

    /**
     * POSTs {@code payload} to {@code webhookUrl} and classifies the outcome.
     */
    public Mono<WebhookExecutionResult> deliver(String webhookId, String formId, String webhookUrl, String payload) {
        return webClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    headers.set(relayProperties.getWebhookIdHeader(), webhookId);
                    if (formId != null) {
                        headers.set(relayProperties.getFormIdHeader(), formId);
                    }
                })
                .bodyValue(payload)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> classify(response.statusCode().value(), body)))
                .timeout(relayProperties.getRequestTimeout())
                .onErrorResume(TimeoutException.class, e -> Mono.just(WebhookExecutionResult.failure(null,
                        "Request timed out after " + relayProperties.getRequestTimeout().toMillis() + "ms",
                        FailureKind.TIMEOUT)))
                .onErrorResume(WebClientRequestException.class, e -> Mono.just(WebhookExecutionResult.failure(null,
                        "Network error: " + e.getMostSpecificCause().getMessage(), FailureKind.NETWORK)));
    }

    WebhookExecutionResult classify(int statusCode, String body) {
        if (statusCode >= 200 && statusCode < 300) {
            return WebhookExecutionResult.success(statusCode, body);
        }
        FailureKind kind;
        if (statusCode == 429) {
            kind = FailureKind.RATE_LIMITED;
        } else if (retryPolicy.isImmediateDisableStatus(statusCode)) {
            kind = FailureKind.PERMANENT;
        } else {
            // unlisted statuses are retried too, the failure-rate rule bounds them
            if (!retryPolicy.isRetryableStatus(statusCode)) {
                log.warn("Relay target answered HTTP {} which is not a listed retry status, retrying anyway",
                        statusCode);
            }
            kind = FailureKind.RETRYABLE;
        }
        return WebhookExecutionResult.builder()
                .statusCode(statusCode)
                .success(false)
                .errorMessage("HTTP " + statusCode)
                .responseBody(body)
                .failureKind(kind)
                .build();
    }
}
