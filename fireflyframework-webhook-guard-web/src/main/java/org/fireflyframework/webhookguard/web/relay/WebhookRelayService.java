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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.ratelimit.OutboundRateLimiter;
import org.fireflyframework.webhookguard.core.resilience.RateLimitedException;
import org.fireflyframework.webhookguard.core.resilience.ResilientRetryHandler;
import org.fireflyframework.webhookguard.core.resilience.RetryOperation;
import org.fireflyframework.webhookguard.core.retry.WebhookExecutionResult;
import org.fireflyframework.webhookguard.core.retry.WebhookRetryManager;
import org.fireflyframework.webhookguard.interfaces.dto.WebhookRetryRecordDTO;
import org.fireflyframework.webhookguard.interfaces.enums.FailureKind;
import org.fireflyframework.webhookguard.web.config.RelayProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Forwards verified webhooks to the downstream target.
 * <p>
 * Each relay is throttled by the {@link OutboundRateLimiter} and retried briefly in-process.
 * Deliveries that still fail are handed to the {@link WebhookRetryManager}, with the payload
 * kept in the {@link RelayPayloadStore} until the record reaches a terminal status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRelayService {

    private final HttpWebhookExecutor webhookExecutor;
    private final ResilientRetryHandler retryHandler;
    private final OutboundRateLimiter rateLimiter;
    private final WebhookRetryManager retryManager;
    private final RelayPayloadStore payloadStore;
    private final RelayProperties relayProperties;

    /**
     * Starts relaying in the background. Failures are logged, never propagated.
     */
    public void dispatch(String webhookId, String formId, String payload) {
        relay(webhookId, formId, payload)
                .subscribe(
                        null,
                        error -> log.error("Unexpected error relaying webhook {}: {}", webhookId, error.getMessage(), error)
                );
    }

    /**
     * Relays one webhook, scheduling a retry when delivery fails.
     *
     * @return the retry record when a retry was scheduled, empty when delivered or relaying is disabled
     */
    public Mono<WebhookRetryRecordDTO> relay(String webhookId, String formId, String payload) {
        if (!relayProperties.isRelayEnabled()) {
            log.debug("No relay target configured, webhook {} not forwarded", webhookId);
            return Mono.empty();
        }
        String targetUrl = relayProperties.getTargetUrl();

        return retryHandler.execute(RetryOperation.WEBHOOK_PROCESSING, "relay:" + targetUrl,
                        () -> rateLimiter.throttle(webhookExecutor.deliver(webhookId, formId, targetUrl, payload))
                                .flatMap(this::failTransient))
                .flatMap(result -> {
                    if (result.isSuccess()) {
                        log.info("Relayed webhook {} to {} (HTTP {})", webhookId, targetUrl, result.getStatusCode());
                        return Mono.<WebhookRetryRecordDTO>empty();
                    }
                    return scheduleRetry(webhookId, formId, targetUrl, payload,
                            result.getErrorMessage(), result.getStatusCode());
                })
                .onErrorResume(error -> scheduleRetry(webhookId, formId, targetUrl, payload,
                        describe(error), statusCodeOf(error)));
    }

    private Mono<WebhookExecutionResult> failTransient(WebhookExecutionResult result) {
        FailureKind kind = result.resolveFailureKind();
        if (kind == FailureKind.RATE_LIMITED) {
            return Mono.error(new RateLimitedException("Relay target rate limited the request", null));
        }
        if (!result.isSuccess() && kind.isRetryable()) {
            return Mono.error(new RelayDeliveryException(result));
        }
        return Mono.just(result);
    }

    private Mono<WebhookRetryRecordDTO> scheduleRetry(String webhookId, String formId, String targetUrl,
                                                      String payload, String reason, Integer statusCode) {
        log.warn("Relay of webhook {} failed ({}), handing over to the retry queue", webhookId, reason);
        // Stored only once the record exists, the scheduler drops payloads without one
        return retryManager.scheduleRetry(webhookId, formId, targetUrl, reason, statusCode)
                .doOnNext(record -> {
                    if (record.getRetryStatus().isTerminal()) {
                        payloadStore.remove(webhookId);
                    } else {
                        payloadStore.put(webhookId, payload);
                    }
                });
    }

    private static Integer statusCodeOf(Throwable error) {
        if (error instanceof RelayDeliveryException delivery) {
            return delivery.getStatusCode();
        }
        if (error instanceof RateLimitedException) {
            return 429;
        }
        return null;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
