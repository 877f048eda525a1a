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


package org.fireflyframework.webhookguard.web.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.config.RetryProperties;
import org.fireflyframework.webhookguard.core.retry.WebhookRetryManager;
import org.fireflyframework.webhookguard.interfaces.dto.RetryProcessingSummaryDTO;
import org.fireflyframework.webhookguard.interfaces.dto.WebhookRetryRecordDTO;
import org.fireflyframework.webhookguard.web.relay.RelayPayloadStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Periodically drives the retry queue and releases payloads of finished records.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryQueueScheduler {

    private final WebhookRetryManager retryManager;
    private final RetryProperties retryProperties;
    private final RelayPayloadStore payloadStore;

    @Scheduled(
            fixedDelayString = "${firefly.webhook-guard.retry.processing-interval:PT1M}",
            initialDelayString = "${firefly.webhook-guard.retry.processing-interval:PT1M}"
    )
    public Mono<Void> scheduledRun() {
        return processRetryQueue()
                .onErrorResume(error -> {
                    log.error("Retry processing pass failed: {}", error.getMessage(), error);
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Runs one processing pass unless processing is disabled.
     */
    public Mono<RetryProcessingSummaryDTO> processRetryQueue() {
        if (!retryProperties.isProcessingEnabled()) {
            log.debug("Retry processing disabled, skipping pass");
            return Mono.empty();
        }
        return retryManager.processDueRetries()
                .doOnNext(summary -> {
                    if (summary.isAlreadyProcessing()) {
                        log.debug("Previous retry pass still running, skipping");
                        return;
                    }
                    if (summary.getProcessed() > 0 || summary.getSkipped() > 0) {
                        log.info("Retry pass: processed={}, successful={}, failed={}, disabled={}, skipped={}, errors={}",
                                summary.getProcessed(), summary.getSuccessful(), summary.getFailed(),
                                summary.getDisabled(), summary.getSkipped(), summary.getErrors());
                    }
                    int released = releaseFinishedPayloads();
                    if (released > 0) {
                        log.debug("Released {} stored payloads", released);
                    }
                });
    }

    /**
     * Drops stored payloads whose record is gone or terminal.
     */
    int releaseFinishedPayloads() {
        int released = 0;
        for (String webhookId : payloadStore.ids()) {
            Optional<WebhookRetryRecordDTO> record = retryManager.getRetryStatus(webhookId);
            if (record.isEmpty() || record.get().getRetryStatus().isTerminal()) {
                payloadStore.remove(webhookId);
                released++;
            }
        }
        return released;
    }
}
