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

package org.fireflyframework.webhookguard.core.retry;

import lombok.AccessLevel;
import lombok.Getter;
import org.fireflyframework.webhookguard.interfaces.dto.WebhookRetryRecordDTO;
import org.fireflyframework.webhookguard.interfaces.enums.PermanentFailureReason;
import org.fireflyframework.webhookguard.interfaces.enums.RetryStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Retry state of one failed webhook delivery.
 * <p>
 * Only {@link WebhookRetryManager} mutates a record, always while holding its lock.
 * Once the status is terminal the record is never changed again.
 */
@Getter
public class WebhookRetryRecord {

    private final String webhookId;
    private final String formId;
    private final String webhookUrl;
    private final Instant initialFailureTime;
    private final String initialFailureReason;
    private final Integer initialStatusCode;

    private RetryStatus retryStatus = RetryStatus.PENDING;
    private int totalAttempts;
    private int successfulAttempts;
    private int failedAttempts;
    private Instant nextRetryTime;
    private Instant lastAttemptTime;
    private PermanentFailureReason permanentFailureReason;

    @Getter(AccessLevel.NONE)
    private final List<RetryAttempt> attempts = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<String> failureNotes = new ArrayList<>();

    WebhookRetryRecord(String webhookId, String formId, String webhookUrl, Instant initialFailureTime,
                       String initialFailureReason, Integer initialStatusCode) {
        this.webhookId = webhookId;
        this.formId = formId;
        this.webhookUrl = webhookUrl;
        this.initialFailureTime = initialFailureTime;
        this.initialFailureReason = initialFailureReason;
        this.initialStatusCode = initialStatusCode;
    }

    public List<RetryAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    public List<String> getFailureNotes() {
        return Collections.unmodifiableList(failureNotes);
    }

    /**
     * Failed attempts as a percentage of all attempts, 0 when nothing ran yet.
     */
    public double getFailureRate() {
        if (totalAttempts == 0) {
            return 0.0;
        }
        return failedAttempts * 100.0 / totalAttempts;
    }

    public boolean hasExceededMaxDuration(Instant now, Duration maxDuration) {
        return Duration.between(initialFailureTime, now).compareTo(maxDuration) > 0;
    }

    /**
     * Counts attempts executed within {@code window} before {@code now}.
     *
     * @return {@code [attemptsInWindow, failedInWindow]}
     */
    int[] attemptsInWindow(Instant now, Duration window) {
        Instant windowStart = now.minus(window);
        int inWindow = 0;
        int failed = 0;
        for (RetryAttempt attempt : attempts) {
            if (attempt.getExecutedTime() != null && !attempt.getExecutedTime().isBefore(windowStart)) {
                inWindow++;
                if (attempt.isFailed()) {
                    failed++;
                }
            }
        }
        return new int[]{inWindow, failed};
    }

    public boolean isTerminal() {
        return retryStatus.isTerminal();
    }

    void recordAttempt(RetryAttempt attempt) {
        attempts.add(attempt);
        totalAttempts++;
        if (attempt.isFailed()) {
            failedAttempts++;
        } else {
            successfulAttempts++;
        }
        lastAttemptTime = attempt.getExecutedTime();
    }

    void scheduleNext(Instant nextRetryTime) {
        this.nextRetryTime = nextRetryTime;
    }

    void addFailureNote(String note) {
        failureNotes.add(note);
    }

    void markSucceeded() {
        retryStatus = RetryStatus.SUCCESS;
        nextRetryTime = null;
    }

    void markPermanentlyDisabled(PermanentFailureReason reason) {
        retryStatus = RetryStatus.PERMANENTLY_DISABLED;
        permanentFailureReason = reason;
        nextRetryTime = null;
    }

    void markMaxRetriesExceeded() {
        retryStatus = RetryStatus.MAX_RETRIES_EXCEEDED;
        permanentFailureReason = PermanentFailureReason.MAX_RETRIES_EXCEEDED;
        nextRetryTime = null;
    }

    WebhookRetryRecordDTO toDto() {
        return WebhookRetryRecordDTO.builder()
                .webhookId(webhookId)
                .formId(formId)
                .webhookUrl(webhookUrl)
                .initialFailureTime(initialFailureTime)
                .initialFailureReason(initialFailureReason)
                .initialStatusCode(initialStatusCode)
                .retryStatus(retryStatus)
                .totalAttempts(totalAttempts)
                .successfulAttempts(successfulAttempts)
                .failedAttempts(failedAttempts)
                .failureRate(getFailureRate())
                .nextRetryTime(nextRetryTime)
                .lastAttemptTime(lastAttemptTime)
                .permanentFailureReason(permanentFailureReason)
                .attempts(attempts.stream().map(RetryAttempt::toDto).toList())
                .failureNotes(List.copyOf(failureNotes))
                .build();
    }
}
