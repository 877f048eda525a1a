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

import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.retry.strategy.RetryStrategy;
import org.fireflyframework.webhookguard.interfaces.dto.RetryProcessingSummaryDTO;
import org.fireflyframework.webhookguard.interfaces.dto.RetryQueueStatusDTO;
import org.fireflyframework.webhookguard.interfaces.dto.WebhookRetryRecordDTO;
import org.fireflyframework.webhookguard.interfaces.enums.AttemptStatus;
import org.fireflyframework.webhookguard.interfaces.enums.FailureKind;
import org.fireflyframework.webhookguard.interfaces.enums.PermanentFailureReason;
import org.fireflyframework.webhookguard.interfaces.enums.RetryStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the retry records of failed webhook deliveries and drives them to a terminal state.
 * <p>
 * Records and the active queue are only touched while holding {@link #lock}; a processing
 * pass is single-flight, so attempts for one webhook are strictly sequential while
 * attempts for different webhooks run concurrently up to the configured concurrency.
 * <p>
 * State machine: {@code PENDING -> SUCCESS | PENDING | PERMANENTLY_DISABLED | MAX_RETRIES_EXCEEDED}.
 */
@Slf4j
public class WebhookRetryManager {

    private final RetryPolicyConfig policy;
    private final WebhookExecutor executor;
    private final RetryMetricsCollector metricsCollector;
    private final RetryStrategy backoffStrategy;
    private final TimeLimiter timeLimiter;
    private final int processingConcurrency;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final Map<String, WebhookRetryRecord> records = new HashMap<>();
    private final Set<String> retryQueue = new LinkedHashSet<>();

    public WebhookRetryManager(RetryPolicyConfig policy,
                               WebhookExecutor executor,
                               RetryMetricsCollector metricsCollector,
                               RetryStrategy backoffStrategy,
                               TimeLimiter timeLimiter,
                               int processingConcurrency,
                               Clock clock) {
        this.policy = policy;
        this.executor = executor;
        this.metricsCollector = metricsCollector != null ? metricsCollector : RetryMetricsCollector.NOOP;
        this.backoffStrategy = backoffStrategy;
        this.timeLimiter = timeLimiter;
        this.processingConcurrency = Math.max(1, processingConcurrency);
        this.clock = clock;

        log.info("Initialized WebhookRetryManager: maxAttempts={}, maxDuration={}, initialInterval={}, maxInterval={}",
                policy.getMaxTotalAttempts(), policy.getMaxRetryDuration(),
                policy.getInitialRetryInterval(), policy.getMaxRetryInterval());
    }

    /**
     * Registers a failed delivery for retry.
     * <p>
     * A status code configured for immediate disablement creates a terminal record that
     * never enters the queue. Scheduling an id that is already pending only appends the
     * reason to its failure notes; scheduling an id whose record is terminal returns that
     * record unchanged.
     *
     * @param webhookId     the webhook identifier
     * @param formId        the form the webhook belongs to
     * @param webhookUrl    the delivery target
     * @param failureReason why the delivery failed
     * @param statusCode    the HTTP status of the failed delivery, if any
     * @return a snapshot of the record
     */
    public Mono<WebhookRetryRecordDTO> scheduleRetry(String webhookId, String formId, String webhookUrl,
                                                     String failureReason, Integer statusCode) {
        return Mono.fromCallable(() -> doScheduleRetry(webhookId, formId, webhookUrl, failureReason, statusCode));
    }

    private WebhookRetryRecordDTO doScheduleRetry(String webhookId, String formId, String webhookUrl,
                                                  String failureReason, Integer statusCode) {
        if (webhookId == null || webhookId.isBlank()) {
            throw new IllegalArgumentException("webhookId must not be blank");
        }

        RetryMetricsEvent event;
        WebhookRetryRecordDTO snapshot;

        lock.lock();
        try {
            Instant now = clock.instant();
            WebhookRetryRecord existing = records.get(webhookId);

            if (existing != null && existing.isTerminal()) {
                log.info("Ignoring retry request for webhook {} already in terminal state {}",
                        webhookId, existing.getRetryStatus());
                event = event(RetryEventType.RETRY_SCHEDULE_IGNORED, existing, now).statusCode(statusCode).build();
                snapshot = existing.toDto();
            } else if (existing != null) {
                existing.addFailureNote(failureReason);
                log.debug("Webhook {} already queued for retry, noted failure: {}", webhookId, failureReason);
                return existing.toDto();
            } else {
                WebhookRetryRecord record = new WebhookRetryRecord(
                        webhookId, formId, webhookUrl, now, failureReason, statusCode);
                records.put(webhookId, record);

                if (policy.isImmediateDisableStatus(statusCode)) {
                    PermanentFailureReason reason = PermanentFailureReason.forStatusCode(statusCode);
                    record.markPermanentlyDisabled(reason);
                    log.warn("Webhook {} permanently disabled on first failure: status={}, reason={}",
                            webhookId, statusCode, reason);
                    event = event(RetryEventType.IMMEDIATELY_DISABLED, record, now)
                            .statusCode(statusCode)
                            .permanentFailureReason(reason)
                            .build();
                } else {
                    record.scheduleNext(now.plus(backoffStrategy.nextDelay(0)));
                    retryQueue.add(webhookId);
                    log.info("Scheduled retry for webhook {} (form {}) at {}: {}",
                            webhookId, formId, record.getNextRetryTime(), failureReason);
                    event = event(RetryEventType.RETRY_SCHEDULED, record, now).statusCode(statusCode).build();
                }
                snapshot = record.toDto();
            }
        } finally {
            lock.unlock();
        }

        emit(event);
        return snapshot;
    }

    /**
     * Runs one pass over the retries that are due.
     * <p>
     * Returns {@link RetryProcessingSummaryDTO#alreadyProcessing()} immediately when another
     * pass is still running. Errors are recorded per webhook and never abort the pass.
     *
     * @return the pass summary
     */
    public Mono<RetryProcessingSummaryDTO> processDueRetries() {
        return Mono.defer(() -> {
            if (!processing.compareAndSet(false, true)) {
                log.debug("Retry processing already in progress, skipping this pass");
                return Mono.just(RetryProcessingSummaryDTO.alreadyProcessing());
            }

            long startedAt = clock.millis();
            PassCounters counters = new PassCounters();
            List<WebhookRetryRecord> due;
            Instant now;
            try {
                now = clock.instant();
                due = collectDueRecords(now, counters);
            } catch (RuntimeException e) {
                processing.set(false);
                return Mono.error(e);
            }

            if (!due.isEmpty()) {
                log.info("Processing {} due webhook retries", due.size());
            }

            return Flux.fromIterable(due)
                    .flatMap(record -> processRecord(record, now, counters), processingConcurrency)
                    .then(Mono.fromSupplier(() -> counters.toSummary(clock.millis() - startedAt)))
                    .doOnNext(this::reportSummary)
                    .doFinally(signal -> processing.set(false));
        });
    }

    private List<WebhookRetryRecord> collectDueRecords(Instant now, PassCounters counters) {
        List<WebhookRetryRecord> due = new ArrayList<>();
        lock.lock();
        try {
            Iterator<String> it = retryQueue.iterator();
            while (it.hasNext()) {
                String webhookId = it.next();
                WebhookRetryRecord record = records.get(webhookId);
                if (record == null) {
                    log.warn("Removing stale webhook {} from retry queue: no retry record", webhookId);
                    it.remove();
                    counters.skipped.incrementAndGet();
                } else if (record.getNextRetryTime() == null || !record.getNextRetryTime().isAfter(now)) {
                    due.add(record);
                }
            }
        } finally {
            lock.unlock();
        }
        return due;
    }

    private Mono<Void> processRecord(WebhookRetryRecord record, Instant now, PassCounters counters) {
        return Mono.defer(() -> {
            counters.processed.incrementAndGet();

            RetryMetricsEvent limitEvent = null;
            RetryAttemptContext context = null;
            lock.lock();
            try {
                if (record.hasExceededMaxDuration(now, policy.getMaxRetryDuration())) {
                    record.markPermanentlyDisabled(PermanentFailureReason.MAX_RETRY_DURATION_EXCEEDED);
                    retryQueue.remove(record.getWebhookId());
                    log.warn("Webhook {} permanently disabled: retrying for longer than {}",
                            record.getWebhookId(), policy.getMaxRetryDuration());
                    limitEvent = event(RetryEventType.PERMANENTLY_DISABLED, record, now)
                            .permanentFailureReason(PermanentFailureReason.MAX_RETRY_DURATION_EXCEEDED)
                            .build();
                } else if (record.getTotalAttempts() >= policy.getMaxTotalAttempts()) {
                    record.markMaxRetriesExceeded();
                    retryQueue.remove(record.getWebhookId());
                    log.warn("Webhook {} exhausted its {} retry attempts",
                            record.getWebhookId(), policy.getMaxTotalAttempts());
                    limitEvent = event(RetryEventType.MAX_RETRIES_EXCEEDED, record, now)
                            .permanentFailureReason(PermanentFailureReason.MAX_RETRIES_EXCEEDED)
                            .build();
                } else {
                    context = RetryAttemptContext.builder()
                            .attemptNumber(record.getTotalAttempts() + 1)
                            .scheduledTime(record.getNextRetryTime())
                            .initialFailureTime(record.getInitialFailureTime())
                            .initialFailureReason(record.getInitialFailureReason())
                            .lastStatusCode(lastStatusCode(record))
                            .build();
                }
            } finally {
                lock.unlock();
            }

            if (limitEvent != null) {
                counters.disabled.incrementAndGet();
                emit(limitEvent);
                return Mono.empty();
            }

            RetryAttemptContext attemptContext = context;
            long attemptStartedAt = clock.millis();
            return invokeExecutor(record, attemptContext)
                    .doOnNext(result -> applyOutcome(record, attemptContext, attemptStartedAt, result, counters))
                    .then();
        }).onErrorResume(e -> {
            log.error("Unexpected error while processing retry for webhook {}", record.getWebhookId(), e);
            counters.errors.incrementAndGet();
            return Mono.empty();
        });
    }

    private Mono<WebhookExecutionResult> invokeExecutor(WebhookRetryRecord record, RetryAttemptContext context) {
        String webhookId = record.getWebhookId();
        Supplier<Mono<WebhookExecutionResult>> call =
                () -> executor.execute(webhookId, record.getFormId(), record.getWebhookUrl(), context);

        return Mono.defer(call)
                .transformDeferred(TimeLimiterOperator.of(timeLimiter))
                .switchIfEmpty(Mono.fromSupplier(() -> WebhookExecutionResult.failure(
                        null, "Executor completed without a result", FailureKind.EXECUTOR_EXCEPTION)))
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("Delivery attempt {} for webhook {} timed out: {}",
                            context.getAttemptNumber(), webhookId, e.getMessage());
                    return Mono.just(WebhookExecutionResult.failure(
                            null, "Executor timed out: " + e.getMessage(), FailureKind.TIMEOUT));
                })
                .onErrorResume(e -> {
                    log.error("Executor failed on attempt {} for webhook {}",
                            context.getAttemptNumber(), webhookId, e);
                    return Mono.just(WebhookExecutionResult.failure(
                            null, e.getClass().getSimpleName() + ": " + e.getMessage(),
                            FailureKind.EXECUTOR_EXCEPTION));
                });
    }

    private void applyOutcome(WebhookRetryRecord record, RetryAttemptContext context, long attemptStartedAt,
                              WebhookExecutionResult result, PassCounters counters) {
        List<RetryMetricsEvent> events = new ArrayList<>(2);

        lock.lock();
        try {
            Instant executedAt = clock.instant();
            FailureKind failureKind = result.resolveFailureKind();
            RetryAttempt attempt = RetryAttempt.builder()
                    .attemptNumber(context.getAttemptNumber())
                    .scheduledTime(context.getScheduledTime())
                    .executedTime(executedAt)
                    .status(result.isSuccess() ? AttemptStatus.SUCCESS : AttemptStatus.FAILED)
                    .responseStatusCode(result.getStatusCode())
                    .errorMessage(result.getErrorMessage())
                    .durationMs(Math.max(0, clock.millis() - attemptStartedAt))
                    .failureKind(failureKind)
                    .build();
            record.recordAttempt(attempt);

            events.add(event(result.isSuccess() ? RetryEventType.ATTEMPT_SUCCEEDED : RetryEventType.ATTEMPT_FAILED,
                    record, executedAt)
                    .attemptNumber(attempt.getAttemptNumber())
                    .statusCode(attempt.getResponseStatusCode())
                    .durationMs(attempt.getDurationMs())
                    .failureKind(failureKind)
                    .build());

            if (result.isSuccess()) {
                record.markSucceeded();
                retryQueue.remove(record.getWebhookId());
                counters.successful.incrementAndGet();
                log.info("Webhook {} delivered on retry attempt {}", record.getWebhookId(), attempt.getAttemptNumber());
                return;
            }

            PermanentFailureReason disableReason = null;
            if (policy.isImmediateDisableStatus(result.getStatusCode())) {
                disableReason = PermanentFailureReason.forStatusCode(result.getStatusCode());
            } else if (failureKind == FailureKind.PERMANENT) {
                disableReason = PermanentFailureReason.NON_RETRYABLE_FAILURE;
            } else if (isFailureRateExceeded(record, executedAt)) {
                disableReason = PermanentFailureReason.FAILURE_RATE_EXCEEDED;
            }

            if (disableReason != null) {
                record.markPermanentlyDisabled(disableReason);
                retryQueue.remove(record.getWebhookId());
                counters.disabled.incrementAndGet();
                log.warn("Webhook {} permanently disabled after attempt {}: reason={}, failureRate={}%",
                        record.getWebhookId(), attempt.getAttemptNumber(), disableReason, record.getFailureRate());
                events.add(event(RetryEventType.PERMANENTLY_DISABLED, record, executedAt)
                        .attemptNumber(attempt.getAttemptNumber())
                        .statusCode(attempt.getResponseStatusCode())
                        .permanentFailureReason(disableReason)
                        .build());
            } else {
                record.scheduleNext(executedAt.plus(backoffStrategy.nextDelay(record.getTotalAttempts())));
                counters.failed.incrementAndGet();
                log.info("Retry attempt {} for webhook {} failed ({}), next attempt at {}",
                        attempt.getAttemptNumber(), record.getWebhookId(),
                        attempt.getErrorMessage() != null ? attempt.getErrorMessage() : attempt.getResponseStatusCode(),
                        record.getNextRetryTime());
            }
        } finally {
            lock.unlock();
            events.forEach(this::emit);
        }
    }

    private boolean isFailureRateExceeded(WebhookRetryRecord record, Instant now) {
        if (record.getTotalAttempts() < policy.getMinimumSampleSize()) {
            return false;
        }
        int[] window = record.attemptsInWindow(now, policy.getFailureRateEvaluationWindow());
        int attemptsInWindow = window[0];
        if (attemptsInWindow == 0 || attemptsInWindow < policy.getMinimumAttemptsInWindow()) {
            return false;
        }
        double windowFailureRate = window[1] * 100.0 / attemptsInWindow;
        return windowFailureRate >= policy.getFailureRateDisableThreshold();
    }

    /**
     * @param webhookId the webhook identifier
     * @return a snapshot of the record, empty when the id is unknown
     */
    public Optional<WebhookRetryRecordDTO> getRetryStatus(String webhookId) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(webhookId)).map(WebhookRetryRecord::toDto);
        } finally {
            lock.unlock();
        }
    }

    public RetryQueueStatusDTO getQueueStatus() {
        lock.lock();
        try {
            Map<RetryStatus, Long> distribution = new EnumMap<>(RetryStatus.class);
            for (WebhookRetryRecord record : records.values()) {
                distribution.merge(record.getRetryStatus(), 1L, Long::sum);
            }
            return RetryQueueStatusDTO.builder()
                    .queueSize(retryQueue.size())
                    .totalRecords(records.size())
                    .statusDistribution(distribution)
                    .processing(processing.get())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the record of a webhook. A queue entry left behind is discarded as stale
     * by the next pass.
     *
     * @param webhookId the webhook identifier
     * @return {@code true} if a record was removed
     */
    public boolean purgeRecord(String webhookId) {
        lock.lock();
        try {
            return records.remove(webhookId) != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public RetryPolicyConfig getPolicy() {
        return policy;
    }

    private static Integer lastStatusCode(WebhookRetryRecord record) {
        List<RetryAttempt> attempts = record.getAttempts();
        if (attempts.isEmpty()) {
            return record.getInitialStatusCode();
        }
        return attempts.get(attempts.size() - 1).getResponseStatusCode();
    }

    private RetryMetricsEvent.RetryMetricsEventBuilder event(RetryEventType type, WebhookRetryRecord record,
                                                             Instant timestamp) {
        return RetryMetricsEvent.builder()
                .type(type)
                .timestamp(timestamp)
                .webhookId(record.getWebhookId())
                .formId(record.getFormId());
    }

    private void reportSummary(RetryProcessingSummaryDTO summary) {
        if (summary.getProcessed() > 0 || summary.getSkipped() > 0) {
            log.info("Retry pass completed: processed={}, successful={}, failed={}, disabled={}, skipped={}, errors={}",
                    summary.getProcessed(), summary.getSuccessful(), summary.getFailed(),
                    summary.getDisabled(), summary.getSkipped(), summary.getErrors());
        }
        emit(RetryMetricsEvent.builder()
                .type(RetryEventType.PROCESSING_SUMMARY)
                .timestamp(clock.instant())
                .durationMs(summary.getDurationMs())
                .summary(summary)
                .build());
    }

    private void emit(RetryMetricsEvent event) {
        try {
            metricsCollector.collect(event);
        } catch (RuntimeException e) {
            log.warn("Metrics collector failed for event {}: {}", event.getType(), e.getMessage());
        }
    }

    private static final class PassCounters {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger successful = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger disabled = new AtomicInteger();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();

        RetryProcessingSummaryDTO toSummary(long durationMs) {
            return RetryProcessingSummaryDTO.builder()
                    .status(RetryProcessingSummaryDTO.STATUS_COMPLETED)
                    .processed(processed.get())
                    .successful(successful.get())
                    .failed(failed.get())
                    .disabled(disabled.get())
                    .skipped(skipped.get())
                    .errors(errors.get())
                    .durationMs(durationMs)
                    .build();
        }
    }
}
