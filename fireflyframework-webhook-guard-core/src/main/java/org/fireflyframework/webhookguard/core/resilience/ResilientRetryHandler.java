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

package org.fireflyframework.webhookguard.core.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.retry.strategy.ExponentialBackoffStrategy;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Generic retry with exponential backoff, per-call timeout and per-operation-id
 * circuit breakers.
 * <p>
 * Each {@link RetryOperation} has its own {@link OperationRetryConfig}. The circuit
 * breakers live in a Resilience4j {@link CircuitBreakerRegistry}, one per operation id,
 * created with the settings of the operation that first uses the id. When every
 * attempt fails the last error is propagated unchanged.
 */
@Slf4j
public class ResilientRetryHandler {

    private static final int MAX_TRACKED_ATTEMPTS = 1000;
    private static final int RECENT_WINDOW = 20;

    private final OperationRetryConfig defaultConfig;
    private final Map<RetryOperation, OperationRetryConfig> operationConfigs = new ConcurrentHashMap<>();
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Deque<AttemptRecord> attempts = new ArrayDeque<>();
    private final DoubleSupplier random;

    public ResilientRetryHandler(OperationRetryConfig defaultConfig,
                                 Map<RetryOperation, OperationRetryConfig> overrides,
                                 CircuitBreakerRegistry circuitBreakerRegistry,
                                 DoubleSupplier random) {
        this.defaultConfig = defaultConfig != null ? defaultConfig : OperationRetryConfig.defaults();
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.random = random;
        operationConfigs.putAll(OperationRetryConfig.builtIn());
        if (overrides != null) {
            operationConfigs.putAll(overrides);
        }
    }

    /**
     * Runs {@code call} with the retry configuration of {@code operation}.
     *
     * @param operation   the kind of operation
     * @param operationId key of the circuit breaker guarding the call; defaults to the operation name
     * @param call        produces the call, invoked once per attempt
     * @return the first successful result, or the last error
     */
    public <T> Mono<T> execute(RetryOperation operation, String operationId, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            OperationRetryConfig config = getConfig(operation);
            String opId = operationId != null ? operationId : operation.name().toLowerCase();
            CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(opId, config.toCircuitBreakerConfig());
            TimeLimiter timeLimiter = TimeLimiter.of("retry-" + opId, TimeLimiterConfig.custom()
                    .timeoutDuration(config.getTimeout())
                    .cancelRunningFuture(true)
                    .build());
            ExponentialBackoffStrategy strategy = config.toStrategy(random);
            AtomicReference<Throwable> lastFailure = new AtomicReference<>();

            return Mono.defer(call)
                    .transformDeferred(TimeLimiterOperator.of(timeLimiter))
                    .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                    .doOnSuccess(result -> recordAttempt(operation, true))
                    .doOnError(error -> {
                        if (!(error instanceof CallNotPermittedException)) {
                            recordAttempt(operation, false);
                        }
                    })
                    .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                        Throwable error = signal.failure();
                        int attemptNumber = (int) signal.totalRetries() + 1;

                        if (error instanceof CallNotPermittedException) {
                            Throwable previous = lastFailure.get();
                            if (previous != null) {
                                log.warn("Circuit breaker for {} opened while retrying, giving up after {} attempts",
                                        opId, attemptNumber - 1);
                                return Mono.<Long>error(previous);
                            }
                            return Mono.<Long>error(new CircuitBreakerOpenException(opId, error));
                        }
                        lastFailure.set(error);

                        if (!strategy.shouldRetry(attemptNumber, error)) {
                            log.error("All retry attempts exhausted for {} ({}) after {} attempts: {}",
                                    operation, opId, attemptNumber, error.toString());
                            return Mono.<Long>error(error);
                        }

                        Duration delay = backoff(config, strategy, opId, attemptNumber, error);
                        log.warn("Attempt {} of {} failed for {}: {}, retrying in {}ms",
                                attemptNumber, operation, opId, error.toString(), delay.toMillis());
                        return Mono.delay(delay).doOnNext(tick -> log.info("Retrying {} (attempt {}/{}) for {}",
                                operation, attemptNumber + 1, config.getMaxAttempts(), opId));
                    })));
        });
    }

    private Duration backoff(OperationRetryConfig config, ExponentialBackoffStrategy strategy, String opId,
                             int attemptNumber, Throwable error) {
        Duration delay = strategy.nextDelay(attemptNumber - 1);
        if (error instanceof RateLimitedException rateLimited && config.isRespectRetryAfter()) {
            Optional<Duration> retryAfter = rateLimited.getRetryAfter();
            if (retryAfter.isPresent()) {
                Duration hinted = Duration.ofMillis(
                        Math.round(retryAfter.get().toMillis() * config.getRetryAfterMultiplier()));
                if (hinted.compareTo(delay) > 0) {
                    delay = hinted;
                }
                log.warn("Rate limited on {}, waiting {}ms (retry-after {}s)",
                        opId, delay.toMillis(), retryAfter.get().toSeconds());
            }
        }
        return delay;
    }

    public OperationRetryConfig getConfig(RetryOperation operation) {
        return operationConfigs.getOrDefault(operation, defaultConfig);
    }

    /**
     * Replaces the configuration of {@code operation}. Circuit breakers created
     * before the change keep their thresholds.
     */
    public void configure(RetryOperation operation, OperationRetryConfig config) {
        operationConfigs.put(operation, config);
        log.info("Updated retry configuration for {}: {}", operation, config);
    }

    public Map<String, CircuitBreaker> getCircuitBreakers() {
        Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
        circuitBreakerRegistry.getAllCircuitBreakers()
                .forEach(circuitBreaker -> breakers.put(circuitBreaker.getName(), circuitBreaker));
        return Collections.unmodifiableMap(breakers);
    }

    public RetryStatistics getStatistics() {
        return getStatistics(null);
    }

    /**
     * @param operation restricts the statistics to one operation, {@code null} for all
     */
    public RetryStatistics getStatistics(RetryOperation operation) {
        List<AttemptRecord> snapshot;
        synchronized (attempts) {
            snapshot = new ArrayList<>(attempts);
        }
        if (operation != null) {
            snapshot.removeIf(a -> a.getOperation() != operation);
        }

        int failed = (int) snapshot.stream().filter(a -> !a.isSuccess()).count();
        int recentFailures = (int) snapshot.subList(Math.max(0, snapshot.size() - RECENT_WINDOW), snapshot.size())
                .stream().filter(a -> !a.isSuccess()).count();

        Map<RetryOperation, RetryStatistics.OperationStatistics> perOperation = new EnumMap<>(RetryOperation.class);
        for (RetryOperation op : RetryOperation.values()) {
            List<AttemptRecord> opAttempts = snapshot.stream().filter(a -> a.getOperation() == op).toList();
            if (!opAttempts.isEmpty()) {
                int opFailed = (int) opAttempts.stream().filter(a -> !a.isSuccess()).count();
                perOperation.put(op, new RetryStatistics.OperationStatistics(opAttempts.size(), opFailed,
                        (opAttempts.size() - opFailed) / (double) opAttempts.size()));
            }
        }

        Map<String, RetryStatistics.CircuitBreakerSnapshot> breakers = new LinkedHashMap<>();
        getCircuitBreakers().forEach((id, circuitBreaker) -> {
            CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
            breakers.put(id, new RetryStatistics.CircuitBreakerSnapshot(circuitBreaker.getState(),
                    metrics.getNumberOfFailedCalls(), metrics.getNumberOfBufferedCalls(), metrics.getFailureRate()));
        });

        return RetryStatistics.builder()
                .totalAttempts(snapshot.size())
                .failedAttempts(failed)
                .recentFailures(recentFailures)
                .operations(perOperation)
                .circuitBreakers(breakers)
                .build();
    }

    private void recordAttempt(RetryOperation operation, boolean success) {
        synchronized (attempts) {
            if (attempts.size() == MAX_TRACKED_ATTEMPTS) {
                attempts.removeFirst();
            }
            attempts.addLast(new AttemptRecord(operation, success));
        }
    }

    @Value
    private static class AttemptRecord {
        RetryOperation operation;
        boolean success;
    }
}
