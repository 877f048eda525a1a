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

package org.fireflyframework.webhookguard.core.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.interfaces.dto.RateLimitStatusDTO;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Interval-based limiter for calls to a rate-limited third-party API.
 * <p>
 * Every acquisition reserves the next free slot, at least {@code 1 / requestsPerSecond}
 * after the previous one, and the caller is delayed until that slot. The last
 * {@value #TRACKED_REQUESTS} slots are kept for status reporting only, they play no
 * part in enforcement.
 */
@Slf4j
public class OutboundRateLimiter {

    static final int TRACKED_REQUESTS = 100;
    static final double RECOMMENDED_REQUESTS_PER_SECOND = 2.0;
    private static final Duration REPORTING_WINDOW = Duration.ofSeconds(60);

    private final double requestsPerSecond;
    private final Duration minInterval;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> recentRequests = new ArrayDeque<>(TRACKED_REQUESTS);
    private Instant lastRequestTime;

    public OutboundRateLimiter(double requestsPerSecond, Clock clock) {
        if (!(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be positive, was " + requestsPerSecond);
        }
        this.requestsPerSecond = requestsPerSecond;
        this.minInterval = Duration.ofNanos(Math.round(1_000_000_000L / requestsPerSecond));
        this.clock = clock;
        configurationWarnings().forEach(warning -> log.warn("Rate limiter configuration: {}", warning));
    }

    /**
     * Completes once the caller may send its request. The slot is reserved at
     * subscription time.
     */
    public Mono<Void> acquire() {
        return Mono.defer(() -> {
            Duration wait = reserve();
            if (wait.isZero()) {
                return Mono.empty();
            }
            log.debug("Rate limit enforced: delaying request by {}ms", wait.toMillis());
            return Mono.delay(wait).then();
        });
    }

    /**
     * Runs {@code call} once a slot is available.
     */
    public <T> Mono<T> throttle(Mono<T> call) {
        return acquire().then(call);
    }

    /**
     * Reserves the next slot and returns how long the caller has to wait for it.
     */
    Duration reserve() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant slot = now;
            if (lastRequestTime != null) {
                Instant earliest = lastRequestTime.plus(minInterval);
                if (earliest.isAfter(now)) {
                    slot = earliest;
                }
            }
            lastRequestTime = slot;
            if (recentRequests.size() == TRACKED_REQUESTS) {
                recentRequests.removeFirst();
            }
            recentRequests.addLast(slot);
            return Duration.between(now, slot);
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStatusDTO status() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant windowStart = now.minus(REPORTING_WINDOW);
            long recent = recentRequests.stream()
                    .filter(ts -> !ts.isBefore(windowStart) && !ts.isAfter(now))
                    .count();
            double actualRate = recent / (double) REPORTING_WINDOW.toSeconds();
            double compliance = actualRate > 0
                    ? Math.min(100.0, requestsPerSecond / actualRate * 100.0)
                    : 100.0;
            long timeToNext = 0;
            if (lastRequestTime != null) {
                Duration remaining = Duration.between(now, lastRequestTime.plus(minInterval));
                timeToNext = Math.max(0, remaining.toMillis());
            }
            return RateLimitStatusDTO.builder()
                    .configuredRate(requestsPerSecond)
                    .actualRate60s(Math.round(actualRate * 1000) / 1000.0)
                    .compliancePercent(Math.round(compliance * 10) / 10.0)
                    .compliant(actualRate <= requestsPerSecond)
                    .timeToNextRequestMs(timeToNext)
                    .totalRequestsTracked(recentRequests.size())
                    .lastRequestTime(lastRequestTime)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            recentRequests.clear();
            lastRequestTime = null;
        } finally {
            lock.unlock();
        }
        log.info("Rate limiter tracking reset");
    }

    /**
     * Checks the configured rate against what the Typeform API tolerates.
     *
     * @return human-readable warnings, empty when the configuration is sound
     */
    public List<String> configurationWarnings() {
        List<String> warnings = new ArrayList<>();
        if (requestsPerSecond > RECOMMENDED_REQUESTS_PER_SECOND) {
            warnings.add("Rate limit " + requestsPerSecond + " req/sec exceeds the recommended "
                    + RECOMMENDED_REQUESTS_PER_SECOND + " req/sec");
        }
        if (requestsPerSecond < 0.5) {
            warnings.add("Very conservative rate limit may impact performance");
        }
        if (minInterval.compareTo(Duration.ofMillis(100)) < 0) {
            warnings.add("Request interval below 100ms may trigger rate limiting");
        }
        return warnings;
    }

    public double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public Duration getMinInterval() {
        return minInterval;
    }
}
