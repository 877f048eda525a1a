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

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Attempt statistics of the {@link ResilientRetryHandler}.
 */
@Value
@Builder
public class RetryStatistics {

    int totalAttempts;
    int failedAttempts;

    /**
     * Failures among the last 20 attempts
     */
    int recentFailures;

    Map<RetryOperation, OperationStatistics> operations;
    Map<String, CircuitBreakerSnapshot> circuitBreakers;

    @Value
    public static class OperationStatistics {
        int totalAttempts;
        int failedAttempts;
        double successRate;
    }

    @Value
    public static class CircuitBreakerSnapshot {
        CircuitBreaker.State state;
        int failedCalls;
        int bufferedCalls;

        /**
         * Percentage of failed calls in the sliding window, -1 until the window holds enough calls
         */
        float failureRate;
    }
}
