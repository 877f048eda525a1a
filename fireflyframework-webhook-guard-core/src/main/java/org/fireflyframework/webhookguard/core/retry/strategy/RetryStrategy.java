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

package org.fireflyframework.webhookguard.core.retry.strategy;

import java.time.Duration;

/**
 * Decides whether a failed call is retried and how long to wait before the next try.
 * <p>
 * Shared by the webhook retry manager and the generic resilient retry handler so
 * both compute backoff the same way.
 */
public interface RetryStrategy {

    /**
     * @param attempt number of attempts already made, starting at 1
     * @param error   the failure of the last attempt, may be {@code null} when the
     *                outcome was a result rather than an exception
     * @return {@code true} if another attempt should be made
     */
    boolean shouldRetry(int attempt, Throwable error);

    /**
     * @param attempt zero-based retry index
     * @return the delay before that retry
     */
    Duration nextDelay(int attempt);
}
