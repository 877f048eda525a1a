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

package org.fireflyframework.webhookguard.interfaces.enums;

/**
 * Classification of a delivery outcome.
 * <p>
 * Executors tag their results with a kind so the retry policy does not depend
 * on which exception types a transport happens to throw.
 */
public enum FailureKind {

    /** The attempt succeeded. */
    NONE,

    /** Transient failure, typically 408 or 5xx. */
    RETRYABLE,

    /** The target asked us to slow down (429). */
    RATE_LIMITED,

    TIMEOUT,

    NETWORK,

    /** Retrying can never succeed. */
    PERMANENT,

    /** The executor itself threw instead of returning a result. */
    EXECUTOR_EXCEPTION;

    public boolean isRetryable() {
        return this != NONE && this != PERMANENT;
    }
}
