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
 * Reason a webhook retry record left the queue without succeeding.
 */
public enum PermanentFailureReason {

    /**
     * Target answered 404, the endpoint no longer exists.
     */
    HTTP_404_NOT_FOUND,

    /**
     * Target answered 410, the endpoint was removed on purpose.
     */
    HTTP_410_GONE,

    /**
     * Target answered with another status configured for immediate disablement.
     */
    IMMEDIATE_DISABLE_STATUS_CODE,

    /**
     * Executor classified the failure as permanent.
     */
    NON_RETRYABLE_FAILURE,

    MAX_RETRY_DURATION_EXCEEDED,

    MAX_RETRIES_EXCEEDED,

    FAILURE_RATE_EXCEEDED;

    /**
     * Maps an immediate-disable HTTP status code to its reason.
     *
     * @param statusCode the HTTP status code
     * @return the matching reason
     */
    public static PermanentFailureReason forStatusCode(int statusCode) {
        return switch (statusCode) {
            case 404 -> HTTP_404_NOT_FOUND;
            case 410 -> HTTP_410_GONE;
            default -> IMMEDIATE_DISABLE_STATUS_CODE;
        };
    }
}
