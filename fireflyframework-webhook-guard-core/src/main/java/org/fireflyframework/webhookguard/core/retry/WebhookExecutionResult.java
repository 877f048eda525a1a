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

import lombok.Builder;
import lombok.Value;
import org.fireflyframework.webhookguard.interfaces.enums.FailureKind;

/**
 * Outcome of one delivery made by a {@link WebhookExecutor}.
 */
@Value
@Builder
public class WebhookExecutionResult {

    Integer statusCode;
    boolean success;
    String errorMessage;
    String responseBody;
    FailureKind failureKind;

    public static WebhookExecutionResult success(int statusCode, String responseBody) {
        return WebhookExecutionResult.builder()
                .statusCode(statusCode)
                .success(true)
                .responseBody(responseBody)
                .failureKind(FailureKind.NONE)
                .build();
    }

    public static WebhookExecutionResult failure(Integer statusCode, String errorMessage, FailureKind failureKind) {
        return WebhookExecutionResult.builder()
                .statusCode(statusCode)
                .success(false)
                .errorMessage(errorMessage)
                .failureKind(failureKind)
                .build();
    }

    /**
     * The failure kind, derived from the status code when the executor left it unset.
     */
    public FailureKind resolveFailureKind() {
        if (success) {
            return FailureKind.NONE;
        }
        if (failureKind != null && failureKind != FailureKind.NONE) {
            return failureKind;
        }
        if (statusCode != null && statusCode == 429) {
            return FailureKind.RATE_LIMITED;
        }
        return FailureKind.RETRYABLE;
    }
}
