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

package org.fireflyframework.webhookguard.interfaces.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.fireflyframework.webhookguard.interfaces.enums.AttemptStatus;
import org.fireflyframework.webhookguard.interfaces.enums.FailureKind;

import java.time.Instant;

/**
 * Snapshot of one recorded delivery attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single retry attempt of a webhook delivery")
public class RetryAttemptDTO {

    @Schema(description = "1-based attempt number", example = "1")
    private int attemptNumber;

    @Schema(description = "When the attempt was due")
    private Instant scheduledTime;

    @Schema(description = "When the attempt actually ran")
    private Instant executedTime;

    @Schema(description = "Attempt outcome", example = "FAILED")
    private AttemptStatus status;

    @Schema(description = "HTTP status returned by the target, if any", example = "503")
    private Integer responseStatusCode;

    @Schema(description = "Error message, if the attempt failed")
    private String errorMessage;

    @Schema(description = "Attempt duration in milliseconds", example = "125")
    private long durationMs;

    @Schema(description = "Failure classification", example = "RETRYABLE")
    private FailureKind failureKind;
}
