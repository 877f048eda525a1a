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
import org.fireflyframework.webhookguard.interfaces.enums.PermanentFailureReason;
import org.fireflyframework.webhookguard.interfaces.enums.RetryStatus;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a webhook retry record, used for status and audit queries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Retry state of a failed webhook delivery")
public class WebhookRetryRecordDTO {

    @Schema(description = "Webhook identifier", example = "wh_01HZX3")
    private String webhookId;

    @Schema(description = "Form the webhook belongs to", example = "abc123")
    private String formId;

    @Schema(description = "Delivery target URL", example = "https://example.com/hooks/typeform")
    private String webhookUrl;

    @Schema(description = "When the first delivery failed")
    private Instant initialFailureTime;

    @Schema(description = "Reason given for the first failure", example = "timeout")
    private String initialFailureReason;

    @Schema(description = "Status code of the first failure, if any", example = "500")
    private Integer initialStatusCode;

    @Schema(description = "Current retry status", example = "PENDING")
    private RetryStatus retryStatus;

    @Schema(description = "Total attempts executed", example = "3")
    private int totalAttempts;

    @Schema(description = "Successful attempts", example = "0")
    private int successfulAttempts;

    @Schema(description = "Failed attempts", example = "3")
    private int failedAttempts;

    @Schema(description = "Failure rate in percent", example = "100.0")
    private double failureRate;

    @Schema(description = "Next scheduled attempt, if pending")
    private Instant nextRetryTime;

    @Schema(description = "Last executed attempt")
    private Instant lastAttemptTime;

    @Schema(description = "Why the record was disabled, if it was", example = "FAILURE_RATE_EXCEEDED")
    private PermanentFailureReason permanentFailureReason;

    @Schema(description = "Attempt history, oldest first")
    private List<RetryAttemptDTO> attempts;

    @Schema(description = "Failure reasons reported by repeated scheduling calls")
    private List<String> failureNotes;
}
