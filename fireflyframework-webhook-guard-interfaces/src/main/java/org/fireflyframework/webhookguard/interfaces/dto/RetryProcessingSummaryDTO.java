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

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one pass over the due retries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Summary of a retry processing pass")
public class RetryProcessingSummaryDTO {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ALREADY_PROCESSING = "already_processing";

    @Schema(description = "Pass status", example = "completed", allowableValues = {"completed", "already_processing"})
    private String status;

    @Schema(description = "Due records handled in this pass", example = "5")
    private int processed;

    @Schema(description = "Records delivered successfully", example = "2")
    private int successful;

    @Schema(description = "Records that failed again and stay pending", example = "2")
    private int failed;

    @Schema(description = "Records disabled or exhausted in this pass", example = "1")
    private int disabled;

    @Schema(description = "Queued ids without a backing record", example = "0")
    private int skipped;

    @Schema(description = "Records whose processing raised an unexpected error", example = "0")
    private int errors;

    @Schema(description = "Pass duration in milliseconds", example = "840")
    private Long durationMs;

    public static RetryProcessingSummaryDTO alreadyProcessing() {
        return RetryProcessingSummaryDTO.builder()
                .status(STATUS_ALREADY_PROCESSING)
                .build();
    }

    public boolean isAlreadyProcessing() {
        return STATUS_ALREADY_PROCESSING.equals(status);
    }
}
