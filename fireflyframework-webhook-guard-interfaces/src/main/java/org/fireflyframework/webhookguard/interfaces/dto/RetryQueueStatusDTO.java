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
import org.fireflyframework.webhookguard.interfaces.enums.RetryStatus;

import java.util.Map;

/**
 * Overview of the retry queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Retry queue overview")
public class RetryQueueStatusDTO {

    @Schema(description = "Records currently waiting for a retry", example = "4")
    private int queueSize;

    @Schema(description = "All known records, including terminal ones", example = "12")
    private int totalRecords;

    @Schema(description = "Number of records per retry status")
    private Map<RetryStatus, Long> statusDistribution;

    @Schema(description = "Whether a processing pass is running right now")
    private boolean processing;
}
