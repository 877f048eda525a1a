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

import java.time.Instant;

/**
 * Compliance report of the outbound rate limiter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outbound rate limiter status")
public class RateLimitStatusDTO {

    @Schema(description = "Configured requests per second", example = "2.0")
    private double configuredRate;

    @Schema(description = "Observed requests per second over the last 60 seconds", example = "1.25")
    private double actualRate60s;

    @Schema(description = "Configured rate as a percentage of the observed rate, capped at 100", example = "100.0")
    private double compliancePercent;

    @Schema(description = "Whether the observed rate stays within the configured rate")
    private boolean compliant;

    @Schema(description = "Milliseconds until the next request may be sent", example = "0")
    private long timeToNextRequestMs;

    @Schema(description = "Timestamps currently held in the reporting window", example = "42")
    private int totalRequestsTracked;

    @Schema(description = "When the last request was admitted")
    private Instant lastRequestTime;
}
