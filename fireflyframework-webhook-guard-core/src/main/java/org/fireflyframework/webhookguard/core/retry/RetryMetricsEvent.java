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
import org.fireflyframework.webhookguard.interfaces.dto.RetryProcessingSummaryDTO;
import org.fireflyframework.webhookguard.interfaces.enums.FailureKind;
import org.fireflyframework.webhookguard.interfaces.enums.PermanentFailureReason;

import java.time.Instant;

/**
 * Structured event emitted by the retry manager. Fields irrelevant to the
 * event type are {@code null}.
 */
@Value
@Builder
public class RetryMetricsEvent {

    RetryEventType type;
    Instant timestamp;
    String webhookId;
    String formId;
    Integer attemptNumber;
    Integer statusCode;
    Long durationMs;
    FailureKind failureKind;
    PermanentFailureReason permanentFailureReason;
    RetryProcessingSummaryDTO summary;
}
