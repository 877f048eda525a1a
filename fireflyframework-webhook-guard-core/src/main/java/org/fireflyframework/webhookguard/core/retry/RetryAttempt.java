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
import org.fireflyframework.webhookguard.interfaces.dto.RetryAttemptDTO;
import org.fireflyframework.webhookguard.interfaces.enums.AttemptStatus;
import org.fireflyframework.webhookguard.interfaces.enums.FailureKind;

import java.time.Instant;

/**
 * One executed delivery attempt. Immutable once recorded.
 */
@Value
@Builder
public class RetryAttempt {

    int attemptNumber;
    Instant scheduledTime;
    Instant executedTime;
    AttemptStatus status;
    Integer responseStatusCode;
    String errorMessage;
    long durationMs;
    FailureKind failureKind;

    public boolean isFailed() {
        return status == AttemptStatus.FAILED;
    }

    RetryAttemptDTO toDto() {
        return RetryAttemptDTO.builder()
                .attemptNumber(attemptNumber)
                .scheduledTime(scheduledTime)
                .executedTime(executedTime)
                .status(status)
                .responseStatusCode(responseStatusCode)
                .errorMessage(errorMessage)
                .durationMs(durationMs)
                .failureKind(failureKind)
                .build();
    }
}
