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

package org.fireflyframework.webhookguard.core.health;

import lombok.RequiredArgsConstructor;
import org.fireflyframework.webhookguard.core.retry.WebhookRetryManager;
import org.fireflyframework.webhookguard.interfaces.dto.RetryQueueStatusDTO;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator reporting the webhook retry queue.
 */
@Component
@RequiredArgsConstructor
public class RetryQueueHealthIndicator implements HealthIndicator {

    private final WebhookRetryManager retryManager;

    @Override
    public Health health() {
        RetryQueueStatusDTO status = retryManager.getQueueStatus();
        return Health.up()
                .withDetail("queueSize", status.getQueueSize())
                .withDetail("totalRecords", status.getTotalRecords())
                .withDetail("statusDistribution", status.getStatusDistribution())
                .withDetail("processing", status.isProcessing())
                .build();
    }
}
