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

package org.fireflyframework.webhookguard.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the outbound rate limiter.
 * <p>
 * Typeform allows 2 requests per second per account, which is the default.
 */
@Configuration
@ConfigurationProperties(prefix = "firefly.webhook-guard.rate-limit")
@Data
public class RateLimitProperties {

    /**
     * Requests per second allowed towards the third-party API
     */
    private double requestsPerSecond = 2.0;

    /**
     * Route retry deliveries through the rate limiter
     */
    private boolean applyToRetries = true;
}
