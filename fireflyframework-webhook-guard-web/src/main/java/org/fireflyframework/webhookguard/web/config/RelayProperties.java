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


package org.fireflyframework.webhookguard.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for relaying verified webhooks to the downstream target.
 */
@Configuration
@ConfigurationProperties(prefix = "firefly.webhook-guard.relay")
@Data
public class RelayProperties {

    /**
     * Downstream URL that receives verified payloads. Relaying is disabled when blank.
     */
    private String targetUrl;

    /**
     * Header carrying the Typeform form id on inbound requests.
     */
    private String formIdHeader = "x-typeform-form-id";

    /**
     * Header carrying the delivery id on inbound requests and outbound relays.
     */
    private String webhookIdHeader = "x-webhook-id";

    /**
     * Timeout applied to each outbound HTTP call.
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    public boolean isRelayEnabled() {
        return targetUrl != null && !targetUrl.isBlank();
    }
}
