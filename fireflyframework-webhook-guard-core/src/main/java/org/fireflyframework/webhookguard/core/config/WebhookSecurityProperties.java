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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for inbound webhook verification.
 * <p>
 * All properties can be configured via:
 * <ul>
 *   <li>application.yml: {@code firefly.webhook-guard.security.max-payload-size: 2097152}</li>
 *   <li>Environment variables: {@code FIREFLY_WEBHOOKGUARD_SECURITY_MAXPAYLOADSIZE=2097152}</li>
 *   <li>System properties: {@code -Dfirefly.webhook-guard.security.max-payload-size=2097152}</li>
 * </ul>
 * <p>
 * Example environment variables:
 * <pre>
 * FIREFLY_WEBHOOKGUARD_SECURITY_WEBHOOKSECRET=tf_secret_value
 * FIREFLY_WEBHOOKGUARD_SECURITY_SIGNATUREHEADER=Typeform-Signature
 * FIREFLY_WEBHOOKGUARD_SECURITY_TIMESTAMPTOLERANCEMINUTES=5
 * FIREFLY_WEBHOOKGUARD_SECURITY_REPLAYWINDOW=PT10M
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "firefly.webhook-guard.security")
@Data
public class WebhookSecurityProperties {

    /**
     * Shared secret used to sign webhooks. When blank, signature verification is skipped.
     */
    private String webhookSecret;

    /**
     * Header carrying the signature, looked up case-insensitively
     */
    private String signatureHeader = "Typeform-Signature";

    /**
     * Maximum payload size in bytes (default: 1MB)
     */
    private long maxPayloadSize = 1048576; // 1MB

    /**
     * Maximum allowed distance between the webhook timestamp and now
     */
    private int timestampToleranceMinutes = 5;

    /**
     * Accepted timestamp headers, checked in order. The first one present wins.
     */
    private List<String> timestampHeaders = new ArrayList<>(List.of("x-typeform-timestamp", "timestamp", "x-timestamp"));

    /**
     * How long a verified request fingerprint is remembered for replay detection
     */
    private Duration replayWindow = Duration.ofMinutes(10);

    /**
     * Hard cap on remembered fingerprints. The oldest-expiring half is evicted past it.
     */
    private int replayCacheMaxEntries = 5000;

    /**
     * Alerting on repeated verification failures from the same source
     */
    private Alert alert = new Alert();

    public boolean isVerificationEnabled() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    @Data
    public static class Alert {

        /**
         * Failures within the window that raise a warning
         */
        private int failureThreshold = 5;

        /**
         * Failures within the window that raise a critical alert
         */
        private int criticalFailureThreshold = 10;

        private Duration timeWindow = Duration.ofMinutes(15);

        /**
         * Minimum time between two alerts for the same source
         */
        private Duration cooldown = Duration.ofMinutes(30);
    }
}
