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

package org.fireflyframework.webhookguard.core.security;

/**
 * Expected reasons for rejecting an inbound webhook.
 */
public enum VerificationFailure {

    MISSING_SIGNATURE("Missing webhook signature in headers"),
    INVALID_SIGNATURE_FORMAT("Invalid webhook signature format"),
    SIGNATURE_MISMATCH("Invalid webhook signature"),
    TIMESTAMP_OUT_OF_TOLERANCE("Webhook timestamp outside tolerance"),
    REPLAY_DETECTED("Potential replay attack detected");

    private final String description;

    VerificationFailure(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
