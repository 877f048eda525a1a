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

import lombok.Getter;

/**
 * Raised when a webhook payload exceeds the configured maximum size.
 */
@Getter
public class PayloadTooLargeException extends WebhookSecurityException {

    private final long payloadSize;
    private final long maxPayloadSize;

    public PayloadTooLargeException(long payloadSize, long maxPayloadSize) {
        super("Payload size exceeds maximum allowed (" + maxPayloadSize + " bytes)");
        this.payloadSize = payloadSize;
        this.maxPayloadSize = maxPayloadSize;
    }
}
