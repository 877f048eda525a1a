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

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Port for verifying inbound webhooks of one provider.
 * <p>
 * Expected rejections are emitted as a non-valid {@link VerificationResult}.
 * Only {@link PayloadTooLargeException} and {@link UnexpectedVerificationException}
 * are signalled as errors.
 */
public interface WebhookSignatureValidator {

    /**
     * Verifies the webhook with the configured secret and tolerance.
     *
     * @param payload the raw webhook payload (as received)
     * @param headers the HTTP headers containing the signature
     * @return a Mono emitting the verification result
     */
    Mono<VerificationResult> validateSignature(String payload, Map<String, String> headers);

    /**
     * @return the provider name in lowercase
     */
    String getProviderName();

    /**
     * @return {@code false} when no secret is configured and requests are accepted unchecked
     */
    default boolean isValidationRequired() {
        return true;
    }
}
