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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of verifying an inbound webhook.
 * <p>
 * {@code verificationSkipped} is set when no secret is configured: the request is
 * accepted but nothing was checked, callers should surface that.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VerificationResult {

    private static final VerificationResult VALID = new VerificationResult(true, null, null, false);
    private static final VerificationResult SKIPPED = new VerificationResult(true, null, null, true);

    boolean valid;
    VerificationFailure failure;
    String message;
    boolean verificationSkipped;

    public static VerificationResult valid() {
        return VALID;
    }

    public static VerificationResult skipped() {
        return SKIPPED;
    }

    public static VerificationResult rejected(VerificationFailure failure) {
        return new VerificationResult(false, failure, failure.getDescription(), false);
    }

    public static VerificationResult rejected(VerificationFailure failure, String message) {
        return new VerificationResult(false, failure, message, false);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(message);
    }
}
