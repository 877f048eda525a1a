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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.webhookguard.core.config.WebhookSecurityProperties;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Verifies Typeform webhooks.
 * <p>
 * Checks run in order and stop at the first failure: payload size, signature
 * presence and format, HMAC, optional timestamp, replay. A payload over the size
 * limit raises {@link PayloadTooLargeException}; any internal error is wrapped in
 * {@link UnexpectedVerificationException}. Every other rejection is returned.
 */
@Slf4j
public class TypeformSignatureVerifier implements WebhookSignatureValidator {

    private static final int BASE64_SIGNATURE_LENGTH = 44;
    private static final int HEX_SIGNATURE_LENGTH = 64;
    private static final int DIGEST_LENGTH = 32;

    private final WebhookSecurityProperties properties;
    private final ReplayCache replayCache;
    private final Clock clock;

    public TypeformSignatureVerifier(WebhookSecurityProperties properties, ReplayCache replayCache, Clock clock) {
        this.properties = properties;
        this.replayCache = replayCache;
        this.clock = clock;

        if (!properties.isVerificationEnabled()) {
            log.warn("Webhook secret not configured - signature verification disabled");
        }
    }

    @Override
    public Mono<VerificationResult> validateSignature(String payload, Map<String, String> headers) {
        return Mono.fromCallable(() -> verify(payload, headers));
    }

    @Override
    public String getProviderName() {
        return "typeform";
    }

    @Override
    public boolean isValidationRequired() {
        return properties.isVerificationEnabled();
    }

    /**
     * Verifies with the configured secret and timestamp tolerance.
     */
    public VerificationResult verify(String payload, Map<String, String> headers) {
        return verify(payload, headers, properties.getWebhookSecret(), properties.getTimestampToleranceMinutes());
    }

    /**
     * Verifies an inbound webhook.
     *
     * @param payload                   raw payload as received
     * @param headers                   request headers, matched case-insensitively
     * @param secret                    shared secret; blank disables verification
     * @param timestampToleranceMinutes allowed clock distance for the timestamp header
     * @return the verification result
     * @throws PayloadTooLargeException        when the payload exceeds the size limit
     * @throws UnexpectedVerificationException on any internal failure
     */
    public VerificationResult verify(String payload, Map<String, String> headers, String secret,
                                     int timestampToleranceMinutes) {
        try {
            String body = payload != null ? payload : "";
            long size = body.getBytes(StandardCharsets.UTF_8).length;
            if (size > properties.getMaxPayloadSize()) {
                log.warn("Webhook payload too large: {} bytes (max {})", size, properties.getMaxPayloadSize());
                throw new PayloadTooLargeException(size, properties.getMaxPayloadSize());
            }

            if (secret == null || secret.isBlank()) {
                log.warn("Webhook signature verification skipped - no secret configured");
                return VerificationResult.skipped();
            }

            String headerValue = findHeader(headers, properties.getSignatureHeader());
            if (headerValue == null || headerValue.isEmpty()) {
                log.warn("Missing signature header: {}", properties.getSignatureHeader());
                return VerificationResult.rejected(VerificationFailure.MISSING_SIGNATURE);
            }

            byte[] provided = decodeSignature(headerValue);
            if (provided == null) {
                return VerificationResult.rejected(VerificationFailure.INVALID_SIGNATURE_FORMAT);
            }

            byte[] expected = TypeformSignatures.digest(body, secret);
            if (!MessageDigest.isEqual(expected, provided)) {
                log.warn("Signature verification failed for payload hash: {}...", hashPrefix(body));
                return VerificationResult.rejected(VerificationFailure.SIGNATURE_MISMATCH);
            }

            if (!isTimestampWithinTolerance(headers, timestampToleranceMinutes)) {
                log.warn("Webhook timestamp verification failed");
                return VerificationResult.rejected(VerificationFailure.TIMESTAMP_OUT_OF_TOLERANCE,
                        "Webhook timestamp outside tolerance (" + timestampToleranceMinutes + " minutes)");
            }

            // canonical encoding, so hex and base64 forms of one signature share a fingerprint
            String fingerprint = TypeformSignatures.sha256Hex(body) + ":" + Base64.getEncoder().encodeToString(provided);
            if (!replayCache.markIfAbsent(fingerprint)) {
                log.warn("Replay attack detected for payload hash: {}...", hashPrefix(body));
                return VerificationResult.rejected(VerificationFailure.REPLAY_DETECTED);
            }

            log.info("Webhook signature verification successful");
            return VerificationResult.valid();
        } catch (WebhookSecurityException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error during webhook verification", e);
            throw new UnexpectedVerificationException(
                    "Unexpected error during webhook verification: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes {@code sha256=<44 base64 | 64 hex>} into the raw digest.
     *
     * @return the 32 digest bytes, or {@code null} when the value is malformed
     */
    private byte[] decodeSignature(String headerValue) {
        for (int i = 0; i < headerValue.length(); i++) {
            char c = headerValue.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                log.warn("Invalid signature format: contains whitespace or control characters");
                return null;
            }
        }
        if (!headerValue.startsWith(TypeformSignatures.PREFIX)) {
            log.warn("Invalid signature format: missing or incorrect prefix");
            return null;
        }

        String encoded = headerValue.substring(TypeformSignatures.PREFIX.length());
        try {
            byte[] decoded;
            if (encoded.length() == BASE64_SIGNATURE_LENGTH) {
                decoded = Base64.getDecoder().decode(encoded);
            } else if (encoded.length() == HEX_SIGNATURE_LENGTH) {
                decoded = HexFormat.of().parseHex(encoded);
            } else {
                log.warn("Invalid signature format: incorrect length {}, expected {} (base64) or {} (hex)",
                        encoded.length(), BASE64_SIGNATURE_LENGTH, HEX_SIGNATURE_LENGTH);
                return null;
            }
            if (decoded.length != DIGEST_LENGTH) {
                log.warn("Invalid signature format: decodes to {} bytes", decoded.length);
                return null;
            }
            return decoded;
        } catch (IllegalArgumentException e) {
            log.warn("Invalid signature format: not valid base64 or hex");
            return null;
        }
    }

    private boolean isTimestampWithinTolerance(Map<String, String> headers, int toleranceMinutes) {
        String timestamp = null;
        for (String name : timestampHeaders()) {
            timestamp = findHeader(headers, name);
            if (timestamp != null && !timestamp.isBlank()) {
                break;
            }
        }
        if (timestamp == null || timestamp.isBlank()) {
            return true;
        }

        try {
            double epochSeconds = Double.parseDouble(timestamp.trim());
            if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
                log.warn("Invalid timestamp format: {}", timestamp);
                return false;
            }
            Instant sentAt = Instant.ofEpochMilli(Math.round(epochSeconds * 1000));
            Duration distance = Duration.between(sentAt, clock.instant()).abs();
            if (distance.compareTo(Duration.ofMinutes(toleranceMinutes)) > 0) {
                log.warn("Webhook timestamp too far from now: {} seconds", distance.toSeconds());
                return false;
            }
            return true;
        } catch (NumberFormatException e) {
            log.warn("Invalid timestamp format: {}", timestamp);
            return false;
        }
    }

    private List<String> timestampHeaders() {
        List<String> names = properties.getTimestampHeaders();
        return names != null ? names : List.of();
    }

    private static String findHeader(Map<String, String> headers, String name) {
        if (headers == null || name == null) {
            return null;
        }
        String value = headers.get(name);
        if (value != null) {
            return value;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String hashPrefix(String payload) {
        return TypeformSignatures.sha256Hex(payload).substring(0, 8);
    }
}
