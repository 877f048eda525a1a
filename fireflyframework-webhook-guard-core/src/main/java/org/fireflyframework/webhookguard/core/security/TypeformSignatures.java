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

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Typeform signature scheme: {@code sha256=base64(HMAC_SHA256(secret, payload + "\n"))}.
 */
public final class TypeformSignatures {

    public static final String PREFIX = "sha256=";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private TypeformSignatures() {
    }

    /**
     * Produces the signature header value for {@code payload}.
     *
     * @param payload the raw payload
     * @param secret  the shared secret
     * @return {@code sha256=<base64 digest>}
     */
    public static String sign(String payload, String secret) {
        return PREFIX + Base64.getEncoder().encodeToString(digest(payload, secret));
    }

    /**
     * Raw HMAC-SHA256 digest over {@code payload + "\n"}.
     */
    public static byte[] digest(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal((payload + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    static String sha256Hex(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
