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

package org.fireflyframework.webhookguard.interfaces.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response returned to the webhook sender after verification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response after an inbound webhook was verified")
public class WebhookVerificationResponseDTO {

    @Schema(description = "Webhook identifier", example = "wh_01HZX3")
    private String webhookId;

    @Schema(description = "Verification status", example = "ACCEPTED", allowableValues = {"ACCEPTED", "REJECTED", "ERROR"})
    private String status;

    @Schema(description = "Message describing the result", example = "Webhook verified and accepted")
    private String message;

    @Schema(description = "Failure tag when rejected", example = "SIGNATURE_MISMATCH")
    private String reason;

    @Schema(description = "Timestamp when the webhook was received")
    private Instant receivedAt;

    public static WebhookVerificationResponseDTO accepted(String webhookId) {
        return WebhookVerificationResponseDTO.builder()
                .webhookId(webhookId)
                .status("ACCEPTED")
                .message("Webhook verified and accepted")
                .receivedAt(Instant.now())
                .build();
    }

    public static WebhookVerificationResponseDTO rejected(String webhookId, String reason, String message) {
        return WebhookVerificationResponseDTO.builder()
                .webhookId(webhookId)
                .status("REJECTED")
                .reason(reason)
                .message(message)
                .receivedAt(Instant.now())
                .build();
    }

    public static WebhookVerificationResponseDTO error(String webhookId, String message) {
        return WebhookVerificationResponseDTO.builder()
                .webhookId(webhookId)
                .status("ERROR")
                .message(message)
                .receivedAt(Instant.now())
                .build();
    }
}
