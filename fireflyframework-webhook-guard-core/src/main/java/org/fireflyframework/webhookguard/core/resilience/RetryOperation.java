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

package org.fireflyframework.webhookguard.core.resilience;

/**
 * Kinds of operations retried by the {@link ResilientRetryHandler}, each with its own
 * default retry configuration.
 */
public enum RetryOperation {
    TYPEFORM_API_REQUEST,
    WEBHOOK_PROCESSING,
    DATABASE_OPERATION,
    FORM_RESPONSE_PROCESSING,
    CLIENT_IDENTIFIER_EXTRACTION,
    EXTERNAL_API_CALL
}
