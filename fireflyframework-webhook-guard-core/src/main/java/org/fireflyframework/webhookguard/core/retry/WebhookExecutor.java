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

package org.fireflyframework.webhookguard.core.retry;

import reactor.core.publisher.Mono;

/**
 * Port performing one delivery of a webhook.
 * <p>
 * Implementations should tag failures with a {@link org.fireflyframework.webhookguard.interfaces.enums.FailureKind}
 * rather than signal them as errors. Errors are still tolerated: the retry manager
 * records them as failed attempts.
 */
public interface WebhookExecutor {

    /**
     * Delivers the webhook once.
     *
     * @param webhookId  the webhook identifier
     * @param formId     the form the webhook belongs to
     * @param webhookUrl the delivery target
     * @param context    details of the attempt being made
     * @return the delivery outcome
     */
    Mono<WebhookExecutionResult> execute(String webhookId, String formId, String webhookUrl,
                                         RetryAttemptContext context);
}
