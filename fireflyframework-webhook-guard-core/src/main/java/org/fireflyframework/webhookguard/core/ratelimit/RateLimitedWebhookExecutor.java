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

package org.fireflyframework.webhookguard.core.ratelimit;

import lombok.RequiredArgsConstructor;
import org.fireflyframework.webhookguard.core.retry.RetryAttemptContext;
import org.fireflyframework.webhookguard.core.retry.WebhookExecutionResult;
import org.fireflyframework.webhookguard.core.retry.WebhookExecutor;
import reactor.core.publisher.Mono;

/**
 * Executor decorator that takes a rate limiter slot before every delivery.
 * <p>
 * Used when retries target a shared third-party endpoint.
 */
@RequiredArgsConstructor
public class RateLimitedWebhookExecutor implements WebhookExecutor {

    private final WebhookExecutor delegate;
    private final OutboundRateLimiter rateLimiter;

    @Override
    public Mono<WebhookExecutionResult> execute(String webhookId, String formId, String webhookUrl,
                                                RetryAttemptContext context) {
        return rateLimiter.throttle(Mono.defer(() -> delegate.execute(webhookId, formId, webhookUrl, context)));
    }
}
