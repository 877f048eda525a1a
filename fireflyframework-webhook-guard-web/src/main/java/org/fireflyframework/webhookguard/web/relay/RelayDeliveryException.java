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


package org.fireflyframework.webhookguard.web.relay;

import org.fireflyframework.webhookguard.core.retry.WebhookExecutionResult;

/**
 * Signals a transient relay failure so the call can be retried in-process.
 */
public class RelayDeliveryException extends RuntimeException {

    private final transient WebhookExecutionResult result;

    public RelayDeliveryException(WebhookExecutionResult result) {
        super(result.getErrorMessage());
        this.result = result;
    }

    public WebhookExecutionResult getResult() {
        return result;
    }

    public Integer getStatusCode() {
        return result.getStatusCode();
    }
}
