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

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the raw payload of every webhook waiting in the retry queue, keyed by webhook id.
 */
@Component
public class RelayPayloadStore {

    private final ConcurrentHashMap<String, String> payloads = new ConcurrentHashMap<>();

    public void put(String webhookId, String payload) {
        payloads.put(webhookId, payload);
    }

    public Optional<String> get(String webhookId) {
        return Optional.ofNullable(payloads.get(webhookId));
    }

    public boolean remove(String webhookId) {
        return payloads.remove(webhookId) != null;
    }

    public Set<String> ids() {
        return Set.copyOf(payloads.keySet());
    }

    public int size() {
        return payloads.size();
    }
}
