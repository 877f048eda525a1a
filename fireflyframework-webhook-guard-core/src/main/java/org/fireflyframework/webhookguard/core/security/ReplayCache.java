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

/**
 * Store of recently verified request fingerprints.
 * <p>
 * One instance is shared by every verifier in the process. Implementations must be
 * thread-safe; a distributed implementation can replace the in-memory one when
 * several instances receive webhooks.
 */
public interface ReplayCache {

    /**
     * @return {@code true} if the fingerprint is present and not expired
     */
    boolean contains(String fingerprint);

    /**
     * Remembers the fingerprint for the cache's replay window.
     */
    void put(String fingerprint);

    void evict(String fingerprint);

    int size();

    /**
     * Records the fingerprint unless it is already present.
     *
     * @return {@code true} if the fingerprint was new, {@code false} for a replay
     */
    default boolean markIfAbsent(String fingerprint) {
        if (contains(fingerprint)) {
            return false;
        }
        put(fingerprint);
        return true;
    }
}
