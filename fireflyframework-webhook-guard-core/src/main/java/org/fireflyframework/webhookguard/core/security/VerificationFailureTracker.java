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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts verification failures per source and raises alerts on repeated failures.
 * <p>
 * Failures older than the alert window are forgotten. Once an alert fired for a
 * source, no further alert fires for it until the cooldown elapsed, except that a
 * warning may still escalate to critical.
 */
@Slf4j
public class VerificationFailureTracker {

    public enum AlertLevel {
        NONE,
        WARNING,
        CRITICAL
    }

    private final WebhookSecurityProperties.Alert config;
    private final Clock clock;
    private final Map<String, Deque<Instant>> failures = new HashMap<>();
    private final Map<String, Instant> lastAlerts = new HashMap<>();
    private final Map<String, AlertLevel> lastAlertLevels = new HashMap<>();

    public VerificationFailureTracker(WebhookSecurityProperties.Alert config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Records a failed verification from {@code source}.
     *
     * @return the alert raised by this failure, {@link AlertLevel#NONE} if none
     */
    public synchronized AlertLevel recordFailure(String source, VerificationFailure failure) {
        String key = source != null ? source : "unknown";
        Instant now = clock.instant();
        Deque<Instant> recent = failures.computeIfAbsent(key, k -> new ArrayDeque<>());
        purgeOld(recent, now);
        recent.addLast(now);

        int count = recent.size();
        if (count < config.getFailureThreshold()) {
            return AlertLevel.NONE;
        }
        AlertLevel level = count >= config.getCriticalFailureThreshold() ? AlertLevel.CRITICAL : AlertLevel.WARNING;
        Instant lastAlert = lastAlerts.get(key);
        boolean coolingDown = lastAlert != null && lastAlert.plus(config.getCooldown()).isAfter(now);
        if (coolingDown && !(level == AlertLevel.CRITICAL && lastAlertLevels.get(key) == AlertLevel.WARNING)) {
            return AlertLevel.NONE;
        }

        lastAlerts.put(key, now);
        lastAlertLevels.put(key, level);
        log.warn("SECURITY ALERT: {} webhook verification failures from {} within {} minutes. Alert level: {}, last failure: {}",
                count, key, config.getTimeWindow().toMinutes(), level, failure);
        return level;
    }

    public synchronized int getFailureCount(String source) {
        Deque<Instant> recent = failures.get(source);
        if (recent == null) {
            return 0;
        }
        purgeOld(recent, clock.instant());
        if (recent.isEmpty()) {
            failures.remove(source);
            return 0;
        }
        return recent.size();
    }

    private void purgeOld(Deque<Instant> recent, Instant now) {
        Instant threshold = now.minus(config.getTimeWindow());
        while (!recent.isEmpty() && !recent.peekFirst().isAfter(threshold)) {
            recent.removeFirst();
        }
    }
}
