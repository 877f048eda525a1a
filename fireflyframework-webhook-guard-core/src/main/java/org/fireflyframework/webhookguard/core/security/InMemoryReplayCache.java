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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Size- and TTL-bounded replay cache guarded by a single lock.
 * <p>
 * Expired entries are dropped lazily on every access. Past {@code maxEntries} the
 * oldest-expiring half is evicted, which bounds memory at the cost of forgetting
 * some fingerprints before their window ends.
 */
@Slf4j
public class InMemoryReplayCache implements ReplayCache {

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Instant> expiries = new HashMap<>();

    public InMemoryReplayCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Replay window must be positive, was " + ttl);
        }
        if (maxEntries < 2) {
            throw new IllegalArgumentException("Replay cache must hold at least 2 entries, was " + maxEntries);
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public boolean contains(String fingerprint) {
        lock.lock();
        try {
            Instant now = clock.instant();
            purgeExpired(now);
            return expiries.containsKey(fingerprint);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String fingerprint) {
        lock.lock();
        try {
            Instant now = clock.instant();
            purgeExpired(now);
            store(fingerprint, now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean markIfAbsent(String fingerprint) {
        lock.lock();
        try {
            Instant now = clock.instant();
            purgeExpired(now);
            if (expiries.containsKey(fingerprint)) {
                return false;
            }
            store(fingerprint, now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void evict(String fingerprint) {
        lock.lock();
        try {
            expiries.remove(fingerprint);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            purgeExpired(clock.instant());
            return expiries.size();
        } finally {
            lock.unlock();
        }
    }

    private void store(String fingerprint, Instant now) {
        expiries.put(fingerprint, now.plus(ttl));
        if (expiries.size() > maxEntries) {
            evictOldestHalf();
        }
    }

    private void purgeExpired(Instant now) {
        Iterator<Map.Entry<String, Instant>> it = expiries.entrySet().iterator();
        while (it.hasNext()) {
            if (!it.next().getValue().isAfter(now)) {
                it.remove();
            }
        }
    }

    private void evictOldestHalf() {
        List<Map.Entry<String, Instant>> entries = new ArrayList<>(expiries.entrySet());
        entries.sort(Map.Entry.comparingByValue());
        int toEvict = entries.size() / 2;
        for (int i = 0; i < toEvict; i++) {
            expiries.remove(entries.get(i).getKey());
        }
        log.debug("Replay cache over capacity, evicted {} oldest-expiring fingerprints", toEvict);
    }
}
