package me.golemcore.concierge.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Size-bounded store of per-tenant sliding windows.
 *
 * <p>
 * Windows are kept in access order; once more than
 * {@code concierge.rate-limit.max-tracked-tenants} tenants are tracked, the
 * least recently touched tenant is evicted. A plain index mirrors the windows
 * so lookups that must not count as a use stay constant time. All map access
 * is serialized on the store, while counting happens under each window's own
 * lock so tenants never contend on each other's counters.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class RateLimitStore {

    private final long windowMs;
    private final Map<String, SlidingWindow> windows;
    private final Map<String, SlidingWindow> index = new HashMap<>();

    public RateLimitStore(ConciergeProperties properties) {
        this(properties.getRateLimit().getWindowMs(), properties.getRateLimit().getMaxTrackedTenants());
    }

    public RateLimitStore(long windowMs, int maxTrackedTenants) {
        this.windowMs = windowMs;
        this.windows = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SlidingWindow> eldest) {
                boolean evict = size() > maxTrackedTenants;
                if (evict) {
                    index.remove(eldest.getKey());
                    log.debug("[RateLimit] Evicting least recently used tenant window: {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    /**
     * Returns the tenant's window, creating it if needed, and marks the tenant as
     * most recently used.
     */
    public synchronized SlidingWindow touch(String tenantId) {
        SlidingWindow window = index.get(tenantId);
        if (window != null) {
            windows.get(tenantId);
            return window;
        }
        window = new SlidingWindow(windowMs);
        index.put(tenantId, window);
        windows.put(tenantId, window);
        return window;
    }

    /**
     * Returns the tenant's window without creating it or changing the eviction
     * order.
     */
    public synchronized Optional<SlidingWindow> peek(String tenantId) {
        return Optional.ofNullable(index.get(tenantId));
    }

    public synchronized void remove(String tenantId) {
        windows.remove(tenantId);
        index.remove(tenantId);
    }

    public synchronized void clear() {
        windows.clear();
        index.clear();
    }

    public synchronized int trackedTenants() {
        return windows.size();
    }

    public synchronized boolean isTracked(String tenantId) {
        return index.containsKey(tenantId);
    }

    public long getWindowMs() {
        return windowMs;
    }
}
