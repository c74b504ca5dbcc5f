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

import me.golemcore.concierge.domain.model.RateLimitResult;

/**
 * Per-tenant admission control over a sliding one-minute window.
 *
 * <p>
 * {@link #admit(String, int)} records the request when it is allowed.
 * {@link #status(String, int)} reports the same numbers without recording
 * anything and is meant for dashboards.
 *
 * @since 1.0
 * @see SlidingWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Check the tenant's window and record the request if admitted.
     */
    RateLimitResult admit(String tenantId, int limitPerMinute);

    /**
     * Read-only view of the tenant's window.
     */
    RateLimitResult status(String tenantId, int limitPerMinute);

    /**
     * Forget all recorded requests of a tenant.
     */
    void reset(String tenantId);

    /**
     * Forget all recorded requests of every tenant.
     */
    void resetAll();
}
