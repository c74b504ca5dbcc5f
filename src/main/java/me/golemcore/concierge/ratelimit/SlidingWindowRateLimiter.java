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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.model.RateLimitResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Sliding window rate limiter keyed by tenant.
 *
 * <p>
 * Implements {@link RateLimiter} on top of an injected {@link RateLimitStore}
 * so the bounded state is explicit and replaceable in tests. A non-positive
 * limit denies every request.
 *
 * @since 1.0
 * @see SlidingWindow
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private final RateLimitStore store;
    private final Clock clock;

    @Override
    public RateLimitResult admit(String tenantId, int limitPerMinute) {
        if (limitPerMinute <= 0) {
            return RateLimitResult.denied(store.getWindowMs(), "Rate limit exceeded: engine runs disabled");
        }

        SlidingWindow window = store.touch(tenantId);
        RateLimitResult result = window.tryAcquire(clock.millis(), limitPerMinute);
        if (!result.isAllowed()) {
            log.warn("[RateLimit] Tenant {} denied: {} (reset in {}ms)",
                    tenantId, result.getReason(), result.getResetInMs());
        }
        return result;
    }

    @Override
    public RateLimitResult status(String tenantId, int limitPerMinute) {
        if (limitPerMinute <= 0) {
            return RateLimitResult.denied(store.getWindowMs(), "Rate limit exceeded: engine runs disabled");
        }

        Optional<SlidingWindow> window = store.peek(tenantId);
        if (window.isEmpty()) {
            return RateLimitResult.allowed(limitPerMinute, store.getWindowMs());
        }
        return window.get().peek(clock.millis(), limitPerMinute);
    }

    @Override
    public void reset(String tenantId) {
        store.remove(tenantId);
        log.info("[RateLimit] Reset window for tenant {}", tenantId);
    }

    @Override
    public void resetAll() {
        store.clear();
        log.info("[RateLimit] Reset all tenant windows");
    }
}
