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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Thread-safe sliding window of request timestamps for a single tenant.
 *
 * <p>
 * Timestamps older than the window are pruned lazily on every access. The
 * window denies when the number of timestamps still inside it reaches the
 * limit, and reports the time until the oldest one leaves the window.
 *
 * @since 1.0
 */
public class SlidingWindow {

    private final long windowMs;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public SlidingWindow(long windowMs) {
        this.windowMs = windowMs;
    }

    /**
     * Try to record one request at {@code nowMs}.
     */
    public synchronized RateLimitResult tryAcquire(long nowMs, int limit) {
        prune(nowMs);

        if (timestamps.size() >= limit) {
            return RateLimitResult.denied(resetInMs(nowMs), deniedReason(limit));
        }

        timestamps.addLast(nowMs);
        return RateLimitResult.allowed(limit - timestamps.size(), resetInMs(nowMs));
    }

    /**
     * Report the window state at {@code nowMs} without recording a request.
     */
    public synchronized RateLimitResult peek(long nowMs, int limit) {
        prune(nowMs);

        int count = timestamps.size();
        if (count >= limit) {
            return RateLimitResult.denied(resetInMs(nowMs), deniedReason(limit));
        }
        return RateLimitResult.allowed(limit - count, resetInMs(nowMs));
    }

    public synchronized int size(long nowMs) {
        prune(nowMs);
        return timestamps.size();
    }

    private void prune(long nowMs) {
        long cutoff = nowMs - windowMs;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }

    private long resetInMs(long nowMs) {
        Long oldest = timestamps.peekFirst();
        if (oldest == null) {
            return windowMs;
        }
        return Math.max(0, oldest + windowMs - nowMs);
    }

    private String deniedReason(int limit) {
        return String.format(Locale.ROOT, "Rate limit exceeded: %d/%d requests per minute",
                timestamps.size(), limit);
    }
}
