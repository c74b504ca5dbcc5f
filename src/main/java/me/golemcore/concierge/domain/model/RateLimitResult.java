package me.golemcore.concierge.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Result of a rate limit check operation.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the request was admitted</li>
 * <li>{@code remaining} - how many requests are left in the current
 * window</li>
 * <li>{@code resetInMs} - time until the oldest request leaves the window</li>
 * <li>{@code reason} - explanation for denial</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private int remaining;
    private long resetInMs;
    private String reason;

    public static RateLimitResult allowed(int remaining, long resetInMs) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(remaining)
                .resetInMs(resetInMs)
                .build();
    }

    public static RateLimitResult denied(long resetInMs, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .remaining(0)
                .resetInMs(resetInMs)
                .reason(reason)
                .build();
    }
}
