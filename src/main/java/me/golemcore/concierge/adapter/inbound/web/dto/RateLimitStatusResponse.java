package me.golemcore.concierge.adapter.inbound.web.dto;

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
 * Response of {@code GET /api/inbound/rate-limit/{tenantId}}.
 */
public record RateLimitStatusResponse(String tenantId, boolean allowed, int remaining, long resetInMs) {

    public static RateLimitStatusResponse of(String tenantId, RateLimitResult result) {
        return new RateLimitStatusResponse(tenantId, result.isAllowed(), result.getRemaining(),
                result.getResetInMs());
    }
}
