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
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Record of one booking action against the tenant calendar. Successful create
 * entries double as the idempotency ledger and as the fallback index for
 * locating an event by session or phone.
 */
@Value
@Builder
public class BookingLogEntry {

    String id;
    String tenantId;
    String sessionId;
    String action; // check, create, modify, cancel
    String idempotencyKey;
    String eventId;
    String phone;
    String status; // success, blocked, error, handoff
    Map<String, Object> input;
    Map<String, Object> result;
    Instant createdAt;
}
