package me.golemcore.concierge.port.outbound;

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

import me.golemcore.concierge.domain.model.BookingLogEntry;

import java.util.Optional;

/**
 * Booking request log used for idempotency and event lookup.
 */
public interface BookingLogPort {

    void append(BookingLogEntry entry);

    Optional<BookingLogEntry> findSuccessfulByIdempotencyKey(String idempotencyKey);

    /**
     * Latest successful create entry of the tenant matching the session or, when
     * none, the phone number.
     */
    Optional<BookingLogEntry> findLatestCreate(String tenantId, String sessionId, String phone);
}
