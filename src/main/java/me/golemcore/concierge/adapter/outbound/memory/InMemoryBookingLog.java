package me.golemcore.concierge.adapter.outbound.memory;

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
import me.golemcore.concierge.port.outbound.BookingLogPort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Booking request log kept in process memory.
 */
@Component
public class InMemoryBookingLog implements BookingLogPort {

    private static final String STATUS_SUCCESS = "success";
    private static final String ACTION_CREATE = "create";

    private final List<BookingLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(BookingLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public Optional<BookingLogEntry> findSuccessfulByIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return latest(entry -> STATUS_SUCCESS.equals(entry.getStatus())
                && idempotencyKey.equals(entry.getIdempotencyKey()));
    }

    @Override
    public Optional<BookingLogEntry> findLatestCreate(String tenantId, String sessionId, String phone) {
        Predicate<BookingLogEntry> successfulCreate = entry -> Objects.equals(entry.getTenantId(), tenantId)
                && ACTION_CREATE.equals(entry.getAction())
                && STATUS_SUCCESS.equals(entry.getStatus())
                && entry.getEventId() != null;

        Optional<BookingLogEntry> bySession = sessionId == null ? Optional.empty()
                : latest(successfulCreate.and(entry -> sessionId.equals(entry.getSessionId())));
        if (bySession.isPresent() || phone == null) {
            return bySession;
        }
        return latest(successfulCreate.and(entry -> phone.equals(entry.getPhone())));
    }

    public List<BookingLogEntry> findAll() {
        return List.copyOf(entries);
    }

    private Optional<BookingLogEntry> latest(Predicate<BookingLogEntry> filter) {
        return entries.stream()
                .filter(filter)
                .max(Comparator.comparing(BookingLogEntry::getCreatedAt,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));
    }
}
