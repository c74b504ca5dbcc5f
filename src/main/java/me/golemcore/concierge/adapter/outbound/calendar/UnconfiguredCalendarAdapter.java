package me.golemcore.concierge.adapter.outbound.calendar;

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

import me.golemcore.concierge.port.outbound.CalendarPort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Calendar adapter used when no calendar provider is wired in. Every tenant
 * reports as not connected, so the booking module hands off.
 */
@Component
public class UnconfiguredCalendarAdapter implements CalendarPort {

    private static final String NOT_CONNECTED = "Calendar provider not configured";

    @Override
    public boolean isConnected(String tenantId) {
        return false;
    }

    @Override
    public CompletableFuture<Availability> checkAvailability(String tenantId, Instant start, Instant end) {
        return CompletableFuture.failedFuture(new IllegalStateException(NOT_CONNECTED));
    }

    @Override
    public CompletableFuture<String> createEvent(String tenantId, EventRequest request) {
        return CompletableFuture.failedFuture(new IllegalStateException(NOT_CONNECTED));
    }

    @Override
    public CompletableFuture<Void> updateEvent(String tenantId, String eventId, EventRequest request) {
        return CompletableFuture.failedFuture(new IllegalStateException(NOT_CONNECTED));
    }

    @Override
    public CompletableFuture<Void> deleteEvent(String tenantId, String eventId) {
        return CompletableFuture.failedFuture(new IllegalStateException(NOT_CONNECTED));
    }
}
