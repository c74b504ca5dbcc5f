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

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * External calendar used by the booking module.
 */
public interface CalendarPort {

    boolean isConnected(String tenantId);

    CompletableFuture<Availability> checkAvailability(String tenantId, Instant start, Instant end);

    /**
     * @return the external event id
     */
    CompletableFuture<String> createEvent(String tenantId, EventRequest request);

    CompletableFuture<Void> updateEvent(String tenantId, String eventId, EventRequest request);

    CompletableFuture<Void> deleteEvent(String tenantId, String eventId);

    record Availability(boolean available, Instant nextAvailable) {
    }

    record EventRequest(String summary, String description, Instant start, Instant end, String timeZone) {
    }
}
