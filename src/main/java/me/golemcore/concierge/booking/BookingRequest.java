package me.golemcore.concierge.booking;

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
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Booking details gathered so far. Stored in session metadata as
 * {@code pendingBooking} between turns.
 */
public record BookingRequest(
        BookingAction action,
        Instant dateTime,
        Integer partySize,
        String name,
        String phone,
        String notes,
        String eventId) {

    public static BookingRequest empty() {
        return new BookingRequest(null, null, null, null, null, null, null);
    }

    /**
     * Fields present here win over the ones in {@code base}.
     */
    public BookingRequest over(BookingRequest base) {
        if (base == null) {
            return this;
        }
        return new BookingRequest(
                action != null ? action : base.action,
                dateTime != null ? dateTime : base.dateTime,
                partySize != null ? partySize : base.partySize,
                name != null ? name : base.name,
                phone != null ? phone : base.phone,
                notes != null ? notes : base.notes,
                eventId != null ? eventId : base.eventId);
    }

    public BookingRequest withAction(BookingAction newAction) {
        return new BookingRequest(newAction, dateTime, partySize, name, phone, notes, eventId);
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (action != null) {
            map.put("action", action.getValue());
        }
        if (dateTime != null) {
            map.put("dateTime", dateTime.toString());
        }
        if (partySize != null) {
            map.put("partySize", partySize);
        }
        if (name != null) {
            map.put("name", name);
        }
        if (phone != null) {
            map.put("phone", phone);
        }
        if (notes != null) {
            map.put("notes", notes);
        }
        return map;
    }

    public static BookingRequest fromMetadata(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return empty();
        }
        Instant dateTime = null;
        if (map.get("dateTime") instanceof String text) {
            try {
                dateTime = Instant.parse(text);
            } catch (DateTimeParseException e) {
                dateTime = null;
            }
        }
        Integer partySize = map.get("partySize") instanceof Number number ? number.intValue() : null;
        return new BookingRequest(
                map.get("action") instanceof String action ? BookingAction.fromValue(action) : null,
                dateTime,
                partySize,
                stringValue(map.get("name")),
                stringValue(map.get("phone")),
                stringValue(map.get("notes")),
                stringValue(map.get("eventId")));
    }

    private static String stringValue(Object value) {
        return value instanceof String text && !text.isBlank() ? text : null;
    }
}
