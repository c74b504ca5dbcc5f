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

import me.golemcore.concierge.domain.model.TenantSettings;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Booking settings of a tenant, parsed from its {@code bookingConfig} blob by
 * {@link BookingConfigParser}.
 */
public record BookingConfig(
        boolean enabled,
        String calendarId,
        String timezone,
        int defaultDurationMinutes,
        int minNoticeMinutes,
        int maxPartySize,
        boolean allowModify,
        boolean allowCancel,
        boolean requirePhone,
        boolean requireName,
        boolean autoConfirm,
        boolean sendSmsConfirmation) {

    public static final int LARGE_PARTY = 10;

    public static BookingConfig defaults() {
        return new BookingConfig(false, "primary", TenantSettings.DEFAULT_TIMEZONE, 90, 60, 20, true, true, false,
                true, true, true);
    }

    public ZoneId zone() {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return ZoneId.of(TenantSettings.DEFAULT_TIMEZONE);
        }
    }

    public Instant endOf(Instant start) {
        return start.plus(Duration.ofMinutes(defaultDurationMinutes));
    }

    /**
     * Hours of notice as shown to customers, rounded up.
     */
    public int minNoticeHours() {
        return (minNoticeMinutes + 59) / 60;
    }

    /**
     * Checks a booking request against the configured limits.
     */
    public Validation validate(BookingRequest request, Instant now) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (requireName && isBlank(request.name())) {
            errors.add("Name is required");
        }
        if (requirePhone && isBlank(request.phone())) {
            errors.add("Phone number is required");
        }

        if (request.dateTime() == null) {
            errors.add("Date and time are required");
        } else if (request.dateTime().isBefore(now)) {
            errors.add("Cannot book in the past");
        } else if (Duration.between(now, request.dateTime()).toMinutes() < minNoticeMinutes) {
            errors.add("Minimum " + minNoticeHours() + " hour(s) notice required");
        }

        if (request.partySize() != null) {
            if (request.partySize() < 1) {
                errors.add("Party size must be at least 1");
            } else if (request.partySize() > maxPartySize) {
                errors.add("Maximum party size is " + maxPartySize);
            }
            if (request.partySize() > LARGE_PARTY) {
                warnings.add("Large party - may require special arrangements");
            }
        }
        return new Validation(List.copyOf(errors), List.copyOf(warnings));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record Validation(List<String> errors, List<String> warnings) {

        public boolean valid() {
            return errors.isEmpty();
        }

        public boolean partyTooLarge() {
            return errors.stream().anyMatch(error -> error.startsWith("Maximum party size"));
        }

        public boolean noticeTooShort() {
            return errors.stream().anyMatch(error -> error.endsWith("notice required"));
        }
    }
}
