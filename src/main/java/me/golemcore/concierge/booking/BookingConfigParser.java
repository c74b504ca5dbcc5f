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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parses the booking blob of a tenant. Never throws; a missing or mistyped
 * field takes its default.
 *
 * <p>
 * Calendar settings are read from the nested {@code calendar} object and
 * confirmation switches from {@code confirmations}.
 */
public final class BookingConfigParser {

    private BookingConfigParser() {
    }

    public static BookingConfig parse(JsonNode node) {
        BookingConfig defaults = BookingConfig.defaults();
        if (node == null || !node.isObject()) {
            return defaults;
        }
        JsonNode calendar = node.path("calendar");
        JsonNode confirmations = node.path("confirmations");
        return new BookingConfig(
                bool(node, "enabled", defaults.enabled()),
                text(calendar, "calendarId", defaults.calendarId()),
                text(calendar, "timezone", defaults.timezone()),
                positiveInt(calendar, "defaultDurationMinutes", defaults.defaultDurationMinutes()),
                nonNegativeInt(calendar, "minNoticeMinutes", defaults.minNoticeMinutes()),
                positiveInt(calendar, "maxPartySize", defaults.maxPartySize()),
                bool(calendar, "allowModify", defaults.allowModify()),
                bool(calendar, "allowCancel", defaults.allowCancel()),
                bool(calendar, "requirePhone", defaults.requirePhone()),
                bool(calendar, "requireName", defaults.requireName()),
                bool(confirmations, "autoConfirm", defaults.autoConfirm()),
                bool(confirmations, "sendSmsConfirmation", defaults.sendSmsConfirmation()));
    }

    private static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : fallback;
    }

    private static int positiveInt(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isIntegralNumber() && value.asInt() > 0 ? value.asInt() : fallback;
    }

    private static int nonNegativeInt(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isIntegralNumber() && value.asInt() >= 0 ? value.asInt() : fallback;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : fallback;
    }
}
