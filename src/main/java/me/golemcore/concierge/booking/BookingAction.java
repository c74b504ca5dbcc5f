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

import java.util.Locale;

/**
 * What the customer wants done with a booking.
 */
public enum BookingAction {

    CHECK("check"), CREATE("create"), MODIFY("modify"), CANCEL("cancel");

    private final String value;

    BookingAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BookingAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BookingAction action : values()) {
            if (action.value.equals(normalized)) {
                return action;
            }
        }
        return null;
    }
}
