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

import java.util.Locale;

/**
 * Whether an order is collected as soon as possible or at a requested time.
 */
public enum PickupMode {

    ASAP("asap"), TIME("time");

    private final String value;

    PickupMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PickupMode fromValue(String value, PickupMode defaultMode) {
        if (value == null) {
            return defaultMode;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PickupMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        return defaultMode;
    }
}
