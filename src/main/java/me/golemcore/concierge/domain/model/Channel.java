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
 * Inbound messaging channels supported by the engine.
 */
public enum Channel {

    SMS("sms"), WHATSAPP("whatsapp"), VOICE("voice");

    private final String value;

    Channel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a channel from its wire value. Unknown values fall back to SMS.
     */
    public static Channel fromValue(String value) {
        if (value == null) {
            return SMS;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Channel channel : values()) {
            if (channel.value.equals(normalized)) {
                return channel;
            }
        }
        return SMS;
    }
}
