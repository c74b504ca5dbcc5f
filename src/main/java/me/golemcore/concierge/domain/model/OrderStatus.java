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

/**
 * Takeaway order lifecycle. Transitions are one-way except for explicit
 * payment retries.
 */
public enum OrderStatus {

    DRAFT("draft"),
    PENDING_CONFIRMATION("pending_confirmation"),
    PENDING_PAYMENT("pending_payment"),
    CONFIRMED("confirmed"),
    CANCELED("canceled"),
    EXPIRED("expired");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether the customer may still change or cancel the order.
     */
    public boolean isOpen() {
        return this == DRAFT || this == PENDING_CONFIRMATION || this == PENDING_PAYMENT;
    }
}
