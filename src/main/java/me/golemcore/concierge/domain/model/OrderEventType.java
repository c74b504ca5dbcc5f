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
 * Kinds of entries in the per-order event trail.
 */
public enum OrderEventType {
    DRAFT_CREATED,
    DRAFT_UPDATED,
    CONFIRMATION_REQUESTED,
    CONFIRMED,
    PENDING_PAYMENT,
    PAYMENT_LINK_CREATED,
    CANCELED,
    EXPIRED,
    HANDOFF_TRIGGERED,
    NOTIFICATION_SENT,
    NOTIFICATION_FAILED,
    ERROR
}
