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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A takeaway order owned by a tenant and optionally a session. Unique on
 * {@link #idempotencyKey}.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;
    private String tenantId;
    private String sessionId;
    private Channel channel;

    @Builder.Default
    private OrderStatus status = OrderStatus.DRAFT;

    private String customerName;
    private String customerPhone;
    private String customerEmail;

    @Builder.Default
    private PickupMode pickupMode = PickupMode.ASAP;

    private Instant pickupTime;
    private String notes;

    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    private int totalItems;
    private Integer totalAmountCents;
    private String idempotencyKey;

    // Payment
    private Boolean paymentRequired;
    private PaymentStatus paymentStatus;
    private Integer paymentAmountCents;
    private String paymentCurrency;
    private int paymentAttemptCount;
    private String paymentUrl;
    private Instant paymentExpiresAt;

    private String cancelReason;
    private Instant confirmedAt;
    private Instant canceledAt;
    private Instant expiredAt;
    private Instant createdAt;
    private Instant updatedAt;
}
