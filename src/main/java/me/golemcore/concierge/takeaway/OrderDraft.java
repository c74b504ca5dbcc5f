package me.golemcore.concierge.takeaway;

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
import lombok.Value;
import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.PickupMode;

import java.time.Instant;
import java.util.List;

/**
 * Customer-supplied order fields before they are written to an order.
 */
@Value
@Builder(toBuilder = true)
public class OrderDraft {

    String customerName;
    String customerPhone;
    @Builder.Default
    PickupMode pickupMode = PickupMode.ASAP;
    Instant pickupTime;
    String notes;
    @Builder.Default
    List<OrderItem> items = List.of();

    public int totalQuantity() {
        return items.stream().mapToInt(OrderItem::getQuantity).sum();
    }
}
