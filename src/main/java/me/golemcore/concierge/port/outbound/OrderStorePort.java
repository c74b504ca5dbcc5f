package me.golemcore.concierge.port.outbound;

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

import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderEvent;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of takeaway orders and their event trail.
 *
 * <p>
 * Implementations must enforce uniqueness of {@link Order#getIdempotencyKey()}.
 * {@link #insertIfAbsent(Order)} is the only creation path and must be atomic
 * with respect to that key.
 */
public interface OrderStorePort {

    /**
     * Inserts the order unless one with the same idempotency key exists.
     *
     * @return the stored order and whether it was created by this call
     */
    InsertOutcome insertIfAbsent(Order order);

    Optional<Order> findById(String orderId);

    Optional<Order> findByIdempotencyKey(String idempotencyKey);

    /**
     * Most recent order of the session that is still open for changes.
     */
    Optional<Order> findLatestOpenBySession(String sessionId);

    Order update(Order order);

    void appendEvent(OrderEvent event);

    List<OrderEvent> findEvents(String orderId);

    record InsertOutcome(Order order, boolean created) {
    }
}
