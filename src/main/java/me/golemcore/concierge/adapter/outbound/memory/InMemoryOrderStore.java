package me.golemcore.concierge.adapter.outbound.memory;

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
import me.golemcore.concierge.port.outbound.OrderStorePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orders, items and order events kept in process memory.
 *
 * <p>
 * The idempotency key index is the unique constraint: inserting under a key
 * that is already taken returns the stored order instead of a new one, even
 * under concurrent inserts. Reads return copies so that callers only change
 * stored state through {@link #update(Order)}.
 */
@Component
public class InMemoryOrderStore implements OrderStorePort {

    private final Map<String, Order> ordersByIdempotencyKey = new ConcurrentHashMap<>();
    private final Map<String, String> idempotencyKeysById = new ConcurrentHashMap<>();
    private final Map<String, List<OrderEvent>> events = new ConcurrentHashMap<>();

    @Override
    public InsertOutcome insertIfAbsent(Order order) {
        Objects.requireNonNull(order.getIdempotencyKey(), "idempotencyKey");
        AtomicBoolean created = new AtomicBoolean(false);
        Order stored = ordersByIdempotencyKey.computeIfAbsent(order.getIdempotencyKey(), key -> {
            created.set(true);
            return copy(order);
        });
        if (created.get()) {
            idempotencyKeysById.put(order.getId(), order.getIdempotencyKey());
        }
        return new InsertOutcome(copy(stored), created.get());
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(idempotencyKeysById.get(orderId))
                .map(ordersByIdempotencyKey::get)
                .map(InMemoryOrderStore::copy);
    }

    @Override
    public Optional<Order> findByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(ordersByIdempotencyKey.get(idempotencyKey)).map(InMemoryOrderStore::copy);
    }

    @Override
    public Optional<Order> findLatestOpenBySession(String sessionId) {
        return ordersByIdempotencyKey.values().stream()
                .filter(order -> Objects.equals(order.getSessionId(), sessionId))
                .filter(order -> order.getStatus().isOpen())
                .max(Comparator.comparing(Order::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(InMemoryOrderStore::copy);
    }

    /**
     * Replaces the stored order. The idempotency key of an order never
     * changes, so the stored key is kept whatever the argument carries.
     */
    @Override
    public Order update(Order order) {
        String key = idempotencyKeysById.get(order.getId());
        if (key == null) {
            throw new IllegalArgumentException("Unknown order: " + order.getId());
        }
        ordersByIdempotencyKey.put(key, copy(order.toBuilder().idempotencyKey(key).build()));
        return order;
    }

    @Override
    public void appendEvent(OrderEvent event) {
        events.computeIfAbsent(event.getOrderId(), id -> Collections.synchronizedList(new ArrayList<>()))
                .add(event);
    }

    @Override
    public List<OrderEvent> findEvents(String orderId) {
        List<OrderEvent> orderEvents = events.get(orderId);
        if (orderEvents == null) {
            return List.of();
        }
        synchronized (orderEvents) {
            return orderEvents.stream()
                    .sorted(Comparator.comparing(OrderEvent::getCreatedAt,
                            Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                    .toList();
        }
    }

    public int count() {
        return ordersByIdempotencyKey.size();
    }

    private static Order copy(Order order) {
        if (order == null) {
            return null;
        }
        return order.toBuilder().items(new ArrayList<>(order.getItems())).build();
    }
}
