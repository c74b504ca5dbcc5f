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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderEvent;
import me.golemcore.concierge.domain.model.OrderEventType;
import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.OrderStatus;
import me.golemcore.concierge.domain.model.PaymentStatus;
import me.golemcore.concierge.domain.model.PickupMode;
import me.golemcore.concierge.domain.service.IdempotencyKeys;
import me.golemcore.concierge.port.outbound.OrderStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Lifecycle of a takeaway order.
 *
 * <pre>
 * draft -> pending_confirmation -> pending_payment -> confirmed
 *                               \-> confirmed
 * draft | pending_confirmation | pending_payment -> canceled | expired
 * </pre>
 *
 * Creation is idempotent: the key is derived from tenant, session, phone, item
 * summary and pickup minute, and the store inserts only when the key is new.
 * A canceled or expired order under the key does not count as a duplicate.
 * Every transition re-reads the order and checks its current status first, so
 * a replayed or concurrent request either short-circuits or reports a
 * conflict. No locks are taken.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderStateMachine {

    private static final DateTimeFormatter PICKUP_FORMAT = DateTimeFormatter.ofPattern("EEE h:mm a",
            Locale.forLanguageTag("en-AU"));

    private final OrderStorePort orderStore;
    private final Clock clock;

    // ==================== creation ====================

    public OrderOperationResult createOrderDraft(String tenantId, Channel channel, OrderDraft draft,
            String sessionId) {
        String summary = buildOrderSummary(draft.getItems(), draft.getNotes());
        String baseKey = idempotencyKey(tenantId, sessionId, draft.getCustomerPhone(), summary,
                draft.getPickupTime());

        return guarded("createOrderDraft", () -> {
            // a canceled or expired order never absorbs a new draft; the next free key generation takes it
            String key = baseKey;
            Optional<Order> existing = orderStore.findByIdempotencyKey(key);
            for (int generation = 1; existing.isPresent() && isRetired(existing.get()); generation++) {
                key = baseKey + "-" + generation;
                existing = orderStore.findByIdempotencyKey(key);
            }
            if (existing.isPresent()) {
                log.info("[Takeaway] Duplicate order draft for key {}, returning {}", key, existing.get().getId());
                return OrderOperationResult.duplicate(existing.get());
            }

            Instant now = clock.instant();
            Integer total = computeTotal(draft.getItems());
            Order order = Order.builder()
                    .id(UUID.randomUUID().toString())
                    .tenantId(tenantId)
                    .sessionId(sessionId)
                    .channel(channel)
                    .status(OrderStatus.DRAFT)
                    .customerName(draft.getCustomerName())
                    .customerPhone(draft.getCustomerPhone())
                    .pickupMode(draft.getPickupMode() != null ? draft.getPickupMode() : PickupMode.ASAP)
                    .pickupTime(draft.getPickupTime())
                    .notes(draft.getNotes())
                    .items(new ArrayList<>(draft.getItems()))
                    .totalItems(draft.totalQuantity())
                    .totalAmountCents(total)
                    .paymentAmountCents(total)
                    .idempotencyKey(key)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            OrderStorePort.InsertOutcome outcome = orderStore.insertIfAbsent(order);
            if (!outcome.created()) {
                // lost the race against a concurrent delivery of the same message
                return OrderOperationResult.duplicate(outcome.order());
            }
            logEvent(order.getId(), OrderEventType.DRAFT_CREATED, Map.of(
                    "channel", channel != null ? channel.getValue() : "unknown",
                    "itemCount", draft.getItems().size(),
                    "totalItems", order.getTotalItems()));
            log.info("[Takeaway] Created order draft {} for tenant {}", order.getId(), tenantId);
            return OrderOperationResult.ok(outcome.order());
        });
    }

    /**
     * Replaces the draft fields that are present in {@code updates}. Only
     * orders still in {@code draft} can change. The idempotency key is kept.
     */
    public OrderOperationResult updateOrderDraft(String orderId, OrderDraft updates) {
        return guarded("updateOrderDraft", () -> {
            Optional<Order> existing = orderStore.findById(orderId);
            if (existing.isEmpty()) {
                return OrderOperationResult.failure("Order not found");
            }
            Order order = existing.get();
            if (order.getStatus() != OrderStatus.DRAFT) {
                return OrderOperationResult.conflict(order, "Can only update draft orders");
            }

            Order.OrderBuilder builder = order.toBuilder().updatedAt(clock.instant());
            List<String> changes = new ArrayList<>();
            if (!updates.getItems().isEmpty()) {
                Integer total = computeTotal(updates.getItems());
                builder.items(new ArrayList<>(updates.getItems()))
                        .totalItems(updates.totalQuantity())
                        .totalAmountCents(total)
                        .paymentAmountCents(total);
                changes.add("items");
            }
            if (updates.getCustomerName() != null) {
                builder.customerName(updates.getCustomerName());
                changes.add("customerName");
            }
            if (updates.getCustomerPhone() != null) {
                builder.customerPhone(updates.getCustomerPhone());
                changes.add("customerPhone");
            }
            if (updates.getPickupTime() != null) {
                builder.pickupTime(updates.getPickupTime()).pickupMode(PickupMode.TIME);
                changes.add("pickupTime");
            }
            if (updates.getNotes() != null) {
                builder.notes(updates.getNotes());
                changes.add("notes");
            }

            Order updated = orderStore.update(builder.build());
            logEvent(orderId, OrderEventType.DRAFT_UPDATED, Map.of("changes", changes));
            return OrderOperationResult.ok(updated);
        });
    }

    // ==================== transitions ====================

    public OrderOperationResult requestOrderConfirmation(String orderId) {
        return transition(orderId, "requestOrderConfirmation", order -> switch (order.getStatus()) {
            case PENDING_CONFIRMATION -> OrderOperationResult.duplicate(order);
            case DRAFT -> {
                Order updated = orderStore.update(order.toBuilder()
                        .status(OrderStatus.PENDING_CONFIRMATION)
                        .updatedAt(clock.instant())
                        .build());
                logEvent(orderId, OrderEventType.CONFIRMATION_REQUESTED, Map.of());
                yield OrderOperationResult.ok(updated);
            }
            default -> OrderOperationResult.conflict(order,
                    "Cannot request confirmation in status: " + order.getStatus().getValue());
        });
    }

    /**
     * Confirms the order. Confirming an already confirmed order returns the
     * same order flagged as duplicate and has no side effects.
     */
    public OrderOperationResult confirmOrder(String orderId) {
        return transition(orderId, "confirmOrder", order -> switch (order.getStatus()) {
            case CONFIRMED -> OrderOperationResult.duplicate(order);
            case DRAFT, PENDING_CONFIRMATION, PENDING_PAYMENT -> {
                Instant now = clock.instant();
                Order.OrderBuilder builder = order.toBuilder()
                        .status(OrderStatus.CONFIRMED)
                        .confirmedAt(now)
                        .updatedAt(now);
                if (order.getStatus() == OrderStatus.PENDING_PAYMENT) {
                    builder.paymentStatus(PaymentStatus.PAID);
                }
                Order updated = orderStore.update(builder.build());
                logEvent(orderId, OrderEventType.CONFIRMED, Map.of("confirmedAt", now.toString()));
                yield OrderOperationResult.ok(updated);
            }
            default -> OrderOperationResult.conflict(order,
                    "Cannot confirm order in status: " + order.getStatus().getValue());
        });
    }

    /**
     * Confirms an order that needs no payment and records that on the order.
     */
    public OrderOperationResult confirmWithoutPayment(String orderId) {
        OrderOperationResult result = confirmOrder(orderId);
        if (!result.success() || result.duplicate()) {
            return result;
        }
        Order updated = orderStore.update(result.order().toBuilder()
                .paymentRequired(false)
                .paymentStatus(PaymentStatus.NOT_REQUIRED)
                .build());
        return OrderOperationResult.ok(updated);
    }

    public OrderOperationResult setOrderPendingPayment(String orderId, int amountCents, String currency) {
        return transition(orderId, "setOrderPendingPayment", order -> switch (order.getStatus()) {
            case PENDING_PAYMENT -> OrderOperationResult.duplicate(order);
            case DRAFT, PENDING_CONFIRMATION -> {
                Order updated = orderStore.update(order.toBuilder()
                        .status(OrderStatus.PENDING_PAYMENT)
                        .paymentRequired(true)
                        .paymentAmountCents(amountCents)
                        .paymentCurrency(currency)
                        .paymentStatus(PaymentStatus.PENDING)
                        .updatedAt(clock.instant())
                        .build());
                logEvent(orderId, OrderEventType.PENDING_PAYMENT, Map.of(
                        "amountCents", amountCents,
                        "currency", currency));
                yield OrderOperationResult.ok(updated);
            }
            default -> OrderOperationResult.conflict(order,
                    "Cannot set pending_payment from status: " + order.getStatus().getValue());
        });
    }

    /**
     * Records an issued checkout link. Every issuance, first or retry, counts
     * as one payment attempt.
     */
    public OrderOperationResult recordPaymentLink(String orderId, String paymentUrl, Instant expiresAt) {
        return transition(orderId, "recordPaymentLink", order -> {
            if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
                return OrderOperationResult.conflict(order,
                        "Cannot issue payment link in status: " + order.getStatus().getValue());
            }
            Order updated = orderStore.update(order.toBuilder()
                    .paymentUrl(paymentUrl)
                    .paymentExpiresAt(expiresAt)
                    .paymentStatus(PaymentStatus.PENDING)
                    .paymentAttemptCount(order.getPaymentAttemptCount() + 1)
                    .updatedAt(clock.instant())
                    .build());
            return OrderOperationResult.ok(updated);
        });
    }

    /**
     * Cancels an open order. A confirmed order is refused with a conflict; the
     * business has already committed to it.
     */
    public OrderOperationResult cancelOrder(String orderId, String reason) {
        return transition(orderId, "cancelOrder", order -> {
            if (order.getStatus() == OrderStatus.CANCELED) {
                return OrderOperationResult.duplicate(order);
            }
            if (order.getStatus() == OrderStatus.CONFIRMED) {
                return OrderOperationResult.conflict(order, "Cannot cancel confirmed order - requires handoff");
            }
            if (!order.getStatus().isOpen()) {
                return OrderOperationResult.conflict(order,
                        "Cannot cancel order in status: " + order.getStatus().getValue());
            }
            Instant now = clock.instant();
            Order updated = orderStore.update(order.toBuilder()
                    .status(OrderStatus.CANCELED)
                    .cancelReason(reason)
                    .canceledAt(now)
                    .updatedAt(now)
                    .build());
            logEvent(orderId, OrderEventType.CANCELED, Map.of("reason", reason));
            return OrderOperationResult.ok(updated);
        });
    }

    public OrderOperationResult expireOrder(String orderId, String reason) {
        return transition(orderId, "expireOrder", order -> {
            if (order.getStatus() == OrderStatus.EXPIRED) {
                return OrderOperationResult.duplicate(order);
            }
            if (!order.getStatus().isOpen()) {
                return OrderOperationResult.conflict(order,
                        "Cannot expire order in status: " + order.getStatus().getValue());
            }
            Instant now = clock.instant();
            Order.OrderBuilder builder = order.toBuilder()
                    .status(OrderStatus.EXPIRED)
                    .expiredAt(now)
                    .updatedAt(now);
            if (order.getStatus() == OrderStatus.PENDING_PAYMENT) {
                builder.paymentStatus(PaymentStatus.EXPIRED);
            }
            Order updated = orderStore.update(builder.build());
            logEvent(orderId, OrderEventType.EXPIRED, Map.of("reason", reason));
            return OrderOperationResult.ok(updated);
        });
    }

    // ==================== queries ====================

    public Optional<Order> findOrder(String orderId) {
        return orderId != null ? orderStore.findById(orderId) : Optional.empty();
    }

    /**
     * Latest order of the session that can still be changed.
     */
    public Optional<Order> getPendingOrderForSession(String sessionId) {
        return sessionId != null ? orderStore.findLatestOpenBySession(sessionId) : Optional.empty();
    }

    public List<OrderEvent> getEvents(String orderId) {
        return orderStore.findEvents(orderId);
    }

    /**
     * Appends to the order's event trail. Failures are logged and never reach
     * the caller.
     */
    public void logEvent(String orderId, OrderEventType type, Map<String, Object> details) {
        try {
            orderStore.appendEvent(OrderEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .orderId(orderId)
                    .type(type)
                    .details(new LinkedHashMap<>(details))
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) { // NOSONAR - event trail must not fail the order flow
            log.warn("[Takeaway] Failed to log order event {} for {}: {}", type, orderId, e.getMessage());
        }
    }

    // ==================== helpers ====================

    /**
     * {@code Nx name (options) - notes} per item, then a notes block.
     */
    public static String buildOrderSummary(List<OrderItem> items, String notes) {
        if (items == null || items.isEmpty()) {
            return "No items";
        }
        String summary = items.stream().map(OrderStateMachine::summaryLine).collect(Collectors.joining("\n"));
        if (notes != null && !notes.isBlank()) {
            summary += "\n\nNotes: " + notes;
        }
        return summary;
    }

    private static String summaryLine(OrderItem item) {
        StringBuilder line = new StringBuilder().append(item.getQuantity()).append("x ").append(item.getName());
        if (item.getOptions() != null && !item.getOptions().isEmpty()) {
            String options = item.getOptions().entrySet().stream()
                    .map(entry -> entry.getValue() instanceof List<?> values
                            ? values.stream().map(String::valueOf).collect(Collectors.joining(", "))
                            : entry.getKey() + ": " + entry.getValue())
                    .collect(Collectors.joining(", "));
            line.append(" (").append(options).append(')');
        }
        if (item.getNotes() != null && !item.getNotes().isBlank()) {
            line.append(" - ").append(item.getNotes());
        }
        return line.toString();
    }

    /**
     * Key components: tenant, session, digits of the phone, a 16-hex hash of the
     * item summary and the pickup time truncated to the minute. Tenant id is
     * always part of the key so keys never collide across tenants.
     */
    public static String idempotencyKey(String tenantId, String sessionId, String customerPhone, String summary,
            Instant pickupTime) {
        return IdempotencyKeys.of(32,
                tenantId,
                sessionId != null ? sessionId : "no-session",
                customerPhone != null ? customerPhone.replaceAll("\\D", "") : "",
                IdempotencyKeys.sha256Hex(summary, 16),
                pickupTime != null ? pickupTime.truncatedTo(ChronoUnit.MINUTES).toString() : "asap");
    }

    /**
     * Sum of line totals when every item is priced, otherwise {@code null}.
     */
    public static Integer computeTotal(List<OrderItem> items) {
        if (items == null || items.isEmpty() || items.stream().anyMatch(item -> item.getUnitPriceCents() == null)) {
            return null;
        }
        return items.stream().mapToInt(OrderItem::lineTotalCents).sum();
    }

    private static boolean isRetired(Order order) {
        return order.getStatus() == OrderStatus.CANCELED || order.getStatus() == OrderStatus.EXPIRED;
    }

    public static String shortOrderId(String orderId) {
        if (orderId == null) {
            return "";
        }
        return orderId.substring(0, Math.min(8, orderId.length())).toUpperCase(Locale.ROOT);
    }

    public static String formatPickupTime(Instant pickupTime, PickupMode mode, ZoneId zone) {
        if (pickupTime == null || mode == PickupMode.ASAP) {
            return "ASAP";
        }
        return PICKUP_FORMAT.format(pickupTime.atZone(zone));
    }

    /**
     * @return the problem with the pickup time, empty when it is acceptable;
     *         ASAP pickups are always acceptable
     */
    public static Optional<String> validatePickupTime(Instant pickupTime, int minNoticeMinutes, Instant now) {
        if (pickupTime == null) {
            return Optional.empty();
        }
        if (pickupTime.isBefore(now.plus(Duration.ofMinutes(minNoticeMinutes)))) {
            return Optional.of("Pickup time must be at least " + minNoticeMinutes + " minutes from now");
        }
        return Optional.empty();
    }

    private OrderOperationResult transition(String orderId, String operation,
            Function<Order, OrderOperationResult> step) {
        return guarded(operation, () -> orderStore.findById(orderId)
                .map(step)
                .orElseGet(() -> OrderOperationResult.failure("Order not found")));
    }

    private OrderOperationResult guarded(String operation, Supplier<OrderOperationResult> body) {
        try {
            return body.get();
        } catch (RuntimeException e) { // NOSONAR - store failures become a failed result
            log.error("[Takeaway] {} failed: {}", operation, e.getMessage(), e);
            return OrderOperationResult.failure(e.getMessage() != null ? e.getMessage() : "Order store error");
        }
    }
}
