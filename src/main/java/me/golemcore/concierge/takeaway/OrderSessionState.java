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

import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.module.ModuleContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session metadata keys owned by the takeaway modules, and conversion of item
 * lists to and from their metadata form.
 */
public final class OrderSessionState {

    public static final String ORDER_ID = "orderId";
    public static final String ORDER_STATUS = "orderStatus";
    public static final String DRAFT_ITEMS = "draftItems";
    public static final String ORDER_ITEMS = "orderItems";
    public static final String CUSTOMER_NAME = "customerName";
    public static final String PICKUP_MODE = "pickupMode";
    public static final String PICKUP_TIME = "pickupTime";
    public static final String ORDER_NOTES = "orderNotes";
    public static final String CLARIFICATION_COUNT = "clarificationCount";
    public static final String AWAITING = "awaiting";
    public static final String AWAITING_CONFIRMATION = "awaitingConfirmation";
    public static final String ORDER_CONFIRMED = "orderConfirmed";
    public static final String AWAITING_PAYMENT = "awaitingPayment";
    public static final String AWAITING_PAYMENT_RETRY = "awaitingPaymentRetry";
    public static final String PAYMENT_LINK_SENT_AT = "paymentLinkSentAt";
    public static final String LAST_CONFIRMATION_SENT_AT = "lastConfirmationSentAt";

    private OrderSessionState() {
    }

    public static List<Map<String, Object>> itemsToMetadata(List<OrderItem> items) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (OrderItem item : items) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", item.getName());
            entry.put("quantity", item.getQuantity());
            if (item.getMenuItemId() != null) {
                entry.put("menuItemId", item.getMenuItemId());
            }
            if (item.getUnitPriceCents() != null) {
                entry.put("unitPriceCents", item.getUnitPriceCents());
            }
            if (item.getOptions() != null && !item.getOptions().isEmpty()) {
                entry.put("options", item.getOptions());
            }
            if (item.getNotes() != null) {
                entry.put("notes", item.getNotes());
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * Reads items written by {@link #itemsToMetadata}. Malformed entries are
     * skipped.
     */
    @SuppressWarnings("unchecked")
    public static List<OrderItem> itemsFromMetadata(Object value) {
        List<OrderItem> items = new ArrayList<>();
        if (!(value instanceof List<?> list)) {
            return items;
        }
        for (Object element : list) {
            if (element instanceof OrderItem item) {
                items.add(item);
            } else if (element instanceof Map<?, ?> map && map.get("name") instanceof String name) {
                int quantity = map.get("quantity") instanceof Number number ? number.intValue() : 1;
                items.add(OrderItem.builder()
                        .name(name)
                        .quantity(Math.max(1, quantity))
                        .menuItemId(map.get("menuItemId") instanceof String id ? id : null)
                        .unitPriceCents(map.get("unitPriceCents") instanceof Number price ? price.intValue() : null)
                        .options(map.get("options") instanceof Map<?, ?> options ? (Map<String, Object>) options
                                : null)
                        .notes(map.get("notes") instanceof String notes ? notes : null)
                        .build());
            }
        }
        return items;
    }

    /**
     * Adds {@code additions} to {@code current}; a repeated item increases the
     * quantity of the existing line.
     */
    public static List<OrderItem> mergeItems(List<OrderItem> current, List<OrderItem> additions) {
        List<OrderItem> merged = new ArrayList<>();
        current.forEach(item -> merged.add(item.toBuilder().build()));
        for (OrderItem addition : additions) {
            OrderItem match = merged.stream()
                    .filter(item -> sameLine(item, addition))
                    .findFirst()
                    .orElse(null);
            if (match != null) {
                match.setQuantity(match.getQuantity() + addition.getQuantity());
            } else {
                merged.add(addition.toBuilder().build());
            }
        }
        return merged;
    }

    public static List<OrderItem> draftItems(ModuleContext context) {
        return itemsFromMetadata(context.metadata(DRAFT_ITEMS));
    }

    private static boolean sameLine(OrderItem a, OrderItem b) {
        if (a.getMenuItemId() != null && b.getMenuItemId() != null) {
            return a.getMenuItemId().equals(b.getMenuItemId()) && equalOptions(a, b);
        }
        return a.getName() != null && a.getName().equalsIgnoreCase(b.getName()) && equalOptions(a, b);
    }

    private static boolean equalOptions(OrderItem a, OrderItem b) {
        Map<String, Object> left = a.getOptions() != null ? a.getOptions() : Map.of();
        Map<String, Object> right = b.getOptions() != null ? b.getOptions() : Map.of();
        return left.equals(right);
    }
}
