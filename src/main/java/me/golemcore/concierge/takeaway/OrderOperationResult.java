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

import me.golemcore.concierge.domain.model.Order;

/**
 * Outcome of an {@link OrderStateMachine} operation.
 *
 * <p>
 * {@code duplicate} marks an idempotent replay that changed nothing.
 * {@code conflict} means the order's status no longer allows the operation;
 * {@code order} then holds the unchanged order.
 */
public record OrderOperationResult(boolean success, Order order, boolean duplicate, boolean conflict, String error) {

    public static OrderOperationResult ok(Order order) {
        return new OrderOperationResult(true, order, false, false, null);
    }

    public static OrderOperationResult duplicate(Order order) {
        return new OrderOperationResult(true, order, true, false, null);
    }

    public static OrderOperationResult conflict(Order order, String error) {
        return new OrderOperationResult(false, order, false, true, error);
    }

    public static OrderOperationResult failure(String error) {
        return new OrderOperationResult(false, null, false, false, error);
    }

    public String orderId() {
        return order != null ? order.getId() : null;
    }
}
