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

import java.util.concurrent.CompletableFuture;

/**
 * Outbound delivery of customer payment links and business order alerts.
 */
public interface NotificationPort {

    CompletableFuture<DeliveryResult> deliver(Notification notification);

    /**
     * @param channel
     *            {@code sms} or {@code whatsapp}
     */
    record Notification(String tenantId, String channel, String to, String body) {
    }

    record DeliveryResult(boolean delivered, String providerMessageId, String error) {

        public static DeliveryResult delivered(String providerMessageId) {
            return new DeliveryResult(true, providerMessageId, null);
        }

        public static DeliveryResult failed(String error) {
            return new DeliveryResult(false, null, error);
        }
    }
}
