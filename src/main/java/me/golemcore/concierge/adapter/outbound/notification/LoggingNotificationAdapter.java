package me.golemcore.concierge.adapter.outbound.notification;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Notification adapter that writes messages to the log instead of sending
 * them. Stands in for an SMS/WhatsApp provider.
 */
@Component
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    @Override
    public CompletableFuture<DeliveryResult> deliver(Notification notification) {
        if (notification.to() == null || notification.to().isBlank()) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("No recipient"));
        }
        String messageId = "log-" + UUID.randomUUID();
        log.info("[Notify] {} to {} for tenant {} ({}): {}", notification.channel(), notification.to(),
                notification.tenantId(), messageId, notification.body());
        return CompletableFuture.completedFuture(DeliveryResult.delivered(messageId));
    }
}
