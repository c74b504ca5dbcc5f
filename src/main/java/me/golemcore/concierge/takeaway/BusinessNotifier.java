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
import me.golemcore.concierge.domain.exception.ExternalCallException;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderEventType;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.AuditService;
import me.golemcore.concierge.gating.FeatureGate;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.port.outbound.NotificationPort;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tells the business about a newly confirmed order.
 *
 * <p>
 * Best effort: SMS is tried first, then WhatsApp, each behind its capability
 * gate. A failure only leaves a {@code notification_failed} event on the
 * order; the confirmation itself is never rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusinessNotifier {

    private final NotificationPort notificationPort;
    private final ExternalCallExecutor executor;
    private final OrderStateMachine orders;
    private final AuditService auditService;

    public NotificationOutcome notifyBusinessOfOrder(TenantSettings tenant, Order order, TakeawayConfig config,
            Function<String, FeatureGateResult> canUse) {
        String notifyTo = config.notifications().notifyTo();
        if (notifyTo == null || notifyTo.isBlank()) {
            notifyTo = tenant != null ? tenant.getHandoffSmsTo() : null;
        }
        if (notifyTo == null || notifyTo.isBlank()) {
            orders.logEvent(order.getId(), OrderEventType.NOTIFICATION_FAILED,
                    Map.of("reason", "No notification phone configured"));
            return new NotificationOutcome(true, "none", null);
        }

        String message = renderMessage(order, config,
                tenant != null ? tenant.zone() : ZoneId.of(TenantSettings.DEFAULT_TIMEZONE));

        if (config.notifications().notifyBySms()
                && tryChannel(order, FeatureGate.SMS, notifyTo, message, canUse)) {
            return new NotificationOutcome(true, FeatureGate.SMS, null);
        }
        if (config.notifications().notifyByWhatsApp()
                && tryChannel(order, FeatureGate.WHATSAPP, notifyTo, message, canUse)) {
            return new NotificationOutcome(true, FeatureGate.WHATSAPP, null);
        }

        orders.logEvent(order.getId(), OrderEventType.NOTIFICATION_FAILED, Map.of("reason", "all_methods_failed"));
        log.warn("[Takeaway] Order {} confirmed but business was not notified", order.getId());
        return new NotificationOutcome(false, null,
                "All notification methods failed - order confirmed but business not notified");
    }

    static String renderMessage(Order order, TakeawayConfig config, ZoneId zone) {
        String itemsList = order.getItems().stream()
                .map(item -> {
                    String line = "  " + item.getQuantity() + "x " + item.getName();
                    if (item.getOptions() != null && !item.getOptions().isEmpty()) {
                        line += " (" + item.getOptions() + ")";
                    }
                    return line;
                })
                .collect(Collectors.joining("\n"));

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("orderId", OrderStateMachine.shortOrderId(order.getId()));
        variables.put("customerName", order.getCustomerName() != null ? order.getCustomerName() : "Not provided");
        variables.put("customerPhone", order.getCustomerPhone());
        variables.put("pickupTime", OrderStateMachine.formatPickupTime(order.getPickupTime(), order.getPickupMode(),
                zone));
        variables.put("itemsList", itemsList);
        variables.put("notes", order.getNotes() != null ? "Notes: " + order.getNotes() : "");
        return TemplateRenderer.render(config.templates().businessNotificationText(), variables);
    }

    private boolean tryChannel(Order order, String channel, String to, String message,
            Function<String, FeatureGateResult> canUse) {
        FeatureGateResult gate = canUse.apply(channel);
        if (!gate.isAllowed()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", channel + "_module_blocked");
            details.put("blockedBy", gate.getBlockedBy());
            orders.logEvent(order.getId(), OrderEventType.NOTIFICATION_FAILED, details);
            auditService.record(order.getTenantId(), "takeaway.notification_blocked", Map.of(
                    "orderId", order.getId(),
                    "method", channel,
                    "reason", String.valueOf(gate.getReason())));
            return false;
        }

        try {
            NotificationPort.DeliveryResult result = executor.call("notify.business." + channel,
                    () -> notificationPort.deliver(
                            new NotificationPort.Notification(order.getTenantId(), channel, to, message)));
            if (!result.delivered()) {
                log.warn("[Takeaway] {} notification for order {} failed: {}", channel, order.getId(),
                        result.error());
                return false;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("method", channel);
            details.put("to", to);
            details.put("messageId", result.providerMessageId());
            orders.logEvent(order.getId(), OrderEventType.NOTIFICATION_SENT, details);
            auditService.record(order.getTenantId(), "takeaway.notification_sent", Map.of(
                    "orderId", order.getId(),
                    "method", channel));
            return true;
        } catch (ExternalCallException e) {
            log.warn("[Takeaway] {} notification error for order {}: {}", channel, order.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * @param method
     *            channel that delivered the alert, {@code none} when no target is
     *            configured
     */
    public record NotificationOutcome(boolean success, String method, String error) {
    }
}
