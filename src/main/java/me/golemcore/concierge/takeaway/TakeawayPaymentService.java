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
import me.golemcore.concierge.domain.exception.PaymentSetupException;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderEventType;
import me.golemcore.concierge.domain.model.OrderStatus;
import me.golemcore.concierge.domain.service.AuditService;
import me.golemcore.concierge.gating.FeatureGate;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.port.outbound.NotificationPort;
import me.golemcore.concierge.port.outbound.PaymentPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Issues checkout links for takeaway orders and texts them to the customer.
 *
 * <p>
 * In test mode the link is a deterministic local URL and the payment provider
 * is not called. Every issued link increments the order's payment attempt
 * count. The customer SMS is best effort: the link is also part of the chat
 * reply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TakeawayPaymentService {

    private final PaymentPort paymentPort;
    private final NotificationPort notificationPort;
    private final ExternalCallExecutor executor;
    private final OrderStateMachine orders;
    private final AuditService auditService;
    private final ConciergeProperties properties;
    private final Clock clock;

    /**
     * Creates a checkout link, moves the order to {@code pending_payment} when
     * it is not there yet and records the link on the order.
     *
     * <p>
     * Outside a retry, an order already awaiting payment on an unexpired link
     * gets that link back. Nothing is created, recorded or sent in that case.
     *
     * @throws PaymentSetupException
     *             when the provider is missing or the checkout call fails; the
     *             order is left in its prior state
     */
    public IssuedLink issueLink(Order order, PaymentConfig config, boolean retry,
            Function<String, FeatureGateResult> canUse) {
        if (!retry) {
            Optional<IssuedLink> active = activeLink(order);
            if (active.isPresent()) {
                log.info("[Takeaway] Order {} already has an active payment link, reusing it", order.getId());
                return active.get();
            }
        }
        String shortId = OrderStateMachine.shortOrderId(order.getId());
        int amountCents = order.getPaymentAmountCents() != null ? order.getPaymentAmountCents() : 0;
        if (amountCents <= 0) {
            throw new PaymentSetupException("Order has no payment amount", null);
        }

        PaymentPort.CheckoutLink link;
        if (config.testMode()) {
            link = new PaymentPort.CheckoutLink(testModeUrl(shortId, amountCents),
                    clock.instant().plus(Duration.ofMinutes(config.expiresMinutes())));
        } else {
            link = createCheckoutLink(order, config, shortId, retry);
        }

        if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
            OrderOperationResult pending = orders.setOrderPendingPayment(order.getId(), amountCents,
                    config.currency());
            if (!pending.success()) {
                throw new PaymentSetupException("Could not move order to pending_payment: " + pending.error(), null);
            }
            if (pending.duplicate() && !retry) {
                Optional<IssuedLink> active = activeLink(pending.order());
                if (active.isPresent()) {
                    log.info("[Takeaway] Order {} moved to pending_payment concurrently, reusing its link",
                            order.getId());
                    return active.get();
                }
            }
        }
        OrderOperationResult recorded = orders.recordPaymentLink(order.getId(), link.paymentUrl(), link.expiresAt());
        if (!recorded.success()) {
            throw new PaymentSetupException("Could not record payment link: " + recorded.error(), null);
        }

        auditService.record(order.getTenantId(), "takeaway.payment_link_sent", auditDetails(order, config, link));
        Map<String, Object> eventDetails = new LinkedHashMap<>();
        eventDetails.put("attempt", recorded.order().getPaymentAttemptCount());
        eventDetails.put("testMode", config.testMode());
        eventDetails.putAll(sendPaymentSms(order, shortId, link.paymentUrl(), config.expiresMinutes(), canUse));
        orders.logEvent(order.getId(), OrderEventType.PAYMENT_LINK_CREATED, eventDetails);
        log.info("[Takeaway] Payment link issued for order {} (attempt {})", order.getId(),
                recorded.order().getPaymentAttemptCount());

        return new IssuedLink(link.paymentUrl(), link.expiresAt(), recorded.order());
    }

    private Optional<IssuedLink> activeLink(Order order) {
        if (order == null || order.getStatus() != OrderStatus.PENDING_PAYMENT || order.getPaymentUrl() == null
                || order.getPaymentExpiresAt() == null || !clock.instant().isBefore(order.getPaymentExpiresAt())) {
            return Optional.empty();
        }
        return Optional.of(new IssuedLink(order.getPaymentUrl(), order.getPaymentExpiresAt(), order));
    }

    String testModeUrl(String shortId, int amountCents) {
        String base = properties.getPayment().getAppBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/test-payment?order=" + shortId + "&amount=" + amountCents;
    }

    private PaymentPort.CheckoutLink createCheckoutLink(Order order, PaymentConfig config, String shortId,
            boolean retry) {
        if (!paymentPort.isConfigured()) {
            throw new PaymentSetupException("Payment provider not configured", null);
        }
        PaymentPort.CheckoutRequest request = new PaymentPort.CheckoutRequest(
                order.getTenantId(),
                order.getId(),
                order.getPaymentAmountCents(),
                config.currency(),
                order.getCustomerPhone(),
                config.expiresMinutes(),
                config.productName() + " #" + shortId + (retry ? " (retry)" : ""));
        try {
            PaymentPort.CheckoutLink link = executor.call("payment.checkout",
                    () -> paymentPort.createCheckoutLink(request));
            if (link == null || link.paymentUrl() == null || link.paymentUrl().isBlank()) {
                throw new PaymentSetupException("Payment provider returned no link", null);
            }
            return link;
        } catch (PaymentSetupException e) {
            throw e;
        } catch (ExternalCallException e) {
            throw new PaymentSetupException(e.getMessage(), e);
        }
    }

    private Map<String, Object> sendPaymentSms(Order order, String shortId, String paymentUrl, int expiresMinutes,
            Function<String, FeatureGateResult> canUse) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (order.getCustomerPhone() == null || order.getCustomerPhone().isBlank()) {
            details.put("smsSent", false);
            details.put("smsError", "No customer phone");
            return details;
        }
        FeatureGateResult gate = canUse.apply(FeatureGate.SMS);
        if (!gate.isAllowed()) {
            details.put("smsSent", false);
            details.put("blockedBy", gate.getBlockedBy());
            return details;
        }

        String body = "Order #" + shortId + ": Please complete your payment to confirm.\n\n"
                + "Pay here: " + paymentUrl + "\n\n"
                + "This link expires in " + expiresMinutes + " minutes.";
        try {
            NotificationPort.DeliveryResult result = executor.call("notify.payment_link",
                    () -> notificationPort.deliver(new NotificationPort.Notification(order.getTenantId(),
                            FeatureGate.SMS, order.getCustomerPhone(), body)));
            details.put("smsSent", result.delivered());
            if (result.delivered()) {
                details.put("messageId", result.providerMessageId());
            } else {
                details.put("smsError", result.error());
            }
        } catch (ExternalCallException e) {
            log.warn("[Takeaway] Payment link SMS failed for order {}: {}", order.getId(), e.getMessage());
            details.put("smsSent", false);
            details.put("smsError", e.getMessage());
        }
        return details;
    }

    private Map<String, Object> auditDetails(Order order, PaymentConfig config, PaymentPort.CheckoutLink link) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderId", order.getId());
        details.put("amountCents", order.getPaymentAmountCents());
        details.put("currency", config.currency());
        details.put("expiresAt", link.expiresAt() != null ? link.expiresAt().toString() : null);
        return details;
    }

    public record IssuedLink(String paymentUrl, Instant expiresAt, Order order) {
    }
}
