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
import me.golemcore.concierge.domain.exception.PaymentSetupException;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderEventType;
import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.OrderStatus;
import me.golemcore.concierge.domain.model.PickupMode;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.AuditService;
import me.golemcore.concierge.gating.FeatureGate;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static me.golemcore.concierge.takeaway.OrderSessionState.AWAITING;
import static me.golemcore.concierge.takeaway.OrderSessionState.AWAITING_CONFIRMATION;
import static me.golemcore.concierge.takeaway.OrderSessionState.AWAITING_PAYMENT;
import static me.golemcore.concierge.takeaway.OrderSessionState.AWAITING_PAYMENT_RETRY;
import static me.golemcore.concierge.takeaway.OrderSessionState.CLARIFICATION_COUNT;
import static me.golemcore.concierge.takeaway.OrderSessionState.CUSTOMER_NAME;
import static me.golemcore.concierge.takeaway.OrderSessionState.DRAFT_ITEMS;
import static me.golemcore.concierge.takeaway.OrderSessionState.LAST_CONFIRMATION_SENT_AT;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_CONFIRMED;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_ID;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_NOTES;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_STATUS;
import static me.golemcore.concierge.takeaway.OrderSessionState.PAYMENT_LINK_SENT_AT;
import static me.golemcore.concierge.takeaway.OrderSessionState.PICKUP_MODE;
import static me.golemcore.concierge.takeaway.OrderSessionState.PICKUP_TIME;

/**
 * Rule-driven takeaway ordering.
 *
 * <p>
 * Items are collected from free text into a draft kept in session metadata.
 * Once the required fields are present the order is written and the customer
 * gets a summary to confirm with an explicit yes. Confirmation either issues a
 * payment link or confirms directly and alerts the business. Confirmed orders
 * are never changed or canceled here; those requests hand off to staff.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TakeawayOrderModule implements ModuleHandler {

    public static final String NAME = "takeaway-order";

    static final String MODULE_BLOCKED = "I'm unable to process orders at this time. "
            + "Please call us directly to place your order.";
    static final String NOT_ENABLED = "Online ordering is not currently available. Please call us to place your order.";
    static final String ASK_ITEMS = "What would you like to order?";
    static final String ASK_MORE_ITEMS = "Would you like to add anything else to your order?";
    static final String ASK_PICKUP_TIME = "When would you like to pick up your order? "
            + "You can say 'ASAP' or give us a specific time.";
    static final String ASK_NAME = "May I have your name for the order?";
    static final String ASK_PHONE = "What's the best phone number for your order?";
    static final String ITEMS_UNCLEAR = "I didn't quite catch that. Could you please repeat your order?";
    static final String MAX_CLARIFICATIONS = "I'm having trouble understanding your order. "
            + "Let me connect you with someone who can help.";
    static final String ORDER_EXPIRED = "Your order has expired. Please start a new order when you're ready.";
    static final String MODIFY_AFTER_CONFIRM = "To modify your confirmed order, please call us directly "
            + "and we'll be happy to help.";
    static final String CANCEL_AFTER_CONFIRM = "To cancel your confirmed order, please call us directly.";
    static final String NOTHING_TO_CONFIRM = "I don't see an order to confirm. Would you like to place a new order?";
    static final String NO_CURRENT_ORDER = "I don't see any current orders. Would you like to place a new order?";
    static final String NOTHING_TO_RETRY = "I don't see an order to retry payment for. "
            + "Would you like to place a new order?";
    static final String PAYMENT_TROUBLE = "I'm having trouble setting up payment. "
            + "Let me connect you with someone who can help.";

    private final OrderStateMachine orders;
    private final TakeawayPaymentService payments;
    private final BusinessNotifier notifier;
    private final AuditService auditService;
    private final Clock clock;

    enum Action {
        ADD, CONFIRM, REPROMPT, CANCEL, MODIFY, STATUS, RETRY_PAYMENT
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getAliases() {
        return List.of("order");
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        FeatureGateResult gate = context.canUse(FeatureGate.TAKEAWAY);
        if (!gate.isAllowed()) {
            return ModuleResult.blocked(MODULE_BLOCKED, gate.getReason(), gate.getBlockedBy());
        }

        TenantSettings tenant = context.getTenant();
        TakeawayConfig config = TakeawayConfigParser.parseTakeaway(tenant != null ? tenant.getTakeawayConfig() : null);
        if (!config.enabled()) {
            return ModuleResult.handoff(NOT_ENABLED, "Takeaway not enabled for tenant");
        }

        String orderId = context.metadataString(ORDER_ID);
        Optional<Order> existing = orderId != null ? orders.findOrder(orderId)
                : orders.getPendingOrderForSession(context.getSessionId());
        Action action = determineAction(context, config, existing.map(Order::getStatus).orElse(null));
        log.debug("[Takeaway] Action {} for session {}", action, context.getSessionId());

        try {
            return switch (action) {
            case CONFIRM -> handleConfirmation(context, config, existing.orElse(null));
            case REPROMPT -> repromptConfirmation(context, config, existing.orElse(null));
            case CANCEL -> handleCancellation(context, config, existing.orElse(null));
            case MODIFY -> handleModification(context, config, existing.orElse(null));
            case STATUS -> handleStatusCheck(context, existing.orElse(null));
            case RETRY_PAYMENT -> handlePaymentRetry(context, existing.orElse(null));
            case ADD -> handleAddItems(context, config, existing.orElse(null));
            };
        } catch (RuntimeException e) { // NOSONAR - any failure hands the order to staff
            log.error("[Takeaway] Order processing failed for session {}: {}", context.getSessionId(),
                    e.getMessage(), e);
            existing.ifPresent(order -> orders.logEvent(order.getId(), OrderEventType.ERROR,
                    Map.of("error", String.valueOf(e.getMessage()))));
            return ModuleResult.handoff(MODULE_BLOCKED, "Order processing error");
        }
    }

    /**
     * Yes/no replies only count while a confirmation or a payment retry is
     * pending. Otherwise the classified intent decides, except that a confirm
     * intent still needs a yes phrase before anything is confirmed.
     */
    static Action determineAction(ModuleContext context, TakeawayConfig config, OrderStatus currentStatus) {
        String text = context.getUserText();
        if (context.metadataFlag(AWAITING_CONFIRMATION)) {
            if (config.isConfirmationYes(text)) {
                return Action.CONFIRM;
            }
            if (config.isConfirmationNo(text)) {
                return Action.CANCEL;
            }
        }
        if (context.metadataFlag(AWAITING_PAYMENT_RETRY)) {
            if (config.isConfirmationYes(text)) {
                return Action.RETRY_PAYMENT;
            }
            if (config.isConfirmationNo(text)) {
                return Action.CANCEL;
            }
        }
        if (context.metadataFlag(AWAITING_PAYMENT) && currentStatus == OrderStatus.PENDING_PAYMENT) {
            return Action.STATUS;
        }

        String intent = context.getIntent() != null ? context.getIntent() : "";
        if (intent.contains("confirm")) {
            return config.isConfirmationYes(text) ? Action.CONFIRM : Action.REPROMPT;
        }
        if (intent.contains("cancel")) {
            return Action.CANCEL;
        }
        if (intent.contains("modify") || intent.contains("change")) {
            return Action.MODIFY;
        }
        if (intent.contains("status")) {
            return Action.STATUS;
        }
        if (intent.contains("order")) {
            return Action.ADD;
        }
        return currentStatus == OrderStatus.CONFIRMED ? Action.STATUS : Action.ADD;
    }

    // ==================== add items ====================

    private ModuleResult handleAddItems(ModuleContext context, TakeawayConfig config, Order existing) {
        TenantSettings tenant = context.getTenant();
        MenuConfig menu = TakeawayConfigParser.parseMenu(tenant.getMenuConfig());
        ZoneId zone = tenant.zone();
        Instant now = clock.instant();
        int clarificationCount = context.metadataInt(CLARIFICATION_COUNT, 0);
        String awaiting = context.metadataString(AWAITING);

        OrderTextParser.ParsedOrder parsed = OrderTextParser.parse(context.getUserText(), menu,
                config.defaultQuantity());

        List<OrderItem> currentItems = existing != null && existing.getStatus().isOpen()
                && existing.getStatus() != OrderStatus.PENDING_PAYMENT
                        ? existing.getItems()
                        : OrderSessionState.draftItems(context);
        List<OrderItem> items = OrderSessionState.mergeItems(currentItems, parsed.items());

        String customerName = firstNonBlank(parsed.customerName(),
                "name".equals(awaiting) ? OrderTextParser.extractName(context.getUserText(), true) : null,
                context.metadataString(CUSTOMER_NAME),
                existing != null ? existing.getCustomerName() : null);
        PickupMode pickupMode = parsed.pickupMode() != null ? parsed.pickupMode()
                : PickupMode.fromValue(context.metadataString(PICKUP_MODE), config.defaultPickupMode());
        Instant pickupTime = parsed.pickupTime() != null ? resolvePickupTime(parsed.pickupTime(), zone, now)
                : parseInstant(context.metadataString(PICKUP_TIME));
        String customerPhone = firstNonBlank(context.metadataString("customerPhone"), context.getContactKey());
        String notes = context.metadataString(ORDER_NOTES);

        Map<String, Object> draftUpdates = ModuleResult.updates();
        draftUpdates.put(DRAFT_ITEMS, OrderSessionState.itemsToMetadata(items));
        draftUpdates.put(PICKUP_MODE, pickupMode.getValue());
        draftUpdates.put(PICKUP_TIME, pickupTime != null ? pickupTime.toString() : null);
        if (customerName != null) {
            draftUpdates.put(CUSTOMER_NAME, customerName);
        }

        if (!parsed.rejected().isEmpty()) {
            draftUpdates.put(CLARIFICATION_COUNT, clarificationCount + 1);
            return clarify(config, clarificationCount, menu.itemNotFoundMessage(), draftUpdates);
        }

        if (items.isEmpty()) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(CLARIFICATION_COUNT, clarificationCount + 1);
            updates.put(AWAITING, "items");
            String prompt = existing != null ? ASK_MORE_ITEMS : clarificationCount > 0 ? ITEMS_UNCLEAR : ASK_ITEMS;
            return clarify(config, clarificationCount, prompt, updates);
        }

        int totalQuantity = items.stream().mapToInt(OrderItem::getQuantity).sum();
        if (totalQuantity > config.maxItems()) {
            return ModuleResult.reply("Sorry, we can only process orders with up to " + config.maxItems()
                    + " items at a time.");
        }

        if (pickupMode == PickupMode.TIME && pickupTime != null
                && OrderStateMachine.validatePickupTime(pickupTime, config.minNoticeMinutes(), now).isPresent()) {
            draftUpdates.put(PICKUP_TIME, null);
            draftUpdates.put(AWAITING, "pickup time");
            return ModuleResult.reply("We need at least " + config.minNoticeMinutes()
                    + " minutes notice for pickup. Would you like to pick up later?", draftUpdates);
        }

        String missing = missingField(config, customerName, customerPhone, pickupMode, pickupTime);
        if (missing != null) {
            String prompt = switch (missing) {
            case "name" -> ASK_NAME;
            case "pickup time" -> ASK_PICKUP_TIME;
            case "phone" -> ASK_PHONE;
            default -> "Please provide your " + missing + ".";
            };
            draftUpdates.put(AWAITING, missing);
            draftUpdates.put(CLARIFICATION_COUNT, clarificationCount + 1);
            return clarify(config, clarificationCount, prompt, draftUpdates);
        }

        OrderDraft draft = OrderDraft.builder()
                .customerName(customerName)
                .customerPhone(customerPhone)
                .pickupMode(pickupMode)
                .pickupTime(pickupMode == PickupMode.TIME ? pickupTime : null)
                .notes(notes)
                .items(items)
                .build();

        OrderOperationResult result = writeDraft(context, draft, existing);
        if (!result.success() || result.order() == null) {
            return ModuleResult.handoff(MODULE_BLOCKED,
                    result.error() != null ? result.error() : "Failed to create order");
        }
        Order order = result.order();
        if (order.getStatus() == OrderStatus.DRAFT) {
            OrderOperationResult requested = orders.requestOrderConfirmation(order.getId());
            if (!requested.success()) {
                return ModuleResult.handoff(MODULE_BLOCKED, requested.error());
            }
            order = requested.order();
        }

        Map<String, Object> updates = ModuleResult.updates();
        updates.put(CUSTOMER_NAME, customerName);
        updates.put(DRAFT_ITEMS, null);
        updates.put(CLARIFICATION_COUNT, 0);
        updates.put(AWAITING, null);
        return confirmationPrompt(config, order, zone, updates);
    }

    /**
     * Order summary with the YES/NO prompt. Marks the session as awaiting
     * confirmation for {@code order}.
     */
    private ModuleResult confirmationPrompt(TakeawayConfig config, Order order, ZoneId zone,
            Map<String, Object> updates) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("orderSummary", OrderStateMachine.buildOrderSummary(order.getItems(), order.getNotes()));
        variables.put("pickupTime", OrderStateMachine.formatPickupTime(order.getPickupTime(), order.getPickupMode(),
                zone));
        variables.put("orderId", OrderStateMachine.shortOrderId(order.getId()));

        updates.put(ORDER_ID, order.getId());
        updates.put(ORDER_STATUS, order.getStatus().getValue());
        updates.put(AWAITING_CONFIRMATION, true);
        updates.put(LAST_CONFIRMATION_SENT_AT, clock.instant().toString());
        return ModuleResult.reply(TemplateRenderer.render(config.templates().customerNeedConfirmationText(),
                variables), updates);
    }

    private OrderOperationResult writeDraft(ModuleContext context, OrderDraft draft, Order existing) {
        if (existing != null && existing.getStatus() == OrderStatus.DRAFT) {
            return orders.updateOrderDraft(existing.getId(), draft);
        }
        OrderOperationResult created = orders.createOrderDraft(context.getTenantId(), context.getChannel(), draft,
                context.getSessionId());
        if (created.success() && existing != null && existing.getStatus() == OrderStatus.PENDING_CONFIRMATION
                && !existing.getId().equals(created.orderId())) {
            orders.cancelOrder(existing.getId(), "Replaced by updated order");
        }
        return created;
    }

    private static String missingField(TakeawayConfig config, String name, String phone, PickupMode mode,
            Instant pickupTime) {
        if (config.requireName() && name == null) {
            return "name";
        }
        if (mode == PickupMode.TIME && pickupTime == null) {
            return "pickup time";
        }
        if (config.requirePhone() && phone == null) {
            return "phone";
        }
        return null;
    }

    private static ModuleResult clarify(TakeawayConfig config, int clarificationCount, String prompt,
            Map<String, Object> updates) {
        if (clarificationCount >= config.maxClarificationQuestions()) {
            Map<String, Object> reset = ModuleResult.updates();
            reset.put(CLARIFICATION_COUNT, 0);
            reset.put(AWAITING, null);
            return ModuleResult.builder()
                    .replyText(MAX_CLARIFICATIONS)
                    .handoffTriggered(true)
                    .handoffReason("Max clarification questions exceeded")
                    .sessionMetadataUpdates(reset)
                    .build();
        }
        return ModuleResult.reply(prompt, updates);
    }

    // ==================== confirmation ====================

    private ModuleResult handleConfirmation(ModuleContext context, TakeawayConfig config, Order existing) {
        if (existing == null) {
            return ModuleResult.reply(NOTHING_TO_CONFIRM);
        }
        String shortId = OrderStateMachine.shortOrderId(existing.getId());

        if (existing.getStatus() == OrderStatus.CONFIRMED) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(ORDER_CONFIRMED, true);
            updates.put(AWAITING_CONFIRMATION, false);
            return ModuleResult.reply("Great! Your order #" + shortId
                    + " has been confirmed. We'll have it ready for you!", updates);
        }
        PaymentConfig paymentConfig = TakeawayConfigParser.parsePayment(context.getTenant().getTakeawayPaymentConfig());
        if (existing.getStatus() == OrderStatus.PENDING_PAYMENT) {
            // replayed yes: the payment service hands back the link already issued
            return handlePaymentRequired(context, existing, paymentConfig);
        }
        if (existing.getStatus() != OrderStatus.PENDING_CONFIRMATION && existing.getStatus() != OrderStatus.DRAFT) {
            return ModuleResult.reply(ORDER_EXPIRED, clearedOrderState());
        }
        if (paymentConfig.isPaymentRequired(existing.getPaymentRequired())) {
            return handlePaymentRequired(context, existing, paymentConfig);
        }
        return confirmDirectly(context, config, existing);
    }

    private ModuleResult repromptConfirmation(ModuleContext context, TakeawayConfig config, Order existing) {
        if (existing == null) {
            return ModuleResult.reply(NOTHING_TO_CONFIRM);
        }
        if (existing.getStatus() != OrderStatus.PENDING_CONFIRMATION) {
            return handleStatusCheck(context, existing);
        }
        log.debug("[Takeaway] Confirm intent without a yes reply, re-sending summary for {}", existing.getId());
        return confirmationPrompt(config, existing, context.getTenant().zone(), ModuleResult.updates());
    }

    private ModuleResult handlePaymentRequired(ModuleContext context, Order order, PaymentConfig paymentConfig) {
        if (order.getPaymentAmountCents() == null || order.getPaymentAmountCents() <= 0) {
            log.error("[Takeaway] Order {} requires payment but has no amount", order.getId());
            return ModuleResult.handoff(MODULE_BLOCKED, "Order requires payment but no amount set");
        }

        TakeawayPaymentService.IssuedLink link;
        try {
            link = payments.issueLink(order, paymentConfig, false, context::canUse);
        } catch (PaymentSetupException e) {
            log.error("[Takeaway] Payment setup failed for order {}: {}", order.getId(), e.getMessage());
            orders.logEvent(order.getId(), OrderEventType.ERROR, Map.of("error", String.valueOf(e.getMessage())));
            return ModuleResult.handoff(PAYMENT_TROUBLE, "Payment setup failed: " + e.getMessage());
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("orderId", OrderStateMachine.shortOrderId(order.getId()));
        variables.put("paymentUrl", link.paymentUrl());
        variables.put("expiresMinutes", paymentConfig.expiresMinutes());
        variables.put("amount", MenuConfig.formatPrice(order.getPaymentAmountCents(), paymentConfig.currency()));

        Map<String, Object> updates = ModuleResult.updates();
        updates.put(ORDER_STATUS, OrderStatus.PENDING_PAYMENT.getValue());
        updates.put(AWAITING_CONFIRMATION, false);
        updates.put(AWAITING_PAYMENT, true);
        updates.put(PAYMENT_LINK_SENT_AT, clock.instant().toString());
        return ModuleResult.reply(TemplateRenderer.render(paymentConfig.messages().pending(), variables), updates);
    }

    private ModuleResult confirmDirectly(ModuleContext context, TakeawayConfig config, Order existing) {
        OrderOperationResult result = orders.confirmWithoutPayment(existing.getId());
        if (!result.success()) {
            return ModuleResult.handoff(MODULE_BLOCKED, result.error());
        }
        Order order = result.order();

        if (!result.duplicate()) {
            BusinessNotifier.NotificationOutcome outcome = notifier.notifyBusinessOfOrder(context.getTenant(), order,
                    config, context::canUse);
            if (!outcome.success()) {
                log.error("[Takeaway] Business notification failed: {}", outcome.error());
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("orderId", order.getId());
            details.put("channel", context.getChannel() != null ? context.getChannel().getValue() : null);
            details.put("totalItems", order.getTotalItems());
            details.put("paymentRequired", false);
            auditService.record(context.getTenantId(), "takeaway.confirmed", details);
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("orderId", OrderStateMachine.shortOrderId(order.getId()));
        variables.put("pickupTime", OrderStateMachine.formatPickupTime(order.getPickupTime(), order.getPickupMode(),
                context.getTenant().zone()));

        Map<String, Object> updates = ModuleResult.updates();
        updates.put(ORDER_STATUS, OrderStatus.CONFIRMED.getValue());
        updates.put(ORDER_CONFIRMED, true);
        updates.put(AWAITING_CONFIRMATION, false);
        return ModuleResult.reply(TemplateRenderer.render(config.templates().customerConfirmationText(), variables),
                updates);
    }

    // ==================== cancel / modify ====================

    private ModuleResult handleCancellation(ModuleContext context, TakeawayConfig config, Order existing) {
        if (existing != null && existing.getStatus() == OrderStatus.CONFIRMED) {
            return refuseAfterConfirm(context, existing, "cancel_after_confirm",
                    "Customer requested cancel after confirmation", CANCEL_AFTER_CONFIRM,
                    "Cancel after confirmation requires handoff");
        }
        if (existing != null) {
            OrderOperationResult result = orders.cancelOrder(existing.getId(), "Customer requested cancellation");
            if (result.conflict() && result.order().getStatus() == OrderStatus.EXPIRED) {
                return ModuleResult.reply(config.templates().customerExpiredText(), clearedOrderState());
            }
        }
        return ModuleResult.reply(TemplateRenderer.render(config.templates().customerCanceledText(), Map.of()),
                clearedOrderState());
    }

    private ModuleResult handleModification(ModuleContext context, TakeawayConfig config, Order existing) {
        if (existing != null && existing.getStatus() == OrderStatus.CONFIRMED) {
            return refuseAfterConfirm(context, existing, "modify_after_confirm",
                    "Customer requested modification after confirmation", MODIFY_AFTER_CONFIRM,
                    "Modification after confirmation requires handoff");
        }
        return handleAddItems(context, config, existing);
    }

    private ModuleResult refuseAfterConfirm(ModuleContext context, Order order, String eventReason,
            String auditReason, String reply, String handoffReason) {
        orders.logEvent(order.getId(), OrderEventType.HANDOFF_TRIGGERED, Map.of("reason", eventReason));
        auditService.record(context.getTenantId(), "takeaway.handoff_triggered", Map.of(
                "orderId", order.getId(),
                "reason", auditReason));
        return ModuleResult.handoff(reply, handoffReason);
    }

    // ==================== status / payment retry ====================

    private ModuleResult handleStatusCheck(ModuleContext context, Order existing) {
        if (existing == null) {
            return ModuleResult.reply(NO_CURRENT_ORDER);
        }
        String shortId = OrderStateMachine.shortOrderId(existing.getId());
        if (existing.getStatus() == OrderStatus.PENDING_PAYMENT && existing.getPaymentExpiresAt() != null
                && clock.instant().isAfter(existing.getPaymentExpiresAt())) {
            PaymentConfig paymentConfig = TakeawayConfigParser.parsePayment(
                    context.getTenant().getTakeawayPaymentConfig());
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(AWAITING_PAYMENT, false);
            updates.put(AWAITING_PAYMENT_RETRY, true);
            return ModuleResult.reply(TemplateRenderer.render(paymentConfig.messages().expired(),
                    Map.of("orderId", shortId)), updates);
        }

        String message = switch (existing.getStatus()) {
        case DRAFT -> "Your order #" + shortId + " is in progress. Would you like to add anything else?";
        case PENDING_CONFIRMATION -> "Your order #" + shortId
                + " is waiting for your confirmation. Reply YES to confirm.";
        case PENDING_PAYMENT -> "Your order #" + shortId + " is waiting for payment. "
                + "Please use the payment link we sent you.";
        case CONFIRMED -> "Your order #" + shortId + " is confirmed. Pickup: "
                + OrderStateMachine.formatPickupTime(existing.getPickupTime(), existing.getPickupMode(),
                        context.getTenant().zone());
        case EXPIRED -> ORDER_EXPIRED;
        case CANCELED -> "Your order was canceled. Would you like to place a new order?";
        };
        return ModuleResult.reply(message);
    }

    private ModuleResult handlePaymentRetry(ModuleContext context, Order existing) {
        if (existing == null) {
            return ModuleResult.reply(NOTHING_TO_RETRY);
        }
        String shortId = OrderStateMachine.shortOrderId(existing.getId());
        PaymentConfig paymentConfig = TakeawayConfigParser.parsePayment(context.getTenant().getTakeawayPaymentConfig());

        if (!paymentConfig.canRetryPayment(existing.getPaymentAttemptCount())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", "max_payment_retries_exceeded");
            details.put("attemptCount", existing.getPaymentAttemptCount());
            orders.logEvent(existing.getId(), OrderEventType.HANDOFF_TRIGGERED, details);
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(AWAITING_PAYMENT_RETRY, false);
            return ModuleResult.builder()
                    .replyText(TemplateRenderer.render(paymentConfig.messages().maxRetriesExceeded(),
                            Map.of("orderId", shortId)))
                    .handoffTriggered(true)
                    .handoffReason("Max payment retries exceeded")
                    .sessionMetadataUpdates(updates)
                    .build();
        }
        if (existing.getStatus() != OrderStatus.PENDING_PAYMENT) {
            return ModuleResult.reply(ORDER_EXPIRED, clearedOrderState());
        }

        TakeawayPaymentService.IssuedLink link;
        try {
            link = payments.issueLink(existing, paymentConfig, true, context::canUse);
        } catch (PaymentSetupException e) {
            log.error("[Takeaway] Payment retry failed for order {}: {}", existing.getId(), e.getMessage());
            return ModuleResult.handoff(PAYMENT_TROUBLE, "Payment retry setup failed: " + e.getMessage());
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("orderId", shortId);
        variables.put("paymentUrl", link.paymentUrl());
        variables.put("expiresMinutes", paymentConfig.expiresMinutes());

        Map<String, Object> updates = ModuleResult.updates();
        updates.put(ORDER_STATUS, OrderStatus.PENDING_PAYMENT.getValue());
        updates.put(AWAITING_PAYMENT, true);
        updates.put(AWAITING_PAYMENT_RETRY, false);
        updates.put(PAYMENT_LINK_SENT_AT, clock.instant().toString());
        return ModuleResult.reply(TemplateRenderer.render(paymentConfig.messages().retryLinkSent(), variables),
                updates);
    }

    // ==================== helpers ====================

    static Map<String, Object> clearedOrderState() {
        Map<String, Object> updates = ModuleResult.updates();
        for (String key : List.of(ORDER_ID, ORDER_STATUS, DRAFT_ITEMS, AWAITING, CLARIFICATION_COUNT,
                PICKUP_TIME)) {
            updates.put(key, null);
        }
        updates.put(AWAITING_CONFIRMATION, false);
        updates.put(AWAITING_PAYMENT, false);
        updates.put(AWAITING_PAYMENT_RETRY, false);
        return updates;
    }

    /**
     * Today's occurrence of the time in the tenant zone, or tomorrow's when
     * today's has already passed.
     */
    static Instant resolvePickupTime(LocalTime time, ZoneId zone, Instant now) {
        LocalDate today = now.atZone(zone).toLocalDate();
        Instant candidate = today.atTime(time).atZone(zone).toInstant();
        return candidate.isBefore(now) ? today.plusDays(1).atTime(time).atZone(zone).toInstant() : candidate;
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static String firstNonBlank(String... values) {
        List<String> candidates = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                candidates.add(value);
            }
        }
        return candidates.isEmpty() ? null : candidates.get(0);
    }
}
