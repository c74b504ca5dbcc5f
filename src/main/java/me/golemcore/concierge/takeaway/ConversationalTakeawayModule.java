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
import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.exception.PaymentSetupException;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.ConversationTurn;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.Message;
import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.PickupMode;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.model.ToolDefinition;
import me.golemcore.concierge.domain.service.GenerationService;
import me.golemcore.concierge.gating.FeatureGate;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static me.golemcore.concierge.takeaway.OrderSessionState.AWAITING_PAYMENT;
import static me.golemcore.concierge.takeaway.OrderSessionState.CUSTOMER_NAME;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_CONFIRMED;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_ID;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_ITEMS;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_NOTES;
import static me.golemcore.concierge.takeaway.OrderSessionState.ORDER_STATUS;
import static me.golemcore.concierge.takeaway.OrderSessionState.PICKUP_MODE;

/**
 * Takeaway ordering driven by LLM function calling.
 *
 * <p>
 * The model talks to the customer and manipulates the order only through the
 * tools declared here. Every item is checked against the menu before it
 * lands in the order, so the model cannot invent dishes or prices. The
 * running order lives in session metadata until {@code confirm_order} writes
 * it through {@link OrderStateMachine}. That tool only goes through when the
 * customer's own reply is one of the tenant's yes phrases.
 *
 * <p>
 * Tenants opt in with {@code useConversationalMode}; the engine routes
 * takeaway traffic here instead of {@link TakeawayOrderModule} when the flag
 * is set and the menu is enabled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationalTakeawayModule implements ModuleHandler {

    public static final String NAME = "takeaway-conversational";

    static final String MODULE_BLOCKED = "I'm unable to process orders at this time. Please call us directly.";
    static final String NOT_AVAILABLE = "Online ordering is not currently available. Please call us directly.";
    static final String DEFAULT_REPLY = "I'm here to help you order. What would you like?";
    static final String ERROR_REPLY = "I'm having trouble right now. Let me connect you with someone who can help.";
    static final String CANCELED_REPLY = "No problem, I've cancelled your order. "
            + "Let me know if you'd like to start a new one!";
    static final String EMPTY_ORDER = "Your order is currently empty.";
    static final String NOTHING_TO_CONFIRM = "Your order is empty. What would you like to order?";
    static final String ASK_NAME = "May I have your name for the order?";
    static final String CONFIRM_PROMPT = "Reply YES to confirm or NO to cancel.";
    static final double ESTIMATED_COST = 0.02;
    static final int HISTORY_LIMIT = 10;
    static final int MAX_QUANTITY = 10;

    private final GenerationService generationService;
    private final OrderStateMachine orders;
    private final TakeawayPaymentService payments;
    private final BusinessNotifier notifier;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        FeatureGateResult gate = context.canUse(FeatureGate.TAKEAWAY);
        if (!gate.isAllowed()) {
            return ModuleResult.blocked(MODULE_BLOCKED, gate.getReason(), gate.getBlockedBy());
        }

        TenantSettings tenant = context.getTenant();
        TakeawayConfig config = TakeawayConfigParser.parseTakeaway(tenant != null ? tenant.getTakeawayConfig() : null);
        MenuConfig menu = TakeawayConfigParser.parseMenu(tenant != null ? tenant.getMenuConfig() : null);
        if (!config.enabled() || !menu.enabled()) {
            return ModuleResult.handoff(NOT_AVAILABLE, "Takeaway or menu not enabled");
        }
        if (!generationService.isConfigured()) {
            return ModuleResult.handoff(ERROR_REPLY, "LLM not configured");
        }

        ConversationState state = ConversationState.from(context, config);

        LlmRequest request = LlmRequest.builder()
                .model(context.getChannel() == Channel.VOICE ? generationService.classificationModel()
                        : generationService.resolveModel(tenant))
                .systemPrompt(buildSystemPrompt(context, menu, state))
                .messages(buildMessages(context))
                .tools(toolDefinitions(menu))
                .temperature(0.7)
                .build();

        GenerationService.Generation generation;
        try {
            generation = generationService.chat(context.getTenantId(), "llm.takeaway", request, ESTIMATED_COST);
        } catch (BudgetExceededException e) {
            log.warn("[Takeaway] Conversational ordering blocked by budget for tenant {}", context.getTenantId());
            return ModuleResult.blocked(MODULE_BLOCKED, "Budget limit exceeded", "budget");
        } catch (GenerationFailureException e) {
            log.error("[Takeaway] Conversational generation failed: {}", e.getMessage());
            return ModuleResult.handoff(ERROR_REPLY, "LLM error");
        }

        ModuleResult result;
        try {
            result = applyResponse(context, config, menu, state, generation);
        } catch (RuntimeException e) { // NOSONAR - any failure hands the order to staff
            log.error("[Takeaway] Conversational order processing failed for session {}: {}",
                    context.getSessionId(), e.getMessage(), e);
            result = ModuleResult.handoff(ERROR_REPLY, "Order processing error");
        }
        return result.toBuilder()
                .inputTokens(generation.inputTokens())
                .outputTokens(generation.outputTokens())
                .costUsd(generation.costUsd())
                .model(generation.model())
                .build();
    }

    private ModuleResult applyResponse(ModuleContext context, TakeawayConfig config, MenuConfig menu,
            ConversationState state, GenerationService.Generation generation) {
        List<String> toolOutputs = new ArrayList<>();
        if (generation.response().hasToolCalls()) {
            for (Message.ToolCall call : generation.response().getToolCalls()) {
                Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();
                log.debug("[Takeaway] Tool call {} for session {}", call.getName(), context.getSessionId());
                switch (call.getName()) {
                case "add_to_order" -> toolOutputs.add(addToOrder(menu, state, args));
                case "remove_from_order" -> toolOutputs.add(removeFromOrder(state, args));
                case "get_order_summary" -> toolOutputs.add(orderSummary(state, menu.currency()));
                case "set_customer_name" -> toolOutputs.add(setCustomerName(state, args));
                case "get_menu" -> toolOutputs.add(describeMenu(menu, stringArg(args, "category")));
                case "confirm_order" -> {
                    return confirmOrder(context, config, menu, state);
                }
                case "cancel_order" -> {
                    return cancelOrder(context, state);
                }
                default -> log.warn("[Takeaway] Unknown tool requested: {}", call.getName());
                }
            }
        }

        String reply = generation.text().isBlank() ? String.join(" ", toolOutputs) : generation.text();
        if (reply.isBlank()) {
            reply = DEFAULT_REPLY;
        }
        return ModuleResult.reply(reply, state.toUpdates());
    }

    // ==================== tools ====================

    String addToOrder(MenuConfig menu, ConversationState state, Map<String, Object> args) {
        String itemName = stringArg(args, "item_name");
        Optional<MenuConfig.MenuItem> found = itemName != null ? menu.findMenuItem(itemName) : Optional.empty();
        if (found.isEmpty()) {
            return "\"" + itemName + "\" is not available on our menu.";
        }
        MenuConfig.MenuItem menuItem = found.get();
        int quantity = Math.max(1, Math.min(MAX_QUANTITY, intArg(args, "quantity", 1)));
        int unitPrice = MenuConfig.calculateItemPrice(menuItem, Map.of());
        OrderItem addition = OrderItem.builder()
                .menuItemId(menuItem.id())
                .name(menuItem.name())
                .quantity(quantity)
                .notes(stringArg(args, "notes"))
                .unitPriceCents(unitPrice)
                .build();
        state.items = OrderSessionState.mergeItems(state.items, List.of(addition));
        return "Added " + quantity + "x " + menuItem.name() + " ("
                + MenuConfig.formatPrice(unitPrice * quantity, menu.currency()) + ") to your order.";
    }

    static String removeFromOrder(ConversationState state, Map<String, Object> args) {
        String itemName = stringArg(args, "item_name");
        String needle = itemName != null ? itemName.toLowerCase(Locale.ROOT) : "";
        for (OrderItem item : state.items) {
            if (!needle.isEmpty() && item.getName().toLowerCase(Locale.ROOT).contains(needle)) {
                List<OrderItem> remaining = new ArrayList<>(state.items);
                remaining.remove(item);
                state.items = remaining;
                return "Removed " + item.getName() + " from your order.";
            }
        }
        return "\"" + itemName + "\" is not in your current order.";
    }

    static String orderSummary(ConversationState state, String currency) {
        if (state.items.isEmpty()) {
            return EMPTY_ORDER;
        }
        StringBuilder sb = new StringBuilder();
        for (OrderItem item : state.items) {
            sb.append(item.getQuantity()).append("x ").append(item.getName()).append(" - ")
                    .append(MenuConfig.formatPrice(item.lineTotalCents(), currency)).append('\n');
        }
        sb.append("Total: ").append(MenuConfig.formatPrice(totalCents(state.items), currency));
        return sb.toString();
    }

    static String setCustomerName(ConversationState state, Map<String, Object> args) {
        String name = stringArg(args, "name");
        if (name == null || name.isBlank()) {
            return "I didn't catch your name.";
        }
        state.customerName = name.trim();
        return "Got it, " + state.customerName + "!";
    }

    static String describeMenu(MenuConfig menu, String category) {
        List<MenuConfig.MenuItem> items = menu.items().stream()
                .filter(MenuConfig.MenuItem::available)
                .filter(item -> category == null || category.isBlank()
                        || category.equalsIgnoreCase(item.categoryId())
                        || menu.categories().stream().anyMatch(c -> c.id().equals(item.categoryId())
                                && c.name().equalsIgnoreCase(category)))
                .toList();
        if (items.isEmpty()) {
            return "No menu items available.";
        }
        List<String> lines = new ArrayList<>();
        for (MenuConfig.MenuItem item : items) {
            String line = "• " + item.name() + " - " + MenuConfig.formatPrice(item.priceCents(), menu.currency());
            if (item.description() != null && !item.description().isBlank()) {
                line += " (" + item.description() + ")";
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }

    // ==================== confirm / cancel ====================

    private ModuleResult confirmOrder(ModuleContext context, TakeawayConfig config, MenuConfig menu,
            ConversationState state) {
        if (state.items.isEmpty()) {
            return ModuleResult.reply(NOTHING_TO_CONFIRM, state.toUpdates());
        }
        if (config.requireName() && state.customerName == null) {
            return ModuleResult.reply(ASK_NAME, state.toUpdates());
        }
        if (!config.isConfirmationYes(context.getUserText())) {
            log.info("[Takeaway] confirm_order without a yes reply in session {}, asking again",
                    context.getSessionId());
            return ModuleResult.reply(orderSummary(state, menu.currency()) + "\n\n" + CONFIRM_PROMPT,
                    state.toUpdates());
        }

        OrderDraft draft = OrderDraft.builder()
                .customerName(state.customerName)
                .customerPhone(context.getContactKey())
                .pickupMode(state.pickupMode)
                .notes(state.notes)
                .items(state.items)
                .build();
        OrderOperationResult created = orders.createOrderDraft(context.getTenantId(), context.getChannel(), draft,
                context.getSessionId());
        if (!created.success() || created.order() == null) {
            return ModuleResult.handoff(ERROR_REPLY, created.error() != null ? created.error()
                    : "Failed to create order");
        }
        Order order = created.order();
        String shortId = OrderStateMachine.shortOrderId(order.getId());

        PaymentConfig paymentConfig = TakeawayConfigParser.parsePayment(context.getTenant().getTakeawayPaymentConfig());
        if (paymentConfig.isPaymentRequired(order.getPaymentRequired())) {
            if (order.getPaymentAmountCents() == null || order.getPaymentAmountCents() <= 0) {
                return ModuleResult.handoff(ERROR_REPLY, "Order requires payment but no amount set");
            }
            try {
                payments.issueLink(order, paymentConfig, false, context::canUse);
            } catch (PaymentSetupException e) {
                log.error("[Takeaway] Payment setup failed for order {}: {}", order.getId(), e.getMessage());
                return ModuleResult.handoff(ERROR_REPLY, "Payment setup failed: " + e.getMessage());
            }
            Map<String, Object> updates = state.toUpdates();
            updates.put(ORDER_ID, order.getId());
            updates.put(ORDER_STATUS, "pending_payment");
            updates.put(AWAITING_PAYMENT, true);
            return ModuleResult.reply("Perfect! Your order total is "
                    + MenuConfig.formatPrice(order.getPaymentAmountCents(), paymentConfig.currency())
                    + ". I'm sending you a payment link by SMS. "
                    + "Your order will be confirmed once payment is complete.", updates);
        }

        OrderOperationResult confirmed = orders.confirmWithoutPayment(order.getId());
        if (!confirmed.success()) {
            return ModuleResult.handoff(ERROR_REPLY, confirmed.error());
        }
        if (!confirmed.duplicate()) {
            BusinessNotifier.NotificationOutcome outcome = notifier.notifyBusinessOfOrder(context.getTenant(),
                    confirmed.order(), config, context::canUse);
            if (!outcome.success()) {
                log.error("[Takeaway] Business notification failed: {}", outcome.error());
            }
        }

        Map<String, Object> updates = ModuleResult.updates();
        updates.put(ORDER_ITEMS, List.of());
        updates.put(CUSTOMER_NAME, null);
        updates.put(ORDER_ID, order.getId());
        updates.put(ORDER_STATUS, "confirmed");
        updates.put(ORDER_CONFIRMED, true);
        return ModuleResult.reply("Great! Your order #" + shortId + " is confirmed! We'll have it ready for pickup "
                + OrderStateMachine.formatPickupTime(order.getPickupTime(), order.getPickupMode(),
                        context.getTenant().zone())
                + ". Thank you!", updates);
    }

    private ModuleResult cancelOrder(ModuleContext context, ConversationState state) {
        String orderId = context.metadataString(ORDER_ID);
        if (orderId != null) {
            OrderOperationResult result = orders.cancelOrder(orderId, "Customer requested cancellation");
            if (result.conflict()) {
                log.info("[Takeaway] Cancel of order {} refused: {}", orderId, result.error());
            }
        }
        Map<String, Object> updates = ModuleResult.updates();
        updates.put(ORDER_ITEMS, List.of());
        updates.put(CUSTOMER_NAME, null);
        updates.put(ORDER_ID, null);
        updates.put(ORDER_STATUS, null);
        updates.put(AWAITING_PAYMENT, false);
        return ModuleResult.reply(CANCELED_REPLY, updates);
    }

    // ==================== prompt ====================

    private static List<Message> buildMessages(ModuleContext context) {
        List<ConversationTurn> history = context.getHistory();
        int from = Math.max(0, history.size() - HISTORY_LIMIT);
        List<Message> messages = new ArrayList<>();
        history.subList(from, history.size()).forEach(turn -> messages.add(Message.fromTurn(turn)));
        messages.add(Message.user(context.getUserText()));
        return messages;
    }

    static String buildSystemPrompt(ModuleContext context, MenuConfig menu, ConversationState state) {
        TenantSettings tenant = context.getTenant();
        String businessName = tenant != null && tenant.getName() != null ? tenant.getName() : "the restaurant";
        StringBuilder sb = new StringBuilder();
        sb.append("You are taking takeaway orders for ").append(businessName).append(".\n\n");
        sb.append("""
                STRICT RULES:
                1. Only offer items from the menu below. Never invent items or prices.
                2. Change the order only through the provided functions. Never claim an item was added \
                without calling add_to_order.
                3. Before confirming, read back the order and ask the customer to confirm.
                4. Only call confirm_order after the customer has replied YES to the read-back.
                5. Never reveal that you are an automated system.

                MENU:
                """);
        sb.append(describeMenu(menu, null)).append("\n\n");
        sb.append("CURRENT ORDER:\n").append(orderSummary(state, menu.currency())).append("\n\n");
        sb.append("CUSTOMER NAME: ").append(state.customerName != null ? state.customerName : "unknown").append('\n');
        if (context.getChannel() == Channel.VOICE) {
            sb.append("\nThis is a phone call. Keep every reply to one or two short sentences.\n");
        }
        return sb.toString();
    }

    static List<ToolDefinition> toolDefinitions(MenuConfig menu) {
        List<String> itemNames = menu.items().stream()
                .filter(MenuConfig.MenuItem::available)
                .map(MenuConfig.MenuItem::name)
                .toList();
        Map<String, Object> itemName = new LinkedHashMap<>();
        itemName.put("type", "string");
        itemName.put("description", "Exact menu item name");
        if (!itemNames.isEmpty()) {
            itemName.put("enum", itemNames);
        }

        return List.of(
                ToolDefinition.builder()
                        .name("add_to_order")
                        .description("Add a menu item to the customer's order")
                        .inputSchema(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "item_name", itemName,
                                        "quantity", Map.of("type", "integer", "minimum", 1,
                                                "maximum", MAX_QUANTITY),
                                        "notes", Map.of("type", "string",
                                                "description", "Special requests for this item")),
                                "required", List.of("item_name")))
                        .build(),
                ToolDefinition.builder()
                        .name("remove_from_order")
                        .description("Remove an item from the customer's order")
                        .inputSchema(Map.of(
                                "type", "object",
                                "properties", Map.of("item_name", Map.of("type", "string")),
                                "required", List.of("item_name")))
                        .build(),
                ToolDefinition.simple("get_order_summary", "Get the current order with prices and total"),
                ToolDefinition.builder()
                        .name("set_customer_name")
                        .description("Record the customer's name for the order")
                        .inputSchema(Map.of(
                                "type", "object",
                                "properties", Map.of("name", Map.of("type", "string")),
                                "required", List.of("name")))
                        .build(),
                ToolDefinition.simple("confirm_order", "Place the order after the customer confirmed it"),
                ToolDefinition.simple("cancel_order", "Cancel the current order"),
                ToolDefinition.builder()
                        .name("get_menu")
                        .description("List menu items, optionally for one category")
                        .inputSchema(Map.of(
                                "type", "object",
                                "properties", Map.of("category", Map.of("type", "string"))))
                        .build());
    }

    // ==================== helpers ====================

    static int totalCents(List<OrderItem> items) {
        return items.stream().mapToInt(OrderItem::lineTotalCents).sum();
    }

    private static String stringArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? value.toString() : null;
    }

    private static int intArg(Map<String, Object> args, String key, int defaultValue) {
        Object value = args.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Order being assembled in this turn, seeded from session metadata.
     */
    static final class ConversationState {
        List<OrderItem> items;
        String customerName;
        PickupMode pickupMode;
        String notes;

        static ConversationState from(ModuleContext context, TakeawayConfig config) {
            ConversationState state = new ConversationState();
            state.items = OrderSessionState.itemsFromMetadata(context.metadata(ORDER_ITEMS));
            state.customerName = context.metadataString(CUSTOMER_NAME);
            state.pickupMode = PickupMode.fromValue(context.metadataString(PICKUP_MODE), config.defaultPickupMode());
            state.notes = context.metadataString(ORDER_NOTES);
            return state;
        }

        Map<String, Object> toUpdates() {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(ORDER_ITEMS, OrderSessionState.itemsToMetadata(items));
            updates.put(CUSTOMER_NAME, customerName);
            updates.put(PICKUP_MODE, pickupMode.getValue());
            updates.put(ORDER_NOTES, notes);
            return updates;
        }
    }
}
