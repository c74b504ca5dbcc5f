package me.golemcore.concierge.takeaway;

import me.golemcore.concierge.adapter.outbound.memory.InMemoryAuditLog;
import me.golemcore.concierge.adapter.outbound.memory.InMemoryOrderStore;
import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.ConversationTurn;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.LlmResponse;
import me.golemcore.concierge.domain.model.LlmUsage;
import me.golemcore.concierge.domain.model.Message;
import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.OrderStatus;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.AuditService;
import me.golemcore.concierge.domain.service.GenerationService;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleResult;
import me.golemcore.concierge.port.outbound.NotificationPort;
import me.golemcore.concierge.port.outbound.PaymentPort;
import me.golemcore.concierge.security.RuleSet;
import me.golemcore.concierge.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConversationalTakeawayModuleTest {

    private static final String TENANT_ID = "tenant-1";
    private static final String PHONE = "+61412345678";

    private GenerationService generationService;
    private NotificationPort notificationPort;
    private OrderStateMachine orders;
    private ConversationalTakeawayModule module;
    private TenantSettings tenant;
    private Map<String, Object> metadata;
    private List<ConversationTurn> history;
    private Channel channel;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-03-02T07:00:00Z");
        generationService = mock(GenerationService.class);
        when(generationService.isConfigured()).thenReturn(true);
        when(generationService.resolveModel(any())).thenReturn("gpt-4o");
        when(generationService.classificationModel()).thenReturn("gpt-4o-mini");
        notificationPort = mock(NotificationPort.class);
        when(notificationPort.deliver(any())).thenReturn(
                CompletableFuture.completedFuture(NotificationPort.DeliveryResult.delivered("sms-1")));

        ConciergeProperties properties = new ConciergeProperties();
        properties.getResilience().setMaxRetries(0);
        AuditService auditService = new AuditService(new InMemoryAuditLog(), clock);
        ExternalCallExecutor executor = new ExternalCallExecutor(properties);
        orders = new OrderStateMachine(new InMemoryOrderStore(), clock);
        TakeawayPaymentService payments = new TakeawayPaymentService(mock(PaymentPort.class), notificationPort,
                executor, orders, auditService, properties, clock);
        BusinessNotifier notifier = new BusinessNotifier(notificationPort, executor, orders, auditService);
        module = new ConversationalTakeawayModule(generationService, orders, payments, notifier);

        tenant = TenantSettings.builder()
                .tenantId(TENANT_ID)
                .name("Luigi's")
                .handoffSmsTo("+61298765432")
                .useConversationalMode(true)
                .takeawayConfig(TakeawayFixtures.json(TakeawayFixtures.TAKEAWAY_JSON))
                .menuConfig(TakeawayFixtures.json(TakeawayFixtures.MENU_JSON))
                .takeawayPaymentConfig(TakeawayFixtures.json("{\"enabled\": false}"))
                .build();
        metadata = new HashMap<>();
        history = new ArrayList<>();
        channel = Channel.SMS;
    }

    private void modelAnswers(String text, Message.ToolCall... calls) {
        LlmResponse response = LlmResponse.builder()
                .content(text)
                .toolCalls(calls.length > 0 ? List.of(calls) : null)
                .usage(LlmUsage.of(300, 40))
                .model("gpt-4o")
                .build();
        when(generationService.chat(eq(TENANT_ID), eq("llm.takeaway"), any(LlmRequest.class), anyDouble()))
                .thenReturn(new GenerationService.Generation(response, "gpt-4o", 0.0031));
    }

    private static Message.ToolCall tool(String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder().id("call-" + name).name(name).arguments(arguments).build();
    }

    private ModuleResult send(String text) {
        ModuleContext context = ModuleContext.builder()
                .tenantId(TENANT_ID)
                .sessionId("session-1")
                .channel(channel)
                .contactKey(PHONE)
                .userText(text)
                .history(history)
                .rules(RuleSet.defaults())
                .tenant(tenant)
                .sessionMetadata(new HashMap<>(metadata))
                .capabilityCheck(capability -> FeatureGateResult.allow("ok"))
                .intent("order.create")
                .build();
        ModuleResult result = module.handle(context);
        if (result.getSessionMetadataUpdates() != null) {
            result.getSessionMetadataUpdates().forEach((key, value) -> {
                if (value == null) {
                    metadata.remove(key);
                } else {
                    metadata.put(key, value);
                }
            });
        }
        return result;
    }

    private void seedOrder(String customerName) {
        metadata.put(OrderSessionState.ORDER_ITEMS, OrderSessionState.itemsToMetadata(List.of(
                OrderItem.builder().menuItemId("m1").name("Margherita").quantity(2).unitPriceCents(1800).build())));
        if (customerName != null) {
            metadata.put(OrderSessionState.CUSTOMER_NAME, customerName);
        }
    }

    private LlmRequest capturedRequest() {
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(generationService).chat(anyString(), anyString(), captor.capture(), anyDouble());
        return captor.getValue();
    }

    // ==================== Tools ====================

    @Test
    void shouldAddMenuItemThroughTool() {
        // Arrange
        modelAnswers("", tool("add_to_order", Map.of("item_name", "Margherita", "quantity", 2)));

        // Act
        ModuleResult result = send("two margheritas please");

        // Assert
        assertEquals("Added 2x Margherita (" + MenuConfig.formatPrice(3600, "AUD") + ") to your order.",
                result.getReplyText());
        List<OrderItem> items = OrderSessionState.itemsFromMetadata(metadata.get(OrderSessionState.ORDER_ITEMS));
        assertEquals(1, items.size());
        assertEquals(2, items.get(0).getQuantity());
        assertEquals(1800, items.get(0).getUnitPriceCents());
        assertEquals(300, result.getInputTokens());
        assertEquals(40, result.getOutputTokens());
        assertEquals(0.0031, result.getCostUsd(), 1e-9);
        assertEquals("gpt-4o", result.getModel());
    }

    @Test
    void shouldRefuseItemsNotOnMenu() {
        modelAnswers("", tool("add_to_order", Map.of("item_name", "Lobster Thermidor")));

        ModuleResult result = send("one lobster thermidor");

        assertEquals("\"Lobster Thermidor\" is not available on our menu.", result.getReplyText());
        assertTrue(OrderSessionState.itemsFromMetadata(metadata.get(OrderSessionState.ORDER_ITEMS)).isEmpty());
    }

    @Test
    void shouldClampQuantityAndPreferModelText() {
        modelAnswers("Coming right up!", tool("add_to_order", Map.of("item_name", "Pepperoni", "quantity", "50")));

        ModuleResult result = send("fifty pepperonis");

        assertEquals("Coming right up!", result.getReplyText());
        List<OrderItem> items = OrderSessionState.itemsFromMetadata(metadata.get(OrderSessionState.ORDER_ITEMS));
        assertEquals(ConversationalTakeawayModule.MAX_QUANTITY, items.get(0).getQuantity());
    }

    @Test
    void shouldRemoveItemAndRecordName() {
        seedOrder(null);
        modelAnswers("", tool("remove_from_order", Map.of("item_name", "margherita")),
                tool("set_customer_name", Map.of("name", " Ana ")));

        ModuleResult result = send("drop the pizza, I'm Ana");

        assertEquals("Removed Margherita from your order. Got it, Ana!", result.getReplyText());
        assertEquals("Ana", metadata.get(OrderSessionState.CUSTOMER_NAME));
        assertTrue(OrderSessionState.itemsFromMetadata(metadata.get(OrderSessionState.ORDER_ITEMS)).isEmpty());
    }

    @Test
    void shouldFallBackToDefaultReplyWhenModelSaysNothing() {
        modelAnswers(null);

        ModuleResult result = send("hmm");

        assertEquals(ConversationalTakeawayModule.DEFAULT_REPLY, result.getReplyText());
    }

    // ==================== Confirm / cancel ====================

    @Test
    void shouldConfirmOrderAndNotifyBusiness() {
        seedOrder("Ana");
        modelAnswers("", tool("confirm_order", Map.of()));

        ModuleResult result = send("yes");

        assertTrue(result.getReplyText().startsWith("Great! Your order #"));
        Order order = orders.findOrder((String) metadata.get(OrderSessionState.ORDER_ID)).orElseThrow();
        assertEquals(OrderStatus.CONFIRMED, order.getStatus());
        assertEquals(PHONE, order.getCustomerPhone());
        assertEquals(3600, order.getTotalAmountCents());
        assertEquals(true, metadata.get(OrderSessionState.ORDER_CONFIRMED));
        assertFalse(metadata.containsKey(OrderSessionState.CUSTOMER_NAME));
        verify(notificationPort).deliver(any());
    }

    @Test
    void shouldNotConfirmUntilCustomerRepliesYes() {
        // Arrange
        seedOrder("Ana");
        modelAnswers("", tool("confirm_order", Map.of()));

        // Act
        ModuleResult result = send("maybe");

        // Assert
        assertTrue(result.getReplyText().startsWith("2x Margherita"));
        assertTrue(result.getReplyText().endsWith(ConversationalTakeawayModule.CONFIRM_PROMPT));
        assertFalse(metadata.containsKey(OrderSessionState.ORDER_ID));
        assertEquals(1, OrderSessionState.itemsFromMetadata(metadata.get(OrderSessionState.ORDER_ITEMS)).size());
        assertEquals("Ana", metadata.get(OrderSessionState.CUSTOMER_NAME));
        verify(notificationPort, never()).deliver(any());

        // Act
        ModuleResult confirmed = send("YES");

        // Assert
        assertTrue(confirmed.getReplyText().startsWith("Great! Your order #"));
        Order order = orders.findOrder((String) metadata.get(OrderSessionState.ORDER_ID)).orElseThrow();
        assertEquals(OrderStatus.CONFIRMED, order.getStatus());
    }

    @Test
    void shouldAskForNameBeforeConfirming() {
        seedOrder(null);
        modelAnswers("", tool("confirm_order", Map.of()));

        ModuleResult result = send("confirm");

        assertEquals(ConversationalTakeawayModule.ASK_NAME, result.getReplyText());
        assertFalse(metadata.containsKey(OrderSessionState.ORDER_ID));
    }

    @Test
    void shouldRefuseToConfirmEmptyOrder() {
        modelAnswers("", tool("confirm_order", Map.of()));

        ModuleResult result = send("confirm");

        assertEquals(ConversationalTakeawayModule.NOTHING_TO_CONFIRM, result.getReplyText());
    }

    @Test
    void shouldSendPaymentLinkWhenPaymentRequired() {
        tenant.setTakeawayPaymentConfig(TakeawayFixtures.json("{\"enabled\": true, \"testMode\": true}"));
        seedOrder("Ana");
        modelAnswers("", tool("confirm_order", Map.of()));

        ModuleResult result = send("yes");

        assertTrue(result.getReplyText().contains("I'm sending you a payment link by SMS"));
        Order order = orders.findOrder((String) metadata.get(OrderSessionState.ORDER_ID)).orElseThrow();
        assertEquals(OrderStatus.PENDING_PAYMENT, order.getStatus());
        assertEquals(true, metadata.get(OrderSessionState.AWAITING_PAYMENT));
    }

    @Test
    void shouldNotResendPaymentLinkWhenConfirmationIsReplayed() {
        // Arrange
        tenant.setTakeawayPaymentConfig(TakeawayFixtures.json("{\"enabled\": true, \"testMode\": true}"));
        seedOrder("Ana");
        modelAnswers("", tool("confirm_order", Map.of()));
        Map<String, Object> beforeConfirm = new HashMap<>(metadata);
        send("yes");
        String orderId = (String) metadata.get(OrderSessionState.ORDER_ID);
        metadata.clear();
        metadata.putAll(beforeConfirm);

        // Act
        ModuleResult replay = send("yes");

        // Assert
        assertTrue(replay.getReplyText().contains("I'm sending you a payment link by SMS"));
        assertEquals(orderId, metadata.get(OrderSessionState.ORDER_ID));
        Order order = orders.findOrder(orderId).orElseThrow();
        assertEquals(OrderStatus.PENDING_PAYMENT, order.getStatus());
        assertEquals(1, order.getPaymentAttemptCount());
        verify(notificationPort, times(1)).deliver(any());
    }

    @Test
    void shouldCancelStoredOrder() {
        seedOrder("Ana");
        modelAnswers("", tool("confirm_order", Map.of()));
        tenant.setTakeawayPaymentConfig(TakeawayFixtures.json("{\"enabled\": true, \"testMode\": true}"));
        send("yes");
        String orderId = (String) metadata.get(OrderSessionState.ORDER_ID);
        modelAnswers("", tool("cancel_order", Map.of()));

        ModuleResult result = send("actually cancel it");

        assertEquals(ConversationalTakeawayModule.CANCELED_REPLY, result.getReplyText());
        assertEquals(OrderStatus.CANCELED, orders.findOrder(orderId).orElseThrow().getStatus());
        assertFalse(metadata.containsKey(OrderSessionState.ORDER_ID));
    }

    // ==================== Failures ====================

    @Test
    void shouldBlockWhenBudgetExceeded() {
        when(generationService.chat(anyString(), anyString(), any(), anyDouble()))
                .thenThrow(new BudgetExceededException(TENANT_ID, 50.0, 50.0));

        ModuleResult result = send("two margheritas");

        assertEquals("budget", result.getBlockedBy());
        assertTrue(result.isHandoffTriggered());
    }

    @Test
    void shouldHandOffWhenGenerationFails() {
        when(generationService.chat(anyString(), anyString(), any(), anyDouble()))
                .thenThrow(new GenerationFailureException("llm.takeaway", "timeout", null));

        ModuleResult result = send("two margheritas");

        assertEquals(ConversationalTakeawayModule.ERROR_REPLY, result.getReplyText());
        assertEquals("LLM error", result.getHandoffReason());
    }

    @Test
    void shouldHandOffWhenMenuDisabled() {
        tenant.setMenuConfig(TakeawayFixtures.json("{\"enabled\": false}"));

        ModuleResult result = send("two margheritas");

        assertEquals(ConversationalTakeawayModule.NOT_AVAILABLE, result.getReplyText());
        verify(generationService, never()).chat(anyString(), anyString(), any(), anyDouble());
    }

    // ==================== Prompt ====================

    @Test
    void shouldSendMenuToolsAndRecentHistory() {
        for (int i = 0; i < 12; i++) {
            history.add(ConversationTurn.builder()
                    .role(i % 2 == 0 ? ConversationTurn.ROLE_USER : ConversationTurn.ROLE_ASSISTANT)
                    .text("turn " + i)
                    .createdAt(Instant.parse("2026-03-02T06:00:00Z").plusSeconds(i))
                    .build());
        }
        modelAnswers("What would you like?");

        send("hello");

        LlmRequest request = capturedRequest();
        assertEquals("gpt-4o", request.getModel());
        assertEquals(ConversationalTakeawayModule.HISTORY_LIMIT + 1, request.getMessages().size());
        assertEquals("turn 2", request.getMessages().get(0).getContent());
        assertTrue(request.getSystemPrompt().contains("Luigi's"));
        assertTrue(request.getSystemPrompt().contains("Margherita"));
        assertFalse(request.getSystemPrompt().contains("Coke"));
        assertEquals(7, request.getTools().size());
    }

    @Test
    void shouldUseFastModelAndShortRepliesOnVoice() {
        channel = Channel.VOICE;
        modelAnswers("Sure.");

        send("I'd like to order");

        LlmRequest request = capturedRequest();
        assertEquals("gpt-4o-mini", request.getModel());
        assertTrue(request.getSystemPrompt().contains("This is a phone call"));
    }
}
