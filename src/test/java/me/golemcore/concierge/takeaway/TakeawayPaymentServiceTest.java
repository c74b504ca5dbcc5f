package me.golemcore.concierge.takeaway;

import me.golemcore.concierge.adapter.outbound.memory.InMemoryAuditLog;
import me.golemcore.concierge.adapter.outbound.memory.InMemoryOrderStore;
import me.golemcore.concierge.domain.exception.PaymentSetupException;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderEvent;
import me.golemcore.concierge.domain.model.OrderEventType;
import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.OrderStatus;
import me.golemcore.concierge.domain.service.AuditService;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.port.outbound.NotificationPort;
import me.golemcore.concierge.port.outbound.PaymentPort;
import me.golemcore.concierge.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TakeawayPaymentServiceTest {

    private static final String TENANT_ID = "tenant-1";
    private static final Function<String, FeatureGateResult> ALLOW_ALL = capability -> FeatureGateResult.allow(
            "ok");

    private MutableClock clock;
    private PaymentPort paymentPort;
    private NotificationPort notificationPort;
    private OrderStateMachine orders;
    private InMemoryAuditLog auditLog;
    private TakeawayPaymentService paymentService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T07:00:00Z");
        paymentPort = mock(PaymentPort.class);
        notificationPort = mock(NotificationPort.class);
        when(notificationPort.deliver(any())).thenReturn(
                CompletableFuture.completedFuture(NotificationPort.DeliveryResult.delivered("sms-1")));
        ConciergeProperties properties = new ConciergeProperties();
        properties.getResilience().setMaxRetries(0);
        properties.getPayment().setAppBaseUrl("https://concierge.example/");
        orders = new OrderStateMachine(new InMemoryOrderStore(), clock);
        auditLog = new InMemoryAuditLog();
        paymentService = new TakeawayPaymentService(paymentPort, notificationPort,
                new ExternalCallExecutor(properties), orders, new AuditService(auditLog, clock), properties, clock);
    }

    private Order pendingConfirmationOrder() {
        OrderDraft draft = OrderDraft.builder()
                .customerName("Ana")
                .customerPhone("+61412345678")
                .items(List.of(OrderItem.builder().name("Margherita").quantity(2).unitPriceCents(1800).build()))
                .build();
        Order order = orders.createOrderDraft(TENANT_ID, Channel.SMS, draft, "session-1").order();
        return orders.requestOrderConfirmation(order.getId()).order();
    }

    private PaymentConfig config(boolean testMode) {
        PaymentConfig defaults = PaymentConfig.defaults();
        return new PaymentConfig(true, testMode, true, 15, true, 1, "AUD", "Luigi's order",
                PaymentConfig.PRICING_ITEMS, defaults.messages());
    }

    private List<OrderEvent> linkEvents(String orderId) {
        return orders.getEvents(orderId).stream()
                .filter(event -> event.getType() == OrderEventType.PAYMENT_LINK_CREATED)
                .toList();
    }

    // ==================== Test mode ====================

    @Test
    void shouldIssueLocalLinkInTestMode() {
        // Arrange
        Order order = pendingConfirmationOrder();
        String shortId = OrderStateMachine.shortOrderId(order.getId());

        // Act
        TakeawayPaymentService.IssuedLink link = paymentService.issueLink(order, config(true), false, ALLOW_ALL);

        // Assert
        assertEquals("https://concierge.example/test-payment?order=" + shortId + "&amount=3600", link.paymentUrl());
        assertEquals(Instant.parse("2026-03-02T07:15:00Z"), link.expiresAt());
        assertEquals(OrderStatus.PENDING_PAYMENT, link.order().getStatus());
        assertEquals(1, link.order().getPaymentAttemptCount());
        verifyNoInteractions(paymentPort);
        assertEquals(1, auditLog.findByAction("takeaway.payment_link_sent").size());
        assertEquals(true, linkEvents(order.getId()).get(0).getDetails().get("smsSent"));
    }

    @Test
    void shouldCountEveryIssuedLink() {
        Order order = pendingConfirmationOrder();
        Order afterFirst = paymentService.issueLink(order, config(true), false, ALLOW_ALL).order();

        Order afterRetry = paymentService.issueLink(afterFirst, config(true), true, ALLOW_ALL).order();

        assertEquals(2, afterRetry.getPaymentAttemptCount());
        assertEquals(2, linkEvents(order.getId()).size());
        assertFalse(config(true).canRetryPayment(afterRetry.getPaymentAttemptCount()));
    }

    @Test
    void shouldReturnActiveLinkWithoutSideEffectsOutsideRetry() {
        // Arrange
        Order order = pendingConfirmationOrder();
        TakeawayPaymentService.IssuedLink first = paymentService.issueLink(order, config(true), false, ALLOW_ALL);

        // Act
        TakeawayPaymentService.IssuedLink again = paymentService.issueLink(first.order(), config(true), false,
                ALLOW_ALL);

        // Assert
        assertEquals(first.paymentUrl(), again.paymentUrl());
        assertEquals(first.expiresAt(), again.expiresAt());
        assertEquals(1, orders.findOrder(order.getId()).orElseThrow().getPaymentAttemptCount());
        assertEquals(1, linkEvents(order.getId()).size());
        assertEquals(1, auditLog.findByAction("takeaway.payment_link_sent").size());
        verify(notificationPort, times(1)).deliver(any());
    }

    @Test
    void shouldReturnActiveLinkWhenCallerHoldsStaleOrder() {
        Order stale = pendingConfirmationOrder();
        TakeawayPaymentService.IssuedLink first = paymentService.issueLink(stale, config(true), false, ALLOW_ALL);

        TakeawayPaymentService.IssuedLink again = paymentService.issueLink(stale, config(true), false, ALLOW_ALL);

        assertEquals(first.paymentUrl(), again.paymentUrl());
        assertEquals(1, again.order().getPaymentAttemptCount());
        verify(notificationPort, times(1)).deliver(any());
    }

    @Test
    void shouldIssueNewLinkOnceActiveLinkExpired() {
        Order order = pendingConfirmationOrder();
        Order afterFirst = paymentService.issueLink(order, config(true), false, ALLOW_ALL).order();
        clock.advance(Duration.ofMinutes(16));

        TakeawayPaymentService.IssuedLink link = paymentService.issueLink(afterFirst, config(true), false,
                ALLOW_ALL);

        assertEquals(Instant.parse("2026-03-02T07:31:00Z"), link.expiresAt());
        assertEquals(2, link.order().getPaymentAttemptCount());
        verify(notificationPort, times(2)).deliver(any());
    }

    // ==================== Provider ====================

    @Test
    void shouldCallProviderOutsideTestMode() {
        // Arrange
        Order order = pendingConfirmationOrder();
        when(paymentPort.isConfigured()).thenReturn(true);
        when(paymentPort.createCheckoutLink(any())).thenReturn(CompletableFuture.completedFuture(
                new PaymentPort.CheckoutLink("https://pay.example/cs_1", Instant.parse("2026-03-02T07:15:00Z"))));

        // Act
        TakeawayPaymentService.IssuedLink link = paymentService.issueLink(order, config(false), true, ALLOW_ALL);

        // Assert
        assertEquals("https://pay.example/cs_1", link.paymentUrl());
        ArgumentCaptor<PaymentPort.CheckoutRequest> captor = ArgumentCaptor.forClass(
                PaymentPort.CheckoutRequest.class);
        verify(paymentPort).createCheckoutLink(captor.capture());
        assertEquals(3600, captor.getValue().amountCents());
        assertTrue(captor.getValue().productName().endsWith("(retry)"));
    }

    @Test
    void shouldLeaveOrderUnchangedWhenProviderMissing() {
        Order order = pendingConfirmationOrder();
        when(paymentPort.isConfigured()).thenReturn(false);

        assertThrows(PaymentSetupException.class,
                () -> paymentService.issueLink(order, config(false), false, ALLOW_ALL));

        assertEquals(OrderStatus.PENDING_CONFIRMATION, orders.findOrder(order.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldWrapProviderFailure() {
        Order order = pendingConfirmationOrder();
        when(paymentPort.isConfigured()).thenReturn(true);
        when(paymentPort.createCheckoutLink(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("card network down")));

        PaymentSetupException error = assertThrows(PaymentSetupException.class,
                () -> paymentService.issueLink(order, config(false), false, ALLOW_ALL));

        assertTrue(error.getMessage().contains("card network down"));
        assertEquals(0, orders.findOrder(order.getId()).orElseThrow().getPaymentAttemptCount());
    }

    @Test
    void shouldRefuseOrderWithoutAmount() {
        Order order = pendingConfirmationOrder().toBuilder().paymentAmountCents(null).build();

        assertThrows(PaymentSetupException.class,
                () -> paymentService.issueLink(order, config(true), false, ALLOW_ALL));
    }

    // ==================== SMS ====================

    @Test
    void shouldSkipSmsWhenGateDenies() {
        Order order = pendingConfirmationOrder();
        Function<String, FeatureGateResult> smsBlocked = capability -> FeatureGateResult.deny(
                FeatureGateResult.BLOCKED_BY_KILL_SWITCH, null, "SMS disabled", List.of());

        TakeawayPaymentService.IssuedLink link = paymentService.issueLink(order, config(true), false, smsBlocked);

        assertNotNull(link.paymentUrl());
        verifyNoInteractions(notificationPort);
        OrderEvent event = linkEvents(order.getId()).get(0);
        assertEquals(false, event.getDetails().get("smsSent"));
        assertEquals(FeatureGateResult.BLOCKED_BY_KILL_SWITCH, event.getDetails().get("blockedBy"));
    }

    @Test
    void shouldKeepLinkWhenSmsFails() {
        Order order = pendingConfirmationOrder();
        when(notificationPort.deliver(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("carrier error")));

        TakeawayPaymentService.IssuedLink link = paymentService.issueLink(order, config(true), false, ALLOW_ALL);

        assertEquals(OrderStatus.PENDING_PAYMENT, link.order().getStatus());
        assertEquals(false, linkEvents(order.getId()).get(0).getDetails().get("smsSent"));
    }
}
