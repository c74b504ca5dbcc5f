package me.golemcore.concierge.adapter.outbound.memory;

import me.golemcore.concierge.domain.model.Order;
import me.golemcore.concierge.domain.model.OrderEvent;
import me.golemcore.concierge.domain.model.OrderEventType;
import me.golemcore.concierge.domain.model.OrderItem;
import me.golemcore.concierge.domain.model.OrderStatus;
import me.golemcore.concierge.port.outbound.OrderStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryOrderStoreTest {

    private InMemoryOrderStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryOrderStore();
    }

    private Order order(String id, String key, Instant createdAt) {
        List<OrderItem> items = new ArrayList<>();
        items.add(OrderItem.builder().name("Margherita").quantity(2).build());
        return Order.builder()
                .id(id)
                .tenantId("tenant-1")
                .sessionId("session-1")
                .idempotencyKey(key)
                .items(items)
                .totalItems(2)
                .createdAt(createdAt)
                .build();
    }

    @Test
    void shouldReturnExistingOrderForDuplicateKey() {
        OrderStorePort.InsertOutcome first = store.insertIfAbsent(order("o-1", "key-1", Instant.EPOCH));
        OrderStorePort.InsertOutcome second = store.insertIfAbsent(order("o-2", "key-1", Instant.EPOCH));

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals("o-1", second.order().getId());
        assertTrue(store.findById("o-2").isEmpty());
        assertEquals(1, store.count());
    }

    @Test
    void shouldCreateExactlyOneOrderUnderConcurrentInserts() throws Exception {
        // Arrange
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        Set<String> returnedIds = ConcurrentHashMap.newKeySet();

        // Act
        for (int i = 0; i < threads; i++) {
            String id = "o-" + i;
            pool.submit(() -> {
                start.await();
                OrderStorePort.InsertOutcome outcome = store.insertIfAbsent(order(id, "same-key", Instant.EPOCH));
                if (outcome.created()) {
                    created.incrementAndGet();
                }
                returnedIds.add(outcome.order().getId());
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        // Assert
        assertEquals(1, created.get());
        assertEquals(1, returnedIds.size());
        assertEquals(1, store.count());
    }

    @Test
    void shouldHandOutCopies() {
        store.insertIfAbsent(order("o-1", "key-1", Instant.EPOCH));

        Order loaded = store.findById("o-1").orElseThrow();
        loaded.setStatus(OrderStatus.CANCELED);
        loaded.getItems().clear();

        Order reloaded = store.findById("o-1").orElseThrow();
        assertEquals(OrderStatus.DRAFT, reloaded.getStatus());
        assertEquals(1, reloaded.getItems().size());
    }

    @Test
    void shouldKeepStoredKeyOnUpdate() {
        store.insertIfAbsent(order("o-1", "key-1", Instant.EPOCH));
        Order changed = store.findById("o-1").orElseThrow().toBuilder()
                .status(OrderStatus.PENDING_CONFIRMATION)
                .idempotencyKey("other")
                .build();

        store.update(changed);

        Order stored = store.findByIdempotencyKey("key-1").orElseThrow();
        assertEquals(OrderStatus.PENDING_CONFIRMATION, stored.getStatus());
        assertTrue(store.findByIdempotencyKey("other").isEmpty());
    }

    @Test
    void shouldRejectUpdateOfUnknownOrder() {
        assertThrows(IllegalArgumentException.class, () -> store.update(order("missing", "k", Instant.EPOCH)));
    }

    @Test
    void shouldFindLatestOpenOrderOfSession() {
        store.insertIfAbsent(order("o-1", "key-1", Instant.parse("2026-03-02T09:00:00Z")));
        store.insertIfAbsent(order("o-2", "key-2", Instant.parse("2026-03-02T09:05:00Z")));
        Order confirmed = order("o-3", "key-3", Instant.parse("2026-03-02T09:10:00Z"));
        confirmed.setStatus(OrderStatus.CONFIRMED);
        store.insertIfAbsent(confirmed);

        assertEquals("o-2", store.findLatestOpenBySession("session-1").orElseThrow().getId());
        assertTrue(store.findLatestOpenBySession("session-2").isEmpty());
    }

    @Test
    void shouldReturnEventsInTimeOrder() {
        store.appendEvent(OrderEvent.builder().id("e-2").orderId("o-1").type(OrderEventType.CONFIRMED)
                .createdAt(Instant.parse("2026-03-02T09:01:00Z")).build());
        store.appendEvent(OrderEvent.builder().id("e-1").orderId("o-1").type(OrderEventType.DRAFT_CREATED)
                .createdAt(Instant.parse("2026-03-02T09:00:00Z")).build());

        assertEquals(List.of(OrderEventType.DRAFT_CREATED, OrderEventType.CONFIRMED),
                store.findEvents("o-1").stream().map(OrderEvent::getType).toList());
        assertTrue(store.findEvents("o-2").isEmpty());
    }
}
