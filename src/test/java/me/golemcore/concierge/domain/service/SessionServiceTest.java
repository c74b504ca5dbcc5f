package me.golemcore.concierge.domain.service;

import me.golemcore.concierge.adapter.outbound.memory.InMemorySessionStore;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.ConversationSession;
import me.golemcore.concierge.domain.model.ConversationTurn;
import me.golemcore.concierge.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private static final String TENANT_ID = "tenant-1";

    private MutableClock clock;
    private InMemorySessionStore store;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T09:00:00Z");
        store = new InMemorySessionStore();
        sessionService = new SessionService(store, clock);
    }

    // ==================== getOrCreate ====================

    @Test
    void shouldReuseActiveSessionForSameContact() {
        // Arrange
        ConversationSession first = sessionService.getOrCreate(TENANT_ID, Channel.SMS, "0412 345 678", null);
        clock.advance(Duration.ofMinutes(5));

        // Act
        ConversationSession second = sessionService.getOrCreate(TENANT_ID, Channel.SMS, "+61412345678", null);

        // Assert
        assertEquals(first.getId(), second.getId());
        assertEquals("+61412345678", second.getContactKey());
        assertEquals(clock.instant(), second.getLastActiveAt());
    }

    @Test
    void shouldOpenSeparateSessionsPerChannelAndTenant() {
        ConversationSession sms = sessionService.getOrCreate(TENANT_ID, Channel.SMS, "+61412345678", null);
        ConversationSession whatsapp = sessionService.getOrCreate(TENANT_ID, Channel.WHATSAPP, "+61412345678", null);
        ConversationSession other = sessionService.getOrCreate("tenant-2", Channel.SMS, "+61412345678", null);

        assertNotEquals(sms.getId(), whatsapp.getId());
        assertNotEquals(sms.getId(), other.getId());
    }

    @Test
    void shouldOpenNewSessionAfterClose() {
        ConversationSession first = sessionService.getOrCreate(TENANT_ID, Channel.SMS, "+61412345678", "thread-1");

        sessionService.closeSession(first.getId());
        ConversationSession second = sessionService.getOrCreate(TENANT_ID, Channel.SMS, "+61412345678", null);

        assertNotEquals(first.getId(), second.getId());
        assertFalse(store.findById(first.getId()).orElseThrow().isActive());
        assertEquals("thread-1", first.getExternalThreadKey());
    }

    // ==================== Turns and metadata ====================

    @Test
    void shouldReturnLastTurnsOldestFirst() {
        ConversationSession session = sessionService.getOrCreate(TENANT_ID, Channel.SMS, "+61412345678", null);
        for (int i = 1; i <= 5; i++) {
            sessionService.saveTurn(session, ConversationTurn.ROLE_USER, "message " + i, null);
        }

        List<ConversationTurn> history = sessionService.getConversationHistory(session.getId(), 3);

        assertEquals(List.of("message 3", "message 4", "message 5"),
                history.stream().map(ConversationTurn::getText).toList());
        assertEquals(Map.of(), history.get(0).getRaw());
        assertTrue(sessionService.getConversationHistory(session.getId(), 0).isEmpty());
    }

    @Test
    void shouldMergeMetadataAndRemoveNullValues() {
        // Arrange
        ConversationSession session = sessionService.getOrCreate(TENANT_ID, Channel.SMS, "+61412345678", null);
        sessionService.updateSessionMetadata(session.getId(), Map.of("customerName", "Ana", "lastIntent", "faq"));
        Map<String, Object> updates = new HashMap<>();
        updates.put("lastIntent", "order.create");
        updates.put("customerName", null);

        // Act
        sessionService.updateSessionMetadata(session.getId(), updates);

        // Assert
        Map<String, Object> metadata = sessionService.getSessionMetadata(session.getId());
        assertEquals(Map.of("lastIntent", "order.create"), metadata);
        assertThrows(UnsupportedOperationException.class, () -> metadata.put("x", 1));
    }

    @Test
    void shouldIgnoreMetadataUpdateForUnknownSession() {
        assertDoesNotThrow(() -> sessionService.updateSessionMetadata("missing", Map.of("a", 1)));
        assertEquals(Map.of(), sessionService.getSessionMetadata("missing"));
    }

    @Test
    void shouldCreateClosedOrphanSession() {
        ConversationSession orphan = sessionService.createOrphanSession();

        assertEquals(SessionService.ORPHAN_TENANT, orphan.getTenantId());
        assertFalse(orphan.isActive());
        assertEquals(true, orphan.getMetadata().get(SessionService.ORPHAN_RUN));
    }

    // ==================== normalizePhone ====================

    @ParameterizedTest
    @CsvSource({
            "0412 345 678, +61412345678",
            "+61 412 345 678, +61412345678",
            "61412345678, +61412345678",
            "(02) 9876-5432, +61298765432",
            "12345, 12345",
            "web-visitor, web-visitor"
    })
    void shouldNormalizePhone(String input, String expected) {
        assertEquals(expected, SessionService.normalizePhone(input));
    }
}
