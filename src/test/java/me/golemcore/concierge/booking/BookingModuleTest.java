package me.golemcore.concierge.booking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.concierge.adapter.outbound.memory.InMemoryBookingLog;
import me.golemcore.concierge.domain.model.BookingLogEntry;
import me.golemcore.concierge.domain.model.Channel;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.gating.FeatureGate;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleResult;
import me.golemcore.concierge.port.outbound.CalendarPort;
import me.golemcore.concierge.port.outbound.NotificationPort;
import me.golemcore.concierge.security.RuleSet;
import me.golemcore.concierge.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BookingModuleTest {

    private static final String TENANT_ID = "tenant-1";
    private static final String PHONE = "+61412345678";
    private static final Instant TOMORROW_7PM = Instant.parse("2026-03-03T08:00:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CalendarPort calendarPort;
    private NotificationPort notificationPort;
    private InMemoryBookingLog bookingLog;
    private BookingModule module;
    private TenantSettings tenant;
    private Map<String, Object> metadata;
    private Function<String, FeatureGateResult> capabilityCheck;

    @BeforeEach
    void setUp() throws JsonProcessingException {
        MutableClock clock = MutableClock.at("2026-03-02T07:00:00Z");
        calendarPort = mock(CalendarPort.class);
        when(calendarPort.isConnected(TENANT_ID)).thenReturn(true);
        when(calendarPort.checkAvailability(anyString(), any(), any())).thenReturn(
                CompletableFuture.completedFuture(new CalendarPort.Availability(true, null)));
        when(calendarPort.createEvent(anyString(), any())).thenReturn(CompletableFuture.completedFuture("evt-1"));
        when(calendarPort.updateEvent(anyString(), anyString(), any())).thenReturn(
                CompletableFuture.completedFuture(null));
        when(calendarPort.deleteEvent(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        notificationPort = mock(NotificationPort.class);
        when(notificationPort.deliver(any())).thenReturn(
                CompletableFuture.completedFuture(NotificationPort.DeliveryResult.delivered("sms-1")));
        ConciergeProperties properties = new ConciergeProperties();
        properties.getResilience().setMaxRetries(0);
        bookingLog = new InMemoryBookingLog();
        module = new BookingModule(calendarPort, bookingLog, notificationPort, new ExternalCallExecutor(properties),
                clock);

        tenant = TenantSettings.builder()
                .tenantId(TENANT_ID)
                .name("Luigi's")
                .bookingConfig(MAPPER.readTree("""
                        {"enabled": true, "calendar": {"minNoticeMinutes": 60, "maxPartySize": 12}}
                        """))
                .build();
        metadata = new HashMap<>();
        capabilityCheck = capability -> FeatureGateResult.allow("ok");
    }

    private ModuleContext context(String text, String intent) {
        return ModuleContext.builder()
                .tenantId(TENANT_ID)
                .sessionId("session-1")
                .channel(Channel.SMS)
                .contactKey(PHONE)
                .userText(text)
                .rules(RuleSet.defaults())
                .tenant(tenant)
                .sessionMetadata(new HashMap<>(metadata))
                .capabilityCheck(capabilityCheck)
                .intent(intent)
                .build();
    }

    private ModuleResult send(String text, String intent) {
        ModuleResult result = module.handle(context(text, intent));
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

    private List<BookingLogEntry> logEntries(String action, String status) {
        return bookingLog.findAll().stream()
                .filter(entry -> action.equals(entry.getAction()) && status.equals(entry.getStatus()))
                .toList();
    }

    // ==================== Action selection ====================

    @Test
    void shouldPreferExplicitIntentOverKeywordsAndSession() {
        metadata.put(BookingModule.BOOKING_ACTION, "create");

        assertEquals(BookingAction.CANCEL, BookingModule.determineAction(context("x", "booking.cancel")));
        assertEquals(BookingAction.CHECK, BookingModule.determineAction(context("x", "check_availability")));
        assertEquals(BookingAction.MODIFY, BookingModule.determineAction(context("x", "reschedule")));
        assertEquals(BookingAction.CREATE, BookingModule.determineAction(context("x", null)));
    }

    @Test
    void shouldContinueCreateAfterConfirmedAvailability() {
        metadata.put(BookingModule.AVAILABILITY_CONFIRMED, true);
        metadata.put(BookingModule.PENDING_BOOKING, Map.of("partySize", 2));

        assertEquals(BookingAction.CREATE, BookingModule.determineAction(context("yes", null)));
    }

    @Test
    void shouldAskWhichActionWhenUnclear() {
        ModuleResult result = send("hello", "faq");

        assertEquals(BookingModule.WHICH_ACTION, result.getReplyText());
    }

    // ==================== Availability and create ====================

    @Test
    void shouldCheckAvailabilityThenBookWithoutCheckingAgain() {
        // Act
        ModuleResult check = send("Is there a table tomorrow at 7pm for 4?", "booking.check");

        // Assert
        assertTrue(check.getReplyText().startsWith("Great news! We have availability on"));
        assertEquals("create", metadata.get(BookingModule.BOOKING_ACTION));
        assertEquals(true, metadata.get(BookingModule.AVAILABILITY_CONFIRMED));
        assertEquals(TOMORROW_7PM.toString(), metadata.get(BookingModule.CHECKED_DATE_TIME));

        // Act
        ModuleResult askName = send("yes please", null);

        // Assert
        assertTrue(askName.getReplyText().contains("your name"));
        assertEquals(List.of("your name"), metadata.get(BookingModule.AWAITING_DETAILS));

        // Act
        ModuleResult created = send("Ana", null);

        // Assert
        assertTrue(created.getReplyText().startsWith("Perfect! Your booking is confirmed: Ana, 4 guests on"));
        assertEquals("evt-1", metadata.get(BookingModule.LAST_BOOKING_EVENT_ID));
        assertFalse(metadata.containsKey(BookingModule.PENDING_BOOKING));
        verify(calendarPort, times(1)).checkAvailability(eq(TENANT_ID), eq(TOMORROW_7PM), any());

        ArgumentCaptor<CalendarPort.EventRequest> event = ArgumentCaptor.forClass(CalendarPort.EventRequest.class);
        verify(calendarPort).createEvent(eq(TENANT_ID), event.capture());
        assertEquals("Booking: Ana (4 guests)", event.getValue().summary());
        assertEquals(TOMORROW_7PM.plusSeconds(90 * 60), event.getValue().end());
        assertTrue(event.getValue().description().contains("Phone: " + PHONE));

        ArgumentCaptor<NotificationPort.Notification> sms = ArgumentCaptor.forClass(
                NotificationPort.Notification.class);
        verify(notificationPort).deliver(sms.capture());
        assertEquals(PHONE, sms.getValue().to());
        assertTrue(sms.getValue().body().startsWith("Hi Ana, your booking is confirmed!"));
        assertTrue(sms.getValue().body().endsWith("See you at Luigi's!"));
        assertEquals(1, logEntries("create", "success").size());
    }

    @Test
    void shouldSuggestAlternativeWhenSlotTaken() {
        Instant alternative = Instant.parse("2026-03-03T09:00:00Z");
        when(calendarPort.checkAvailability(anyString(), any(), any())).thenReturn(
                CompletableFuture.completedFuture(new CalendarPort.Availability(false, alternative)));

        ModuleResult result = send("any tables tomorrow at 7pm?", "booking.check");

        assertTrue(result.getReplyText().contains("is not available. However, we have an opening at"));
        assertEquals(alternative.toString(), metadata.get(BookingModule.SUGGESTED_ALTERNATIVE));
        assertEquals(false, metadata.get(BookingModule.AVAILABILITY_CONFIRMED));
    }

    @Test
    void shouldListEveryMissingDetail() {
        ModuleResult result = send("I'd like to book a table", "booking.create");

        assertEquals("I'd be happy to book that for you. Could you please provide the date and time and "
                + "your name and the number of guests?", result.getReplyText());
        verify(calendarPort, never()).createEvent(anyString(), any());
    }

    @Test
    void shouldReturnExistingBookingForRepeatedRequest() {
        String text = "Book a table for 4 tomorrow at 7pm, my name is Ana";
        send(text, "booking.create");
        metadata.clear();

        ModuleResult repeated = send(text, "booking.create");

        assertTrue(repeated.getReplyText().endsWith(BookingModule.ALREADY_CONFIRMED));
        verify(calendarPort, times(1)).createEvent(anyString(), any());
        assertEquals("evt-1", metadata.get(BookingModule.LAST_BOOKING_EVENT_ID));
    }

    @Test
    void shouldHandOffPartiesAboveLimit() {
        ModuleResult result = send("table for 15 tomorrow at 7pm, name is Ana", "booking.create");

        assertTrue(result.isHandoffTriggered());
        assertEquals("Party size exceeds limit", result.getHandoffReason());
    }

    @Test
    void shouldAskForLaterTimeWithoutEnoughNotice() {
        ModuleResult result = send("table for 2 today at 6:30pm, name is Ana", "booking.create");

        assertFalse(result.isHandoffTriggered());
        assertTrue(result.getReplyText().startsWith("We require at least 1 hour(s) notice"));
    }

    @Test
    void shouldHandOffWhenCalendarCreateFails() {
        when(calendarPort.createEvent(anyString(), any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("calendar down")));

        ModuleResult result = send("Book a table for 4 tomorrow at 7pm, my name is Ana", "booking.create");

        assertTrue(result.isHandoffTriggered());
        assertEquals(BookingModule.BOOKING_FAILED, result.getReplyText());
        assertEquals(1, logEntries("create", "error").size());
    }

    // ==================== Modify and cancel ====================

    @Test
    void shouldCancelBookingFoundInLog() {
        send("Book a table for 4 tomorrow at 7pm, my name is Ana", "booking.create");
        metadata.clear();

        ModuleResult result = send("please cancel my booking", "booking.cancel");

        assertEquals(BookingModule.CANCEL_SUCCESS, result.getReplyText());
        verify(calendarPort).deleteEvent(TENANT_ID, "evt-1");
        assertEquals(true, metadata.get(BookingModule.BOOKING_CANCELLED));
    }

    @Test
    void shouldAskForDetailsWhenNoBookingToCancel() {
        ModuleResult result = send("cancel my booking", "booking.cancel");

        assertEquals(BookingModule.CANCEL_NEED_ID, result.getReplyText());
        assertEquals("cancel", metadata.get(BookingModule.BOOKING_ACTION));
    }

    @Test
    void shouldHandOffCancelWhenNotAllowed() throws JsonProcessingException {
        tenant.setBookingConfig(MAPPER.readTree("{\"enabled\": true, \"calendar\": {\"allowCancel\": false}}"));

        ModuleResult result = send("cancel my booking", "booking.cancel");

        assertTrue(result.isHandoffTriggered());
        assertEquals(BookingModule.CANCEL_NOT_ALLOWED, result.getReplyText());
        assertEquals(1, logEntries("cancel", "handoff").size());
        verify(calendarPort, never()).deleteEvent(anyString(), anyString());
    }

    @Test
    void shouldUpdatePartySizeOfKnownBooking() {
        metadata.put(BookingModule.LAST_BOOKING_EVENT_ID, "evt-9");

        ModuleResult result = send("can we make it 6 people instead", "booking.modify");

        assertEquals("Your booking has been updated: 6 guests.", result.getReplyText());
        ArgumentCaptor<CalendarPort.EventRequest> event = ArgumentCaptor.forClass(CalendarPort.EventRequest.class);
        verify(calendarPort).updateEvent(eq(TENANT_ID), eq("evt-9"), event.capture());
        assertEquals("Booking: (6 guests)", event.getValue().summary());
        assertNull(event.getValue().start());
    }

    @Test
    void shouldAskWhatToChange() {
        metadata.put(BookingModule.LAST_BOOKING_EVENT_ID, "evt-9");

        ModuleResult result = send("I need to change my booking", "booking.modify");

        assertEquals(BookingModule.MODIFY_WHAT, result.getReplyText());
        verify(calendarPort, never()).updateEvent(anyString(), anyString(), any());
    }

    // ==================== Gating ====================

    @Test
    void shouldBlockWhenBookingCapabilityDenied() {
        capabilityCheck = capability -> FeatureGate.BOOKING.equals(capability)
                ? FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "required", "Sandbox", List.of())
                : FeatureGateResult.allow("ok");

        ModuleResult result = send("book a table", "booking.create");

        assertEquals(FeatureGateResult.BLOCKED_BY_SANDBOX, result.getBlockedBy());
        assertEquals(BookingModule.MODULE_BLOCKED, result.getReplyText());
    }

    @Test
    void shouldHandOffWhenCalendarNotConnected() {
        when(calendarPort.isConnected(TENANT_ID)).thenReturn(false);

        ModuleResult result = send("book a table", "booking.create");

        assertTrue(result.isHandoffTriggered());
        assertEquals(BookingModule.NOT_CONNECTED, result.getReplyText());
    }

    @Test
    void shouldSkipConfirmationSmsWhenSmsGated() {
        capabilityCheck = capability -> FeatureGate.SMS.equals(capability)
                ? FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_KILL_SWITCH, null, "SMS disabled", List.of())
                : FeatureGateResult.allow("ok");

        ModuleResult result = send("Book a table for 4 tomorrow at 7pm, my name is Ana", "booking.create");

        assertTrue(result.getReplyText().startsWith("Perfect!"));
        verify(notificationPort, never()).deliver(any());
    }

    // ==================== Idempotency key ====================

    @Test
    void shouldKeyOnPhoneDigitsAndMinute() {
        String key = BookingModule.idempotencyKey(TENANT_ID, BookingAction.CREATE, TOMORROW_7PM, 4,
                "+61 412 345 678", "session-1");

        assertEquals(32, key.length());
        assertEquals(key, BookingModule.idempotencyKey(TENANT_ID, BookingAction.CREATE,
                TOMORROW_7PM.plusSeconds(30), 4, "61412345678", "session-2"));
        assertNotEquals(key, BookingModule.idempotencyKey(TENANT_ID, BookingAction.CREATE, TOMORROW_7PM, 5,
                "61412345678", "session-1"));
        assertNotEquals(BookingModule.idempotencyKey(TENANT_ID, BookingAction.CREATE, TOMORROW_7PM, 4, null, "a"),
                BookingModule.idempotencyKey(TENANT_ID, BookingAction.CREATE, TOMORROW_7PM, 4, null, "b"));
    }
}
