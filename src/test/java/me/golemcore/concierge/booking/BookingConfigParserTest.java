package me.golemcore.concierge.booking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class BookingConfigParserTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2026-03-02T07:00:00Z");

    private static JsonNode json(String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }

    private static BookingRequest request(Instant dateTime, Integer partySize, String name, String phone) {
        return new BookingRequest(BookingAction.CREATE, dateTime, partySize, name, phone, null, null);
    }

    // ==================== Parsing ====================

    @Test
    void shouldUseDefaultsForMissingBlob() {
        BookingConfig config = BookingConfigParser.parse(null);

        assertFalse(config.enabled());
        assertEquals("primary", config.calendarId());
        assertEquals(ZoneId.of("Australia/Sydney"), config.zone());
        assertEquals(90, config.defaultDurationMinutes());
        assertEquals(60, config.minNoticeMinutes());
        assertEquals(20, config.maxPartySize());
        assertFalse(config.requirePhone());
        assertTrue(config.requireName());
        assertTrue(config.sendSmsConfirmation());
    }

    @Test
    void shouldReadNestedCalendarAndConfirmationSettings() throws JsonProcessingException {
        BookingConfig config = BookingConfigParser.parse(json("""
                {"enabled": true,
                 "calendar": {"calendarId": "bookings@example.com", "timezone": "Australia/Perth",
                   "defaultDurationMinutes": 120, "minNoticeMinutes": 0, "maxPartySize": 8,
                   "allowModify": false, "allowCancel": false, "requirePhone": true, "requireName": false},
                 "confirmations": {"autoConfirm": false, "sendSmsConfirmation": false}}
                """));

        assertTrue(config.enabled());
        assertEquals("bookings@example.com", config.calendarId());
        assertEquals(ZoneId.of("Australia/Perth"), config.zone());
        assertEquals(120, config.defaultDurationMinutes());
        assertEquals(0, config.minNoticeMinutes());
        assertEquals(8, config.maxPartySize());
        assertFalse(config.allowModify());
        assertFalse(config.allowCancel());
        assertTrue(config.requirePhone());
        assertFalse(config.requireName());
        assertFalse(config.autoConfirm());
        assertFalse(config.sendSmsConfirmation());
    }

    @Test
    void shouldFallBackOnInvalidValues() throws JsonProcessingException {
        BookingConfig config = BookingConfigParser.parse(json("""
                {"enabled": "yes", "calendar": {"defaultDurationMinutes": -30, "minNoticeMinutes": -1,
                  "maxPartySize": "ten", "timezone": "Mars/Olympus"}}
                """));

        assertFalse(config.enabled());
        assertEquals(90, config.defaultDurationMinutes());
        assertEquals(60, config.minNoticeMinutes());
        assertEquals(20, config.maxPartySize());
        assertEquals(ZoneId.of("Australia/Sydney"), config.zone());
    }

    // ==================== Validation ====================

    @Test
    void shouldAcceptValidRequest() {
        BookingConfig.Validation validation = BookingConfig.defaults()
                .validate(request(NOW.plusSeconds(7200), 4, "Ana", null), NOW);

        assertTrue(validation.valid());
        assertTrue(validation.warnings().isEmpty());
    }

    @Test
    void shouldRejectPastAndShortNoticeTimes() {
        BookingConfig config = BookingConfig.defaults();

        BookingConfig.Validation past = config.validate(request(NOW.minusSeconds(60), 2, "Ana", null), NOW);
        BookingConfig.Validation soon = config.validate(request(NOW.plusSeconds(1800), 2, "Ana", null), NOW);

        assertEquals("Cannot book in the past", past.errors().get(0));
        assertTrue(soon.noticeTooShort());
        assertEquals("Minimum 1 hour(s) notice required", soon.errors().get(0));
    }

    @Test
    void shouldFlagPartySizeLimitsAndLargeParties() {
        BookingConfig config = BookingConfig.defaults();

        BookingConfig.Validation tooLarge = config.validate(request(NOW.plusSeconds(7200), 25, "Ana", null), NOW);
        BookingConfig.Validation large = config.validate(request(NOW.plusSeconds(7200), 14, "Ana", null), NOW);

        assertTrue(tooLarge.partyTooLarge());
        assertTrue(large.valid());
        assertEquals("Large party - may require special arrangements", large.warnings().get(0));
    }

    @Test
    void shouldRequireNameAndPhoneWhenConfigured() {
        BookingConfig config = new BookingConfig(true, "primary", "Australia/Sydney", 90, 60, 20, true, true,
                true, true, true, true);

        BookingConfig.Validation validation = config.validate(request(null, null, null, " "), NOW);

        assertEquals(3, validation.errors().size());
        assertTrue(validation.errors().contains("Name is required"));
        assertTrue(validation.errors().contains("Phone number is required"));
        assertTrue(validation.errors().contains("Date and time are required"));
    }

    @Test
    void shouldRoundNoticeHoursUp() {
        BookingConfig config = new BookingConfig(true, "primary", "Australia/Sydney", 90, 90, 20, true, true,
                false, true, true, true);

        assertEquals(2, config.minNoticeHours());
        assertEquals(NOW.plusSeconds(90 * 60), config.endOf(NOW));
    }
}
