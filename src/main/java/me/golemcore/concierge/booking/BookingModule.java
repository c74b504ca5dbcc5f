package me.golemcore.concierge.booking;

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
import me.golemcore.concierge.domain.model.BookingLogEntry;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.IdempotencyKeys;
import me.golemcore.concierge.gating.FeatureGate;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import me.golemcore.concierge.port.outbound.BookingLogPort;
import me.golemcore.concierge.port.outbound.CalendarPort;
import me.golemcore.concierge.port.outbound.NotificationPort;
import me.golemcore.concierge.takeaway.OrderTextParser;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Table bookings against the tenant's external calendar.
 *
 * <p>
 * Four actions are supported: check availability, create, modify and cancel.
 * Details collected over several turns are kept as {@code pendingBooking} in
 * session metadata. Creation is keyed by an idempotency key so a repeated
 * request returns the booking that already exists instead of a second event.
 * Modify and cancel need the external event id; when the session does not
 * carry it, the booking log is searched by session and then by phone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BookingModule implements ModuleHandler {

    public static final String NAME = "booking";

    public static final String BOOKING_ACTION = "bookingAction";
    public static final String PENDING_BOOKING = "pendingBooking";
    public static final String CHECKED_DATE_TIME = "checkedDateTime";
    public static final String AVAILABILITY_CONFIRMED = "availabilityConfirmed";
    public static final String LAST_BOOKING_EVENT_ID = "lastBookingEventId";
    public static final String LAST_BOOKING_CONFIRMED = "lastBookingConfirmed";
    public static final String BOOKING_CANCELLED = "bookingCancelled";
    public static final String AWAITING_DETAILS = "awaitingDetails";
    public static final String SUGGESTED_ALTERNATIVE = "suggestedAlternative";

    static final String NOT_CONNECTED = "I'm sorry, our booking system is currently unavailable. "
            + "Please call us directly to make a reservation.";
    static final String NOT_ENABLED = "Online booking is not currently available. "
            + "Please call us to make a reservation.";
    static final String MODULE_BLOCKED = "I'm unable to process bookings at this time. "
            + "Let me connect you with someone who can help.";
    static final String BOOKING_FAILED = "I'm sorry, I wasn't able to complete the booking. "
            + "Let me connect you with someone who can help.";
    static final String MODIFY_NOT_ALLOWED = "I'm sorry, booking modifications need to be handled by our team. "
            + "Let me connect you with someone who can help.";
    static final String CANCEL_NOT_ALLOWED = "I'm sorry, cancellations need to be handled by our team. "
            + "Let me connect you with someone who can help.";
    static final String CANCEL_SUCCESS = "Your booking has been cancelled. We hope to see you another time!";
    static final String CANCEL_NEED_ID = "To cancel your booking, I'll need to look it up. "
            + "Could you tell me the date and time of your reservation?";
    static final String MODIFY_NEED_ID = "I'll need to find your booking first. "
            + "Could you tell me the date and name for the reservation?";
    static final String MODIFY_WHAT = "What would you like to change? The date/time or the number of guests?";
    static final String NEED_DATE_TIME = "What date and time would you like to book?";
    static final String WHICH_ACTION = "Would you like to check availability, make a booking, "
            + "or modify an existing reservation?";
    static final String ALREADY_CONFIRMED = " (Your booking was already confirmed.)";

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("EEE d MMM, h:mm a",
            Locale.forLanguageTag("en-AU"));

    private final CalendarPort calendarPort;
    private final BookingLogPort bookingLogPort;
    private final NotificationPort notificationPort;
    private final ExternalCallExecutor executor;
    private final Clock clock;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getAliases() {
        return List.of("booking_calendar");
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        FeatureGateResult gate = context.canUse(FeatureGate.BOOKING);
        if (!gate.isAllowed()) {
            return ModuleResult.blocked(MODULE_BLOCKED, gate.getReason(), gate.getBlockedBy());
        }

        TenantSettings tenant = context.getTenant();
        BookingConfig config = BookingConfigParser.parse(tenant != null ? tenant.getBookingConfig() : null);
        if (!config.enabled()) {
            return ModuleResult.handoff(NOT_ENABLED, "Booking not enabled for tenant");
        }
        if (!calendarPort.isConnected(context.getTenantId())) {
            return ModuleResult.handoff(NOT_CONNECTED, "Calendar not connected");
        }

        BookingAction action = determineAction(context);
        BookingRequest request = collectRequest(context, config);
        log.debug("[Booking] Action {} for session {}", action, context.getSessionId());
        if (action == null) {
            return ModuleResult.reply(WHICH_ACTION);
        }

        try {
            return switch (action) {
            case CHECK -> handleAvailabilityCheck(context, config, request);
            case CREATE -> handleCreate(context, config, request);
            case MODIFY -> handleModify(context, config, request);
            case CANCEL -> handleCancel(context, config, request);
            };
        } catch (RuntimeException e) { // NOSONAR - any failure hands the booking to staff
            log.error("[Booking] Booking failed for session {}: {}", context.getSessionId(), e.getMessage(), e);
            logRequest(context, action, Map.of(), errorOf(e), "error", null,
                    null, request.phone());
            return ModuleResult.handoff(BOOKING_FAILED, "Booking error");
        }
    }

    /**
     * Explicit {@code booking.*} intents win, then intent keywords, then the
     * action remembered in the session.
     */
    static BookingAction determineAction(ModuleContext context) {
        String intent = context.getIntent() != null ? context.getIntent().toLowerCase(Locale.ROOT) : "";
        if (intent.startsWith("booking.")) {
            BookingAction explicit = BookingAction.fromValue(intent.substring("booking.".length()));
            if (explicit != null) {
                return explicit;
            }
        }
        if (intent.contains("availability")) {
            return BookingAction.CHECK;
        }
        if (intent.contains("cancel")) {
            return BookingAction.CANCEL;
        }
        if (intent.contains("change") || intent.contains("reschedule") || intent.contains("modify")) {
            return BookingAction.MODIFY;
        }
        if (intent.contains("book") || intent.contains("reserve")) {
            return BookingAction.CREATE;
        }

        BookingAction remembered = BookingAction.fromValue(context.metadataString(BOOKING_ACTION));
        if (remembered != null) {
            return remembered;
        }
        if (context.metadataFlag(AVAILABILITY_CONFIRMED) && context.metadata(PENDING_BOOKING) != null) {
            return BookingAction.CREATE;
        }
        return null;
    }

    private BookingRequest collectRequest(ModuleContext context, BookingConfig config) {
        BookingRequest pending = BookingRequest.fromMetadata(context.metadata(PENDING_BOOKING));
        BookingRequest parsed = BookingTextParser.parse(context.getUserText(), config.zone(), clock.instant());
        BookingRequest merged = parsed.over(pending);

        if (merged.name() == null && awaiting(context, "your name")) {
            String name = OrderTextParser.extractName(context.getUserText(), true);
            merged = new BookingRequest(merged.action(), merged.dateTime(), merged.partySize(), name,
                    merged.phone(), merged.notes(), merged.eventId());
        }
        if (merged.phone() == null && context.getContactKey() != null && !context.getContactKey().isBlank()) {
            merged = new BookingRequest(merged.action(), merged.dateTime(), merged.partySize(), merged.name(),
                    context.getContactKey(), merged.notes(), merged.eventId());
        }
        return merged;
    }

    private static boolean awaiting(ModuleContext context, String detail) {
        return context.metadata(AWAITING_DETAILS) instanceof List<?> list && list.contains(detail);
    }

    // ==================== check ====================

    private ModuleResult handleAvailabilityCheck(ModuleContext context, BookingConfig config,
            BookingRequest request) {
        if (request.dateTime() == null) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(BOOKING_ACTION, BookingAction.CHECK.getValue());
            updates.put(PENDING_BOOKING, request.withAction(BookingAction.CHECK).toMetadata());
            return ModuleResult.reply(NEED_DATE_TIME, updates);
        }

        Instant start = request.dateTime();
        Instant end = config.endOf(start);
        Map<String, Object> input = Map.of("startTime", start.toString(), "endTime", end.toString());
        CalendarPort.Availability availability;
        try {
            availability = executor.call("calendar.availability",
                    () -> calendarPort.checkAvailability(context.getTenantId(), start, end));
        } catch (ExternalCallException e) {
            logRequest(context, BookingAction.CHECK, input, errorOf(e), "error", null, null,
                    request.phone());
            return ModuleResult.handoff(BOOKING_FAILED, e.getMessage());
        }
        logRequest(context, BookingAction.CHECK, input, Map.of("available", availability.available()), "success",
                null, null, request.phone());

        String dateText = formatDateTime(start, config.zone());
        Map<String, Object> updates = ModuleResult.updates();
        updates.put(CHECKED_DATE_TIME, start.toString());
        updates.put(AVAILABILITY_CONFIRMED, availability.available());
        if (availability.available()) {
            updates.put(BOOKING_ACTION, BookingAction.CREATE.getValue());
            updates.put(PENDING_BOOKING, request.withAction(BookingAction.CREATE).toMetadata());
            return ModuleResult.reply("Great news! We have availability on " + dateText
                    + ". Would you like me to book this for you?", updates);
        }
        updates.put(SUGGESTED_ALTERNATIVE, availability.nextAvailable() != null
                ? availability.nextAvailable().toString()
                : null);
        return ModuleResult.reply(notAvailable(dateText, availability, config.zone()), updates);
    }

    // ==================== create ====================

    private ModuleResult handleCreate(ModuleContext context, BookingConfig config, BookingRequest request) {
        List<String> missing = new ArrayList<>();
        if (request.dateTime() == null) {
            missing.add("the date and time");
        }
        if (config.requireName() && request.name() == null) {
            missing.add("your name");
        }
        if (config.requirePhone() && request.phone() == null) {
            missing.add("a phone number");
        }
        if (request.partySize() == null) {
            missing.add("the number of guests");
        }
        if (!missing.isEmpty()) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(BOOKING_ACTION, BookingAction.CREATE.getValue());
            updates.put(PENDING_BOOKING, request.withAction(BookingAction.CREATE).toMetadata());
            updates.put(AWAITING_DETAILS, List.copyOf(missing));
            return ModuleResult.reply("I'd be happy to book that for you. Could you please provide "
                    + String.join(" and ", missing) + "?", updates);
        }

        Instant now = clock.instant();
        BookingConfig.Validation validation = config.validate(request, now);
        if (!validation.valid()) {
            if (validation.partyTooLarge()) {
                return ModuleResult.handoff("We can accommodate groups up to " + config.maxPartySize()
                        + " people. For larger groups, please call us directly so we can make special arrangements.",
                        "Party size exceeds limit");
            }
            if (validation.noticeTooShort()) {
                return ModuleResult.reply("We require at least " + config.minNoticeHours()
                        + " hour(s) notice for bookings. Would you like to book for a later time?");
            }
            return ModuleResult.reply("I noticed a few issues: " + String.join(". ", validation.errors())
                    + ". Could you please check and try again?");
        }

        String idempotencyKey = idempotencyKey(context.getTenantId(), BookingAction.CREATE, request.dateTime(),
                request.partySize(), request.phone(), context.getSessionId());
        String dateText = formatDateTime(request.dateTime(), config.zone());
        String summary = request.name() + ", " + request.partySize() + " guests on " + dateText;

        Optional<BookingLogEntry> existing = bookingLogPort.findSuccessfulByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            log.info("[Booking] Duplicate booking request {} returns event {}", idempotencyKey,
                    existing.get().getEventId());
            Map<String, Object> updates = completedCreateUpdates(existing.get().getEventId());
            return ModuleResult.reply(confirmedText(summary) + ALREADY_CONFIRMED, updates);
        }

        boolean checked = context.metadataFlag(AVAILABILITY_CONFIRMED)
                && request.dateTime().toString().equals(context.metadataString(CHECKED_DATE_TIME));
        if (!checked) {
            CalendarPort.Availability availability = executor.call("calendar.availability",
                    () -> calendarPort.checkAvailability(context.getTenantId(), request.dateTime(),
                            config.endOf(request.dateTime())));
            if (!availability.available()) {
                return ModuleResult.reply(notAvailable(dateText, availability, config.zone()));
            }
        }

        CalendarPort.EventRequest event = new CalendarPort.EventRequest(
                eventSummary(request),
                eventDescription(request, context, now),
                request.dateTime(),
                config.endOf(request.dateTime()),
                config.timezone());
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("name", request.name());
        input.put("partySize", request.partySize());
        input.put("dateTime", request.dateTime().toString());
        input.put("channel", context.getChannel() != null ? context.getChannel().getValue() : null);

        String eventId;
        try {
            eventId = executor.call("calendar.create",
                    () -> calendarPort.createEvent(context.getTenantId(), event));
        } catch (ExternalCallException e) {
            logRequest(context, BookingAction.CREATE, input, errorOf(e), "error",
                    idempotencyKey, null, request.phone());
            return ModuleResult.handoff(BOOKING_FAILED, e.getMessage());
        }
        logRequest(context, BookingAction.CREATE, input, Map.of("eventId", eventId), "success", idempotencyKey,
                eventId, request.phone());
        log.info("[Booking] Created event {} for tenant {}", eventId, context.getTenantId());

        if (config.sendSmsConfirmation() && request.phone() != null) {
            sendConfirmationSms(context, request, dateText);
        }
        return ModuleResult.reply(confirmedText(summary), completedCreateUpdates(eventId));
    }

    private static Map<String, Object> completedCreateUpdates(String eventId) {
        Map<String, Object> updates = ModuleResult.updates();
        updates.put(LAST_BOOKING_EVENT_ID, eventId);
        updates.put(LAST_BOOKING_CONFIRMED, true);
        updates.put(PENDING_BOOKING, null);
        updates.put(BOOKING_ACTION, null);
        updates.put(AWAITING_DETAILS, null);
        return updates;
    }

    private void sendConfirmationSms(ModuleContext context, BookingRequest request, String dateText) {
        FeatureGateResult gate = context.canUse(FeatureGate.SMS);
        if (!gate.isAllowed()) {
            log.info("[Booking] Confirmation SMS skipped: {}", gate.getReason());
            return;
        }
        String business = context.getTenant() != null ? context.getTenant().getName() : null;
        String message = confirmationSms(request, dateText, business);
        try {
            NotificationPort.DeliveryResult result = executor.call("notify.customer.sms",
                    () -> notificationPort.deliver(new NotificationPort.Notification(context.getTenantId(),
                            FeatureGate.SMS, request.phone(), message)));
            if (!result.delivered()) {
                log.warn("[Booking] Confirmation SMS failed: {}", result.error());
            }
        } catch (ExternalCallException e) {
            log.warn("[Booking] Confirmation SMS error: {}", e.getMessage());
        }
    }

    // ==================== modify / cancel ====================

    private ModuleResult handleModify(ModuleContext context, BookingConfig config, BookingRequest request) {
        if (!config.allowModify()) {
            logRequest(context, BookingAction.MODIFY, Map.of(), Map.of("blocked", "not_allowed"), "handoff", null,
                    null, request.phone());
            return ModuleResult.handoff(MODIFY_NOT_ALLOWED, "Modifications not allowed by config");
        }

        String eventId = resolveEventId(context, request);
        if (eventId == null) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(BOOKING_ACTION, BookingAction.MODIFY.getValue());
            return ModuleResult.reply(MODIFY_NEED_ID, updates);
        }
        BookingRequest changes = BookingTextParser.parse(context.getUserText(), config.zone(), clock.instant());
        if (changes.dateTime() == null && changes.partySize() == null) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(BOOKING_ACTION, BookingAction.MODIFY.getValue());
            updates.put(LAST_BOOKING_EVENT_ID, eventId);
            return ModuleResult.reply(MODIFY_WHAT, updates);
        }

        CalendarPort.EventRequest event = new CalendarPort.EventRequest(
                changes.partySize() != null ? "Booking: (" + changes.partySize() + " guests)" : null,
                null,
                changes.dateTime(),
                changes.dateTime() != null ? config.endOf(changes.dateTime()) : null,
                config.timezone());
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("eventId", eventId);
        input.put("newDateTime", changes.dateTime() != null ? changes.dateTime().toString() : null);
        input.put("newPartySize", changes.partySize());
        try {
            executor.call("calendar.update", () -> calendarPort.updateEvent(context.getTenantId(), eventId, event));
        } catch (ExternalCallException e) {
            logRequest(context, BookingAction.MODIFY, input, errorOf(e), "error", null,
                    eventId, request.phone());
            return ModuleResult.handoff(BOOKING_FAILED, e.getMessage());
        }
        logRequest(context, BookingAction.MODIFY, input, Map.of("updated", true), "success", null, eventId,
                request.phone());

        List<String> described = new ArrayList<>();
        if (changes.dateTime() != null) {
            described.add("new time: " + formatDateTime(changes.dateTime(), config.zone()));
        }
        if (changes.partySize() != null) {
            described.add(changes.partySize() + " guests");
        }
        Map<String, Object> updates = ModuleResult.updates();
        updates.put(LAST_BOOKING_EVENT_ID, eventId);
        updates.put(BOOKING_ACTION, null);
        return ModuleResult.reply("Your booking has been updated: " + String.join(", ", described) + ".", updates);
    }

    private ModuleResult handleCancel(ModuleContext context, BookingConfig config, BookingRequest request) {
        if (!config.allowCancel()) {
            logRequest(context, BookingAction.CANCEL, Map.of(), Map.of("blocked", "not_allowed"), "handoff", null,
                    null, request.phone());
            return ModuleResult.handoff(CANCEL_NOT_ALLOWED, "Cancellations not allowed by config");
        }

        String eventId = resolveEventId(context, request);
        if (eventId == null) {
            Map<String, Object> updates = ModuleResult.updates();
            updates.put(BOOKING_ACTION, BookingAction.CANCEL.getValue());
            return ModuleResult.reply(CANCEL_NEED_ID, updates);
        }

        try {
            executor.call("calendar.delete", () -> calendarPort.deleteEvent(context.getTenantId(), eventId));
        } catch (ExternalCallException e) {
            logRequest(context, BookingAction.CANCEL, Map.of("eventId", eventId), errorOf(e),
                    "error", null, eventId, request.phone());
            return ModuleResult.handoff(BOOKING_FAILED, e.getMessage());
        }
        logRequest(context, BookingAction.CANCEL, Map.of("eventId", eventId), Map.of("deleted", true), "success",
                null, eventId, request.phone());

        Map<String, Object> updates = ModuleResult.updates();
        updates.put(LAST_BOOKING_EVENT_ID, null);
        updates.put(BOOKING_CANCELLED, true);
        updates.put(BOOKING_ACTION, null);
        updates.put(PENDING_BOOKING, null);
        return ModuleResult.reply(CANCEL_SUCCESS, updates);
    }

    /**
     * Event id from the request, then the session, then the booking log.
     */
    private String resolveEventId(ModuleContext context, BookingRequest request) {
        if (request.eventId() != null) {
            return request.eventId();
        }
        String fromSession = context.metadataString(LAST_BOOKING_EVENT_ID);
        if (fromSession != null) {
            return fromSession;
        }
        Optional<BookingLogEntry> found = bookingLogPort.findLatestCreate(context.getTenantId(),
                context.getSessionId(), request.phone());
        found.ifPresent(entry -> log.info("[Booking] Found event {} via booking log entry {}", entry.getEventId(),
                entry.getId()));
        return found.map(BookingLogEntry::getEventId).orElse(null);
    }

    // ==================== helpers ====================

    /**
     * SHA-256 over tenant, action, start truncated to the minute, party size and
     * the phone digits or, without a phone, the session id.
     */
    public static String idempotencyKey(String tenantId, BookingAction action, Instant start, Integer partySize,
            String phone, String sessionId) {
        String digits = phone != null ? phone.replaceAll("\\D", "") : "";
        String contact = !digits.isEmpty() ? digits : sessionId != null ? sessionId : "no-contact";
        return IdempotencyKeys.of(32,
                tenantId,
                action.getValue(),
                start != null ? start.truncatedTo(ChronoUnit.MINUTES).toString() : "no-time",
                partySize != null ? partySize.toString() : "no-size",
                contact);
    }

    static String formatDateTime(Instant instant, ZoneId zone) {
        return DATE_TIME_FORMAT.format(instant.atZone(zone));
    }

    static String eventSummary(BookingRequest request) {
        List<String> parts = new ArrayList<>();
        if (request.name() != null) {
            parts.add(request.name());
        }
        if (request.partySize() != null) {
            parts.add("(" + request.partySize() + " guests)");
        }
        return parts.isEmpty() ? "Booking" : "Booking: " + String.join(" ", parts);
    }

    static String eventDescription(BookingRequest request, ModuleContext context, Instant bookedAt) {
        List<String> lines = new ArrayList<>();
        if (request.name() != null) {
            lines.add("Name: " + request.name());
        }
        if (request.phone() != null) {
            lines.add("Phone: " + request.phone());
        }
        if (request.partySize() != null) {
            lines.add("Party Size: " + request.partySize());
        }
        if (request.notes() != null) {
            lines.add("Notes: " + request.notes());
        }
        lines.add("");
        if (context.getChannel() != null) {
            lines.add("Booked via: " + context.getChannel().getValue().toUpperCase(Locale.ROOT));
        }
        lines.add("Session: " + context.getSessionId());
        lines.add("Booked at: " + bookedAt);
        return String.join("\n", lines);
    }

    static String confirmationSms(BookingRequest request, String dateText, String businessName) {
        int guests = request.partySize() != null ? request.partySize() : 1;
        StringBuilder sb = new StringBuilder();
        sb.append("Hi ").append(request.name() != null ? request.name() : "Guest")
                .append(", your booking is confirmed!\n\n")
                .append(dateText).append('\n')
                .append(guests).append(guests == 1 ? " guest" : " guests");
        if (businessName != null && !businessName.isBlank()) {
            sb.append("\n\nSee you at ").append(businessName).append('!');
        } else {
            sb.append("\n\nWe look forward to seeing you!");
        }
        return sb.toString();
    }

    private static Map<String, Object> errorOf(RuntimeException e) {
        return Map.of("error", String.valueOf(e.getMessage()));
    }

    private static String confirmedText(String summary) {
        return "Perfect! Your booking is confirmed: " + summary + ". We look forward to seeing you!";
    }

    private static String notAvailable(String dateText, CalendarPort.Availability availability, ZoneId zone) {
        if (availability.nextAvailable() != null) {
            return "Unfortunately, " + dateText + " is not available. However, we have an opening at "
                    + formatDateTime(availability.nextAvailable(), zone) + ". Would that work for you?";
        }
        return "Unfortunately, " + dateText + " is not available. Would you like to try a different time?";
    }

    private void logRequest(ModuleContext context, BookingAction action, Map<String, Object> input,
            Map<String, Object> result, String status, String idempotencyKey, String eventId, String phone) {
        try {
            bookingLogPort.append(BookingLogEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .tenantId(context.getTenantId())
                    .sessionId(context.getSessionId())
                    .action(action.getValue())
                    .idempotencyKey(idempotencyKey)
                    .eventId(eventId)
                    .phone(phone)
                    .status(status)
                    .input(input)
                    .result(result)
                    .createdAt(clock.instant())
                    .build());
        } catch (RuntimeException e) { // NOSONAR - the log must not fail the booking
            log.error("[Booking] Failed to log {} request: {}", action.getValue(), e.getMessage());
        }
    }
}
