package me.golemcore.concierge.adapter.outbound.notification;

import me.golemcore.concierge.port.outbound.NotificationPort;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoggingNotificationAdapterTest {

    private final LoggingNotificationAdapter adapter = new LoggingNotificationAdapter();

    @Test
    void shouldReportDeliveryWithMessageId() {
        NotificationPort.DeliveryResult result = adapter.deliver(
                new NotificationPort.Notification("luigis", "sms", "+61298765432", "New order #AB12CD34")).join();

        assertTrue(result.delivered());
        assertTrue(result.providerMessageId().startsWith("log-"));
    }

    @Test
    void shouldFailWithoutRecipient() {
        NotificationPort.DeliveryResult result = adapter.deliver(
                new NotificationPort.Notification("luigis", "sms", " ", "New order")).join();

        assertFalse(result.delivered());
        assertEquals("No recipient", result.error());
    }
}
