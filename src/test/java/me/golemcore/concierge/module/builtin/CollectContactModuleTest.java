package me.golemcore.concierge.module.builtin;

import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectContactModuleTest {

    private final CollectContactModule module = new CollectContactModule(
            Clock.fixed(Instant.parse("2026-03-02T07:00:00Z"), ZoneOffset.UTC));

    private static ModuleContext context(String text, Map<String, Object> metadata) {
        return ModuleContext.builder()
                .tenantId("tenant-1")
                .sessionId("session-1")
                .userText(text)
                .sessionMetadata(metadata)
                .build();
    }

    @Test
    void shouldAskForDetailsFirst() {
        ModuleResult result = module.handle(context("can someone call me back?", Map.of()));

        assertEquals(CollectContactModule.PROMPT_REPLY, result.getReplyText());
        assertEquals(true, result.getSessionMetadataUpdates().get("collectingContact"));
    }

    @Test
    void shouldStoreNameAndPhoneOnSecondTurn() {
        ModuleResult result = module.handle(context("It's Ana Lopez, 0412 345 678",
                Map.of("collectingContact", true)));

        assertEquals(CollectContactModule.CONFIRM_REPLY, result.getReplyText());
        Map<String, Object> updates = result.getSessionMetadataUpdates();
        assertEquals("Ana Lopez", updates.get("collectedName"));
        assertEquals("0412345678", updates.get("collectedPhone"));
        assertEquals(false, updates.get("collectingContact"));
        assertEquals("2026-03-02T07:00:00Z", updates.get("contactCollectedAt"));
    }

    @Test
    void shouldKeepEarlierPhoneWhenOnlyNameGiven() {
        ModuleResult result = module.handle(context("My name is Sam",
                Map.of("collectingContact", true, "collectedPhone", "+61400000000")));

        assertEquals("Sam", result.getSessionMetadataUpdates().get("collectedName"));
        assertEquals("+61400000000", result.getSessionMetadataUpdates().get("collectedPhone"));
    }

    @Test
    void shouldAskAgainWhenNothingRecognised() {
        ModuleResult result = module.handle(context("sure thing", Map.of("collectingContact", "true")));

        assertEquals(CollectContactModule.RETRY_REPLY, result.getReplyText());
        assertNull(result.getSessionMetadataUpdates());
    }

    @Test
    void shouldExtractInternationalNumber() {
        CollectContactModule.Contact contact = CollectContactModule.extractContact("+61 412 345 678 thanks");

        assertEquals("+61412345678", contact.phone());
        assertNull(contact.name());
    }
}
