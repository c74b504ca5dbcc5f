package me.golemcore.concierge.domain.service;

import me.golemcore.concierge.domain.model.Channel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelReplyAdapterTest {

    // ==================== Formatting ====================

    @Test
    void shouldStripMarkupForSms() {
        String text = "## Hours\n**We open** at *9am*. See `menu` at [our site](https://luigis.example) <b>now</b>";

        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt(text, Channel.SMS);

        assertEquals("Hours\nWe open at 9am. See menu at our site now", adapted.text());
        assertFalse(adapted.truncated());
    }

    @Test
    void shouldKeepWhatsAppBold() {
        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt("# Hours\nWe open at **9am**.",
                Channel.WHATSAPP);

        assertEquals("Hours\nWe open at *9am*.", adapted.text());
    }

    @Test
    void shouldExpandAbbreviationsForVoice() {
        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt(
                "Ask for **Dr. Rossi** at 12 Smith St. #2", Channel.VOICE);

        assertEquals("Ask for doctor Rossi at 12 Smith street 2", adapted.text());
    }

    @Test
    void shouldTreatNullTextAsEmpty() {
        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt(null, Channel.SMS);

        assertEquals("", adapted.text());
        assertEquals(0, adapted.originalLength());
    }

    @Test
    void shouldDefaultToSmsWithoutChannel() {
        assertEquals("bold", ChannelReplyAdapter.adapt("**bold**", null).text());
    }

    // ==================== Truncation ====================

    @Test
    void shouldCutAtSentenceEnd() {
        String text = "a".repeat(1200) + ". " + "b".repeat(1000);

        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt(text, Channel.SMS);

        assertTrue(adapted.truncated());
        assertEquals("a".repeat(1200) + "....", adapted.text());
        assertEquals(2202, adapted.originalLength());
    }

    @Test
    void shouldCutAtWordBoundary() {
        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt("word ".repeat(400), Channel.SMS);

        assertTrue(adapted.truncated());
        assertTrue(adapted.text().endsWith("word..."));
        assertTrue(adapted.text().length() <= ChannelReplyAdapter.SMS_MAX_LENGTH);
    }

    @Test
    void shouldHardCutUnbrokenText() {
        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt("x".repeat(2000), Channel.SMS);

        assertEquals(ChannelReplyAdapter.SMS_MAX_LENGTH, adapted.text().length());
        assertTrue(adapted.text().endsWith("x..."));
    }

    @Test
    void shouldCutVoiceWithoutSuffix() {
        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt("x".repeat(3500), Channel.VOICE);

        assertTrue(adapted.truncated());
        assertEquals("x".repeat(ChannelReplyAdapter.VOICE_MAX_LENGTH), adapted.text());
    }

    @Test
    void shouldAllowLongerWhatsAppReplies() {
        String text = "y".repeat(3000);

        ChannelReplyAdapter.Adapted adapted = ChannelReplyAdapter.adapt(text, Channel.WHATSAPP);

        assertFalse(adapted.truncated());
        assertEquals(text, adapted.text());
    }
}
