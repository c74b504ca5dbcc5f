package me.golemcore.concierge.module;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ModuleRunnerTest {

    private ModuleHandler faq;
    private ModuleHandler handoff;
    private ModuleContext context;

    @BeforeEach
    void setUp() {
        faq = handler("faq", List.of());
        handoff = handler("handoff", List.of("human"));
        context = ModuleContext.builder()
                .tenantId("tenant-1")
                .sessionId("session-1")
                .userText("what are your hours?")
                .build();
    }

    private static ModuleHandler handler(String name, List<String> aliases) {
        ModuleHandler handler = mock(ModuleHandler.class);
        when(handler.getName()).thenReturn(name);
        when(handler.getAliases()).thenReturn(aliases);
        return handler;
    }

    // ==================== Registry ====================

    @Test
    void shouldRegisterNamesAndAliases() {
        ModuleRegistry registry = new ModuleRegistry(List.of(faq, handoff));

        assertEquals(List.of("faq", "handoff", "human"), List.copyOf(registry.getRegisteredNames()));
        assertSame(handoff, registry.find("human").orElseThrow());
        assertTrue(registry.contains("faq"));
        assertFalse(registry.contains(null));
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void shouldIgnoreBlankRegistrations() {
        ModuleRegistry registry = new ModuleRegistry(null);

        registry.register(" ", faq);
        registry.register("faq", null);

        assertTrue(registry.getRegisteredNames().isEmpty());
    }

    @Test
    void shouldLetLaterRegistrationReplaceEarlier() {
        ModuleHandler replacement = handler("faq", List.of());
        ModuleRegistry registry = new ModuleRegistry(List.of(faq, replacement));

        assertSame(replacement, registry.find("faq").orElseThrow());
    }

    // ==================== Runner ====================

    @Test
    void shouldReturnFirstModuleWithReply() {
        when(faq.handle(any())).thenReturn(ModuleResult.reply("We open at 9."));
        ModuleRunner runner = new ModuleRunner(new ModuleRegistry(List.of(faq, handoff)));

        ModuleResult result = runner.run(List.of("faq", "handoff"), context);

        assertEquals("We open at 9.", result.getReplyText());
        verify(handoff, never()).handle(any());
    }

    @Test
    void shouldSkipUnknownEmptyAndFailingModules() {
        ModuleHandler broken = handler("broken", List.of());
        when(broken.handle(any())).thenThrow(new IllegalStateException("boom"));
        when(faq.handle(any())).thenReturn(ModuleResult.empty());
        when(handoff.handle(any())).thenReturn(ModuleResult.handoff("Connecting you now.", "requested"));
        ModuleRunner runner = new ModuleRunner(new ModuleRegistry(List.of(broken, faq, handoff)));

        ModuleResult result = runner.run(List.of("missing", "broken", "faq", "human"), context);

        assertEquals("Connecting you now.", result.getReplyText());
        assertTrue(result.isHandoffTriggered());
        verify(broken).handle(context);
        verify(faq).handle(context);
    }

    @Test
    void shouldFallBackToHandoffWhenNothingReplies() {
        when(faq.handle(any())).thenReturn(ModuleResult.reply("   "));
        ModuleRunner runner = new ModuleRunner(new ModuleRegistry(List.of(faq)));

        ModuleResult result = runner.run(List.of("faq"), context);

        assertEquals(ModuleRunner.NO_MODULE_REPLY, result.getReplyText());
        assertEquals(ModuleRunner.NO_MODULE_REASON, result.getHandoffReason());
        assertTrue(result.isHandoffTriggered());
    }

    @Test
    void shouldFallBackForEmptyCandidateList() {
        ModuleRunner runner = new ModuleRunner(new ModuleRegistry(List.of()));

        assertEquals(ModuleRunner.NO_MODULE_REPLY, runner.run(List.of(), context).getReplyText());
        assertEquals(ModuleRunner.NO_MODULE_REPLY, runner.run(null, context).getReplyText());
    }
}
