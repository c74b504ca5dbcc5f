package me.golemcore.concierge.domain.service;

import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.Message;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.port.outbound.BudgetPort;
import me.golemcore.concierge.testsupport.StubLlmPort;
import me.golemcore.concierge.usage.CostEstimator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GenerationServiceTest {

    private static final String TENANT_ID = "tenant-1";

    private StubLlmPort llmPort;
    private BudgetPort budgetPort;
    private ConciergeProperties properties;
    private GenerationService generationService;

    @BeforeEach
    void setUp() {
        llmPort = new StubLlmPort();
        budgetPort = mock(BudgetPort.class);
        properties = new ConciergeProperties();
        properties.getResilience().setMaxRetries(1);
        properties.getResilience().setInitialBackoffMs(0);
        properties.getResilience().setTimeoutMs(1_000);
        generationService = new GenerationService(llmPort, new ExternalCallExecutor(properties), budgetPort,
                new CostEstimator(), properties);
    }

    private LlmRequest request() {
        return LlmRequest.builder()
                .model("gpt-4o-mini")
                .messages(List.of(Message.user("hello")))
                .build();
    }

    // ==================== chat ====================

    @Test
    void shouldCheckBudgetThenRecordActualCost() {
        // Arrange
        llmPort.reply("Hi there");

        // Act
        GenerationService.Generation generation = generationService.chat(TENANT_ID, "llm.test", request(), 0.01);

        // Assert
        assertEquals("Hi there", generation.text());
        assertEquals(100, generation.inputTokens());
        assertEquals(20, generation.outputTokens());
        assertTrue(generation.costUsd() > 0);
        assertEquals(TENANT_ID, llmPort.requests().get(0).getTenantId());
        InOrder order = inOrder(budgetPort);
        order.verify(budgetPort).requireBudget(TENANT_ID, 0.01);
        order.verify(budgetPort).recordCost(eq(TENANT_ID), eq(generation.costUsd()), eq(100), eq(20));
    }

    @Test
    void shouldNotCallProviderWhenBudgetExceeded() {
        doThrow(new BudgetExceededException(TENANT_ID, 50, 50)).when(budgetPort).requireBudget(TENANT_ID, 0.01);

        assertThrows(BudgetExceededException.class,
                () -> generationService.chat(TENANT_ID, "llm.test", request(), 0.01));
        assertTrue(llmPort.requests().isEmpty());
        verify(budgetPort, never()).recordCost(anyString(), anyDouble(), anyInt(), anyInt());
    }

    @Test
    void shouldWrapProviderFailureAfterRetries() {
        llmPort.failWith(new IllegalStateException("provider down"));

        GenerationFailureException error = assertThrows(GenerationFailureException.class,
                () -> generationService.chat(TENANT_ID, "llm.test", request(), 0.01));

        assertEquals("llm.test", error.getOperation());
        assertEquals(2, llmPort.requests().size());
        verify(budgetPort, never()).recordCost(anyString(), anyDouble(), anyInt(), anyInt());
    }

    @Test
    void shouldFailFastWhenProviderUnavailable() {
        llmPort.unavailable();

        assertFalse(generationService.isConfigured());
        assertThrows(GenerationFailureException.class,
                () -> generationService.chat(TENANT_ID, "llm.test", request(), 0.01));
        verifyNoInteractions(budgetPort);
    }

    // ==================== models ====================

    @Test
    void shouldPreferTenantModelOverride() {
        TenantSettings tenant = TenantSettings.builder().tenantId(TENANT_ID).aiModelOverride("gpt-4o").build();

        assertEquals("gpt-4o", generationService.resolveModel(tenant));
        assertEquals(properties.getLlm().getModel(), generationService.resolveModel(new TenantSettings()));
        assertEquals(properties.getLlm().getLowCostModel(), generationService.classificationModel());
    }
}
