package me.golemcore.concierge.adapter.outbound.memory;

import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.model.AuditEvent;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.AuditService;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.port.outbound.BudgetPort;
import me.golemcore.concierge.port.outbound.TenantSettingsPort;
import me.golemcore.concierge.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class InMemoryBudgetLedgerTest {

    private static final String TENANT_ID = "tenant-1";

    private MutableClock clock;
    private TenantSettingsPort tenantSettingsPort;
    private InMemoryAuditLog auditLog;
    private InMemoryBudgetLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-30T12:00:00Z");
        tenantSettingsPort = mock(TenantSettingsPort.class);
        when(tenantSettingsPort.findByTenantId(anyString())).thenReturn(Optional.empty());
        auditLog = new InMemoryAuditLog();
        ledger = new InMemoryBudgetLedger(tenantSettingsPort, new AuditService(auditLog, clock),
                new ConciergeProperties(), clock);
    }

    private void tenantBudget(double budget, boolean hardLimit) {
        TenantSettings tenant = TenantSettings.builder()
                .tenantId(TENANT_ID)
                .monthlyAiBudget(budget)
                .hardBudgetLimit(hardLimit)
                .build();
        when(tenantSettingsPort.findByTenantId(TENANT_ID)).thenReturn(Optional.of(tenant));
    }

    @Test
    void shouldAllowWithinDefaultBudget() {
        BudgetPort.BudgetStatus status = ledger.checkBudget(TENANT_ID, 0.01);

        assertTrue(status.allowed());
        assertEquals(50.0, status.budget());
        assertEquals(50.0, status.remaining());
    }

    @Test
    void shouldRejectAndAuditWhenEstimateExceedsHardLimit() {
        // Arrange
        tenantBudget(1.0, true);
        ledger.recordCost(TENANT_ID, 0.995, 1000, 200);

        // Act
        assertThrows(BudgetExceededException.class, () -> ledger.requireBudget(TENANT_ID, 0.01));

        // Assert
        List<AuditEvent> events = auditLog.findByAction(InMemoryBudgetLedger.AUDIT_LIMIT_EXCEEDED);
        assertEquals(1, events.size());
        assertEquals("ai", events.get(0).getDetails().get("type"));
        assertEquals(0.01, events.get(0).getDetails().get("estimatedCost"));
    }

    @Test
    void shouldAllowOverspendWithoutHardLimit() {
        tenantBudget(1.0, false);
        ledger.recordCost(TENANT_ID, 2.0, 1000, 200);

        assertDoesNotThrow(() -> ledger.requireBudget(TENANT_ID, 0.01));
        assertEquals(0.0, ledger.checkBudget(TENANT_ID, 0.01).remaining());
    }

    @Test
    void shouldAccumulatePerMonth() {
        ledger.recordCost(TENANT_ID, 0.5, 100, 10);
        ledger.recordCost(TENANT_ID, 0.25, 50, 5);

        InMemoryBudgetLedger.MonthlyCost march = ledger.currentMonth(TENANT_ID);
        assertEquals(0.75, march.costUsd());
        assertEquals(150, march.tokensIn());
        assertEquals(15, march.tokensOut());

        clock.advance(Duration.ofDays(3));
        assertEquals(0.0, ledger.currentMonth(TENANT_ID).costUsd());
        assertEquals(0.0, ledger.checkBudget(TENANT_ID, 0).used());
    }
}
