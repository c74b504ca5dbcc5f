package me.golemcore.concierge.adapter.outbound.memory;

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
import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.AuditService;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.port.outbound.BudgetPort;
import me.golemcore.concierge.port.outbound.TenantSettingsPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Monthly AI spend ledger kept in process memory, keyed by tenant and
 * {@code YYYY-MM}.
 *
 * <p>
 * The budget and the hard-limit flag come from the tenant settings, falling
 * back to {@code concierge.budget.*}. With the hard limit off an over-budget
 * call is still allowed. The check and the later record are separate steps,
 * so concurrent calls of one tenant may overspend by one call's cost.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryBudgetLedger implements BudgetPort {

    static final String AUDIT_LIMIT_EXCEEDED = "cost.limit_exceeded";

    private final TenantSettingsPort tenantSettingsPort;
    private final AuditService auditService;
    private final ConciergeProperties properties;
    private final Clock clock;

    private final Map<String, MonthlyCost> ledger = new ConcurrentHashMap<>();

    @Override
    public BudgetStatus checkBudget(String tenantId, double estimatedCost) {
        TenantSettings tenant = tenantSettingsPort.findByTenantId(tenantId).orElse(null);
        double budget = tenant != null && tenant.getMonthlyAiBudget() != null ? tenant.getMonthlyAiBudget()
                : properties.getBudget().getDefaultMonthlyBudget();
        boolean hardLimit = tenant != null && tenant.getHardBudgetLimit() != null ? tenant.getHardBudgetLimit()
                : properties.getBudget().isDefaultHardLimit();

        double used = currentMonth(tenantId).costUsd();
        boolean wouldExceed = used + estimatedCost > budget;
        return new BudgetStatus(!hardLimit || !wouldExceed, used, budget, Math.max(0, budget - used));
    }

    @Override
    public void requireBudget(String tenantId, double estimatedCost) {
        BudgetStatus status = checkBudget(tenantId, estimatedCost);
        if (status.allowed()) {
            return;
        }
        log.warn("[Budget] Tenant {} over budget: {} of {} used", tenantId, status.used(), status.budget());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", "ai");
        details.put("used", status.used());
        details.put("budget", status.budget());
        details.put("estimatedCost", estimatedCost);
        auditService.record(tenantId, AUDIT_LIMIT_EXCEEDED, details);
        throw new BudgetExceededException(tenantId, status.used(), status.budget());
    }

    @Override
    public void recordCost(String tenantId, double actualCost, int tokensIn, int tokensOut) {
        ledger.merge(key(tenantId, YearMonth.now(clock)), new MonthlyCost(actualCost, tokensIn, tokensOut),
                MonthlyCost::plus);
    }

    public MonthlyCost currentMonth(String tenantId) {
        return ledger.getOrDefault(key(tenantId, YearMonth.now(clock)), MonthlyCost.ZERO);
    }

    private static String key(String tenantId, YearMonth month) {
        return tenantId + ":" + month;
    }

    /**
     * Spend and token totals of one tenant for one month.
     */
    public record MonthlyCost(double costUsd, long tokensIn, long tokensOut) {

        static final MonthlyCost ZERO = new MonthlyCost(0, 0, 0);

        MonthlyCost plus(MonthlyCost other) {
            return new MonthlyCost(costUsd + other.costUsd, tokensIn + other.tokensIn, tokensOut + other.tokensOut);
        }
    }
}
