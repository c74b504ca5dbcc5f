package me.golemcore.concierge.domain.exception;

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

import java.util.Locale;

/**
 * Thrown before a billable call when the tenant's monthly AI budget would be
 * exceeded.
 */
public class BudgetExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String tenantId;
    private final double used;
    private final double budget;

    public BudgetExceededException(String tenantId, double used, double budget) {
        super(String.format(Locale.ROOT, "AI budget exceeded for tenant %s: %.4f of %.2f used",
                tenantId, used, budget));
        this.tenantId = tenantId;
        this.used = used;
        this.budget = budget;
    }

    public String getTenantId() {
        return tenantId;
    }

    public double getUsed() {
        return used;
    }

    public double getBudget() {
        return budget;
    }
}
