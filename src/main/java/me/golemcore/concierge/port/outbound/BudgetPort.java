package me.golemcore.concierge.port.outbound;

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

import me.golemcore.concierge.domain.exception.BudgetExceededException;

/**
 * Monthly AI spend ceiling per tenant. Checked before every billable call and
 * charged right after a successful one.
 */
public interface BudgetPort {

    BudgetStatus checkBudget(String tenantId, double estimatedCost);

    /**
     * @throws BudgetExceededException
     *             when the estimated cost does not fit the remaining budget
     */
    void requireBudget(String tenantId, double estimatedCost);

    void recordCost(String tenantId, double actualCost, int tokensIn, int tokensOut);

    record BudgetStatus(boolean allowed, double used, double budget, double remaining) {
    }
}
