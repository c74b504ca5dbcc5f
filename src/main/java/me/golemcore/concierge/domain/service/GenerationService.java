package me.golemcore.concierge.domain.service;

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
import me.golemcore.concierge.domain.exception.ExternalCallException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.LlmResponse;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.infrastructure.config.ConciergeProperties;
import me.golemcore.concierge.infrastructure.resilience.ExternalCallExecutor;
import me.golemcore.concierge.port.outbound.BudgetPort;
import me.golemcore.concierge.port.outbound.LlmPort;
import me.golemcore.concierge.usage.CostEstimator;
import org.springframework.stereotype.Service;

/**
 * Budget-aware gateway to the LLM port.
 *
 * <p>
 * Every call is preceded by a budget check and followed by a cost record:
 * <ol>
 * <li>{@link BudgetPort#requireBudget} with the caller's estimate</li>
 * <li>the chat call under {@link ExternalCallExecutor} (timeout and retry)</li>
 * <li>{@link BudgetPort#recordCost} with the cost of the actual usage</li>
 * </ol>
 * The check and the record are not atomic, so concurrent calls for the same
 * tenant can overspend by at most one call.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationService {

    private final LlmPort llmPort;
    private final ExternalCallExecutor executor;
    private final BudgetPort budgetPort;
    private final CostEstimator costEstimator;
    private final ConciergeProperties properties;

    public boolean isConfigured() {
        return llmPort.isAvailable();
    }

    /**
     * Model for free-text generation, honouring the tenant override.
     */
    public String resolveModel(TenantSettings tenant) {
        if (tenant != null && tenant.getAiModelOverride() != null && !tenant.getAiModelOverride().isBlank()) {
            return tenant.getAiModelOverride();
        }
        return properties.getLlm().getModel();
    }

    /**
     * Cheaper model used for classification.
     */
    public String classificationModel() {
        return properties.getLlm().getLowCostModel();
    }

    /**
     * Runs one billable chat call for the tenant.
     *
     * @throws BudgetExceededException
     *             when the estimate does not fit the tenant's remaining budget
     * @throws GenerationFailureException
     *             when the provider is unavailable or every attempt failed
     */
    public Generation chat(String tenantId, String operation, LlmRequest request, double estimatedCost) {
        if (!llmPort.isAvailable()) {
            throw new GenerationFailureException(operation, "LLM provider is not configured", null);
        }

        budgetPort.requireBudget(tenantId, estimatedCost);

        request.setTenantId(tenantId);
        LlmResponse response;
        try {
            response = executor.call(operation, () -> llmPort.chat(request));
        } catch (GenerationFailureException e) {
            throw e;
        } catch (ExternalCallException e) {
            throw new GenerationFailureException(operation, e.getMessage(), e.getCause());
        }

        String model = response.getModel() != null ? response.getModel() : request.getModel();
        double cost = costEstimator.estimate(model, response.inputTokens(), response.outputTokens());
        budgetPort.recordCost(tenantId, cost, response.inputTokens(), response.outputTokens());
        log.debug("[Budget] {} for tenant {} cost ${} ({} in / {} out)", operation, tenantId,
                String.format("%.6f", cost), response.inputTokens(), response.outputTokens());

        return new Generation(response, model, cost);
    }

    /**
     * A completed chat call together with what it cost.
     */
    public record Generation(LlmResponse response, String model, double costUsd) {

        public String text() {
            return response.getContent() != null ? response.getContent() : "";
        }

        public int inputTokens() {
            return response.inputTokens();
        }

        public int outputTokens() {
            return response.outputTokens();
        }
    }
}
