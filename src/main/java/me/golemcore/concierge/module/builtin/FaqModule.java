package me.golemcore.concierge.module.builtin;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.Message;
import me.golemcore.concierge.domain.model.TenantSettings;
import me.golemcore.concierge.domain.service.GenerationService;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import me.golemcore.concierge.security.RuleSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers questions from the tenant's FAQ text and the industry default FAQ.
 *
 * <p>
 * Generation is budget-checked before the call and charged after it. Without
 * FAQ content and without an LLM the module hands off.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FaqModule implements ModuleHandler {

    static final String NO_MATCH_REPLY = "I don't have specific information about that, "
            + "but I'd be happy to connect you with someone who can help.";
    static final String BLOCKED_REPLY = "I'm sorry, I'm unable to help with that right now. "
            + "Let me connect you with a team member.";
    static final String ERROR_REPLY = "I apologize for the inconvenience. Let me connect you with a team member.";
    static final double ESTIMATED_COST = 0.02;

    private final GenerationService generationService;

    @Override
    public String getName() {
        return "faq";
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        FeatureGateResult gate = context.canUse("faq");
        if (!gate.isAllowed()) {
            return ModuleResult.blocked(BLOCKED_REPLY, gate.getReason(), gate.getBlockedBy());
        }

        String faq = combinedFaq(context.getTenant());
        if (!generationService.isConfigured()) {
            String reason = faq.isEmpty() ? "No FAQ content available" : "Cannot answer FAQ question";
            return ModuleResult.handoff(NO_MATCH_REPLY, reason);
        }

        List<Message> messages = new ArrayList<>();
        context.getHistory().forEach(turn -> messages.add(Message.fromTurn(turn)));
        messages.add(Message.user(context.getUserText()));

        LlmRequest request = LlmRequest.builder()
                .model(generationService.resolveModel(context.getTenant()))
                .systemPrompt(buildFaqPrompt(context.getSystemPrompt(), faq, context.getRules()))
                .messages(messages)
                .build();

        try {
            GenerationService.Generation generation = generationService.chat(context.getTenantId(), "llm.faq",
                    request, ESTIMATED_COST);
            if (generation.text().isBlank()) {
                return ModuleResult.handoff(NO_MATCH_REPLY, "Empty FAQ answer");
            }
            return ModuleResult.builder()
                    .replyText(generation.text())
                    .inputTokens(generation.inputTokens())
                    .outputTokens(generation.outputTokens())
                    .costUsd(generation.costUsd())
                    .model(generation.model())
                    .build();
        } catch (BudgetExceededException e) {
            log.warn("[Modules] FAQ blocked by budget for tenant {}", context.getTenantId());
            return ModuleResult.blocked(BLOCKED_REPLY, "Budget limit exceeded", "budget");
        } catch (GenerationFailureException e) {
            log.error("[Modules] FAQ generation failed: {}", e.getMessage());
            return ModuleResult.handoff(ERROR_REPLY, "LLM error");
        }
    }

    static String combinedFaq(TenantSettings tenant) {
        if (tenant == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        if (tenant.getFaqText() != null && !tenant.getFaqText().isBlank()) {
            parts.add(tenant.getFaqText());
        }
        JsonNode industryRules = tenant.getIndustryRules();
        if (industryRules != null && industryRules.path("defaultFaq").isTextual()) {
            String industryFaq = industryRules.get("defaultFaq").asText();
            if (!industryFaq.isBlank()) {
                parts.add(industryFaq);
            }
        }
        return String.join("\n\n", parts);
    }

    private String buildFaqPrompt(String systemPrompt, String faq, RuleSet rules) {
        StringBuilder sb = new StringBuilder(systemPrompt).append("\n\n");
        if (rules != null && rules.persona() != null) {
            sb.append("You are ").append(rules.persona()).append(".\n");
        }
        if (rules != null && rules.tone() != null) {
            sb.append("Respond in a ").append(rules.tone()).append(" tone.\n");
        }
        sb.append("""

                Use the following FAQ/knowledge base to answer the user's question. \
                If the information is not in the FAQ, acknowledge this and offer to connect them \
                with someone who can help.

                FAQ/KNOWLEDGE BASE:
                """);
        sb.append(faq.isEmpty() ? "No specific FAQ content available." : faq);
        sb.append("""


                IMPORTANT RULES:
                1. Never reveal that you are an automated system.
                2. Keep responses concise and helpful.
                3. If you cannot answer from the FAQ, offer to connect with a human.
                """);
        return sb.toString();
    }
}
