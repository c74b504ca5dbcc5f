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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.exception.BudgetExceededException;
import me.golemcore.concierge.domain.exception.GenerationFailureException;
import me.golemcore.concierge.domain.model.LlmRequest;
import me.golemcore.concierge.domain.model.Message;
import me.golemcore.concierge.domain.service.GenerationService;
import me.golemcore.concierge.module.ModuleContext;
import me.golemcore.concierge.module.ModuleHandler;
import me.golemcore.concierge.module.ModuleResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Answers greetings, generated when an LLM is available and canned otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GreetingModule implements ModuleHandler {

    static final String GREETING_REPLY = "Hello! How can I help you today?";
    static final String BLOCKED_REPLY = "I'm sorry, I'm unable to help with that right now. "
            + "Let me connect you with a team member.";
    static final double ESTIMATED_COST = 0.01;

    private final GenerationService generationService;

    @Override
    public String getName() {
        return "greeting";
    }

    @Override
    public ModuleResult handle(ModuleContext context) {
        if (!generationService.isConfigured()) {
            return ModuleResult.reply(GREETING_REPLY);
        }

        LlmRequest request = LlmRequest.builder()
                .model(generationService.resolveModel(context.getTenant()))
                .systemPrompt(context.getSystemPrompt()
                        + "\n\nThe user is greeting you. Respond with a friendly, brief greeting and offer to help.")
                .messages(List.of(Message.user(context.getUserText())))
                .maxTokens(100)
                .build();

        try {
            GenerationService.Generation generation = generationService.chat(context.getTenantId(),
                    "llm.greeting", request, ESTIMATED_COST);
            String text = generation.text().isBlank() ? GREETING_REPLY : generation.text();
            return ModuleResult.builder()
                    .replyText(text)
                    .inputTokens(generation.inputTokens())
                    .outputTokens(generation.outputTokens())
                    .costUsd(generation.costUsd())
                    .model(generation.model())
                    .build();
        } catch (BudgetExceededException e) {
            return ModuleResult.blocked(BLOCKED_REPLY, "Budget limit exceeded", "budget");
        } catch (GenerationFailureException e) {
            log.warn("[Modules] Greeting generation failed, using canned greeting: {}", e.getMessage());
            return ModuleResult.reply(GREETING_REPLY);
        }
    }
}
